/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.path;

import com.powsybl.graphtheory.graph.Edge;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;

import java.util.*;

/**
 * Single source shortest paths with non negative edge weights, following arc directions in a directed graph. The
 * search stops as soon as every target has been settled.
 *
 * @author PowSyBl graph theory team
 */
public final class Dijkstra {

    private static final int NONE = -1;

    private Dijkstra() {
    }

    public static ShortestPath find(Graph graph, int source, int target) {
        return find(graph, source, List.of(target)).get(target);
    }

    /**
     * @return the shortest path to each target, keyed and ordered by target
     */
    public static Map<Integer, ShortestPath> find(Graph graph, int source, Collection<Integer> targets) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(targets);
        int n = graph.getVertexCount();
        Objects.checkIndex(source, n);
        Set<Integer> remaining = new HashSet<>();
        for (int t : targets) {
            remaining.add(Objects.checkIndex(t, n));
        }
        for (Edge e : graph.getEdges()) {
            double w = graph.getWeight(e.source(), e.target());
            if (w < 0) {
                throw new GraphException(GraphError.NEGATIVE_WEIGHT, e + " has weight " + w);
            }
        }

        double[] distance = new double[n];
        Arrays.fill(distance, Double.POSITIVE_INFINITY);
        int[] previous = new int[n];
        Arrays.fill(previous, NONE);
        boolean[] settled = new boolean[n];
        distance[source] = 0;
        PriorityQueue<double[]> frontier = new PriorityQueue<>(Comparator.comparingDouble((double[] e) -> e[0]));
        frontier.add(new double[] {0, source});
        while (!frontier.isEmpty() && !remaining.isEmpty()) {
            int v = (int) frontier.poll()[1];
            if (settled[v]) {
                continue;
            }
            settled[v] = true;
            remaining.remove(v);
            for (int w : graph.getNeighbors(v)) {
                double d = distance[v] + graph.getWeight(v, w);
                if (d < distance[w]) {
                    distance[w] = d;
                    previous[w] = v;
                    frontier.add(new double[] {d, w});
                }
            }
        }

        Map<Integer, ShortestPath> paths = new TreeMap<>();
        for (int t : targets) {
            if (!settled[t]) {
                paths.put(t, ShortestPath.unreachable(source, t));
            } else {
                List<Integer> vertices = new ArrayList<>();
                for (int v = t; v != NONE; v = previous[v]) {
                    vertices.add(v);
                }
                Collections.reverse(vertices);
                paths.put(t, new ShortestPath(source, t, distance[t], vertices));
            }
        }
        return paths;
    }
}

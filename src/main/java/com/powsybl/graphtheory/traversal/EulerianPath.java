/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.traversal;

import com.powsybl.graphtheory.graph.Edge;
import com.powsybl.graphtheory.graph.Graph;
import gnu.trove.list.array.TIntArrayList;

import java.util.*;

/**
 * Eulerian trails (Hierholzer): a trail using every edge exactly once.
 *
 * @author PowSyBl graph theory team
 */
public final class EulerianPath {

    private EulerianPath() {
    }

    /**
     * @return the vertices of an Eulerian trail, its first and last vertices being equal for an Eulerian circuit,
     * or empty if there is none. A graph without edges has no Eulerian trail.
     */
    public static List<Integer> find(Graph graph) {
        Objects.requireNonNull(graph);
        int n = graph.getVertexCount();
        if (graph.getEdgeCount() == 0) {
            return Collections.emptyList();
        }
        int start = findStart(graph);
        if (start < 0) {
            return Collections.emptyList();
        }
        // remaining edges per vertex, consumed in increasing neighbor order
        List<Deque<Integer>> remaining = new ArrayList<>(n);
        for (int v = 0; v < n; v++) {
            Deque<Integer> neighbors = new ArrayDeque<>();
            for (int w : graph.getNeighbors(v)) {
                neighbors.add(w);
            }
            remaining.add(neighbors);
        }
        Set<Edge> used = new HashSet<>();
        TIntArrayList stack = new TIntArrayList();
        List<Integer> trail = new ArrayList<>();
        stack.add(start);
        while (!stack.isEmpty()) {
            int v = stack.get(stack.size() - 1);
            Deque<Integer> neighbors = remaining.get(v);
            Integer next = null;
            while (!neighbors.isEmpty() && next == null) {
                int w = neighbors.poll();
                Edge e = graph.isDirected() ? new Edge(v, w) : Edge.undirected(v, w);
                if (used.add(e)) {
                    next = w;
                }
            }
            if (next != null) {
                stack.add(next);
            } else {
                trail.add(stack.removeAt(stack.size() - 1));
            }
        }
        Collections.reverse(trail);
        return trail.size() == graph.getEdgeCount() + 1 ? trail : Collections.emptyList();
    }

    public static boolean isEulerian(Graph graph) {
        return !find(graph).isEmpty();
    }

    /**
     * Start vertex satisfying the degree conditions, -1 if they do not hold.
     */
    private static int findStart(Graph graph) {
        int n = graph.getVertexCount();
        int start = -1;
        int firstWithEdges = -1;
        int unbalanced = 0;
        for (int v = 0; v < n; v++) {
            if (firstWithEdges < 0 && graph.getDegree(v) > 0) {
                firstWithEdges = v;
            }
            if (graph.isDirected()) {
                int delta = graph.getOutDegree(v) - graph.getInDegree(v);
                if (delta == 1 && start < 0) {
                    start = v;
                    unbalanced++;
                } else if (delta != 0) {
                    if (Math.abs(delta) > 1 || delta == 1) {
                        return -1;
                    }
                    unbalanced++;
                }
            } else if (graph.getDegree(v) % 2 != 0) {
                unbalanced++;
                if (start < 0) {
                    start = v;
                }
            }
        }
        if (unbalanced != 0 && unbalanced != 2) {
            return -1;
        }
        return start >= 0 ? start : firstWithEdges;
    }
}

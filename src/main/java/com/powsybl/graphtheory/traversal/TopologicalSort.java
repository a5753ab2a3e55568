/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.traversal;

import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;

import java.util.*;

/**
 * Topological ordering of a directed acyclic graph (Kahn), smallest available vertex first.
 *
 * @author PowSyBl graph theory team
 */
public final class TopologicalSort {

    private TopologicalSort() {
    }

    /**
     * @throws GraphException with {@link GraphError#NOT_ACYCLIC} if the graph has a directed cycle
     */
    public static List<Integer> sort(Graph graph) {
        Optional<List<Integer>> order = tryToSort(graph);
        return order.orElseThrow(() -> new GraphException(GraphError.NOT_ACYCLIC));
    }

    public static boolean isAcyclic(Graph graph) {
        return tryToSort(graph).isPresent();
    }

    private static Optional<List<Integer>> tryToSort(Graph graph) {
        Objects.requireNonNull(graph);
        if (!graph.isDirected()) {
            throw new GraphException(GraphError.DIRECTED_GRAPH_REQUIRED);
        }
        int[][] adjacency = graph.getAdjacencyLists();
        int n = adjacency.length;
        int[] inDegree = new int[n];
        for (int[] neighbors : adjacency) {
            for (int w : neighbors) {
                inDegree[w]++;
            }
        }
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int v = 0; v < n; v++) {
            if (inDegree[v] == 0) {
                ready.add(v);
            }
        }
        List<Integer> order = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int v = ready.poll();
            order.add(v);
            for (int w : adjacency[v]) {
                if (--inDegree[w] == 0) {
                    ready.add(w);
                }
            }
        }
        return order.size() == n ? Optional.of(order) : Optional.empty();
    }
}

/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.traversal;

import com.powsybl.graphtheory.graph.Graph;

import java.util.Objects;

/**
 * Depth first search visiting neighbors in increasing index order, in the order a recursive search would.
 * The search stack is explicit so that long paths do not exhaust the thread stack.
 *
 * @author PowSyBl graph theory team
 */
public final class DepthFirstSearch {

    private DepthFirstSearch() {
    }

    /**
     * Search from a root following arc directions.
     */
    public static Traversal run(Graph graph, int root) {
        Objects.requireNonNull(graph);
        return run(graph.getAdjacencyLists(), root);
    }

    /**
     * Search from a root ignoring arc directions.
     */
    public static Traversal runUndirected(Graph graph, int root) {
        Objects.requireNonNull(graph);
        return run(graph.getUndirectedAdjacencyLists(), root);
    }

    static Traversal run(int[][] adjacency, int root) {
        Objects.checkIndex(root, adjacency.length);
        Traversal traversal = new Traversal(adjacency.length);
        int[] stack = new int[adjacency.length];
        int[] next = new int[adjacency.length];
        int top = 0;
        stack[top++] = root;
        traversal.visit(root, Traversal.NO_PARENT);
        while (top > 0) {
            int v = stack[top - 1];
            if (next[v] < adjacency[v].length) {
                int w = adjacency[v][next[v]++];
                if (!traversal.isVisited(w)) {
                    traversal.visit(w, v);
                    stack[top++] = w;
                }
            } else {
                top--;
            }
        }
        return traversal;
    }
}

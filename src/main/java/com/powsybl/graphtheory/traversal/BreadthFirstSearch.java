/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.traversal;

import com.powsybl.graphtheory.graph.Graph;
import gnu.trove.list.array.TIntArrayList;

import java.util.Objects;

/**
 * Breadth first search visiting neighbors in increasing index order. The depth of a visited vertex is its distance
 * (in edges) to the root.
 *
 * @author PowSyBl graph theory team
 */
public final class BreadthFirstSearch {

    private BreadthFirstSearch() {
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
        TIntArrayList queue = new TIntArrayList(adjacency.length);
        traversal.visit(root, Traversal.NO_PARENT);
        queue.add(root);
        for (int head = 0; head < queue.size(); head++) {
            int v = queue.get(head);
            for (int w : adjacency[v]) {
                if (!traversal.isVisited(w)) {
                    traversal.visit(w, v);
                    queue.add(w);
                }
            }
        }
        return traversal;
    }
}

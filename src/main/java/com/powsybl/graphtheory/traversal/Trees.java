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

import java.util.Objects;

/**
 * Tree, forest, arborescence and tournament predicates.
 *
 * @author PowSyBl graph theory team
 */
public final class Trees {

    private Trees() {
    }

    private static void checkUndirected(Graph graph) {
        Objects.requireNonNull(graph);
        if (graph.isDirected()) {
            throw new GraphException(GraphError.UNDIRECTED_GRAPH_REQUIRED);
        }
    }

    /**
     * An undirected graph is a forest iff it has n - c edges, c being its number of connected components.
     */
    public static boolean isForest(Graph graph) {
        checkUndirected(graph);
        return graph.getEdgeCount() == graph.getVertexCount() - ConnectedComponents.getComponentCount(graph);
    }

    /**
     * A tree is a non empty connected forest.
     */
    public static boolean isTree(Graph graph) {
        checkUndirected(graph);
        return graph.getVertexCount() > 0 && graph.getEdgeCount() == graph.getVertexCount() - 1
                && ConnectedComponents.isConnected(graph);
    }

    /**
     * A directed graph is an arborescence if a root reaches every vertex through exactly one directed path, that is if
     * the root has no incoming arc, every other vertex has exactly one, and every vertex is reachable from the root.
     */
    public static boolean isArborescence(Graph graph) {
        Objects.requireNonNull(graph);
        if (!graph.isDirected()) {
            throw new GraphException(GraphError.DIRECTED_GRAPH_REQUIRED);
        }
        int n = graph.getVertexCount();
        if (n == 0) {
            return false;
        }
        int root = -1;
        for (int v = 0; v < n; v++) {
            int in = graph.getInDegree(v);
            if (in == 0) {
                if (root >= 0) {
                    return false;
                }
                root = v;
            } else if (in > 1) {
                return false;
            }
        }
        return root >= 0 && DepthFirstSearch.run(graph, root).getVisitedCount() == n;
    }

    /**
     * A tournament is a directed graph with exactly one arc between every pair of distinct vertices.
     */
    public static boolean isTournament(Graph graph) {
        Objects.requireNonNull(graph);
        if (!graph.isDirected()) {
            throw new GraphException(GraphError.DIRECTED_GRAPH_REQUIRED);
        }
        int n = graph.getVertexCount();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (graph.hasEdge(i, j) == graph.hasEdge(j, i)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Height of a tree rooted at the given vertex, the number of edges of its longest root to leaf path.
     */
    public static int getHeight(Graph graph, int root) {
        if (!isTree(graph)) {
            throw new GraphException(GraphError.NOT_A_TREE);
        }
        Traversal bfs = BreadthFirstSearch.run(graph, root);
        int[] order = bfs.getOrder();
        return bfs.getDepth(order[order.length - 1]);
    }
}

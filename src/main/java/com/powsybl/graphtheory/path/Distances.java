/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.path;

import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.traversal.BreadthFirstSearch;
import com.powsybl.graphtheory.traversal.Traversal;
import com.powsybl.math.matrix.DenseMatrix;

import java.util.List;
import java.util.Objects;

/**
 * Distances counted in edges, following arc directions in a directed graph, except for the diameter which is
 * weighted.
 *
 * @author PowSyBl graph theory team
 */
public final class Distances {

    private Distances() {
    }

    /**
     * Number of edges of a shortest path, {@link Double#POSITIVE_INFINITY} if v is not reachable from u.
     */
    public static double vertexDistance(Graph graph, int u, int v) {
        Objects.requireNonNull(graph);
        Objects.checkIndex(v, graph.getVertexCount());
        Traversal bfs = BreadthFirstSearch.run(graph, u);
        return bfs.isVisited(v) ? bfs.getDepth(v) : Double.POSITIVE_INFINITY;
    }

    /**
     * A path with the fewest edges from u to v, empty if v is not reachable from u.
     */
    public static List<Integer> shortestPath(Graph graph, int u, int v) {
        Objects.requireNonNull(graph);
        Objects.checkIndex(v, graph.getVertexCount());
        return BreadthFirstSearch.run(graph, u).getPathTo(v);
    }

    /**
     * Largest distance between two vertices, edge weights being taken into account, {@link Double#POSITIVE_INFINITY}
     * if some vertex is not reachable from another one.
     */
    public static double diameter(Graph graph) {
        Objects.requireNonNull(graph);
        int n = graph.getVertexCount();
        if (n == 0) {
            throw new GraphException(GraphError.GRAPH_IS_EMPTY);
        }
        DenseMatrix distances = FloydWarshall.compute(graph);
        double diameter = 0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                diameter = Math.max(diameter, distances.get(i, j));
            }
        }
        return diameter;
    }
}

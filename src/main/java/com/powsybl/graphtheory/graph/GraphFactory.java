/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.graph;

import org.apache.commons.lang3.tuple.Pair;

import java.util.List;
import java.util.Objects;

/**
 * Graph construction from vertex lists, edge lists, trails and matrices.
 *
 * @author PowSyBl graph theory team
 */
public final class GraphFactory {

    private GraphFactory() {
    }

    /**
     * Graph with {@code n} isolated vertices labeled "0" to "n-1".
     */
    public static Graph create(int n, boolean directed) {
        Graph graph = new Graph(directed);
        graph.addVertices(n);
        return graph;
    }

    public static Graph create(List<String> labels, boolean directed) {
        Graph graph = new Graph(directed);
        graph.addVertices(labels);
        return graph;
    }

    /**
     * Graph from an edge list, vertices being created in order of first appearance.
     */
    public static Graph fromEdges(List<Pair<String, String>> edges, boolean directed) {
        Objects.requireNonNull(edges);
        checkEdges(edges);
        Graph graph = new Graph(directed);
        for (Pair<String, String> e : edges) {
            graph.addEdge(e.getLeft(), e.getRight());
        }
        return graph;
    }

    /**
     * Weighted graph from an edge list, each edge paired with its weight.
     */
    public static Graph fromWeightedEdges(List<Pair<Pair<String, String>, Double>> edges, boolean directed) {
        Objects.requireNonNull(edges);
        for (Pair<Pair<String, String>, Double> e : edges) {
            if (e.getLeft() == null || e.getRight() == null) {
                throw new GraphException(GraphError.INVALID_EDGE, String.valueOf(e));
            }
        }
        checkEdges(edges.stream().map(Pair::getLeft).toList());
        Graph graph = new Graph(directed, true);
        for (Pair<Pair<String, String>, Double> e : edges) {
            graph.addEdge(e.getLeft().getLeft(), e.getLeft().getRight(), e.getRight());
        }
        return graph;
    }

    private static void checkEdges(List<Pair<String, String>> edges) {
        for (Pair<String, String> e : edges) {
            if (e == null || e.getLeft() == null || e.getRight() == null || e.getLeft().equals(e.getRight())) {
                throw new GraphException(GraphError.INVALID_EDGE, String.valueOf(e));
            }
        }
    }

    /**
     * Graph made of the consecutive edges of a trail. A trail ending on its first vertex closes a cycle.
     */
    public static Graph fromTrail(List<String> trail, boolean directed) {
        Graph graph = new Graph(directed);
        addTrail(graph, trail);
        return graph;
    }

    public static void addTrail(Graph graph, List<String> trail) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(trail);
        for (int k = 1; k < trail.size(); k++) {
            if (Objects.equals(trail.get(k - 1), trail.get(k))) {
                throw new GraphException(GraphError.INVALID_EDGE, "repeated vertex '" + trail.get(k) + "' in trail");
            }
        }
        if (trail.size() == 1) {
            graph.addVertex(trail.get(0));
        }
        for (int k = 1; k < trail.size(); k++) {
            graph.addEdge(trail.get(k - 1), trail.get(k));
        }
    }

    /**
     * Graph from an adjacency or weight matrix, whose directedness is deduced: a symmetric matrix gives an undirected
     * graph, an asymmetric one a directed graph. Zero entries mean no edge; any non-zero entry other than 1 makes the
     * graph weighted.
     */
    public static Graph fromMatrix(double[][] matrix) {
        checkSquare(matrix);
        return fromMatrix(matrix, !isSymmetric(matrix));
    }

    /**
     * Graph from an adjacency or weight matrix with an explicit directedness. The matrix of an undirected graph must be
     * symmetric.
     */
    public static Graph fromMatrix(double[][] matrix, boolean directed) {
        checkSquare(matrix);
        int n = matrix.length;
        if (!directed && !isSymmetric(matrix)) {
            throw new GraphException(GraphError.MATRIX_NOT_SYMMETRIC);
        }
        boolean weighted = false;
        for (int i = 0; i < n; i++) {
            if (matrix[i][i] != 0) {
                throw new GraphException(GraphError.INVALID_EDGE, "non zero diagonal entry at " + i);
            }
            for (int j = 0; j < n; j++) {
                if (matrix[i][j] != 0 && matrix[i][j] != 1) {
                    weighted = true;
                }
            }
        }
        Graph graph = new Graph(directed, weighted);
        graph.addVertices(n);
        for (int i = 0; i < n; i++) {
            for (int j = directed ? 0 : i + 1; j < n; j++) {
                if (matrix[i][j] != 0) {
                    if (weighted) {
                        graph.addEdge(i, j, matrix[i][j]);
                    } else {
                        graph.addEdge(i, j);
                    }
                }
            }
        }
        return graph;
    }

    private static void checkSquare(double[][] matrix) {
        Objects.requireNonNull(matrix);
        for (double[] row : matrix) {
            if (row == null || row.length != matrix.length) {
                throw new GraphException(GraphError.NOT_SQUARE_MATRIX);
            }
        }
    }

    static boolean isSymmetric(double[][] matrix) {
        for (int i = 0; i < matrix.length; i++) {
            for (int j = i + 1; j < matrix.length; j++) {
                if (matrix[i][j] != matrix[j][i]) {
                    return false;
                }
            }
        }
        return true;
    }
}

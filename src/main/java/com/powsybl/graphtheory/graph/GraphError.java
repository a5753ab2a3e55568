/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.graph;

import java.util.Objects;

/**
 * Named failure conditions reported by the graph engine.
 *
 * @author PowSyBl graph theory team
 */
public enum GraphError {
    NOT_SQUARE_MATRIX(Category.INPUT_SHAPE, "adjacency/weight matrix must be square"),
    MATRIX_NOT_SYMMETRIC(Category.INPUT_SHAPE, "weight/adjacency matrix must be symmetric for undirected graphs"),
    INVALID_EDGE(Category.INPUT_SHAPE, "does not specify an edge"),
    INVALID_ARGUMENT(Category.INPUT_SHAPE, "invalid argument"),
    MIXED_GRAPH_KINDS(Category.PRECONDITION, "mixing directed/undirected or weighted/unweighted graphs is not allowed"),
    WEIGHTED_GRAPH_REQUIRED(Category.PRECONDITION, "a weighted graph is required"),
    UNWEIGHTED_GRAPH_REQUIRED(Category.PRECONDITION, "an unweighted graph is required"),
    DIRECTED_GRAPH_REQUIRED(Category.PRECONDITION, "a directed graph is required"),
    UNDIRECTED_GRAPH_REQUIRED(Category.PRECONDITION, "an undirected graph is required"),
    CONNECTED_GRAPH_REQUIRED(Category.PRECONDITION, "a connected graph is required"),
    NEGATIVE_WEIGHT(Category.PRECONDITION, "edge weights must be non-negative"),
    NOT_A_TREE(Category.PRECONDITION, "graph is not a tree"),
    GRAPH_IS_EMPTY(Category.PRECONDITION, "graph is empty"),
    VERTEX_NOT_FOUND(Category.NOT_FOUND, "vertex not found"),
    EDGE_NOT_FOUND(Category.NOT_FOUND, "edge not found"),
    NAME_NOT_RECOGNIZED(Category.NOT_FOUND, "graph name not recognized"),
    NOT_PLANAR(Category.INFEASIBLE, "graph is not planar"),
    NOT_GRAPHIC_SEQUENCE(Category.INFEASIBLE, "the given list is not a valid graphic sequence"),
    NOT_ACYCLIC(Category.INFEASIBLE, "graph is not acyclic"),
    NOT_A_CYCLE(Category.INFEASIBLE, "does not specify a cycle in the given graph"),
    INVALID_NUMBER_OF_ROOTS(Category.INFEASIBLE, "exactly one root node must be specified per connected component"),
    INVALID_ROOT(Category.INFEASIBLE, "invalid root vertex"),
    DOT_READ_FAILURE(Category.INPUT_SHAPE, "failed to read graph in dot format");

    public enum Category {
        /**
         * Wrong argument arity or shape, detected before any graph state is touched.
         */
        INPUT_SHAPE,
        /**
         * The graph does not have the kind (directed, weighted, tree...) the operation needs.
         */
        PRECONDITION,
        /**
         * A vertex, edge or name reference that does not resolve.
         */
        NOT_FOUND,
        /**
         * The requested structure does not exist for this graph.
         */
        INFEASIBLE
    }

    private final Category category;

    private final String message;

    GraphError(Category category, String message) {
        this.category = Objects.requireNonNull(category);
        this.message = Objects.requireNonNull(message);
    }

    public Category getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }
}

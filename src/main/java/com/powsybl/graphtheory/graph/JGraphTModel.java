/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.graph;

import org.jgrapht.graph.DefaultWeightedEdge;
import org.jgrapht.graph.SimpleDirectedWeightedGraph;
import org.jgrapht.graph.SimpleWeightedGraph;

import java.util.Objects;

/**
 * Conversions between {@link Graph} and JGraphT graphs. JGraphT vertices are the vertex indices of the graph.
 *
 * @author PowSyBl graph theory team
 */
public final class JGraphTModel {

    private JGraphTModel() {
    }

    /**
     * Simple JGraphT view of a graph, edge weights being 1 for unweighted graphs.
     */
    public static org.jgrapht.Graph<Integer, DefaultWeightedEdge> toJGraphT(Graph graph) {
        Objects.requireNonNull(graph);
        org.jgrapht.Graph<Integer, DefaultWeightedEdge> jgraph = graph.isDirected()
                ? new SimpleDirectedWeightedGraph<>(DefaultWeightedEdge.class)
                : new SimpleWeightedGraph<>(DefaultWeightedEdge.class);
        for (int i = 0; i < graph.getVertexCount(); i++) {
            jgraph.addVertex(i);
        }
        for (Edge e : graph.getEdges()) {
            DefaultWeightedEdge je = jgraph.addEdge(e.source(), e.target());
            jgraph.setEdgeWeight(je, graph.getWeight(e.source(), e.target()));
        }
        return jgraph;
    }

    /**
     * Build a graph from a JGraphT graph, vertices being labeled by their string representation.
     */
    public static <V, E> Graph fromJGraphT(org.jgrapht.Graph<V, E> jgraph, boolean weighted) {
        Objects.requireNonNull(jgraph);
        Graph graph = new Graph(jgraph.getType().isDirected(), weighted);
        for (V v : jgraph.vertexSet()) {
            graph.addVertex(String.valueOf(v));
        }
        for (E e : jgraph.edgeSet()) {
            String source = String.valueOf(jgraph.getEdgeSource(e));
            String target = String.valueOf(jgraph.getEdgeTarget(e));
            if (source.equals(target)) {
                throw new GraphException(GraphError.INVALID_EDGE, "self loop on vertex '" + source + "'");
            }
            if (weighted) {
                graph.addEdge(source, target, jgraph.getEdgeWeight(e));
            } else {
                graph.addEdge(source, target);
            }
        }
        return graph;
    }
}

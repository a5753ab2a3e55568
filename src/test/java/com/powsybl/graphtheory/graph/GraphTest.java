/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.graph;

import com.powsybl.math.matrix.DenseMatrix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl graph theory team
 */
class GraphTest {

    private Graph graph;

    @BeforeEach
    void setUp() {
        graph = new Graph();
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");
        graph.addEdge("c", "d");
        graph.addEdge("d", "a");
        graph.addEdge("a", "c");
    }

    @Test
    void testVerticesAndEdges() {
        assertEquals(4, graph.getVertexCount());
        assertEquals(5, graph.getEdgeCount());
        assertEquals(List.of("a", "b", "c", "d"), graph.getVertexLabels());
        assertTrue(graph.hasEdge(0, 1));
        assertTrue(graph.hasEdge(1, 0));
        assertTrue(graph.hasEdge("c", "a"));
        assertFalse(graph.hasEdge("b", "d"));
        assertFalse(graph.hasEdge("b", "x"));
        assertArrayEquals(new int[] {1, 2, 3}, graph.getNeighbors(0));
        assertEquals(List.of(new Edge(0, 1), new Edge(0, 2), new Edge(0, 3), new Edge(1, 2), new Edge(2, 3)), graph.getEdges());
    }

    @Test
    void testAddExistingVertex() {
        assertEquals(2, graph.addVertex("c"));
        assertEquals(4, graph.getVertexCount());
    }

    @Test
    void testLabelLookup() {
        assertEquals(3, graph.getVertexIndex("d"));
        assertEquals(Graph.NOT_FOUND, graph.getVertexIndex("z"));
        GraphException e = assertThrows(GraphException.class, () -> graph.requireVertexIndex("z"));
        assertEquals(GraphError.VERTEX_NOT_FOUND, e.getError());
        assertEquals(GraphError.Category.NOT_FOUND, e.getCategory());
        assertEquals("vertex not found: z", e.getMessage());
    }

    @Test
    void testOutOfRangeIndex() {
        assertThrows(IndexOutOfBoundsException.class, () -> graph.getNeighbors(4));
        assertThrows(IndexOutOfBoundsException.class, () -> graph.addEdge(0, 7));
    }

    @Test
    void testSelfLoopRejected() {
        GraphException e = assertThrows(GraphException.class, () -> graph.addEdge("a", "a"));
        assertEquals(GraphError.INVALID_EDGE, e.getError());
    }

    @Test
    void testRemoveVertexRenumbers() {
        graph.markVertex(3);
        assertTrue(graph.removeVertex("b"));
        assertEquals(3, graph.getVertexCount());
        assertEquals(List.of("a", "c", "d"), graph.getVertexLabels());
        assertEquals(1, graph.getVertexIndex("c"));
        assertEquals(2, graph.getVertexIndex("d"));
        assertEquals(3, graph.getEdgeCount());
        assertTrue(graph.hasEdge(1, 2));
        assertTrue(graph.hasEdge(0, 2));
        assertEquals(List.of(2), graph.getMarkedVertices());
        assertFalse(graph.removeVertex("b"));
    }

    @Test
    void testRemoveEdge() {
        assertTrue(graph.removeEdge("c", "a"));
        assertFalse(graph.hasEdge(0, 2));
        assertFalse(graph.hasEdge(2, 0));
        assertFalse(graph.removeEdge(0, 2));
        assertEquals(4, graph.getEdgeCount());
    }

    @Test
    void testDegrees() {
        assertArrayEquals(new int[] {3, 2, 3, 2}, graph.getDegreeSequence());
        assertEquals(2, graph.getMinimumDegree());
        assertEquals(3, graph.getMaximumDegree());
        assertFalse(graph.isRegular(2));
        graph.removeEdge("a", "c");
        assertTrue(graph.isRegular(2));
        GraphException e = assertThrows(GraphException.class, () -> new Graph().getMaximumDegree());
        assertEquals(GraphError.GRAPH_IS_EMPTY, e.getError());
    }

    @Test
    void testDirected() {
        Graph g = new Graph(true);
        g.addEdge("a", "b");
        g.addEdge("c", "b");
        g.addEdge("b", "a");
        assertEquals(3, g.getEdgeCount());
        assertTrue(g.hasEdge(0, 1));
        assertFalse(g.hasEdge(2, 1) && g.hasEdge(1, 2));
        assertEquals(1, g.getOutDegree(1));
        assertEquals(2, g.getInDegree(1));
        assertEquals(3, g.getDegree(1));
        assertArrayEquals(new int[] {0, 2}, g.getInNeighbors(1));
        assertArrayEquals(new int[] {0, 2}, g.getAdjacentVertices(1));
        assertTrue(g.areAdjacent(1, 2));
        GraphException e = assertThrows(GraphException.class, () -> g.setDirected(false));
        assertEquals(GraphError.INVALID_ARGUMENT, e.getError());
    }

    @Test
    void testMakeDirected() {
        graph.makeDirected();
        assertTrue(graph.isDirected());
        assertEquals(10, graph.getEdgeCount());
        graph.removeEdge(0, 1);
        assertTrue(graph.hasEdge(1, 0));
    }

    @Test
    void testWeights() {
        Graph g = new Graph(false, true);
        g.addEdge("a", "b", 2.5);
        g.addEdge("b", "c");
        assertEquals(2.5, g.getWeight(1, 0));
        assertEquals(1.0, g.getWeight(1, 2));
        g.setWeight(2, 1, 4);
        assertEquals(4, g.getWeight(1, 2));
        assertEquals(AttributeValue.of(4), g.getEdgeAttribute(1, 2, AttributeTags.WEIGHT).orElseThrow());

        assertEquals(1.0, graph.getWeight(0, 1));
        GraphException e = assertThrows(GraphException.class, () -> graph.addEdge(0, 1, 3));
        assertEquals(GraphError.WEIGHTED_GRAPH_REQUIRED, e.getError());
        GraphException e2 = assertThrows(GraphException.class, () -> graph.getWeight(1, 3));
        assertEquals(GraphError.EDGE_NOT_FOUND, e2.getError());

        g.makeUnweighted();
        assertFalse(g.isWeighted());
        assertEquals(1.0, g.getWeight(0, 1));
    }

    @Test
    void testMakeWeighted() {
        Graph g = GraphFactory.fromTrail(List.of("x", "y", "z"), false);
        g.makeWeighted(new double[][] {{0, 3, 0}, {3, 0, 5}, {0, 5, 0}});
        assertTrue(g.isWeighted());
        assertEquals(5, g.getWeight(2, 1));
        GraphException e = assertThrows(GraphException.class, () -> g.makeWeighted(new double[][] {{0, 1}, {1, 0}}));
        assertEquals(GraphError.NOT_SQUARE_MATRIX, e.getError());
    }

    @Test
    void testMakeWeightedAsymmetric() {
        Graph g = GraphFactory.fromTrail(List.of("x", "y", "z"), false);
        double[][] asymmetric = {{0, 3, 0}, {4, 0, 5}, {0, 5, 0}};
        GraphException e = assertThrows(GraphException.class, () -> g.makeWeighted(asymmetric));
        assertEquals(GraphError.MATRIX_NOT_SYMMETRIC, e.getError());
        // rejected before any change
        assertFalse(g.isWeighted());
        assertEquals(1.0, g.getWeight(0, 1));

        Graph directed = GraphFactory.fromTrail(List.of("x", "y", "z"), true);
        directed.makeWeighted(asymmetric);
        assertEquals(3, directed.getWeight(0, 1));
        assertEquals(5, directed.getWeight(1, 2));
    }

    @Test
    void testRandomizeEdgeWeights() {
        Graph g = GraphFactory.fromTrail(List.of("a", "b", "c", "d", "a"), false);
        GraphException e = assertThrows(GraphException.class, () -> g.randomizeEdgeWeights(1, 5, true, new Random(1)));
        assertEquals(GraphError.WEIGHTED_GRAPH_REQUIRED, e.getError());

        g.setWeighted(true);
        g.randomizeEdgeWeights(1, 5, true, new Random(1));
        for (Edge edge : g.getEdges()) {
            double w = g.getWeight(edge.source(), edge.target());
            assertEquals(Math.rint(w), w);
            assertTrue(w >= 1 && w <= 5);
            // both directions share the same weight
            assertEquals(w, g.getWeight(edge.target(), edge.source()));
        }
        g.randomizeEdgeWeights(-0.5, 0.5, false, new Random(2));
        for (Edge edge : g.getEdges()) {
            double w = g.getWeight(edge.source(), edge.target());
            assertTrue(w >= -0.5 && w < 0.5);
        }
        g.randomizeEdgeWeights(2, 2, false, new Random(3));
        assertEquals(2, g.getWeight(0, 1));

        GraphException e2 = assertThrows(GraphException.class, () -> g.randomizeEdgeWeights(3, 1, false, new Random(1)));
        assertEquals(GraphError.INVALID_ARGUMENT, e2.getError());
        GraphException e3 = assertThrows(GraphException.class, () -> g.randomizeEdgeWeights(0.5, 2, true, new Random(1)));
        assertEquals(GraphError.INVALID_ARGUMENT, e3.getError());
    }

    @Test
    void testAttributes() {
        graph.setGraphAttribute("owner", AttributeValue.of("me"));
        graph.setVertexAttribute(0, AttributeTags.COLOR, AttributeValue.of("red"));
        graph.setVertexAttribute(1, "rank", AttributeValue.of(2));
        graph.setEdgeAttribute(0, 1, "capacity", AttributeValue.of(7));

        assertEquals("me", graph.getGraphAttribute("owner").orElseThrow().asString());
        assertEquals(Map.of("color", AttributeValue.of("red")), graph.getVertexAttributes(0));
        assertEquals(2, graph.getVertexAttribute(1, "rank").orElseThrow().asNumber());
        assertTrue(graph.getVertexAttribute(2, "rank").isEmpty());
        assertTrue(graph.getVertexAttribute(2, "unknown").isEmpty());
        // undirected edges share their attributes
        assertEquals(7, graph.getEdgeAttribute(1, 0, "capacity").orElseThrow().asNumber());
        assertEquals(Map.of("capacity", AttributeValue.of(7)), graph.getEdgeAttributes(1, 0));

        int key = graph.getAttributeTags().getKey("capacity");
        assertTrue(graph.discardEdgeAttribute(0, 1, key));
        assertTrue(graph.getEdgeAttribute(1, 0, key).isEmpty());
        assertTrue(graph.discardVertexAttribute(0, AttributeTags.COLOR));
        assertFalse(graph.discardVertexAttribute(0, AttributeTags.COLOR));

        GraphException e = assertThrows(GraphException.class, () -> graph.setGraphAttribute(AttributeTags.DIRECTED, AttributeValue.TRUE));
        assertEquals(GraphError.INVALID_ARGUMENT, e.getError());
        assertThrows(GraphException.class, () -> graph.setEdgeAttribute(1, 3, "capacity", AttributeValue.of(1)));
    }

    @Test
    void testTagsCarriedByCopies() {
        graph.setVertexAttribute(0, "rank", AttributeValue.of(1));
        Graph copy = new Graph(graph);
        assertEquals(graph.getAttributeTags().getKey("rank"), copy.getAttributeTags().getKey("rank"));
        assertEquals(1, copy.getVertexAttribute(0, "rank").orElseThrow().asNumber());
        copy.setVertexAttribute(0, "rank", AttributeValue.of(3));
        assertEquals(1, graph.getVertexAttribute(0, "rank").orElseThrow().asNumber());
        assertTrue(GraphTransforms.graphEqual(graph, copy));
    }

    @Test
    void testMatrices() {
        DenseMatrix a = graph.getAdjacencyMatrix();
        assertEquals(1, a.get(0, 2));
        assertEquals(1, a.get(2, 0));
        assertEquals(0, a.get(1, 3));

        DenseMatrix inc = graph.getIncidenceMatrix();
        assertEquals(4, inc.getRowCount());
        assertEquals(5, inc.getColumnCount());
        assertEquals(1, inc.get(0, 0));
        assertEquals(1, inc.get(1, 0));

        Graph d = new Graph(true);
        d.addEdge("a", "b");
        DenseMatrix dinc = d.getIncidenceMatrix();
        assertEquals(-1, dinc.get(0, 0));
        assertEquals(1, dinc.get(1, 0));

        GraphException e = assertThrows(GraphException.class, () -> graph.getWeightMatrix());
        assertEquals(GraphError.WEIGHTED_GRAPH_REQUIRED, e.getError());
    }

    @Test
    void testMarkedVertices() {
        graph.markVertex(2);
        graph.markVertex(0);
        graph.markVertex(2);
        assertEquals(List.of(2, 0), graph.getMarkedVertices());
        assertTrue(graph.unmarkVertex(2));
        assertFalse(graph.unmarkVertex(2));
        graph.clearMarkedVertices();
        assertTrue(graph.getMarkedVertices().isEmpty());
    }

    @Test
    void testLabels() {
        graph.setVertexLabel(0, "z");
        assertEquals(0, graph.getVertexIndex("z"));
        assertEquals(Graph.NOT_FOUND, graph.getVertexIndex("a"));
        assertThrows(GraphException.class, () -> graph.setVertexLabel(1, "c"));
        Graph g = new Graph();
        g.addVertices(3);
        assertEquals(List.of("0", "1", "2"), g.getVertexLabels());
    }

    @Test
    void testToString() {
        assertEquals("graph[undirected, unweighted, 4 vertices, 5 edges]", graph.toString());
        assertEquals("k4[undirected, unweighted, 0 vertices, 0 edges]", new Graph().setName("k4").toString());
    }
}

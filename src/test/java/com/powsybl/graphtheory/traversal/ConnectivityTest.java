/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.traversal;

import com.powsybl.graphtheory.catalog.GraphGenerators;
import com.powsybl.graphtheory.graph.Edge;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphFactory;
import com.powsybl.graphtheory.graph.JGraphTModel;
import org.apache.commons.lang3.tuple.Pair;
import org.jgrapht.alg.connectivity.BiconnectivityInspector;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.alg.connectivity.KosarajuStrongConnectivityInspector;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl graph theory team
 */
class ConnectivityTest {

    @Test
    void testCycle() {
        Graph c5 = GraphGenerators.cycle(5);
        assertTrue(Connectivity.isConnected(c5));
        assertTrue(Connectivity.isBiconnected(c5));
        assertTrue(Connectivity.isTwoEdgeConnected(c5));
        assertFalse(Connectivity.isTriconnected(c5));
        assertTrue(Connectivity.findCutVertices(c5).isEmpty());
        assertTrue(Connectivity.findBridges(c5).isEmpty());
        assertEquals(List.of(List.of(0, 1, 2, 3, 4)), Connectivity.findBlocks(c5));
    }

    @Test
    void testTriconnected() {
        assertTrue(Connectivity.isTriconnected(GraphGenerators.complete(4)));
        assertTrue(Connectivity.isTriconnected(GraphGenerators.wheel(5)));
        assertTrue(Connectivity.isTriconnected(GraphGenerators.prism(4)));
        assertFalse(Connectivity.isTriconnected(GraphGenerators.completeMultipartite(2, 3)));
    }

    @Test
    void testBowTie() {
        // two triangles sharing vertex c, plus a pendant edge c - f
        Graph g = GraphFactory.fromTrail(List.of("a", "b", "c", "a"), false);
        GraphFactory.addTrail(g, List.of("c", "d", "e", "c"));
        g.addEdge("c", "f");
        int c = g.getVertexIndex("c");
        int f = g.getVertexIndex("f");
        assertEquals(List.of(c), Connectivity.findCutVertices(g));
        assertEquals(List.of(Edge.undirected(c, f)), Connectivity.findBridges(g));
        assertEquals(3, Connectivity.findBlocks(g).size());
        assertFalse(Connectivity.isBiconnected(g));
        assertFalse(Connectivity.isTwoEdgeConnected(g));

        BiconnectedComponentsFinder finder = new BiconnectedComponentsFinder(g);
        assertTrue(finder.getLowLink(f) > finder.getDiscoveryTime(c));
        assertEquals(1, finder.getDiscoveryTime(0));
    }

    @Test
    void testComponents() {
        Graph g = GraphFactory.fromEdges(List.of(Pair.of("a", "b"), Pair.of("c", "d"), Pair.of("d", "e")), false);
        g.addVertex("f");
        assertArrayEquals(new int[] {0, 0, 1, 1, 1, 2}, ConnectedComponents.getComponentNumbers(g));
        assertEquals(List.of(List.of(0, 1), List.of(2, 3, 4), List.of(5)), ConnectedComponents.find(g));
        assertEquals(3, ConnectedComponents.getComponentCount(g));
        assertFalse(ConnectedComponents.isConnected(g));
        assertTrue(ConnectedComponents.isConnected(new Graph()));
    }

    @Test
    void testStronglyConnected() {
        Graph g = GraphFactory.fromTrail(List.of("a", "b", "c", "a"), true);
        assertTrue(Connectivity.isStronglyConnected(g));
        g.addEdge("c", "d");
        assertFalse(Connectivity.isStronglyConnected(g));
        List<List<Integer>> components = Connectivity.findStronglyConnectedComponents(g);
        // the sink component comes first
        assertEquals(List.of(List.of(3), List.of(0, 1, 2)), components);
    }

    private static Set<Set<Integer>> toSets(Collection<? extends Collection<Integer>> collections) {
        return collections.stream().<Set<Integer>>map(HashSet::new).collect(Collectors.toSet());
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 4, 5, 6, 7, 8})
    void testAgainstJGraphT(long seed) {
        Graph g = GraphGenerators.randomGraph(30, 0.08, false, new Random(seed));
        org.jgrapht.Graph<Integer, DefaultWeightedEdge> jgraph = JGraphTModel.toJGraphT(g);

        BiconnectivityInspector<Integer, DefaultWeightedEdge> inspector = new BiconnectivityInspector<>(jgraph);
        assertEquals(new TreeSet<>(inspector.getCutpoints()), new TreeSet<>(Connectivity.findCutVertices(g)));
        Set<Edge> expectedBridges = inspector.getBridges().stream()
                .map(e -> Edge.undirected(jgraph.getEdgeSource(e), jgraph.getEdgeTarget(e)))
                .collect(Collectors.toSet());
        assertEquals(expectedBridges, new HashSet<>(Connectivity.findBridges(g)));
        Set<Set<Integer>> expectedBlocks = inspector.getBlocks().stream()
                .map(org.jgrapht.Graph::vertexSet)
                .filter(vertices -> vertices.size() > 1)
                .collect(Collectors.toSet());
        assertEquals(expectedBlocks, toSets(Connectivity.findBlocks(g)));

        assertEquals(toSets(new ConnectivityInspector<>(jgraph).connectedSets()), toSets(ConnectedComponents.find(g)));
    }

    @ParameterizedTest
    @ValueSource(longs = {11, 12, 13, 14, 15})
    void testStronglyConnectedAgainstJGraphT(long seed) {
        Graph g = GraphGenerators.randomGraph(25, 0.07, true, new Random(seed));
        KosarajuStrongConnectivityInspector<Integer, DefaultWeightedEdge> inspector = new KosarajuStrongConnectivityInspector<>(JGraphTModel.toJGraphT(g));
        assertEquals(toSets(inspector.stronglyConnectedSets()), toSets(Connectivity.findStronglyConnectedComponents(g)));
    }

    @Test
    void testBiconnectedIffNoCutVertex() {
        Random random = new Random(3);
        for (int k = 0; k < 20; k++) {
            Graph g = GraphGenerators.randomGraph(12, 0.3, false, random);
            boolean expected = ConnectedComponents.isConnected(g) && new BiconnectedComponentsFinder(g).getCutVertices().isEmpty();
            assertEquals(expected, Connectivity.isBiconnected(g));
            if (Connectivity.isBiconnected(g) && g.getVertexCount() > 2) {
                assertEquals(1, Connectivity.findBlocks(g).size());
            }
        }
    }

    @Test
    void testLongPath() {
        int n = 200_000;
        Graph path = GraphGenerators.path(n);
        assertFalse(Connectivity.isBiconnected(path));
        assertFalse(Connectivity.isTwoEdgeConnected(path));
        List<Integer> cutVertices = Connectivity.findCutVertices(path);
        assertEquals(n - 2, cutVertices.size());
        assertEquals(1, cutVertices.get(0));
        assertEquals(n - 2, cutVertices.get(n - 3));
        assertEquals(n - 1, Connectivity.findBridges(path).size());
        assertEquals(n - 1, Connectivity.findBlocks(path).size());
    }

    @Test
    void testLongCycle() {
        int n = 200_000;
        Graph cycle = GraphGenerators.cycle(n);
        assertTrue(Connectivity.isBiconnected(cycle));
        assertTrue(Connectivity.isTwoEdgeConnected(cycle));
        assertTrue(Connectivity.findBridges(cycle).isEmpty());
        BiconnectedComponentsFinder finder = new BiconnectedComponentsFinder(cycle);
        assertEquals(1, finder.getBlocks().size());
        assertEquals(n, finder.getBlocks().get(0).size());
        assertEquals(n, finder.getDiscoveryTime(n - 1));
        assertEquals(1, finder.getLowLink(n - 1));
    }

    @Test
    void testLongDirectedPath() {
        int n = 200_000;
        Graph g = GraphFactory.create(n, true);
        for (int i = 1; i < n; i++) {
            g.addEdge(i - 1, i);
        }
        assertFalse(Connectivity.isStronglyConnected(g));
        List<List<Integer>> components = Connectivity.findStronglyConnectedComponents(g);
        assertEquals(n, components.size());
        assertEquals(List.of(n - 1), components.get(0));
        assertEquals(List.of(0), components.get(n - 1));

        // closing the path makes a single component
        g.addEdge(n - 1, 0);
        assertTrue(Connectivity.isStronglyConnected(g));
    }
}

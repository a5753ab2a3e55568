/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.traversal;

import com.powsybl.graphtheory.catalog.GraphGenerators;
import com.powsybl.graphtheory.catalog.NamedGraph;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.graph.GraphFactory;
import com.powsybl.graphtheory.graph.JGraphTModel;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.alg.partition.BipartitePartitioning;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl graph theory team
 */
class CyclesTest {

    @Test
    void testFiveCycle() {
        Graph c5 = GraphGenerators.cycle(5);
        assertEquals(OptionalInt.of(5), Cycles.girth(c5));
        assertEquals(OptionalInt.of(5), Cycles.oddGirth(c5));
        assertFalse(Cycles.isBipartite(c5));
        assertFalse(Trees.isTree(c5));
        assertFalse(Trees.isForest(c5));
        List<Integer> cycle = Cycles.findCycle(c5);
        assertEquals(5, cycle.size());
        assertTrue(Cycles.isCycle(c5, cycle));
    }

    @Test
    void testAcyclic() {
        Graph tree = GraphGenerators.kAryTree(3, 2);
        assertTrue(Cycles.findCycle(tree).isEmpty());
        assertFalse(Cycles.hasCycle(tree));
        assertEquals(OptionalInt.empty(), Cycles.girth(tree));
        assertTrue(Cycles.isBipartite(tree));
    }

    @Test
    void testIsCycle() {
        Graph k4 = GraphGenerators.complete(4);
        assertTrue(Cycles.isCycle(k4, List.of(0, 1, 2, 3)));
        assertTrue(Cycles.isCycle(k4, List.of(3, 1, 0)));
        assertFalse(Cycles.isCycle(k4, List.of(0, 1)));
        assertFalse(Cycles.isCycle(k4, List.of(0, 1, 0, 2)));
        Graph p4 = GraphGenerators.path(4);
        assertFalse(Cycles.isCycle(p4, List.of(0, 1, 2, 3)));
    }

    @Test
    void testDirectedCycles() {
        Graph g = GraphFactory.fromTrail(List.of("a", "b", "c"), true);
        g.addEdge("a", "c");
        // a triangle, but not a directed cycle
        assertFalse(Cycles.hasCycle(g));
        assertEquals(OptionalInt.empty(), Cycles.girth(g));
        g.addEdge("c", "a");
        // a and c now form a directed 2-cycle
        assertEquals(OptionalInt.of(2), Cycles.girth(g));
        List<Integer> cycle = Cycles.findCycle(g);
        for (int k = 0; k < cycle.size(); k++) {
            assertTrue(g.hasEdge(cycle.get(k), cycle.get((k + 1) % cycle.size())));
        }
        assertThrows(GraphException.class, () -> Cycles.oddGirth(g));
    }

    @Test
    void testGirthOfNamedGraphs() {
        assertEquals(OptionalInt.of(5), Cycles.girth(NamedGraph.PETERSEN.create()));
        assertEquals(OptionalInt.of(5), Cycles.oddGirth(NamedGraph.PETERSEN.create()));
        assertEquals(OptionalInt.of(4), Cycles.girth(GraphGenerators.hypercube(4)));
        assertEquals(OptionalInt.empty(), Cycles.oddGirth(GraphGenerators.hypercube(4)));
        assertEquals(OptionalInt.of(5), Cycles.oddGirth(NamedGraph.GROTZSCH.create()));
    }

    @Test
    void testAgainstJGraphT() {
        Random random = new Random(5);
        for (int k = 0; k < 20; k++) {
            Graph directed = GraphGenerators.randomGraph(15, 0.05, true, random);
            assertEquals(new CycleDetector<>(JGraphTModel.toJGraphT(directed)).detectCycles(), Cycles.hasCycle(directed));
            Graph undirected = GraphGenerators.randomGraph(15, 0.15, false, random);
            assertEquals(new BipartitePartitioning<>(JGraphTModel.toJGraphT(undirected)).isBipartite(), Cycles.isBipartite(undirected));
        }
    }

    @Test
    void testTrees() {
        Graph forest = GraphFactory.create(5, false);
        forest.addEdge(0, 1);
        forest.addEdge(2, 3);
        assertTrue(Trees.isForest(forest));
        assertFalse(Trees.isTree(forest));
        forest.addEdge(1, 2);
        forest.addEdge(3, 4);
        assertTrue(Trees.isTree(forest));
        assertEquals(4, Trees.getHeight(forest, 0));
        assertEquals(2, Trees.getHeight(forest, 2));
        assertFalse(Trees.isTree(new Graph()));

        GraphException e = assertThrows(GraphException.class, () -> Trees.getHeight(GraphGenerators.cycle(3), 0));
        assertEquals(GraphError.NOT_A_TREE, e.getError());
        GraphException e2 = assertThrows(GraphException.class, () -> Trees.isTree(GraphGenerators.randomTournament(3, new Random(0))));
        assertEquals(GraphError.UNDIRECTED_GRAPH_REQUIRED, e2.getError());
    }

    @Test
    void testArborescenceAndTournament() {
        Graph g = GraphFactory.create(4, true);
        g.addEdge(0, 1);
        g.addEdge(0, 2);
        g.addEdge(2, 3);
        assertTrue(Trees.isArborescence(g));
        g.addEdge(1, 3);
        assertFalse(Trees.isArborescence(g));
        assertFalse(Trees.isTournament(g));
        assertTrue(Trees.isTournament(GraphGenerators.randomTournament(6, new Random(1))));
        assertThrows(GraphException.class, () -> Trees.isArborescence(GraphGenerators.path(3)));
    }
}

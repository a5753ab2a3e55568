/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.clique;

import com.powsybl.graphtheory.catalog.GraphGenerators;
import com.powsybl.graphtheory.catalog.NamedGraph;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.graph.GraphFactory;
import com.powsybl.graphtheory.graph.JGraphTModel;
import org.jgrapht.alg.clique.BronKerboschCliqueFinder;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl graph theory team
 */
class CliqueFinderTest {

    @Test
    void testMaximalCliques() {
        // two triangles sharing edge 1-2, plus the pendant edge 3-4
        Graph g = GraphFactory.create(5, false);
        g.addEdge(0, 1);
        g.addEdge(0, 2);
        g.addEdge(1, 2);
        g.addEdge(1, 3);
        g.addEdge(2, 3);
        g.addEdge(3, 4);
        Set<List<Integer>> cliques = new HashSet<>(CliqueFinder.findMaximalCliques(g));
        assertEquals(Set.of(List.of(0, 1, 2), List.of(1, 2, 3), List.of(3, 4)), cliques);
        assertEquals(3, CliqueFinder.getCliqueNumber(g));
        assertTrue(CliqueFinder.findMaximalCliques(new Graph()).isEmpty());
        assertTrue(CliqueFinder.findMaximumClique(new Graph()).isEmpty());
    }

    @Test
    void testAgainstJGraphT() {
        Random random = new Random(9);
        for (int k = 0; k < 15; k++) {
            Graph g = GraphGenerators.randomGraph(18, 0.3 + 0.02 * k, false, random);
            Set<Set<Integer>> expected = new HashSet<>();
            new BronKerboschCliqueFinder<Integer, DefaultWeightedEdge>(JGraphTModel.toJGraphT(g)).forEach(expected::add);
            Set<Set<Integer>> actual = new HashSet<>();
            for (List<Integer> clique : CliqueFinder.findMaximalCliques(g)) {
                assertTrue(CliqueFinder.isClique(g, clique));
                actual.add(new HashSet<>(clique));
            }
            assertEquals(expected, actual);
            int largest = expected.stream().mapToInt(Set::size).max().orElse(0);
            assertEquals(largest, CliqueFinder.getCliqueNumber(g));
        }
    }

    @Test
    void testIsClique() {
        Graph k5 = GraphGenerators.complete(5);
        assertTrue(CliqueFinder.isClique(k5, List.of(0, 2, 4)));
        assertTrue(CliqueFinder.isClique(k5, List.of()));
        assertFalse(CliqueFinder.isClique(GraphGenerators.cycle(5), List.of(0, 1, 2)));
        assertEquals(5, CliqueFinder.getCliqueNumber(k5));
        assertEquals(2, CliqueFinder.getCliqueNumber(NamedGraph.PETERSEN.create()));
        GraphException e = assertThrows(GraphException.class, () -> CliqueFinder.findMaximalCliques(GraphFactory.create(2, true)));
        assertEquals(GraphError.UNDIRECTED_GRAPH_REQUIRED, e.getError());
    }

    @Test
    void testCliqueCover() {
        Graph c5 = GraphGenerators.cycle(5);
        CliqueCover cover = CliqueCover.find(c5);
        assertTrue(cover.isSuccessful());
        assertEquals(3, cover.size());
        assertEquals(5, cover.getCliques().stream().mapToInt(List::size).sum());
        for (List<Integer> clique : cover.getCliques()) {
            assertTrue(CliqueFinder.isClique(c5, clique));
        }

        CliqueCover capped = CliqueCover.find(c5, 2);
        assertFalse(capped.isSuccessful());
        assertEquals(2, capped.size());
        assertTrue(CliqueCover.find(GraphGenerators.complete(4), 1).isSuccessful());
        assertThrows(IllegalArgumentException.class, () -> CliqueCover.find(c5, -1));
    }

    @Test
    void testColorings() {
        assertEquals(3, Colorings.getChromaticNumber(GraphGenerators.cycle(5)));
        assertEquals(2, Colorings.getChromaticNumber(GraphGenerators.cycle(6)));
        assertEquals(4, Colorings.getChromaticNumber(GraphGenerators.complete(4)));
        assertEquals(2, Colorings.getChromaticNumber(GraphGenerators.grid(3, 3)));
        assertEquals(3, Colorings.getCliqueCoverNumber(GraphGenerators.cycle(5)));
        assertEquals(4, Colorings.getIndependenceNumber(NamedGraph.PETERSEN.create()));

        Graph petersen = NamedGraph.PETERSEN.create();
        int[] colors = Colorings.getColoring(petersen);
        for (int v = 0; v < petersen.getVertexCount(); v++) {
            for (int w : petersen.getNeighbors(v)) {
                assertNotEquals(colors[v], colors[w]);
            }
        }
        List<Integer> independent = Colorings.findMaximumIndependentSet(GraphGenerators.path(5));
        assertEquals(List.of(0, 2, 4), independent);
    }
}

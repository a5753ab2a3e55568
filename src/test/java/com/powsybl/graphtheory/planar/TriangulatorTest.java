/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.planar;

import com.powsybl.graphtheory.catalog.GraphGenerators;
import com.powsybl.graphtheory.catalog.NamedGraph;
import com.powsybl.graphtheory.graph.Edge;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.graph.GraphFactory;
import com.powsybl.graphtheory.traversal.Connectivity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl graph theory team
 */
class TriangulatorTest {

    @Test
    void testMakeBiconnected() {
        for (Graph g : List.of(GraphGenerators.path(6), GraphGenerators.star(5), GraphGenerators.kAryTree(2, 3),
                GraphGenerators.randomTree(25, new Random(4)))) {
            Graph augmented = Triangulator.makeBiconnected(g);
            assertTrue(Connectivity.isBiconnected(augmented));
            assertTrue(PlanarEmbedder.isPlanar(augmented));
            assertEquals(g.getVertexLabels(), augmented.getVertexLabels());
            for (Edge e : g.getEdges()) {
                assertTrue(augmented.hasEdge(e.source(), e.target()));
            }
        }
        Graph c6 = GraphGenerators.cycle(6);
        assertEquals(6, Triangulator.makeBiconnected(c6).getEdgeCount());
        assertEquals(1, Triangulator.makeBiconnected(GraphGenerators.path(2)).getEdgeCount());
    }

    @Test
    void testMakeBiconnectedLongPath() {
        int n = 400;
        Graph augmented = Triangulator.makeBiconnected(GraphGenerators.path(n));
        // one chord around each inner vertex
        assertEquals(2 * n - 3, augmented.getEdgeCount());
        for (int i = 0; i + 2 < n; i++) {
            assertTrue(augmented.hasEdge(i, i + 2));
        }
        assertTrue(Connectivity.isBiconnected(augmented));
    }

    @Test
    void testMakeBiconnectedStar() {
        // the leaves around the center are chained into a fan
        Graph augmented = Triangulator.makeBiconnected(GraphGenerators.star(5));
        assertEquals(9, augmented.getEdgeCount());
        assertTrue(Connectivity.isBiconnected(augmented));
        assertEquals(5, PlanarEmbedder.embedOrThrow(augmented).getFaceCount());
    }

    @Test
    void testMakeBiconnectedErrors() {
        GraphException e = assertThrows(GraphException.class, () -> Triangulator.makeBiconnected(GraphFactory.create(3, false)));
        assertEquals(GraphError.CONNECTED_GRAPH_REQUIRED, e.getError());
        GraphException e2 = assertThrows(GraphException.class, () -> Triangulator.makeBiconnected(GraphGenerators.complete(5)));
        assertEquals(GraphError.NOT_PLANAR, e2.getError());
    }

    @Test
    void testMaximalPlanar() {
        Graph cube = NamedGraph.CUBE.create();
        PlanarEmbedding embedding = PlanarEmbedder.embedOrThrow(cube);
        Triangulator.Triangulation triangulation = Triangulator.triangulate(cube, embedding, -1);
        Graph triangulated = triangulation.graph();
        // a maximal planar graph has 3V - 6 edges and 2V - 4 faces
        assertEquals(18, triangulated.getEdgeCount());
        assertEquals(6, triangulation.addedEdges().size());
        assertEquals(12, triangulation.faces().size());
        assertTrue(triangulation.faces().stream().allMatch(face -> face.size() == 3));
        assertTrue(PlanarEmbedder.isPlanar(triangulated));
        assertEquals(12, cube.getEdgeCount());
    }

    @Test
    void testKeepOuterFace() {
        Graph grid = GraphGenerators.grid(3, 3);
        PlanarEmbedding embedding = PlanarEmbedder.embedOrThrow(grid);
        int outer = embedding.getLargestFaceIndex(IntStream.range(0, 9).boxed().toList());
        assertEquals(8, embedding.getFaces().get(outer).size());
        Triangulator.Triangulation triangulation = Triangulator.triangulate(grid, embedding, outer);
        assertEquals(4, triangulation.addedEdges().size());
        long outerFaces = triangulation.faces().stream().filter(face -> face.size() == 8).count();
        assertEquals(1, outerFaces);
        assertEquals(9, triangulation.faces().size());
        for (Edge e : triangulation.addedEdges()) {
            assertFalse(grid.hasEdge(e.source(), e.target()));
            assertTrue(triangulation.graph().hasEdge(e.source(), e.target()));
        }
    }
}

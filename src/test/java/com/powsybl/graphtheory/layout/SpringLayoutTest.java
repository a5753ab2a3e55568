/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

import com.powsybl.graphtheory.catalog.GraphGenerators;
import com.powsybl.graphtheory.catalog.NamedGraph;
import com.powsybl.graphtheory.graph.Edge;
import com.powsybl.graphtheory.graph.Graph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl graph theory team
 */
class SpringLayoutTest {

    private static double distance(Layout layout, int u, int v) {
        double[] p = layout.getCoordinates(u);
        double[] q = layout.getCoordinates(v);
        double sum = 0;
        for (int d = 0; d < p.length; d++) {
            sum += (p[d] - q[d]) * (p[d] - q[d]);
        }
        return Math.sqrt(sum);
    }

    private static void assertSpreadOut(Graph g, Layout layout, double minDistance) {
        int n = g.getVertexCount();
        assertEquals(n, layout.getVertexCount());
        for (int u = 0; u < n; u++) {
            for (double c : layout.getCoordinates(u)) {
                assertTrue(Double.isFinite(c));
            }
            for (int v = u + 1; v < n; v++) {
                assertTrue(distance(layout, u, v) > minDistance, "vertices " + u + " and " + v + " overlap");
            }
        }
    }

    /**
     * Mean length of edges compared to the mean distance between any two vertices.
     */
    private static double edgeLengthRatio(Graph g, Layout layout) {
        double edges = 0;
        for (Edge e : g.getEdges()) {
            edges += distance(layout, e.source(), e.target());
        }
        edges /= g.getEdgeCount();
        double pairs = 0;
        int n = g.getVertexCount();
        for (int u = 0; u < n; u++) {
            for (int v = u + 1; v < n; v++) {
                pairs += distance(layout, u, v);
            }
        }
        pairs /= n * (n - 1) / 2.0;
        return edges / pairs;
    }

    @Test
    void testCycle() {
        Graph c8 = GraphGenerators.cycle(8);
        Layout layout = new SpringLayout(new LayoutParameters()).run(c8);
        assertEquals(2, layout.getDimension());
        assertSpreadOut(c8, layout, 0.1);
        assertTrue(edgeLengthRatio(c8, layout) < 0.75);
    }

    @Test
    void testSeedMakesLayoutReproducible() {
        Graph petersen = NamedGraph.PETERSEN.create();
        LayoutParameters parameters = new LayoutParameters().setSeed(7);
        Layout l1 = new SpringLayout(parameters).run(petersen);
        Layout l2 = new SpringLayout(parameters).run(petersen);
        for (int v = 0; v < petersen.getVertexCount(); v++) {
            assertArrayEquals(l1.getCoordinates(v), l2.getCoordinates(v));
        }
    }

    @Test
    void testThreeDimensional() {
        Graph cube = NamedGraph.CUBE.create();
        Layout layout = new SpringLayout(new LayoutParameters().setThreeDimensional(true)).run(cube);
        assertEquals(3, layout.getDimension());
        assertSpreadOut(cube, layout, 0.1);
    }

    @Test
    void testFixedVertices() {
        Graph star = GraphGenerators.star(4);
        Layout initial = new Layout(5, 2);
        for (int v = 0; v < 5; v++) {
            initial.setCoordinates(v, v, v % 2);
        }
        Layout layout = new SpringLayout(new LayoutParameters()).run(star, initial, List.of(0, 1));
        assertArrayEquals(new double[] {0, 0}, layout.getCoordinates(0));
        assertArrayEquals(new double[] {1, 1}, layout.getCoordinates(1));
        assertArrayEquals(new double[] {2, 0}, initial.getCoordinates(2));
        assertSpreadOut(star, layout, 0.1);
        assertThrows(IllegalArgumentException.class, () -> new SpringLayout(new LayoutParameters()).run(star, new Layout(2, 2), List.of()));
    }

    @Test
    void testIterationsAreBounded() {
        LayoutParameters parameters = new LayoutParameters().setMaxIterations(3);
        SpringLayout springLayout = new SpringLayout(parameters);
        double[][] positions = springLayout.randomPositions(10, 2);
        int[][] adjacency = GraphGenerators.cycle(10).getAdjacencyLists();
        assertEquals(3, springLayout.relax(adjacency, positions, new boolean[10], springLayout.getInitialTemperature(10)));
        assertEquals(0, springLayout.relax(new int[0][], new double[0][], new boolean[0], 1));
    }

    @Test
    void testCoincidentVerticesAreSeparated() {
        SpringLayout springLayout = new SpringLayout(new LayoutParameters());
        double[][] positions = new double[3][2];
        springLayout.relax(GraphGenerators.path(3).getAdjacencyLists(), positions, new boolean[3], 1);
        Layout layout = new Layout(positions, 2);
        assertSpreadOut(GraphGenerators.path(3), layout, 0.1);
    }

    @ParameterizedTest
    @EnumSource(CoarseningMethod.class)
    void testMultilevel(CoarseningMethod method) {
        Graph grid = GraphGenerators.grid(15, 15);
        LayoutParameters parameters = new LayoutParameters().setCoarseningMethod(method).setMaxIterations(100);
        Layout layout = new MultilevelSpringLayout(parameters).run(grid);
        assertSpreadOut(grid, layout, 1e-3);
        assertTrue(edgeLengthRatio(grid, layout) < 0.4);
    }

    @Test
    void testRepulsionRadius() {
        int[][] noEdges = new int[2][0];
        // too far apart to repel each other
        SpringLayout shortRange = new SpringLayout(new LayoutParameters().setRepulsionRadius(2));
        double[][] positions = {{0, 0}, {10, 0}};
        assertEquals(1, shortRange.relax(noEdges, positions, new boolean[2], 1));
        assertArrayEquals(new double[] {10, 0}, positions[1]);

        SpringLayout longRange = new SpringLayout(new LayoutParameters().setRepulsionRadius(Double.POSITIVE_INFINITY));
        longRange.relax(noEdges, positions, new boolean[2], 1);
        assertTrue(positions[1][0] - positions[0][0] > 10);

        // close vertices in adjacent cells on both sides of the origin
        double[][] close = {{-0.5, 0}, {0.5, 0}};
        shortRange.relax(noEdges, close, new boolean[2], 1);
        assertTrue(close[1][0] - close[0][0] > 1);
    }

    @Test
    void testLargeRadiusMatchesAllPairs() {
        int[][] adjacency = NamedGraph.PETERSEN.create().getUndirectedAdjacencyLists();
        LayoutParameters gridParameters = new LayoutParameters().setRepulsionRadius(1000).setMaxIterations(20);
        LayoutParameters allPairsParameters = new LayoutParameters().setRepulsionRadius(Double.POSITIVE_INFINITY).setMaxIterations(20);
        SpringLayout grid = new SpringLayout(gridParameters, new Random(5));
        SpringLayout allPairs = new SpringLayout(allPairsParameters, new Random(5));
        double[][] p1 = grid.randomPositions(10, 2);
        double[][] p2 = allPairs.randomPositions(10, 2);
        grid.relax(adjacency, p1, new boolean[10], 1);
        allPairs.relax(adjacency, p2, new boolean[10], 1);
        for (int v = 0; v < 10; v++) {
            assertArrayEquals(p2[v], p1[v], 1e-6);
        }
    }

    @Test
    void testGeometricCooling() {
        Graph c8 = GraphGenerators.cycle(8);
        Layout layout = new SpringLayout(new LayoutParameters().setAdaptiveCooling(false)).run(c8);
        assertSpreadOut(c8, layout, 0.1);
        assertTrue(edgeLengthRatio(c8, layout) < 0.75);
    }

    @Test
    void testMultilevelOnLongPath() {
        // fine times coarse vertex counts exceed the int range
        int n = 70_000;
        Graph path = GraphGenerators.path(n);
        for (CoarseningMethod method : CoarseningMethod.values()) {
            LayoutParameters parameters = new LayoutParameters()
                    .setCoarseningMethod(method)
                    .setMaxIterations(2)
                    .setRepulsionRadius(2);
            List<CoarseLevel> levels = new MultilevelSpringLayout(parameters).buildHierarchy(path.getUndirectedAdjacencyLists());
            assertEquals(n, levels.get(0).getFineVertexCount());
            Layout layout = new MultilevelSpringLayout(parameters).run(path);
            assertEquals(n, layout.getVertexCount());
            for (int v = 0; v < n; v += 997) {
                for (double c : layout.getCoordinates(v)) {
                    assertTrue(Double.isFinite(c));
                }
            }
        }
    }
}

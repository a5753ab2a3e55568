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
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.graph.GraphFactory;
import com.powsybl.graphtheory.graph.GraphTransforms;
import com.powsybl.graphtheory.traversal.ConnectedComponents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl graph theory team
 */
class LayoutEngineTest {

    private static final double EPSILON = 1e-6;

    private LayoutEngine engine;

    @BeforeEach
    void setUp() {
        engine = new LayoutEngine(new LayoutParameters());
    }

    private static double largestSide(Layout layout) {
        Rectangle box = layout.getBoundingBox();
        return Math.max(box.width(), box.height());
    }

    private static Graph forest() {
        // a path, a square and a triangle
        return GraphTransforms.disjointUnion(List.of(GraphGenerators.path(3), GraphGenerators.cycle(4), GraphGenerators.cycle(3)));
    }

    @Test
    void testSize() {
        Graph petersen = NamedGraph.PETERSEN.create();
        assertEquals(Math.sqrt(10), largestSide(engine.layout(petersen)), EPSILON);
        Graph g = forest();
        assertEquals(Math.sqrt(10), largestSide(engine.layout(g)), EPSILON);
        LayoutEngine longEdges = new LayoutEngine(new LayoutParameters().setEdgeLength(3));
        assertEquals(3 * Math.sqrt(10), largestSide(longEdges.layout(petersen)), EPSILON);
    }

    @Test
    void testSmallGraphs() {
        assertEquals(0, engine.layout(new Graph()).getVertexCount());
        Layout single = engine.layout(GraphFactory.create(1, false));
        assertEquals(1, single.getVertexCount());
        assertEquals(Math.sqrt(2), largestSide(engine.layout(GraphFactory.create(2, false))), EPSILON);
    }

    @Test
    void testComponentsDoNotOverlap() {
        Graph g = GraphTransforms.disjointUnion(List.of(GraphGenerators.grid(3, 3), GraphGenerators.kAryTree(2, 3),
                NamedGraph.PETERSEN.create(), GraphGenerators.path(2)));
        Layout layout = engine.layout(g);
        List<List<Integer>> components = ConnectedComponents.find(g);
        for (int i = 0; i < components.size(); i++) {
            for (int j = i + 1; j < components.size(); j++) {
                assertFalse(boundingBox(layout, components.get(i)).intersects(boundingBox(layout, components.get(j))));
            }
        }
    }

    private static Rectangle boundingBox(Layout layout, List<Integer> vertices) {
        Layout sub = new Layout(vertices.size(), 2);
        for (int k = 0; k < vertices.size(); k++) {
            sub.setCoordinates(k, layout.getCoordinates(vertices.get(k)));
        }
        return sub.getBoundingBox();
    }

    @Test
    void testGuessedStyles() {
        // a tree is drawn in layers
        Layout tree = engine.layout(GraphGenerators.kAryTree(2, 2));
        assertTrue(tree.getY(0) > tree.getY(1));
        assertEquals(tree.getY(1), tree.getY(2), EPSILON);
        assertEquals(tree.getY(3), tree.getY(6), EPSILON);

        // a small biconnected planar graph is drawn without crossing
        Graph wheel = GraphGenerators.wheel(7);
        Layout layout = engine.layout(wheel);
        List<Edge> edges = wheel.getEdges();
        for (Edge e1 : edges) {
            for (Edge e2 : edges) {
                assertFalse(PlanarLayoutTest.cross(layout, e1, e2));
            }
        }
    }

    @ParameterizedTest
    @EnumSource(LayoutStyle.class)
    void testExplicitStyles(LayoutStyle style) {
        Graph g = style == LayoutStyle.TREE || style == LayoutStyle.RADIAL_TREE
                ? GraphGenerators.randomTree(15, new Random(3)) : GraphGenerators.prism(5);
        Layout layout = engine.layout(g, style);
        assertEquals(g.getVertexCount(), layout.getVertexCount());
        assertEquals(2, layout.getDimension());
        assertEquals(Math.sqrt(g.getVertexCount()), largestSide(layout), EPSILON);
    }

    @Test
    void testDirectedGraph() {
        Graph tournament = GraphGenerators.randomTournament(6, new Random(4));
        Layout layout = engine.layout(tournament, LayoutStyle.SPRING);
        assertEquals(6, layout.getVertexCount());
    }

    @Test
    void testLayoutTree() {
        Graph g = GraphTransforms.disjointUnion(List.of(GraphGenerators.path(3), GraphGenerators.star(3)));
        // roots at the middle of the path and at a leaf of the star
        Layout layout = engine.layoutTree(g, List.of(1, 4));
        assertTrue(layout.getY(1) > layout.getY(0));
        assertEquals(layout.getY(0), layout.getY(2), EPSILON);
        assertTrue(layout.getY(4) > layout.getY(3));
        assertTrue(layout.getY(3) > layout.getY(5));

        GraphException e = assertThrows(GraphException.class, () -> engine.layoutTree(g, List.of(1)));
        assertEquals(GraphError.INVALID_NUMBER_OF_ROOTS, e.getError());
        GraphException e2 = assertThrows(GraphException.class, () -> engine.layout(GraphGenerators.cycle(5), LayoutStyle.TREE));
        assertEquals(GraphError.NOT_A_TREE, e2.getError());
    }

    @Test
    void testLayoutRadialTree() {
        Graph star = GraphGenerators.star(5);
        Layout layout = engine.layoutRadialTree(star, List.of(0));
        double radius = Math.hypot(layout.getX(1) - layout.getX(0), layout.getY(1) - layout.getY(0));
        for (int v = 2; v <= 5; v++) {
            assertEquals(radius, Math.hypot(layout.getX(v) - layout.getX(0), layout.getY(v) - layout.getY(0)), EPSILON);
        }
        GraphException e = assertThrows(GraphException.class, () -> engine.layoutRadialTree(star, List.of(0, 1)));
        assertEquals(GraphError.INVALID_NUMBER_OF_ROOTS, e.getError());
    }

    @Test
    void testLayoutCircle() {
        Graph wheel = GraphGenerators.wheel(8);
        List<Integer> rim = List.of(1, 2, 3, 4, 5, 6, 7, 8);
        Layout layout = engine.layoutCircle(wheel, rim);
        double cx = 0;
        double cy = 0;
        for (int v : rim) {
            cx += layout.getX(v) / rim.size();
            cy += layout.getY(v) / rim.size();
        }
        double radius = Math.hypot(layout.getX(1) - cx, layout.getY(1) - cy);
        for (int v : rim) {
            assertEquals(radius, Math.hypot(layout.getX(v) - cx, layout.getY(v) - cy), EPSILON);
        }
        assertTrue(Math.hypot(layout.getX(0) - cx, layout.getY(0) - cy) < radius);

        GraphException e = assertThrows(GraphException.class, () -> engine.layoutCircle(wheel, List.of(1, 2, 4)));
        assertEquals(GraphError.NOT_A_CYCLE, e.getError());
    }

    @Test
    void testThreeDimensions() {
        LayoutEngine engine3d = new LayoutEngine(new LayoutParameters().setThreeDimensional(true));
        Graph cube = GraphGenerators.hypercube(3);
        Layout layout = engine3d.layout(cube);
        assertEquals(3, layout.getDimension());
        assertEquals(3, layout.getCoordinates(0).length);

        GraphException e = assertThrows(GraphException.class, () -> engine3d.layout(cube, LayoutStyle.PLANAR));
        assertEquals(GraphError.INVALID_ARGUMENT, e.getError());
        GraphException e2 = assertThrows(GraphException.class, () -> engine3d.layout(forest()));
        assertEquals(GraphError.CONNECTED_GRAPH_REQUIRED, e2.getError());
    }
}

/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

import com.powsybl.graphtheory.catalog.GraphGenerators;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.graph.GraphFactory;
import com.powsybl.graphtheory.traversal.BreadthFirstSearch;
import com.powsybl.graphtheory.traversal.Traversal;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl graph theory team
 */
class TreeLayoutTest {

    private static final double EPSILON = 1e-9;

    @Test
    void testBinaryTree() {
        Layout layout = new TreeLayout(new LayoutParameters()).run(GraphGenerators.kAryTree(2, 2));
        double[] expectedX = {1.5, 0.5, 2.5, 0, 1, 2, 3};
        double[] expectedY = {0, -1, -1, -2, -2, -2, -2};
        for (int v = 0; v < 7; v++) {
            assertEquals(expectedX[v], layout.getX(v), EPSILON);
            assertEquals(expectedY[v], layout.getY(v), EPSILON);
        }
    }

    @Test
    void testPolar() {
        TreeLayout treeLayout = new TreeLayout(new LayoutParameters());
        Layout layout = treeLayout.toPolar(treeLayout.run(GraphGenerators.kAryTree(2, 2)));
        assertEquals(0, layout.getX(0), EPSILON);
        assertEquals(0, layout.getY(0), EPSILON);
        // layered x from 0 to 3 is spread over a full turn of 4 sibling separations
        assertEquals(Math.cos(Math.PI / 4), layout.getX(1), EPSILON);
        assertEquals(Math.sin(Math.PI / 4), layout.getY(1), EPSILON);
        assertEquals(2, layout.getX(3), EPSILON);
        assertEquals(0, layout.getY(3), EPSILON);
        assertEquals(0, layout.getX(6), EPSILON);
        assertEquals(-2, layout.getY(6), EPSILON);
        for (int v = 3; v < 7; v++) {
            assertEquals(2, Math.hypot(layout.getX(v), layout.getY(v)), EPSILON);
            for (int w = v + 1; w < 7; w++) {
                assertTrue(Math.hypot(layout.getX(v) - layout.getX(w), layout.getY(v) - layout.getY(w)) > 1);
            }
        }
        assertEquals(0, treeLayout.toPolar(new Layout(0, 2)).getVertexCount());
    }

    @Test
    void testSeparations() {
        LayoutParameters parameters = new LayoutParameters().setTreeLevelSeparation(3).setTreeSiblingSeparation(2);
        Layout layout = new TreeLayout(parameters).run(GraphGenerators.star(2));
        assertEquals(1, layout.getX(0), EPSILON);
        assertEquals(0, layout.getY(0), EPSILON);
        assertEquals(0, layout.getX(1), EPSILON);
        assertEquals(2, layout.getX(2), EPSILON);
        assertEquals(-3, layout.getY(2), EPSILON);
    }

    @Test
    void testRandomTreesHaveNoOverlap() {
        Random random = new Random(21);
        for (int k = 0; k < 10; k++) {
            Graph tree = GraphGenerators.randomTree(40, random);
            int root = random.nextInt(40);
            Layout layout = new TreeLayout(new LayoutParameters()).run(tree, List.of(root));
            Traversal bfs = BreadthFirstSearch.run(tree, root);
            Map<Integer, List<Double>> levels = new TreeMap<>();
            for (int v = 0; v < 40; v++) {
                assertEquals(-bfs.getDepth(v), layout.getY(v), EPSILON);
                levels.computeIfAbsent(bfs.getDepth(v), d -> new ArrayList<>()).add(layout.getX(v));
            }
            // vertices of a level are at least one sibling separation apart
            for (List<Double> xs : levels.values()) {
                Collections.sort(xs);
                for (int i = 1; i < xs.size(); i++) {
                    assertTrue(xs.get(i) - xs.get(i - 1) >= 1 - EPSILON);
                }
            }
            // parents are centered above their extreme children
            for (int v = 0; v < 40; v++) {
                double min = Double.POSITIVE_INFINITY;
                double max = Double.NEGATIVE_INFINITY;
                for (int w : tree.getNeighbors(v)) {
                    if (bfs.getParent(w) == v) {
                        min = Math.min(min, layout.getX(w));
                        max = Math.max(max, layout.getX(w));
                    }
                }
                if (min <= max) {
                    assertEquals((min + max) / 2, layout.getX(v), EPSILON);
                }
            }
        }
    }

    @Test
    void testForest() {
        Graph forest = GraphFactory.create(5, false);
        forest.addEdge(0, 1);
        forest.addEdge(2, 3);
        forest.addEdge(3, 4);
        Layout layout = new TreeLayout(new LayoutParameters()).run(forest, List.of(1, 3));
        assertEquals(0, layout.getY(1), EPSILON);
        assertEquals(-1, layout.getY(0), EPSILON);
        assertEquals(0, layout.getY(3), EPSILON);
        for (int v = 2; v < 5; v++) {
            assertTrue(layout.getX(v) >= 1);
        }
        assertArrayEquals(new int[] {0, 2}, TreeLayout.resolveRoots(forest, List.of()));
    }

    @Test
    void testErrors() {
        TreeLayout treeLayout = new TreeLayout(new LayoutParameters());
        GraphException e1 = assertThrows(GraphException.class, () -> treeLayout.run(GraphGenerators.cycle(4)));
        assertEquals(GraphError.NOT_A_TREE, e1.getError());

        Graph forest = GraphFactory.create(4, false);
        forest.addEdge(0, 1);
        forest.addEdge(2, 3);
        GraphException e2 = assertThrows(GraphException.class, () -> treeLayout.run(forest, List.of(0)));
        assertEquals(GraphError.INVALID_NUMBER_OF_ROOTS, e2.getError());
        GraphException e3 = assertThrows(GraphException.class, () -> treeLayout.run(forest, List.of(0, 1)));
        assertEquals(GraphError.INVALID_ROOT, e3.getError());
        assertEquals(GraphError.Category.INFEASIBLE, e3.getCategory());
    }
}

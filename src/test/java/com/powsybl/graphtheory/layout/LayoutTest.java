/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

import com.powsybl.graphtheory.catalog.GraphGenerators;
import com.powsybl.graphtheory.graph.AttributeTags;
import com.powsybl.graphtheory.graph.AttributeValue;
import com.powsybl.graphtheory.graph.Graph;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl graph theory team
 */
class LayoutTest {

    private static final double EPSILON = 1e-9;

    @Test
    void testTransformations() {
        Layout layout = new Layout(2, 2);
        layout.setCoordinates(0, 1, 0);
        layout.setCoordinates(1, 3, 0);
        assertEquals(new Rectangle(1, 0, 2, 0), layout.getBoundingBox());

        layout.translate(-1, 2).scale(2);
        assertArrayEquals(new double[] {0, 4}, layout.getCoordinates(0), EPSILON);
        assertArrayEquals(new double[] {4, 4}, layout.getCoordinates(1), EPSILON);

        layout.rotate(Math.PI / 2);
        assertEquals(-4, layout.getX(1), EPSILON);
        assertEquals(4, layout.getY(1), EPSILON);

        assertThrows(IllegalArgumentException.class, () -> layout.setCoordinates(0, 1, 2, 3));
        assertThrows(IllegalArgumentException.class, () -> new Layout(3, 4));
    }

    @Test
    void testGetCoordinatesReturnsCopy() {
        Layout layout = new Layout(1, 3);
        layout.setCoordinates(0, 1, 2, 3);
        layout.getCoordinates(0)[0] = 10;
        assertEquals(1, layout.getX(0));
        assertEquals(3, layout.getDimension());
    }

    @Test
    void testAlignPrincipalAxis() {
        Layout layout = new Layout(3, 2);
        layout.setCoordinates(0, 0, 0);
        layout.setCoordinates(1, 1, 1);
        layout.setCoordinates(2, 2, 2);
        layout.alignPrincipalAxis();
        for (int v = 0; v < 3; v++) {
            assertEquals(1, layout.getY(v), EPSILON);
        }
        assertEquals(2 * Math.sqrt(2), layout.getBoundingBox().width(), EPSILON);
    }

    private static Layout rotatedSquare() {
        Layout layout = new Layout(4, 2);
        double[][] corners = {{1, 1}, {-1, 1}, {-1, -1}, {1, -1}};
        for (int v = 0; v < 4; v++) {
            layout.setCoordinates(v, corners[v]);
        }
        return layout.rotate(0.3).translate(3, -2);
    }

    @Test
    void testSymmetryAxis() {
        SymmetryAxis axis = SymmetryAxis.find(rotatedSquare(), 1e-6).orElseThrow();
        assertEquals(4, axis.mirroredVertexCount());
        assertEquals(3, axis.centerX(), EPSILON);
        assertEquals(-2, axis.centerY(), EPSILON);
        assertTrue(axis.angle() >= 0 && axis.angle() < Math.PI);

        // an isosceles triangle has a single axis, through its apex
        Layout triangle = new Layout(3, 2);
        triangle.setCoordinates(0, 0, 0);
        triangle.setCoordinates(1, 4, 0);
        triangle.setCoordinates(2, 2, 3);
        SymmetryAxis triangleAxis = SymmetryAxis.find(triangle, 1e-6).orElseThrow();
        assertEquals(3, triangleAxis.mirroredVertexCount());
        assertEquals(Math.PI / 2, triangleAxis.angle(), EPSILON);

        Layout irregular = new Layout(4, 2);
        irregular.setCoordinates(1, 1, 0);
        irregular.setCoordinates(2, 0, 3);
        irregular.setCoordinates(3, 5, 7);
        assertTrue(SymmetryAxis.find(irregular, 1e-6).isEmpty());
        assertTrue(SymmetryAxis.find(new Layout(1, 2), 1e-6).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> SymmetryAxis.find(irregular, 0));
    }

    @Test
    void testAlignSymmetryAxis() {
        Layout triangle = new Layout(3, 2);
        triangle.setCoordinates(0, 0, 0);
        triangle.setCoordinates(1, 4, 0);
        triangle.setCoordinates(2, 2, 3);
        triangle.rotate(1.1).alignSymmetryAxis(1e-6);
        // the base is horizontal again and the apex above its middle
        assertEquals(triangle.getY(0), triangle.getY(1), EPSILON);
        assertEquals((triangle.getX(0) + triangle.getX(1)) / 2, triangle.getX(2), EPSILON);

        Layout square = rotatedSquare().alignSymmetryAxis(1e-6);
        for (int v = 0; v < 4; v++) {
            double mirroredX = 6 - square.getX(v);
            double y = square.getY(v);
            boolean found = false;
            for (int w = 0; w < 4; w++) {
                found |= Math.abs(square.getX(w) - mirroredX) < EPSILON && Math.abs(square.getY(w) - y) < EPSILON;
            }
            assertTrue(found);
        }

        // without symmetry, the principal axis is aligned
        Layout line = new Layout(3, 2);
        line.setCoordinates(0, 0, 0);
        line.setCoordinates(1, 1, 1);
        line.setCoordinates(2, 3, 3);
        line.alignSymmetryAxis(1e-6);
        for (int v = 0; v < 3; v++) {
            assertEquals(4.0 / 3, line.getY(v), EPSILON);
        }
    }

    @Test
    void testApplyTo() {
        Graph g = GraphGenerators.path(2);
        Layout layout = new Layout(2, 2);
        layout.setCoordinates(1, 1.5, -2);
        layout.applyTo(g);
        assertEquals(AttributeValue.ofPoint(1.5, -2), g.getVertexAttribute(1, AttributeTags.POSITION).orElseThrow());
        assertEquals("1.5,-2.0", g.getVertexAttribute(1, "pos").orElseThrow().toString());
        assertThrows(IllegalArgumentException.class, () -> new Layout(3, 2).applyTo(g));
    }

    @Test
    void testRectangle() {
        Rectangle r = new Rectangle(0, 0, 2, 1);
        assertEquals(2, r.getArea());
        assertTrue(r.intersects(new Rectangle(1, 0.5, 2, 2)));
        assertFalse(r.intersects(new Rectangle(2, 0, 1, 1)));
        assertEquals(new Rectangle(0, 0, 4, 3), r.union(new Rectangle(3, 2, 1, 1)));
        assertThrows(IllegalArgumentException.class, () -> new Rectangle(0, 0, -1, 1));
    }

    @Test
    void testPacking() {
        Random random = new Random(9);
        List<Rectangle> rectangles = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            rectangles.add(new Rectangle(random.nextDouble() * 100, -random.nextDouble() * 100,
                    1 + random.nextDouble() * 10, random.nextInt(4) == 0 ? 0 : 1 + random.nextDouble() * 10));
        }
        double separation = 0.5;
        List<Rectangle> packed = RectanglePacker.pack(rectangles, separation);
        assertEquals(rectangles.size(), packed.size());
        double totalArea = 0;
        for (int i = 0; i < packed.size(); i++) {
            Rectangle p = packed.get(i);
            assertEquals(rectangles.get(i).width(), p.width());
            assertEquals(rectangles.get(i).height(), p.height());
            totalArea += p.getArea();
            for (int j = i + 1; j < packed.size(); j++) {
                Rectangle q = packed.get(j);
                double gapX = Math.max(q.x() - p.getMaxX(), p.x() - q.getMaxX());
                double gapY = Math.max(q.y() - p.getMaxY(), p.y() - q.getMaxY());
                assertTrue(Math.max(gapX, gapY) >= separation - 1e-9, "rectangles " + i + " and " + j + " are too close");
            }
        }
        Rectangle bounds = packed.stream().reduce(Rectangle::union).orElseThrow();
        // not optimal, but far from a single row
        assertTrue(bounds.getArea() < 10 * totalArea);
        assertEquals(0, bounds.x());
        assertEquals(0, bounds.y());
    }

    @Test
    void testPackingEdgeCases() {
        assertTrue(RectanglePacker.pack(List.of(), 1).isEmpty());
        List<Rectangle> points = RectanglePacker.pack(List.of(new Rectangle(5, 5, 0, 0), new Rectangle(7, 7, 0, 0)), 1);
        assertEquals(1, Math.hypot(points.get(0).x() - points.get(1).x(), points.get(0).y() - points.get(1).y()), EPSILON);
        assertThrows(IllegalArgumentException.class, () -> RectanglePacker.pack(List.of(), -1));
    }
}

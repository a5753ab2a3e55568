/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

import com.powsybl.graphtheory.graph.AttributeTags;
import com.powsybl.graphtheory.graph.AttributeValue;
import com.powsybl.graphtheory.graph.Graph;
import net.jafama.FastMath;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Vertex coordinates in 2 or 3 dimensions, indexed like the vertices of the graph they have been computed for.
 *
 * @author PowSyBl graph theory team
 */
public class Layout {

    private final double[][] coordinates;

    private final int dimension;

    public Layout(int vertexCount, int dimension) {
        if (dimension != 2 && dimension != 3) {
            throw new IllegalArgumentException("Invalid layout dimension: " + dimension);
        }
        this.dimension = dimension;
        this.coordinates = new double[vertexCount][dimension];
    }

    Layout(double[][] coordinates, int dimension) {
        this.coordinates = Objects.requireNonNull(coordinates);
        this.dimension = dimension;
    }

    public int getVertexCount() {
        return coordinates.length;
    }

    public int getDimension() {
        return dimension;
    }

    public double[] getCoordinates(int v) {
        return coordinates[v].clone();
    }

    public double getX(int v) {
        return coordinates[v][0];
    }

    public double getY(int v) {
        return coordinates[v][1];
    }

    public void setCoordinates(int v, double... point) {
        if (point.length != dimension) {
            throw new IllegalArgumentException("Expected " + dimension + " coordinates, got " + point.length);
        }
        System.arraycopy(point, 0, coordinates[v], 0, dimension);
    }

    double[][] getCoordinatesArray() {
        return coordinates;
    }

    /**
     * Bounding rectangle of the projection on the xy plane.
     */
    public Rectangle getBoundingBox() {
        if (coordinates.length == 0) {
            return new Rectangle(0, 0, 0, 0);
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (double[] p : coordinates) {
            minX = Math.min(minX, p[0]);
            minY = Math.min(minY, p[1]);
            maxX = Math.max(maxX, p[0]);
            maxY = Math.max(maxY, p[1]);
        }
        return new Rectangle(minX, minY, maxX - minX, maxY - minY);
    }

    public Layout translate(double... offset) {
        if (offset.length > dimension) {
            throw new IllegalArgumentException("Too many offset coordinates: " + offset.length);
        }
        for (double[] p : coordinates) {
            for (int d = 0; d < offset.length; d++) {
                p[d] += offset[d];
            }
        }
        return this;
    }

    public Layout scale(double factor) {
        for (double[] p : coordinates) {
            for (int d = 0; d < dimension; d++) {
                p[d] *= factor;
            }
        }
        return this;
    }

    /**
     * Rotate around the origin in the xy plane.
     */
    public Layout rotate(double angle) {
        double cos = FastMath.cos(angle);
        double sin = FastMath.sin(angle);
        for (double[] p : coordinates) {
            double x = p[0];
            double y = p[1];
            p[0] = cos * x - sin * y;
            p[1] = sin * x + cos * y;
        }
        return this;
    }

    /**
     * Rotate around the centroid so that the principal axis of the point cloud is horizontal.
     */
    public Layout alignPrincipalAxis() {
        int n = coordinates.length;
        if (n < 2) {
            return this;
        }
        double cx = 0;
        double cy = 0;
        for (double[] p : coordinates) {
            cx += p[0];
            cy += p[1];
        }
        cx /= n;
        cy /= n;
        double sxx = 0;
        double syy = 0;
        double sxy = 0;
        for (double[] p : coordinates) {
            double dx = p[0] - cx;
            double dy = p[1] - cy;
            sxx += dx * dx;
            syy += dy * dy;
            sxy += dx * dy;
        }
        double angle = 0.5 * FastMath.atan2(2 * sxy, sxx - syy);
        return translate(-cx, -cy).rotate(-angle).translate(cx, cy);
    }

    /**
     * Rotate around the centroid so that a mirror symmetry axis is vertical, if one maps at least half of the
     * vertices onto vertices. Otherwise, align the principal axis.
     */
    public Layout alignSymmetryAxis(double tolerance) {
        Optional<SymmetryAxis> axis = SymmetryAxis.find(this, tolerance)
                .filter(a -> 2 * a.mirroredVertexCount() >= coordinates.length);
        if (axis.isEmpty()) {
            return alignPrincipalAxis();
        }
        SymmetryAxis a = axis.get();
        return translate(-a.centerX(), -a.centerY()).rotate(Math.PI / 2 - a.angle()).translate(a.centerX(), a.centerY());
    }

    /**
     * Store each vertex position as the {@link AttributeTags#POSITION} attribute of the vertex with the same index.
     */
    public void applyTo(Graph graph) {
        Objects.requireNonNull(graph);
        if (graph.getVertexCount() != coordinates.length) {
            throw new IllegalArgumentException("Layout of " + coordinates.length + " vertices cannot be applied to a graph of "
                    + graph.getVertexCount() + " vertices");
        }
        for (int v = 0; v < coordinates.length; v++) {
            graph.setVertexAttribute(v, AttributeTags.POSITION, AttributeValue.ofPoint(coordinates[v].clone()));
        }
    }

    @Override
    public String toString() {
        return "Layout(dimension=" + dimension + ", coordinates=" + Arrays.deepToString(coordinates) + ")";
    }
}

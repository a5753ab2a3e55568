/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TLongObjectHashMap;
import net.jafama.FastMath;

import java.util.Objects;
import java.util.Optional;

/**
 * Mirror symmetry axis of a drawing, in the xy plane.
 * <p>
 * The axis goes through the centroid of the vertices. Candidates are the perpendicular bisectors of vertex pairs that
 * pass through the centroid, and each candidate is scored by the number of vertices whose mirror image coincides with
 * a vertex, up to the tolerance. Vertices lying on the axis are their own image.
 *
 * @param centerX            x of the centroid
 * @param centerY            y of the centroid
 * @param angle              direction of the axis, in [0, pi)
 * @param mirroredVertexCount number of vertices having a mirror image
 *
 * @author PowSyBl graph theory team
 */
public record SymmetryAxis(double centerX, double centerY, double angle, int mirroredVertexCount) {

    private static final double ANGLE_EPSILON = 1e-9;

    public static Optional<SymmetryAxis> find(Layout layout, double tolerance) {
        Objects.requireNonNull(layout);
        if (tolerance <= 0) {
            throw new IllegalArgumentException("Invalid tolerance: " + tolerance);
        }
        int n = layout.getVertexCount();
        if (n < 2) {
            return Optional.empty();
        }
        double[][] p = layout.getCoordinatesArray();
        double cx = 0;
        double cy = 0;
        for (double[] q : p) {
            cx += q[0] / n;
            cy += q[1] / n;
        }

        TDoubleArrayList candidates = new TDoubleArrayList();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double dx = p[j][0] - p[i][0];
                double dy = p[j][1] - p[i][1];
                double length = Math.hypot(dx, dy);
                if (length <= tolerance) {
                    continue;
                }
                double mx = (p[i][0] + p[j][0]) / 2 - cx;
                double my = (p[i][1] + p[j][1]) / 2 - cy;
                if (Math.abs(mx * dx + my * dy) / length <= tolerance) {
                    double angle = FastMath.atan2(dy, dx) + Math.PI / 2;
                    candidates.add(normalize(angle));
                }
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        candidates.sort();

        TLongObjectHashMap<TIntArrayList> grid = new TLongObjectHashMap<>();
        for (int v = 0; v < n; v++) {
            long key = cellKey((long) Math.floor(p[v][0] / tolerance), (long) Math.floor(p[v][1] / tolerance));
            TIntArrayList cell = grid.get(key);
            if (cell == null) {
                cell = new TIntArrayList(1);
                grid.put(key, cell);
            }
            cell.add(v);
        }

        SymmetryAxis best = null;
        double previous = Double.NaN;
        for (int k = 0; k < candidates.size(); k++) {
            double angle = candidates.get(k);
            if (angle - previous < ANGLE_EPSILON) {
                continue;
            }
            previous = angle;
            int count = countMirrored(p, grid, cx, cy, angle, tolerance);
            if (best == null || count > best.mirroredVertexCount()) {
                best = new SymmetryAxis(cx, cy, angle, count);
            }
        }
        return Optional.of(best);
    }

    private static double normalize(double angle) {
        double a = angle % Math.PI;
        return a < 0 ? a + Math.PI : a;
    }

    private static long cellKey(long i, long j) {
        return i * 73856093L ^ j * 19349663L;
    }

    private static int countMirrored(double[][] p, TLongObjectHashMap<TIntArrayList> grid, double cx, double cy,
                                     double angle, double tolerance) {
        double ux = FastMath.cos(angle);
        double uy = FastMath.sin(angle);
        int count = 0;
        for (double[] q : p) {
            double dx = q[0] - cx;
            double dy = q[1] - cy;
            double dot = dx * ux + dy * uy;
            double rx = cx + 2 * dot * ux - dx;
            double ry = cy + 2 * dot * uy - dy;
            if (hasVertexNear(p, grid, rx, ry, tolerance)) {
                count++;
            }
        }
        return count;
    }

    private static boolean hasVertexNear(double[][] p, TLongObjectHashMap<TIntArrayList> grid, double x, double y, double tolerance) {
        long i = (long) Math.floor(x / tolerance);
        long j = (long) Math.floor(y / tolerance);
        for (long di = -1; di <= 1; di++) {
            for (long dj = -1; dj <= 1; dj++) {
                TIntArrayList cell = grid.get(cellKey(i + di, j + dj));
                if (cell != null) {
                    for (int k = 0; k < cell.size(); k++) {
                        double[] q = p[cell.get(k)];
                        if (Math.hypot(q[0] - x, q[1] - y) <= tolerance) {
                            return true;
                        }
                    }
                }
            }
        }
        return false;
    }
}

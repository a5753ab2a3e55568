/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

import java.util.*;

/**
 * Greedy packing of rectangles in the plane.
 * <p>
 * Rectangles are placed one at a time, largest area first. The candidate positions of a rectangle are the corners
 * to the right of and above the rectangles already placed. The chosen candidate is the one that does not overlap any
 * placed rectangle and gives the smallest bounding box area, ties being broken in favor of the squarest bounding box.
 *
 * @author PowSyBl graph theory team
 */
public final class RectanglePacker {

    private RectanglePacker() {
    }

    /**
     * @param rectangles rectangles to pack, only their size is used
     * @param separation minimum gap between two packed rectangles
     * @return packed rectangles, in the order of the input
     */
    public static List<Rectangle> pack(List<Rectangle> rectangles, double separation) {
        Objects.requireNonNull(rectangles);
        if (separation < 0) {
            throw new IllegalArgumentException("Negative separation: " + separation);
        }
        int count = rectangles.size();
        Integer[] order = new Integer[count];
        for (int i = 0; i < count; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> rectangles.get(i).getArea()).reversed()
                .thenComparingInt(i -> i));

        Rectangle[] packed = new Rectangle[count];
        List<Rectangle> occupied = new ArrayList<>(count);
        List<double[]> candidates = new ArrayList<>();
        candidates.add(new double[] {0, 0});
        Rectangle bounds = null;
        for (int i : order) {
            Rectangle r = rectangles.get(i);
            Rectangle best = null;
            double bestArea = Double.POSITIVE_INFINITY;
            double bestSide = Double.POSITIVE_INFINITY;
            for (double[] c : candidates) {
                Rectangle placed = r.moveTo(c[0], c[1]);
                Rectangle grown = grow(placed, separation);
                if (occupied.stream().anyMatch(grown::intersects)) {
                    continue;
                }
                Rectangle newBounds = bounds == null ? placed : bounds.union(placed);
                double area = newBounds.getArea();
                double side = Math.max(newBounds.width(), newBounds.height());
                if (area < bestArea || area == bestArea && side < bestSide) {
                    best = placed;
                    bestArea = area;
                    bestSide = side;
                }
            }
            if (best == null) {
                // cannot happen, the corner right of the bounding box is always free
                throw new IllegalStateException("No position found for rectangle " + r);
            }
            packed[i] = best;
            occupied.add(best);
            bounds = bounds == null ? best : bounds.union(best);
            candidates.add(new double[] {best.getMaxX() + separation, best.y()});
            candidates.add(new double[] {best.x(), best.getMaxY() + separation});
            candidates.add(new double[] {bounds.getMaxX() + separation, bounds.y()});
        }
        return Arrays.asList(packed);
    }

    /**
     * Rectangle grown by slightly less than the separation on every side, so that it intersects the rectangles closer
     * than the separation, degenerate ones included.
     */
    private static Rectangle grow(Rectangle r, double separation) {
        double margin = Math.max(separation - 1e-9, 0);
        return new Rectangle(r.x() - margin, r.y() - margin, r.width() + 2 * margin, r.height() + 2 * margin);
    }
}

/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

/**
 * Axis aligned rectangle, given by its lower left corner and its size.
 *
 * @author PowSyBl graph theory team
 */
public record Rectangle(double x, double y, double width, double height) {

    public Rectangle {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative rectangle size: " + width + "x" + height);
        }
    }

    public double getMaxX() {
        return x + width;
    }

    public double getMaxY() {
        return y + height;
    }

    public double getArea() {
        return width * height;
    }

    public Rectangle moveTo(double newX, double newY) {
        return new Rectangle(newX, newY, width, height);
    }

    /**
     * Interiors overlap. Rectangles sharing only a side do not intersect.
     */
    public boolean intersects(Rectangle other) {
        return x < other.getMaxX() && other.x < getMaxX() && y < other.getMaxY() && other.y < getMaxY();
    }

    public Rectangle union(Rectangle other) {
        double minX = Math.min(x, other.x);
        double minY = Math.min(y, other.y);
        return new Rectangle(minX, minY, Math.max(getMaxX(), other.getMaxX()) - minX,
                Math.max(getMaxY(), other.getMaxY()) - minY);
    }
}

/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.graph;

import com.powsybl.commons.PowsyblException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable value stored in graph, vertex and edge attribute maps: a number, a string, a point or a boolean.
 *
 * @author PowSyBl graph theory team
 */
public final class AttributeValue {

    public enum Type {
        NUMBER,
        STRING,
        POINT,
        BOOLEAN
    }

    public static final AttributeValue TRUE = new AttributeValue(Type.BOOLEAN, Boolean.TRUE);

    public static final AttributeValue FALSE = new AttributeValue(Type.BOOLEAN, Boolean.FALSE);

    private final Type type;

    private final Object value;

    private AttributeValue(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static AttributeValue of(double number) {
        return new AttributeValue(Type.NUMBER, number);
    }

    public static AttributeValue of(String str) {
        return new AttributeValue(Type.STRING, Objects.requireNonNull(str));
    }

    public static AttributeValue of(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static AttributeValue ofPoint(double... coordinates) {
        Objects.requireNonNull(coordinates);
        if (coordinates.length < 2 || coordinates.length > 3) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "a point has 2 or 3 coordinates, got " + coordinates.length);
        }
        return new AttributeValue(Type.POINT, coordinates.clone());
    }

    /**
     * Convert a raw text (as found in a dot attribute list) to the most specific value type.
     */
    public static AttributeValue parse(String text) {
        Objects.requireNonNull(text);
        if ("true".equals(text)) {
            return TRUE;
        }
        if ("false".equals(text)) {
            return FALSE;
        }
        try {
            return of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return of(text);
        }
    }

    public Type getType() {
        return type;
    }

    public boolean isNumber() {
        return type == Type.NUMBER;
    }

    public double asNumber() {
        checkType(Type.NUMBER);
        return (Double) value;
    }

    public String asString() {
        checkType(Type.STRING);
        return (String) value;
    }

    public boolean asBoolean() {
        checkType(Type.BOOLEAN);
        return (Boolean) value;
    }

    public double[] asPoint() {
        checkType(Type.POINT);
        return ((double[]) value).clone();
    }

    private void checkType(Type expected) {
        if (type != expected) {
            throw new PowsyblException("Attribute value " + this + " is not of type " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeValue)) {
            return false;
        }
        AttributeValue other = (AttributeValue) o;
        if (type != other.type) {
            return false;
        }
        return type == Type.POINT ? Arrays.equals((double[]) value, (double[]) other.value) : value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + (type == Type.POINT ? Arrays.hashCode((double[]) value) : value.hashCode());
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                double d = (Double) value;
                if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                    return Long.toString((long) d);
                }
                return String.format(Locale.US, "%s", d);
            case POINT:
                double[] p = (double[]) value;
                StringBuilder builder = new StringBuilder();
                for (int i = 0; i < p.length; i++) {
                    if (i > 0) {
                        builder.append(',');
                    }
                    builder.append(p[i]);
                }
                return builder.toString();
            default:
                return value.toString();
        }
    }
}

/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.graph;

/**
 * A pair of vertex indices. For undirected graphs, edges are normalized so that {@code source < target}.
 *
 * @author PowSyBl graph theory team
 */
public record Edge(int source, int target) {

    public static Edge undirected(int i, int j) {
        return i < j ? new Edge(i, j) : new Edge(j, i);
    }

    public Edge reversed() {
        return new Edge(target, source);
    }

    public boolean isIncidentTo(int v) {
        return source == v || target == v;
    }

    public int opposite(int v) {
        if (v == source) {
            return target;
        }
        if (v == target) {
            return source;
        }
        throw new IllegalArgumentException("Vertex " + v + " is not an end of " + this);
    }

    @Override
    public String toString() {
        return "(" + source + ", " + target + ")";
    }
}

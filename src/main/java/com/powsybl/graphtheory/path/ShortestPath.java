/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.path;

import java.util.List;

/**
 * A shortest path between two vertices.
 *
 * @param source   start vertex
 * @param target   end vertex
 * @param distance sum of the edge weights along the path, {@link Double#POSITIVE_INFINITY} if target is unreachable
 * @param vertices path vertices from source to target, empty if target is unreachable
 *
 * @author PowSyBl graph theory team
 */
public record ShortestPath(int source, int target, double distance, List<Integer> vertices) {

    public ShortestPath {
        vertices = List.copyOf(vertices);
    }

    static ShortestPath unreachable(int source, int target) {
        return new ShortestPath(source, target, Double.POSITIVE_INFINITY, List.of());
    }

    public boolean isReachable() {
        return !vertices.isEmpty();
    }
}

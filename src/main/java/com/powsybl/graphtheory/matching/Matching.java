/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.matching;

import com.powsybl.graphtheory.graph.Edge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A set of edges without common vertex, stored as the mate of each vertex.
 *
 * @author PowSyBl graph theory team
 */
public class Matching {

    public static final int UNMATCHED = -1;

    private final int[] mates;

    Matching(int[] mates) {
        this.mates = Objects.requireNonNull(mates);
    }

    public int getMate(int v) {
        return mates[v];
    }

    public boolean isMatched(int v) {
        return mates[v] != UNMATCHED;
    }

    public int getSize() {
        return (int) Arrays.stream(mates).filter(m -> m != UNMATCHED).count() / 2;
    }

    /**
     * Matched edges, each one from its smaller vertex, sorted by source.
     */
    public List<Edge> getEdges() {
        List<Edge> edges = new ArrayList<>();
        for (int v = 0; v < mates.length; v++) {
            if (mates[v] > v) {
                edges.add(new Edge(v, mates[v]));
            }
        }
        return edges;
    }

    @Override
    public String toString() {
        return "Matching(" + getEdges() + ")";
    }
}

/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.graph;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Vertex record: a label, its own attributes and the attributes of the edges leaving it, keyed by neighbor index.
 * Neighbors are kept sorted by index.
 *
 * @author PowSyBl graph theory team
 */
class Vertex {

    private String label;

    private final Map<Integer, AttributeValue> attributes = new TreeMap<>();

    private final TreeMap<Integer, Map<Integer, AttributeValue>> neighbors = new TreeMap<>();

    Vertex(String label) {
        this.label = Objects.requireNonNull(label);
    }

    String getLabel() {
        return label;
    }

    void setLabel(String label) {
        this.label = Objects.requireNonNull(label);
    }

    Map<Integer, AttributeValue> getAttributes() {
        return attributes;
    }

    TreeMap<Integer, Map<Integer, AttributeValue>> getNeighbors() {
        return neighbors;
    }

    boolean hasNeighbor(int i) {
        return neighbors.containsKey(i);
    }

    void addNeighbor(int i, Map<Integer, AttributeValue> edgeAttributes) {
        neighbors.put(i, edgeAttributes);
    }

    Map<Integer, AttributeValue> removeNeighbor(int i) {
        return neighbors.remove(i);
    }

    Map<Integer, AttributeValue> getEdgeAttributes(int i) {
        return neighbors.get(i);
    }

    int[] getNeighborIndices() {
        int[] result = new int[neighbors.size()];
        int k = 0;
        for (int j : neighbors.keySet()) {
            result[k++] = j;
        }
        return result;
    }

    @Override
    public String toString() {
        return label;
    }
}

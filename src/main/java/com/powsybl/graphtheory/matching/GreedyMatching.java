/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.matching;

import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Maximal matching and maximal independent set, built greedily.
 *
 * @author PowSyBl graph theory team
 */
public final class GreedyMatching {

    private GreedyMatching() {
    }

    /**
     * Maximal matching: vertices are visited by index and each unmatched vertex is matched with its first unmatched
     * neighbor.
     */
    public static Matching find(Graph graph) {
        checkUndirected(graph);
        int n = graph.getVertexCount();
        int[] mates = new int[n];
        Arrays.fill(mates, Matching.UNMATCHED);
        for (int v = 0; v < n; v++) {
            if (mates[v] != Matching.UNMATCHED) {
                continue;
            }
            for (int w : graph.getNeighbors(v)) {
                if (mates[w] == Matching.UNMATCHED) {
                    mates[v] = w;
                    mates[w] = v;
                    break;
                }
            }
        }
        return new Matching(mates);
    }

    /**
     * Maximal independent set: vertices are visited by increasing degree and kept when none of their neighbors has
     * been kept.
     *
     * @return the kept vertices, sorted
     */
    public static int[] findMaximalIndependentSet(Graph graph) {
        checkUndirected(graph);
        int n = graph.getVertexCount();
        Integer[] order = new Integer[n];
        for (int v = 0; v < n; v++) {
            order[v] = v;
        }
        Arrays.sort(order, (v, w) -> graph.getDegree(v) != graph.getDegree(w)
                ? Integer.compare(graph.getDegree(v), graph.getDegree(w)) : Integer.compare(v, w));
        boolean[] excluded = new boolean[n];
        boolean[] kept = new boolean[n];
        for (int v : order) {
            if (!excluded[v]) {
                kept[v] = true;
                excluded[v] = true;
                for (int w : graph.getNeighbors(v)) {
                    excluded[w] = true;
                }
            }
        }
        return IntStream.range(0, n).filter(v -> kept[v]).toArray();
    }

    static void checkUndirected(Graph graph) {
        Objects.requireNonNull(graph);
        if (graph.isDirected()) {
            throw new GraphException(GraphError.UNDIRECTED_GRAPH_REQUIRED);
        }
    }
}

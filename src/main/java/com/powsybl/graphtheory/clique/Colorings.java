/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.clique;

import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphTransforms;

import java.util.List;

/**
 * Coloring and independence through the complement graph: a clique of the complement is an independent set, and a
 * clique cover of the complement is a proper coloring.
 * <p>
 * Since clique covers are built greedily, the chromatic number is an upper bound, exact on many small graphs but not
 * guaranteed in general.
 *
 * @author PowSyBl graph theory team
 */
public final class Colorings {

    private Colorings() {
    }

    /**
     * Vertex coloring, colors being numbered from 0.
     */
    public static int[] getColoring(Graph graph) {
        CliqueCover cover = CliqueCover.find(GraphTransforms.complement(GraphTransforms.underlying(graph)));
        int[] colors = new int[graph.getVertexCount()];
        List<List<Integer>> classes = cover.getCliques();
        for (int c = 0; c < classes.size(); c++) {
            for (int v : classes.get(c)) {
                colors[v] = c;
            }
        }
        return colors;
    }

    public static int getChromaticNumber(Graph graph) {
        return CliqueCover.find(GraphTransforms.complement(GraphTransforms.underlying(graph))).size();
    }

    public static int getCliqueCoverNumber(Graph graph) {
        return CliqueCover.find(GraphTransforms.underlying(graph)).size();
    }

    /**
     * A largest set of pairwise non adjacent vertices, sorted.
     */
    public static List<Integer> findMaximumIndependentSet(Graph graph) {
        return CliqueFinder.findMaximumClique(GraphTransforms.complement(GraphTransforms.underlying(graph)));
    }

    public static int getIndependenceNumber(Graph graph) {
        return findMaximumIndependentSet(graph).size();
    }
}

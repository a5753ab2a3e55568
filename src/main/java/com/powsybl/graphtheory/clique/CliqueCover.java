/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.clique;

import com.powsybl.graphtheory.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * Partition of the vertices into cliques, built greedily by repeatedly removing a maximum clique of the remaining
 * vertices. The partition is not minimum in general.
 * <p>
 * The number of cliques may be capped: a cover that would need more cliques than the cap is unsuccessful, and only
 * holds the cliques found before the cap was reached.
 *
 * @author PowSyBl graph theory team
 */
public final class CliqueCover {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliqueCover.class);

    public static final int NO_LIMIT = 0;

    private final List<List<Integer>> cliques;

    private final boolean successful;

    private CliqueCover(List<List<Integer>> cliques, boolean successful) {
        this.cliques = Collections.unmodifiableList(cliques);
        this.successful = successful;
    }

    public static CliqueCover find(Graph graph) {
        return find(graph, NO_LIMIT);
    }

    /**
     * @param maxCliques maximum number of cliques, or {@link #NO_LIMIT}
     */
    public static CliqueCover find(Graph graph, int maxCliques) {
        if (maxCliques < 0) {
            throw new IllegalArgumentException("Invalid maximum number of cliques: " + maxCliques);
        }
        BitSet[] neighbors = CliqueFinder.toBitSets(graph);
        BitSet remaining = new BitSet(neighbors.length);
        remaining.set(0, neighbors.length);
        List<List<Integer>> cliques = new ArrayList<>();
        while (!remaining.isEmpty()) {
            if (maxCliques != NO_LIMIT && cliques.size() == maxCliques) {
                LOGGER.debug("Clique cover stopped at {} cliques, {} vertices left uncovered", maxCliques, remaining.cardinality());
                return new CliqueCover(cliques, false);
            }
            BitSet clique = CliqueFinder.findMaximumClique(neighbors, remaining);
            List<Integer> list = new ArrayList<>(clique.cardinality());
            clique.stream().forEach(list::add);
            cliques.add(Collections.unmodifiableList(list));
            remaining.andNot(clique);
        }
        return new CliqueCover(cliques, true);
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * Cliques of the cover, in the order they have been removed, each one sorted.
     */
    public List<List<Integer>> getCliques() {
        return cliques;
    }

    public int size() {
        return cliques.size();
    }

    @Override
    public String toString() {
        return "CliqueCover(successful=" + successful + ", cliques=" + cliques + ")";
    }
}

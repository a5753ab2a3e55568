/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.clique;

import com.google.common.base.Stopwatch;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.util.Markers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Clique enumeration by the Bron-Kerbosch algorithm with the pivoting rule of Tomita, Tanaka and Takahashi.
 * <p>
 * A search state is a clique R, the candidates P that extend it and the excluded vertices X that extend it but have
 * already been explored. The pivot is the vertex of P ∪ X with the most neighbors in P, and only the candidates not
 * adjacent to the pivot are branched on. Worst case running time is O(3^(n/3)).
 *
 * @author PowSyBl graph theory team
 */
public final class CliqueFinder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliqueFinder.class);

    private final BitSet[] neighbors;

    private final Consumer<BitSet> cliqueConsumer;

    /**
     * Size a branch must beat to be explored, cliques not larger than it being ignored.
     */
    private int bound;

    private CliqueFinder(BitSet[] neighbors, Consumer<BitSet> cliqueConsumer, int bound) {
        this.neighbors = neighbors;
        this.cliqueConsumer = cliqueConsumer;
        this.bound = bound;
    }

    static BitSet[] toBitSets(Graph graph) {
        Objects.requireNonNull(graph);
        if (graph.isDirected()) {
            throw new GraphException(GraphError.UNDIRECTED_GRAPH_REQUIRED);
        }
        int n = graph.getVertexCount();
        BitSet[] neighbors = new BitSet[n];
        for (int v = 0; v < n; v++) {
            neighbors[v] = new BitSet(n);
            for (int w : graph.getNeighbors(v)) {
                neighbors[v].set(w);
            }
        }
        return neighbors;
    }

    private static List<Integer> toList(BitSet set) {
        List<Integer> list = new ArrayList<>(set.cardinality());
        set.stream().forEach(list::add);
        return list;
    }

    /**
     * All maximal cliques, each one sorted.
     */
    public static List<List<Integer>> findMaximalCliques(Graph graph) {
        BitSet[] neighbors = toBitSets(graph);
        Stopwatch stopwatch = Stopwatch.createStarted();

        List<List<Integer>> cliques = new ArrayList<>();
        int n = neighbors.length;
        if (n > 0) {
            BitSet candidates = new BitSet(n);
            candidates.set(0, n);
            new CliqueFinder(neighbors, clique -> cliques.add(toList(clique)), 0)
                    .expand(new BitSet(n), candidates, new BitSet(n));
        }

        stopwatch.stop();
        LOGGER.debug(Markers.PERFORMANCE_MARKER, "{} maximal cliques found in {} ms", cliques.size(),
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return cliques;
    }

    /**
     * A largest clique, sorted, empty for the empty graph.
     */
    public static List<Integer> findMaximumClique(Graph graph) {
        BitSet[] neighbors = toBitSets(graph);
        BitSet all = new BitSet(neighbors.length);
        all.set(0, neighbors.length);
        return toList(findMaximumClique(neighbors, all));
    }

    /**
     * A largest clique among the given vertices.
     */
    static BitSet findMaximumClique(BitSet[] neighbors, BitSet vertices) {
        BitSet best = new BitSet(neighbors.length);
        if (vertices.isEmpty()) {
            return best;
        }
        CliqueFinder[] finder = new CliqueFinder[1];
        finder[0] = new CliqueFinder(neighbors, clique -> {
            if (clique.cardinality() > best.cardinality()) {
                best.clear();
                best.or(clique);
                finder[0].bound = clique.cardinality();
            }
        }, 0);
        finder[0].expand(new BitSet(neighbors.length), (BitSet) vertices.clone(), new BitSet(neighbors.length));
        return best;
    }

    public static int getCliqueNumber(Graph graph) {
        return findMaximumClique(graph).size();
    }

    public static boolean isClique(Graph graph, Collection<Integer> vertices) {
        Objects.requireNonNull(graph);
        List<Integer> list = new ArrayList<>(new LinkedHashSet<>(Objects.requireNonNull(vertices)));
        for (int i = 0; i < list.size(); i++) {
            for (int j = i + 1; j < list.size(); j++) {
                if (!graph.hasEdge(list.get(i), list.get(j))) {
                    return false;
                }
            }
        }
        return true;
    }

    private void expand(BitSet clique, BitSet candidates, BitSet excluded) {
        if (candidates.isEmpty()) {
            if (excluded.isEmpty()) {
                cliqueConsumer.accept(clique);
            }
            return;
        }
        if (clique.cardinality() + candidates.cardinality() <= bound) {
            return;
        }
        int pivot = choosePivot(candidates, excluded);
        BitSet branches = (BitSet) candidates.clone();
        branches.andNot(neighbors[pivot]);
        for (int v = branches.nextSetBit(0); v >= 0; v = branches.nextSetBit(v + 1)) {
            BitSet newCandidates = (BitSet) candidates.clone();
            newCandidates.and(neighbors[v]);
            BitSet newExcluded = (BitSet) excluded.clone();
            newExcluded.and(neighbors[v]);
            clique.set(v);
            expand(clique, newCandidates, newExcluded);
            clique.clear(v);
            candidates.clear(v);
            excluded.set(v);
        }
    }

    private int choosePivot(BitSet candidates, BitSet excluded) {
        BitSet union = (BitSet) candidates.clone();
        union.or(excluded);
        int pivot = -1;
        int max = -1;
        for (int u = union.nextSetBit(0); u >= 0; u = union.nextSetBit(u + 1)) {
            BitSet common = (BitSet) candidates.clone();
            common.and(neighbors[u]);
            int count = common.cardinality();
            if (count > max) {
                max = count;
                pivot = u;
            }
        }
        return pivot;
    }
}

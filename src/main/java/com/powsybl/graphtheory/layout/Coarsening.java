/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;

import java.util.*;

/**
 * Builds a smaller graph approximating the structure of a graph.
 *
 * @author PowSyBl graph theory team
 */
public final class Coarsening {

    private Coarsening() {
    }

    public static CoarseLevel coarsen(int[][] adjacency, CoarseningMethod method) {
        Objects.requireNonNull(adjacency);
        Objects.requireNonNull(method);
        return switch (method) {
            case MIS -> coarsenByIndependentSet(adjacency);
            case EDGE_CONTRACTION -> coarsenByEdgeContraction(adjacency);
        };
    }

    /**
     * Coarse vertices are the vertices of a greedy maximal independent set, lowest degrees first. A vertex out of the
     * set is placed at the barycenter of its neighbors in the set. Two coarse vertices are adjacent when an edge
     * joins two vertices they contribute to.
     */
    static CoarseLevel coarsenByIndependentSet(int[][] adjacency) {
        int n = adjacency.length;
        Integer[] order = byIncreasingDegree(adjacency);
        int[] coarseIndex = new int[n];
        Arrays.fill(coarseIndex, -1);
        boolean[] blocked = new boolean[n];
        int m = 0;
        for (int v : order) {
            if (!blocked[v]) {
                coarseIndex[v] = m++;
                blocked[v] = true;
                for (int w : adjacency[v]) {
                    blocked[w] = true;
                }
            }
        }
        TIntArrayList[] parents = new TIntArrayList[n];
        TDoubleArrayList[] weights = new TDoubleArrayList[n];
        for (int v = 0; v < n; v++) {
            parents[v] = new TIntArrayList();
            if (coarseIndex[v] >= 0) {
                parents[v].add(coarseIndex[v]);
            } else {
                for (int w : adjacency[v]) {
                    if (coarseIndex[w] >= 0) {
                        parents[v].add(coarseIndex[w]);
                    }
                }
            }
            weights[v] = new TDoubleArrayList(parents[v].size());
            for (int k = 0; k < parents[v].size(); k++) {
                weights[v].add(1.0 / parents[v].size());
            }
        }
        List<Set<Integer>> coarseNeighbors = newNeighborSets(m);
        for (int v = 0; v < n; v++) {
            for (int w : adjacency[v]) {
                for (int a = 0; a < parents[v].size(); a++) {
                    for (int b = 0; b < parents[w].size(); b++) {
                        int c1 = parents[v].get(a);
                        int c2 = parents[w].get(b);
                        if (c1 != c2) {
                            coarseNeighbors.get(c1).add(c2);
                            coarseNeighbors.get(c2).add(c1);
                        }
                    }
                }
            }
        }
        return new CoarseLevel(toAdjacency(coarseNeighbors), parents, weights);
    }

    /**
     * Coarse vertices are the edges of a greedy maximal matching, each vertex being matched with its unmatched
     * neighbor of lowest degree, and the vertices left unmatched.
     */
    static CoarseLevel coarsenByEdgeContraction(int[][] adjacency) {
        int n = adjacency.length;
        Integer[] order = byIncreasingDegree(adjacency);
        int[] coarseIndex = new int[n];
        Arrays.fill(coarseIndex, -1);
        int m = 0;
        for (int v : order) {
            if (coarseIndex[v] >= 0) {
                continue;
            }
            int mate = -1;
            for (int w : adjacency[v]) {
                if (coarseIndex[w] < 0 && (mate < 0 || adjacency[w].length < adjacency[mate].length)) {
                    mate = w;
                }
            }
            coarseIndex[v] = m;
            if (mate >= 0) {
                coarseIndex[mate] = m;
            }
            m++;
        }
        TIntArrayList[] parents = new TIntArrayList[n];
        TDoubleArrayList[] weights = new TDoubleArrayList[n];
        List<Set<Integer>> coarseNeighbors = newNeighborSets(m);
        for (int v = 0; v < n; v++) {
            parents[v] = new TIntArrayList(new int[] {coarseIndex[v]});
            weights[v] = new TDoubleArrayList(new double[] {1});
            for (int w : adjacency[v]) {
                if (coarseIndex[w] != coarseIndex[v]) {
                    coarseNeighbors.get(coarseIndex[v]).add(coarseIndex[w]);
                }
            }
        }
        return new CoarseLevel(toAdjacency(coarseNeighbors), parents, weights);
    }

    private static Integer[] byIncreasingDegree(int[][] adjacency) {
        Integer[] order = new Integer[adjacency.length];
        for (int v = 0; v < order.length; v++) {
            order[v] = v;
        }
        Arrays.sort(order, Comparator.comparingInt((Integer v) -> adjacency[v].length).thenComparingInt(v -> v));
        return order;
    }

    private static List<Set<Integer>> newNeighborSets(int m) {
        List<Set<Integer>> sets = new ArrayList<>(m);
        for (int c = 0; c < m; c++) {
            sets.add(new TreeSet<>());
        }
        return sets;
    }

    private static int[][] toAdjacency(List<Set<Integer>> neighbors) {
        int[][] adjacency = new int[neighbors.size()][];
        for (int c = 0; c < adjacency.length; c++) {
            adjacency[c] = neighbors.get(c).stream().mapToInt(Integer::intValue).toArray();
        }
        return adjacency;
    }
}

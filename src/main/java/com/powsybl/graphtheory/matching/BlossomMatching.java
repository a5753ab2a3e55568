/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.matching;

import com.google.common.base.Stopwatch;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.util.Markers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * Maximum cardinality matching of an undirected unweighted graph, by the blossom algorithm of Edmonds.
 * <p>
 * Starting from a greedy maximal matching, an alternating tree is grown by breadth first search from each unmatched
 * vertex. When the search closes an odd cycle, the cycle is contracted by giving all its vertices the same base, and
 * the search goes on with the contracted vertices in the queue. When an unmatched vertex is reached, the augmenting
 * path is followed back through the tree parents and the matching grows by one edge. Contractions are undone by
 * resetting the bases before the next search. The algorithm runs in O(V³).
 *
 * @author PowSyBl graph theory team
 */
public final class BlossomMatching {

    private static final Logger LOGGER = LoggerFactory.getLogger(BlossomMatching.class);

    private final int[][] adjacency;
    private final int[] mate;
    private final int[] parent;
    private final int[] base;
    private final boolean[] inTree;
    private final boolean[] inBlossom;
    private final int[] queue;
    private int queueHead;
    private int queueTail;

    private BlossomMatching(int[][] adjacency, int[] mate) {
        this.adjacency = adjacency;
        this.mate = mate;
        int n = adjacency.length;
        parent = new int[n];
        base = new int[n];
        inTree = new boolean[n];
        inBlossom = new boolean[n];
        queue = new int[n];
    }

    public static Matching find(Graph graph) {
        GreedyMatching.checkUndirected(graph);
        if (graph.isWeighted()) {
            throw new GraphException(GraphError.UNWEIGHTED_GRAPH_REQUIRED);
        }
        Stopwatch stopwatch = Stopwatch.createStarted();

        Matching initial = GreedyMatching.find(graph);
        int n = graph.getVertexCount();
        int[] mate = new int[n];
        for (int v = 0; v < n; v++) {
            mate[v] = initial.getMate(v);
        }
        BlossomMatching blossom = new BlossomMatching(graph.getAdjacencyLists(), mate);
        int augmentations = 0;
        for (int root = 0; root < n; root++) {
            if (mate[root] == Matching.UNMATCHED) {
                int end = blossom.findAugmentingPath(root);
                if (end != Matching.UNMATCHED) {
                    blossom.augment(end);
                    augmentations++;
                }
            }
        }

        stopwatch.stop();
        LOGGER.debug("{} augmenting paths found after a greedy matching of size {}", augmentations, initial.getSize());
        LOGGER.debug(Markers.PERFORMANCE_MARKER, "Maximum matching of {} vertices found in {} ms", n,
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return new Matching(mate);
    }

    private void augment(int end) {
        int v = end;
        while (v != Matching.UNMATCHED) {
            int pv = parent[v];
            int next = mate[pv];
            mate[v] = pv;
            mate[pv] = v;
            v = next;
        }
    }

    /**
     * Nearest common ancestor of the bases of a and b in the alternating tree.
     */
    private int commonBase(int a, int b) {
        boolean[] onPath = new boolean[adjacency.length];
        int x = a;
        while (true) {
            x = base[x];
            onPath[x] = true;
            if (mate[x] == Matching.UNMATCHED) {
                break;
            }
            x = parent[mate[x]];
        }
        int y = b;
        while (true) {
            y = base[y];
            if (onPath[y]) {
                return y;
            }
            y = parent[mate[y]];
        }
    }

    /**
     * Mark the blossom vertices on the tree path from v up to the blossom base, and orient the parents of the path
     * towards the edge closing the cycle.
     */
    private void markPath(int v, int blossomBase, int child) {
        int x = v;
        int c = child;
        while (base[x] != blossomBase) {
            inBlossom[base[x]] = true;
            inBlossom[base[mate[x]]] = true;
            parent[x] = c;
            c = mate[x];
            x = parent[mate[x]];
        }
    }

    private void contract(int v, int w) {
        int blossomBase = commonBase(v, w);
        Arrays.fill(inBlossom, false);
        markPath(v, blossomBase, w);
        markPath(w, blossomBase, v);
        for (int x = 0; x < adjacency.length; x++) {
            if (inBlossom[base[x]]) {
                base[x] = blossomBase;
                if (!inTree[x]) {
                    inTree[x] = true;
                    queue[queueTail++] = x;
                }
            }
        }
    }

    /**
     * @return the unmatched end of an augmenting path starting at root, or {@link Matching#UNMATCHED} if there is none
     */
    private int findAugmentingPath(int root) {
        Arrays.fill(inTree, false);
        Arrays.fill(parent, Matching.UNMATCHED);
        for (int x = 0; x < base.length; x++) {
            base[x] = x;
        }
        inTree[root] = true;
        queueHead = 0;
        queueTail = 0;
        queue[queueTail++] = root;
        while (queueHead < queueTail) {
            int v = queue[queueHead++];
            for (int w : adjacency[v]) {
                if (base[v] == base[w] || mate[v] == w) {
                    continue;
                }
                if (w == root || mate[w] != Matching.UNMATCHED && parent[mate[w]] != Matching.UNMATCHED) {
                    contract(v, w);
                } else if (parent[w] == Matching.UNMATCHED) {
                    parent[w] = v;
                    if (mate[w] == Matching.UNMATCHED) {
                        return w;
                    }
                    inTree[mate[w]] = true;
                    queue[queueTail++] = mate[w];
                }
            }
        }
        return Matching.UNMATCHED;
    }
}

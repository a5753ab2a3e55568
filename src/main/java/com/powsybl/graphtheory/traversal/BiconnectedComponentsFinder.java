/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.traversal;

import com.powsybl.graphtheory.graph.Edge;
import com.powsybl.graphtheory.graph.Graph;
import gnu.trove.list.array.TIntArrayList;

import java.util.*;

/**
 * Cut vertices and blocks (maximal biconnected subgraphs) of the undirected graph underlying a graph, computed by a
 * single depth first search with low-link numbering and an edge stack.
 * <p>
 * A non root vertex is a cut vertex iff one of its children has a low-link greater or equal to its own discovery
 * time; a root is a cut vertex iff it has more than one child in the search tree. A block is emitted each time the
 * edge stack is popped back to the tree edge entering such a child.
 *
 * @author PowSyBl graph theory team
 */
public class BiconnectedComponentsFinder {

    private final int[][] neighbours;

    private final int[] dfsn;

    private final int[] lowLink;

    private final int[] parent;

    /**
     * Index of the next neighbour to explore, per vertex.
     */
    private final int[] next;

    private int dfsnCount;

    /**
     * Edge stack, each edge taking two consecutive slots.
     */
    private final TIntArrayList edgeStack = new TIntArrayList();

    private SortedSet<Integer> cutVertices;

    private List<List<Edge>> blocks;

    public BiconnectedComponentsFinder(Graph graph) {
        Objects.requireNonNull(graph);
        this.neighbours = graph.getUndirectedAdjacencyLists();
        this.dfsn = new int[neighbours.length];
        this.lowLink = new int[neighbours.length];
        this.parent = new int[neighbours.length];
        this.next = new int[neighbours.length];
    }

    private void visit(int root) {
        TIntArrayList stack = new TIntArrayList();
        dfsn[root] = ++dfsnCount;
        lowLink[root] = dfsn[root];
        parent[root] = -1;
        stack.add(root);
        int rootChildren = 0;
        while (!stack.isEmpty()) {
            int v = stack.get(stack.size() - 1);
            if (next[v] < neighbours[v].length) {
                int w = neighbours[v][next[v]++];
                if (dfsn[w] == 0) {
                    if (v == root) {
                        rootChildren++;
                    }
                    edgeStack.add(v);
                    edgeStack.add(w);
                    parent[w] = v;
                    dfsn[w] = ++dfsnCount;
                    lowLink[w] = dfsn[w];
                    stack.add(w);
                } else if (w != parent[v] && dfsn[w] < dfsn[v]) {
                    // back edge
                    edgeStack.add(v);
                    edgeStack.add(w);
                    lowLink[v] = Math.min(lowLink[v], dfsn[w]);
                }
            } else {
                stack.removeAt(stack.size() - 1);
                int u = parent[v];
                if (u >= 0) {
                    lowLink[u] = Math.min(lowLink[u], lowLink[v]);
                    if (lowLink[v] >= dfsn[u]) {
                        if (u != root || rootChildren > 1) {
                            cutVertices.add(u);
                        }
                        popBlock(u, v);
                    }
                }
            }
        }
    }

    private void popBlock(int v, int w) {
        List<Edge> block = new ArrayList<>();
        while (true) {
            int size = edgeStack.size();
            int a = edgeStack.get(size - 2);
            int b = edgeStack.get(size - 1);
            edgeStack.remove(size - 2, 2);
            block.add(Edge.undirected(a, b));
            if (a == v && b == w) {
                break;
            }
        }
        Collections.sort(block, Comparator.comparingInt(Edge::source).thenComparingInt(Edge::target));
        blocks.add(block);
    }

    private void lazySearch() {
        if (blocks == null) {
            cutVertices = new TreeSet<>();
            blocks = new ArrayList<>();
            dfsnCount = 0;
            Arrays.fill(dfsn, 0);
            Arrays.fill(next, 0);
            for (int v = 0; v < neighbours.length; v++) {
                if (dfsn[v] == 0) {
                    visit(v);
                }
            }
        }
    }

    /**
     * Cut vertices (articulation points), sorted.
     */
    public List<Integer> getCutVertices() {
        lazySearch();
        return new ArrayList<>(cutVertices);
    }

    /**
     * Blocks as edge lists. Isolated vertices belong to no block.
     */
    public List<List<Edge>> getBlocks() {
        lazySearch();
        return blocks;
    }

    /**
     * Blocks as sorted vertex lists.
     */
    public List<List<Integer>> getBlockVertices() {
        List<List<Integer>> result = new ArrayList<>();
        for (List<Edge> block : getBlocks()) {
            SortedSet<Integer> vertices = new TreeSet<>();
            for (Edge e : block) {
                vertices.add(e.source());
                vertices.add(e.target());
            }
            result.add(new ArrayList<>(vertices));
        }
        return result;
    }

    /**
     * Depth first search discovery time of a vertex, starting from 1.
     */
    public int getDiscoveryTime(int v) {
        lazySearch();
        return dfsn[v];
    }

    /**
     * Minimum discovery time reachable from the subtree of v through at most one back edge.
     */
    public int getLowLink(int v) {
        lazySearch();
        return lowLink[v];
    }
}

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Finds the bridges of the undirected graph underlying a graph, that is the edges whose removal increases the number
 * of connected components.
 *
 * @author PowSyBl graph theory team
 */
public class BridgesFinder {

    private final int nbVertices;

    private final int[][] neighbours;

    private final boolean[] visited;

    /**
     * Depth-first search number
     */
    private final int[] dfsn;

    /**
     * Depth-first search number counter
     */
    private int dfsnCount;

    /**
     * Lowest depth-first search number reachable from the subtree of each vertex
     */
    private final int[] lowest;

    private final int[] parent;

    private final int[] next;

    private List<Edge> bridges;

    public BridgesFinder(Graph graph) {
        Objects.requireNonNull(graph);
        this.neighbours = graph.getUndirectedAdjacencyLists();
        this.nbVertices = neighbours.length;
        this.visited = new boolean[nbVertices];
        this.dfsn = new int[nbVertices];
        this.lowest = new int[nbVertices];
        this.parent = new int[nbVertices];
        this.next = new int[nbVertices];
        this.dfsnCount = 0;
    }

    /**
     * Finds bridges in the connected component of a vertex, with an explicit search stack.
     *
     * @param root first vertex of the component to be visited
     */
    private void findBridgesFromVertex(int root) {
        TIntArrayList stack = new TIntArrayList();
        visited[root] = true;
        dfsn[root] = ++dfsnCount;
        lowest[root] = dfsn[root];
        parent[root] = root;
        stack.add(root);
        while (!stack.isEmpty()) {
            int v = stack.get(stack.size() - 1);
            if (next[v] < neighbours[v].length) {
                int neighbour = neighbours[v][next[v]++];
                if (!visited[neighbour]) {
                    // Neighbour not visited yet: consider it as child of v and visit it
                    visited[neighbour] = true;
                    dfsn[neighbour] = ++dfsnCount;
                    lowest[neighbour] = dfsn[neighbour];
                    parent[neighbour] = v;
                    stack.add(neighbour);
                } else if (neighbour != parent[v] && lowest[v] > dfsn[neighbour]) {
                    lowest[v] = dfsn[neighbour];
                }
            } else {
                stack.removeAt(stack.size() - 1);
                int u = parent[v];
                if (u != v) {
                    // Check if v has a connection to one of the ancestors of u
                    lowest[u] = Math.min(lowest[u], lowest[v]);
                    // If the lowest vertex reachable from v is after u, then u-v is a bridge
                    if (lowest[v] > dfsn[u]) {
                        bridges.add(Edge.undirected(u, v));
                    }
                }
            }
        }
    }

    /**
     * DFS based function to find all bridges
     *
     * @return the list of bridges, each one with {@code source < target}
     */
    public List<Edge> getBridges() {
        lazySearch();
        return bridges;
    }

    private void lazySearch() {
        if (bridges == null) {
            dfsnCount = 0;
            bridges = new ArrayList<>();
            Arrays.fill(visited, false);
            Arrays.fill(next, 0);
            for (int i = 0; i < nbVertices; i++) {
                if (!visited[i]) {
                    findBridgesFromVertex(i);
                }
            }
        }
    }
}

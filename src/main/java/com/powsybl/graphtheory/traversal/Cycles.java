/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.traversal;

import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;

import java.util.*;

/**
 * Cycle detection and girth.
 *
 * @author PowSyBl graph theory team
 */
public final class Cycles {

    private static final int WHITE = 0;
    private static final int GREY = 1;
    private static final int BLACK = 2;

    private Cycles() {
    }

    /**
     * Find a cycle, following arc directions in a directed graph.
     *
     * @return the vertices of a cycle in traversal order, empty if the graph is acyclic
     */
    public static List<Integer> findCycle(Graph graph) {
        Objects.requireNonNull(graph);
        int[][] adjacency = graph.getAdjacencyLists();
        int n = adjacency.length;
        int[] color = new int[n];
        int[] parent = new int[n];
        int[] next = new int[n];
        Arrays.fill(parent, -1);
        int[] stack = new int[n];
        for (int root = 0; root < n; root++) {
            if (color[root] != WHITE) {
                continue;
            }
            int top = 0;
            stack[top++] = root;
            color[root] = GREY;
            while (top > 0) {
                int v = stack[top - 1];
                if (next[v] < adjacency[v].length) {
                    int w = adjacency[v][next[v]++];
                    if (color[w] == WHITE) {
                        color[w] = GREY;
                        parent[w] = v;
                        stack[top++] = w;
                    } else if (color[w] == GREY && (graph.isDirected() || w != parent[v])) {
                        List<Integer> cycle = new ArrayList<>();
                        for (int u = v; u != w; u = parent[u]) {
                            cycle.add(u);
                        }
                        cycle.add(w);
                        Collections.reverse(cycle);
                        return cycle;
                    }
                } else {
                    color[v] = BLACK;
                    top--;
                }
            }
        }
        return Collections.emptyList();
    }

    public static boolean hasCycle(Graph graph) {
        return !findCycle(graph).isEmpty();
    }

    /**
     * Check that a vertex list describes a cycle of the graph, the closing edge being implicit.
     */
    public static boolean isCycle(Graph graph, List<Integer> cycle) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(cycle);
        int length = cycle.size();
        if (length < 3 || new HashSet<>(cycle).size() != length) {
            return false;
        }
        for (int k = 0; k < length; k++) {
            if (!graph.hasEdge(cycle.get(k), cycle.get((k + 1) % length))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Length of a shortest cycle (directed cycle in a directed graph), empty if the graph is acyclic.
     */
    public static OptionalInt girth(Graph graph) {
        Objects.requireNonNull(graph);
        int[][] adjacency = graph.getAdjacencyLists();
        int n = adjacency.length;
        int best = Integer.MAX_VALUE;
        int[] dist = new int[n];
        int[] parent = new int[n];
        int[] queue = new int[n];
        for (int s = 0; s < n; s++) {
            Arrays.fill(dist, -1);
            dist[s] = 0;
            parent[s] = -1;
            int head = 0;
            int tail = 0;
            queue[tail++] = s;
            while (head < tail) {
                int v = queue[head++];
                if ((graph.isDirected() ? dist[v] + 1 : 2 * dist[v]) >= best) {
                    break;
                }
                for (int w : adjacency[v]) {
                    if (dist[w] < 0) {
                        dist[w] = dist[v] + 1;
                        parent[w] = v;
                        queue[tail++] = w;
                    } else if (graph.isDirected()) {
                        if (w == s) {
                            best = Math.min(best, dist[v] + 1);
                        }
                    } else if (w != parent[v]) {
                        best = Math.min(best, dist[v] + dist[w] + 1);
                    }
                }
            }
        }
        return best == Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of(best);
    }

    /**
     * Length of a shortest odd cycle of an undirected graph, empty if the graph is bipartite.
     */
    public static OptionalInt oddGirth(Graph graph) {
        Objects.requireNonNull(graph);
        if (graph.isDirected()) {
            throw new GraphException(GraphError.UNDIRECTED_GRAPH_REQUIRED);
        }
        int[][] adjacency = graph.getAdjacencyLists();
        int n = adjacency.length;
        int best = Integer.MAX_VALUE;
        int[] dist = new int[n];
        int[] queue = new int[n];
        for (int s = 0; s < n; s++) {
            Arrays.fill(dist, -1);
            dist[s] = 0;
            int head = 0;
            int tail = 0;
            queue[tail++] = s;
            while (head < tail) {
                int v = queue[head++];
                for (int w : adjacency[v]) {
                    if (dist[w] < 0) {
                        dist[w] = dist[v] + 1;
                        queue[tail++] = w;
                    } else if (dist[w] == dist[v]) {
                        best = Math.min(best, 2 * dist[v] + 1);
                    }
                }
            }
        }
        return best == Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of(best);
    }

    /**
     * An undirected graph is bipartite iff it has no odd cycle.
     */
    public static boolean isBipartite(Graph graph) {
        return oddGirth(graph).isEmpty();
    }
}

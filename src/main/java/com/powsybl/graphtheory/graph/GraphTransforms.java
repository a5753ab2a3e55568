/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.graph;

import org.apache.commons.lang3.tuple.Pair;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Operations building a new graph from one or more graphs. Input graphs are never modified.
 *
 * @author PowSyBl graph theory team
 */
public final class GraphTransforms {

    private static final Pattern INTEGER_LABEL = Pattern.compile("-?\\d{1,18}");

    private GraphTransforms() {
    }

    /**
     * Two graphs are equal if they have the same vertex labels in the same order, the same edges, the same directed
     * and weighted flags and, when weighted, the same edge weights.
     */
    public static boolean graphEqual(Graph g1, Graph g2) {
        Objects.requireNonNull(g1);
        Objects.requireNonNull(g2);
        if (g1.isDirected() != g2.isDirected() || g1.isWeighted() != g2.isWeighted()
                || !g1.getVertexLabels().equals(g2.getVertexLabels())) {
            return false;
        }
        List<Edge> edges = g1.getEdges();
        if (!edges.equals(g2.getEdges())) {
            return false;
        }
        if (g1.isWeighted()) {
            for (Edge e : edges) {
                if (g1.getWeight(e.source(), e.target()) != g2.getWeight(e.source(), e.target())) {
                    return false;
                }
            }
        }
        return true;
    }

    private static Graph emptyLike(Graph g, boolean directed, boolean weighted) {
        return new Graph(directed, weighted, g.getAttributeTags());
    }

    private static void copyVertex(Graph from, int i, Graph to, String label) {
        int k = to.addVertex(label);
        from.getVertexAttributes(i).forEach((tag, value) -> to.setVertexAttribute(k, tag, value));
    }

    /**
     * Copy edge (i, j) of {@code from} to edge (k, l) of {@code to}, with its attributes.
     */
    private static void copyEdgeWithAttributes(Graph from, int i, int j, Graph to, int k, int l) {
        if (to.isWeighted()) {
            to.addEdge(k, l, from.getWeight(i, j));
        } else {
            to.addEdge(k, l);
        }
        from.getEdgeAttributes(i, j).forEach((tag, value) -> {
            if (!"weight".equals(tag)) {
                to.setEdgeAttribute(k, l, tag, value);
            }
        });
    }

    /**
     * New graph with the same structure and the given vertex labels.
     */
    public static Graph relabelVertices(Graph g, List<String> labels) {
        Objects.requireNonNull(g);
        Objects.requireNonNull(labels);
        int n = g.getVertexCount();
        if (labels.size() != n) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "expected " + n + " labels, got " + labels.size());
        }
        if (new HashSet<>(labels).size() != n) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "labels must be distinct");
        }
        Graph h = new Graph(g);
        // two passes, so that swapping labels does not collide
        for (int i = 0; i < n; i++) {
            h.setVertexLabel(i, "\u0000" + i);
        }
        for (int i = 0; i < n; i++) {
            h.setVertexLabel(i, labels.get(i));
        }
        return h;
    }

    /**
     * Isomorphic copy where vertex {@code i} of {@code g} becomes vertex {@code sigma[i]}, keeping its label.
     */
    public static Graph isomorphicCopy(Graph g, int[] sigma) {
        Objects.requireNonNull(g);
        int n = g.getVertexCount();
        checkPermutation(sigma, n);
        int[] inverse = new int[n];
        for (int i = 0; i < n; i++) {
            inverse[sigma[i]] = i;
        }
        Graph h = emptyLike(g, g.isDirected(), g.isWeighted());
        h.setName(g.getName());
        for (int k = 0; k < n; k++) {
            copyVertex(g, inverse[k], h, g.getVertexLabel(inverse[k]));
        }
        for (Edge e : g.getEdges()) {
            copyEdgeWithAttributes(g, e.source(), e.target(), h, sigma[e.source()], sigma[e.target()]);
        }
        return h;
    }

    /**
     * Copy of {@code g} whose vertices appear in the order given by {@code labels}.
     */
    public static Graph permuteVertices(Graph g, List<String> labels) {
        Objects.requireNonNull(g);
        Objects.requireNonNull(labels);
        int n = g.getVertexCount();
        if (labels.size() != n) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "expected " + n + " vertices, got " + labels.size());
        }
        int[] sigma = new int[n];
        Arrays.fill(sigma, -1);
        for (int k = 0; k < n; k++) {
            int i = g.requireVertexIndex(labels.get(k));
            if (sigma[i] != -1) {
                throw new GraphException(GraphError.INVALID_ARGUMENT, "vertex '" + labels.get(k) + "' listed twice");
            }
            sigma[i] = k;
        }
        return isomorphicCopy(g, sigma);
    }

    private static void checkPermutation(int[] sigma, int n) {
        Objects.requireNonNull(sigma);
        if (sigma.length != n) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "permutation of size " + sigma.length + " for " + n + " vertices");
        }
        boolean[] seen = new boolean[n];
        for (int s : sigma) {
            if (s < 0 || s >= n || seen[s]) {
                throw new GraphException(GraphError.INVALID_ARGUMENT, "not a permutation: " + Arrays.toString(sigma));
            }
            seen[s] = true;
        }
    }

    /**
     * Undirected and unweighted graph with the same vertices, two vertices being adjacent if they are joined by an edge
     * or an arc in any direction.
     */
    public static Graph underlying(Graph g) {
        Objects.requireNonNull(g);
        Graph h = emptyLike(g, false, false);
        for (int i = 0; i < g.getVertexCount(); i++) {
            copyVertex(g, i, h, g.getVertexLabel(i));
        }
        for (Edge e : g.getEdges()) {
            h.addEdge(e.source(), e.target());
        }
        return h;
    }

    /**
     * Unweighted graph with the same vertices, in which two vertices are adjacent iff they are not adjacent in
     * {@code g}. For a directed graph, arcs are complemented.
     */
    public static Graph complement(Graph g) {
        Objects.requireNonNull(g);
        int n = g.getVertexCount();
        Graph h = emptyLike(g, g.isDirected(), false);
        for (int i = 0; i < n; i++) {
            copyVertex(g, i, h, g.getVertexLabel(i));
        }
        for (int i = 0; i < n; i++) {
            for (int j = g.isDirected() ? 0 : i + 1; j < n; j++) {
                if (i != j && !g.hasEdge(i, j)) {
                    h.addEdge(i, j);
                }
            }
        }
        return h;
    }

    /**
     * Subgraph made of the given edges and of their ends. Vertices keep the relative order they have in {@code g}.
     */
    public static Graph subgraph(Graph g, List<Pair<String, String>> edges) {
        Objects.requireNonNull(g);
        Objects.requireNonNull(edges);
        SortedSet<Integer> ends = new TreeSet<>();
        List<Edge> resolved = new ArrayList<>(edges.size());
        for (Pair<String, String> e : edges) {
            int i = g.getVertexIndex(e.getLeft());
            int j = g.getVertexIndex(e.getRight());
            if (i == Graph.NOT_FOUND || j == Graph.NOT_FOUND || !g.hasEdge(i, j)) {
                throw new GraphException(GraphError.EDGE_NOT_FOUND, String.valueOf(e));
            }
            ends.add(i);
            ends.add(j);
            resolved.add(new Edge(i, j));
        }
        Graph h = emptyLike(g, g.isDirected(), g.isWeighted());
        for (int i : ends) {
            copyVertex(g, i, h, g.getVertexLabel(i));
        }
        for (Edge e : resolved) {
            copyEdgeWithAttributes(g, e.source(), e.target(), h,
                    h.getVertexIndex(g.getVertexLabel(e.source())), h.getVertexIndex(g.getVertexLabel(e.target())));
        }
        return h;
    }

    /**
     * Subgraph induced by a set of vertices. Vertices keep the relative order they have in {@code g}.
     */
    public static Graph inducedSubgraph(Graph g, Collection<Integer> vertices) {
        Objects.requireNonNull(g);
        SortedSet<Integer> set = new TreeSet<>();
        for (int v : Objects.requireNonNull(vertices)) {
            Objects.checkIndex(v, g.getVertexCount());
            set.add(v);
        }
        Graph h = emptyLike(g, g.isDirected(), g.isWeighted());
        int[] map = new int[g.getVertexCount()];
        Arrays.fill(map, -1);
        for (int i : set) {
            map[i] = h.getVertexCount();
            copyVertex(g, i, h, g.getVertexLabel(i));
        }
        for (int i : set) {
            for (int j : g.getNeighbors(i)) {
                if (map[j] >= 0 && (g.isDirected() || i < j)) {
                    copyEdgeWithAttributes(g, i, j, h, map[i], map[j]);
                }
            }
        }
        return h;
    }

    public static Graph inducedSubgraphByLabels(Graph g, Collection<String> labels) {
        Objects.requireNonNull(g);
        List<Integer> indices = new ArrayList<>();
        for (String label : Objects.requireNonNull(labels)) {
            indices.add(g.requireVertexIndex(label));
        }
        return inducedSubgraph(g, indices);
    }

    /**
     * Directed graph with every arc reversed.
     */
    public static Graph reverse(Graph g) {
        Objects.requireNonNull(g);
        if (!g.isDirected()) {
            throw new GraphException(GraphError.DIRECTED_GRAPH_REQUIRED);
        }
        Graph h = emptyLike(g, true, g.isWeighted());
        for (int i = 0; i < g.getVertexCount(); i++) {
            copyVertex(g, i, h, g.getVertexLabel(i));
        }
        for (Edge e : g.getEdges()) {
            copyEdgeWithAttributes(g, e.source(), e.target(), h, e.target(), e.source());
        }
        return h;
    }

    private static void checkSameKind(List<Graph> graphs) {
        if (graphs.isEmpty()) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "at least one graph is required");
        }
        Graph first = graphs.get(0);
        for (Graph g : graphs) {
            if (g.isDirected() != first.isDirected() || g.isWeighted() != first.isWeighted()) {
                throw new GraphException(GraphError.MIXED_GRAPH_KINDS);
            }
        }
    }

    /**
     * Union of graphs: vertices are merged by label, and the weights of edges found in several weighted graphs add up.
     */
    public static Graph union(List<Graph> graphs) {
        Objects.requireNonNull(graphs);
        checkSameKind(graphs);
        Graph first = graphs.get(0);
        Graph h = emptyLike(first, first.isDirected(), first.isWeighted());
        for (Graph g : graphs) {
            for (int i = 0; i < g.getVertexCount(); i++) {
                copyVertex(g, i, h, g.getVertexLabel(i));
            }
            for (Edge e : g.getEdges()) {
                int k = h.getVertexIndex(g.getVertexLabel(e.source()));
                int l = h.getVertexIndex(g.getVertexLabel(e.target()));
                if (h.isWeighted()) {
                    double w = g.getWeight(e.source(), e.target());
                    h.addEdge(k, l, h.hasEdge(k, l) ? h.getWeight(k, l) + w : w);
                } else {
                    h.addEdge(k, l);
                }
            }
        }
        return h;
    }

    /**
     * Disjoint union of graphs. The vertex {@code v} of the k-th graph (starting from 1) is labeled {@code "k:v"}.
     */
    public static Graph disjointUnion(List<Graph> graphs) {
        Objects.requireNonNull(graphs);
        checkSameKind(graphs);
        Graph first = graphs.get(0);
        Graph h = emptyLike(first, first.isDirected(), first.isWeighted());
        int k = 0;
        for (Graph g : graphs) {
            k++;
            int offset = h.getVertexCount();
            for (int i = 0; i < g.getVertexCount(); i++) {
                copyVertex(g, i, h, k + ":" + g.getVertexLabel(i));
            }
            for (Edge e : g.getEdges()) {
                copyEdgeWithAttributes(g, e.source(), e.target(), h, offset + e.source(), offset + e.target());
            }
        }
        return h;
    }

    /**
     * Disjoint union of two undirected unweighted graphs in which every vertex of the first one is joined to every
     * vertex of the second one.
     */
    public static Graph join(Graph g1, Graph g2) {
        for (Graph g : List.of(g1, g2)) {
            if (g.isDirected()) {
                throw new GraphException(GraphError.UNDIRECTED_GRAPH_REQUIRED);
            }
            if (g.isWeighted()) {
                throw new GraphException(GraphError.UNWEIGHTED_GRAPH_REQUIRED);
            }
        }
        Graph h = disjointUnion(List.of(g1, g2));
        int n1 = g1.getVertexCount();
        for (int i = 0; i < n1; i++) {
            for (int j = 0; j < g2.getVertexCount(); j++) {
                h.addEdge(i, n1 + j);
            }
        }
        return h;
    }

    private static Graph product(Graph g1, Graph g2, boolean cartesian) {
        Objects.requireNonNull(g1);
        Objects.requireNonNull(g2);
        if (g1.isDirected() != g2.isDirected()) {
            throw new GraphException(GraphError.MIXED_GRAPH_KINDS);
        }
        int n1 = g1.getVertexCount();
        int n2 = g2.getVertexCount();
        Graph h = new Graph(g1.isDirected());
        for (int u = 0; u < n1; u++) {
            for (int v = 0; v < n2; v++) {
                h.addVertex(g1.getVertexLabel(u) + ":" + g2.getVertexLabel(v));
            }
        }
        for (int u = 0; u < n1; u++) {
            for (int v = 0; v < n2; v++) {
                int a = u * n2 + v;
                if (cartesian) {
                    for (int w : g2.getNeighbors(v)) {
                        h.addEdge(a, u * n2 + w);
                    }
                    for (int w : g1.getNeighbors(u)) {
                        h.addEdge(a, w * n2 + v);
                    }
                } else {
                    for (int w1 : g1.getNeighbors(u)) {
                        for (int w2 : g2.getNeighbors(v)) {
                            h.addEdge(a, w1 * n2 + w2);
                        }
                    }
                }
            }
        }
        return h;
    }

    /**
     * Cartesian product: (u, v) and (u', v') are adjacent iff u = u' and v ~ v', or v = v' and u ~ u'. Vertices are
     * labeled {@code "u:v"}.
     */
    public static Graph cartesianProduct(Graph g1, Graph g2) {
        return product(g1, g2, true);
    }

    /**
     * Tensor product: (u, v) and (u', v') are adjacent iff u ~ u' and v ~ v'. Vertices are labeled {@code "u:v"}.
     */
    public static Graph tensorProduct(Graph g1, Graph g2) {
        return product(g1, g2, false);
    }

    /**
     * k-th power of a graph: two vertices are adjacent iff there is a path of length at most k between them.
     */
    public static Graph power(Graph g, int k) {
        Objects.requireNonNull(g);
        if (k < 1) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "power must be positive, got " + k);
        }
        int n = g.getVertexCount();
        int[][] adjacency = g.getAdjacencyLists();
        Graph h = emptyLike(g, g.isDirected(), false);
        for (int i = 0; i < n; i++) {
            copyVertex(g, i, h, g.getVertexLabel(i));
        }
        int[] dist = new int[n];
        Deque<Integer> queue = new ArrayDeque<>();
        for (int s = 0; s < n; s++) {
            Arrays.fill(dist, -1);
            dist[s] = 0;
            queue.add(s);
            while (!queue.isEmpty()) {
                int v = queue.poll();
                if (dist[v] == k) {
                    continue;
                }
                for (int w : adjacency[v]) {
                    if (dist[w] < 0) {
                        dist[w] = dist[v] + 1;
                        queue.add(w);
                        h.addEdge(s, w);
                    }
                }
            }
        }
        return h;
    }

    /**
     * Seidel switch of an undirected unweighted graph with respect to a vertex set: edges between the set and its
     * complement are inverted.
     */
    public static Graph seidelSwitch(Graph g, Collection<String> labels) {
        Objects.requireNonNull(g);
        if (g.isDirected()) {
            throw new GraphException(GraphError.UNDIRECTED_GRAPH_REQUIRED);
        }
        if (g.isWeighted()) {
            throw new GraphException(GraphError.UNWEIGHTED_GRAPH_REQUIRED);
        }
        int n = g.getVertexCount();
        boolean[] inSet = new boolean[n];
        for (String label : Objects.requireNonNull(labels)) {
            inSet[g.requireVertexIndex(label)] = true;
        }
        Graph h = emptyLike(g, false, false);
        for (int i = 0; i < n; i++) {
            copyVertex(g, i, h, g.getVertexLabel(i));
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (g.hasEdge(i, j) != (inSet[i] != inSet[j])) {
                    h.addEdge(i, j);
                }
            }
        }
        return h;
    }

    /**
     * Insert {@code r} new vertices on each of the given edges. New vertices are labeled with the smallest integers
     * greater than every integer label of {@code g}.
     */
    public static Graph subdivideEdges(Graph g, List<Pair<String, String>> edges, int r) {
        Objects.requireNonNull(g);
        Objects.requireNonNull(edges);
        if (r < 1) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "number of inserted vertices must be positive, got " + r);
        }
        List<Edge> resolved = new ArrayList<>();
        for (Pair<String, String> e : edges) {
            int i = g.getVertexIndex(e.getLeft());
            int j = g.getVertexIndex(e.getRight());
            if (i == Graph.NOT_FOUND || j == Graph.NOT_FOUND || !g.hasEdge(i, j)) {
                throw new GraphException(GraphError.EDGE_NOT_FOUND, String.valueOf(e));
            }
            resolved.add(new Edge(i, j));
        }
        long next = -1;
        for (String label : g.getVertexLabels()) {
            if (INTEGER_LABEL.matcher(label).matches()) {
                next = Math.max(next, Long.parseLong(label));
            }
        }
        Graph h = new Graph(g);
        for (Edge e : resolved) {
            double weight = h.getWeight(e.source(), e.target());
            h.removeEdge(e.source(), e.target());
            int v = e.source();
            for (int k = 0; k < r; k++) {
                int w = h.addVertex(Long.toString(++next));
                addEdge(h, v, w, weight);
                v = w;
            }
            addEdge(h, v, e.target(), weight);
        }
        return h;
    }

    private static void addEdge(Graph g, int i, int j, double weight) {
        if (g.isWeighted()) {
            g.addEdge(i, j, weight);
        } else {
            g.addEdge(i, j);
        }
    }

    /**
     * Contract edge (i, j): vertex j is merged into vertex i, which inherits its edges, then removed.
     */
    public static Graph contractEdge(Graph g, String label1, String label2) {
        Objects.requireNonNull(g);
        int i = g.getVertexIndex(label1);
        int j = g.getVertexIndex(label2);
        if (i == Graph.NOT_FOUND || j == Graph.NOT_FOUND || !g.hasEdge(i, j)) {
            throw new GraphException(GraphError.EDGE_NOT_FOUND, "(" + label1 + ", " + label2 + ")");
        }
        Graph h = new Graph(g);
        for (int k : g.getNeighbors(j)) {
            if (k != i && !h.hasEdge(i, k)) {
                addEdge(h, i, k, g.getWeight(j, k));
            }
        }
        if (g.isDirected()) {
            for (int k : g.getInNeighbors(j)) {
                if (k != i && !h.hasEdge(k, i)) {
                    addEdge(h, k, i, g.getWeight(k, j));
                }
            }
        }
        h.removeVertex(j);
        return h;
    }

    /**
     * Interval graph: one vertex per interval [a, b], labeled {@code "a .. b"}, two vertices being adjacent iff their
     * intervals overlap.
     */
    public static Graph intervalGraph(List<double[]> intervals) {
        Objects.requireNonNull(intervals);
        for (double[] interval : intervals) {
            if (interval == null || interval.length != 2) {
                throw new GraphException(GraphError.INVALID_ARGUMENT, "an interval has two bounds");
            }
        }
        Graph g = new Graph();
        for (double[] interval : intervals) {
            String label = AttributeValue.of(interval[0]) + " .. " + AttributeValue.of(interval[1]);
            String unique = label;
            for (int k = 2; g.containsVertex(unique); k++) {
                unique = label + " #" + k;
            }
            g.addVertex(unique);
        }
        for (int i = 0; i < intervals.size(); i++) {
            double[] a = intervals.get(i);
            for (int j = i + 1; j < intervals.size(); j++) {
                double[] b = intervals.get(j);
                if (b[1] > a[0] && a[1] > b[0]) {
                    g.addEdge(i, j);
                }
            }
        }
        return g;
    }
}

/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.catalog;

import com.google.common.math.IntMath;
import com.powsybl.graphtheory.graph.Edge;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.graph.GraphFactory;
import com.powsybl.graphtheory.graph.GraphTransforms;
import com.powsybl.graphtheory.planar.PlanarEmbedder;
import com.powsybl.graphtheory.planar.Triangulator;
import com.powsybl.graphtheory.traversal.Connectivity;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Parametric graph families. Unless stated otherwise, vertices are labeled "0" to "n-1".
 *
 * @author PowSyBl graph theory team
 */
public final class GraphGenerators {

    static final int KNESER_MAX_N = 20;

    static final int KNESER_MAX_VERTICES = 10000;

    private GraphGenerators() {
    }

    private static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, message);
        }
    }

    public static Graph cycle(int n) {
        checkArgument(n >= 3, "a cycle has at least 3 vertices");
        Graph g = GraphFactory.create(n, false);
        for (int i = 0; i < n; i++) {
            g.addEdge(i, (i + 1) % n);
        }
        return g;
    }

    public static Graph path(int n) {
        checkArgument(n >= 1, "a path has at least 1 vertex");
        Graph g = GraphFactory.create(n, false);
        for (int i = 1; i < n; i++) {
            g.addEdge(i - 1, i);
        }
        return g;
    }

    public static Graph complete(int n) {
        checkArgument(n >= 0, "negative vertex count");
        Graph g = GraphFactory.create(n, false);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                g.addEdge(i, j);
            }
        }
        return g;
    }

    /**
     * Complete multipartite graph, parts being made of consecutive vertices.
     */
    public static Graph completeMultipartite(int... parts) {
        Objects.requireNonNull(parts);
        checkArgument(parts.length >= 2, "at least two parts are required");
        int n = 0;
        int[] partOf = new int[Arrays.stream(parts).sum()];
        for (int p = 0; p < parts.length; p++) {
            checkArgument(parts[p] > 0, "parts must be non empty");
            Arrays.fill(partOf, n, n + parts[p], p);
            n += parts[p];
        }
        Graph g = GraphFactory.create(n, false);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (partOf[i] != partOf[j]) {
                    g.addEdge(i, j);
                }
            }
        }
        return g;
    }

    /**
     * Star K(1,n): center 0 joined to vertices 1 to n.
     */
    public static Graph star(int n) {
        checkArgument(n >= 1, "a star has at least one leaf");
        return completeMultipartite(1, n);
    }

    /**
     * Wheel: center 0 joined to every vertex of the cycle 1..n.
     */
    public static Graph wheel(int n) {
        checkArgument(n >= 3, "the rim of a wheel has at least 3 vertices");
        Graph g = GraphFactory.create(n + 1, false);
        for (int i = 1; i <= n; i++) {
            g.addEdge(0, i);
            g.addEdge(i, i % n + 1);
        }
        return g;
    }

    public static Graph prism(int n) {
        return generalizedPetersen(n, 1);
    }

    /**
     * Antiprism: two n-cycles 0..n-1 and n..2n-1 where i is joined to n + i and n + (i + 1) mod n.
     */
    public static Graph antiprism(int n) {
        checkArgument(n >= 3, "an antiprism has at least 3 vertices per cycle");
        Graph g = GraphFactory.create(2 * n, false);
        for (int i = 0; i < n; i++) {
            g.addEdge(i, (i + 1) % n);
            g.addEdge(n + i, n + (i + 1) % n);
            g.addEdge(i, n + i);
            g.addEdge(i, n + (i + 1) % n);
        }
        return g;
    }

    /**
     * Hypercube of dimension d, vertices being labeled by their d-bit binary words.
     */
    public static Graph hypercube(int d) {
        checkArgument(d >= 1 && d <= 16, "hypercube dimension must be between 1 and 16");
        int n = 1 << d;
        Graph g = new Graph();
        for (int v = 0; v < n; v++) {
            g.addVertex(binaryWord(v, d));
        }
        for (int v = 0; v < n; v++) {
            for (int b = 0; b < d; b++) {
                g.addEdge(v, v ^ (1 << b));
            }
        }
        return g;
    }

    private static String binaryWord(int v, int d) {
        StringBuilder word = new StringBuilder(Integer.toBinaryString(v));
        while (word.length() < d) {
            word.insert(0, '0');
        }
        return word.toString();
    }

    /**
     * Generalized Petersen graph P(n, k): outer cycle 0..n-1, spokes i - (n + i) and inner star polygon
     * (n + i) - (n + (i + k) mod n).
     */
    public static Graph generalizedPetersen(int n, int k) {
        checkArgument(n >= 3 && k >= 1 && 2 * k < n, "generalized Petersen graph requires n >= 3 and 1 <= k < n/2");
        Graph g = GraphFactory.create(2 * n, false);
        for (int i = 0; i < n; i++) {
            g.addEdge(i, (i + 1) % n);
            g.addEdge(i, n + i);
            g.addEdge(n + i, n + (i + k) % n);
        }
        return g;
    }

    /**
     * Cubic Hamiltonian graph given in LCF notation [jumps]^repeat.
     */
    public static Graph lcf(int[] jumps, int repeat) {
        Objects.requireNonNull(jumps);
        checkArgument(jumps.length > 0 && repeat > 0, "LCF notation requires jumps and a positive exponent");
        int n = jumps.length * repeat;
        checkArgument(n >= 3, "LCF graph has at least 3 vertices");
        Graph g = cycle(n);
        for (int i = 0; i < n; i++) {
            int j = Math.floorMod(i + jumps[i % jumps.length], n);
            checkArgument(j != i && j != (i + 1) % n && j != Math.floorMod(i - 1, n), "jump " + jumps[i % jumps.length] + " is not valid");
            g.addEdge(i, j);
        }
        return g;
    }

    /**
     * Kneser graph K(n, k): k-subsets of {1..n}, adjacent iff disjoint. Vertices are labeled like "{1,2}".
     */
    public static Graph kneser(int n, int k) {
        checkArgument(n >= 2 && n <= KNESER_MAX_N, "Kneser graph requires 2 <= n <= " + KNESER_MAX_N);
        checkArgument(k >= 1 && k < n, "Kneser graph requires 1 <= k < n");
        checkArgument(IntMath.binomial(n, k) <= KNESER_MAX_VERTICES, "Kneser graph K(" + n + ", " + k + ") is too large");
        List<Integer> subsets = new ArrayList<>();
        for (int mask = 0; mask < 1 << n; mask++) {
            if (Integer.bitCount(mask) == k) {
                subsets.add(mask);
            }
        }
        Graph g = new Graph();
        for (int mask : subsets) {
            List<Integer> elements = new ArrayList<>();
            for (int b = 0; b < n; b++) {
                if ((mask & (1 << b)) != 0) {
                    elements.add(b + 1);
                }
            }
            g.addVertex(elements.stream().map(String::valueOf).collect(Collectors.joining(",", "{", "}")));
        }
        for (int i = 0; i < subsets.size(); i++) {
            for (int j = i + 1; j < subsets.size(); j++) {
                if ((subsets.get(i) & subsets.get(j)) == 0) {
                    g.addEdge(i, j);
                }
            }
        }
        return g;
    }

    /**
     * Odd graph O(n), the Kneser graph K(2n - 1, n - 1).
     */
    public static Graph odd(int n) {
        checkArgument(n >= 2 && n <= 8, "odd graph requires 2 <= n <= 8");
        return kneser(2 * n - 1, n - 1);
    }

    /**
     * Sierpinski graph S(n, k): words of length n over {0..k-1}, labeled by the word itself.
     */
    public static Graph sierpinski(int n, int k) {
        checkArgument(n >= 1 && k >= 2, "Sierpinski graph requires n >= 1 and k >= 2");
        checkArgument(Math.pow(k, n) <= 100000, "Sierpinski graph S(" + n + ", " + k + ") is too large");
        int count = IntMath.pow(k, n);
        Graph g = new Graph();
        int[][] words = new int[count][];
        for (int v = 0; v < count; v++) {
            int[] word = new int[n];
            int x = v;
            for (int p = n - 1; p >= 0; p--) {
                word[p] = x % k;
                x /= k;
            }
            words[v] = word;
            StringBuilder label = new StringBuilder();
            for (int letter : word) {
                label.append(letter);
            }
            g.addVertex(label.toString());
        }
        // u and v are adjacent iff, from the first differing position h on, u = w a b b ... b and v = w b a a ... a
        for (int u = 0; u < count; u++) {
            for (int v = u + 1; v < count; v++) {
                if (sierpinskiAdjacent(words[u], words[v])) {
                    g.addEdge(u, v);
                }
            }
        }
        return g;
    }

    private static boolean sierpinskiAdjacent(int[] u, int[] v) {
        int h = 0;
        while (h < u.length && u[h] == v[h]) {
            h++;
        }
        if (h == u.length) {
            return false;
        }
        for (int j = h + 1; j < u.length; j++) {
            if (u[j] != v[h] || v[j] != u[h]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Complete k-ary tree of the given depth, vertices numbered in breadth first order from the root 0.
     */
    public static Graph kAryTree(int k, int depth) {
        checkArgument(k >= 1 && depth >= 0, "k-ary tree requires k >= 1 and a non negative depth");
        long n = 1;
        long level = 1;
        for (int d = 0; d < depth; d++) {
            level *= k;
            n += level;
            checkArgument(n <= 1_000_000, "k-ary tree is too large");
        }
        Graph g = GraphFactory.create((int) n, false);
        for (int v = 1; v < n; v++) {
            g.addEdge((v - 1) / k, v);
        }
        return g;
    }

    /**
     * Web graph W(a, b): Cartesian product of the cycle C(a) and the path P(b).
     */
    public static Graph web(int a, int b) {
        return GraphTransforms.cartesianProduct(cycle(a), path(b));
    }

    /**
     * Grid graph: Cartesian product of the paths P(m) and P(n), vertices being labeled "i:j".
     */
    public static Graph grid(int m, int n) {
        return GraphTransforms.cartesianProduct(path(m), path(n));
    }

    /**
     * Torus grid: Cartesian product of the cycles C(m) and C(n).
     */
    public static Graph torus(int m, int n) {
        return GraphTransforms.cartesianProduct(cycle(m), cycle(n));
    }

    // random graphs

    /**
     * Erdős–Rényi G(n, p) random graph or digraph.
     */
    public static Graph randomGraph(int n, double p, boolean directed, Random random) {
        checkArgument(n >= 0, "negative vertex count");
        checkArgument(p >= 0 && p <= 1, "edge probability must be in [0, 1]");
        Objects.requireNonNull(random);
        Graph g = GraphFactory.create(n, directed);
        for (int i = 0; i < n; i++) {
            for (int j = directed ? 0 : i + 1; j < n; j++) {
                if (i != j && random.nextDouble() < p) {
                    g.addEdge(i, j);
                }
            }
        }
        return g;
    }

    /**
     * Random bipartite graph with parts 0..n1-1 and n1..n1+n2-1.
     */
    public static Graph randomBipartite(int n1, int n2, double p, Random random) {
        checkArgument(n1 >= 1 && n2 >= 1, "both parts must be non empty");
        checkArgument(p >= 0 && p <= 1, "edge probability must be in [0, 1]");
        Objects.requireNonNull(random);
        Graph g = GraphFactory.create(n1 + n2, false);
        for (int i = 0; i < n1; i++) {
            for (int j = 0; j < n2; j++) {
                if (random.nextDouble() < p) {
                    g.addEdge(i, n1 + j);
                }
            }
        }
        return g;
    }

    /**
     * Uniformly distributed random labeled tree, decoded from a random Prüfer sequence.
     */
    public static Graph randomTree(int n, Random random) {
        checkArgument(n >= 1, "a tree has at least one vertex");
        Objects.requireNonNull(random);
        Graph g = GraphFactory.create(n, false);
        if (n == 2) {
            g.addEdge(0, 1);
        }
        if (n <= 2) {
            return g;
        }
        int[] prufer = new int[n - 2];
        int[] degree = new int[n];
        Arrays.fill(degree, 1);
        for (int i = 0; i < prufer.length; i++) {
            prufer[i] = random.nextInt(n);
            degree[prufer[i]]++;
        }
        PriorityQueue<Integer> leaves = new PriorityQueue<>();
        for (int v = 0; v < n; v++) {
            if (degree[v] == 1) {
                leaves.add(v);
            }
        }
        for (int p : prufer) {
            int leaf = leaves.poll();
            g.addEdge(leaf, p);
            if (--degree[p] == 1) {
                leaves.add(p);
            }
        }
        g.addEdge(leaves.poll(), leaves.poll());
        return g;
    }

    /**
     * Random biconnected planar graph. A random tree is made biconnected, then triangulated, and edges of the
     * triangulation are dropped in random order with probability 1/2 as long as the graph stays biconnected.
     */
    public static Graph randomPlanar(int n, Random random) {
        checkArgument(n >= 3, "a biconnected planar graph has at least 3 vertices");
        Objects.requireNonNull(random);
        Graph biconnected = Triangulator.makeBiconnected(randomTree(n, random));
        Graph g = Triangulator.triangulate(biconnected, PlanarEmbedder.embedOrThrow(biconnected), -1).graph();
        List<Edge> edges = new ArrayList<>(g.getEdges());
        Collections.shuffle(edges, random);
        for (Edge e : edges) {
            if (random.nextBoolean()) {
                g.removeEdge(e.source(), e.target());
                if (!Connectivity.isBiconnected(g)) {
                    g.addEdge(e.source(), e.target());
                }
            }
        }
        return g;
    }

    /**
     * Random tournament: every pair of vertices is joined by exactly one arc of random direction.
     */
    public static Graph randomTournament(int n, Random random) {
        checkArgument(n >= 1, "a tournament has at least one vertex");
        Objects.requireNonNull(random);
        Graph g = GraphFactory.create(n, true);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (random.nextBoolean()) {
                    g.addEdge(i, j);
                } else {
                    g.addEdge(j, i);
                }
            }
        }
        return g;
    }

    /**
     * Random d-regular graph, using the pairing model with restarts.
     */
    public static Graph randomRegular(int n, int d, Random random) {
        checkArgument(n >= 1 && d >= 0 && d < n && (n * d) % 2 == 0, "no " + d + "-regular graph on " + n + " vertices");
        Objects.requireNonNull(random);
        while (true) {
            Graph g = tryRandomRegular(n, d, random);
            if (g != null) {
                return g;
            }
        }
    }

    private static Graph tryRandomRegular(int n, int d, Random random) {
        Graph g = GraphFactory.create(n, false);
        List<Integer> points = new ArrayList<>(n * d);
        for (int v = 0; v < n; v++) {
            for (int k = 0; k < d; k++) {
                points.add(v);
            }
        }
        while (!points.isEmpty()) {
            boolean paired = false;
            // a few attempts to draw a suitable pair before restarting from scratch
            for (int attempt = 0; attempt < 100 && !paired; attempt++) {
                int a = random.nextInt(points.size());
                int b = random.nextInt(points.size());
                int u = points.get(a);
                int v = points.get(b);
                if (u != v && !g.hasEdge(u, v)) {
                    g.addEdge(u, v);
                    points.remove(Math.max(a, b));
                    points.remove(Math.min(a, b));
                    paired = true;
                }
            }
            if (!paired) {
                return null;
            }
        }
        return g;
    }
}

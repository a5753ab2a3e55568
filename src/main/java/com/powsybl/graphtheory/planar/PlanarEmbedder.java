/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.planar;

import com.google.common.base.Stopwatch;
import com.powsybl.graphtheory.graph.Edge;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.traversal.BiconnectedComponentsFinder;
import com.powsybl.graphtheory.util.Markers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Planarity test and combinatorial embedding of the undirected graph underlying a graph.
 * <p>
 * Each block is embedded by Demoucron, Malgrange and Pertuiset face subdivision: starting from a cycle drawn as two
 * faces, a path of some fragment is repeatedly drawn inside one of the faces containing all the fragment attachments.
 * A fragment admissible in a single face is always processed first; otherwise the largest admissible face is used.
 * The graph is not planar iff some fragment has no admissible face.
 * <p>
 * Block embeddings are then glued at cut vertices by concatenating their rotations.
 *
 * @author PowSyBl graph theory team
 */
public final class PlanarEmbedder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlanarEmbedder.class);

    private PlanarEmbedder() {
    }

    public static boolean isPlanar(Graph graph) {
        return embed(graph).isPresent();
    }

    /**
     * @throws GraphException with {@link GraphError#NOT_PLANAR} if the graph is not planar
     */
    public static PlanarEmbedding embedOrThrow(Graph graph) {
        return embed(graph).orElseThrow(() -> new GraphException(GraphError.NOT_PLANAR));
    }

    /**
     * @return the embedding, or empty if the graph is not planar
     */
    public static Optional<PlanarEmbedding> embed(Graph graph) {
        Objects.requireNonNull(graph);
        Stopwatch stopwatch = Stopwatch.createStarted();
        int n = graph.getVertexCount();
        List<List<List<Integer>>> rotations = new ArrayList<>(n);
        for (int v = 0; v < n; v++) {
            rotations.add(new ArrayList<>());
        }
        for (List<Edge> block : new BiconnectedComponentsFinder(graph).getBlocks()) {
            if (!embedBlock(block, rotations)) {
                LOGGER.debug("Graph {} is not planar", graph);
                return Optional.empty();
            }
        }
        int[][] rotation = new int[n][];
        for (int v = 0; v < n; v++) {
            rotation[v] = rotations.get(v).stream().flatMap(List::stream).mapToInt(Integer::intValue).toArray();
        }
        PlanarEmbedding embedding = new PlanarEmbedding(rotation);
        stopwatch.stop();
        LOGGER.debug(Markers.PERFORMANCE_MARKER, "Planar embedding of {} ({} faces) computed in {} ms",
                graph, embedding.getFaceCount(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return Optional.of(embedding);
    }

    /**
     * Embed a block and append the rotation of each of its vertices to the rotation lists.
     */
    private static boolean embedBlock(List<Edge> block, List<List<List<Integer>>> rotations) {
        if (block.size() == 1) {
            Edge e = block.get(0);
            rotations.get(e.source()).add(List.of(e.target()));
            rotations.get(e.target()).add(List.of(e.source()));
            return true;
        }
        Map<Integer, SortedSet<Integer>> adjacency = new TreeMap<>();
        for (Edge e : block) {
            adjacency.computeIfAbsent(e.source(), k -> new TreeSet<>()).add(e.target());
            adjacency.computeIfAbsent(e.target(), k -> new TreeSet<>()).add(e.source());
        }
        int vertexCount = adjacency.size();
        if (vertexCount >= 3 && block.size() > 3 * vertexCount - 6) {
            return false;
        }
        List<List<Integer>> faces = subdivideFaces(block, adjacency);
        if (faces == null) {
            return false;
        }
        // successor of u around v, for each face walking u -> v -> w
        Map<Integer, Map<Integer, Integer>> successors = new HashMap<>();
        for (List<Integer> face : faces) {
            int size = face.size();
            for (int k = 0; k < size; k++) {
                int u = face.get((k + size - 1) % size);
                int v = face.get(k);
                int w = face.get((k + 1) % size);
                successors.computeIfAbsent(v, x -> new HashMap<>()).put(u, w);
            }
        }
        for (Map.Entry<Integer, SortedSet<Integer>> e : adjacency.entrySet()) {
            int v = e.getKey();
            Map<Integer, Integer> succ = successors.get(v);
            List<Integer> cycle = new ArrayList<>();
            int first = e.getValue().first();
            int u = first;
            do {
                cycle.add(u);
                u = succ.get(u);
            } while (u != first);
            rotations.get(v).add(cycle);
        }
        return true;
    }

    /**
     * Demoucron face subdivision of a biconnected block.
     *
     * @return consistently oriented faces, or null if the block is not planar
     */
    private static List<List<Integer>> subdivideFaces(List<Edge> block, Map<Integer, SortedSet<Integer>> adjacency) {
        List<Integer> cycle = findCycle(adjacency);
        List<List<Integer>> faces = new ArrayList<>();
        faces.add(new ArrayList<>(cycle));
        List<Integer> reversed = new ArrayList<>(cycle);
        Collections.reverse(reversed);
        faces.add(reversed);

        Set<Integer> embeddedVertices = new HashSet<>(cycle);
        Set<Edge> embeddedEdges = new HashSet<>();
        addPathEdges(cycle, embeddedEdges);
        embeddedEdges.add(Edge.undirected(cycle.get(0), cycle.get(cycle.size() - 1)));

        while (embeddedEdges.size() < block.size()) {
            List<Fragment> fragments = findFragments(block, adjacency, embeddedVertices, embeddedEdges);
            Fragment chosen = null;
            int chosenFace = -1;
            int chosenAdmissibleCount = 0;
            for (Fragment fragment : fragments) {
                List<Integer> admissible = new ArrayList<>();
                for (int f = 0; f < faces.size(); f++) {
                    if (fragment.isAdmissible(faces.get(f))) {
                        admissible.add(f);
                    }
                }
                if (admissible.isEmpty()) {
                    LOGGER.trace("{} has no admissible face", fragment);
                    return null;
                }
                if (chosen == null || admissible.size() == 1 && chosenAdmissibleCount > 1) {
                    chosen = fragment;
                    chosenAdmissibleCount = admissible.size();
                    chosenFace = admissible.stream().max(Comparator.comparingInt(f -> faces.get(f).size())).orElseThrow();
                }
            }
            List<Integer> path = chosen.findPath(adjacency);
            splitFace(faces, chosenFace, path);
            embeddedVertices.addAll(path);
            addPathEdges(path, embeddedEdges);
        }
        return faces;
    }

    private static void addPathEdges(List<Integer> path, Set<Edge> edges) {
        for (int k = 1; k < path.size(); k++) {
            edges.add(Edge.undirected(path.get(k - 1), path.get(k)));
        }
    }

    /**
     * Replace a face by the two faces obtained by drawing a path between two of its vertices inside it.
     */
    private static void splitFace(List<List<Integer>> faces, int f, List<Integer> path) {
        List<Integer> face = faces.get(f);
        int size = face.size();
        int a = path.get(0);
        int b = path.get(path.size() - 1);
        int i = face.indexOf(a);
        int j = face.indexOf(b);
        List<Integer> inner = path.subList(1, path.size() - 1);

        // a -> ... -> b along the face, then back to a through the path
        List<Integer> face1 = new ArrayList<>();
        for (int k = i; k != j; k = (k + 1) % size) {
            face1.add(face.get(k));
        }
        face1.add(b);
        List<Integer> innerReversed = new ArrayList<>(inner);
        Collections.reverse(innerReversed);
        face1.addAll(innerReversed);

        // b -> ... -> a along the face, then back to b through the path
        List<Integer> face2 = new ArrayList<>();
        for (int k = j; k != i; k = (k + 1) % size) {
            face2.add(face.get(k));
        }
        face2.add(a);
        face2.addAll(inner);

        faces.set(f, face1);
        faces.add(face2);
    }

    private static List<Fragment> findFragments(List<Edge> block, Map<Integer, SortedSet<Integer>> adjacency,
                                                Set<Integer> embeddedVertices, Set<Edge> embeddedEdges) {
        List<Fragment> fragments = new ArrayList<>();
        for (Edge e : block) {
            if (!embeddedEdges.contains(e) && embeddedVertices.contains(e.source()) && embeddedVertices.contains(e.target())) {
                fragments.add(Fragment.ofEdge(e.source(), e.target()));
            }
        }
        Set<Integer> seen = new HashSet<>();
        for (int start : adjacency.keySet()) {
            if (embeddedVertices.contains(start) || seen.contains(start)) {
                continue;
            }
            Set<Integer> inner = new HashSet<>();
            SortedSet<Integer> attachments = new TreeSet<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            seen.add(start);
            while (!queue.isEmpty()) {
                int v = queue.poll();
                inner.add(v);
                for (int w : adjacency.get(v)) {
                    if (embeddedVertices.contains(w)) {
                        attachments.add(w);
                    } else if (seen.add(w)) {
                        queue.add(w);
                    }
                }
            }
            fragments.add(Fragment.ofComponent(inner, attachments));
        }
        return fragments;
    }

    /**
     * A cycle of a biconnected block, found by a depth first search.
     */
    private static List<Integer> findCycle(Map<Integer, SortedSet<Integer>> adjacency) {
        int root = adjacency.keySet().iterator().next();
        Map<Integer, Integer> parent = new HashMap<>();
        Deque<Integer> stack = new ArrayDeque<>();
        Map<Integer, Iterator<Integer>> iterators = new HashMap<>();
        parent.put(root, -1);
        stack.push(root);
        iterators.put(root, adjacency.get(root).iterator());
        while (!stack.isEmpty()) {
            int v = stack.peek();
            Iterator<Integer> it = iterators.get(v);
            if (!it.hasNext()) {
                stack.pop();
                continue;
            }
            int w = it.next();
            if (!parent.containsKey(w)) {
                parent.put(w, v);
                stack.push(w);
                iterators.put(w, adjacency.get(w).iterator());
            } else if (w != parent.get(v) && stack.contains(w)) {
                List<Integer> cycle = new ArrayList<>();
                for (int x = v; x != w; x = parent.get(x)) {
                    cycle.add(x);
                }
                cycle.add(w);
                Collections.reverse(cycle);
                return cycle;
            }
        }
        throw new IllegalStateException("Biconnected block without cycle");
    }
}

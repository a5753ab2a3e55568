/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.planar;

import com.powsybl.graphtheory.graph.Edge;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.graph.GraphTransforms;
import com.powsybl.graphtheory.traversal.BiconnectedComponentsFinder;
import com.powsybl.graphtheory.traversal.Connectivity;
import gnu.trove.list.array.TIntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.IntStream;

/**
 * Planarity preserving augmentations: making a connected planar graph biconnected, and cutting the faces of a
 * biconnected plane graph into triangles.
 *
 * @author PowSyBl graph theory team
 */
public final class Triangulator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Triangulator.class);

    /**
     * A plane graph whose faces have been triangulated.
     *
     * @param graph      the augmented graph
     * @param faces      its faces, consistently oriented
     * @param addedEdges the edges that have been added
     */
    public record Triangulation(Graph graph, List<List<Integer>> faces, List<Edge> addedEdges) {
    }

    private Triangulator() {
    }

    /**
     * Undirected unweighted copy of a connected planar graph, with extra edges making it biconnected. Each extra edge
     * joins two neighbors of a cut vertex that belong to different blocks and are consecutive around it.
     * <p>
     * The graph is embedded once. Each extra edge is drawn inside the face of the corner it closes, so the rotation
     * system is updated in place, and blocks are merged with a union-find structure.
     */
    public static Graph makeBiconnected(Graph graph) {
        Objects.requireNonNull(graph);
        Graph augmented = GraphTransforms.underlying(graph);
        if (augmented.getVertexCount() <= 2) {
            return augmented;
        }
        if (!Connectivity.isConnected(augmented)) {
            throw new GraphException(GraphError.CONNECTED_GRAPH_REQUIRED);
        }
        PlanarEmbedding embedding = PlanarEmbedder.embedOrThrow(augmented);
        BiconnectedComponentsFinder finder = new BiconnectedComponentsFinder(augmented);
        List<List<Edge>> blocks = finder.getBlocks();
        Map<Edge, Integer> blockOfEdge = new HashMap<>();
        for (int b = 0; b < blocks.size(); b++) {
            for (Edge e : blocks.get(b)) {
                blockOfEdge.put(e, b);
            }
        }
        int[] blockParent = IntStream.range(0, blocks.size()).toArray();
        List<TIntArrayList> rotations = new ArrayList<>(augmented.getVertexCount());
        for (int v = 0; v < augmented.getVertexCount(); v++) {
            rotations.add(new TIntArrayList(embedding.getRotation(v)));
        }
        int addedCount = 0;
        for (int v : finder.getCutVertices()) {
            // inserting chords only changes the rotations of the chord ends, so the rotation of v stays the same
            TIntArrayList rotation = rotations.get(v);
            int degree = rotation.size();
            for (int k = 0; k < degree; k++) {
                int a = rotation.get(k);
                int c = rotation.get((k + 1) % degree);
                int blockA = findBlock(blockParent, blockOfEdge.get(Edge.undirected(v, a)));
                int blockC = findBlock(blockParent, blockOfEdge.get(Edge.undirected(v, c)));
                if (blockA != blockC) {
                    LOGGER.trace("Edge {}-{} added to make graph biconnected", a, c);
                    augmented.addEdge(a, c);
                    addedCount++;
                    blockParent[blockC] = blockA;
                    blockOfEdge.put(Edge.undirected(a, c), blockA);
                    // the face walking a -> v -> c is split into the triangle a, v, c and the rest of the face
                    TIntArrayList rotationA = rotations.get(a);
                    rotationA.insert(rotationA.indexOf(v), c);
                    TIntArrayList rotationC = rotations.get(c);
                    rotationC.insert(rotationC.indexOf(v) + 1, a);
                }
            }
        }
        LOGGER.debug("{} edges added to make graph {} biconnected", addedCount, graph);
        return augmented;
    }

    private static int findBlock(int[] parent, int b) {
        int root = b;
        while (parent[root] != root) {
            root = parent[root];
        }
        // path compression
        while (parent[b] != root) {
            int next = parent[b];
            parent[b] = root;
            b = next;
        }
        return root;
    }

    /**
     * Cut every face of a biconnected plane graph into triangles, except the given outer face.
     *
     * @param graph     a biconnected undirected graph
     * @param embedding an embedding of this graph
     * @param outerFace index of the face to keep, or -1 to get a maximal planar graph
     */
    public static Triangulation triangulate(Graph graph, PlanarEmbedding embedding, int outerFace) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(embedding);
        Graph triangulated = new Graph(graph);
        List<List<Integer>> faces = new ArrayList<>();
        List<Edge> added = new ArrayList<>();
        List<List<Integer>> original = embedding.getFaces();
        for (int f = 0; f < original.size(); f++) {
            List<Integer> face = new ArrayList<>(original.get(f));
            if (f == outerFace || face.size() <= 3) {
                faces.add(face);
                continue;
            }
            if (new HashSet<>(face).size() != face.size()) {
                throw new GraphException(GraphError.INVALID_ARGUMENT, "face " + face + " is not a simple cycle");
            }
            clipEars(triangulated, face, faces, added);
        }
        return new Triangulation(triangulated, faces, added);
    }

    /**
     * Cut triangles off a face, along chords that are not already edges of the graph. Two crossing chords cannot both
     * run outside a face, so such a chord always exists.
     */
    private static void clipEars(Graph graph, List<Integer> face, List<List<Integer>> faces, List<Edge> added) {
        while (face.size() > 3) {
            int size = face.size();
            boolean clipped = false;
            for (int i = 0; i < size && !clipped; i++) {
                int a = face.get((i + size - 1) % size);
                int c = face.get((i + 1) % size);
                if (!graph.hasEdge(a, c)) {
                    graph.addEdge(a, c);
                    added.add(Edge.undirected(a, c));
                    faces.add(List.of(a, face.get(i), c));
                    face.remove(i);
                    clipped = true;
                }
            }
            if (!clipped) {
                throw new IllegalStateException("No chord available in face " + face);
            }
        }
        faces.add(face);
    }
}

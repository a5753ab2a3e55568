/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.planar;

import java.util.*;

/**
 * Combinatorial embedding of a planar graph.
 * <p>
 * The embedding is a rotation system: for each vertex, the cyclic order of its neighbors around it. Faces are traced
 * from it: the face walk entering v from u leaves towards the successor of u in the rotation of v. Each face is a
 * closed walk given by its sequence of vertices; every edge is walked once in each direction, by the same face or by
 * two different faces. An isolated vertex forms a face on its own.
 * <p>
 * For every connected component with V vertices and E edges, the number F of faces walking through it satisfies
 * V - E + F = 2.
 *
 * @author PowSyBl graph theory team
 */
public class PlanarEmbedding {

    private final int[][] rotation;

    private final List<List<Integer>> faces;

    PlanarEmbedding(int[][] rotation) {
        this.rotation = Objects.requireNonNull(rotation);
        this.faces = traceFaces(rotation);
    }

    private static List<List<Integer>> traceFaces(int[][] rotation) {
        int n = rotation.length;
        // position of each neighbor in the rotation of each vertex
        List<Map<Integer, Integer>> positions = new ArrayList<>(n);
        for (int[] r : rotation) {
            Map<Integer, Integer> pos = new HashMap<>();
            for (int k = 0; k < r.length; k++) {
                pos.put(r[k], k);
            }
            positions.add(pos);
        }
        List<Set<Integer>> walkedDarts = new ArrayList<>(n);
        for (int v = 0; v < n; v++) {
            walkedDarts.add(new HashSet<>());
        }
        List<List<Integer>> faces = new ArrayList<>();
        for (int u = 0; u < n; u++) {
            if (rotation[u].length == 0) {
                faces.add(List.of(u));
                continue;
            }
            for (int v : rotation[u]) {
                if (walkedDarts.get(u).contains(v)) {
                    continue;
                }
                List<Integer> face = new ArrayList<>();
                int a = u;
                int b = v;
                while (walkedDarts.get(a).add(b)) {
                    face.add(a);
                    int[] rb = rotation[b];
                    int next = rb[(positions.get(b).get(a) + 1) % rb.length];
                    a = b;
                    b = next;
                }
                faces.add(Collections.unmodifiableList(face));
            }
        }
        return Collections.unmodifiableList(faces);
    }

    public int getVertexCount() {
        return rotation.length;
    }

    /**
     * Neighbors of v in rotation order.
     */
    public int[] getRotation(int v) {
        return rotation[v].clone();
    }

    public List<List<Integer>> getFaces() {
        return faces;
    }

    public int getFaceCount() {
        return faces.size();
    }

    /**
     * Faces walking through at least one of the given vertices.
     */
    public List<List<Integer>> getFaces(Collection<Integer> vertices) {
        Set<Integer> set = new HashSet<>(vertices);
        List<List<Integer>> result = new ArrayList<>();
        for (List<Integer> face : faces) {
            if (face.stream().anyMatch(set::contains)) {
                result.add(face);
            }
        }
        return result;
    }

    /**
     * Index of a longest face among those walking through the given vertices, used as outer face.
     */
    public int getLargestFaceIndex(Collection<Integer> vertices) {
        Set<Integer> set = new HashSet<>(vertices);
        int best = -1;
        for (int f = 0; f < faces.size(); f++) {
            List<Integer> face = faces.get(f);
            if (face.stream().anyMatch(set::contains) && (best < 0 || face.size() > faces.get(best).size())) {
                best = f;
            }
        }
        return best;
    }
}

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
 * Piece of a block not yet embedded, attached to the embedded part through two or more vertices: either a single
 * edge joining two embedded vertices, or a connected set of non embedded vertices with all its edges.
 *
 * @author PowSyBl graph theory team
 */
class Fragment {

    private final SortedSet<Integer> attachments;

    /**
     * Non embedded vertices, empty for a single edge fragment.
     */
    private final Set<Integer> inner;

    private Fragment(SortedSet<Integer> attachments, Set<Integer> inner) {
        this.attachments = attachments;
        this.inner = inner;
    }

    static Fragment ofEdge(int u, int v) {
        return new Fragment(new TreeSet<>(List.of(u, v)), Collections.emptySet());
    }

    static Fragment ofComponent(Set<Integer> inner, SortedSet<Integer> attachments) {
        return new Fragment(attachments, inner);
    }

    SortedSet<Integer> getAttachments() {
        return attachments;
    }

    boolean isAdmissible(Collection<Integer> face) {
        return face.containsAll(attachments);
    }

    /**
     * Path of the fragment joining two distinct attachments, through inner vertices only.
     */
    List<Integer> findPath(Map<Integer, SortedSet<Integer>> adjacency) {
        if (inner.isEmpty()) {
            return new ArrayList<>(attachments);
        }
        int a = attachments.first();
        int start = -1;
        for (int w : adjacency.get(a)) {
            if (inner.contains(w)) {
                start = w;
                break;
            }
        }
        Map<Integer, Integer> parent = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        parent.put(start, a);
        queue.add(start);
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (int w : adjacency.get(v)) {
                if (w != a && attachments.contains(w)) {
                    List<Integer> path = new ArrayList<>();
                    path.add(w);
                    for (int x = v; x != a; x = parent.get(x)) {
                        path.add(x);
                    }
                    path.add(a);
                    Collections.reverse(path);
                    return path;
                }
                if (inner.contains(w) && !parent.containsKey(w)) {
                    parent.put(w, v);
                    queue.add(w);
                }
            }
        }
        throw new IllegalStateException("Fragment attached through a single vertex " + a);
    }

    @Override
    public String toString() {
        return "Fragment(attachments=" + attachments + ", inner=" + inner + ")";
    }
}

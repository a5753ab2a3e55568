/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.traversal;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a depth first or breadth first search: visit order, search tree and depth of each visited vertex.
 *
 * @author PowSyBl graph theory team
 */
public class Traversal {

    public static final int NO_PARENT = -1;

    private final TIntArrayList order;

    private final int[] parent;

    private final int[] discoveryTime;

    private final int[] depth;

    Traversal(int vertexCount) {
        order = new TIntArrayList(vertexCount);
        parent = new int[vertexCount];
        discoveryTime = new int[vertexCount];
        depth = new int[vertexCount];
        Arrays.fill(parent, NO_PARENT);
        Arrays.fill(discoveryTime, -1);
        Arrays.fill(depth, -1);
    }

    void visit(int v, int p) {
        discoveryTime[v] = order.size();
        parent[v] = p;
        depth[v] = p == NO_PARENT ? 0 : depth[p] + 1;
        order.add(v);
    }

    public boolean isVisited(int v) {
        return discoveryTime[v] >= 0;
    }

    /**
     * Visited vertices in visit order.
     */
    public int[] getOrder() {
        return order.toArray();
    }

    public int getVisitedCount() {
        return order.size();
    }

    /**
     * @return the parent of v in the search tree, {@link #NO_PARENT} for a root or an unvisited vertex
     */
    public int getParent(int v) {
        return parent[v];
    }

    /**
     * @return rank of v in the visit order, -1 if not visited
     */
    public int getDiscoveryTime(int v) {
        return discoveryTime[v];
    }

    /**
     * @return distance of v to the root in the search tree, -1 if not visited
     */
    public int getDepth(int v) {
        return depth[v];
    }

    /**
     * Tree path from the root to v, empty if v has not been visited.
     */
    public List<Integer> getPathTo(int v) {
        if (!isVisited(v)) {
            return Collections.emptyList();
        }
        List<Integer> path = new ArrayList<>();
        for (int w = v; w != NO_PARENT; w = parent[w]) {
            path.add(w);
        }
        Collections.reverse(path);
        return path;
    }
}

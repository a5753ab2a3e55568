/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.traversal;

import com.powsybl.graphtheory.graph.Graph;
import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Strongly connected components (Tarjan). A component is emitted when the low-link of a vertex equals its own
 * discovery time, by popping the node stack down to that vertex. For an undirected graph, the components are the
 * connected components.
 *
 * @author PowSyBl graph theory team
 */
public class StronglyConnectedComponentsFinder {

    private final int[][] neighbours;

    private final int[] dfsn;

    private final int[] lowLink;

    private final boolean[] onStack;

    private final int[] next;

    private final TIntArrayList nodeStack = new TIntArrayList();

    private int dfsnCount;

    private List<List<Integer>> components;

    public StronglyConnectedComponentsFinder(Graph graph) {
        Objects.requireNonNull(graph);
        this.neighbours = graph.getAdjacencyLists();
        this.dfsn = new int[neighbours.length];
        this.lowLink = new int[neighbours.length];
        this.onStack = new boolean[neighbours.length];
        this.next = new int[neighbours.length];
    }

    private void discover(int v, TIntArrayList callStack) {
        dfsn[v] = ++dfsnCount;
        lowLink[v] = dfsn[v];
        nodeStack.add(v);
        onStack[v] = true;
        callStack.add(v);
    }

    private void visit(int root) {
        TIntArrayList callStack = new TIntArrayList();
        discover(root, callStack);
        while (!callStack.isEmpty()) {
            int v = callStack.get(callStack.size() - 1);
            if (next[v] < neighbours[v].length) {
                int w = neighbours[v][next[v]++];
                if (dfsn[w] == 0) {
                    discover(w, callStack);
                } else if (onStack[w]) {
                    lowLink[v] = Math.min(lowLink[v], dfsn[w]);
                }
                continue;
            }
            callStack.removeAt(callStack.size() - 1);
            if (lowLink[v] == dfsn[v]) {
                popComponent(v);
            }
            if (!callStack.isEmpty()) {
                int u = callStack.get(callStack.size() - 1);
                lowLink[u] = Math.min(lowLink[u], lowLink[v]);
            }
        }
    }

    private void popComponent(int v) {
        List<Integer> component = new ArrayList<>();
        int w;
        do {
            w = nodeStack.removeAt(nodeStack.size() - 1);
            onStack[w] = false;
            component.add(w);
        } while (w != v);
        Collections.sort(component);
        components.add(component);
    }

    /**
     * Components as sorted vertex lists, in reverse topological order of the condensation.
     */
    public List<List<Integer>> getComponents() {
        if (components == null) {
            components = new ArrayList<>();
            for (int v = 0; v < neighbours.length; v++) {
                if (dfsn[v] == 0) {
                    visit(v);
                }
            }
        }
        return components;
    }
}

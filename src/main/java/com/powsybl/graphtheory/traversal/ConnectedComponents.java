/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.traversal;

import com.powsybl.graphtheory.graph.Graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Connected components of the undirected graph underlying a graph.
 *
 * @author PowSyBl graph theory team
 */
public final class ConnectedComponents {

    private ConnectedComponents() {
    }

    /**
     * Component number of each vertex. Components are numbered in the order of their smallest vertex.
     */
    public static int[] getComponentNumbers(Graph graph) {
        Objects.requireNonNull(graph);
        int[][] adjacency = graph.getUndirectedAdjacencyLists();
        int[] components = new int[adjacency.length];
        Arrays.fill(components, -1);
        int count = 0;
        for (int v = 0; v < adjacency.length; v++) {
            if (components[v] < 0) {
                for (int w : BreadthFirstSearch.run(adjacency, v).getOrder()) {
                    components[w] = count;
                }
                count++;
            }
        }
        return components;
    }

    /**
     * Connected components as sorted vertex lists, in the order of their smallest vertex.
     */
    public static List<List<Integer>> find(Graph graph) {
        int[] components = getComponentNumbers(graph);
        List<List<Integer>> result = new ArrayList<>();
        for (int v = 0; v < components.length; v++) {
            if (components[v] == result.size()) {
                result.add(new ArrayList<>());
            }
            result.get(components[v]).add(v);
        }
        return result;
    }

    public static int getComponentCount(Graph graph) {
        return find(graph).size();
    }

    /**
     * The empty graph is considered connected.
     */
    public static boolean isConnected(Graph graph) {
        return getComponentCount(graph) <= 1;
    }
}

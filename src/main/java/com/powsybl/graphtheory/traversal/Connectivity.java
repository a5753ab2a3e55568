/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.traversal;

import com.powsybl.graphtheory.graph.Edge;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphTransforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Connectivity predicates. Directions are ignored, except for strong connectivity.
 *
 * @author PowSyBl graph theory team
 */
public final class Connectivity {

    private static final Logger LOGGER = LoggerFactory.getLogger(Connectivity.class);

    private Connectivity() {
    }

    public static boolean isConnected(Graph graph) {
        return ConnectedComponents.isConnected(graph);
    }

    public static List<Integer> findCutVertices(Graph graph) {
        return new BiconnectedComponentsFinder(graph).getCutVertices();
    }

    public static List<List<Integer>> findBlocks(Graph graph) {
        return new BiconnectedComponentsFinder(graph).getBlockVertices();
    }

    public static List<Edge> findBridges(Graph graph) {
        return new BridgesFinder(graph).getBridges();
    }

    public static List<List<Integer>> findStronglyConnectedComponents(Graph graph) {
        return new StronglyConnectedComponentsFinder(graph).getComponents();
    }

    /**
     * A graph is biconnected if it is connected and has no cut vertex.
     */
    public static boolean isBiconnected(Graph graph) {
        Objects.requireNonNull(graph);
        return isConnected(graph) && findCutVertices(graph).isEmpty();
    }

    /**
     * A graph is two-edge-connected if it is connected and has no bridge.
     */
    public static boolean isTwoEdgeConnected(Graph graph) {
        Objects.requireNonNull(graph);
        return isConnected(graph) && findBridges(graph).isEmpty();
    }

    /**
     * A graph is triconnected if it is biconnected and removing any single vertex leaves a biconnected graph or a
     * graph with less than 3 vertices. Each vertex removal is tested, in O(V(V+E)).
     */
    public static boolean isTriconnected(Graph graph) {
        if (!isBiconnected(graph)) {
            return false;
        }
        int n = graph.getVertexCount();
        if (n < 4) {
            return true;
        }
        List<Integer> others = new ArrayList<>(n - 1);
        for (int v = 0; v < n; v++) {
            others.clear();
            for (int w = 0; w < n; w++) {
                if (w != v) {
                    others.add(w);
                }
            }
            if (!isBiconnected(GraphTransforms.inducedSubgraph(graph, others))) {
                LOGGER.trace("Removing vertex '{}' breaks biconnectivity", graph.getVertexLabel(v));
                return false;
            }
        }
        return true;
    }

    /**
     * Every vertex reaches every other vertex following arc directions. Same as connectivity for undirected graphs.
     */
    public static boolean isStronglyConnected(Graph graph) {
        Objects.requireNonNull(graph);
        if (!graph.isDirected()) {
            return isConnected(graph);
        }
        return findStronglyConnectedComponents(graph).size() <= 1;
    }
}

/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.traversal.Cycles;
import net.jafama.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Drawing around a leading cycle.
 * <p>
 * The vertices of the leading cycle are evenly spaced on a circle, in cycle order, and the other vertices are placed
 * inside by a spring layout in which the cycle does not move. Without a given cycle, a cycle of the graph is used,
 * and an acyclic graph has all its vertices on the circle in index order.
 *
 * @author PowSyBl graph theory team
 */
public class CircularLayout {

    private static final Logger LOGGER = LoggerFactory.getLogger(CircularLayout.class);

    private final LayoutParameters parameters;

    public CircularLayout(LayoutParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public Layout run(Graph graph) {
        return run(graph, Collections.emptyList());
    }

    /**
     * @param cycle the leading cycle, as a vertex list whose closing edge is implicit, or an empty list to use a cycle
     *              of the graph
     */
    public Layout run(Graph graph, List<Integer> cycle) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(cycle);
        List<Integer> leadingCycle = cycle;
        if (!cycle.isEmpty()) {
            if (!Cycles.isCycle(graph, cycle)) {
                throw new GraphException(GraphError.NOT_A_CYCLE, cycle.toString());
            }
        } else {
            leadingCycle = Cycles.findCycle(graph);
            if (leadingCycle.isEmpty()) {
                LOGGER.debug("No cycle found, vertices placed on a circle in index order");
                leadingCycle = IntStream.range(0, graph.getVertexCount()).boxed().collect(Collectors.toList());
            }
        }

        int n = graph.getVertexCount();
        Layout layout = new Layout(n, 2);
        if (n == 0) {
            return layout;
        }
        int length = leadingCycle.size();
        double k = parameters.getEdgeLength();
        // chord between consecutive cycle vertices is k
        double radius = length > 1 ? k / (2 * FastMath.sin(Math.PI / length)) : 0;
        for (int i = 0; i < length; i++) {
            double angle = 2 * Math.PI * i / length;
            layout.setCoordinates(leadingCycle.get(i), radius * FastMath.cos(angle), radius * FastMath.sin(angle));
        }
        if (length == n) {
            return layout;
        }
        // other vertices start near the center
        Random random = new Random(parameters.getSeed());
        Set<Integer> onCycle = new HashSet<>(leadingCycle);
        for (int v = 0; v < n; v++) {
            if (!onCycle.contains(v)) {
                layout.setCoordinates(v, radius * (random.nextDouble() - 0.5), radius * (random.nextDouble() - 0.5));
            }
        }
        return new SpringLayout(parameters, random).run(graph, layout, onCycle);
    }
}

/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

import com.google.common.base.Stopwatch;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.util.Markers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Force directed placement accelerated by multilevel coarsening.
 * <p>
 * The graph is coarsened repeatedly until it has at most the coarsest size, or until a coarsening step no longer
 * removes a quarter of the vertices. The coarsest graph gets a spring layout, which is then prolonged level by level
 * back to the original graph, scaled to keep the vertex density, and locally relaxed at each level with a low
 * temperature.
 *
 * @author PowSyBl graph theory team
 */
public class MultilevelSpringLayout {

    private static final Logger LOGGER = LoggerFactory.getLogger(MultilevelSpringLayout.class);

    private static final double MIN_REDUCTION_RATIO = 0.75;

    private final LayoutParameters parameters;

    private final Random random;

    private final SpringLayout springLayout;

    public MultilevelSpringLayout(LayoutParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
        this.random = new Random(parameters.getSeed());
        this.springLayout = new SpringLayout(parameters, random);
    }

    /**
     * Coarsening hierarchy of a graph, finest level first.
     */
    public List<CoarseLevel> buildHierarchy(int[][] adjacency) {
        Objects.requireNonNull(adjacency);
        List<CoarseLevel> levels = new ArrayList<>();
        int[][] current = adjacency;
        while (current.length > parameters.getCoarsestSize()) {
            CoarseLevel level = Coarsening.coarsen(current, parameters.getCoarseningMethod());
            if (level.getVertexCount() > MIN_REDUCTION_RATIO * current.length) {
                break;
            }
            levels.add(level);
            current = level.getAdjacency();
        }
        return levels;
    }

    public Layout run(Graph graph) {
        Objects.requireNonNull(graph);
        Stopwatch stopwatch = Stopwatch.createStarted();

        int dimension = parameters.isThreeDimensional() ? 3 : 2;
        int[][] adjacency = graph.getUndirectedAdjacencyLists();
        List<CoarseLevel> levels = buildHierarchy(adjacency);

        int[][] coarsest = levels.isEmpty() ? adjacency : levels.get(levels.size() - 1).getAdjacency();
        double[][] positions = springLayout.randomPositions(coarsest.length, dimension);
        springLayout.relax(coarsest, positions, new boolean[coarsest.length], springLayout.getInitialTemperature(coarsest.length));

        double k = parameters.getEdgeLength();
        for (int l = levels.size() - 1; l >= 0; l--) {
            CoarseLevel level = levels.get(l);
            positions = level.prolong(positions);
            // the finer graph gets the same vertex density as the coarser one, and vertices prolonged to the same
            // position are told apart
            double scale = Math.pow((double) level.getFineVertexCount() / level.getVertexCount(), 1.0 / dimension);
            for (double[] p : positions) {
                for (int d = 0; d < dimension; d++) {
                    p[d] = p[d] * scale + 0.1 * k * (random.nextDouble() - 0.5);
                }
            }
            int[][] fineAdjacency = l == 0 ? adjacency : levels.get(l - 1).getAdjacency();
            springLayout.relax(fineAdjacency, positions, new boolean[positions.length], k);
        }

        stopwatch.stop();
        LOGGER.info("Multilevel layout of {} vertices done with {} coarsening levels", adjacency.length, levels.size());
        LOGGER.debug(Markers.PERFORMANCE_MARKER, "Multilevel layout done in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));

        return new Layout(positions, dimension);
    }
}

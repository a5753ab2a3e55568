/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.path;

import com.google.common.base.Stopwatch;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.util.Markers;
import com.powsybl.math.matrix.DenseMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * All pairs shortest distances in O(V³).
 * <p>
 * Negative edge weights are allowed but negative cycles are not: they are not detected, and the distances computed
 * for a graph having one are meaningless.
 *
 * @author PowSyBl graph theory team
 */
public final class FloydWarshall {

    private static final Logger LOGGER = LoggerFactory.getLogger(FloydWarshall.class);

    private FloydWarshall() {
    }

    /**
     * @return the matrix of distances from row vertex to column vertex, {@link Double#POSITIVE_INFINITY} when
     * unreachable
     */
    public static DenseMatrix compute(Graph graph) {
        Objects.requireNonNull(graph);
        Stopwatch stopwatch = Stopwatch.createStarted();

        int n = graph.getVertexCount();
        double[][] d = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                d[i][j] = i == j ? 0 : Double.POSITIVE_INFINITY;
            }
            for (int j : graph.getNeighbors(i)) {
                d[i][j] = graph.getWeight(i, j);
            }
        }
        for (int k = 0; k < n; k++) {
            double[] dk = d[k];
            for (int i = 0; i < n; i++) {
                double dik = d[i][k];
                if (dik == Double.POSITIVE_INFINITY) {
                    continue;
                }
                double[] di = d[i];
                for (int j = 0; j < n; j++) {
                    if (dik + dk[j] < di[j]) {
                        di[j] = dik + dk[j];
                    }
                }
            }
        }
        DenseMatrix distances = new DenseMatrix(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                distances.set(i, j, d[i][j]);
            }
        }

        stopwatch.stop();
        LOGGER.debug(Markers.PERFORMANCE_MARKER, "All pairs distances of {} vertices computed in {} ms", n,
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return distances;
    }
}

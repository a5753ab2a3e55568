/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;

import java.util.Objects;

/**
 * A coarse graph together with the sparse prolongation P mapping its vertex positions to the positions of the finer
 * graph it has been built from: fine positions are P times coarse positions.
 * <p>
 * P is stored by rows: for each fine vertex, the coarse vertices it is interpolated from and their weights, which sum
 * to 1.
 *
 * @author PowSyBl graph theory team
 */
public class CoarseLevel {

    private final int[][] adjacency;

    private final TIntArrayList[] parents;

    private final TDoubleArrayList[] weights;

    CoarseLevel(int[][] adjacency, TIntArrayList[] parents, TDoubleArrayList[] weights) {
        this.adjacency = Objects.requireNonNull(adjacency);
        this.parents = Objects.requireNonNull(parents);
        this.weights = Objects.requireNonNull(weights);
        if (parents.length != weights.length) {
            throw new IllegalArgumentException("Parents and weights rows differ: " + parents.length + " != " + weights.length);
        }
    }

    /**
     * Adjacency lists of the coarse graph.
     */
    public int[][] getAdjacency() {
        return adjacency;
    }

    public int getVertexCount() {
        return adjacency.length;
    }

    /**
     * Vertex count of the finer graph, that is the number of rows of P.
     */
    public int getFineVertexCount() {
        return parents.length;
    }

    /**
     * Coarse vertices the position of a fine vertex is interpolated from.
     */
    public int[] getParents(int fineVertex) {
        return parents[fineVertex].toArray();
    }

    /**
     * Interpolation weights, in the order of {@link #getParents(int)}.
     */
    public double[] getWeights(int fineVertex) {
        return weights[fineVertex].toArray();
    }

    double[][] prolong(double[][] coarsePositions) {
        int dimension = coarsePositions.length == 0 ? 0 : coarsePositions[0].length;
        double[][] fine = new double[parents.length][dimension];
        for (int v = 0; v < parents.length; v++) {
            for (int k = 0; k < parents[v].size(); k++) {
                double[] coarse = coarsePositions[parents[v].get(k)];
                double w = weights[v].get(k);
                for (int d = 0; d < dimension; d++) {
                    fine[v][d] += w * coarse[d];
                }
            }
        }
        return fine;
    }
}

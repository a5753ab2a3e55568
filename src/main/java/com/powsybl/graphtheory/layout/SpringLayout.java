/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

import com.powsybl.graphtheory.graph.Graph;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TLongObjectHashMap;
import net.jafama.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.Random;

/**
 * Fruchterman-Reingold force directed placement.
 * <p>
 * Two vertices closer than the repulsion radius R repel with a force k²/d and every edge attracts its ends with a
 * force d²/k, k being the edge length. Repelling pairs are found by bucketing vertices in a grid of cells of side R,
 * each vertex only meeting the vertices of its own and adjacent cells. Each iteration moves every free vertex along
 * its resulting force, by at most the current step. With adaptive cooling the step is divided by 0.9 after five
 * consecutive iterations lowering the energy (the sum of squared forces) and multiplied by 0.9 after any other
 * iteration; otherwise it is multiplied by 0.95 at each iteration. Iterations stop when no vertex moves by more than
 * tolerance * k, or after the maximum number of iterations.
 *
 * @author PowSyBl graph theory team
 */
public class SpringLayout {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpringLayout.class);

    private static final double COOLING_FACTOR = 0.95;

    private static final double ADAPTIVE_COOLING_FACTOR = 0.9;

    private static final int ADAPTIVE_PROGRESS_STEPS = 5;

    /**
     * Bits of each cell coordinate in a grid cell key.
     */
    private static final int CELL_BITS = 21;

    private static final long CELL_MASK = (1L << CELL_BITS) - 1;

    /**
     * Cell offset leaving every axis unchanged.
     */
    private static final int SAME_CELL = 13;

    private final LayoutParameters parameters;

    private final Random random;

    public SpringLayout(LayoutParameters parameters) {
        this(parameters, new Random(parameters.getSeed()));
    }

    SpringLayout(LayoutParameters parameters, Random random) {
        this.parameters = Objects.requireNonNull(parameters);
        this.random = Objects.requireNonNull(random);
    }

    public Layout run(Graph graph) {
        Objects.requireNonNull(graph);
        int dimension = parameters.isThreeDimensional() ? 3 : 2;
        int n = graph.getVertexCount();
        double[][] positions = randomPositions(n, dimension);
        relax(graph.getUndirectedAdjacencyLists(), positions, new boolean[n], getInitialTemperature(n));
        return new Layout(positions, dimension);
    }

    /**
     * Relax an existing layout, the given vertices keeping their position.
     */
    public Layout run(Graph graph, Layout initial, Collection<Integer> fixedVertices) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(initial);
        Objects.requireNonNull(fixedVertices);
        int n = graph.getVertexCount();
        if (initial.getVertexCount() != n) {
            throw new IllegalArgumentException("Initial layout has " + initial.getVertexCount() + " vertices, graph has " + n);
        }
        double[][] positions = new double[n][];
        for (int v = 0; v < n; v++) {
            positions[v] = initial.getCoordinates(v);
        }
        boolean[] fixed = new boolean[n];
        for (int v : fixedVertices) {
            fixed[Objects.checkIndex(v, n)] = true;
        }
        relax(graph.getUndirectedAdjacencyLists(), positions, fixed, getInitialTemperature(n));
        return new Layout(positions, initial.getDimension());
    }

    double getInitialTemperature(int vertexCount) {
        double k = parameters.getEdgeLength();
        return Math.max(k * FastMath.sqrt(vertexCount) / 10, k);
    }

    /**
     * Uniform random positions in a cube of side k * sqrt(n).
     */
    double[][] randomPositions(int vertexCount, int dimension) {
        double side = parameters.getEdgeLength() * Math.max(1, FastMath.sqrt(vertexCount));
        double[][] positions = new double[vertexCount][dimension];
        for (double[] p : positions) {
            for (int d = 0; d < dimension; d++) {
                p[d] = side * random.nextDouble();
            }
        }
        return positions;
    }

    /**
     * Move positions in place until stabilization.
     *
     * @return the number of iterations run
     */
    int relax(int[][] adjacency, double[][] positions, boolean[] fixed, double initialTemperature) {
        int n = positions.length;
        if (n == 0) {
            return 0;
        }
        int dimension = positions[0].length;
        double k = parameters.getEdgeLength();
        double minDistance = 1e-6 * k;
        double radius = parameters.getRepulsionRadius() * k;
        double step = initialTemperature;
        double previousEnergy = Double.POSITIVE_INFINITY;
        int progress = 0;
        double[][] displacement = new double[n][dimension];
        double[] delta = new double[dimension];
        int iteration = 0;
        while (iteration < parameters.getMaxIterations()) {
            iteration++;
            for (double[] d : displacement) {
                Arrays.fill(d, 0);
            }
            if (Double.isInfinite(radius)) {
                repulseAllPairs(positions, displacement, delta, minDistance);
            } else {
                repulseWithinRadius(positions, displacement, delta, minDistance, radius);
            }
            for (int i = 0; i < n; i++) {
                for (int j : adjacency[i]) {
                    if (j > i) {
                        double distance = difference(positions[i], positions[j], delta, minDistance);
                        double force = distance * distance / k;
                        accumulate(displacement[i], displacement[j], delta, -force / distance);
                    }
                }
            }
            double maxMove = 0;
            double energy = 0;
            for (int i = 0; i < n; i++) {
                if (fixed[i]) {
                    continue;
                }
                double length = norm(displacement[i]);
                energy += length * length;
                if (length > 0) {
                    double move = Math.min(length, step);
                    for (int d = 0; d < dimension; d++) {
                        positions[i][d] += displacement[i][d] / length * move;
                    }
                    maxMove = Math.max(maxMove, move);
                }
            }
            if (parameters.isAdaptiveCooling()) {
                if (energy < previousEnergy) {
                    progress++;
                    if (progress >= ADAPTIVE_PROGRESS_STEPS) {
                        progress = 0;
                        step /= ADAPTIVE_COOLING_FACTOR;
                    }
                } else {
                    progress = 0;
                    step *= ADAPTIVE_COOLING_FACTOR;
                }
                previousEnergy = energy;
            } else {
                step *= COOLING_FACTOR;
            }
            if (maxMove < parameters.getTolerance() * k) {
                break;
            }
        }
        LOGGER.trace("Spring layout of {} vertices stabilized after {} iterations", n, iteration);
        return iteration;
    }

    private void repulseAllPairs(double[][] positions, double[][] displacement, double[] delta, double minDistance) {
        double k2 = parameters.getEdgeLength() * parameters.getEdgeLength();
        for (int i = 0; i < positions.length; i++) {
            for (int j = i + 1; j < positions.length; j++) {
                double distance = difference(positions[i], positions[j], delta, minDistance);
                accumulate(displacement[i], displacement[j], delta, k2 / distance / distance);
            }
        }
    }

    /**
     * Repulsion between the vertices closer than the radius, each vertex meeting the vertices of the 3^d cells around
     * its own cell.
     */
    private void repulseWithinRadius(double[][] positions, double[][] displacement, double[] delta, double minDistance,
                                     double radius) {
        double k2 = parameters.getEdgeLength() * parameters.getEdgeLength();
        int dimension = delta.length;
        TLongObjectHashMap<TIntArrayList> cells = new TLongObjectHashMap<>();
        for (int i = 0; i < positions.length; i++) {
            long key = cellKey(positions[i], radius, SAME_CELL);
            TIntArrayList cell = cells.get(key);
            if (cell == null) {
                cell = new TIntArrayList();
                cells.put(key, cell);
            }
            cell.add(i);
        }
        int neighborCellCount = dimension == 2 ? 9 : 27;
        for (int i = 0; i < positions.length; i++) {
            for (int c = 0; c < neighborCellCount; c++) {
                TIntArrayList cell = cells.get(cellKey(positions[i], radius, c));
                if (cell == null) {
                    continue;
                }
                for (int m = 0; m < cell.size(); m++) {
                    int j = cell.get(m);
                    if (j <= i) {
                        continue;
                    }
                    double distance = difference(positions[i], positions[j], delta, minDistance);
                    if (distance < radius) {
                        accumulate(displacement[i], displacement[j], delta, k2 / distance / distance);
                    }
                }
            }
        }
    }

    /**
     * Key of the cell containing a point, moved by an offset whose base 3 digits, first axis first, give the move
     * along each axis: 0 for -1, 1 for none, 2 for +1.
     */
    private static long cellKey(double[] p, double side, int offset) {
        long key = 0;
        int o = offset;
        for (int d = 0; d < 3; d++) {
            long cell = 0;
            if (d < p.length) {
                cell = (long) Math.floor(p[d] / side) + o % 3 - 1;
                o /= 3;
            }
            key = (key << CELL_BITS) | (cell & CELL_MASK);
        }
        return key;
    }

    /**
     * Store p - q in delta and return its norm. Coincident points are separated along a random direction.
     */
    private double difference(double[] p, double[] q, double[] delta, double minDistance) {
        for (int d = 0; d < delta.length; d++) {
            delta[d] = p[d] - q[d];
        }
        double distance = norm(delta);
        if (distance < minDistance) {
            for (int d = 0; d < delta.length; d++) {
                delta[d] = random.nextDouble() - 0.5;
            }
            double length = norm(delta);
            if (length == 0) {
                delta[0] = 1;
                length = 1;
            }
            for (int d = 0; d < delta.length; d++) {
                delta[d] *= minDistance / length;
            }
            distance = minDistance;
        }
        return distance;
    }

    private static void accumulate(double[] di, double[] dj, double[] delta, double factor) {
        for (int d = 0; d < delta.length; d++) {
            di[d] += delta[d] * factor;
            dj[d] -= delta[d] * factor;
        }
    }

    private static double norm(double[] v) {
        double sum = 0;
        for (double x : v) {
            sum += x * x;
        }
        return FastMath.sqrt(sum);
    }
}

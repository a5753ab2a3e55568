/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

import com.powsybl.commons.config.PlatformConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Layout tuning parameters, loaded from the "graph-layout-default-parameters" module of the platform configuration.
 *
 * @author PowSyBl graph theory team
 */
public class LayoutParameters {

    public static final String MODULE_NAME = "graph-layout-default-parameters";

    public static final String EDGE_LENGTH_PARAM_NAME = "edgeLength";
    public static final String TOLERANCE_PARAM_NAME = "tolerance";
    public static final String MAX_ITERATIONS_PARAM_NAME = "maxIterations";
    public static final String REPULSION_RADIUS_PARAM_NAME = "repulsionRadius";
    public static final String ADAPTIVE_COOLING_PARAM_NAME = "adaptiveCooling";
    public static final String MULTILEVEL_THRESHOLD_PARAM_NAME = "multilevelThreshold";
    public static final String COARSENING_METHOD_PARAM_NAME = "coarseningMethod";
    public static final String COARSEST_SIZE_PARAM_NAME = "coarsestSize";
    public static final String SEPARATION_PARAM_NAME = "separation";
    public static final String TREE_LEVEL_SEPARATION_PARAM_NAME = "treeLevelSeparation";
    public static final String TREE_SIBLING_SEPARATION_PARAM_NAME = "treeSiblingSeparation";
    public static final String THREE_DIMENSIONAL_PARAM_NAME = "threeDimensional";
    public static final String SEED_PARAM_NAME = "seed";

    public static final double EDGE_LENGTH_DEFAULT_VALUE = 1.0;
    public static final double TOLERANCE_DEFAULT_VALUE = 1e-3;
    public static final int MAX_ITERATIONS_DEFAULT_VALUE = 500;
    public static final double REPULSION_RADIUS_DEFAULT_VALUE = 8.0;
    public static final boolean ADAPTIVE_COOLING_DEFAULT_VALUE = true;
    public static final int MULTILEVEL_THRESHOLD_DEFAULT_VALUE = 100;
    public static final CoarseningMethod COARSENING_METHOD_DEFAULT_VALUE = CoarseningMethod.MIS;
    public static final int COARSEST_SIZE_DEFAULT_VALUE = 10;
    public static final double SEPARATION_DEFAULT_VALUE = 1.0;
    public static final double TREE_LEVEL_SEPARATION_DEFAULT_VALUE = 1.0;
    public static final double TREE_SIBLING_SEPARATION_DEFAULT_VALUE = 1.0;
    public static final boolean THREE_DIMENSIONAL_DEFAULT_VALUE = false;
    public static final long SEED_DEFAULT_VALUE = 0L;

    private double edgeLength = EDGE_LENGTH_DEFAULT_VALUE;

    private double tolerance = TOLERANCE_DEFAULT_VALUE;

    private int maxIterations = MAX_ITERATIONS_DEFAULT_VALUE;

    private double repulsionRadius = REPULSION_RADIUS_DEFAULT_VALUE;

    private boolean adaptiveCooling = ADAPTIVE_COOLING_DEFAULT_VALUE;

    private int multilevelThreshold = MULTILEVEL_THRESHOLD_DEFAULT_VALUE;

    private CoarseningMethod coarseningMethod = COARSENING_METHOD_DEFAULT_VALUE;

    private int coarsestSize = COARSEST_SIZE_DEFAULT_VALUE;

    private double separation = SEPARATION_DEFAULT_VALUE;

    private double treeLevelSeparation = TREE_LEVEL_SEPARATION_DEFAULT_VALUE;

    private double treeSiblingSeparation = TREE_SIBLING_SEPARATION_DEFAULT_VALUE;

    private boolean threeDimensional = THREE_DIMENSIONAL_DEFAULT_VALUE;

    private long seed = SEED_DEFAULT_VALUE;

    private static double checkPositive(double value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException("Invalid " + name + " value: " + value);
        }
        return value;
    }

    private static int checkPositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException("Invalid " + name + " value: " + value);
        }
        return value;
    }

    public double getEdgeLength() {
        return edgeLength;
    }

    public LayoutParameters setEdgeLength(double edgeLength) {
        this.edgeLength = checkPositive(edgeLength, EDGE_LENGTH_PARAM_NAME);
        return this;
    }

    /**
     * Force directed placement stops when no vertex moves more than tolerance times the edge length.
     */
    public double getTolerance() {
        return tolerance;
    }

    public LayoutParameters setTolerance(double tolerance) {
        this.tolerance = checkPositive(tolerance, TOLERANCE_PARAM_NAME);
        return this;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public LayoutParameters setMaxIterations(int maxIterations) {
        this.maxIterations = checkPositive(maxIterations, MAX_ITERATIONS_PARAM_NAME);
        return this;
    }

    /**
     * Distance, in edge length units, beyond which two vertices no longer repel each other.
     * {@link Double#POSITIVE_INFINITY} makes every pair of vertices repel.
     */
    public double getRepulsionRadius() {
        return repulsionRadius;
    }

    public LayoutParameters setRepulsionRadius(double repulsionRadius) {
        this.repulsionRadius = checkPositive(repulsionRadius, REPULSION_RADIUS_PARAM_NAME);
        return this;
    }

    /**
     * With adaptive cooling, the step grows after a run of iterations decreasing the energy and shrinks after any
     * other iteration. Otherwise it shrinks geometrically at each iteration.
     */
    public boolean isAdaptiveCooling() {
        return adaptiveCooling;
    }

    public LayoutParameters setAdaptiveCooling(boolean adaptiveCooling) {
        this.adaptiveCooling = adaptiveCooling;
        return this;
    }

    /**
     * Vertex count above which a connected component is laid out by multilevel coarsening.
     */
    public int getMultilevelThreshold() {
        return multilevelThreshold;
    }

    public LayoutParameters setMultilevelThreshold(int multilevelThreshold) {
        this.multilevelThreshold = checkPositive(multilevelThreshold, MULTILEVEL_THRESHOLD_PARAM_NAME);
        return this;
    }

    public CoarseningMethod getCoarseningMethod() {
        return coarseningMethod;
    }

    public LayoutParameters setCoarseningMethod(CoarseningMethod coarseningMethod) {
        this.coarseningMethod = Objects.requireNonNull(coarseningMethod);
        return this;
    }

    /**
     * Coarsening stops once a graph has at most this many vertices.
     */
    public int getCoarsestSize() {
        return coarsestSize;
    }

    public LayoutParameters setCoarsestSize(int coarsestSize) {
        this.coarsestSize = checkPositive(coarsestSize, COARSEST_SIZE_PARAM_NAME);
        return this;
    }

    /**
     * Margin between the bounding rectangles of packed components, in edge length units.
     */
    public double getSeparation() {
        return separation;
    }

    public LayoutParameters setSeparation(double separation) {
        this.separation = checkPositive(separation, SEPARATION_PARAM_NAME);
        return this;
    }

    public double getTreeLevelSeparation() {
        return treeLevelSeparation;
    }

    public LayoutParameters setTreeLevelSeparation(double treeLevelSeparation) {
        this.treeLevelSeparation = checkPositive(treeLevelSeparation, TREE_LEVEL_SEPARATION_PARAM_NAME);
        return this;
    }

    public double getTreeSiblingSeparation() {
        return treeSiblingSeparation;
    }

    public LayoutParameters setTreeSiblingSeparation(double treeSiblingSeparation) {
        this.treeSiblingSeparation = checkPositive(treeSiblingSeparation, TREE_SIBLING_SEPARATION_PARAM_NAME);
        return this;
    }

    public boolean isThreeDimensional() {
        return threeDimensional;
    }

    public LayoutParameters setThreeDimensional(boolean threeDimensional) {
        this.threeDimensional = threeDimensional;
        return this;
    }

    public long getSeed() {
        return seed;
    }

    public LayoutParameters setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    public static LayoutParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static LayoutParameters load(PlatformConfig platformConfig) {
        Objects.requireNonNull(platformConfig);
        LayoutParameters parameters = new LayoutParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setEdgeLength(config.getDoubleProperty(EDGE_LENGTH_PARAM_NAME, EDGE_LENGTH_DEFAULT_VALUE))
                .setTolerance(config.getDoubleProperty(TOLERANCE_PARAM_NAME, TOLERANCE_DEFAULT_VALUE))
                .setMaxIterations(config.getIntProperty(MAX_ITERATIONS_PARAM_NAME, MAX_ITERATIONS_DEFAULT_VALUE))
                .setRepulsionRadius(config.getDoubleProperty(REPULSION_RADIUS_PARAM_NAME, REPULSION_RADIUS_DEFAULT_VALUE))
                .setAdaptiveCooling(config.getBooleanProperty(ADAPTIVE_COOLING_PARAM_NAME, ADAPTIVE_COOLING_DEFAULT_VALUE))
                .setMultilevelThreshold(config.getIntProperty(MULTILEVEL_THRESHOLD_PARAM_NAME, MULTILEVEL_THRESHOLD_DEFAULT_VALUE))
                .setCoarseningMethod(config.getEnumProperty(COARSENING_METHOD_PARAM_NAME, CoarseningMethod.class, COARSENING_METHOD_DEFAULT_VALUE))
                .setCoarsestSize(config.getIntProperty(COARSEST_SIZE_PARAM_NAME, COARSEST_SIZE_DEFAULT_VALUE))
                .setSeparation(config.getDoubleProperty(SEPARATION_PARAM_NAME, SEPARATION_DEFAULT_VALUE))
                .setTreeLevelSeparation(config.getDoubleProperty(TREE_LEVEL_SEPARATION_PARAM_NAME, TREE_LEVEL_SEPARATION_DEFAULT_VALUE))
                .setTreeSiblingSeparation(config.getDoubleProperty(TREE_SIBLING_SEPARATION_PARAM_NAME, TREE_SIBLING_SEPARATION_DEFAULT_VALUE))
                .setThreeDimensional(config.getBooleanProperty(THREE_DIMENSIONAL_PARAM_NAME, THREE_DIMENSIONAL_DEFAULT_VALUE))
                .setSeed(config.getLongProperty(SEED_PARAM_NAME, SEED_DEFAULT_VALUE)));
        return parameters;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(13);
        map.put(EDGE_LENGTH_PARAM_NAME, edgeLength);
        map.put(TOLERANCE_PARAM_NAME, tolerance);
        map.put(MAX_ITERATIONS_PARAM_NAME, maxIterations);
        map.put(REPULSION_RADIUS_PARAM_NAME, repulsionRadius);
        map.put(ADAPTIVE_COOLING_PARAM_NAME, adaptiveCooling);
        map.put(MULTILEVEL_THRESHOLD_PARAM_NAME, multilevelThreshold);
        map.put(COARSENING_METHOD_PARAM_NAME, coarseningMethod);
        map.put(COARSEST_SIZE_PARAM_NAME, coarsestSize);
        map.put(SEPARATION_PARAM_NAME, separation);
        map.put(TREE_LEVEL_SEPARATION_PARAM_NAME, treeLevelSeparation);
        map.put(TREE_SIBLING_SEPARATION_PARAM_NAME, treeSiblingSeparation);
        map.put(THREE_DIMENSIONAL_PARAM_NAME, threeDimensional);
        map.put(SEED_PARAM_NAME, seed);
        return map;
    }

    @Override
    public String toString() {
        return "LayoutParameters(" + toMap().entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(", ")) + ")";
    }
}

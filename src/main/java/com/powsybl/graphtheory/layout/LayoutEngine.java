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
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.graph.GraphTransforms;
import com.powsybl.graphtheory.planar.PlanarEmbedder;
import com.powsybl.graphtheory.traversal.ConnectedComponents;
import com.powsybl.graphtheory.traversal.Connectivity;
import com.powsybl.graphtheory.traversal.Cycles;
import com.powsybl.graphtheory.traversal.Trees;
import com.powsybl.graphtheory.util.Markers;
import net.jafama.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of graph drawing.
 * <p>
 * Graphs are drawn through their underlying undirected graph. In two dimensions, every connected component is laid
 * out on its own and the components are packed with the configured separation. Spring drawings are rotated so that
 * their principal axis is horizontal, circular and planar drawings so that a mirror symmetry axis is vertical when
 * they have one. Trees keep their root on top, or at the center for radial trees. When no style is requested, a tree component is
 * drawn as a tree, a small biconnected planar component as a planar drawing and any other component with springs.
 * Finally the drawing is scaled so that its largest side is k * sqrt(n), k being the edge length.
 * <p>
 * Three dimensional drawing only supports the spring style, on connected graphs.
 *
 * @author PowSyBl graph theory team
 */
public class LayoutEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutParameters parameters;

    public LayoutEngine() {
        this(LayoutParameters.load());
    }

    public LayoutEngine(LayoutParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public LayoutParameters getParameters() {
        return parameters;
    }

    /**
     * Layout with a style guessed for each connected component.
     */
    public Layout layout(Graph graph) {
        return layout(graph, null, Collections.emptyList(), Collections.emptyList());
    }

    public Layout layout(Graph graph, LayoutStyle style) {
        return layout(graph, Objects.requireNonNull(style), Collections.emptyList(), Collections.emptyList());
    }

    /**
     * Tree layout of a forest.
     *
     * @param roots one root per connected component, or an empty list to root each component at its smallest vertex
     */
    public Layout layoutTree(Graph graph, List<Integer> roots) {
        return layout(graph, LayoutStyle.TREE, roots, Collections.emptyList());
    }

    /**
     * Radial tree layout of a forest.
     *
     * @param roots one root per connected component, or an empty list to root each component at its smallest vertex
     */
    public Layout layoutRadialTree(Graph graph, List<Integer> roots) {
        return layout(graph, LayoutStyle.RADIAL_TREE, roots, Collections.emptyList());
    }

    /**
     * Circular layout around a leading cycle.
     *
     * @param cycle the leading cycle, or an empty list to use a cycle found in each connected component
     */
    public Layout layoutCircle(Graph graph, List<Integer> cycle) {
        return layout(graph, LayoutStyle.CIRCLE, Collections.emptyList(), cycle);
    }

    private Layout layout(Graph graph, LayoutStyle style, List<Integer> roots, List<Integer> cycle) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(roots);
        Objects.requireNonNull(cycle);
        Stopwatch stopwatch = Stopwatch.createStarted();

        Graph underlying = GraphTransforms.underlying(graph);
        int n = underlying.getVertexCount();
        Layout layout;
        if (parameters.isThreeDimensional()) {
            layout = layout3d(underlying, style);
        } else {
            layout = layout2d(underlying, style, roots, cycle);
        }
        normalizeSize(layout);

        stopwatch.stop();
        LOGGER.debug(Markers.PERFORMANCE_MARKER, "Layout of {} vertices done in {} ms", n, stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return layout;
    }

    private Layout layout3d(Graph graph, LayoutStyle style) {
        if (style != null && style != LayoutStyle.SPRING) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "style " + style + " has no three dimensional version");
        }
        if (!Connectivity.isConnected(graph)) {
            throw new GraphException(GraphError.CONNECTED_GRAPH_REQUIRED);
        }
        return springLayout(graph);
    }

    private Layout layout2d(Graph graph, LayoutStyle style, List<Integer> roots, List<Integer> cycle) {
        int n = graph.getVertexCount();
        int[] componentNumbers = ConnectedComponents.getComponentNumbers(graph);
        List<List<Integer>> components = ConnectedComponents.find(graph);
        int[] treeRoots = style == LayoutStyle.TREE || style == LayoutStyle.RADIAL_TREE ? TreeLayout.resolveRoots(graph, roots) : null;
        int cycleComponent = -1;
        if (!cycle.isEmpty()) {
            if (!Cycles.isCycle(graph, cycle)) {
                throw new GraphException(GraphError.NOT_A_CYCLE, cycle.toString());
            }
            cycleComponent = componentNumbers[cycle.get(0)];
        }

        Layout layout = new Layout(n, 2);
        List<Layout> componentLayouts = new ArrayList<>(components.size());
        List<Rectangle> boxes = new ArrayList<>(components.size());
        for (List<Integer> component : components) {
            int c = componentNumbers[component.get(0)];
            Graph sub = GraphTransforms.inducedSubgraph(graph, component);
            // component vertices are sorted, so the local index of a vertex is its rank in the component
            Layout componentLayout;
            LayoutStyle componentStyle = style != null ? style : guessStyle(sub);
            switch (componentStyle) {
                case TREE -> {
                    int root = treeRoots != null ? Collections.binarySearch(component, treeRoots[c]) : 0;
                    componentLayout = new TreeLayout(parameters).run(sub, List.of(root));
                }
                case RADIAL_TREE -> {
                    int root = treeRoots != null ? Collections.binarySearch(component, treeRoots[c]) : 0;
                    TreeLayout treeLayout = new TreeLayout(parameters);
                    componentLayout = treeLayout.toPolar(treeLayout.run(sub, List.of(root)));
                }
                case CIRCLE -> {
                    List<Integer> localCycle = new ArrayList<>();
                    if (c == cycleComponent) {
                        for (int v : cycle) {
                            localCycle.add(Collections.binarySearch(component, v));
                        }
                    }
                    componentLayout = new CircularLayout(parameters).run(sub, localCycle).alignSymmetryAxis(parameters.getTolerance());
                }
                case PLANAR -> componentLayout = new PlanarLayout(parameters).run(sub).alignSymmetryAxis(parameters.getTolerance());
                case SPRING -> componentLayout = springLayout(sub).alignPrincipalAxis();
                default -> throw new IllegalStateException("Unknown layout style: " + componentStyle);
            }
            LOGGER.trace("Component of {} vertices laid out with style {}", component.size(), componentStyle);
            componentLayouts.add(componentLayout);
            boxes.add(componentLayout.getBoundingBox());
        }

        List<Rectangle> packed = RectanglePacker.pack(boxes, parameters.getSeparation() * parameters.getEdgeLength());
        for (int i = 0; i < components.size(); i++) {
            List<Integer> component = components.get(i);
            Layout componentLayout = componentLayouts.get(i);
            Rectangle box = boxes.get(i);
            Rectangle target = packed.get(i);
            componentLayout.translate(target.x() - box.x(), target.y() - box.y());
            for (int local = 0; local < component.size(); local++) {
                layout.setCoordinates(component.get(local), componentLayout.getCoordinates(local));
            }
        }
        return layout;
    }

    private LayoutStyle guessStyle(Graph component) {
        if (Trees.isTree(component)) {
            return LayoutStyle.TREE;
        }
        if (component.getVertexCount() <= parameters.getMultilevelThreshold() && Connectivity.isBiconnected(component)
                && PlanarEmbedder.isPlanar(component)) {
            return LayoutStyle.PLANAR;
        }
        return LayoutStyle.SPRING;
    }

    private Layout springLayout(Graph graph) {
        if (graph.getVertexCount() > parameters.getMultilevelThreshold()) {
            return new MultilevelSpringLayout(parameters).run(graph);
        }
        return new SpringLayout(parameters).run(graph);
    }

    private void normalizeSize(Layout layout) {
        int n = layout.getVertexCount();
        if (n < 2) {
            return;
        }
        double[][] coordinates = layout.getCoordinatesArray();
        double size = 0;
        for (int d = 0; d < layout.getDimension(); d++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] p : coordinates) {
                min = Math.min(min, p[d]);
                max = Math.max(max, p[d]);
            }
            size = Math.max(size, max - min);
        }
        if (size > 0) {
            layout.scale(parameters.getEdgeLength() * FastMath.sqrt(n) / size);
        }
    }
}

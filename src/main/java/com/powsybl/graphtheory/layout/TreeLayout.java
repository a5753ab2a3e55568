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
import com.powsybl.graphtheory.graph.GraphTransforms;
import com.powsybl.graphtheory.traversal.ConnectedComponents;
import com.powsybl.graphtheory.traversal.Trees;
import net.jafama.FastMath;

import java.util.*;

/**
 * Layered drawing of a forest, each tree hanging from its root.
 * <p>
 * Horizontal positions follow the algorithm of Walker, in the linear time version of Buchheim, Jünger and Leipert: a
 * post-order pass gives each vertex a preliminary position relative to its siblings and a modifier to apply to its
 * whole subtree, shifting subtrees apart as soon as their contours get closer than the sibling separation. A pre-order
 * pass then accumulates the modifiers from the root. A parent is centered above its leftmost and rightmost children.
 * Trees of a forest are placed side by side, from left to right in the order of their smallest vertex.
 *
 * @author PowSyBl graph theory team
 */
public class TreeLayout {

    private static final int NONE = -1;

    private final LayoutParameters parameters;

    public TreeLayout(LayoutParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    /**
     * Root of each connected component, indexed by component number.
     *
     * @param roots one root per connected component, or an empty list to root each component at its smallest vertex
     */
    public static int[] resolveRoots(Graph graph, List<Integer> roots) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(roots);
        int[] componentNumbers = ConnectedComponents.getComponentNumbers(graph);
        int componentCount = Arrays.stream(componentNumbers).max().orElse(-1) + 1;
        int[] resolved = new int[componentCount];
        Arrays.fill(resolved, NONE);
        if (roots.isEmpty()) {
            for (int v = componentNumbers.length - 1; v >= 0; v--) {
                resolved[componentNumbers[v]] = v;
            }
            return resolved;
        }
        if (roots.size() != componentCount) {
            throw new GraphException(GraphError.INVALID_NUMBER_OF_ROOTS,
                    roots.size() + " roots given for " + componentCount + " connected components");
        }
        for (int root : roots) {
            int c = componentNumbers[Objects.checkIndex(root, componentNumbers.length)];
            if (resolved[c] != NONE) {
                throw new GraphException(GraphError.INVALID_ROOT, "vertices " + resolved[c] + " and " + root
                        + " are roots of the same connected component");
            }
            resolved[c] = root;
        }
        return resolved;
    }

    public Layout run(Graph graph) {
        return run(graph, Collections.emptyList());
    }

    public Layout run(Graph graph, List<Integer> roots) {
        Objects.requireNonNull(graph);
        if (!Trees.isForest(graph.isDirected() ? GraphTransforms.underlying(graph) : graph)) {
            throw new GraphException(GraphError.NOT_A_TREE);
        }
        int[] treeRoots = resolveRoots(graph, roots);
        int n = graph.getVertexCount();
        Layout layout = new Layout(n, 2);
        if (n == 0) {
            return layout;
        }
        TreeState state = new TreeState(graph.getUndirectedAdjacencyLists());
        double offset = 0;
        for (int root : treeRoots) {
            List<Integer> vertices = state.layoutTree(root);
            double minX = Double.POSITIVE_INFINITY;
            double maxX = Double.NEGATIVE_INFINITY;
            for (int v : vertices) {
                minX = Math.min(minX, state.x[v]);
                maxX = Math.max(maxX, state.x[v]);
            }
            for (int v : vertices) {
                layout.setCoordinates(v, (state.x[v] - minX + offset) * parameters.getTreeSiblingSeparation(),
                        -state.depth[v] * parameters.getTreeLevelSeparation());
            }
            offset += maxX - minX + 1;
        }
        return layout;
    }

    /**
     * Radial drawing of a tree from its layered drawing: the horizontal position becomes an angle and the depth a
     * radius, so that the root sits at the origin and each level on a circle around it. The angles span the full turn
     * minus one sibling separation, so that the leftmost and rightmost vertices do not meet.
     */
    public Layout toPolar(Layout layered) {
        Objects.requireNonNull(layered);
        int n = layered.getVertexCount();
        Layout polar = new Layout(n, 2);
        if (n == 0) {
            return polar;
        }
        Rectangle box = layered.getBoundingBox();
        double span = box.width() + parameters.getTreeSiblingSeparation();
        double top = box.y() + box.height();
        for (int v = 0; v < n; v++) {
            double angle = 2 * Math.PI * (layered.getX(v) - box.x()) / span;
            double radius = top - layered.getY(v);
            polar.setCoordinates(v, radius * FastMath.cos(angle), radius * FastMath.sin(angle));
        }
        return polar;
    }

    /**
     * Walker positioning workspace, indexed by vertex. Distances are in sibling separation units.
     */
    private static final class TreeState {

        private final int[][] adjacency;
        private final int[] parent;
        private final int[][] children;
        private final int[] number;
        private final int[] depth;
        private final int[] thread;
        private final int[] ancestor;
        private final double[] prelim;
        private final double[] mod;
        private final double[] shift;
        private final double[] change;
        private final double[] midpoint;
        private final double[] x;

        private TreeState(int[][] adjacency) {
            this.adjacency = adjacency;
            int n = adjacency.length;
            parent = new int[n];
            children = new int[n][];
            number = new int[n];
            depth = new int[n];
            thread = new int[n];
            ancestor = new int[n];
            prelim = new double[n];
            mod = new double[n];
            shift = new double[n];
            change = new double[n];
            midpoint = new double[n];
            x = new double[n];
        }

        /**
         * @return the vertices of the tree, in breadth first order
         */
        private List<Integer> layoutTree(int root) {
            List<Integer> order = new ArrayList<>();
            parent[root] = NONE;
            depth[root] = 0;
            order.add(root);
            for (int k = 0; k < order.size(); k++) {
                int v = order.get(k);
                int[] c = Arrays.stream(adjacency[v]).filter(w -> w != parent[v]).toArray();
                children[v] = c;
                thread[v] = NONE;
                ancestor[v] = v;
                prelim[v] = 0;
                mod[v] = 0;
                shift[v] = 0;
                change[v] = 0;
                for (int i = 0; i < c.length; i++) {
                    parent[c[i]] = v;
                    number[c[i]] = i + 1;
                    depth[c[i]] = depth[v] + 1;
                    order.add(c[i]);
                }
            }
            // first walk, children before parents
            for (int k = order.size() - 1; k >= 0; k--) {
                int v = order.get(k);
                int[] c = children[v];
                if (c.length == 0) {
                    continue;
                }
                int defaultAncestor = c[0];
                for (int i = 0; i < c.length; i++) {
                    place(c[i], i > 0 ? c[i - 1] : NONE);
                    defaultAncestor = apportion(c[i], i > 0 ? c[i - 1] : NONE, defaultAncestor);
                }
                executeShifts(v);
                midpoint[v] = (prelim[c[0]] + prelim[c[c.length - 1]]) / 2;
            }
            place(root, NONE);
            // second walk, parents before children
            x[root] = prelim[root];
            double[] modSum = new double[adjacency.length];
            for (int v : order) {
                for (int w : children[v]) {
                    modSum[w] = modSum[v] + mod[v];
                    x[w] = prelim[w] + modSum[w];
                }
            }
            return order;
        }

        private void place(int v, int leftSibling) {
            if (children[v].length == 0) {
                prelim[v] = leftSibling != NONE ? prelim[leftSibling] + 1 : 0;
            } else if (leftSibling != NONE) {
                prelim[v] = prelim[leftSibling] + 1;
                mod[v] = prelim[v] - midpoint[v];
            } else {
                prelim[v] = midpoint[v];
            }
        }

        private int nextLeft(int v) {
            return children[v].length > 0 ? children[v][0] : thread[v];
        }

        private int nextRight(int v) {
            return children[v].length > 0 ? children[v][children[v].length - 1] : thread[v];
        }

        private int apportion(int v, int leftSibling, int defaultAncestor) {
            if (leftSibling == NONE) {
                return defaultAncestor;
            }
            int vip = v;
            int vop = v;
            int vim = leftSibling;
            int vom = children[parent[v]][0];
            double sip = mod[vip];
            double sop = mod[vop];
            double sim = mod[vim];
            double som = mod[vom];
            int result = defaultAncestor;
            while (nextRight(vim) != NONE && nextLeft(vip) != NONE) {
                vim = nextRight(vim);
                vip = nextLeft(vip);
                vom = nextLeft(vom);
                vop = nextRight(vop);
                ancestor[vop] = v;
                double s = prelim[vim] + sim - (prelim[vip] + sip) + 1;
                if (s > 0) {
                    int a = parent[ancestor[vim]] == parent[v] ? ancestor[vim] : result;
                    moveSubtree(a, v, s);
                    sip += s;
                    sop += s;
                }
                sim += mod[vim];
                sip += mod[vip];
                som += mod[vom];
                sop += mod[vop];
            }
            if (nextRight(vim) != NONE && nextRight(vop) == NONE) {
                thread[vop] = nextRight(vim);
                mod[vop] += sim - sop;
            }
            if (nextLeft(vip) != NONE && nextLeft(vom) == NONE) {
                thread[vom] = nextLeft(vip);
                mod[vom] += sip - som;
                result = v;
            }
            return result;
        }

        private void moveSubtree(int wm, int wp, double s) {
            double subtrees = number[wp] - number[wm];
            change[wp] -= s / subtrees;
            shift[wp] += s;
            change[wm] += s / subtrees;
            prelim[wp] += s;
            mod[wp] += s;
        }

        private void executeShifts(int v) {
            double s = 0;
            double c = 0;
            int[] ch = children[v];
            for (int i = ch.length - 1; i >= 0; i--) {
                int w = ch[i];
                prelim[w] += s;
                mod[w] += s;
                c += change[w];
                s += shift[w] + c;
            }
        }
    }
}

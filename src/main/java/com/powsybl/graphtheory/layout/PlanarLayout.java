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
import com.powsybl.graphtheory.planar.PlanarEmbedder;
import com.powsybl.graphtheory.planar.PlanarEmbedding;
import com.powsybl.graphtheory.planar.Triangulator;
import com.powsybl.graphtheory.traversal.Connectivity;
import net.jafama.FastMath;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Straight line drawing without crossing of a connected planar graph.
 * <p>
 * The graph is first made biconnected and embedded. Its largest face becomes the outer face, drawn as a regular
 * polygon, and every other face is triangulated. Inner vertices are then placed by the barycentric method of Tutte:
 * each one is at the barycenter of its neighbors in the triangulated graph, which is a linear system in the inner
 * vertex coordinates.
 *
 * @author PowSyBl graph theory team
 */
public class PlanarLayout {

    private final LayoutParameters parameters;

    public PlanarLayout(LayoutParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public Layout run(Graph graph) {
        Objects.requireNonNull(graph);
        int n = graph.getVertexCount();
        Layout layout = new Layout(n, 2);
        double k = parameters.getEdgeLength();
        if (n <= 2) {
            for (int v = 0; v < n; v++) {
                layout.setCoordinates(v, v * k, 0);
            }
            if (n == 2 && !Connectivity.isConnected(graph)) {
                throw new GraphException(GraphError.CONNECTED_GRAPH_REQUIRED);
            }
            return layout;
        }
        Graph augmented = Triangulator.makeBiconnected(graph);
        PlanarEmbedding embedding = PlanarEmbedder.embedOrThrow(augmented);
        List<Integer> all = IntStream.range(0, n).boxed().collect(Collectors.toList());
        int outer = embedding.getLargestFaceIndex(all);
        Triangulator.Triangulation triangulation = Triangulator.triangulate(augmented, embedding, outer);
        List<Integer> outerFace = embedding.getFaces().get(outer);

        // outer face on a regular polygon with sides of length k
        int length = outerFace.size();
        double radius = k / (2 * FastMath.sin(Math.PI / length));
        boolean[] isOuter = new boolean[n];
        for (int i = 0; i < length; i++) {
            double angle = 2 * Math.PI * i / length;
            int v = outerFace.get(i);
            isOuter[v] = true;
            layout.setCoordinates(v, radius * FastMath.cos(angle), radius * FastMath.sin(angle));
        }

        int[] innerIndex = new int[n];
        Arrays.fill(innerIndex, -1);
        int m = 0;
        for (int v = 0; v < n; v++) {
            if (!isOuter[v]) {
                innerIndex[v] = m++;
            }
        }
        if (m == 0) {
            return layout;
        }
        Graph triangulated = triangulation.graph();
        RealMatrix a = new Array2DRowRealMatrix(m, m);
        RealMatrix b = new Array2DRowRealMatrix(m, 2);
        for (int v = 0; v < n; v++) {
            int i = innerIndex[v];
            if (i < 0) {
                continue;
            }
            int[] neighbors = triangulated.getNeighbors(v);
            a.setEntry(i, i, neighbors.length);
            for (int w : neighbors) {
                if (innerIndex[w] >= 0) {
                    a.addToEntry(i, innerIndex[w], -1);
                } else {
                    b.addToEntry(i, 0, layout.getX(w));
                    b.addToEntry(i, 1, layout.getY(w));
                }
            }
        }
        DecompositionSolver solver = new LUDecomposition(a).getSolver();
        RealMatrix solution = solver.solve(b);
        for (int v = 0; v < n; v++) {
            int i = innerIndex[v];
            if (i >= 0) {
                layout.setCoordinates(v, solution.getEntry(i, 0), solution.getEntry(i, 1));
            }
        }
        return layout;
    }
}

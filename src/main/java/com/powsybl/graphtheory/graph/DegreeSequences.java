/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.graph;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Graphic degree sequences.
 *
 * @author PowSyBl graph theory team
 */
public final class DegreeSequences {

    private DegreeSequences() {
    }

    /**
     * Erdős–Gallai test: a sequence of non-negative integers with an even sum is the degree sequence of a simple graph
     * iff for every k, the sum of the k largest degrees is at most k(k-1) + sum of min(d_i, k) over the remaining
     * degrees.
     */
    public static boolean isGraphicSequence(int[] sequence) {
        Objects.requireNonNull(sequence);
        int n = sequence.length;
        long sum = 0;
        for (int d : sequence) {
            if (d < 0 || d >= Math.max(n, 1)) {
                return false;
            }
            sum += d;
        }
        if (sum % 2 != 0) {
            return false;
        }
        int[] sorted = sortDescending(sequence);
        long left = 0;
        for (int k = 1; k <= n; k++) {
            left += sorted[k - 1];
            long right = (long) k * (k - 1);
            for (int i = k; i < n; i++) {
                right += Math.min(sorted[i], k);
            }
            if (left > right) {
                return false;
            }
        }
        return true;
    }

    /**
     * Havel–Hakimi construction of a graph realizing a degree sequence. Vertex i of the result is labeled "i" and has
     * degree {@code sequence[i]}.
     *
     * @throws GraphException with {@link GraphError#NOT_GRAPHIC_SEQUENCE} if the sequence is not graphic
     */
    public static Graph sequenceGraph(int[] sequence) {
        if (!isGraphicSequence(sequence)) {
            throw new GraphException(GraphError.NOT_GRAPHIC_SEQUENCE, Arrays.toString(sequence));
        }
        int n = sequence.length;
        Graph g = GraphFactory.create(n, false);
        int[] residual = sequence.clone();
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        while (n > 0) {
            Arrays.sort(order, Comparator.comparingInt((Integer v) -> residual[v]).reversed().thenComparingInt(v -> v));
            int v = order[0];
            int d = residual[v];
            if (d == 0) {
                break;
            }
            residual[v] = 0;
            for (int k = 1; k <= d; k++) {
                int w = order[k];
                if (residual[w] == 0) {
                    // cannot happen with a graphic sequence
                    throw new GraphException(GraphError.NOT_GRAPHIC_SEQUENCE, Arrays.toString(sequence));
                }
                residual[w]--;
                g.addEdge(v, w);
            }
        }
        return g;
    }

    private static int[] sortDescending(int[] sequence) {
        int[] sorted = sequence.clone();
        Arrays.sort(sorted);
        for (int i = 0, j = sorted.length - 1; i < j; i++, j--) {
            int tmp = sorted[i];
            sorted[i] = sorted[j];
            sorted[j] = tmp;
        }
        return sorted;
    }
}

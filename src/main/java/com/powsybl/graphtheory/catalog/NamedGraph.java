/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.catalog;

import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import com.powsybl.graphtheory.graph.GraphFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Catalog of well known graphs.
 *
 * @author PowSyBl graph theory team
 */
public enum NamedGraph {
    CLEBSCH("clebsch", NamedGraph::clebsch),
    COXETER("coxeter", NamedGraph::coxeter),
    DESARGUES("desargues", () -> GraphGenerators.generalizedPetersen(10, 3)),
    DODECAHEDRON("dodecahedron", () -> GraphGenerators.generalizedPetersen(10, 2)),
    DURER("durer", () -> GraphGenerators.generalizedPetersen(6, 2)),
    DYCK("dyck", () -> GraphGenerators.lcf(new int[] {5, -5}, 16)),
    FRANKLIN("franklin", () -> GraphGenerators.lcf(new int[] {5, -5}, 6)),
    GROTZSCH("grotzsch", NamedGraph::grotzsch),
    HEAWOOD("heawood", () -> GraphGenerators.lcf(new int[] {5, -5}, 7)),
    ICOSAHEDRON("icosahedron", NamedGraph::icosahedron),
    LEVI("levi", () -> GraphGenerators.lcf(new int[] {-13, -9, 7, -7, 9, 13}, 5)),
    MCGEE("mcgee", () -> GraphGenerators.lcf(new int[] {12, 7, -7}, 8)),
    MOBIUS_KANTOR("mobius-kantor", () -> GraphGenerators.generalizedPetersen(8, 3)),
    NAURU("nauru", () -> GraphGenerators.generalizedPetersen(12, 5)),
    OCTAHEDRON("octahedron", () -> GraphGenerators.completeMultipartite(2, 2, 2)),
    PAPPUS("pappus", () -> GraphGenerators.lcf(new int[] {5, 7, -7, 7, -7, -5}, 3)),
    PETERSEN("petersen", () -> GraphGenerators.generalizedPetersen(5, 2)),
    TETRAHEDRON("tetrahedron", () -> GraphGenerators.complete(4)),
    CUBE("cube", () -> GraphGenerators.hypercube(3));

    private final String graphName;

    private final Supplier<Graph> builder;

    NamedGraph(String graphName, Supplier<Graph> builder) {
        this.graphName = graphName;
        this.builder = builder;
    }

    public String getGraphName() {
        return graphName;
    }

    /**
     * Build a new instance of this graph, named after it.
     */
    public Graph create() {
        return builder.get().setName(graphName);
    }

    /**
     * Case insensitive lookup, accepting both "mobius-kantor" and "mobius_kantor".
     */
    public static NamedGraph of(String name) {
        Objects.requireNonNull(name);
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (NamedGraph g : values()) {
            if (g.graphName.equals(normalized)) {
                return g;
            }
        }
        throw new GraphException(GraphError.NAME_NOT_RECOGNIZED, name);
    }

    public static Graph create(String name) {
        return of(name).create();
    }

    /**
     * Folded 5-cube: the 4-cube plus the edges joining antipodal vertices.
     */
    private static Graph clebsch() {
        Graph g = GraphFactory.create(16, false);
        for (int v = 0; v < 16; v++) {
            for (int b = 0; b < 4; b++) {
                g.addEdge(v, v ^ (1 << b));
            }
            g.addEdge(v, v ^ 15);
        }
        return g;
    }

    /**
     * Four 7-vertex rings a, b, c (steps 1, 2, 3) and d, where d(i) is joined to a(i), b(i) and c(i).
     */
    private static Graph coxeter() {
        Graph g = GraphFactory.create(28, false);
        for (int i = 0; i < 7; i++) {
            g.addEdge(i, (i + 1) % 7);
            g.addEdge(7 + i, 7 + (i + 2) % 7);
            g.addEdge(14 + i, 14 + (i + 3) % 7);
            g.addEdge(21 + i, i);
            g.addEdge(21 + i, 7 + i);
            g.addEdge(21 + i, 14 + i);
        }
        return g;
    }

    /**
     * Mycielskian of the 5-cycle.
     */
    private static Graph grotzsch() {
        Graph g = GraphFactory.create(11, false);
        for (int i = 0; i < 5; i++) {
            g.addEdge(i, (i + 1) % 5);
            g.addEdge(5 + i, (i + 1) % 5);
            g.addEdge(5 + i, (i + 4) % 5);
            g.addEdge(10, 5 + i);
        }
        return g;
    }

    /**
     * Two poles 0 and 11, and two staggered 5-rings 1..5 and 6..10.
     */
    private static Graph icosahedron() {
        Graph g = GraphFactory.create(12, false);
        for (int i = 0; i < 5; i++) {
            int upper = 1 + i;
            int lower = 6 + i;
            g.addEdge(0, upper);
            g.addEdge(upper, 1 + (i + 1) % 5);
            g.addEdge(11, lower);
            g.addEdge(lower, 6 + (i + 1) % 5);
            g.addEdge(upper, lower);
            g.addEdge(upper, 6 + (i + 1) % 5);
        }
        return g;
    }
}

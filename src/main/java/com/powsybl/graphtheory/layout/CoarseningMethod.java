/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

/**
 * How a graph is shrunk at each level of a multilevel spring layout.
 *
 * @author PowSyBl graph theory team
 */
public enum CoarseningMethod {
    /**
     * Coarse vertices are the vertices of a maximal independent set, other vertices being interpolated from their
     * neighbors in the set.
     */
    MIS,
    /**
     * Coarse vertices are the edges of a maximal matching, contracted, and the unmatched vertices.
     */
    EDGE_CONTRACTION
}

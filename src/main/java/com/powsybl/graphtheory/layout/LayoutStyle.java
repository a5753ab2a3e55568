/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.layout;

/**
 * Drawing styles.
 *
 * @author PowSyBl graph theory team
 */
public enum LayoutStyle {
    /**
     * Force directed placement, in 2 or 3 dimensions.
     */
    SPRING,
    /**
     * Layered drawing of a tree from its root.
     */
    TREE,
    /**
     * Tree drawn in concentric levels around its root.
     */
    RADIAL_TREE,
    /**
     * Leading cycle on a circle, other vertices inside.
     */
    CIRCLE,
    /**
     * Straight line drawing without crossing of a planar graph.
     */
    PLANAR
}

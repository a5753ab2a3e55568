/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.graph;

import com.powsybl.commons.PowsyblException;

import java.util.Objects;

/**
 * @see GraphError
 *
 * @author PowSyBl graph theory team
 */
public class GraphException extends PowsyblException {

    private final GraphError error;

    public GraphException(GraphError error) {
        super(Objects.requireNonNull(error).getMessage());
        this.error = error;
    }

    public GraphException(GraphError error, String detail) {
        super(Objects.requireNonNull(error).getMessage() + ": " + detail);
        this.error = error;
    }

    public GraphException(GraphError error, String detail, Throwable cause) {
        super(Objects.requireNonNull(error).getMessage() + ": " + detail, cause);
        this.error = error;
    }

    public GraphError getError() {
        return error;
    }

    public GraphError.Category getCategory() {
        return error.getCategory();
    }
}

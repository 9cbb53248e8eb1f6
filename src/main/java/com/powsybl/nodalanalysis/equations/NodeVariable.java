/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.equations;

import com.powsybl.nodalanalysis.network.CircuitNode;

import java.util.Objects;

/**
 * @author PowSyBl nodal analysis developers
 */
public record NodeVariable(CircuitNode node, int column) implements UnknownVariable {

    public NodeVariable {
        Objects.requireNonNull(node);
    }

    @Override
    public int getColumn() {
        return column;
    }

    @Override
    public int getColumnCount() {
        return 1;
    }

    @Override
    public CircuitNode getNode() {
        return node;
    }

    @Override
    public String getLabel() {
        return node.getLabel();
    }
}

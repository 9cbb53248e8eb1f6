/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.equations;

import com.powsybl.nodalanalysis.graph.SupernodeResolution;
import com.powsybl.nodalanalysis.network.CircuitNode;
import com.powsybl.nodalanalysis.network.CurrentSource;
import com.powsybl.nodalanalysis.util.ValueFormatter;

import java.util.Objects;

/**
 * Fixed current leaving a node through a current source: +value at nodeA, -value at nodeB. Being constant, it only
 * contributes to the right-hand side, with opposite sign.
 *
 * @author PowSyBl nodal analysis developers
 */
public class CurrentSourceTerm implements EquationTerm {

    private final CurrentSource source;

    private final CircuitNode node;

    public CurrentSourceTerm(CurrentSource source, CircuitNode node) {
        this.source = Objects.requireNonNull(source);
        this.node = Objects.requireNonNull(node);
        if (!source.isConnectedTo(node)) {
            throw new IllegalArgumentException("Current source " + source.getId() + " is not connected to node " + node.getLabel());
        }
    }

    @Override
    public CurrentSource getComponent() {
        return source;
    }

    @Override
    public CircuitNode getNode() {
        return node;
    }

    public double getCurrentLeaving() {
        return source.getCurrentLeaving(node, source.getCurrent());
    }

    @Override
    public void stamp(Equation equation, SupernodeResolution resolution) {
        equation.addRhs(-getCurrentLeaving());
    }

    @Override
    public String getCurrentExpression(ValueFormatter formatter) {
        return formatter.format(getCurrentLeaving());
    }

    @Override
    public String toString() {
        return "CurrentSourceTerm(" + source.getId() + ", " + node.getLabel() + ")";
    }
}

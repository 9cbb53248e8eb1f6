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
import com.powsybl.nodalanalysis.network.Resistor;
import com.powsybl.nodalanalysis.util.ValueFormatter;

import java.util.Objects;

/**
 * Current (V(node) - V(other)) / R leaving a node through a resistor.
 *
 * @author PowSyBl nodal analysis developers
 */
public class ResistorTerm implements EquationTerm {

    private final Resistor resistor;

    private final CircuitNode node;

    public ResistorTerm(Resistor resistor, CircuitNode node) {
        this.resistor = Objects.requireNonNull(resistor);
        this.node = Objects.requireNonNull(node);
        if (!resistor.isConnectedTo(node)) {
            throw new IllegalArgumentException("Resistor " + resistor.getId() + " is not connected to node " + node.getLabel());
        }
    }

    @Override
    public Resistor getComponent() {
        return resistor;
    }

    @Override
    public CircuitNode getNode() {
        return node;
    }

    public CircuitNode getOtherNode() {
        return resistor.getOtherNode(node);
    }

    @Override
    public void stamp(Equation equation, SupernodeResolution resolution) {
        double g = resistor.getConductance();
        equation.addCoefficient(resolution.getColumn(node), g);
        CircuitNode other = getOtherNode();
        if (resolution.isKnown(other)) {
            double v = resolution.getKnownVoltage(other);
            equation.addRhs(g * v);
            if (!other.isReference()) {
                equation.addSubstitution(other, v);
            }
        } else {
            equation.addCoefficient(resolution.getColumn(other), -g);
        }
    }

    @Override
    public String getCurrentExpression(ValueFormatter formatter) {
        CircuitNode other = getOtherNode();
        String otherVoltage = other.isReference() ? "0" : "V(" + other.getLabel() + ")";
        return "(V(" + node.getLabel() + ") - " + otherVoltage + ") / " + formatter.format(resistor.getResistance());
    }

    @Override
    public String toString() {
        return "ResistorTerm(" + resistor.getId() + ", " + node.getLabel() + ")";
    }
}

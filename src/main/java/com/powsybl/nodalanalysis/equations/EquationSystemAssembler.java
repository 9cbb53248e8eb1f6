/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.equations;

import com.powsybl.nodalanalysis.graph.Supernode;
import com.powsybl.nodalanalysis.graph.SupernodeResolution;
import com.powsybl.nodalanalysis.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the linear system with a single loop over unknown variables. A plain node gives one KCL row; a supernode
 * gives its merged KCL row followed by one constraint row per non representative member, so that row indices
 * match column indices.
 *
 * @author PowSyBl nodal analysis developers
 */
public final class EquationSystemAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(EquationSystemAssembler.class);

    private EquationSystemAssembler() {
    }

    public static LinearSystem assemble(SupernodeResolution resolution) {
        return assemble(resolution, List.of());
    }

    public static LinearSystem assemble(SupernodeResolution resolution, List<EquationListener> listeners) {
        Objects.requireNonNull(resolution);
        Objects.requireNonNull(listeners);
        List<Equation> equations = new ArrayList<>(resolution.getUnknownCount());
        for (UnknownVariable variable : resolution.getVariables()) {
            if (variable instanceof NodeVariable nodeVariable) {
                Equation kcl = Equation.createKcl(equations.size(), nodeVariable);
                addCurrentBalanceTerms(kcl, nodeVariable.getNode(), null, resolution);
                add(kcl, equations, listeners);
            } else if (variable instanceof SupernodeVariable supernodeVariable) {
                Supernode supernode = supernodeVariable.supernode();
                Equation kcl = Equation.createSupernodeKcl(equations.size(), supernodeVariable);
                for (CircuitNode member : supernode.getMembers()) {
                    addCurrentBalanceTerms(kcl, member, supernode, resolution);
                }
                add(kcl, equations, listeners);
                for (CircuitNode member : supernode.getMembers().subList(1, supernode.size())) {
                    add(Equation.createConstraint(equations.size(), supernodeVariable, member), equations, listeners);
                }
            } else {
                throw new IllegalStateException("Unknown variable kind: " + variable.getClass().getName());
            }
        }
        LOGGER.debug("Linear system assembled: {} rows", equations.size());
        return new LinearSystem(resolution, equations);
    }

    private static void add(Equation equation, List<Equation> equations, List<EquationListener> listeners) {
        if (equation.getRow() != equation.getVariable().getColumn() && equation.getType().isKcl()) {
            throw new IllegalStateException("Row " + equation.getRow() + " is not aligned with variable " + equation.getVariable().getLabel());
        }
        equations.add(equation);
        listeners.forEach(listener -> listener.onEquationCreated(equation));
    }

    private static void addCurrentBalanceTerms(Equation equation, CircuitNode node, Supernode supernode, SupernodeResolution resolution) {
        for (CircuitComponent component : node.getComponents()) {
            // branches inside a supernode cancel out in the merged balance
            if (supernode != null && supernode.contains(component.getOtherNode(node))) {
                continue;
            }
            EquationTerm term = createTerm(component, node);
            if (term != null) {
                term.stamp(equation, resolution);
                equation.addTerm(term);
            }
        }
    }

    /**
     * Null for voltage sources: they only tie node voltages together, through supernodes.
     */
    private static EquationTerm createTerm(CircuitComponent component, CircuitNode node) {
        return switch (component.getType()) {
            case RESISTOR -> new ResistorTerm((Resistor) component, node);
            case CURRENT_SOURCE -> new CurrentSourceTerm((CurrentSource) component, node);
            case VOLTAGE_SOURCE -> null;
        };
    }
}

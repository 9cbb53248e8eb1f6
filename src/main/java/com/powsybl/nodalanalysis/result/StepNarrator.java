/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.result;

import com.powsybl.nodalanalysis.equations.Equation;
import com.powsybl.nodalanalysis.equations.EquationListener;
import com.powsybl.nodalanalysis.equations.EquationTerm;
import com.powsybl.nodalanalysis.graph.Supernode;
import com.powsybl.nodalanalysis.graph.SupernodeResolution;
import com.powsybl.nodalanalysis.network.CircuitNode;
import com.powsybl.nodalanalysis.util.ValueFormatter;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Records one {@link DerivationStep} per assembled row, in row order. Only reads the rows it is notified of.
 *
 * @author PowSyBl nodal analysis developers
 */
public class StepNarrator implements EquationListener {

    private final SupernodeResolution resolution;

    private final ValueFormatter formatter;

    private final List<DerivationStep> steps = new ArrayList<>();

    public StepNarrator(SupernodeResolution resolution, ValueFormatter formatter) {
        this.resolution = Objects.requireNonNull(resolution);
        this.formatter = Objects.requireNonNull(formatter);
    }

    public List<DerivationStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    @Override
    public void onEquationCreated(Equation equation) {
        steps.add(switch (equation.getType()) {
            case KCL -> describeKcl(equation);
            case SUPERNODE_KCL -> describeSupernodeKcl(equation);
            case CONSTRAINT -> describeConstraint(equation);
        });
    }

    private DerivationStep describeKcl(Equation equation) {
        String label = equation.getVariable().getLabel();
        String explanation = "Sum of currents leaving node " + label + " through its branches is zero. "
                + describeRow(equation);
        return new DerivationStep(equation.getType(), equation.getRow(), "KCL at node " + label,
                describeCurrentSum(equation), explanation);
    }

    private DerivationStep describeSupernodeKcl(Equation equation) {
        String members = equation.getNodes().stream().map(CircuitNode::getLabel).collect(Collectors.joining(", "));
        String explanation = "Nodes " + members + " are tied together by voltage sources, so their current balances are added: "
                + "the net current leaving the supernode is zero and branches inside it cancel out. "
                + describeRow(equation);
        return new DerivationStep(equation.getType(), equation.getRow(), "Supernode KCL for " + equation.getVariable().getLabel(),
                describeCurrentSum(equation), explanation);
    }

    private DerivationStep describeConstraint(Equation equation) {
        Equation.Constraint constraint = equation.getConstraint().orElseThrow();
        String member = voltage(constraint.member());
        String representative = voltage(constraint.representative());
        String path = constraint.path().stream()
                .map(this::describeSourceStep)
                .collect(Collectors.joining(", then "));
        String explanation = "Walking from " + constraint.representative().getLabel() + " to " + constraint.member().getLabel()
                + ": " + path + ". " + describeRow(equation);
        return new DerivationStep(equation.getType(), equation.getRow(), "Constraint " + member + " - " + representative,
                member + " - " + representative + " = " + formatter.formatComputed(constraint.offset()), explanation);
    }

    private String describeSourceStep(Supernode.SourceStep step) {
        double rise = step.getRise();
        return "voltage source " + step.source().getId() + " from " + step.from().getLabel() + " to " + step.to().getLabel()
                + (rise >= 0 ? " raises the potential by " : " lowers the potential by ")
                + formatter.formatComputed(Math.abs(rise)) + " V";
    }

    private String describeCurrentSum(Equation equation) {
        if (equation.getTerms().isEmpty()) {
            return "0 = 0";
        }
        StringBuilder builder = new StringBuilder();
        for (EquationTerm term : equation.getTerms()) {
            String expression = term.getCurrentExpression(formatter);
            if (builder.length() == 0) {
                builder.append(expression);
            } else if (expression.startsWith("-")) {
                builder.append(" - ").append(expression.substring(1));
            } else {
                builder.append(" + ").append(expression);
            }
        }
        return builder.append(" = 0").toString();
    }

    private String describeRow(Equation equation) {
        StringBuilder builder = new StringBuilder("Matrix row ").append(equation.getRow()).append(": ");
        if (equation.getCoefficients().isEmpty()) {
            builder.append('0');
        }
        boolean first = true;
        for (Map.Entry<Integer, Double> e : equation.getCoefficients().entrySet()) {
            double coefficient = e.getValue();
            String variable = voltage(resolution.getNodeAtColumn(e.getKey()));
            if (first) {
                builder.append(coefficient < 0 ? "-" : "");
            } else {
                builder.append(coefficient < 0 ? " - " : " + ");
            }
            builder.append(formatter.format(Math.abs(coefficient))).append('*').append(variable);
            first = false;
        }
        builder.append(" = ").append(formatter.formatComputed(equation.getRhs())).append('.');
        if (!equation.getSubstitutions().isEmpty()) {
            builder.append(" Known voltages moved to the right-hand side: ")
                    .append(equation.getSubstitutions().entrySet().stream()
                            .map(e -> voltage(e.getKey()) + " = " + formatter.formatComputed(e.getValue()) + " V")
                            .collect(Collectors.joining(", ")))
                    .append('.');
        }
        return builder.toString();
    }

    private static String voltage(CircuitNode node) {
        return "V(" + node.getLabel() + ")";
    }
}

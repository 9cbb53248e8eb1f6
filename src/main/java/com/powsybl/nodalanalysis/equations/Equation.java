/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.equations;

import com.powsybl.nodalanalysis.graph.Supernode;
import com.powsybl.nodalanalysis.network.CircuitNode;

import java.util.*;

/**
 * One row of the linear system: either the current balance of a node or of a supernode, or the voltage constraint
 * tying a supernode member to its representative.
 *
 * @author PowSyBl nodal analysis developers
 */
public class Equation {

    /**
     * V(member) - V(representative) = offset, the offset being the sum of the source rises along {@code path}.
     */
    public record Constraint(CircuitNode member, CircuitNode representative, double offset, List<Supernode.SourceStep> path) {

        public Constraint {
            Objects.requireNonNull(member);
            Objects.requireNonNull(representative);
            path = List.copyOf(path);
        }
    }

    private final int row;

    private final EquationType type;

    private final UnknownVariable variable;

    private final List<CircuitNode> nodes;

    private final Constraint constraint;

    private final List<EquationTerm> terms = new ArrayList<>();

    private final SortedMap<Integer, Double> coefficients = new TreeMap<>();

    private final Map<CircuitNode, Double> substitutions = new LinkedHashMap<>();

    private double rhs;

    private Equation(int row, EquationType type, UnknownVariable variable, List<CircuitNode> nodes, Constraint constraint) {
        this.row = row;
        this.type = Objects.requireNonNull(type);
        this.variable = Objects.requireNonNull(variable);
        this.nodes = List.copyOf(nodes);
        this.constraint = constraint;
    }

    static Equation createKcl(int row, NodeVariable variable) {
        return new Equation(row, EquationType.KCL, variable, List.of(variable.getNode()), null);
    }

    static Equation createSupernodeKcl(int row, SupernodeVariable variable) {
        return new Equation(row, EquationType.SUPERNODE_KCL, variable, variable.supernode().getMembers(), null);
    }

    static Equation createConstraint(int row, SupernodeVariable variable, CircuitNode member) {
        Supernode supernode = variable.supernode();
        Constraint constraint = new Constraint(member, supernode.getRepresentative(), supernode.getOffset(member),
                supernode.getPath(member));
        Equation equation = new Equation(row, EquationType.CONSTRAINT, variable, List.of(member, supernode.getRepresentative()), constraint);
        equation.addCoefficient(variable.getColumn(member), 1);
        equation.addCoefficient(variable.getColumn(), -1);
        equation.addRhs(constraint.offset());
        return equation;
    }

    public int getRow() {
        return row;
    }

    public EquationType getType() {
        return type;
    }

    public UnknownVariable getVariable() {
        return variable;
    }

    /**
     * Nodes whose current balance is summed in this row (all members for a supernode), or the member and the
     * representative for a constraint row.
     */
    public List<CircuitNode> getNodes() {
        return nodes;
    }

    public Optional<Constraint> getConstraint() {
        return Optional.ofNullable(constraint);
    }

    public List<EquationTerm> getTerms() {
        return Collections.unmodifiableList(terms);
    }

    /**
     * Non zero coefficients by column.
     */
    public SortedMap<Integer, Double> getCoefficients() {
        return Collections.unmodifiableSortedMap(coefficients);
    }

    public double getCoefficient(int column) {
        return coefficients.getOrDefault(column, 0.0);
    }

    public double getRhs() {
        return rhs;
    }

    /**
     * Known node voltages moved to the right-hand side while stamping.
     */
    public Map<CircuitNode, Double> getSubstitutions() {
        return Collections.unmodifiableMap(substitutions);
    }

    public double evaluate(double[] x) {
        double value = 0;
        for (Map.Entry<Integer, Double> e : coefficients.entrySet()) {
            value += e.getValue() * x[e.getKey()];
        }
        return value;
    }

    void addTerm(EquationTerm term) {
        terms.add(Objects.requireNonNull(term));
    }

    void addCoefficient(int column, double value) {
        double sum = coefficients.getOrDefault(column, 0.0) + value;
        if (sum == 0) {
            coefficients.remove(column);
        } else {
            coefficients.put(column, sum);
        }
    }

    void addRhs(double value) {
        rhs += value;
    }

    void addSubstitution(CircuitNode node, double voltage) {
        substitutions.put(node, voltage);
    }

    @Override
    public String toString() {
        return "Equation(row=" + row + ", type=" + type + ", variable=" + variable.getLabel() + ")";
    }
}

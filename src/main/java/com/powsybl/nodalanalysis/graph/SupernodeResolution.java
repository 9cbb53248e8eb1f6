/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.graph;

import com.powsybl.nodalanalysis.equations.UnknownVariable;
import com.powsybl.nodalanalysis.network.Circuit;
import com.powsybl.nodalanalysis.network.CircuitNode;

import java.util.*;

/**
 * Outcome of supernode resolution: for every node, either a known voltage (reference node and members of the group
 * containing it) or a column of the linear system; and the ordered list of unknown variables.
 *
 * @author PowSyBl nodal analysis developers
 */
public class SupernodeResolution {

    private final Circuit circuit;

    private final List<Supernode> supernodes;

    private final Supernode[] supernodeByNode;

    private final int[] columnByNode;

    private final double[] knownVoltageByNode;

    private final CircuitNode[] nodeByColumn;

    private final List<UnknownVariable> variables;

    SupernodeResolution(Circuit circuit, List<Supernode> supernodes, int[] columnByNode, double[] knownVoltageByNode,
                        List<UnknownVariable> variables) {
        this.circuit = Objects.requireNonNull(circuit);
        this.supernodes = List.copyOf(supernodes);
        this.columnByNode = columnByNode;
        this.knownVoltageByNode = knownVoltageByNode;
        this.variables = List.copyOf(variables);
        supernodeByNode = new Supernode[circuit.getNodeCount()];
        for (Supernode supernode : supernodes) {
            for (CircuitNode member : supernode.getMembers()) {
                supernodeByNode[member.getNum()] = supernode;
            }
        }
        int unknownCount = variables.stream().mapToInt(UnknownVariable::getColumnCount).sum();
        nodeByColumn = new CircuitNode[unknownCount];
        for (CircuitNode node : circuit.getNodes()) {
            int column = columnByNode[node.getNum()];
            if (column >= 0) {
                nodeByColumn[column] = node;
            }
        }
    }

    public Circuit getCircuit() {
        return circuit;
    }

    /**
     * All groups of two or more nodes tied by voltage sources, ordered by representative index.
     */
    public List<Supernode> getSupernodes() {
        return supernodes;
    }

    public Optional<Supernode> getGroundedSupernode() {
        return supernodes.stream().filter(Supernode::isGrounded).findFirst();
    }

    public List<Supernode> getUngroundedSupernodes() {
        return supernodes.stream().filter(s -> !s.isGrounded()).toList();
    }

    public Optional<Supernode> getSupernode(CircuitNode node) {
        return Optional.ofNullable(supernodeByNode[node.getNum()]);
    }

    /**
     * Non-reference nodes that do not belong to any supernode.
     */
    public List<CircuitNode> getRegularNodes() {
        return circuit.getNodes().stream()
                .filter(n -> !n.isReference() && supernodeByNode[n.getNum()] == null)
                .toList();
    }

    public boolean isKnown(CircuitNode node) {
        return columnByNode[node.getNum()] < 0;
    }

    public double getKnownVoltage(CircuitNode node) {
        if (!isKnown(node)) {
            throw new IllegalArgumentException("Voltage of node " + node.getLabel() + " is an unknown");
        }
        return knownVoltageByNode[node.getNum()];
    }

    public int getColumn(CircuitNode node) {
        int column = columnByNode[node.getNum()];
        if (column < 0) {
            throw new IllegalArgumentException("Voltage of node " + node.getLabel() + " is known");
        }
        return column;
    }

    public CircuitNode getNodeAtColumn(int column) {
        return nodeByColumn[column];
    }

    public List<UnknownVariable> getVariables() {
        return variables;
    }

    public int getUnknownCount() {
        return nodeByColumn.length;
    }

    /**
     * Voltage of every node, known voltages completed with the solved unknowns.
     */
    public double[] getNodeVoltages(double[] solution) {
        if (solution.length != getUnknownCount()) {
            throw new IllegalArgumentException("Expected " + getUnknownCount() + " unknown values, got " + solution.length);
        }
        double[] voltages = new double[circuit.getNodeCount()];
        for (CircuitNode node : circuit.getNodes()) {
            int column = columnByNode[node.getNum()];
            voltages[node.getNum()] = column < 0 ? knownVoltageByNode[node.getNum()] : solution[column];
        }
        voltages[circuit.getReferenceNode().getNum()] = 0.0;
        return voltages;
    }
}

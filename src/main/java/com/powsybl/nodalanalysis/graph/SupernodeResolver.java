/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.graph;

import com.powsybl.nodalanalysis.InconsistentSourceException;
import com.powsybl.nodalanalysis.NodalAnalysisParameters;
import com.powsybl.nodalanalysis.equations.NodeVariable;
import com.powsybl.nodalanalysis.equations.SupernodeVariable;
import com.powsybl.nodalanalysis.equations.UnknownVariable;
import com.powsybl.nodalanalysis.network.Circuit;
import com.powsybl.nodalanalysis.network.CircuitNode;
import com.powsybl.nodalanalysis.network.VoltageSource;
import net.jafama.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Groups nodes tied by ideal voltage sources. The group containing the reference node has all its voltages known
 * and drops out of the unknowns; every other group becomes one {@link SupernodeVariable}; remaining nodes become
 * {@link NodeVariable}s. Columns are allocated in order of first node index.
 *
 * @author PowSyBl nodal analysis developers
 */
public final class SupernodeResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(SupernodeResolver.class);

    private SupernodeResolver() {
    }

    public static SupernodeResolution resolve(Circuit circuit, NodalAnalysisParameters parameters) {
        Objects.requireNonNull(circuit);
        Objects.requireNonNull(parameters);
        int nodeCount = circuit.getNodeCount();
        WeightedUnionFind unionFind = new WeightedUnionFind(nodeCount);

        List<VoltageSource> treeSources = new ArrayList<>();
        List<VoltageSource> redundantSources = new ArrayList<>();
        for (VoltageSource source : circuit.getComponents(VoltageSource.class)) {
            int a = source.getNodeA().getNum();
            int b = source.getNodeB().getNum();
            if (unionFind.union(a, b, source.getVoltage())) {
                treeSources.add(source);
            } else {
                double expected = unionFind.difference(a, b);
                double scale = FastMath.max(1.0, FastMath.max(FastMath.abs(expected), FastMath.abs(source.getVoltage())));
                if (FastMath.abs(expected - source.getVoltage()) > parameters.getSourceConsistencyTolerance() * scale) {
                    throw new InconsistentSourceException(source.getId(), source.getNodeA().getLabel(), source.getNodeB().getLabel(),
                            expected, source.getVoltage());
                }
                LOGGER.warn("Voltage source '{}' closes a loop of ideal sources, its current cannot be determined", source.getId());
                redundantSources.add(source);
            }
        }

        // members sorted by node index as nodes are visited in order
        Map<Integer, List<CircuitNode>> membersByRoot = new LinkedHashMap<>();
        for (CircuitNode node : circuit.getNodes()) {
            membersByRoot.computeIfAbsent(unionFind.find(node.getNum()), k -> new ArrayList<>()).add(node);
        }

        List<Supernode> supernodes = new ArrayList<>();
        for (Map.Entry<Integer, List<CircuitNode>> e : membersByRoot.entrySet()) {
            List<CircuitNode> members = e.getValue();
            if (members.size() < 2) {
                continue;
            }
            int root = e.getKey();
            CircuitNode representative = members.get(0);
            Map<CircuitNode, Double> offsets = new HashMap<>();
            for (CircuitNode member : members) {
                offsets.put(member, member == representative ? 0.0 : unionFind.difference(representative.getNum(), member.getNum()));
            }
            List<VoltageSource> groupTreeSources = treeSources.stream()
                    .filter(s -> unionFind.find(s.getNodeA().getNum()) == root)
                    .toList();
            List<VoltageSource> groupRedundantSources = redundantSources.stream()
                    .filter(s -> unionFind.find(s.getNodeA().getNum()) == root)
                    .toList();
            supernodes.add(new Supernode(supernodes.size(), members, offsets, groupTreeSources, groupRedundantSources));
        }

        int[] columnByNode = new int[nodeCount];
        double[] knownVoltageByNode = new double[nodeCount];
        Arrays.fill(columnByNode, -1);
        Arrays.fill(knownVoltageByNode, Double.NaN);
        knownVoltageByNode[circuit.getReferenceNode().getNum()] = 0.0;

        Map<CircuitNode, Supernode> supernodeByNode = new HashMap<>();
        for (Supernode supernode : supernodes) {
            for (CircuitNode member : supernode.getMembers()) {
                supernodeByNode.put(member, supernode);
                if (supernode.isGrounded()) {
                    knownVoltageByNode[member.getNum()] = member.isReference() ? 0.0 : supernode.getOffset(member);
                }
            }
        }

        List<UnknownVariable> variables = new ArrayList<>();
        int column = 0;
        for (CircuitNode node : circuit.getNodes()) {
            if (node.isReference()) {
                continue;
            }
            Supernode supernode = supernodeByNode.get(node);
            if (supernode == null) {
                columnByNode[node.getNum()] = column;
                variables.add(new NodeVariable(node, column));
                column++;
            } else if (!supernode.isGrounded() && supernode.getRepresentative() == node) {
                variables.add(new SupernodeVariable(supernode, column));
                for (CircuitNode member : supernode.getMembers()) {
                    columnByNode[member.getNum()] = column++;
                }
            }
        }

        LOGGER.debug("{} supernode(s) found, {} unknown voltage(s) in {} variable(s)", supernodes.size(), column, variables.size());

        return new SupernodeResolution(circuit, supernodes, columnByNode, knownVoltageByNode, variables);
    }
}

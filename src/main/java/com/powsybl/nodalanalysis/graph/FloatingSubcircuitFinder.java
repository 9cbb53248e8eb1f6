/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.graph;

import com.powsybl.nodalanalysis.SingularityHint;
import com.powsybl.nodalanalysis.network.*;
import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.Pseudograph;

import java.util.*;

/**
 * Finds groups of nodes whose potential is not fixed: nodes that cannot reach the reference node through resistors
 * and voltage sources. Current sources impose a current, never a potential, so they are left out of the graph.
 *
 * @author PowSyBl nodal analysis developers
 */
public final class FloatingSubcircuitFinder {

    /**
     * A connected group of nodes with undetermined potential.
     */
    public record FloatingSubcircuit(List<CircuitNode> nodes, SingularityHint hint) {

        public FloatingSubcircuit {
            nodes = List.copyOf(nodes);
            Objects.requireNonNull(hint);
        }

        public List<String> getNodeLabels() {
            return nodes.stream().map(CircuitNode::getLabel).toList();
        }
    }

    private FloatingSubcircuitFinder() {
    }

    public static List<FloatingSubcircuit> find(Circuit circuit) {
        Objects.requireNonNull(circuit);
        Graph<CircuitNode, CircuitComponent> graph = new Pseudograph<>(null, null, false);
        circuit.getNodes().forEach(graph::addVertex);
        for (CircuitComponent component : circuit.getComponents()) {
            if (component.getType() != ComponentType.CURRENT_SOURCE) {
                graph.addEdge(component.getNodeA(), component.getNodeB(), component);
            }
        }
        List<FloatingSubcircuit> floatingSubcircuits = new ArrayList<>();
        for (Set<CircuitNode> connectedSet : new ConnectivityInspector<>(graph).connectedSets()) {
            if (connectedSet.contains(circuit.getReferenceNode())) {
                continue;
            }
            List<CircuitNode> nodes = connectedSet.stream()
                    .sorted(Comparator.comparingInt(CircuitNode::getNum))
                    .toList();
            boolean hasVoltageSource = nodes.stream()
                    .flatMap(n -> n.getComponents().stream())
                    .anyMatch(c -> c.getType() == ComponentType.VOLTAGE_SOURCE);
            floatingSubcircuits.add(new FloatingSubcircuit(nodes,
                    hasVoltageSource ? SingularityHint.FLOATING_SUBCIRCUIT : SingularityHint.MISSING_REFERENCE_PATH));
        }
        floatingSubcircuits.sort(Comparator.comparingInt(f -> f.nodes().get(0).getNum()));
        return floatingSubcircuits;
    }
}

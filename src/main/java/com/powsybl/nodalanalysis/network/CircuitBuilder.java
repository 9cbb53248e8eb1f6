/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.network;

import com.powsybl.nodalanalysis.CircuitValidationException;
import com.powsybl.nodalanalysis.NodalAnalysisParameters;
import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.Pseudograph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Turns a component list into a {@link Circuit}: validates values and labels, assigns canonical node indices
 * (reference node first, then first-seen order) and checks that every node can be reached from the reference node.
 *
 * @author PowSyBl nodal analysis developers
 */
public final class CircuitBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBuilder.class);

    private CircuitBuilder() {
    }

    public static Circuit build(List<ComponentDescription> descriptions, NodalAnalysisParameters parameters) {
        Objects.requireNonNull(descriptions);
        Objects.requireNonNull(parameters);
        if (descriptions.isEmpty()) {
            throw new CircuitValidationException("Circuit has no component");
        }
        if (descriptions.size() > parameters.getMaxComponentCount()) {
            throw new CircuitValidationException("Circuit has " + descriptions.size() + " components, maximum allowed is "
                    + parameters.getMaxComponentCount());
        }

        List<CircuitNode> nodes = new ArrayList<>();
        Map<String, CircuitNode> nodesByLabel = new HashMap<>();
        CircuitNode referenceNode = new CircuitNode(0, parameters.getReferenceNodeLabel());
        nodes.add(referenceNode);
        boolean referenceUsed = false;

        List<CircuitComponent> components = new ArrayList<>(descriptions.size());
        Set<String> ids = new HashSet<>();
        Map<ComponentType, Integer> generatedIdCounters = new EnumMap<>(ComponentType.class);

        for (int num = 0; num < descriptions.size(); num++) {
            ComponentDescription description = descriptions.get(num);
            if (description == null) {
                throw new CircuitValidationException("Component #" + (num + 1) + " is null");
            }
            validateValue(description, num);
            String labelA = checkLabel(description.nodeA(), num, "nodeA");
            String labelB = checkLabel(description.nodeB(), num, "nodeB");

            boolean referenceA = parameters.isReferenceNode(labelA);
            boolean referenceB = parameters.isReferenceNode(labelB);
            if ((referenceA && referenceB) || labelA.equals(labelB)) {
                throw new CircuitValidationException("Component #" + (num + 1) + " has both terminals on node '" + labelA + "'");
            }
            referenceUsed |= referenceA || referenceB;
            CircuitNode nodeA = referenceA ? referenceNode : nodesByLabel.computeIfAbsent(labelA, l -> newNode(nodes, l));
            CircuitNode nodeB = referenceB ? referenceNode : nodesByLabel.computeIfAbsent(labelB, l -> newNode(nodes, l));

            String id = description.id() != null && !description.id().isBlank()
                    ? description.id().trim()
                    : nextGeneratedId(description.type(), generatedIdCounters, ids, descriptions);
            if (!ids.add(id)) {
                throw new CircuitValidationException("Duplicate component id '" + id + "'");
            }

            CircuitComponent component = switch (description.type()) {
                case RESISTOR -> new Resistor(id, num, description.value(), nodeA, nodeB);
                case VOLTAGE_SOURCE -> new VoltageSource(id, num, description.value(), nodeA, nodeB);
                case CURRENT_SOURCE -> new CurrentSource(id, num, description.value(), nodeA, nodeB);
            };
            nodeA.addComponent(component);
            nodeB.addComponent(component);
            components.add(component);
        }

        if (!referenceUsed) {
            throw new CircuitValidationException("No component is connected to the reference node (expected one of "
                    + parameters.getReferenceNodeAliases() + ")");
        }

        checkConnectivity(nodes, components);

        Circuit circuit = new Circuit(nodes, components);
        LOGGER.debug("Circuit built: {} nodes, {} components", circuit.getNodeCount(), components.size());
        return circuit;
    }

    private static CircuitNode newNode(List<CircuitNode> nodes, String label) {
        CircuitNode node = new CircuitNode(nodes.size(), label);
        nodes.add(node);
        return node;
    }

    private static void validateValue(ComponentDescription description, int num) {
        if (description.type() == null) {
            throw new CircuitValidationException("Component #" + (num + 1) + " has no type");
        }
        double value = description.value();
        if (!Double.isFinite(value)) {
            throw new CircuitValidationException("Component #" + (num + 1) + " has a non finite value: " + value);
        }
        if (description.type() == ComponentType.RESISTOR && value <= 0) {
            throw new CircuitValidationException("Resistor #" + (num + 1) + " must have a strictly positive resistance, got " + value);
        }
    }

    private static String checkLabel(String label, int num, String terminal) {
        if (label == null || label.isBlank()) {
            throw new CircuitValidationException("Component #" + (num + 1) + " has no " + terminal);
        }
        return label.trim();
    }

    private static String nextGeneratedId(ComponentType type, Map<ComponentType, Integer> counters, Set<String> usedIds,
                                          List<ComponentDescription> descriptions) {
        String id;
        do {
            int counter = counters.merge(type, 1, Integer::sum);
            id = type.getIdPrefix() + counter;
        } while (usedIds.contains(id) || isExplicitId(id, descriptions));
        return id;
    }

    private static boolean isExplicitId(String id, List<ComponentDescription> descriptions) {
        return descriptions.stream()
                .anyMatch(d -> d != null && d.id() != null && d.id().trim().equals(id));
    }

    private static void checkConnectivity(List<CircuitNode> nodes, List<CircuitComponent> components) {
        Graph<CircuitNode, CircuitComponent> graph = new Pseudograph<>(null, null, false);
        nodes.forEach(graph::addVertex);
        for (CircuitComponent component : components) {
            graph.addEdge(component.getNodeA(), component.getNodeB(), component);
        }
        Set<CircuitNode> mainComponent = new ConnectivityInspector<>(graph).connectedSetOf(nodes.get(0));
        if (mainComponent.size() != nodes.size()) {
            List<String> disconnected = nodes.stream()
                    .filter(n -> !mainComponent.contains(n))
                    .map(CircuitNode::getLabel)
                    .toList();
            throw new CircuitValidationException("Node(s) " + String.join(", ", disconnected)
                    + " cannot be reached from the reference node");
        }
    }
}

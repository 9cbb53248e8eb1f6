/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.network;

import com.google.common.collect.ImmutableList;

import java.util.*;

/**
 * Immutable topology of a circuit: the single source of truth every solve step derives from.
 *
 * @author PowSyBl nodal analysis developers
 */
public class Circuit {

    private final List<CircuitNode> nodes;

    private final List<CircuitComponent> components;

    private final Map<String, CircuitNode> nodesByLabel = new HashMap<>();

    Circuit(List<CircuitNode> nodes, List<CircuitComponent> components) {
        this.nodes = ImmutableList.copyOf(nodes);
        this.components = ImmutableList.copyOf(components);
        for (CircuitNode node : nodes) {
            nodesByLabel.put(node.getLabel(), node);
        }
    }

    public List<CircuitNode> getNodes() {
        return nodes;
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public CircuitNode getNode(int num) {
        return nodes.get(num);
    }

    public Optional<CircuitNode> getNode(String label) {
        return Optional.ofNullable(nodesByLabel.get(label));
    }

    public CircuitNode getReferenceNode() {
        return nodes.get(0);
    }

    public List<CircuitComponent> getComponents() {
        return components;
    }

    public <T extends CircuitComponent> List<T> getComponents(Class<T> clazz) {
        return components.stream().filter(clazz::isInstance).map(clazz::cast).toList();
    }

    public CircuitComponent getComponent(String id) {
        return components.stream()
                .filter(c -> c.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("Component '" + id + "' not found"));
    }

    @Override
    public String toString() {
        return "Circuit(nodes=" + nodes.size() + ", components=" + components.size() + ")";
    }
}

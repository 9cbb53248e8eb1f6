/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.network;

/**
 * A two-terminal component. The ordered pair (nodeA, nodeB) defines the reference polarity: voltage is
 * V(nodeA) - V(nodeB) and current is positive when flowing from nodeA to nodeB through the component.
 *
 * @author PowSyBl nodal analysis developers
 */
public interface CircuitComponent {

    String getId();

    /**
     * Position of the component in the input list.
     */
    int getNum();

    ComponentType getType();

    double getValue();

    CircuitNode getNodeA();

    CircuitNode getNodeB();

    default boolean isConnectedTo(CircuitNode node) {
        return getNodeA() == node || getNodeB() == node;
    }

    default CircuitNode getOtherNode(CircuitNode node) {
        if (node == getNodeA()) {
            return getNodeB();
        } else if (node == getNodeB()) {
            return getNodeA();
        }
        throw new IllegalArgumentException("Component " + getId() + " is not connected to node " + node.getLabel());
    }

    /**
     * Current leaving {@code node} through this component when {@code current} flows from nodeA to nodeB.
     */
    default double getCurrentLeaving(CircuitNode node, double current) {
        if (node == getNodeA()) {
            return current;
        } else if (node == getNodeB()) {
            return -current;
        }
        throw new IllegalArgumentException("Component " + getId() + " is not connected to node " + node.getLabel());
    }
}

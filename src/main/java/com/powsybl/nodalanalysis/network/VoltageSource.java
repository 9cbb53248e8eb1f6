/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.network;

/**
 * Ideal voltage source: V(nodeB) - V(nodeA) = value, whatever the current through it.
 *
 * @author PowSyBl nodal analysis developers
 */
public class VoltageSource extends AbstractCircuitComponent {

    public VoltageSource(String id, int num, double voltage, CircuitNode nodeA, CircuitNode nodeB) {
        super(id, num, voltage, nodeA, nodeB);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.VOLTAGE_SOURCE;
    }

    public double getVoltage() {
        return value;
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.network;

/**
 * One component as described by the user, before any validation. A null id means that an id is generated from the
 * component type.
 *
 * @author PowSyBl nodal analysis developers
 */
public record ComponentDescription(String id, ComponentType type, double value, String nodeA, String nodeB) {

    public static ComponentDescription resistor(double resistance, String nodeA, String nodeB) {
        return new ComponentDescription(null, ComponentType.RESISTOR, resistance, nodeA, nodeB);
    }

    public static ComponentDescription resistor(String id, double resistance, String nodeA, String nodeB) {
        return new ComponentDescription(id, ComponentType.RESISTOR, resistance, nodeA, nodeB);
    }

    /**
     * Voltage source raising the potential by {@code voltage} from {@code nodeA} to {@code nodeB}.
     */
    public static ComponentDescription voltageSource(double voltage, String nodeA, String nodeB) {
        return new ComponentDescription(null, ComponentType.VOLTAGE_SOURCE, voltage, nodeA, nodeB);
    }

    public static ComponentDescription voltageSource(String id, double voltage, String nodeA, String nodeB) {
        return new ComponentDescription(id, ComponentType.VOLTAGE_SOURCE, voltage, nodeA, nodeB);
    }

    /**
     * Current source driving {@code current} from {@code nodeA} to {@code nodeB} through itself.
     */
    public static ComponentDescription currentSource(double current, String nodeA, String nodeB) {
        return new ComponentDescription(null, ComponentType.CURRENT_SOURCE, current, nodeA, nodeB);
    }

    public static ComponentDescription currentSource(String id, double current, String nodeA, String nodeB) {
        return new ComponentDescription(id, ComponentType.CURRENT_SOURCE, current, nodeA, nodeB);
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.network;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author PowSyBl nodal analysis developers
 */
class ComponentTypeTest {

    @Test
    void testFromName() {
        assertEquals(Optional.of(ComponentType.RESISTOR), ComponentType.fromName("Resistor"));
        assertEquals(Optional.of(ComponentType.VOLTAGE_SOURCE), ComponentType.fromName("VoltageSource"));
        assertEquals(Optional.of(ComponentType.VOLTAGE_SOURCE), ComponentType.fromName("Voltage Source"));
        assertEquals(Optional.of(ComponentType.VOLTAGE_SOURCE), ComponentType.fromName("voltage_source"));
        assertEquals(Optional.of(ComponentType.CURRENT_SOURCE), ComponentType.fromName("CURRENT-SOURCE"));
        assertTrue(ComponentType.fromName("Capacitor").isEmpty());
    }
}

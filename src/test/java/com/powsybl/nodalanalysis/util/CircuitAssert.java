/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.util;

import com.powsybl.nodalanalysis.result.CircuitSolution;
import com.powsybl.nodalanalysis.result.ComponentResult;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * @author PowSyBl nodal analysis developers
 */
public final class CircuitAssert {

    public static final double DELTA_V = 1E-9d;
    public static final double DELTA_I = 1E-12d;
    public static final double DELTA_POWER = 1E-9d;

    private CircuitAssert() {
    }

    public static void assertVoltageEquals(double v, CircuitSolution solution, String nodeLabel) {
        assertEquals(v, solution.getVoltage(nodeLabel), DELTA_V, "Wrong voltage at node " + nodeLabel);
    }

    public static void assertCurrentEquals(double i, CircuitSolution solution, String componentId) {
        assertEquals(i, solution.getComponent(componentId).current(), DELTA_I, "Wrong current through " + componentId);
    }

    public static void assertPowerEquals(double p, CircuitSolution solution, String componentId) {
        assertEquals(p, solution.getComponent(componentId).power(), DELTA_POWER, "Wrong power of " + componentId);
    }

    public static void assertPowerBalanced(CircuitSolution solution) {
        assertEquals(0, solution.getTotalPower(), DELTA_POWER, "Power is not balanced");
        double sum = solution.getComponents().stream().mapToDouble(ComponentResult::power).sum();
        assertEquals(solution.getTotalPower(), sum, DELTA_POWER);
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.result;

import com.powsybl.nodalanalysis.network.ComponentType;

import java.util.Objects;

/**
 * Operating point of one component. {@code voltage} is V(nodeA) - V(nodeB), {@code current} flows from nodeA to
 * nodeB through the component and {@code power} is positive when the component absorbs energy.
 * {@code currentDetermined} is false for a voltage source in parallel with other ideal sources, whose share of the
 * current cannot be known.
 *
 * @author PowSyBl nodal analysis developers
 */
public record ComponentResult(String id, ComponentType type, double value, String nodeA, String nodeB,
                              double voltage, double current, double power, boolean currentDetermined,
                              String description) {

    public ComponentResult {
        Objects.requireNonNull(id);
        Objects.requireNonNull(type);
        Objects.requireNonNull(nodeA);
        Objects.requireNonNull(nodeB);
        Objects.requireNonNull(description);
    }
}

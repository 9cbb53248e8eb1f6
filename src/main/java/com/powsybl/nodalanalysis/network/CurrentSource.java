/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.network;

/**
 * Ideal current source: {@code value} amperes flow from nodeA to nodeB through it, whatever the voltage across it.
 *
 * @author PowSyBl nodal analysis developers
 */
public class CurrentSource extends AbstractCircuitComponent {

    public CurrentSource(String id, int num, double current, CircuitNode nodeA, CircuitNode nodeB) {
        super(id, num, current, nodeA, nodeB);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.CURRENT_SOURCE;
    }

    public double getCurrent() {
        return value;
    }
}

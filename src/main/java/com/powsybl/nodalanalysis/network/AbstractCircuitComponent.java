/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.network;

import java.util.Objects;

/**
 * @author PowSyBl nodal analysis developers
 */
public abstract class AbstractCircuitComponent implements CircuitComponent {

    protected final String id;

    protected final int num;

    protected final double value;

    protected final CircuitNode nodeA;

    protected final CircuitNode nodeB;

    protected AbstractCircuitComponent(String id, int num, double value, CircuitNode nodeA, CircuitNode nodeB) {
        this.id = Objects.requireNonNull(id);
        this.num = num;
        this.value = value;
        this.nodeA = Objects.requireNonNull(nodeA);
        this.nodeB = Objects.requireNonNull(nodeB);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public int getNum() {
        return num;
    }

    @Override
    public double getValue() {
        return value;
    }

    @Override
    public CircuitNode getNodeA() {
        return nodeA;
    }

    @Override
    public CircuitNode getNodeB() {
        return nodeB;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(id=" + id + ", value=" + value + ", nodeA=" + nodeA.getLabel() + ", nodeB=" + nodeB.getLabel() + ")";
    }
}

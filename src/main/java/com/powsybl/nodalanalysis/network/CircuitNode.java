/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A circuit node. Index 0 is always the reference node, the others are numbered in order of first appearance.
 *
 * @author PowSyBl nodal analysis developers
 */
public class CircuitNode {

    private final int num;

    private final String label;

    private final List<CircuitComponent> components = new ArrayList<>();

    CircuitNode(int num, String label) {
        this.num = num;
        this.label = Objects.requireNonNull(label);
    }

    public int getNum() {
        return num;
    }

    public String getLabel() {
        return label;
    }

    public boolean isReference() {
        return num == 0;
    }

    void addComponent(CircuitComponent component) {
        components.add(component);
    }

    /**
     * Incident components, in input order.
     */
    public List<CircuitComponent> getComponents() {
        return Collections.unmodifiableList(components);
    }

    @Override
    public String toString() {
        return "CircuitNode(num=" + num + ", label=" + label + ")";
    }
}

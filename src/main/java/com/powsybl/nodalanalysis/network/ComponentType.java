/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.network;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Two-terminal component kinds. New kinds need a new constant here, a {@link CircuitComponent} implementation and a
 * new term in the equation assembler; supernode resolution and solving stay untouched.
 *
 * @author PowSyBl nodal analysis developers
 */
public enum ComponentType {
    RESISTOR("Resistor", "R", "Current flows from nodeA to nodeB: I = (V(nodeA) - V(nodeB)) / R"),
    VOLTAGE_SOURCE("Voltage Source", "V", "Potential rises from nodeA to nodeB: V(nodeB) - V(nodeA) = value"),
    CURRENT_SOURCE("Current Source", "I", "Current (value) flows from nodeA to nodeB through the source");

    private final String displayName;

    private final String idPrefix;

    private final String convention;

    ComponentType(String displayName, String idPrefix, String convention) {
        this.displayName = displayName;
        this.idPrefix = idPrefix;
        this.convention = convention;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    public String getConvention() {
        return convention;
    }

    /**
     * Accepts enum names and display names, case and separator insensitive: "VoltageSource", "Voltage Source",
     * "voltage_source" all match {@link #VOLTAGE_SOURCE}.
     */
    public static Optional<ComponentType> fromName(String name) {
        Objects.requireNonNull(name);
        String normalized = normalize(name);
        for (ComponentType type : values()) {
            if (normalize(type.name()).equals(normalized) || normalize(type.displayName).equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String name) {
        return name.replaceAll("[\\s_-]", "").toLowerCase(Locale.ROOT);
    }
}

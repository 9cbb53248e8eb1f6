/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis;

import java.util.Locale;
import java.util.Objects;

/**
 * Ideal voltage sources forming a loop whose voltages do not sum to zero.
 *
 * @author PowSyBl nodal analysis developers
 */
public class InconsistentSourceException extends NodalAnalysisException {

    private final String sourceId;

    private final double expectedVoltage;

    private final double sourceVoltage;

    public InconsistentSourceException(String sourceId, String nodeA, String nodeB, double expectedVoltage, double sourceVoltage) {
        super(ErrorKind.INCONSISTENT_SOURCE_ERROR, String.format(Locale.ROOT,
                "Voltage source '%s' forces V(%s) - V(%s) = %s V but other voltage sources already fix it to %s V",
                sourceId, nodeB, nodeA, sourceVoltage, expectedVoltage));
        this.sourceId = Objects.requireNonNull(sourceId);
        this.expectedVoltage = expectedVoltage;
        this.sourceVoltage = sourceVoltage;
    }

    public String getSourceId() {
        return sourceId;
    }

    public double getExpectedVoltage() {
        return expectedVoltage;
    }

    public double getSourceVoltage() {
        return sourceVoltage;
    }

    @Override
    public String getSuggestion() {
        return "Remove one of the voltage sources of the loop or make their values agree";
    }
}

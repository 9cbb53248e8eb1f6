/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis;

/**
 * Kind of a fatal nodal analysis failure, with the name used on the wire.
 *
 * @author PowSyBl nodal analysis developers
 */
public enum ErrorKind {
    VALIDATION_ERROR("ValidationError"),
    INCONSISTENT_SOURCE_ERROR("InconsistentSourceError"),
    SINGULAR_SYSTEM_ERROR("SingularSystemError"),
    UNDERCONSTRAINED_CIRCUIT_ERROR("UnderconstrainedCircuitError");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}

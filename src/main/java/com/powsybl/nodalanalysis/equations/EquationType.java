/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.equations;

/**
 * Kind of a row of the nodal linear system.
 *
 * @author PowSyBl nodal analysis developers
 */
public enum EquationType {
    KCL("kcl"),
    SUPERNODE_KCL("supernode_kcl"),
    CONSTRAINT("constraint");

    private final String symbol;

    EquationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isKcl() {
        return this != CONSTRAINT;
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis;

/**
 * Why a linear system could not be solved.
 *
 * @author PowSyBl nodal analysis developers
 */
public enum SingularityHint {
    /**
     * A group of nodes tied together by voltage sources has no resistive path to the reference node.
     */
    FLOATING_SUBCIRCUIT("floating subcircuit"),
    /**
     * Some nodes are attached to the rest of the circuit only through current sources.
     */
    MISSING_REFERENCE_PATH("missing reference path"),
    /**
     * The structure looks fine but the matrix is numerically singular.
     */
    NUMERICALLY_SINGULAR("numerically singular");

    private final String label;

    SingularityHint(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

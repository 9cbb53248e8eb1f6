/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis;

import java.util.Objects;

/**
 * The nodal equations have no unique solution.
 *
 * @author PowSyBl nodal analysis developers
 */
public class SingularSystemException extends NodalAnalysisException {

    private final SingularityHint hint;

    public SingularSystemException(String message) {
        this(ErrorKind.SINGULAR_SYSTEM_ERROR, SingularityHint.NUMERICALLY_SINGULAR, message, null);
    }

    public SingularSystemException(String message, Throwable cause) {
        this(ErrorKind.SINGULAR_SYSTEM_ERROR, SingularityHint.NUMERICALLY_SINGULAR, message, cause);
    }

    protected SingularSystemException(ErrorKind kind, SingularityHint hint, String message, Throwable cause) {
        super(kind, message, cause);
        this.hint = Objects.requireNonNull(hint);
    }

    public SingularityHint getHint() {
        return hint;
    }

    @Override
    public String getSuggestion() {
        return switch (hint) {
            case FLOATING_SUBCIRCUIT -> "Add a resistive path from the voltage source group to the reference node";
            case MISSING_REFERENCE_PATH -> "Connect the nodes fed only by current sources to the reference node through a resistor";
            case NUMERICALLY_SINGULAR -> "Check for extreme resistor values or contradictory sources";
        };
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis;

import com.powsybl.commons.PowsyblException;

import java.util.Objects;

/**
 * Root of all fatal nodal analysis errors. No solution is ever produced when one of them is thrown.
 *
 * @author PowSyBl nodal analysis developers
 */
public abstract class NodalAnalysisException extends PowsyblException {

    private final ErrorKind kind;

    protected NodalAnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind);
    }

    protected NodalAnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Short advice for the user on how to fix the circuit.
     */
    public abstract String getSuggestion();
}

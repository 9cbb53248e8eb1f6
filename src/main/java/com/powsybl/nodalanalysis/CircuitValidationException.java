/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis;

/**
 * Malformed, degenerate or disconnected circuit description.
 *
 * @author PowSyBl nodal analysis developers
 */
public class CircuitValidationException extends NodalAnalysisException {

    public CircuitValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }

    public CircuitValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_ERROR, message, cause);
    }

    @Override
    public String getSuggestion() {
        return "Check component values and node labels, and make sure every node is connected to the reference node";
    }
}

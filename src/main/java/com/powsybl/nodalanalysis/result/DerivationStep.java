/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.result;

import com.powsybl.nodalanalysis.equations.EquationType;

import java.util.Objects;

/**
 * Explanation of how one row of the linear system was built.
 *
 * @author PowSyBl nodal analysis developers
 */
public record DerivationStep(EquationType type, int row, String title, String equationText, String explanation) {

    public DerivationStep {
        Objects.requireNonNull(type);
        Objects.requireNonNull(title);
        Objects.requireNonNull(equationText);
        Objects.requireNonNull(explanation);
    }
}

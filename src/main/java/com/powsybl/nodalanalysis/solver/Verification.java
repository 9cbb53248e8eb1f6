/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.solver;

import java.util.Arrays;
import java.util.Objects;

/**
 * Residual G.V - I of a solution and its classification.
 *
 * @author PowSyBl nodal analysis developers
 */
public record Verification(double[] residual, double maxError, VerificationStatus status) {

    public Verification {
        residual = residual.clone();
        Objects.requireNonNull(status);
    }

    @Override
    public double[] residual() {
        return residual.clone();
    }

    public boolean isVerified() {
        return status == VerificationStatus.VERIFIED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Verification other
                && Arrays.equals(residual, other.residual)
                && Double.compare(maxError, other.maxError) == 0
                && status == other.status;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(residual) + Double.hashCode(maxError)) + status.hashCode();
    }

    @Override
    public String toString() {
        return "Verification(maxError=" + maxError + ", status=" + status + ")";
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.solver;

import com.powsybl.nodalanalysis.equations.LinearSystem;
import net.jafama.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * @author PowSyBl nodal analysis developers
 */
public final class SolutionVerifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(SolutionVerifier.class);

    private SolutionVerifier() {
    }

    /**
     * A residual above {@code tolerance} is not fatal: the solution is kept and flagged.
     */
    public static Verification verify(LinearSystem system, double[] x, double tolerance) {
        Objects.requireNonNull(system);
        Objects.requireNonNull(x);
        double[] residual = system.computeResidual(x);
        double maxError = 0;
        for (double r : residual) {
            maxError = FastMath.max(maxError, FastMath.abs(r));
        }
        VerificationStatus status;
        if (maxError < tolerance) {
            status = VerificationStatus.VERIFIED;
        } else {
            status = VerificationStatus.NUMERICAL_WARNING;
            LOGGER.warn("Max residual {} exceeds tolerance {}", maxError, tolerance);
        }
        return new Verification(residual, maxError, status);
    }
}

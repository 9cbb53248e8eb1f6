/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.solver;

import com.powsybl.nodalanalysis.NodalAnalysisParameters;
import com.powsybl.nodalanalysis.equations.EquationSystemAssembler;
import com.powsybl.nodalanalysis.equations.LinearSystem;
import com.powsybl.nodalanalysis.graph.SupernodeResolver;
import com.powsybl.nodalanalysis.network.CircuitBuilder;
import com.powsybl.nodalanalysis.network.CircuitFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl nodal analysis developers
 */
class SolutionVerifierTest {

    private LinearSystem system;

    @BeforeEach
    void setUp() {
        NodalAnalysisParameters parameters = new NodalAnalysisParameters();
        system = EquationSystemAssembler.assemble(SupernodeResolver.resolve(
                CircuitBuilder.build(CircuitFactory.createUngroundedSupernode(), parameters), parameters));
    }

    @Test
    void testVerified() {
        Verification verification = SolutionVerifier.verify(system, LinearSolver.solve(system), 1E-9);
        assertEquals(VerificationStatus.VERIFIED, verification.status());
        assertTrue(verification.isVerified());
        assertTrue(verification.maxError() < 1E-9);
        assertEquals(2, verification.residual().length);
    }

    @Test
    void testNumericalWarning() {
        Verification verification = SolutionVerifier.verify(system, new double[] {5, 10.001}, 1E-9);
        assertEquals(VerificationStatus.NUMERICAL_WARNING, verification.status());
        assertFalse(verification.isVerified());
        assertEquals(0.001, verification.maxError(), 1E-12);
        assertEquals(5E-7, verification.residual()[0], 1E-12);
    }

    @Test
    void testToleranceIsConfigurable() {
        Verification verification = SolutionVerifier.verify(system, new double[] {5, 10.001}, 1E-2);
        assertEquals(VerificationStatus.VERIFIED, verification.status());
    }
}

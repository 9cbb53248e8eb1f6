/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.result;

import com.powsybl.nodalanalysis.solver.Verification;

import java.util.List;
import java.util.Objects;

/**
 * The linear system as built and solved, with the derivation of each of its rows.
 *
 * @author PowSyBl nodal analysis developers
 */
public class MatrixSolution {

    public static final String MATRIX_EQUATION = "[G][V] = [I]";

    private final double[][] conductanceMatrix;

    private final double[] currentVector;

    private final double[] voltageSolution;

    private final List<String> unknowns;

    private final String solutionMethod;

    private final List<DerivationStep> steps;

    private final Verification verification;

    public MatrixSolution(double[][] conductanceMatrix, double[] currentVector, double[] voltageSolution, List<String> unknowns,
                          String solutionMethod, List<DerivationStep> steps, Verification verification) {
        this.conductanceMatrix = Objects.requireNonNull(conductanceMatrix);
        this.currentVector = Objects.requireNonNull(currentVector);
        this.voltageSolution = Objects.requireNonNull(voltageSolution);
        this.unknowns = List.copyOf(unknowns);
        this.solutionMethod = Objects.requireNonNull(solutionMethod);
        this.steps = List.copyOf(steps);
        this.verification = Objects.requireNonNull(verification);
    }

    public String getMatrixEquation() {
        return MATRIX_EQUATION;
    }

    public double[][] getConductanceMatrix() {
        return conductanceMatrix;
    }

    public double[] getCurrentVector() {
        return currentVector;
    }

    public double[] getVoltageSolution() {
        return voltageSolution;
    }

    /**
     * Voltage name of each column, for instance V(n1).
     */
    public List<String> getUnknowns() {
        return unknowns;
    }

    public String getSolutionMethod() {
        return solutionMethod;
    }

    public List<DerivationStep> getSteps() {
        return steps;
    }

    public Verification getVerification() {
        return verification;
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.equations;

import com.google.common.collect.ImmutableList;
import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.nodalanalysis.graph.SupernodeResolution;

import java.util.List;
import java.util.Objects;

/**
 * The system G.V = I, row i being {@link #getEquations()}.get(i) and column j the unknown voltage of
 * {@link SupernodeResolution#getNodeAtColumn(int)}. Never modified once assembled.
 *
 * @author PowSyBl nodal analysis developers
 */
public class LinearSystem {

    private final SupernodeResolution resolution;

    private final List<Equation> equations;

    private final double[][] matrix;

    private final double[] rhs;

    LinearSystem(SupernodeResolution resolution, List<Equation> equations) {
        this.resolution = Objects.requireNonNull(resolution);
        this.equations = ImmutableList.copyOf(equations);
        int size = resolution.getUnknownCount();
        if (equations.size() != size) {
            throw new IllegalStateException("Equation count " + equations.size() + " differs from unknown count " + size);
        }
        matrix = new double[size][size];
        rhs = new double[size];
        for (Equation equation : equations) {
            int row = equation.getRow();
            equation.getCoefficients().forEach((column, value) -> matrix[row][column] = value);
            rhs[row] = equation.getRhs();
        }
    }

    public SupernodeResolution getResolution() {
        return resolution;
    }

    public List<Equation> getEquations() {
        return equations;
    }

    public int getSize() {
        return rhs.length;
    }

    public double getCoefficient(int row, int column) {
        return matrix[row][column];
    }

    public double getRhs(int row) {
        return rhs[row];
    }

    /**
     * Copy of the conductance matrix.
     */
    public double[][] getMatrix() {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }

    /**
     * Copy of the current vector.
     */
    public double[] getRhs() {
        return rhs.clone();
    }

    /**
     * Fresh dense matrix, suitable for an in place decomposition.
     */
    public DenseMatrix toDenseMatrix() {
        DenseMatrix denseMatrix = new DenseMatrix(getSize(), getSize());
        for (int row = 0; row < getSize(); row++) {
            for (int column = 0; column < getSize(); column++) {
                if (matrix[row][column] != 0) {
                    denseMatrix.set(row, column, matrix[row][column]);
                }
            }
        }
        return denseMatrix;
    }

    /**
     * G.x - I
     */
    public double[] computeResidual(double[] x) {
        if (x.length != getSize()) {
            throw new IllegalArgumentException("Expected a vector of size " + getSize() + ", got " + x.length);
        }
        double[] residual = new double[getSize()];
        for (Equation equation : equations) {
            residual[equation.getRow()] = equation.evaluate(x) - equation.getRhs();
        }
        return residual;
    }
}

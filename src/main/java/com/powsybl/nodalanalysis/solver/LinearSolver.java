/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.solver;

import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.math.matrix.LUDecomposition;
import com.powsybl.nodalanalysis.SingularSystemException;
import com.powsybl.nodalanalysis.SingularityHint;
import com.powsybl.nodalanalysis.UnderconstrainedCircuitException;
import com.powsybl.nodalanalysis.equations.Equation;
import com.powsybl.nodalanalysis.equations.LinearSystem;
import com.powsybl.nodalanalysis.graph.FloatingSubcircuitFinder;
import com.powsybl.nodalanalysis.graph.FloatingSubcircuitFinder.FloatingSubcircuit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Solves G.V = I by dense LU decomposition. Structurally ill-posed circuits are diagnosed before decomposing so that
 * the error can tell a floating voltage source group from nodes hung on current sources only.
 *
 * @author PowSyBl nodal analysis developers
 */
public final class LinearSolver {

    public static final String SOLUTION_METHOD = "LU decomposition";

    private static final Logger LOGGER = LoggerFactory.getLogger(LinearSolver.class);

    private LinearSolver() {
    }

    public static double[] solve(LinearSystem system) {
        Objects.requireNonNull(system);
        checkStructure(system);

        int size = system.getSize();
        if (size == 0) {
            LOGGER.debug("Every node voltage is fixed by voltage sources, nothing to solve");
            return new double[0];
        }
        for (Equation equation : system.getEquations()) {
            if (equation.getCoefficients().isEmpty()) {
                throw new SingularSystemException("Row " + equation.getRow() + " (" + equation.getType().getSymbol() + " of "
                        + equation.getVariable().getLabel() + ") has no coefficient");
            }
        }

        double[] x = system.getRhs();
        DenseMatrix matrix = system.toDenseMatrix();
        try (LUDecomposition lu = matrix.decomposeLU()) {
            lu.solve(x);
        } catch (RuntimeException e) {
            // the dense decomposition reports an exactly singular matrix with an unchecked exception
            throw new SingularSystemException("Conductance matrix is singular: " + e.getMessage(), e);
        }

        for (int i = 0; i < size; i++) {
            if (!Double.isFinite(x[i])) {
                throw new SingularSystemException("Conductance matrix is numerically singular, voltage of "
                        + system.getResolution().getNodeAtColumn(i).getLabel() + " is " + x[i]);
            }
        }
        return x;
    }

    private static void checkStructure(LinearSystem system) {
        List<FloatingSubcircuit> floatingSubcircuits = FloatingSubcircuitFinder.find(system.getResolution().getCircuit());
        if (!floatingSubcircuits.isEmpty()) {
            SingularityHint hint = floatingSubcircuits.stream()
                    .map(FloatingSubcircuit::hint)
                    .filter(h -> h == SingularityHint.FLOATING_SUBCIRCUIT)
                    .findFirst()
                    .orElse(SingularityHint.MISSING_REFERENCE_PATH);
            List<String> floatingNodes = floatingSubcircuits.stream()
                    .flatMap(f -> f.getNodeLabels().stream())
                    .toList();
            throw new UnderconstrainedCircuitException(hint, floatingNodes);
        }
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.equations;

import com.powsybl.nodalanalysis.NodalAnalysisParameters;
import com.powsybl.nodalanalysis.graph.SupernodeResolution;
import com.powsybl.nodalanalysis.graph.SupernodeResolver;
import com.powsybl.nodalanalysis.network.CircuitBuilder;
import com.powsybl.nodalanalysis.network.CircuitFactory;
import com.powsybl.nodalanalysis.network.ComponentDescription;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.powsybl.nodalanalysis.network.ComponentDescription.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl nodal analysis developers
 */
class EquationSystemAssemblerTest {

    private static final double DELTA = 1E-12;

    private final NodalAnalysisParameters parameters = new NodalAnalysisParameters();

    private SupernodeResolution resolve(List<ComponentDescription> components) {
        return SupernodeResolver.resolve(CircuitBuilder.build(components, parameters), parameters);
    }

    @Test
    void testDivider() {
        LinearSystem system = EquationSystemAssembler.assemble(resolve(CircuitFactory.createDivider()));
        assertEquals(1, system.getSize());
        Equation kcl = system.getEquations().get(0);
        assertEquals(EquationType.KCL, kcl.getType());
        assertEquals("n2", kcl.getVariable().getLabel());
        assertEquals(0.0015, system.getCoefficient(0, 0), DELTA);
        // V(n1) = 12 is known and moved to the right-hand side
        assertEquals(0.012, system.getRhs(0), DELTA);
        assertEquals(1, kcl.getSubstitutions().size());
        assertEquals(2, kcl.getTerms().size());
        assertTrue(kcl.getTerms().stream().allMatch(ResistorTerm.class::isInstance));
    }

    @Test
    void testPlainNodes() {
        LinearSystem system = EquationSystemAssembler.assemble(resolve(List.of(
                currentSource(0.002, "GND", "n1"),
                resistor(1000, "n1", "n2"),
                resistor(500, "n2", "GND"))));
        assertArrayEquals(new double[] {0.001, -0.001}, system.getMatrix()[0], DELTA);
        assertArrayEquals(new double[] {-0.001, 0.003}, system.getMatrix()[1], DELTA);
        assertArrayEquals(new double[] {0.002, 0}, system.getRhs(), DELTA);
    }

    @Test
    void testSupernodeRows() {
        List<Equation> created = new ArrayList<>();
        LinearSystem system = EquationSystemAssembler.assemble(resolve(CircuitFactory.createUngroundedSupernode()), List.of(created::add));
        assertEquals(2, system.getSize());
        assertEquals(system.getEquations(), created);

        Equation kcl = system.getEquations().get(0);
        assertEquals(EquationType.SUPERNODE_KCL, kcl.getType());
        assertEquals(List.of("a", "b"), kcl.getNodes().stream().map(n -> n.getLabel()).toList());
        assertEquals(0.001, system.getCoefficient(0, 0), DELTA);
        assertEquals(0.0005, system.getCoefficient(0, 1), DELTA);
        assertEquals(0.01, system.getRhs(0), DELTA);
        assertTrue(kcl.getConstraint().isEmpty());

        Equation constraint = system.getEquations().get(1);
        assertEquals(EquationType.CONSTRAINT, constraint.getType());
        assertEquals(1, constraint.getRow());
        assertEquals(-1, system.getCoefficient(1, 0), DELTA);
        assertEquals(1, system.getCoefficient(1, 1), DELTA);
        assertEquals(5, system.getRhs(1), DELTA);
        Equation.Constraint c = constraint.getConstraint().orElseThrow();
        assertEquals("b", c.member().getLabel());
        assertEquals("a", c.representative().getLabel());
        assertEquals(1, c.path().size());
    }

    @Test
    void testBranchesInsideSupernodeCancel() {
        LinearSystem system = EquationSystemAssembler.assemble(resolve(List.of(
                voltageSource(5, "a", "b"),
                resistor(100, "a", "b"),
                currentSource(0.5, "a", "b"),
                resistor(1000, "a", "GND"))));
        Equation kcl = system.getEquations().get(0);
        assertEquals(1, kcl.getTerms().size());
        assertEquals("R2", kcl.getTerms().get(0).getComponent().getId());
        assertEquals(0.001, system.getCoefficient(0, 0), DELTA);
        assertEquals(0, system.getCoefficient(0, 1), DELTA);
        assertEquals(0, system.getRhs(0), DELTA);
    }

    @Test
    void testNoUnknown() {
        LinearSystem system = EquationSystemAssembler.assemble(resolve(CircuitFactory.createSingleResistor()));
        assertEquals(0, system.getSize());
        assertTrue(system.getEquations().isEmpty());
        assertEquals(0, system.computeResidual(new double[0]).length);
    }

    @Test
    void testResidual() {
        LinearSystem system = EquationSystemAssembler.assemble(resolve(CircuitFactory.createUngroundedSupernode()));
        assertArrayEquals(new double[] {0, 0}, system.computeResidual(new double[] {5, 10}), DELTA);
        assertArrayEquals(new double[] {0.001, -1}, system.computeResidual(new double[] {6, 10}), DELTA);
    }
}

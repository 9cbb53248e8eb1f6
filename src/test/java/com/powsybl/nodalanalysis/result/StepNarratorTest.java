/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.result;

import com.powsybl.nodalanalysis.NodalAnalysisParameters;
import com.powsybl.nodalanalysis.equations.EquationSystemAssembler;
import com.powsybl.nodalanalysis.equations.EquationType;
import com.powsybl.nodalanalysis.equations.LinearSystem;
import com.powsybl.nodalanalysis.graph.SupernodeResolution;
import com.powsybl.nodalanalysis.graph.SupernodeResolver;
import com.powsybl.nodalanalysis.network.CircuitBuilder;
import com.powsybl.nodalanalysis.network.CircuitFactory;
import com.powsybl.nodalanalysis.network.ComponentDescription;
import com.powsybl.nodalanalysis.util.ValueFormatter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl nodal analysis developers
 */
class StepNarratorTest {

    private final NodalAnalysisParameters parameters = new NodalAnalysisParameters();

    private List<DerivationStep> narrate(List<ComponentDescription> components) {
        SupernodeResolution resolution = SupernodeResolver.resolve(CircuitBuilder.build(components, parameters), parameters);
        StepNarrator narrator = new StepNarrator(resolution, new ValueFormatter(6));
        LinearSystem system = EquationSystemAssembler.assemble(resolution, List.of(narrator));
        assertEquals(system.getSize(), narrator.getSteps().size());
        return narrator.getSteps();
    }

    @Test
    void testKclStep() {
        List<DerivationStep> steps = narrate(CircuitFactory.createDivider());
        DerivationStep step = steps.get(0);
        assertEquals(EquationType.KCL, step.type());
        assertEquals(0, step.row());
        assertEquals("KCL at node n2", step.title());
        assertEquals("(V(n2) - V(n1)) / 1000 + (V(n2) - 0) / 2000 = 0", step.equationText());
        assertTrue(step.explanation().contains("Matrix row 0: 0.0015*V(n2) = 0.012."));
        assertTrue(step.explanation().contains("V(n1) = 12 V"));
    }

    @Test
    void testSupernodeSteps() {
        List<DerivationStep> steps = narrate(CircuitFactory.createUngroundedSupernode());
        assertEquals(List.of(EquationType.SUPERNODE_KCL, EquationType.CONSTRAINT), steps.stream().map(DerivationStep::type).toList());

        DerivationStep kcl = steps.get(0);
        assertEquals("Supernode KCL for {a, b}", kcl.title());
        assertEquals("(V(a) - 0) / 1000 - 0.01 + (V(b) - 0) / 2000 = 0", kcl.equationText());

        DerivationStep constraint = steps.get(1);
        assertEquals(1, constraint.row());
        assertEquals("Constraint V(b) - V(a)", constraint.title());
        assertEquals("V(b) - V(a) = 5", constraint.equationText());
        assertTrue(constraint.explanation().contains("voltage source V1 from a to b raises the potential by 5 V"));
        assertTrue(constraint.explanation().contains("Matrix row 1: -1*V(a) + 1*V(b) = 5."));
    }

    @Test
    void testReversedSourceInConstraint() {
        List<DerivationStep> steps = narrate(List.of(
                ComponentDescription.voltageSource("V1", 3, "b", "a"),
                ComponentDescription.resistor("R1", 10, "a", "GND"),
                ComponentDescription.resistor("R2", 10, "b", "GND")));
        DerivationStep constraint = steps.get(1);
        // b is seen first, so it is the representative
        assertEquals("V(a) - V(b) = 3", constraint.equationText());
        assertTrue(constraint.explanation().contains("voltage source V1 from b to a raises the potential by 3 V"));
    }

    @Test
    void testNoStepWhenEverythingIsKnown() {
        assertTrue(narrate(CircuitFactory.createSeriesSources()).isEmpty());
    }

    @Test
    void testNearZeroKnownVoltageIsShownAsZero() {
        // 0.1 + 0.2 - 0.3 leaves a rounding residue on n3
        List<DerivationStep> steps = narrate(List.of(
                ComponentDescription.voltageSource("V1", 0.1, "GND", "n1"),
                ComponentDescription.voltageSource("V2", 0.2, "n1", "n2"),
                ComponentDescription.voltageSource("V3", -0.3, "n2", "n3"),
                ComponentDescription.resistor("R1", 10, "n3", "n4"),
                ComponentDescription.resistor("R2", 10, "n4", "GND")));
        assertEquals(1, steps.size());
        String explanation = steps.get(0).explanation();
        assertTrue(explanation.contains("Matrix row 0: 0.2*V(n4) = 0."), explanation);
        assertTrue(explanation.contains("V(n3) = 0 V"), explanation);
    }
}

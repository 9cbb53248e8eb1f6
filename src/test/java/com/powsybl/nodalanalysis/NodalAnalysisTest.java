/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis;

import com.powsybl.nodalanalysis.network.CircuitFactory;
import com.powsybl.nodalanalysis.network.ComponentDescription;
import com.powsybl.nodalanalysis.result.CircuitSolution;
import com.powsybl.nodalanalysis.result.MatrixSolution;
import com.powsybl.nodalanalysis.solver.VerificationStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.powsybl.nodalanalysis.network.ComponentDescription.*;
import static com.powsybl.nodalanalysis.util.CircuitAssert.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl nodal analysis developers
 */
class NodalAnalysisTest {

    private NodalAnalysisParameters parameters;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        parameters = new NodalAnalysisParameters();
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testSingleResistor() {
        CircuitSolution solution = NodalAnalysis.run(CircuitFactory.createSingleResistor());
        assertVoltageEquals(12, solution, "n1");
        assertCurrentEquals(0.012, solution, "R1");
        assertPowerEquals(0.144, solution, "R1");
        assertPowerEquals(-0.144, solution, "V1");
        assertCurrentEquals(0.012, solution, "V1");
        assertEquals(-12, solution.getComponent("V1").voltage(), DELTA_V);
        assertPowerBalanced(solution);
        assertEquals(2, solution.getSummary().totalComponents());
        assertEquals(2, solution.getSummary().solvedNodes());
        assertTrue(solution.getSummary().powerBalance());
    }

    @Test
    void testDivider() {
        CircuitSolution solution = NodalAnalysis.run(CircuitFactory.createDivider(), parameters);
        assertVoltageEquals(12, solution, "n1");
        assertVoltageEquals(8, solution, "n2");
        assertEquals(2.0 / 3, solution.getVoltage("n2") / solution.getVoltage("n1"), 1E-12);
        assertCurrentEquals(0.004, solution, "R1");
        assertCurrentEquals(0.004, solution, "R2");
        assertPowerEquals(-0.048, solution, "V1");
        assertPowerBalanced(solution);

        MatrixSolution matrixSolution = solution.getMatrixSolution();
        assertEquals("[G][V] = [I]", matrixSolution.getMatrixEquation());
        assertEquals("LU decomposition", matrixSolution.getSolutionMethod());
        assertEquals(List.of("V(n2)"), matrixSolution.getUnknowns());
        assertArrayEquals(new double[] {8}, matrixSolution.getVoltageSolution(), DELTA_V);
        assertEquals(1, matrixSolution.getSteps().size());
        assertEquals(VerificationStatus.VERIFIED, matrixSolution.getVerification().status());
    }

    @Test
    void testReferenceVoltageIsExactlyZero() {
        for (List<ComponentDescription> components : List.of(CircuitFactory.createDivider(), CircuitFactory.createMixed(),
                CircuitFactory.createUngroundedSupernode(), CircuitFactory.createCurrentSourceAndResistor())) {
            CircuitSolution solution = NodalAnalysis.run(components, parameters);
            assertEquals(0.0, solution.getVoltage("GND"));
            assertEquals("GND", solution.getVoltages().keySet().iterator().next());
        }
    }

    @Test
    void testReferenceAliasIsReportedAsGnd() {
        CircuitSolution solution = NodalAnalysis.run(List.of(voltageSource(5, "0", "n1"), resistor(5, "n1", "0")), parameters);
        assertEquals(List.of("GND", "n1"), List.copyOf(solution.getVoltages().keySet()));
        assertEquals("GND", solution.getComponent("R1").nodeB());
    }

    @Test
    void testPowerBalance() {
        for (List<ComponentDescription> components : List.of(CircuitFactory.createSingleResistor(), CircuitFactory.createDivider(),
                CircuitFactory.createUngroundedSupernode(), CircuitFactory.createSeriesSources(), CircuitFactory.createMixed(),
                CircuitFactory.createCurrentSourceAndResistor(), CircuitFactory.createParallelSources(3, 3))) {
            CircuitSolution solution = NodalAnalysis.run(components, parameters);
            assertTrue(Math.abs(solution.getTotalPower()) < 1E-9);
            assertTrue(solution.getSummary().powerBalance());
            assertTrue(solution.getMatrixSolution().getVerification().maxError() < 1E-9);
        }
    }

    @Test
    void testCurrentSource() {
        CircuitSolution solution = NodalAnalysis.run(CircuitFactory.createCurrentSourceAndResistor(), parameters);
        assertVoltageEquals(1, solution, "n1");
        assertCurrentEquals(0.001, solution, "I1");
        assertPowerEquals(-0.001, solution, "I1");
        assertPowerEquals(0.001, solution, "R1");
    }

    @Test
    void testSupernodeSolved() {
        CircuitSolution solution = NodalAnalysis.run(CircuitFactory.createUngroundedSupernode(), parameters);
        assertVoltageEquals(5, solution, "a");
        assertVoltageEquals(10, solution, "b");
        assertCurrentEquals(0.005, solution, "R1");
        assertCurrentEquals(0.005, solution, "R2");
        assertCurrentEquals(0.005, solution, "V1");
        assertPowerEquals(-0.025, solution, "V1");
        assertPowerEquals(-0.05, solution, "I1");
        assertPowerBalanced(solution);
    }

    @Test
    void testMixedCircuitCurrentBalance() {
        CircuitSolution solution = NodalAnalysis.run(CircuitFactory.createMixed(), parameters);
        assertVoltageEquals(solution.getVoltage("c") + 2, solution, "d");
        assertVoltageEquals(solution.getVoltage("d") + 1, solution, "e");
        // currents leaving b through R1 (reversed), R2, R3 and R6 (reversed) sum to zero
        double leavingB = -solution.getComponent("R1").current() + solution.getComponent("R2").current()
                + solution.getComponent("R3").current() - solution.getComponent("R6").current();
        assertEquals(0, leavingB, DELTA_I);
        assertPowerBalanced(solution);
    }

    @Test
    void testUnderconstrainedFloatingSupernode() {
        List<ComponentDescription> components = CircuitFactory.createFloatingSupernode();
        UnderconstrainedCircuitException e = assertThrows(UnderconstrainedCircuitException.class, () -> NodalAnalysis.run(components, parameters));
        assertEquals(SingularityHint.FLOATING_SUBCIRCUIT, e.getHint());
    }

    @Test
    void testInconsistentSources() {
        List<ComponentDescription> components = CircuitFactory.createParallelSources(5, 7);
        NodalAnalysisException e = assertThrows(NodalAnalysisException.class, () -> NodalAnalysis.run(components, parameters));
        assertEquals(ErrorKind.INCONSISTENT_SOURCE_ERROR, e.getKind());
        assertInstanceOf(InconsistentSourceException.class, e);
    }

    @Test
    void testDisconnectedNode() {
        List<ComponentDescription> components = List.of(voltageSource(5, "GND", "n1"), resistor(10, "n1", "GND"), resistor(10, "n2", "n3"));
        NodalAnalysisException e = assertThrows(NodalAnalysisException.class, () -> NodalAnalysis.run(components, parameters));
        assertEquals(ErrorKind.VALIDATION_ERROR, e.getKind());
    }

    @Test
    void testDeterminism() {
        CircuitSolution first = NodalAnalysis.run(CircuitFactory.createMixed(), parameters);
        CircuitSolution second = NodalAnalysis.run(CircuitFactory.createMixed(), parameters);
        assertEquals(first.getVoltages(), second.getVoltages());
        assertEquals(first.getComponents(), second.getComponents());
    }

    @Test
    void testRunAsync() {
        List<CompletableFuture<CircuitSolution>> futures = List.of(
                NodalAnalysis.runAsync(CircuitFactory.createDivider(), parameters, executor),
                NodalAnalysis.runAsync(CircuitFactory.createUngroundedSupernode(), parameters, executor),
                NodalAnalysis.runAsync(CircuitFactory.createMixed(), parameters, executor));
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        assertVoltageEquals(8, futures.get(0).join(), "n2");
        assertVoltageEquals(10, futures.get(1).join(), "b");
        assertPowerBalanced(futures.get(2).join());
    }

    @Test
    void testRunAsyncFailure() {
        CompletableFuture<CircuitSolution> future = NodalAnalysis.runAsync(CircuitFactory.createParallelSources(5, 7), parameters, executor);
        CompletionException e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(InconsistentSourceException.class, e.getCause());
    }

    @Test
    void testOverflowingResultIsRejected() {
        List<ComponentDescription> components = List.of(voltageSource("V1", 1E300, "GND", "n1"), resistor("R1", 1E-10, "n1", "GND"));
        SingularSystemException e = assertThrows(SingularSystemException.class, () -> NodalAnalysis.run(components, parameters));
        assertEquals(ErrorKind.SINGULAR_SYSTEM_ERROR, e.getKind());
        assertEquals(SingularityHint.NUMERICALLY_SINGULAR, e.getHint());
    }

    @Test
    void testBalancedBridge() {
        CircuitSolution solution = NodalAnalysis.run(CircuitFactory.createBalancedBridge(), parameters);
        assertEquals(solution.getVoltage("a"), solution.getVoltage("b"), DELTA_V);
        assertCurrentEquals(0, solution, "R5");
        assertEquals("Resistor R5: 0 W", solution.getComponent("R5").description());
        assertPowerBalanced(solution);
    }

    @Test
    void testRunAsyncUsesParametersAtCallTime() {
        List<Runnable> tasks = new ArrayList<>();
        CompletableFuture<CircuitSolution> future = NodalAnalysis.runAsync(CircuitFactory.createDivider(), parameters, tasks::add);
        parameters.setMaxComponentCount(1);
        assertEquals(1, tasks.size());
        tasks.get(0).run();
        assertVoltageEquals(8, future.join(), "n2");
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis;

import com.google.common.base.Stopwatch;
import com.powsybl.nodalanalysis.equations.EquationSystemAssembler;
import com.powsybl.nodalanalysis.equations.LinearSystem;
import com.powsybl.nodalanalysis.graph.SupernodeResolution;
import com.powsybl.nodalanalysis.graph.SupernodeResolver;
import com.powsybl.nodalanalysis.network.Circuit;
import com.powsybl.nodalanalysis.network.CircuitBuilder;
import com.powsybl.nodalanalysis.network.ComponentDescription;
import com.powsybl.nodalanalysis.result.CircuitSolution;
import com.powsybl.nodalanalysis.result.ResultMapper;
import com.powsybl.nodalanalysis.result.StepNarrator;
import com.powsybl.nodalanalysis.solver.LinearSolver;
import com.powsybl.nodalanalysis.solver.SolutionVerifier;
import com.powsybl.nodalanalysis.solver.Verification;
import com.powsybl.nodalanalysis.util.ValueFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static com.powsybl.nodalanalysis.util.Markers.PERFORMANCE_MARKER;

/**
 * Entry point of the DC nodal analysis: topology, supernode resolution, assembly, solve, verification and mapping
 * of the result. Every artifact lives only for the duration of one call, so concurrent runs need no locking.
 *
 * @author PowSyBl nodal analysis developers
 */
public final class NodalAnalysis {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodalAnalysis.class);

    private NodalAnalysis() {
    }

    public static CircuitSolution run(List<ComponentDescription> components) {
        return run(components, new NodalAnalysisParameters());
    }

    /**
     * @throws NodalAnalysisException if the circuit is invalid or has no unique solution
     */
    public static CircuitSolution run(List<ComponentDescription> components, NodalAnalysisParameters parameters) {
        Objects.requireNonNull(components);
        Objects.requireNonNull(parameters);
        Stopwatch stopwatch = Stopwatch.createStarted();

        Circuit circuit = CircuitBuilder.build(components, parameters);
        SupernodeResolution resolution = SupernodeResolver.resolve(circuit, parameters);
        StepNarrator narrator = new StepNarrator(resolution, new ValueFormatter(parameters.getSignificantDigits()));
        LinearSystem system = EquationSystemAssembler.assemble(resolution, List.of(narrator));
        double[] x = LinearSolver.solve(system);
        Verification verification = SolutionVerifier.verify(system, x, parameters.getResidualTolerance());
        CircuitSolution solution = ResultMapper.map(system, x, verification, narrator.getSteps(), parameters);

        stopwatch.stop();
        LOGGER.info(PERFORMANCE_MARKER, "Nodal analysis of {} components ({} unknowns) done in {} ms",
                circuit.getComponents().size(), system.getSize(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
        if (!solution.getSummary().powerBalance()) {
            LOGGER.warn("Solution exceeds numerical tolerance: max residual {}, total power {} W",
                    verification.maxError(), solution.getTotalPower());
        }
        return solution;
    }

    /**
     * Runs the analysis on {@code executor}. The future completes exceptionally with the {@link NodalAnalysisException}
     * on failure; cancelling it before it starts skips the whole solve. The component list and the parameters are
     * copied, so changing them after this call does not affect the run.
     */
    public static CompletableFuture<CircuitSolution> runAsync(List<ComponentDescription> components, NodalAnalysisParameters parameters,
                                                              Executor executor) {
        Objects.requireNonNull(components);
        Objects.requireNonNull(parameters);
        Objects.requireNonNull(executor);
        List<ComponentDescription> snapshot = new ArrayList<>(components);
        NodalAnalysisParameters parametersSnapshot = parameters.copy();
        return CompletableFuture.supplyAsync(() -> run(snapshot, parametersSnapshot), executor);
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.result;

import java.util.*;

/**
 * Result of a successful nodal analysis.
 *
 * @author PowSyBl nodal analysis developers
 */
public class CircuitSolution {

    private final Map<String, Double> voltages;

    private final List<ComponentResult> components;

    private final double totalPower;

    private final MatrixSolution matrixSolution;

    private final SolutionSummary summary;

    private final CircuitAnalysis analysis;

    public CircuitSolution(Map<String, Double> voltages, List<ComponentResult> components, double totalPower,
                           MatrixSolution matrixSolution, SolutionSummary summary, CircuitAnalysis analysis) {
        this.voltages = Collections.unmodifiableMap(new LinkedHashMap<>(voltages));
        this.components = List.copyOf(components);
        this.totalPower = totalPower;
        this.matrixSolution = Objects.requireNonNull(matrixSolution);
        this.summary = Objects.requireNonNull(summary);
        this.analysis = Objects.requireNonNull(analysis);
    }

    /**
     * Voltage of each node relative to the reference node, reference node first then nodes in first-seen order.
     */
    public Map<String, Double> getVoltages() {
        return voltages;
    }

    public double getVoltage(String nodeLabel) {
        Double voltage = voltages.get(nodeLabel);
        if (voltage == null) {
            throw new NoSuchElementException("Node '" + nodeLabel + "' not found");
        }
        return voltage;
    }

    public List<ComponentResult> getComponents() {
        return components;
    }

    public ComponentResult getComponent(String id) {
        return components.stream()
                .filter(c -> c.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("Component '" + id + "' not found"));
    }

    public double getTotalPower() {
        return totalPower;
    }

    public MatrixSolution getMatrixSolution() {
        return matrixSolution;
    }

    public SolutionSummary getSummary() {
        return summary;
    }

    public CircuitAnalysis getAnalysis() {
        return analysis;
    }
}

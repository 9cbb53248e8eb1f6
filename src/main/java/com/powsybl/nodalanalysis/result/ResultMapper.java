/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.result;

import com.powsybl.nodalanalysis.NodalAnalysisParameters;
import com.powsybl.nodalanalysis.SingularSystemException;
import com.powsybl.nodalanalysis.equations.LinearSystem;
import com.powsybl.nodalanalysis.graph.Supernode;
import com.powsybl.nodalanalysis.graph.SupernodeResolution;
import com.powsybl.nodalanalysis.network.*;
import com.powsybl.nodalanalysis.solver.LinearSolver;
import com.powsybl.nodalanalysis.solver.Verification;
import com.powsybl.nodalanalysis.util.ValueFormatter;
import net.jafama.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.IntStream;

/**
 * Maps solved node voltages back onto components.
 * <p>
 * Resistor and current source currents follow directly from node voltages and source values. Ideal voltage source
 * currents are not unknowns of the system: they are recovered group by group by balancing currents at each member,
 * from the leaves of the source spanning tree up to its root.
 * <p>
 * Finite inputs can still overflow once multiplied out, so a result holding a non finite value is rejected as
 * numerically singular.
 *
 * @author PowSyBl nodal analysis developers
 */
public final class ResultMapper {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultMapper.class);

    private ResultMapper() {
    }

    public static CircuitSolution map(LinearSystem system, double[] solution, Verification verification, List<DerivationStep> steps,
                                      NodalAnalysisParameters parameters) {
        Objects.requireNonNull(system);
        Objects.requireNonNull(solution);
        Objects.requireNonNull(verification);
        Objects.requireNonNull(parameters);
        SupernodeResolution resolution = system.getResolution();
        Circuit circuit = resolution.getCircuit();
        ValueFormatter formatter = new ValueFormatter(parameters.getSignificantDigits());

        double[] nodeVoltages = resolution.getNodeVoltages(solution);
        Map<String, Double> voltages = new LinkedHashMap<>();
        for (CircuitNode node : circuit.getNodes()) {
            voltages.put(node.getLabel(), nodeVoltages[node.getNum()]);
        }

        List<ComponentResult> components = mapComponents(resolution, nodeVoltages, formatter);
        double totalPower = 0;
        double absolutePower = 0;
        for (ComponentResult component : components) {
            totalPower += component.power();
            absolutePower += FastMath.abs(component.power());
        }
        checkFinite(circuit, nodeVoltages, components, totalPower);
        boolean powerBalanced = FastMath.abs(totalPower) < parameters.getPowerBalanceTolerance() * FastMath.max(1.0, absolutePower);
        if (!powerBalanced) {
            LOGGER.warn("Power is not balanced: components sum to {} W", totalPower);
        }

        List<String> unknowns = IntStream.range(0, resolution.getUnknownCount())
                .mapToObj(column -> "V(" + resolution.getNodeAtColumn(column).getLabel() + ")")
                .toList();
        MatrixSolution matrixSolution = new MatrixSolution(system.getMatrix(), system.getRhs(), solution.clone(), unknowns,
                LinearSolver.SOLUTION_METHOD, steps, verification);
        SolutionSummary summary = new SolutionSummary(components.size(), circuit.getNodeCount(),
                powerBalanced && verification.isVerified());
        return new CircuitSolution(voltages, components, totalPower, matrixSolution, summary, analyze(system));
    }

    private static void checkFinite(Circuit circuit, double[] nodeVoltages, List<ComponentResult> components, double totalPower) {
        for (CircuitNode node : circuit.getNodes()) {
            double voltage = nodeVoltages[node.getNum()];
            if (!Double.isFinite(voltage)) {
                throw new SingularSystemException("Voltage of node " + node.getLabel() + " is " + voltage);
            }
        }
        for (ComponentResult component : components) {
            if (!Double.isFinite(component.current()) || !Double.isFinite(component.power())) {
                throw new SingularSystemException("Component " + component.id() + " overflows: current " + component.current()
                        + " A, power " + component.power() + " W");
            }
        }
        if (!Double.isFinite(totalPower)) {
            throw new SingularSystemException("Total power overflows: " + totalPower + " W");
        }
    }

    /**
     * Node voltages indexed by node number, from a label to voltage mapping such as {@link CircuitSolution#getVoltages()}.
     */
    public static double[] toNodeVoltages(Circuit circuit, Map<String, Double> voltages) {
        double[] nodeVoltages = new double[circuit.getNodeCount()];
        for (CircuitNode node : circuit.getNodes()) {
            Double voltage = voltages.get(node.getLabel());
            if (voltage == null) {
                throw new IllegalArgumentException("No voltage for node '" + node.getLabel() + "'");
            }
            nodeVoltages[node.getNum()] = voltage;
        }
        return nodeVoltages;
    }

    public static List<ComponentResult> mapComponents(SupernodeResolution resolution, double[] nodeVoltages, ValueFormatter formatter) {
        Circuit circuit = resolution.getCircuit();
        List<CircuitComponent> components = circuit.getComponents();
        double[] currents = new double[components.size()];
        boolean[] determined = new boolean[components.size()];
        Arrays.fill(determined, true);

        for (CircuitComponent component : components) {
            if (component instanceof Resistor resistor) {
                currents[resistor.getNum()] = getVoltage(resistor, nodeVoltages) / resistor.getResistance();
            } else if (component instanceof CurrentSource source) {
                currents[source.getNum()] = source.getCurrent();
            }
        }
        for (Supernode supernode : resolution.getSupernodes()) {
            computeSourceCurrents(supernode, currents, determined);
        }

        List<ComponentResult> results = new ArrayList<>(components.size());
        for (CircuitComponent component : components) {
            double voltage = getVoltage(component, nodeVoltages);
            double current = currents[component.getNum()];
            double power = voltage * current;
            results.add(new ComponentResult(component.getId(), component.getType(), component.getValue(),
                    component.getNodeA().getLabel(), component.getNodeB().getLabel(), voltage, current, power,
                    determined[component.getNum()], describe(component, power, determined[component.getNum()], formatter)));
        }
        return results;
    }

    private static double getVoltage(CircuitComponent component, double[] nodeVoltages) {
        return nodeVoltages[component.getNodeA().getNum()] - nodeVoltages[component.getNodeB().getNum()];
    }

    private static void computeSourceCurrents(Supernode supernode, double[] currents, boolean[] determined) {
        for (VoltageSource source : supernode.getRedundantSources()) {
            currents[source.getNum()] = 0;
            determined[source.getNum()] = false;
        }
        // children come after their parent in tree order, so walking it backwards settles each subtree first
        List<CircuitNode> treeOrder = supernode.getTreeOrder();
        for (int i = treeOrder.size() - 1; i > 0; i--) {
            CircuitNode node = treeOrder.get(i);
            VoltageSource parentSource = supernode.getParentSource(node).orElseThrow();
            double leaving = 0;
            for (CircuitComponent component : node.getComponents()) {
                if (component != parentSource) {
                    leaving += component.getCurrentLeaving(node, currents[component.getNum()]);
                }
            }
            currents[parentSource.getNum()] = parentSource.getCurrentLeaving(node, -leaving);
        }
    }

    private static String describe(CircuitComponent component, double power, boolean currentDetermined, ValueFormatter formatter) {
        String prefix = component.getType().getDisplayName() + " " + component.getId() + ": ";
        if (!currentDetermined) {
            return prefix + "0 W (current undetermined, in parallel with other ideal voltage sources)";
        }
        if (formatter.isNegligible(power) || formatter.round(power) == 0) {
            return prefix + "0 W";
        }
        return prefix + (power > 0 ? "absorbing " : "supplying ") + formatter.format(FastMath.abs(power)) + " W";
    }

    private static CircuitAnalysis analyze(LinearSystem system) {
        SupernodeResolution resolution = system.getResolution();
        Circuit circuit = resolution.getCircuit();
        int kclCount = (int) system.getEquations().stream().filter(e -> e.getType().isKcl()).count();
        int constraintCount = system.getEquations().size() - kclCount;
        Map<String, String> conventions = new LinkedHashMap<>();
        for (ComponentType type : ComponentType.values()) {
            conventions.put(type.getDisplayName(), type.getConvention());
        }
        return new CircuitAnalysis(circuit.getReferenceNode().getLabel(),
                labels(circuit.getNodes().subList(1, circuit.getNodeCount())),
                labels(resolution.getRegularNodes()),
                resolution.getSupernodes().stream().map(Supernode::getMemberLabels).toList(),
                resolution.getGroundedSupernode().stream().map(Supernode::getMemberLabels).toList(),
                resolution.getUngroundedSupernodes().stream().map(Supernode::getMemberLabels).toList(),
                kclCount, constraintCount, conventions);
    }

    private static List<String> labels(List<CircuitNode> nodes) {
        return nodes.stream().map(CircuitNode::getLabel).toList();
    }
}

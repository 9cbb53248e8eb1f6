/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.network;

import com.powsybl.nodalanalysis.CircuitValidationException;
import com.powsybl.nodalanalysis.ErrorKind;
import com.powsybl.nodalanalysis.NodalAnalysisParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.powsybl.nodalanalysis.network.ComponentDescription.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl nodal analysis developers
 */
class CircuitBuilderTest {

    private NodalAnalysisParameters parameters;

    @BeforeEach
    void setUp() {
        parameters = new NodalAnalysisParameters();
    }

    @Test
    void testNodeNumbering() {
        Circuit circuit = CircuitBuilder.build(CircuitFactory.createDivider(), parameters);
        assertEquals(3, circuit.getNodeCount());
        assertEquals("GND", circuit.getReferenceNode().getLabel());
        assertTrue(circuit.getReferenceNode().isReference());
        assertEquals(List.of("GND", "n1", "n2"), circuit.getNodes().stream().map(CircuitNode::getLabel).toList());
        CircuitNode n1 = circuit.getNode("n1").orElseThrow();
        assertEquals(1, n1.getNum());
        assertEquals(List.of("V1", "R1"), n1.getComponents().stream().map(CircuitComponent::getId).toList());
        assertEquals(2, circuit.getComponents(Resistor.class).size());
        assertEquals(1, circuit.getComponents(VoltageSource.class).size());
        assertTrue(circuit.getComponents(CurrentSource.class).isEmpty());
    }

    @Test
    void testReferenceAliases() {
        Circuit circuit = CircuitBuilder.build(List.of(
                voltageSource(5, "0", "x"),
                resistor(10, "x", "gnd"),
                resistor(20, "x", " GND ")), parameters);
        assertEquals(2, circuit.getNodeCount());
        assertEquals(3, circuit.getReferenceNode().getComponents().size());
        assertEquals("x", circuit.getNode(1).getLabel());
    }

    @Test
    void testCustomReferenceAlias() {
        parameters.setReferenceNodeAliases(List.of("ground"));
        Circuit circuit = CircuitBuilder.build(List.of(resistor(10, "x", "Ground"), currentSource(1, "ground", "x")), parameters);
        assertEquals("ground", circuit.getReferenceNode().getLabel());
        List<ComponentDescription> withGnd = List.of(resistor(10, "x", "GND"));
        CircuitValidationException e = assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(withGnd, parameters));
        assertTrue(e.getMessage().contains("reference node"));
    }

    @Test
    void testGeneratedIds() {
        Circuit circuit = CircuitBuilder.build(List.of(
                voltageSource(5, "GND", "a"),
                resistor(10, "a", "b"),
                resistor("R1", 10, "b", "GND"),
                resistor(10, "a", "GND"),
                currentSource(0.1, "GND", "b")), parameters);
        assertEquals(List.of("V1", "R2", "R1", "R3", "I1"), circuit.getComponents().stream().map(CircuitComponent::getId).toList());
        assertEquals(3, circuit.getComponent("R3").getNum());
    }

    @Test
    void testEmptyCircuit() {
        List<ComponentDescription> empty = List.of();
        CircuitValidationException e = assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(empty, parameters));
        assertEquals(ErrorKind.VALIDATION_ERROR, e.getKind());
        assertEquals("Circuit has no component", e.getMessage());
    }

    @Test
    void testSameNodeOnBothTerminals() {
        List<ComponentDescription> loop = List.of(resistor(10, "a", "GND"), resistor(10, "a", "a"));
        CircuitValidationException e = assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(loop, parameters));
        assertEquals("Component #2 has both terminals on node 'a'", e.getMessage());

        List<ComponentDescription> aliases = List.of(voltageSource(5, "GND", "0"));
        assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(aliases, parameters));
    }

    @Test
    void testInvalidValues() {
        List<ComponentDescription> negative = List.of(resistor(-10, "a", "GND"));
        assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(negative, parameters));
        List<ComponentDescription> zero = List.of(resistor(0, "a", "GND"));
        assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(zero, parameters));
        List<ComponentDescription> nan = List.of(resistor(10, "a", "GND"), voltageSource(Double.NaN, "GND", "a"));
        assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(nan, parameters));
        List<ComponentDescription> infinite = List.of(resistor(10, "a", "GND"), currentSource(Double.POSITIVE_INFINITY, "GND", "a"));
        assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(infinite, parameters));
        List<ComponentDescription> noType = List.of(new ComponentDescription(null, null, 10, "a", "GND"));
        assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(noType, parameters));
        List<ComponentDescription> blankNode = List.of(resistor(10, " ", "GND"));
        assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(blankNode, parameters));
        List<ComponentDescription> withNull = Arrays.asList(resistor(10, "a", "GND"), null);
        assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(withNull, parameters));
    }

    @Test
    void testNegativeSourcesAreValid() {
        Circuit circuit = CircuitBuilder.build(List.of(voltageSource(-5, "GND", "a"), resistor(10, "a", "GND")), parameters);
        assertEquals(-5, ((VoltageSource) circuit.getComponent("V1")).getVoltage(), 0);
    }

    @Test
    void testDuplicateId() {
        List<ComponentDescription> duplicate = List.of(resistor("X", 10, "a", "GND"), resistor("X", 10, "a", "b"));
        CircuitValidationException e = assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(duplicate, parameters));
        assertEquals("Duplicate component id 'X'", e.getMessage());
    }

    @Test
    void testDisconnectedNode() {
        List<ComponentDescription> disconnected = List.of(
                voltageSource(5, "GND", "n1"),
                resistor(10, "n1", "GND"),
                resistor(10, "n2", "n3"));
        CircuitValidationException e = assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(disconnected, parameters));
        assertEquals("Node(s) n2, n3 cannot be reached from the reference node", e.getMessage());
    }

    @Test
    void testNoReferenceNode() {
        List<ComponentDescription> noReference = List.of(resistor(10, "a", "b"));
        assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(noReference, parameters));
    }

    @Test
    void testTooManyComponents() {
        parameters.setMaxComponentCount(3);
        List<ComponentDescription> components = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            components.add(resistor(10, "n" + i, "GND"));
        }
        CircuitValidationException e = assertThrows(CircuitValidationException.class, () -> CircuitBuilder.build(components, parameters));
        assertEquals("Circuit has 4 components, maximum allowed is 3", e.getMessage());
    }
}

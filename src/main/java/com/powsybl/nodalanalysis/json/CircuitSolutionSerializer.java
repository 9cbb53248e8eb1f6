/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.powsybl.nodalanalysis.result.*;
import com.powsybl.nodalanalysis.solver.Verification;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * @author PowSyBl nodal analysis developers
 */
public class CircuitSolutionSerializer extends StdSerializer<CircuitSolution> {

    CircuitSolutionSerializer() {
        super(CircuitSolution.class);
    }

    @Override
    public void serialize(CircuitSolution solution, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeStartObject();
        jsonGenerator.writeStringField("status", "success");

        jsonGenerator.writeObjectFieldStart("voltages");
        for (Map.Entry<String, Double> e : solution.getVoltages().entrySet()) {
            jsonGenerator.writeNumberField(e.getKey(), e.getValue());
        }
        jsonGenerator.writeEndObject();

        jsonGenerator.writeArrayFieldStart("components");
        for (ComponentResult component : solution.getComponents()) {
            serializerProvider.defaultSerializeValue(component, jsonGenerator);
        }
        jsonGenerator.writeEndArray();

        jsonGenerator.writeNumberField("total_power", solution.getTotalPower());
        writeMatrixSolution(solution.getMatrixSolution(), jsonGenerator, serializerProvider);
        writeSummary(solution.getSummary(), jsonGenerator);
        writeAnalysis(solution.getAnalysis(), jsonGenerator);
        jsonGenerator.writeEndObject();
    }

    private static void writeMatrixSolution(MatrixSolution matrixSolution, JsonGenerator jsonGenerator,
                                            SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeObjectFieldStart("matrix_solution");
        jsonGenerator.writeStringField("matrix_equation", matrixSolution.getMatrixEquation());
        jsonGenerator.writeArrayFieldStart("conductance_matrix");
        for (double[] row : matrixSolution.getConductanceMatrix()) {
            jsonGenerator.writeArray(row, 0, row.length);
        }
        jsonGenerator.writeEndArray();
        writeArrayField("current_vector", matrixSolution.getCurrentVector(), jsonGenerator);
        writeArrayField("voltage_solution", matrixSolution.getVoltageSolution(), jsonGenerator);
        writeStringsField("unknowns", matrixSolution.getUnknowns(), jsonGenerator);
        jsonGenerator.writeStringField("solution_method", matrixSolution.getSolutionMethod());
        jsonGenerator.writeArrayFieldStart("steps");
        for (DerivationStep step : matrixSolution.getSteps()) {
            serializerProvider.defaultSerializeValue(step, jsonGenerator);
        }
        jsonGenerator.writeEndArray();

        Verification verification = matrixSolution.getVerification();
        jsonGenerator.writeObjectFieldStart("verification");
        writeArrayField("residual", verification.residual(), jsonGenerator);
        jsonGenerator.writeNumberField("max_error", verification.maxError());
        jsonGenerator.writeStringField("status", verification.status().getLabel());
        jsonGenerator.writeEndObject();

        jsonGenerator.writeEndObject();
    }

    private static void writeSummary(SolutionSummary summary, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeObjectFieldStart("summary");
        jsonGenerator.writeNumberField("total_components", summary.totalComponents());
        jsonGenerator.writeNumberField("solved_nodes", summary.solvedNodes());
        jsonGenerator.writeBooleanField("power_balance", summary.powerBalance());
        jsonGenerator.writeEndObject();
    }

    private static void writeAnalysis(CircuitAnalysis analysis, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeObjectFieldStart("analysis");
        jsonGenerator.writeStringField("reference_node", analysis.referenceNode());
        writeStringsField("non_reference_nodes", analysis.nonReferenceNodes(), jsonGenerator);
        writeStringsField("regular_nodes", analysis.regularNodes(), jsonGenerator);
        writeGroupsField("supernodes", analysis.supernodes(), jsonGenerator);
        writeGroupsField("grounded_supernodes", analysis.groundedSupernodes(), jsonGenerator);
        writeGroupsField("ungrounded_supernodes", analysis.ungroundedSupernodes(), jsonGenerator);
        jsonGenerator.writeNumberField("kcl_equations", analysis.kclEquationCount());
        jsonGenerator.writeNumberField("constraint_equations", analysis.constraintEquationCount());
        jsonGenerator.writeNumberField("total_equations", analysis.getTotalEquationCount());
        jsonGenerator.writeObjectFieldStart("conventions");
        for (Map.Entry<String, String> e : analysis.conventions().entrySet()) {
            jsonGenerator.writeStringField(e.getKey(), e.getValue());
        }
        jsonGenerator.writeEndObject();
        jsonGenerator.writeEndObject();
    }

    private static void writeArrayField(String name, double[] values, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeFieldName(name);
        jsonGenerator.writeArray(values, 0, values.length);
    }

    private static void writeStringsField(String name, List<String> values, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeArrayFieldStart(name);
        for (String value : values) {
            jsonGenerator.writeString(value);
        }
        jsonGenerator.writeEndArray();
    }

    private static void writeGroupsField(String name, List<List<String>> groups, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeArrayFieldStart(name);
        for (List<String> group : groups) {
            jsonGenerator.writeStartArray();
            for (String label : group) {
                jsonGenerator.writeString(label);
            }
            jsonGenerator.writeEndArray();
        }
        jsonGenerator.writeEndArray();
    }
}

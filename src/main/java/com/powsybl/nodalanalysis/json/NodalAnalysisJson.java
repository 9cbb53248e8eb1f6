/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.powsybl.commons.json.JsonUtil;
import com.powsybl.nodalanalysis.CircuitValidationException;
import com.powsybl.nodalanalysis.NodalAnalysis;
import com.powsybl.nodalanalysis.NodalAnalysisException;
import com.powsybl.nodalanalysis.NodalAnalysisParameters;
import com.powsybl.nodalanalysis.network.ComponentDescription;
import com.powsybl.nodalanalysis.result.CircuitSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * JSON face of the nodal analysis: reads a component list, writes a solution or a structured error.
 *
 * @author PowSyBl nodal analysis developers
 */
public final class NodalAnalysisJson {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodalAnalysisJson.class);

    private static final ObjectMapper OBJECT_MAPPER = JsonUtil.createObjectMapper()
            .registerModule(new NodalAnalysisJsonModule());

    private NodalAnalysisJson() {
    }

    /**
     * Accepts either an array of components or an object holding it under {@code components}.
     *
     * @throws CircuitValidationException if the text is not valid JSON or not a component list
     */
    public static List<ComponentDescription> read(String json) {
        Objects.requireNonNull(json);
        try {
            return read(OBJECT_MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new CircuitValidationException("Invalid circuit JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<ComponentDescription> read(Path jsonFile) {
        Objects.requireNonNull(jsonFile);
        try (Reader reader = Files.newBufferedReader(jsonFile, StandardCharsets.UTF_8)) {
            return read(OBJECT_MAPPER.readTree(reader));
        } catch (JsonProcessingException e) {
            throw new CircuitValidationException("Invalid circuit JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static List<ComponentDescription> read(JsonNode root) throws IOException {
        JsonNode components = root != null && root.isObject() ? root.get("components") : root;
        if (components == null || !components.isArray()) {
            throw new CircuitValidationException("Circuit JSON must be an array of components or an object with a 'components' array");
        }
        return OBJECT_MAPPER.readerForListOf(ComponentDescription.class).readValue(components);
    }

    public static String write(CircuitSolution solution) {
        return toJson(solution);
    }

    public static String write(NodalAnalysisException e) {
        return toJson(e);
    }

    public static void write(CircuitSolution solution, Path jsonFile) {
        Objects.requireNonNull(solution);
        Objects.requireNonNull(jsonFile);
        try (Writer writer = Files.newBufferedWriter(jsonFile, StandardCharsets.UTF_8)) {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(writer, solution);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String toJson(Object value) {
        Objects.requireNonNull(value);
        try {
            return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String solve(String json) {
        return solve(json, new NodalAnalysisParameters());
    }

    /**
     * Never throws for a bad circuit: any {@link NodalAnalysisException} becomes an error payload.
     */
    public static String solve(String json, NodalAnalysisParameters parameters) {
        try {
            return write(NodalAnalysis.run(read(json), parameters));
        } catch (NodalAnalysisException e) {
            LOGGER.debug("Nodal analysis failed: {}", e.getMessage());
            return write(e);
        }
    }
}

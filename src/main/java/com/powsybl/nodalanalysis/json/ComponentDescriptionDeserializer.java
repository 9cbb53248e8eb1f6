/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.powsybl.nodalanalysis.network.ComponentDescription;
import com.powsybl.nodalanalysis.network.ComponentType;

import java.io.IOException;

/**
 * Reads {@code {"type": "Resistor", "value": 1000, "nodeA": "n1", "nodeB": "GND", "id": "R1"}}. {@code node1} and
 * {@code node2} are accepted for {@code nodeA} and {@code nodeB}, the id is optional. Missing types and labels are
 * left null and reported by circuit validation.
 *
 * @author PowSyBl nodal analysis developers
 */
public class ComponentDescriptionDeserializer extends StdDeserializer<ComponentDescription> {

    ComponentDescriptionDeserializer() {
        super(ComponentDescription.class);
    }

    @Override
    public ComponentDescription deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        JsonNode node = jsonParser.getCodec().readTree(jsonParser);
        if (node == null || !node.isObject()) {
            return deserializationContext.reportInputMismatch(this, "A component must be a JSON object");
        }
        ComponentType type = null;
        JsonNode typeNode = node.get("type");
        if (typeNode != null && !typeNode.isNull()) {
            String typeName = typeNode.asText();
            type = ComponentType.fromName(typeName)
                    .orElse(null);
            if (type == null) {
                return deserializationContext.reportInputMismatch(this, "Unknown component type '%s'", typeName);
            }
        }
        return new ComponentDescription(text(node, "id"), type, parseValue(node, deserializationContext),
                text(node, "nodeA", "node1"), text(node, "nodeB", "node2"));
    }

    private double parseValue(JsonNode node, DeserializationContext deserializationContext) throws IOException {
        JsonNode valueNode = node.get("value");
        if (valueNode == null || valueNode.isNull()) {
            return deserializationContext.reportInputMismatch(this, "Component has no value");
        }
        if (valueNode.isNumber()) {
            return valueNode.doubleValue();
        }
        if (valueNode.isTextual()) {
            try {
                return Double.parseDouble(valueNode.textValue().trim());
            } catch (NumberFormatException e) {
                return deserializationContext.reportInputMismatch(this, "Component value '%s' is not a number", valueNode.textValue());
            }
        }
        return deserializationContext.reportInputMismatch(this, "Component value must be a number");
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode child = node.get(name);
            if (child != null && !child.isNull()) {
                return child.asText();
            }
        }
        return null;
    }
}

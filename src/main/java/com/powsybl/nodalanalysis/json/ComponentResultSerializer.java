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
import com.powsybl.nodalanalysis.result.ComponentResult;

import java.io.IOException;

/**
 * @author PowSyBl nodal analysis developers
 */
public class ComponentResultSerializer extends StdSerializer<ComponentResult> {

    ComponentResultSerializer() {
        super(ComponentResult.class);
    }

    @Override
    public void serialize(ComponentResult result, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeStartObject();
        jsonGenerator.writeStringField("id", result.id());
        jsonGenerator.writeStringField("type", result.type().getDisplayName());
        jsonGenerator.writeNumberField("value", result.value());
        jsonGenerator.writeStringField("node1", result.nodeA());
        jsonGenerator.writeStringField("node2", result.nodeB());
        jsonGenerator.writeNumberField("voltage", result.voltage());
        jsonGenerator.writeNumberField("current", result.current());
        jsonGenerator.writeNumberField("power", result.power());
        jsonGenerator.writeBooleanField("current_determined", result.currentDetermined());
        jsonGenerator.writeStringField("description", result.description());
        jsonGenerator.writeEndObject();
    }
}

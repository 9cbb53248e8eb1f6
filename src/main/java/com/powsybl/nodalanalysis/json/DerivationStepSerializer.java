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
import com.powsybl.nodalanalysis.result.DerivationStep;

import java.io.IOException;

/**
 * @author PowSyBl nodal analysis developers
 */
public class DerivationStepSerializer extends StdSerializer<DerivationStep> {

    DerivationStepSerializer() {
        super(DerivationStep.class);
    }

    @Override
    public void serialize(DerivationStep step, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeStartObject();
        jsonGenerator.writeStringField("type", step.type().getSymbol());
        jsonGenerator.writeNumberField("row", step.row());
        jsonGenerator.writeStringField("title", step.title());
        jsonGenerator.writeStringField("equation_text", step.equationText());
        jsonGenerator.writeStringField("explanation", step.explanation());
        jsonGenerator.writeEndObject();
    }
}

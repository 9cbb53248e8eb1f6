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
import com.powsybl.nodalanalysis.NodalAnalysisException;
import com.powsybl.nodalanalysis.SingularSystemException;
import com.powsybl.nodalanalysis.UnderconstrainedCircuitException;

import java.io.IOException;

/**
 * Error payload: {@code {"status": "error", "kind": ..., "message": ..., "hint": ..., "suggestion": ...}}, the hint
 * being present for singular systems only.
 *
 * @author PowSyBl nodal analysis developers
 */
public class NodalAnalysisExceptionSerializer extends StdSerializer<NodalAnalysisException> {

    NodalAnalysisExceptionSerializer() {
        super(NodalAnalysisException.class);
    }

    @Override
    public void serialize(NodalAnalysisException e, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeStartObject();
        jsonGenerator.writeStringField("status", "error");
        jsonGenerator.writeStringField("kind", e.getKind().getWireName());
        jsonGenerator.writeStringField("message", e.getMessage());
        if (e instanceof SingularSystemException singular) {
            jsonGenerator.writeStringField("hint", singular.getHint().getLabel());
        }
        if (e instanceof UnderconstrainedCircuitException underconstrained) {
            jsonGenerator.writeArrayFieldStart("floating_nodes");
            for (String label : underconstrained.getFloatingNodes()) {
                jsonGenerator.writeString(label);
            }
            jsonGenerator.writeEndArray();
        }
        jsonGenerator.writeStringField("suggestion", e.getSuggestion());
        jsonGenerator.writeEndObject();
    }
}

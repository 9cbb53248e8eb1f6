/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import com.powsybl.nodalanalysis.NodalAnalysisException;
import com.powsybl.nodalanalysis.network.ComponentDescription;
import com.powsybl.nodalanalysis.result.CircuitSolution;
import com.powsybl.nodalanalysis.result.ComponentResult;
import com.powsybl.nodalanalysis.result.DerivationStep;

/**
 * @author PowSyBl nodal analysis developers
 */
public class NodalAnalysisJsonModule extends SimpleModule {

    public NodalAnalysisJsonModule() {
        addSerializer(CircuitSolution.class, new CircuitSolutionSerializer());
        addSerializer(ComponentResult.class, new ComponentResultSerializer());
        addSerializer(DerivationStep.class, new DerivationStepSerializer());
        addSerializer(NodalAnalysisException.class, new NodalAnalysisExceptionSerializer());
        addDeserializer(ComponentDescription.class, new ComponentDescriptionDeserializer());
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.result;

import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural facts found before solving: how nodes were grouped and how many rows of each kind were written.
 *
 * @author PowSyBl nodal analysis developers
 */
public record CircuitAnalysis(String referenceNode, List<String> nonReferenceNodes, List<String> regularNodes,
                              List<List<String>> supernodes, List<List<String>> groundedSupernodes,
                              List<List<String>> ungroundedSupernodes, int kclEquationCount, int constraintEquationCount,
                              Map<String, String> conventions) {

    public CircuitAnalysis {
        Objects.requireNonNull(referenceNode);
        nonReferenceNodes = List.copyOf(nonReferenceNodes);
        regularNodes = List.copyOf(regularNodes);
        supernodes = List.copyOf(supernodes);
        groundedSupernodes = List.copyOf(groundedSupernodes);
        ungroundedSupernodes = List.copyOf(ungroundedSupernodes);
        conventions = ImmutableMap.copyOf(conventions);
    }

    public int getTotalEquationCount() {
        return kclEquationCount + constraintEquationCount;
    }
}

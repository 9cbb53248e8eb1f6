/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.result;

/**
 * @param solvedNodes count of nodes with a reported voltage, reference node included
 * @param powerBalance true when component powers sum to zero within tolerance and the residual check passed
 *
 * @author PowSyBl nodal analysis developers
 */
public record SolutionSummary(int totalComponents, int solvedNodes, boolean powerBalance) {
}

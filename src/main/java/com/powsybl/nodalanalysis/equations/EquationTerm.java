/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.equations;

import com.powsybl.nodalanalysis.graph.SupernodeResolution;
import com.powsybl.nodalanalysis.network.CircuitComponent;
import com.powsybl.nodalanalysis.network.CircuitNode;
import com.powsybl.nodalanalysis.util.ValueFormatter;

/**
 * Contribution of one component to the KCL row of one of its nodes: the current leaving that node through the
 * component, written as a linear function of node voltages.
 *
 * @author PowSyBl nodal analysis developers
 */
public interface EquationTerm {

    CircuitComponent getComponent();

    /**
     * Node whose current balance this term belongs to.
     */
    CircuitNode getNode();

    /**
     * Adds this term to the coefficients and right-hand side of {@code equation}. Known node voltages are moved to
     * the right-hand side.
     */
    void stamp(Equation equation, SupernodeResolution resolution);

    /**
     * Symbolic current leaving {@link #getNode()}, for instance {@code (V(n1) - V(n2)) / 1000}.
     */
    String getCurrentExpression(ValueFormatter formatter);
}

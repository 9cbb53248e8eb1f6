/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis;

import java.util.List;

/**
 * Some node potentials are not fixed by the circuit: they are reachable from the reference node only through current
 * sources, so any offset added to them still satisfies every equation.
 *
 * @author PowSyBl nodal analysis developers
 */
public class UnderconstrainedCircuitException extends SingularSystemException {

    private final List<String> floatingNodes;

    public UnderconstrainedCircuitException(SingularityHint hint, List<String> floatingNodes) {
        super(ErrorKind.UNDERCONSTRAINED_CIRCUIT_ERROR, hint, "Circuit is underconstrained (" + hint.getLabel()
                + "): node(s) " + String.join(", ", floatingNodes)
                + " have no resistor or voltage source path to the reference node", null);
        this.floatingNodes = List.copyOf(floatingNodes);
    }

    public List<String> getFloatingNodes() {
        return floatingNodes;
    }
}

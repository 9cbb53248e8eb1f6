/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.equations;

import com.powsybl.nodalanalysis.network.CircuitNode;

/**
 * A block of unknown node voltages, owning contiguous columns of the linear system. Either a single node
 * ({@link NodeVariable}) or all the members of a supernode not tied to the reference node ({@link SupernodeVariable}).
 *
 * @author PowSyBl nodal analysis developers
 */
public interface UnknownVariable {

    /**
     * First column owned by this variable.
     */
    int getColumn();

    int getColumnCount();

    /**
     * The node whose KCL row is emitted at {@link #getColumn()}.
     */
    CircuitNode getNode();

    String getLabel();
}

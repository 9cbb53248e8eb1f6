/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.equations;

import com.powsybl.nodalanalysis.graph.Supernode;
import com.powsybl.nodalanalysis.network.CircuitNode;

import java.util.Objects;

/**
 * Members of an ungrounded supernode. The representative owns the first column, the other members follow in node
 * index order.
 *
 * @author PowSyBl nodal analysis developers
 */
public record SupernodeVariable(Supernode supernode, int column) implements UnknownVariable {

    public SupernodeVariable {
        Objects.requireNonNull(supernode);
        if (supernode.isGrounded()) {
            throw new IllegalArgumentException("A supernode containing the reference node has no unknown");
        }
    }

    @Override
    public int getColumn() {
        return column;
    }

    @Override
    public int getColumnCount() {
        return supernode.size();
    }

    @Override
    public CircuitNode getNode() {
        return supernode.getRepresentative();
    }

    public int getColumn(CircuitNode member) {
        int index = supernode.getMembers().indexOf(member);
        if (index < 0) {
            throw new IllegalArgumentException("Node " + member.getLabel() + " is not a member of " + supernode);
        }
        return column + index;
    }

    @Override
    public String getLabel() {
        return "{" + String.join(", ", supernode.getMemberLabels()) + "}";
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.graph;

import com.powsybl.nodalanalysis.network.CircuitNode;
import com.powsybl.nodalanalysis.network.VoltageSource;

import java.util.*;

/**
 * Group of nodes tied together by ideal voltage sources. The representative is the member with the lowest index, so
 * a group containing the reference node is represented by it and all its potentials are known.
 * <p>
 * The sources that merged two distinct groups form a spanning tree of the supernode, rooted at the representative.
 * Consistent loop-closing sources are kept apart as redundant.
 *
 * @author PowSyBl nodal analysis developers
 */
public class Supernode {

    /**
     * Crossing {@code source} from node {@code from} to node {@code to}.
     */
    public record SourceStep(VoltageSource source, CircuitNode from, CircuitNode to) {

        /**
         * V(to) - V(from)
         */
        public double getRise() {
            return to == source.getNodeB() ? source.getVoltage() : -source.getVoltage();
        }
    }

    private final int num;

    private final List<CircuitNode> members;

    private final Map<CircuitNode, Double> offsets;

    private final List<VoltageSource> treeSources;

    private final List<VoltageSource> redundantSources;

    private final Map<CircuitNode, VoltageSource> parentSources = new HashMap<>();

    private final List<CircuitNode> treeOrder = new ArrayList<>();

    Supernode(int num, List<CircuitNode> members, Map<CircuitNode, Double> offsets, List<VoltageSource> treeSources,
              List<VoltageSource> redundantSources) {
        this.num = num;
        this.members = List.copyOf(members);
        this.offsets = Map.copyOf(offsets);
        this.treeSources = List.copyOf(treeSources);
        this.redundantSources = List.copyOf(redundantSources);
        buildTree();
    }

    private void buildTree() {
        Map<CircuitNode, List<VoltageSource>> adjacency = new HashMap<>();
        for (VoltageSource source : treeSources) {
            adjacency.computeIfAbsent(source.getNodeA(), k -> new ArrayList<>()).add(source);
            adjacency.computeIfAbsent(source.getNodeB(), k -> new ArrayList<>()).add(source);
        }
        Deque<CircuitNode> queue = new ArrayDeque<>();
        Set<CircuitNode> visited = new HashSet<>();
        queue.add(getRepresentative());
        visited.add(getRepresentative());
        while (!queue.isEmpty()) {
            CircuitNode node = queue.poll();
            treeOrder.add(node);
            for (VoltageSource source : adjacency.getOrDefault(node, Collections.emptyList())) {
                CircuitNode other = source.getOtherNode(node);
                if (visited.add(other)) {
                    parentSources.put(other, source);
                    queue.add(other);
                }
            }
        }
        if (treeOrder.size() != members.size()) {
            throw new IllegalStateException("Voltage sources of supernode " + num + " do not span all its members");
        }
    }

    public int getNum() {
        return num;
    }

    /**
     * Members sorted by node index, representative first.
     */
    public List<CircuitNode> getMembers() {
        return members;
    }

    public int size() {
        return members.size();
    }

    public CircuitNode getRepresentative() {
        return members.get(0);
    }

    public boolean isGrounded() {
        return getRepresentative().isReference();
    }

    public boolean contains(CircuitNode node) {
        return offsets.containsKey(node);
    }

    /**
     * V(member) - V(representative), fixed by the voltage sources of the group.
     */
    public double getOffset(CircuitNode member) {
        Double offset = offsets.get(member);
        if (offset == null) {
            throw new IllegalArgumentException("Node " + member.getLabel() + " is not a member of supernode " + num);
        }
        return offset;
    }

    public List<VoltageSource> getTreeSources() {
        return treeSources;
    }

    public List<VoltageSource> getRedundantSources() {
        return redundantSources;
    }

    /**
     * Members in breadth first order from the representative: every member comes after its tree parent.
     */
    public List<CircuitNode> getTreeOrder() {
        return Collections.unmodifiableList(treeOrder);
    }

    /**
     * Tree source linking {@code member} to its parent, empty for the representative.
     */
    public Optional<VoltageSource> getParentSource(CircuitNode member) {
        return Optional.ofNullable(parentSources.get(member));
    }

    /**
     * Chain of sources crossed when walking from the representative to {@code member}.
     */
    public List<SourceStep> getPath(CircuitNode member) {
        LinkedList<SourceStep> path = new LinkedList<>();
        CircuitNode node = member;
        VoltageSource source = parentSources.get(node);
        while (source != null) {
            CircuitNode parent = source.getOtherNode(node);
            path.addFirst(new SourceStep(source, parent, node));
            node = parent;
            source = parentSources.get(node);
        }
        return path;
    }

    public List<String> getMemberLabels() {
        return members.stream().map(CircuitNode::getLabel).toList();
    }

    @Override
    public String toString() {
        return "Supernode(num=" + num + ", members=" + getMemberLabels() + ")";
    }
}

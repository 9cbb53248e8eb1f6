/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.graph;

/**
 * Union-find over node indices that also tracks, for each element, its potential relative to the root of its set.
 * Union by rank and path compression keep trees shallow; offsets are folded during compression so that after a
 * {@link #find} call {@code offset[x]} is V(x) - V(root).
 *
 * @author PowSyBl nodal analysis developers
 */
public class WeightedUnionFind {

    private final int[] parent;

    private final int[] rank;

    /**
     * V(x) - V(parent[x])
     */
    private final double[] offset;

    public WeightedUnionFind(int size) {
        parent = new int[size];
        rank = new int[size];
        offset = new double[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
    }

    public int size() {
        return parent.length;
    }

    public int find(int x) {
        int p = parent[x];
        if (p == x) {
            return x;
        }
        int root = find(p);
        offset[x] += offset[p];
        parent[x] = root;
        return root;
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    /**
     * Potential of {@code x} relative to the root of its set.
     */
    public double potential(int x) {
        find(x);
        return offset[x];
    }

    /**
     * V(b) - V(a) for two elements of the same set.
     */
    public double difference(int a, int b) {
        if (find(a) != find(b)) {
            throw new IllegalArgumentException("Elements " + a + " and " + b + " are not in the same set");
        }
        return offset[b] - offset[a];
    }

    /**
     * Merge the sets of {@code a} and {@code b} so that V(b) - V(a) = {@code difference}.
     *
     * @return false if both elements were already in the same set, in which case nothing changes
     */
    public boolean union(int a, int b, double difference) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        // V(rootB) - V(rootA)
        double rootDifference = difference + offset[a] - offset[b];
        if (rank[rootA] < rank[rootB]) {
            parent[rootA] = rootB;
            offset[rootA] = -rootDifference;
        } else {
            parent[rootB] = rootA;
            offset[rootB] = rootDifference;
            if (rank[rootA] == rank[rootB]) {
                rank[rootA]++;
            }
        }
        return true;
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.graph;

/**
 * Degree of a node. For a directed graph, in and out degrees are counted separately and the total is their sum.
 * For an undirected graph the degree is a single count: in, out and total all hold the number of neighbors.
 */
public final class Degree {

    public static final Degree ZERO = new Degree(0, 0, 0);

    private final int in;

    private final int out;

    private final int total;

    private Degree(int in, int out, int total) {
        this.in = in;
        this.out = out;
        this.total = total;
    }

    public static Degree directed(int in, int out) {
        return new Degree(in, out, in + out);
    }

    public static Degree undirected(int count) {
        return new Degree(count, count, count);
    }

    public int getIn() {
        return in;
    }

    public int getOut() {
        return out;
    }

    public int getTotal() {
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Degree other)) {
            return false;
        }
        return in == other.in && out == other.out && total == other.total;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * in + out) + total;
    }

    @Override
    public String toString() {
        return "Degree(in=" + in + ", out=" + out + ", total=" + total + ")";
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.graph;

import java.util.Objects;

/**
 * Immutable weighted edge.
 *
 * @param <N> node identifier type
 */
public final class Edge<N> {

    public static final double DEFAULT_WEIGHT = 1.0;

    private final N from;

    private final N to;

    private final double weight;

    public Edge(N from, N to, double weight) {
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
        if (Double.isNaN(weight) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Invalid weight " + weight + " for edge " + from + " -> " + to);
        }
        this.weight = weight;
    }

    public Edge(N from, N to) {
        this(from, to, DEFAULT_WEIGHT);
    }

    public N getFrom() {
        return from;
    }

    public N getTo() {
        return to;
    }

    public double getWeight() {
        return weight;
    }

    public Edge<N> reverse() {
        return new Edge<>(to, from, weight);
    }

    /**
     * Return the other end of this edge, given one of them.
     */
    public N getOpposite(N node) {
        if (from.equals(node)) {
            return to;
        } else if (to.equals(node)) {
            return from;
        }
        throw new IllegalArgumentException("Node " + node + " is not an end of edge " + this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Edge<?> other = (Edge<?>) o;
        return Double.compare(other.weight, weight) == 0 && from.equals(other.from) && to.equals(other.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, weight);
    }

    @Override
    public String toString() {
        return from + " -> " + to + " (" + weight + ")";
    }
}

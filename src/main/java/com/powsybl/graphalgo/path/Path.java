/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.path;

import com.powsybl.graphalgo.graph.Graph;

import java.util.List;
import java.util.Objects;

/**
 * Immutable path: a non-empty sequence of nodes, each one linked to the next by an edge, and its total weight.
 * A single node path has a length of 0 and a weight of 0.
 *
 * @param <N> node identifier type
 */
public final class Path<N> {

    private final List<N> nodes;

    private final double weight;

    public Path(List<N> nodes, double weight) {
        Objects.requireNonNull(nodes);
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("A path should contain at least one node");
        }
        this.nodes = List.copyOf(nodes);
        this.weight = weight;
    }

    /**
     * Create a path from its nodes, its weight being the sum of the weights of its edges in the given graph.
     */
    public static <N> Path<N> of(Graph<N> graph, List<N> nodes) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(nodes);
        double weight = 0;
        for (int i = 1; i < nodes.size(); i++) {
            N from = nodes.get(i - 1);
            N to = nodes.get(i);
            weight += graph.getWeight(from, to)
                    .orElseThrow(() -> new IllegalArgumentException("No edge between " + from + " and " + to));
        }
        return new Path<>(nodes, weight);
    }

    public List<N> getNodes() {
        return nodes;
    }

    public N getStart() {
        return nodes.get(0);
    }

    public N getEnd() {
        return nodes.get(nodes.size() - 1);
    }

    /**
     * Return the number of edges of the path.
     */
    public int getLength() {
        return nodes.size() - 1;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Path<?> other = (Path<?>) o;
        return Double.compare(other.weight, weight) == 0 && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, weight);
    }

    @Override
    public String toString() {
        return nodes + " (" + weight + ")";
    }
}

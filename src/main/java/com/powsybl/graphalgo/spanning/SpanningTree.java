/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.spanning;

import com.powsybl.graphalgo.graph.Edge;

import java.util.List;
import java.util.Objects;

/**
 * Edges of a spanning tree, or of a spanning forest when the graph is not connected, in the order they have been
 * selected.
 *
 * @param <N> node identifier type
 */
public final class SpanningTree<N> {

    private final List<Edge<N>> edges;

    private final double totalWeight;

    SpanningTree(List<Edge<N>> edges) {
        this.edges = List.copyOf(Objects.requireNonNull(edges));
        this.totalWeight = edges.stream().mapToDouble(Edge::getWeight).sum();
    }

    public List<Edge<N>> getEdges() {
        return edges;
    }

    public int getEdgeCount() {
        return edges.size();
    }

    public double getTotalWeight() {
        return totalWeight;
    }

    @Override
    public String toString() {
        return "SpanningTree(totalWeight=" + totalWeight + ", edges=" + edges + ")";
    }
}

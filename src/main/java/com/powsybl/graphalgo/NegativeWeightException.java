/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo;

import com.powsybl.graphalgo.graph.Edge;

import java.util.Objects;

/**
 * Raised by shortest path algorithms requiring non-negative weights when given a graph with a negative weight.
 */
public class NegativeWeightException extends GraphAlgorithmException {

    private final transient Edge<?> edge;

    public NegativeWeightException(Edge<?> edge) {
        super("Negative weight " + Objects.requireNonNull(edge).getWeight() + " on edge " + edge.getFrom() + " -> " + edge.getTo()
                + ", shortest paths cannot be computed");
        this.edge = edge;
    }

    public Edge<?> getEdge() {
        return edge;
    }
}

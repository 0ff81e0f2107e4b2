/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.traversal;

/**
 * Listener ignoring every event, to be extended by listeners only interested in some of them.
 *
 * @param <N> node identifier type
 */
public abstract class AbstractTraversalListener<N> implements TraversalListener<N> {

    static final TraversalListener<Object> NO_OP = new AbstractTraversalListener<>() {
    };

    @Override
    public void onNodeDiscovered(N node, N parent) {
        // empty
    }

    @Override
    public void onNodeVisited(N node) {
        // empty
    }

    @Override
    public void onBacktrack(N node) {
        // empty
    }

    @Override
    public void onEdgeRelaxed(N from, N to, double distance) {
        // empty
    }
}

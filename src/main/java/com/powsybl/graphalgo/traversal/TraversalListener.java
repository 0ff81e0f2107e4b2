/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.traversal;

/**
 * Hook called by the algorithms at well-defined checkpoints, to observe them step by step.
 *
 * @param <N> node identifier type
 */
public interface TraversalListener<N> {

    /**
     * Called when a node enters the frontier for the first time.
     *
     * @param node   the discovered node
     * @param parent the node it has been discovered from, or null for the start node
     */
    void onNodeDiscovered(N node, N parent);

    /**
     * Called when a node is taken out of the frontier and its result is settled.
     */
    void onNodeVisited(N node);

    /**
     * Called when a recursive exploration has finished with a node and goes back to its caller.
     * Iterative explorations, which do not keep track of call frames, do not notify it.
     */
    void onBacktrack(N node);

    /**
     * Called when a shortest path algorithm improves the tentative distance of a node.
     */
    void onEdgeRelaxed(N from, N to, double distance);

    @SuppressWarnings("unchecked")
    static <N> TraversalListener<N> noOp() {
        return (TraversalListener<N>) AbstractTraversalListener.NO_OP;
    }
}

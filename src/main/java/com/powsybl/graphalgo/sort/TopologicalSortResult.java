/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.sort;

import com.powsybl.graphalgo.GraphAlgorithmException;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a topological sort: either a complete order of the nodes, or the nodes which could not be ordered
 * because of a cycle. A partial order is never exposed as a result.
 *
 * @param <N> node identifier type
 */
public final class TopologicalSortResult<N> {

    private final List<N> order;

    private final List<N> cycleNodes;

    private TopologicalSortResult(List<N> order, List<N> cycleNodes) {
        this.order = Collections.unmodifiableList(order);
        this.cycleNodes = Collections.unmodifiableList(cycleNodes);
    }

    static <N> TopologicalSortResult<N> success(List<N> order) {
        return new TopologicalSortResult<>(Objects.requireNonNull(order), Collections.emptyList());
    }

    static <N> TopologicalSortResult<N> failure(List<N> cycleNodes) {
        Objects.requireNonNull(cycleNodes);
        if (cycleNodes.isEmpty()) {
            throw new IllegalArgumentException("A failed sort should report at least one node");
        }
        return new TopologicalSortResult<>(Collections.emptyList(), cycleNodes);
    }

    public boolean isSuccess() {
        return cycleNodes.isEmpty();
    }

    /**
     * Return the topological order, empty if the sort failed.
     */
    public List<N> getOrder() {
        return order;
    }

    /**
     * Return the nodes which are on a cycle or only reachable through one, empty if the sort succeeded.
     */
    public List<N> getCycleNodes() {
        return cycleNodes;
    }

    public List<N> getOrderOrThrow() {
        if (!isSuccess()) {
            throw new GraphAlgorithmException("Graph has at least one cycle, no topological order exists (nodes "
                    + cycleNodes + ")");
        }
        return order;
    }

    @Override
    public String toString() {
        return isSuccess() ? "TopologicalSortResult(order=" + order + ")"
                           : "TopologicalSortResult(cycleNodes=" + cycleNodes + ")";
    }
}

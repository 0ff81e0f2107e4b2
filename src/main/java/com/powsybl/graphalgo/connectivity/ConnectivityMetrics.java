/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.connectivity;

import com.powsybl.graphalgo.graph.Graph;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Summary of the connectivity of a graph.
 */
public final class ConnectivityMetrics {

    private final int nodeCount;

    private final int componentCount;

    private final int largestComponentSize;

    private final int isolatedNodeCount;

    private ConnectivityMetrics(int nodeCount, int componentCount, int largestComponentSize, int isolatedNodeCount) {
        this.nodeCount = nodeCount;
        this.componentCount = componentCount;
        this.largestComponentSize = largestComponentSize;
        this.isolatedNodeCount = isolatedNodeCount;
    }

    public static <N> ConnectivityMetrics of(Graph<N> graph) {
        return of(graph, ComponentAlgorithm.DFS);
    }

    public static <N> ConnectivityMetrics of(Graph<N> graph, ComponentAlgorithm algorithm) {
        Objects.requireNonNull(graph);
        List<Set<N>> components = ComponentFinder.findComponents(graph, algorithm);
        int largest = 0;
        int isolated = 0;
        for (Set<N> component : components) {
            largest = Math.max(largest, component.size());
            if (component.size() == 1) {
                isolated++;
            }
        }
        return new ConnectivityMetrics(graph.getNodeCount(), components.size(), largest, isolated);
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public int getComponentCount() {
        return componentCount;
    }

    public int getLargestComponentSize() {
        return largestComponentSize;
    }

    /**
     * Number of nodes without any incoming or outgoing edge.
     */
    public int getIsolatedNodeCount() {
        return isolatedNodeCount;
    }

    /**
     * Share of the nodes belonging to the largest component, 1 for the empty graph.
     */
    public double getConnectivityRatio() {
        return nodeCount == 0 ? 1.0 : (double) largestComponentSize / nodeCount;
    }

    public boolean isConnected() {
        return componentCount <= 1;
    }

    @Override
    public String toString() {
        return "ConnectivityMetrics(nodeCount=" + nodeCount
                + ", componentCount=" + componentCount
                + ", largestComponentSize=" + largestComponentSize
                + ", isolatedNodeCount=" + isolatedNodeCount
                + ")";
    }
}

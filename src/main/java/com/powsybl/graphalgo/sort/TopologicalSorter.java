/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.sort;

import com.powsybl.graphalgo.cycle.CycleDetector;
import com.powsybl.graphalgo.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Topological sort of directed graphs. Ties between nodes which could come next are broken using node insertion
 * order, so the result is deterministic.
 */
public final class TopologicalSorter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TopologicalSorter.class);

    private record Frame<N>(N node, Iterator<N> successors) {
    }

    private TopologicalSorter() {
    }

    private static void checkDirected(Graph<?> graph) {
        Objects.requireNonNull(graph);
        if (!graph.isDirected()) {
            throw new IllegalArgumentException("Topological sort requires a directed graph");
        }
    }

    /**
     * Sort the nodes using Kahn's algorithm: nodes without remaining predecessor are repeatedly removed, in FIFO
     * order. If some nodes are never freed, the graph has a cycle and these nodes are reported.
     */
    public static <N> TopologicalSortResult<N> sort(Graph<N> graph) {
        checkDirected(graph);
        Map<N, Integer> inDegrees = new LinkedHashMap<>();
        for (N node : graph.getNodes()) {
            inDegrees.put(node, 0);
        }
        for (N node : graph.getNodes()) {
            for (N successor : graph.getNeighbors(node)) {
                inDegrees.merge(successor, 1, Integer::sum);
            }
        }
        Deque<N> queue = new ArrayDeque<>();
        inDegrees.forEach((node, inDegree) -> {
            if (inDegree == 0) {
                queue.add(node);
            }
        });
        List<N> order = new ArrayList<>(graph.getNodeCount());
        while (!queue.isEmpty()) {
            N node = queue.poll();
            order.add(node);
            for (N successor : graph.getNeighbors(node)) {
                int inDegree = inDegrees.merge(successor, -1, Integer::sum);
                if (inDegree == 0) {
                    queue.add(successor);
                }
            }
        }
        if (order.size() < graph.getNodeCount()) {
            List<N> remaining = new ArrayList<>();
            inDegrees.forEach((node, inDegree) -> {
                if (inDegree > 0) {
                    remaining.add(node);
                }
            });
            LOGGER.warn("Topological sort failed, {} nodes are on a cycle or behind one: {}", remaining.size(), remaining);
            return TopologicalSortResult.failure(remaining);
        }
        return TopologicalSortResult.success(order);
    }

    /**
     * Sort the nodes in reverse depth first post-order. Fails with the nodes of a cycle if the graph has one.
     */
    public static <N> TopologicalSortResult<N> sortDepthFirst(Graph<N> graph) {
        checkDirected(graph);
        Optional<List<N>> cycle = CycleDetector.findCycle(graph);
        if (cycle.isPresent()) {
            List<N> cycleNodes = new ArrayList<>(new LinkedHashSet<>(cycle.get()));
            LOGGER.warn("Topological sort failed, cycle found: {}", cycle.get());
            return TopologicalSortResult.failure(cycleNodes);
        }
        Deque<N> order = new ArrayDeque<>(graph.getNodeCount());
        Set<N> visited = new HashSet<>();
        Deque<Frame<N>> stack = new ArrayDeque<>();
        for (N root : graph.getNodes()) {
            if (!visited.add(root)) {
                continue;
            }
            stack.push(new Frame<>(root, graph.getNeighbors(root).iterator()));
            while (!stack.isEmpty()) {
                Frame<N> frame = stack.peek();
                if (frame.successors().hasNext()) {
                    N successor = frame.successors().next();
                    if (visited.add(successor)) {
                        stack.push(new Frame<>(successor, graph.getNeighbors(successor).iterator()));
                    }
                } else {
                    // all successors are already in the order, so the node can be put in front of them
                    order.addFirst(frame.node());
                    stack.pop();
                }
            }
        }
        return TopologicalSortResult.success(new ArrayList<>(order));
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.traversal;

import com.powsybl.graphalgo.graph.Graph;

import java.util.*;

/**
 * Depth first traversals, available as a recursive and as an iterative formulation, see {@link DfsStrategy}.
 * <p>
 * The recursive formulation marks a node when entering it. The iterative one marks a node when popping it from
 * the stack: a node may then be pushed several times, copies being skipped when popped. Neighbors are pushed in
 * reverse order so that the first inserted neighbor is explored first, as in the recursive formulation.
 * A start node which is not in the graph is explored as an isolated node.
 */
public final class DepthFirstSearch {

    private record StackEntry<N>(N node, N parent) {
    }

    private DepthFirstSearch() {
    }

    /**
     * Return the nodes reachable from the start node, in visit order.
     */
    public static <N> List<N> traverse(Graph<N> graph, N start, DfsStrategy strategy) {
        return traverse(graph, start, strategy, Integer.MAX_VALUE, TraversalListener.noOp());
    }

    public static <N> List<N> traverse(Graph<N> graph, N start, DfsStrategy strategy, TraversalListener<N> listener) {
        return traverse(graph, start, strategy, Integer.MAX_VALUE, listener);
    }

    /**
     * Same as {@link #traverse(Graph, Object, DfsStrategy)} but stops once the given number of nodes have been
     * visited.
     */
    public static <N> List<N> traverse(Graph<N> graph, N start, DfsStrategy strategy, int maxNodes) {
        return traverse(graph, start, strategy, maxNodes, TraversalListener.noOp());
    }

    public static <N> List<N> traverse(Graph<N> graph, N start, DfsStrategy strategy, int maxNodes, TraversalListener<N> listener) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(start);
        Objects.requireNonNull(strategy);
        Objects.requireNonNull(listener);
        if (maxNodes < 0) {
            throw new IllegalArgumentException("Max node count should be >= 0: " + maxNodes);
        }
        List<N> order = new ArrayList<>();
        switch (strategy) {
            case RECURSIVE -> visitRecursively(graph, start, null, maxNodes, new HashSet<>(), order, listener);
            case ITERATIVE -> visitIteratively(graph, start, maxNodes, order, listener);
            default -> throw new IllegalStateException("Unknown DFS strategy: " + strategy);
        }
        return order;
    }

    private static <N> void visitRecursively(Graph<N> graph, N node, N parent, int maxNodes, Set<N> visited,
                                             List<N> order, TraversalListener<N> listener) {
        if (order.size() >= maxNodes) {
            return;
        }
        visited.add(node);
        order.add(node);
        listener.onNodeDiscovered(node, parent);
        listener.onNodeVisited(node);
        for (N neighbor : graph.getNeighbors(node)) {
            if (!visited.contains(neighbor)) {
                visitRecursively(graph, neighbor, node, maxNodes, visited, order, listener);
            }
        }
        listener.onBacktrack(node);
    }

    private static <N> void visitIteratively(Graph<N> graph, N start, int maxNodes, List<N> order,
                                             TraversalListener<N> listener) {
        Set<N> visited = new HashSet<>();
        Deque<StackEntry<N>> stack = new ArrayDeque<>();
        stack.push(new StackEntry<>(start, null));
        while (!stack.isEmpty() && order.size() < maxNodes) {
            StackEntry<N> entry = stack.pop();
            N node = entry.node();
            if (!visited.add(node)) {
                // already visited through another path since it has been pushed
                continue;
            }
            order.add(node);
            listener.onNodeDiscovered(node, entry.parent());
            listener.onNodeVisited(node);
            List<N> neighbors = graph.getNeighbors(node);
            for (ListIterator<N> it = neighbors.listIterator(neighbors.size()); it.hasPrevious();) {
                N neighbor = it.previous();
                if (!visited.contains(neighbor)) {
                    stack.push(new StackEntry<>(neighbor, node));
                }
            }
        }
    }
}

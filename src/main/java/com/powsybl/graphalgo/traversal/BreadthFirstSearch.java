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
 * Breadth first traversals.
 * <p>
 * A node is marked as visited as soon as it is discovered, i.e. when it is enqueued and not when it is dequeued.
 * A node is therefore enqueued at most once, and is reached first through a path with the minimum number of edges.
 * A start node which is not in the graph is explored as an isolated node.
 */
public final class BreadthFirstSearch {

    private BreadthFirstSearch() {
    }

    /**
     * Return the nodes reachable from the start node, in discovery order.
     */
    public static <N> List<N> traverse(Graph<N> graph, N start) {
        return traverse(graph, start, Integer.MAX_VALUE, TraversalListener.noOp());
    }

    public static <N> List<N> traverse(Graph<N> graph, N start, TraversalListener<N> listener) {
        return traverse(graph, start, Integer.MAX_VALUE, listener);
    }

    /**
     * Same as {@link #traverse(Graph, Object)} but stops once the given number of nodes have been visited.
     */
    public static <N> List<N> traverse(Graph<N> graph, N start, int maxNodes) {
        return traverse(graph, start, maxNodes, TraversalListener.noOp());
    }

    public static <N> List<N> traverse(Graph<N> graph, N start, int maxNodes, TraversalListener<N> listener) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(start);
        Objects.requireNonNull(listener);
        if (maxNodes < 0) {
            throw new IllegalArgumentException("Max node count should be >= 0: " + maxNodes);
        }

        List<N> order = new ArrayList<>();
        Set<N> visited = new HashSet<>();
        Deque<N> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        listener.onNodeDiscovered(start, null);
        while (!queue.isEmpty() && order.size() < maxNodes) {
            N node = queue.poll();
            order.add(node);
            listener.onNodeVisited(node);
            for (N neighbor : graph.getNeighbors(node)) {
                if (visited.add(neighbor)) {
                    queue.add(neighbor);
                    listener.onNodeDiscovered(neighbor, node);
                }
            }
        }
        return order;
    }

    /**
     * Return the reachable nodes grouped by distance, in number of edges, from the start node: first level only
     * contains the start node, second one its neighbors, and so on.
     */
    public static <N> List<List<N>> levels(Graph<N> graph, N start) {
        return levels(graph, start, Integer.MAX_VALUE);
    }

    /**
     * Same as {@link #levels(Graph, Object)} but only explores nodes up to the given distance from start node.
     */
    public static <N> List<List<N>> levels(Graph<N> graph, N start, int maxDepth) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(start);
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Max depth should be >= 0: " + maxDepth);
        }

        List<List<N>> levels = new ArrayList<>();
        Set<N> visited = new HashSet<>();
        List<N> currentLevel = List.of(start);
        visited.add(start);
        while (!currentLevel.isEmpty()) {
            levels.add(currentLevel);
            if (levels.size() > maxDepth) {
                break;
            }
            List<N> nextLevel = new ArrayList<>();
            for (N node : currentLevel) {
                for (N neighbor : graph.getNeighbors(node)) {
                    if (visited.add(neighbor)) {
                        nextLevel.add(neighbor);
                    }
                }
            }
            currentLevel = nextLevel;
        }
        return levels;
    }

    /**
     * Return the distance, in number of edges, from the start node to each reachable node. Iteration order of the
     * map is the discovery order.
     */
    public static <N> Map<N, Integer> distances(Graph<N> graph, N start) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(start);

        Map<N, Integer> distances = new LinkedHashMap<>();
        Deque<N> queue = new ArrayDeque<>();
        distances.put(start, 0);
        queue.add(start);
        while (!queue.isEmpty()) {
            N node = queue.poll();
            int distance = distances.get(node);
            for (N neighbor : graph.getNeighbors(node)) {
                if (!distances.containsKey(neighbor)) {
                    distances.put(neighbor, distance + 1);
                    queue.add(neighbor);
                }
            }
        }
        return distances;
    }
}

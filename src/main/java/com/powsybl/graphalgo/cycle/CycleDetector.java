/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.cycle;

import com.powsybl.graphalgo.graph.Graph;
import com.powsybl.graphalgo.traversal.DfsStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Cycle detection on directed and undirected graphs.
 * <p>
 * On a directed graph, nodes are colored white (not visited yet), gray (on the current exploration path) and black
 * (fully explored): an edge toward a gray node closes a cycle. On an undirected graph each edge can be followed both
 * ways, so the edge back to the node we come from must not be taken for a cycle: a visited neighbor which is not the
 * parent closes a cycle.
 * <p>
 * Cycles are returned closed, the first node being repeated at the end, for instance {@code [0, 1, 2, 0]}.
 * All nodes are tried as exploration roots, in insertion order, so cycles are found whatever the component.
 */
public final class CycleDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(CycleDetector.class);

    private enum Color {
        WHITE,
        GRAY,
        BLACK
    }

    private record Frame<N>(N node, N parent, Iterator<N> neighbors) {
    }

    private CycleDetector() {
    }

    public static <N> boolean hasCycle(Graph<N> graph) {
        return findCycle(graph).isPresent();
    }

    public static <N> boolean hasCycle(Graph<N> graph, DfsStrategy strategy) {
        return findCycle(graph, strategy).isPresent();
    }

    public static <N> Optional<List<N>> findCycle(Graph<N> graph) {
        return findCycle(graph, DfsStrategy.ITERATIVE);
    }

    /**
     * Find a cycle using a depth first search run with the given strategy.
     *
     * @return the first cycle met, closed, or an empty optional if the graph is acyclic
     */
    public static <N> Optional<List<N>> findCycle(Graph<N> graph, DfsStrategy strategy) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(strategy);
        List<N> cycle = graph.isDirected() ? findDirectedCycle(graph, strategy) : findUndirectedCycle(graph, strategy);
        if (cycle != null) {
            LOGGER.debug("Cycle found: {}", cycle);
        }
        return Optional.ofNullable(cycle);
    }

    private static <N> List<N> findDirectedCycle(Graph<N> graph, DfsStrategy strategy) {
        Map<N, Color> colors = new HashMap<>();
        Map<N, N> parents = new HashMap<>();
        for (N root : graph.getNodes()) {
            if (colors.getOrDefault(root, Color.WHITE) == Color.WHITE) {
                List<N> cycle = switch (strategy) {
                    case RECURSIVE -> visitDirectedRecursively(graph, root, colors, parents);
                    case ITERATIVE -> visitDirectedIteratively(graph, root, colors, parents);
                };
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        return null;
    }

    private static <N> List<N> visitDirectedRecursively(Graph<N> graph, N node, Map<N, Color> colors, Map<N, N> parents) {
        colors.put(node, Color.GRAY);
        for (N neighbor : graph.getNeighbors(node)) {
            Color color = colors.getOrDefault(neighbor, Color.WHITE);
            if (color == Color.GRAY) {
                return buildCycle(parents, node, neighbor);
            }
            if (color == Color.WHITE) {
                parents.put(neighbor, node);
                List<N> cycle = visitDirectedRecursively(graph, neighbor, colors, parents);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        colors.put(node, Color.BLACK);
        return null;
    }

    private static <N> List<N> visitDirectedIteratively(Graph<N> graph, N root, Map<N, Color> colors, Map<N, N> parents) {
        Deque<Frame<N>> stack = new ArrayDeque<>();
        colors.put(root, Color.GRAY);
        stack.push(new Frame<>(root, null, graph.getNeighbors(root).iterator()));
        while (!stack.isEmpty()) {
            Frame<N> frame = stack.peek();
            if (frame.neighbors().hasNext()) {
                N neighbor = frame.neighbors().next();
                Color color = colors.getOrDefault(neighbor, Color.WHITE);
                if (color == Color.GRAY) {
                    return buildCycle(parents, frame.node(), neighbor);
                }
                if (color == Color.WHITE) {
                    parents.put(neighbor, frame.node());
                    colors.put(neighbor, Color.GRAY);
                    stack.push(new Frame<>(neighbor, frame.node(), graph.getNeighbors(neighbor).iterator()));
                }
            } else {
                colors.put(frame.node(), Color.BLACK);
                stack.pop();
            }
        }
        return null;
    }

    private static <N> List<N> findUndirectedCycle(Graph<N> graph, DfsStrategy strategy) {
        Set<N> visited = new HashSet<>();
        Map<N, N> parents = new HashMap<>();
        for (N root : graph.getNodes()) {
            if (!visited.contains(root)) {
                List<N> cycle = switch (strategy) {
                    case RECURSIVE -> visitUndirectedRecursively(graph, root, null, visited, parents);
                    case ITERATIVE -> visitUndirectedIteratively(graph, root, visited, parents);
                };
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        return null;
    }

    private static <N> List<N> visitUndirectedRecursively(Graph<N> graph, N node, N parent, Set<N> visited, Map<N, N> parents) {
        visited.add(node);
        for (N neighbor : graph.getNeighbors(node)) {
            if (neighbor.equals(parent)) {
                continue;
            }
            if (visited.contains(neighbor)) {
                return buildCycle(parents, node, neighbor);
            }
            parents.put(neighbor, node);
            List<N> cycle = visitUndirectedRecursively(graph, neighbor, node, visited, parents);
            if (cycle != null) {
                return cycle;
            }
        }
        return null;
    }

    private static <N> List<N> visitUndirectedIteratively(Graph<N> graph, N root, Set<N> visited, Map<N, N> parents) {
        Deque<Frame<N>> stack = new ArrayDeque<>();
        visited.add(root);
        stack.push(new Frame<>(root, null, graph.getNeighbors(root).iterator()));
        while (!stack.isEmpty()) {
            Frame<N> frame = stack.peek();
            if (!frame.neighbors().hasNext()) {
                stack.pop();
                continue;
            }
            N neighbor = frame.neighbors().next();
            if (neighbor.equals(frame.parent())) {
                continue;
            }
            if (visited.contains(neighbor)) {
                return buildCycle(parents, frame.node(), neighbor);
            }
            visited.add(neighbor);
            parents.put(neighbor, frame.node());
            stack.push(new Frame<>(neighbor, frame.node(), graph.getNeighbors(neighbor).iterator()));
        }
        return null;
    }

    /**
     * Build the cycle closed by the edge from {@code node} to its ancestor {@code ancestor} in the exploration tree.
     */
    private static <N> List<N> buildCycle(Map<N, N> parents, N node, N ancestor) {
        List<N> cycle = new ArrayList<>();
        N current = node;
        cycle.add(current);
        while (!current.equals(ancestor)) {
            current = parents.get(current);
            cycle.add(current);
        }
        Collections.reverse(cycle);
        cycle.add(ancestor);
        return cycle;
    }

    /**
     * Find a cycle with the minimum number of edges, by running a breadth first search from every node.
     * On an undirected graph, only cycles of at least three nodes are considered.
     */
    public static <N> Optional<List<N>> findShortestCycle(Graph<N> graph) {
        Objects.requireNonNull(graph);
        List<N> shortest = null;
        for (N start : graph.getNodes()) {
            List<N> cycle = graph.isDirected() ? shortestDirectedCycleThrough(graph, start)
                                               : shortestUndirectedCycleFrom(graph, start);
            if (cycle != null && (shortest == null || cycle.size() < shortest.size())) {
                shortest = cycle;
            }
        }
        return Optional.ofNullable(shortest);
    }

    private static <N> List<N> shortestDirectedCycleThrough(Graph<N> graph, N start) {
        Map<N, N> parents = new HashMap<>();
        Deque<N> queue = new ArrayDeque<>();
        parents.put(start, start);
        queue.add(start);
        while (!queue.isEmpty()) {
            N node = queue.poll();
            for (N neighbor : graph.getNeighbors(node)) {
                if (neighbor.equals(start)) {
                    List<N> cycle = pathFromStart(parents, start, node);
                    cycle.add(start);
                    return cycle;
                }
                if (!parents.containsKey(neighbor)) {
                    parents.put(neighbor, node);
                    queue.add(neighbor);
                }
            }
        }
        return null;
    }

    private static <N> List<N> shortestUndirectedCycleFrom(Graph<N> graph, N start) {
        Map<N, N> parents = new HashMap<>();
        Map<N, Integer> depths = new HashMap<>();
        Deque<N> queue = new ArrayDeque<>();
        parents.put(start, start);
        depths.put(start, 0);
        queue.add(start);
        N bestNode = null;
        N bestNeighbor = null;
        int bestLength = Integer.MAX_VALUE;
        while (!queue.isEmpty()) {
            N node = queue.poll();
            int depth = depths.get(node);
            if (2 * depth >= bestLength) {
                // no shorter cycle can be closed from this depth
                break;
            }
            for (N neighbor : graph.getNeighbors(node)) {
                if (!depths.containsKey(neighbor)) {
                    parents.put(neighbor, node);
                    depths.put(neighbor, depth + 1);
                    queue.add(neighbor);
                } else if (!neighbor.equals(parents.get(node))) {
                    int length = depth + depths.get(neighbor) + 1;
                    if (length < bestLength) {
                        bestLength = length;
                        bestNode = node;
                        bestNeighbor = neighbor;
                    }
                }
            }
        }
        if (bestNode == null) {
            return null;
        }
        // both tree paths only share the start node when the cycle is a shortest one of the graph
        List<N> cycle = pathFromStart(parents, start, bestNode);
        List<N> back = pathFromStart(parents, start, bestNeighbor);
        Collections.reverse(back);
        cycle.addAll(back);
        return cycle;
    }

    private static <N> List<N> pathFromStart(Map<N, N> parents, N start, N node) {
        List<N> path = new ArrayList<>();
        N current = node;
        path.add(current);
        while (!current.equals(start)) {
            current = parents.get(current);
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.path;

import com.powsybl.graphalgo.graph.Graph;
import com.powsybl.graphalgo.traversal.DfsStrategy;

import java.util.*;

/**
 * Path searches ignoring edge weights. For weighted shortest paths see {@link DijkstraShortestPath}.
 * <p>
 * "No path" is always reported as an empty optional, which is not the same as the single node path returned when
 * start and target are the same node.
 */
public final class PathFinder {

    private record StackEntry<N>(N node, N parent) {
    }

    private PathFinder() {
    }

    /**
     * Find a path with the minimum number of edges from start to target, using a breadth first search.
     */
    public static <N> Optional<Path<N>> shortestPath(Graph<N> graph, N start, N target) {
        return shortestPathAvoiding(graph, start, target, Collections.emptySet());
    }

    /**
     * Find a path with the minimum number of edges from start to target, which does not go through any of the
     * given nodes.
     */
    public static <N> Optional<Path<N>> shortestPathAvoiding(Graph<N> graph, N start, N target, Set<N> avoidedNodes) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(start);
        Objects.requireNonNull(target);
        Objects.requireNonNull(avoidedNodes);
        if (avoidedNodes.contains(start) || avoidedNodes.contains(target)) {
            return Optional.empty();
        }
        if (start.equals(target)) {
            return Optional.of(Path.of(graph, List.of(start)));
        }

        // a node is discovered once, from the first dequeued node reaching it, which is on a shortest path
        Map<N, N> parents = new HashMap<>();
        Deque<N> queue = new ArrayDeque<>();
        parents.put(start, start);
        queue.add(start);
        while (!queue.isEmpty()) {
            N node = queue.poll();
            for (N neighbor : graph.getNeighbors(node)) {
                if (parents.containsKey(neighbor) || avoidedNodes.contains(neighbor)) {
                    continue;
                }
                parents.put(neighbor, node);
                if (neighbor.equals(target)) {
                    return Optional.of(Path.of(graph, buildPath(parents, start, target)));
                }
                queue.add(neighbor);
            }
        }
        return Optional.empty();
    }

    /**
     * Find any path from start to target using a depth first search. The path is the first one met by the
     * exploration, which is not necessarily the shortest one.
     */
    public static <N> Optional<Path<N>> anyPath(Graph<N> graph, N start, N target, DfsStrategy strategy) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(start);
        Objects.requireNonNull(target);
        Objects.requireNonNull(strategy);
        List<N> nodes = switch (strategy) {
            case RECURSIVE -> {
                List<N> path = new ArrayList<>();
                yield findPathRecursively(graph, start, target, new HashSet<>(), path) ? path : null;
            }
            case ITERATIVE -> findPathIteratively(graph, start, target);
        };
        return Optional.ofNullable(nodes).map(n -> Path.of(graph, n));
    }

    private static <N> boolean findPathRecursively(Graph<N> graph, N node, N target, Set<N> visited, List<N> path) {
        visited.add(node);
        path.add(node);
        if (node.equals(target)) {
            return true;
        }
        for (N neighbor : graph.getNeighbors(node)) {
            if (!visited.contains(neighbor) && findPathRecursively(graph, neighbor, target, visited, path)) {
                return true;
            }
        }
        path.remove(path.size() - 1);
        return false;
    }

    private static <N> List<N> findPathIteratively(Graph<N> graph, N start, N target) {
        Map<N, N> parents = new HashMap<>();
        Deque<StackEntry<N>> stack = new ArrayDeque<>();
        stack.push(new StackEntry<>(start, start));
        while (!stack.isEmpty()) {
            StackEntry<N> entry = stack.pop();
            N node = entry.node();
            if (parents.containsKey(node)) {
                continue;
            }
            parents.put(node, entry.parent());
            if (node.equals(target)) {
                return buildPath(parents, start, target);
            }
            List<N> neighbors = graph.getNeighbors(node);
            for (ListIterator<N> it = neighbors.listIterator(neighbors.size()); it.hasPrevious();) {
                N neighbor = it.previous();
                if (!parents.containsKey(neighbor)) {
                    stack.push(new StackEntry<>(neighbor, node));
                }
            }
        }
        return null;
    }

    /**
     * Find all simple paths from start to target. Beware that the number of simple paths, and so the cost of this
     * method, is exponential in the worst case.
     */
    public static <N> List<Path<N>> allPaths(Graph<N> graph, N start, N target) {
        return allPaths(graph, start, target, Integer.MAX_VALUE);
    }

    /**
     * Find all simple paths from start to target with at most the given number of edges. Beware that the number
     * of simple paths, and so the cost of this method, is exponential in the worst case.
     */
    public static <N> List<Path<N>> allPaths(Graph<N> graph, N start, N target, int maxEdges) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(start);
        Objects.requireNonNull(target);
        if (maxEdges < 0) {
            throw new IllegalArgumentException("Max edge count should be >= 0: " + maxEdges);
        }
        List<Path<N>> paths = new ArrayList<>();
        List<N> currentPath = new ArrayList<>();
        currentPath.add(start);
        Set<N> onPath = new HashSet<>();
        onPath.add(start);
        findAllPaths(graph, start, target, maxEdges, currentPath, onPath, paths);
        return paths;
    }

    private static <N> void findAllPaths(Graph<N> graph, N node, N target, int maxEdges, List<N> currentPath,
                                         Set<N> onPath, List<Path<N>> paths) {
        if (node.equals(target)) {
            paths.add(Path.of(graph, currentPath));
            return;
        }
        if (currentPath.size() > maxEdges) {
            return;
        }
        for (N neighbor : graph.getNeighbors(node)) {
            // only nodes of the current path are rejected, cycles elsewhere do not prevent termination
            if (onPath.add(neighbor)) {
                currentPath.add(neighbor);
                findAllPaths(graph, neighbor, target, maxEdges, currentPath, onPath, paths);
                currentPath.remove(currentPath.size() - 1);
                onPath.remove(neighbor);
            }
        }
    }

    static <N> List<N> buildPath(Map<N, N> parents, N start, N target) {
        List<N> path = new ArrayList<>();
        N node = target;
        path.add(node);
        while (!node.equals(start)) {
            node = parents.get(node);
            path.add(node);
        }
        Collections.reverse(path);
        return path;
    }
}

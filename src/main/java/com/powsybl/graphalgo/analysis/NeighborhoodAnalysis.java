/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.analysis;

import com.powsybl.graphalgo.graph.Graph;
import com.powsybl.graphalgo.path.Path;
import com.powsybl.graphalgo.path.PathFinder;

import java.util.*;

/**
 * Analysis of the direct neighborhood of nodes, as used for social networks: mutual neighbors, neighbor
 * suggestions, local clustering and degrees of separation. Neighbors are the ends of outgoing edges.
 */
public final class NeighborhoodAnalysis {

    private NeighborhoodAnalysis() {
    }

    /**
     * Return the neighbors of {@code node1} which are also neighbors of {@code node2}, in {@code node1} neighbor
     * order.
     */
    public static <N> List<N> mutualNeighbors(Graph<N> graph, N node1, N node2) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(node1);
        Objects.requireNonNull(node2);
        Set<N> neighbors2 = new HashSet<>(graph.getNeighbors(node2));
        return graph.getNeighbors(node1).stream()
                .filter(neighbors2::contains)
                .toList();
    }

    /**
     * Suggest new neighbors for a node: neighbors of its neighbors which are not already its neighbors.
     *
     * @param maxSuggestions maximum number of suggestions
     * @return the suggested nodes with their number of mutual neighbors, by decreasing count, ties being kept in
     * discovery order
     */
    public static <N> Map<N, Integer> suggestNeighbors(Graph<N> graph, N node, int maxSuggestions) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(node);
        if (maxSuggestions < 0) {
            throw new IllegalArgumentException("Max suggestion count should be >= 0: " + maxSuggestions);
        }
        List<N> neighbors = graph.getNeighbors(node);
        Set<N> currentNeighbors = new HashSet<>(neighbors);
        Map<N, Integer> mutualCounts = new LinkedHashMap<>();
        for (N neighbor : neighbors) {
            for (N candidate : graph.getNeighbors(neighbor)) {
                if (!candidate.equals(node) && !currentNeighbors.contains(candidate)) {
                    mutualCounts.merge(candidate, 1, Integer::sum);
                }
            }
        }
        Map<N, Integer> suggestions = new LinkedHashMap<>();
        mutualCounts.entrySet().stream()
                .sorted(Map.Entry.<N, Integer>comparingByValue().reversed())
                .limit(maxSuggestions)
                .forEach(e -> suggestions.put(e.getKey(), e.getValue()));
        return suggestions;
    }

    /**
     * Return the share of the pairs of neighbors of the node which are themselves linked, in either direction.
     * A node with less than two neighbors has a coefficient of 0.
     */
    public static <N> double clusteringCoefficient(Graph<N> graph, N node) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(node);
        List<N> neighbors = graph.getNeighbors(node);
        int k = neighbors.size();
        if (k < 2) {
            return 0.0;
        }
        Map<N, Integer> positions = new HashMap<>(k);
        for (N neighbor : neighbors) {
            positions.put(neighbor, positions.size());
        }
        // a pair linked both ways is only counted from the neighbor coming first
        long linkedPairs = 0;
        for (N n1 : neighbors) {
            for (N n2 : graph.getNeighbors(n1)) {
                Integer position2 = positions.get(n2);
                if (position2 != null && (position2 > positions.get(n1) || !graph.hasEdge(n2, n1))) {
                    linkedPairs++;
                }
            }
        }
        return linkedPairs / ((double) k * (k - 1) / 2);
    }

    /**
     * Return the minimum number of edges to go from {@code node1} to {@code node2}, or an empty optional if
     * {@code node2} cannot be reached.
     */
    public static <N> OptionalInt degreesOfSeparation(Graph<N> graph, N node1, N node2) {
        return PathFinder.shortestPath(graph, node1, node2)
                .map(Path::getLength)
                .map(OptionalInt::of)
                .orElse(OptionalInt.empty());
    }
}

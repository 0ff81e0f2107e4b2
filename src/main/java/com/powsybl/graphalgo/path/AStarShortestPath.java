/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.path;

import com.powsybl.graphalgo.graph.Edge;
import com.powsybl.graphalgo.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.ToDoubleBiFunction;

/**
 * A* search: Dijkstra's algorithm guided toward the target by a heuristic estimate of the remaining distance.
 * The returned path is a shortest one as long as the heuristic never overestimates the remaining distance.
 * With a heuristic always returning 0, it explores nodes exactly as {@link DijkstraShortestPath} does.
 *
 * @param <N> node identifier type
 */
public class AStarShortestPath<N> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AStarShortestPath.class);

    private record QueueEntry<N>(N node, double estimate, long sequence) {
    }

    private final Graph<N> graph;

    private final ToDoubleBiFunction<N, N> heuristic;

    public AStarShortestPath(Graph<N> graph, ToDoubleBiFunction<N, N> heuristic) {
        this.graph = Objects.requireNonNull(graph);
        this.heuristic = Objects.requireNonNull(heuristic);
        DijkstraShortestPath.checkNonNegativeWeights(graph);
    }

    public Optional<Path<N>> computePath(N start, N target) {
        Objects.requireNonNull(start);
        Objects.requireNonNull(target);
        DijkstraShortestPath.checkNonNegativeWeights(graph);

        Map<N, Double> distances = new HashMap<>();
        Map<N, N> predecessors = new HashMap<>();
        Set<N> closed = new HashSet<>();
        PriorityQueue<QueueEntry<N>> open = new PriorityQueue<>(Comparator.<QueueEntry<N>>comparingDouble(QueueEntry::estimate)
                .thenComparingLong(QueueEntry::sequence));
        long sequence = 0;

        distances.put(start, 0.0);
        open.add(new QueueEntry<>(start, heuristic.applyAsDouble(start, target), sequence++));
        while (!open.isEmpty()) {
            N node = open.poll().node();
            if (!closed.add(node)) {
                continue;
            }
            if (node.equals(target)) {
                LOGGER.debug("A* from {} to {} closed {} nodes", start, target, closed.size());
                List<N> nodes = PathFinder.buildPath(predecessors, start, target);
                return Optional.of(new Path<>(nodes, distances.get(target)));
            }
            double distance = distances.get(node);
            for (Edge<N> edge : graph.getOutgoingEdges(node)) {
                N neighbor = edge.getTo();
                double newDistance = distance + edge.getWeight();
                Double currentDistance = distances.get(neighbor);
                if (currentDistance == null || newDistance < currentDistance) {
                    // a closed node may be reopened when the heuristic is not consistent
                    closed.remove(neighbor);
                    distances.put(neighbor, newDistance);
                    predecessors.put(neighbor, node);
                    open.add(new QueueEntry<>(neighbor, newDistance + heuristic.applyAsDouble(neighbor, target), sequence++));
                }
            }
        }
        LOGGER.debug("A* from {} to {}: target not reachable", start, target);
        return Optional.empty();
    }
}

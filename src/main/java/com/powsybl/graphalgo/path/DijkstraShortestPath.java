/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.path;

import com.google.common.base.Stopwatch;
import com.powsybl.graphalgo.NegativeWeightException;
import com.powsybl.graphalgo.graph.Edge;
import com.powsybl.graphalgo.graph.Graph;
import com.powsybl.graphalgo.traversal.TraversalListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;

/**
 * Dijkstra's shortest path algorithm, with a binary heap as frontier.
 * <p>
 * A node is settled the first time it is polled from the heap: its distance cannot be improved afterward because
 * weights are non-negative. Outdated heap entries, left by later improvements, are skipped when polled.
 * Negative weights are rejected with a {@link NegativeWeightException}, when the algorithm is created and again at each
 * computation as the graph may have been modified in between.
 * <p>
 * Edge costs are given by a weight function, defaulting to {@link Edge#getWeight()}. Another function allows to
 * search the same graph by another criterion, for instance the price of flights instead of their distance.
 *
 * @param <N> node identifier type
 */
public class DijkstraShortestPath<N> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DijkstraShortestPath.class);

    /**
     * Heap entry, with an insertion sequence number to break ties between equal distances in insertion order.
     */
    private record QueueEntry<N>(N node, double distance, long sequence) {
    }

    private static final Comparator<QueueEntry<?>> ENTRY_COMPARATOR = Comparator.<QueueEntry<?>>comparingDouble(QueueEntry::distance)
            .thenComparingLong(QueueEntry::sequence);

    private final Graph<N> graph;

    private final ToDoubleFunction<Edge<N>> weightFunction;

    private final TraversalListener<N> listener;

    public DijkstraShortestPath(Graph<N> graph) {
        this(graph, TraversalListener.noOp());
    }

    public DijkstraShortestPath(Graph<N> graph, TraversalListener<N> listener) {
        this(graph, Edge::getWeight, listener);
    }

    public DijkstraShortestPath(Graph<N> graph, ToDoubleFunction<Edge<N>> weightFunction) {
        this(graph, weightFunction, TraversalListener.noOp());
    }

    public DijkstraShortestPath(Graph<N> graph, ToDoubleFunction<Edge<N>> weightFunction, TraversalListener<N> listener) {
        this.graph = Objects.requireNonNull(graph);
        this.weightFunction = Objects.requireNonNull(weightFunction);
        this.listener = Objects.requireNonNull(listener);
        checkWeights(graph, weightFunction);
    }

    static <N> void checkNonNegativeWeights(Graph<N> graph) {
        checkWeights(graph, Edge::getWeight);
    }

    static <N> void checkWeights(Graph<N> graph, ToDoubleFunction<Edge<N>> weightFunction) {
        for (Edge<N> edge : graph.getEdges()) {
            double weight = weightFunction.applyAsDouble(edge);
            if (weight < 0) {
                throw new NegativeWeightException(weight == edge.getWeight() ? edge : new Edge<>(edge.getFrom(), edge.getTo(), weight));
            }
            if (Double.isNaN(weight) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("Invalid weight " + weight + " on edge " + edge.getFrom() + " -> " + edge.getTo());
            }
        }
    }

    /**
     * Compute the shortest distances from the start node to every reachable node.
     */
    public ShortestPathTree<N> computeAll(N start) {
        return run(start, null);
    }

    /**
     * Compute a shortest path from start to target. The search stops as soon as the target is settled.
     */
    public Optional<Path<N>> computePath(N start, N target) {
        Objects.requireNonNull(target);
        return run(start, target).getPath(target);
    }

    private ShortestPathTree<N> run(N start, N target) {
        Objects.requireNonNull(start);
        checkWeights(graph, weightFunction);
        Stopwatch stopwatch = Stopwatch.createStarted();

        Map<N, Double> tentativeDistances = new HashMap<>();
        Map<N, Double> settledDistances = new LinkedHashMap<>();
        Map<N, N> predecessors = new HashMap<>();
        PriorityQueue<QueueEntry<N>> queue = new PriorityQueue<>(ENTRY_COMPARATOR);
        long sequence = 0;

        tentativeDistances.put(start, 0.0);
        queue.add(new QueueEntry<>(start, 0.0, sequence++));
        listener.onNodeDiscovered(start, null);
        while (!queue.isEmpty()) {
            QueueEntry<N> entry = queue.poll();
            N node = entry.node();
            if (settledDistances.containsKey(node)) {
                continue;
            }
            settledDistances.put(node, entry.distance());
            listener.onNodeVisited(node);
            if (node.equals(target)) {
                break;
            }
            for (Edge<N> edge : graph.getOutgoingEdges(node)) {
                N neighbor = edge.getTo();
                if (settledDistances.containsKey(neighbor)) {
                    continue;
                }
                double newDistance = entry.distance() + weightFunction.applyAsDouble(edge);
                Double currentDistance = tentativeDistances.get(neighbor);
                if (currentDistance == null || newDistance < currentDistance) {
                    if (currentDistance == null) {
                        listener.onNodeDiscovered(neighbor, node);
                    }
                    tentativeDistances.put(neighbor, newDistance);
                    predecessors.put(neighbor, node);
                    queue.add(new QueueEntry<>(neighbor, newDistance, sequence++));
                    listener.onEdgeRelaxed(node, neighbor, newDistance);
                }
            }
        }

        LOGGER.debug("Dijkstra from {} settled {} nodes in {} ms", start, settledDistances.size(),
                stopwatch.elapsed(TimeUnit.MILLISECONDS));

        predecessors.keySet().retainAll(settledDistances.keySet());
        return new ShortestPathTree<>(start, settledDistances, predecessors);
    }
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.path;

import java.util.*;

/**
 * Result of a single source shortest path computation: the distance of each reached node from the start node and
 * its predecessor on a shortest path.
 *
 * @param <N> node identifier type
 */
public class ShortestPathTree<N> {

    private final N start;

    private final Map<N, Double> distances;

    private final Map<N, N> predecessors;

    ShortestPathTree(N start, Map<N, Double> distances, Map<N, N> predecessors) {
        this.start = Objects.requireNonNull(start);
        this.distances = Collections.unmodifiableMap(distances);
        this.predecessors = Collections.unmodifiableMap(predecessors);
    }

    public N getStart() {
        return start;
    }

    /**
     * Return the shortest distance from start node to the given node, or {@link Double#POSITIVE_INFINITY} if it
     * cannot be reached.
     */
    public double getDistance(N node) {
        return distances.getOrDefault(node, Double.POSITIVE_INFINITY);
    }

    public boolean isReachable(N node) {
        return distances.containsKey(node);
    }

    /**
     * Return the distances of all reached nodes, in the order they have been settled.
     */
    public Map<N, Double> getDistances() {
        return distances;
    }

    public Optional<N> getPredecessor(N node) {
        return Optional.ofNullable(predecessors.get(node));
    }

    /**
     * Rebuild the shortest path from start node to the given node by following predecessors backward.
     */
    public Optional<Path<N>> getPath(N target) {
        if (!isReachable(target)) {
            return Optional.empty();
        }
        List<N> nodes = new ArrayList<>();
        N node = target;
        nodes.add(node);
        while (!node.equals(start)) {
            node = predecessors.get(node);
            nodes.add(node);
        }
        Collections.reverse(nodes);
        return Optional.of(new Path<>(nodes, getDistance(target)));
    }
}

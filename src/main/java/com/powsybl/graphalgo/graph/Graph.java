/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.graph;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Read-only view of an adjacency-list graph, which is what every algorithm of this library works on.
 * Queries about unknown nodes or edges never fail: they return an empty or false result.
 * <p>
 * Iteration orders are insertion orders. Algorithms rely on them for deterministic tie-breaking:
 * the first inserted neighbor of a node is always explored first.
 *
 * @param <N> node identifier type, with consistent {@code equals} and {@code hashCode}
 */
public interface Graph<N> {

    boolean isDirected();

    boolean containsNode(N node);

    boolean hasEdge(N from, N to);

    /**
     * Return the nodes of the graph in insertion order.
     */
    Set<N> getNodes();

    int getNodeCount();

    /**
     * Return the edges of the graph. For an undirected graph each edge is listed once, in the direction it was
     * first inserted.
     */
    List<Edge<N>> getEdges();

    int getEdgeCount();

    /**
     * Return the neighbors reached by the outgoing edges of the given node, in insertion order, or an empty list
     * if the node is unknown.
     */
    List<N> getNeighbors(N node);

    List<Edge<N>> getOutgoingEdges(N node);

    /**
     * Return the nodes having an edge pointing to the given node. For an undirected graph this is the same set
     * of nodes as {@link #getNeighbors}.
     */
    List<N> getIncomingNeighbors(N node);

    OptionalDouble getWeight(N from, N to);

    Degree getDegree(N node);
}

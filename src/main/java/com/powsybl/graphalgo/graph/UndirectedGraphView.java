/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.graph;

import java.util.*;

/**
 * Undirected view of a graph: the neighbors of a node are the ends of its outgoing edges followed by the origins
 * of its incoming edges. Used to compute weak connectivity of directed graphs.
 * <p>
 * Incoming edges are indexed when the view is created, so the underlying graph must not be modified while the
 * view is in use.
 *
 * @param <N> node identifier type
 */
public final class UndirectedGraphView<N> implements Graph<N> {

    private final Graph<N> delegate;

    private final Map<N, List<N>> neighbors;

    private UndirectedGraphView(Graph<N> delegate) {
        this.delegate = delegate;
        this.neighbors = new HashMap<>();
        for (N node : delegate.getNodes()) {
            neighbors.put(node, new ArrayList<>(delegate.getNeighbors(node)));
        }
        for (Edge<N> edge : delegate.getEdges()) {
            List<N> toNeighbors = neighbors.get(edge.getTo());
            if (!toNeighbors.contains(edge.getFrom())) {
                toNeighbors.add(edge.getFrom());
            }
        }
    }

    /**
     * Return an undirected view of the given graph, or the graph itself if it is already undirected.
     */
    public static <N> Graph<N> of(Graph<N> graph) {
        Objects.requireNonNull(graph);
        return graph.isDirected() ? new UndirectedGraphView<>(graph) : graph;
    }

    @Override
    public boolean isDirected() {
        return false;
    }

    @Override
    public boolean containsNode(N node) {
        return delegate.containsNode(node);
    }

    @Override
    public boolean hasEdge(N from, N to) {
        return delegate.hasEdge(from, to) || delegate.hasEdge(to, from);
    }

    @Override
    public Set<N> getNodes() {
        return delegate.getNodes();
    }

    @Override
    public int getNodeCount() {
        return delegate.getNodeCount();
    }

    /**
     * Return the edges of the underlying graph. Two opposite directed edges are both listed.
     */
    @Override
    public List<Edge<N>> getEdges() {
        return delegate.getEdges();
    }

    @Override
    public int getEdgeCount() {
        return delegate.getEdgeCount();
    }

    @Override
    public List<N> getNeighbors(N node) {
        List<N> nodeNeighbors = neighbors.get(node);
        return nodeNeighbors != null ? Collections.unmodifiableList(nodeNeighbors) : Collections.emptyList();
    }

    @Override
    public List<Edge<N>> getOutgoingEdges(N node) {
        List<Edge<N>> outgoingEdges = new ArrayList<>(delegate.getOutgoingEdges(node));
        for (N neighbor : getNeighbors(node)) {
            if (!delegate.hasEdge(node, neighbor)) {
                delegate.getOutgoingEdges(neighbor).stream()
                        .filter(e -> e.getTo().equals(node))
                        .findFirst()
                        .ifPresent(e -> outgoingEdges.add(e.reverse()));
            }
        }
        return Collections.unmodifiableList(outgoingEdges);
    }

    @Override
    public List<N> getIncomingNeighbors(N node) {
        return getNeighbors(node);
    }

    @Override
    public OptionalDouble getWeight(N from, N to) {
        OptionalDouble weight = delegate.getWeight(from, to);
        return weight.isPresent() ? weight : delegate.getWeight(to, from);
    }

    @Override
    public Degree getDegree(N node) {
        return containsNode(node) ? Degree.undirected(getNeighbors(node).size()) : Degree.ZERO;
    }
}

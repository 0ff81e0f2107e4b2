/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Mutable graph stored as an adjacency list: node to ordered list of outgoing edges.
 * <p>
 * An undirected graph is modeled by storing both arcs (u, v) and (v, u). Mutators never throw on duplicate or
 * missing entities: they report through their boolean result whether the graph changed. Self-loops are rejected
 * the same way.
 *
 * @param <N> node identifier type
 */
public class AdjacencyListGraph<N> implements Graph<N> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdjacencyListGraph.class);

    private final boolean directed;

    private final Map<N, List<Edge<N>>> adjacencyList = new LinkedHashMap<>();

    /**
     * Edges in insertion order, each undirected edge being stored once.
     */
    private final List<Edge<N>> edges = new ArrayList<>();

    public AdjacencyListGraph(boolean directed) {
        this.directed = directed;
    }

    public static <N> AdjacencyListGraph<N> directed() {
        return new AdjacencyListGraph<>(true);
    }

    public static <N> AdjacencyListGraph<N> undirected() {
        return new AdjacencyListGraph<>(false);
    }

    @Override
    public boolean isDirected() {
        return directed;
    }

    /**
     * Add a node to the graph.
     *
     * @return true if the node has been inserted, false if it was already in the graph
     */
    public boolean addNode(N node) {
        Objects.requireNonNull(node);
        if (adjacencyList.containsKey(node)) {
            return false;
        }
        adjacencyList.put(node, new ArrayList<>());
        return true;
    }

    public boolean addEdge(N from, N to) {
        return addEdge(from, to, Edge.DEFAULT_WEIGHT);
    }

    /**
     * Add an edge, inserting its ends if needed. A duplicate edge is rejected, whatever its weight, and so is a
     * self-loop.
     *
     * @return true if the edge has been inserted
     */
    public boolean addEdge(N from, N to, double weight) {
        Edge<N> edge = new Edge<>(from, to, weight);
        if (from.equals(to)) {
            LOGGER.debug("Self-loop on node {} rejected", from);
            return false;
        }
        addNode(from);
        addNode(to);
        if (hasEdge(from, to)) {
            LOGGER.debug("Edge {} -> {} already exists, ignored", from, to);
            return false;
        }
        adjacencyList.get(from).add(edge);
        if (!directed) {
            adjacencyList.get(to).add(edge.reverse());
        }
        edges.add(edge);
        return true;
    }

    /**
     * Remove an edge. For an undirected graph both arcs are removed.
     *
     * @return true if an edge has been removed
     */
    public boolean removeEdge(N from, N to) {
        Objects.requireNonNull(from);
        Objects.requireNonNull(to);
        if (!hasEdge(from, to)) {
            LOGGER.debug("Edge {} -> {} not found, cannot be removed", from, to);
            return false;
        }
        removeArc(from, to);
        if (!directed) {
            removeArc(to, from);
        }
        edges.removeIf(e -> isEdgeBetween(e, from, to));
        return true;
    }

    /**
     * Remove a node and purge every edge referencing it, scanning all adjacency lists.
     *
     * @return true if the node has been removed
     */
    public boolean removeNode(N node) {
        Objects.requireNonNull(node);
        if (adjacencyList.remove(node) == null) {
            LOGGER.debug("Node {} not found, cannot be removed", node);
            return false;
        }
        for (List<Edge<N>> outgoingEdges : adjacencyList.values()) {
            outgoingEdges.removeIf(e -> e.getTo().equals(node));
        }
        edges.removeIf(e -> e.getFrom().equals(node) || e.getTo().equals(node));
        return true;
    }

    private void removeArc(N from, N to) {
        adjacencyList.get(from).removeIf(e -> e.getTo().equals(to));
    }

    private boolean isEdgeBetween(Edge<N> edge, N from, N to) {
        if (edge.getFrom().equals(from) && edge.getTo().equals(to)) {
            return true;
        }
        return !directed && edge.getFrom().equals(to) && edge.getTo().equals(from);
    }

    private Optional<Edge<N>> findArc(N from, N to) {
        List<Edge<N>> outgoingEdges = adjacencyList.get(from);
        if (outgoingEdges == null) {
            return Optional.empty();
        }
        return outgoingEdges.stream().filter(e -> e.getTo().equals(to)).findFirst();
    }

    @Override
    public boolean containsNode(N node) {
        return node != null && adjacencyList.containsKey(node);
    }

    @Override
    public boolean hasEdge(N from, N to) {
        return findArc(from, to).isPresent();
    }

    @Override
    public Set<N> getNodes() {
        return Collections.unmodifiableSet(adjacencyList.keySet());
    }

    @Override
    public int getNodeCount() {
        return adjacencyList.size();
    }

    @Override
    public List<Edge<N>> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    @Override
    public int getEdgeCount() {
        return edges.size();
    }

    @Override
    public List<N> getNeighbors(N node) {
        List<Edge<N>> outgoingEdges = adjacencyList.get(node);
        if (outgoingEdges == null) {
            return Collections.emptyList();
        }
        List<N> neighbors = new ArrayList<>(outgoingEdges.size());
        for (Edge<N> edge : outgoingEdges) {
            neighbors.add(edge.getTo());
        }
        return Collections.unmodifiableList(neighbors);
    }

    @Override
    public List<Edge<N>> getOutgoingEdges(N node) {
        List<Edge<N>> outgoingEdges = adjacencyList.get(node);
        return outgoingEdges != null ? Collections.unmodifiableList(outgoingEdges) : Collections.emptyList();
    }

    @Override
    public List<N> getIncomingNeighbors(N node) {
        if (!containsNode(node)) {
            return Collections.emptyList();
        }
        if (!directed) {
            return getNeighbors(node);
        }
        List<N> incoming = new ArrayList<>();
        for (Map.Entry<N, List<Edge<N>>> e : adjacencyList.entrySet()) {
            for (Edge<N> edge : e.getValue()) {
                if (edge.getTo().equals(node)) {
                    incoming.add(e.getKey());
                }
            }
        }
        return Collections.unmodifiableList(incoming);
    }

    @Override
    public OptionalDouble getWeight(N from, N to) {
        return findArc(from, to)
                .map(e -> OptionalDouble.of(e.getWeight()))
                .orElse(OptionalDouble.empty());
    }

    @Override
    public Degree getDegree(N node) {
        if (!containsNode(node)) {
            return Degree.ZERO;
        }
        int out = adjacencyList.get(node).size();
        if (!directed) {
            return Degree.undirected(out);
        }
        return Degree.directed(getIncomingNeighbors(node).size(), out);
    }

    @Override
    public String toString() {
        if (adjacencyList.isEmpty()) {
            return "Empty graph";
        }
        StringBuilder builder = new StringBuilder(directed ? "Directed graph:" : "Undirected graph:");
        adjacencyList.forEach((node, outgoingEdges) -> builder.append(System.lineSeparator())
                .append("  ").append(node).append(" -> ").append(outgoingEdges.stream().map(Edge::getTo).toList()));
        return builder.toString();
    }
}

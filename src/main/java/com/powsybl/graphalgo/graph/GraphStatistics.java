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
 * Basic figures about a graph: size, density, degrees and particular nodes.
 *
 * @param <N> node identifier type
 */
public final class GraphStatistics<N> {

    private final int nodeCount;

    private final int edgeCount;

    private final double density;

    private final double averageDegree;

    private final List<N> isolatedNodes;

    private final List<N> sourceNodes;

    private final List<N> sinkNodes;

    private GraphStatistics(int nodeCount, int edgeCount, double density, double averageDegree,
                            List<N> isolatedNodes, List<N> sourceNodes, List<N> sinkNodes) {
        this.nodeCount = nodeCount;
        this.edgeCount = edgeCount;
        this.density = density;
        this.averageDegree = averageDegree;
        this.isolatedNodes = Collections.unmodifiableList(isolatedNodes);
        this.sourceNodes = Collections.unmodifiableList(sourceNodes);
        this.sinkNodes = Collections.unmodifiableList(sinkNodes);
    }

    public static <N> GraphStatistics<N> of(Graph<N> graph) {
        Objects.requireNonNull(graph);
        int nodeCount = graph.getNodeCount();
        int edgeCount = graph.getEdgeCount();

        // an undirected edge links an unordered pair, hence twice fewer possible edges
        double density = 0;
        if (nodeCount > 1) {
            double possibleEdges = (double) nodeCount * (nodeCount - 1);
            density = graph.isDirected() ? edgeCount / possibleEdges : 2 * edgeCount / possibleEdges;
        }
        double averageDegree = nodeCount > 0 ? 2.0 * edgeCount / nodeCount : 0;

        List<N> isolatedNodes = new ArrayList<>();
        List<N> sourceNodes = new ArrayList<>();
        List<N> sinkNodes = new ArrayList<>();
        computeDegrees(graph).forEach((node, degree) -> {
            if (degree.getTotal() == 0) {
                isolatedNodes.add(node);
            }
            if (degree.getIn() == 0) {
                sourceNodes.add(node);
            }
            if (degree.getOut() == 0) {
                sinkNodes.add(node);
            }
        });
        return new GraphStatistics<>(nodeCount, edgeCount, density, averageDegree, isolatedNodes, sourceNodes, sinkNodes);
    }

    /**
     * Return the most connected nodes, by decreasing total degree. Nodes with the same degree keep their
     * insertion order.
     */
    public static <N> List<N> getHubs(Graph<N> graph, int topN) {
        Objects.requireNonNull(graph);
        if (topN < 0) {
            throw new IllegalArgumentException("Hub count should be >= 0: " + topN);
        }
        Map<N, Degree> degrees = computeDegrees(graph);
        return degrees.keySet().stream()
                .sorted(Comparator.comparingInt((N node) -> degrees.get(node).getTotal()).reversed())
                .limit(topN)
                .toList();
    }

    /**
     * Compute the degree of every node in a single pass over the adjacency lists, nodes being in insertion order.
     */
    static <N> Map<N, Degree> computeDegrees(Graph<N> graph) {
        Map<N, Integer> inDegrees = new HashMap<>();
        for (N node : graph.getNodes()) {
            for (Edge<N> edge : graph.getOutgoingEdges(node)) {
                inDegrees.merge(edge.getTo(), 1, Integer::sum);
            }
        }
        Map<N, Degree> degrees = new LinkedHashMap<>();
        for (N node : graph.getNodes()) {
            int out = graph.getOutgoingEdges(node).size();
            degrees.put(node, graph.isDirected() ? Degree.directed(inDegrees.getOrDefault(node, 0), out) : Degree.undirected(out));
        }
        return degrees;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public int getEdgeCount() {
        return edgeCount;
    }

    public double getDensity() {
        return density;
    }

    public double getAverageDegree() {
        return averageDegree;
    }

    public List<N> getIsolatedNodes() {
        return isolatedNodes;
    }

    /**
     * Nodes without incoming edges.
     */
    public List<N> getSourceNodes() {
        return sourceNodes;
    }

    /**
     * Nodes without outgoing edges.
     */
    public List<N> getSinkNodes() {
        return sinkNodes;
    }

    @Override
    public String toString() {
        return "GraphStatistics(nodeCount=" + nodeCount
                + ", edgeCount=" + edgeCount
                + ", density=" + density
                + ", averageDegree=" + averageDegree
                + ", isolatedNodes=" + isolatedNodes
                + ")";
    }
}

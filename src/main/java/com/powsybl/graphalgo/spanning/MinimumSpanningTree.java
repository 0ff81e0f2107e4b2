/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.spanning;

import com.powsybl.graphalgo.connectivity.UnionFind;
import com.powsybl.graphalgo.graph.Edge;
import com.powsybl.graphalgo.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Minimum spanning trees of undirected weighted graphs.
 */
public final class MinimumSpanningTree {

    private static final Logger LOGGER = LoggerFactory.getLogger(MinimumSpanningTree.class);

    private record QueueEntry<N>(Edge<N> edge, long sequence) {
    }

    private MinimumSpanningTree() {
    }

    private static void checkUndirected(Graph<?> graph) {
        Objects.requireNonNull(graph);
        if (graph.isDirected()) {
            throw new IllegalArgumentException("Minimum spanning tree requires an undirected graph");
        }
    }

    /**
     * Kruskal's algorithm: edges are taken by increasing weight and kept when they join two different trees.
     * Edges of equal weight are taken in insertion order. On a disconnected graph, a minimum spanning forest is
     * returned.
     */
    public static <N> SpanningTree<N> kruskal(Graph<N> graph) {
        checkUndirected(graph);
        List<Edge<N>> sortedEdges = new ArrayList<>(graph.getEdges());
        sortedEdges.sort(Comparator.comparingDouble(Edge::getWeight));
        UnionFind<N> forest = new UnionFind<>(graph.getNodes());
        List<Edge<N>> treeEdges = new ArrayList<>();
        for (Edge<N> edge : sortedEdges) {
            if (forest.union(edge.getFrom(), edge.getTo())) {
                treeEdges.add(edge);
                if (forest.getComponentCount() == 1) {
                    break;
                }
            }
        }
        SpanningTree<N> tree = new SpanningTree<>(treeEdges);
        LOGGER.debug("Kruskal spanning forest: {} edges, {} trees, weight {}", tree.getEdgeCount(),
                forest.getComponentCount(), tree.getTotalWeight());
        return tree;
    }

    /**
     * Prim's algorithm: the tree is grown from the start node, adding at each step the lightest edge leaving it.
     * Only the component of the start node is covered.
     */
    public static <N> SpanningTree<N> prim(Graph<N> graph, N start) {
        checkUndirected(graph);
        Objects.requireNonNull(start);
        List<Edge<N>> treeEdges = new ArrayList<>();
        if (!graph.containsNode(start)) {
            return new SpanningTree<>(treeEdges);
        }
        Set<N> inTree = new HashSet<>();
        PriorityQueue<QueueEntry<N>> queue = new PriorityQueue<>(Comparator.<QueueEntry<N>>comparingDouble(e -> e.edge().getWeight())
                .thenComparingLong(QueueEntry::sequence));
        long sequence = 0;
        inTree.add(start);
        for (Edge<N> edge : graph.getOutgoingEdges(start)) {
            queue.add(new QueueEntry<>(edge, sequence++));
        }
        while (!queue.isEmpty()) {
            Edge<N> edge = queue.poll().edge();
            N node = edge.getTo();
            if (!inTree.add(node)) {
                continue;
            }
            treeEdges.add(edge);
            for (Edge<N> next : graph.getOutgoingEdges(node)) {
                if (!inTree.contains(next.getTo())) {
                    queue.add(new QueueEntry<>(next, sequence++));
                }
            }
        }
        SpanningTree<N> tree = new SpanningTree<>(treeEdges);
        LOGGER.debug("Prim spanning tree from {}: {} edges, weight {}", start, tree.getEdgeCount(), tree.getTotalWeight());
        return tree;
    }
}

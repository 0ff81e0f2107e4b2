/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.connectivity;

import com.google.common.base.Stopwatch;
import com.powsybl.graphalgo.graph.Edge;
import com.powsybl.graphalgo.graph.Graph;
import com.powsybl.graphalgo.graph.UndirectedGraphView;
import com.powsybl.graphalgo.traversal.BreadthFirstSearch;
import com.powsybl.graphalgo.traversal.DepthFirstSearch;
import com.powsybl.graphalgo.traversal.DfsStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Connected components computation.
 * <p>
 * Edge directions are ignored: on a directed graph the components found are the weakly connected ones, whatever
 * the algorithm. Components are ordered by their first node in graph insertion order.
 */
public final class ComponentFinder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ComponentFinder.class);

    private ComponentFinder() {
    }

    public static <N> List<Set<N>> findComponents(Graph<N> graph) {
        return findComponents(graph, ComponentAlgorithm.DFS);
    }

    public static <N> List<Set<N>> findComponents(Graph<N> graph, ComponentAlgorithm algorithm) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(algorithm);
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<Set<N>> components = switch (algorithm) {
            case DFS, BFS -> findComponentsByTraversal(graph, algorithm);
            case UNION_FIND -> findComponentsByUnionFind(graph);
        };
        LOGGER.debug("{} connected components found by {} in {} ms", components.size(), algorithm,
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return components;
    }

    private static <N> List<Set<N>> findComponentsByTraversal(Graph<N> graph, ComponentAlgorithm algorithm) {
        Graph<N> undirectedGraph = UndirectedGraphView.of(graph);
        List<Set<N>> components = new ArrayList<>();
        Set<N> assigned = new HashSet<>();
        for (N node : graph.getNodes()) {
            if (!assigned.contains(node)) {
                List<N> reached = algorithm == ComponentAlgorithm.BFS
                        ? BreadthFirstSearch.traverse(undirectedGraph, node)
                        : DepthFirstSearch.traverse(undirectedGraph, node, DfsStrategy.ITERATIVE);
                assigned.addAll(reached);
                components.add(new LinkedHashSet<>(reached));
            }
        }
        return components;
    }

    private static <N> List<Set<N>> findComponentsByUnionFind(Graph<N> graph) {
        UnionFind<N> unionFind = new UnionFind<>(graph.getNodes());
        for (Edge<N> edge : graph.getEdges()) {
            unionFind.union(edge.getFrom(), edge.getTo());
        }
        return unionFind.getComponents();
    }

    /**
     * Return true if all nodes are in the same component. The empty graph is considered connected.
     */
    public static <N> boolean isConnected(Graph<N> graph) {
        Objects.requireNonNull(graph);
        if (graph.getNodeCount() == 0) {
            return true;
        }
        N first = graph.getNodes().iterator().next();
        return BreadthFirstSearch.traverse(UndirectedGraphView.of(graph), first).size() == graph.getNodeCount();
    }
}

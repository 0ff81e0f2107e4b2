/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo;

import com.powsybl.graphalgo.connectivity.ComponentFinder;
import com.powsybl.graphalgo.cycle.CycleDetector;
import com.powsybl.graphalgo.graph.Graph;
import com.powsybl.graphalgo.path.DijkstraShortestPath;
import com.powsybl.graphalgo.path.Path;
import com.powsybl.graphalgo.path.PathFinder;
import com.powsybl.graphalgo.path.ShortestPathTree;
import com.powsybl.graphalgo.sort.TopologicalSortResult;
import com.powsybl.graphalgo.sort.TopologicalSorter;
import com.powsybl.graphalgo.traversal.BreadthFirstSearch;
import com.powsybl.graphalgo.traversal.DepthFirstSearch;
import com.powsybl.graphalgo.traversal.TraversalListener;
import com.powsybl.graphalgo.traversal.TraversalListenerTracer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point running the algorithms with the behavior configured once in a {@link GraphAlgorithmParameters}.
 * <p>
 * When {@link GraphAlgorithmParameters#isTraceSteps()} is set, every step of traversals and shortest path
 * computations is logged at trace level.
 */
public class GraphAlgorithms {

    private final GraphAlgorithmParameters parameters;

    public GraphAlgorithms() {
        this(new GraphAlgorithmParameters());
    }

    public GraphAlgorithms(GraphAlgorithmParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public GraphAlgorithmParameters getParameters() {
        return parameters;
    }

    private <N> TraversalListener<N> createListener() {
        TraversalListener<N> listener = TraversalListener.noOp();
        return parameters.isTraceSteps() ? TraversalListenerTracer.trace(listener) : listener;
    }

    public <N> List<N> breadthFirstSearch(Graph<N> graph, N start) {
        return BreadthFirstSearch.traverse(graph, start, createListener());
    }

    public <N> List<N> depthFirstSearch(Graph<N> graph, N start) {
        return DepthFirstSearch.traverse(graph, start, parameters.getDfsStrategy(), createListener());
    }

    public <N> Optional<Path<N>> shortestPath(Graph<N> graph, N start, N target) {
        return PathFinder.shortestPath(graph, start, target);
    }

    public <N> Optional<Path<N>> anyPath(Graph<N> graph, N start, N target) {
        return PathFinder.anyPath(graph, start, target, parameters.getDfsStrategy());
    }

    public <N> List<Path<N>> allPaths(Graph<N> graph, N start, N target) {
        int maxPathEdges = parameters.getMaxPathEdges();
        return maxPathEdges < 0 ? PathFinder.allPaths(graph, start, target)
                                : PathFinder.allPaths(graph, start, target, maxPathEdges);
    }

    public <N> Optional<Path<N>> shortestWeightedPath(Graph<N> graph, N start, N target) {
        return new DijkstraShortestPath<>(graph, this.<N>createListener()).computePath(start, target);
    }

    public <N> ShortestPathTree<N> shortestPathTree(Graph<N> graph, N start) {
        return new DijkstraShortestPath<>(graph, this.<N>createListener()).computeAll(start);
    }

    public <N> boolean hasCycle(Graph<N> graph) {
        return CycleDetector.hasCycle(graph, parameters.getDfsStrategy());
    }

    public <N> Optional<List<N>> findCycle(Graph<N> graph) {
        return CycleDetector.findCycle(graph, parameters.getDfsStrategy());
    }

    public <N> List<Set<N>> findComponents(Graph<N> graph) {
        return ComponentFinder.findComponents(graph, parameters.getComponentAlgorithm());
    }

    public <N> TopologicalSortResult<N> topologicalSort(Graph<N> graph) {
        return TopologicalSorter.sort(graph);
    }
}

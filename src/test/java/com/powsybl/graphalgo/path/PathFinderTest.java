/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.path;

import com.google.common.testing.EqualsTester;
import com.powsybl.graphalgo.GraphFixtures;
import com.powsybl.graphalgo.graph.AdjacencyListGraph;
import com.powsybl.graphalgo.traversal.BreadthFirstSearch;
import com.powsybl.graphalgo.traversal.DfsStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unweighted path finding: shortest path, avoided nodes, any path and path enumeration.
 */
class PathFinderTest {

    private static AdjacencyListGraph<Integer> createGraph() {
        AdjacencyListGraph<Integer> graph = AdjacencyListGraph.directed();
        graph.addEdge(0, 1);
        graph.addEdge(1, 2);
        graph.addEdge(0, 3);
        graph.addEdge(3, 4);
        return graph;
    }

    @Test
    void testShortestPath() {
        Path<Integer> path = PathFinder.shortestPath(createGraph(), 0, 4).orElseThrow();
        assertEquals(List.of(0, 3, 4), path.getNodes());
        assertEquals(2, path.getLength());
        assertEquals(2.0, path.getWeight());
        assertEquals(0, path.getStart());
        assertEquals(4, path.getEnd());
    }

    @Test
    void testNoPathIsNotEmptyPath() {
        AdjacencyListGraph<Integer> graph = createGraph();
        assertTrue(PathFinder.shortestPath(graph, 4, 0).isEmpty());
        assertTrue(PathFinder.shortestPath(graph, 0, 99).isEmpty());
        Path<Integer> path = PathFinder.shortestPath(graph, 2, 2).orElseThrow();
        assertEquals(List.of(2), path.getNodes());
        assertEquals(0, path.getLength());
        assertEquals(0.0, path.getWeight());
    }

    @Test
    void testShortestPathAvoiding() {
        AdjacencyListGraph<String> graph = AdjacencyListGraph.undirected();
        graph.addEdge("A", "B");
        graph.addEdge("B", "E");
        graph.addEdge("A", "C");
        graph.addEdge("C", "D");
        graph.addEdge("D", "E");
        assertEquals(List.of("A", "B", "E"), PathFinder.shortestPath(graph, "A", "E").orElseThrow().getNodes());
        assertEquals(List.of("A", "C", "D", "E"),
                     PathFinder.shortestPathAvoiding(graph, "A", "E", Set.of("B")).orElseThrow().getNodes());
        assertTrue(PathFinder.shortestPathAvoiding(graph, "A", "E", Set.of("B", "D")).isEmpty());
        assertTrue(PathFinder.shortestPathAvoiding(graph, "A", "E", Set.of("E")).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(DfsStrategy.class)
    void testAnyPath(DfsStrategy strategy) {
        AdjacencyListGraph<Integer> graph = createGraph();
        graph.addEdge(2, 4);
        // depth first search follows 0 -> 1 -> 2 before trying 3
        assertEquals(List.of(0, 1, 2, 4), PathFinder.anyPath(graph, 0, 4, strategy).orElseThrow().getNodes());
        assertTrue(PathFinder.anyPath(graph, 4, 0, strategy).isEmpty());
        assertEquals(List.of(1), PathFinder.anyPath(graph, 1, 1, strategy).orElseThrow().getNodes());
    }

    @Test
    void testAllPaths() {
        AdjacencyListGraph<String> graph = GraphFixtures.createWeightedDiamond();
        graph.addEdge("B", "C", 1);
        List<Path<String>> paths = PathFinder.allPaths(graph, "A", "D");
        assertEquals(List.of(List.of("A", "B", "D"), List.of("A", "B", "C", "D"), List.of("A", "C", "D")),
                     paths.stream().map(Path::getNodes).toList());
        assertEquals(List.of(9.0, 13.0, 10.0), paths.stream().map(Path::getWeight).toList());

        assertEquals(2, PathFinder.allPaths(graph, "A", "D", 2).size());
        assertTrue(PathFinder.allPaths(graph, "A", "D", 1).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> PathFinder.allPaths(graph, "A", "D", -1));
    }

    @Test
    void testAllPathsWithCycles() {
        AdjacencyListGraph<Integer> graph = AdjacencyListGraph.undirected();
        graph.addEdge(0, 1);
        graph.addEdge(1, 2);
        graph.addEdge(2, 0);
        graph.addEdge(2, 3);
        List<Path<Integer>> paths = PathFinder.allPaths(graph, 0, 3);
        assertEquals(List.of(List.of(0, 1, 2, 3), List.of(0, 2, 3)), paths.stream().map(Path::getNodes).toList());
        for (Path<Integer> path : paths) {
            assertEquals(path.getNodes().size(), new HashSet<>(path.getNodes()).size());
        }
    }

    @Test
    void testShortestPathLengthIsMinimal() {
        AdjacencyListGraph<Integer> graph = GraphFixtures.createRandom(11, true, 9, 0.25);
        for (Integer start : graph.getNodes()) {
            Map<Integer, Integer> distances = BreadthFirstSearch.distances(graph, start);
            for (Integer target : graph.getNodes()) {
                Optional<Path<Integer>> path = PathFinder.shortestPath(graph, start, target);
                OptionalInt bruteForceLength = PathFinder.allPaths(graph, start, target).stream()
                        .mapToInt(Path::getLength)
                        .min();
                assertEquals(bruteForceLength.isPresent(), path.isPresent());
                if (path.isPresent()) {
                    assertEquals(bruteForceLength.getAsInt(), path.get().getLength());
                    assertEquals(distances.get(target), path.get().getLength());
                }
            }
        }
    }

    @Test
    void testPath() {
        AdjacencyListGraph<String> graph = GraphFixtures.createWeightedDiamond();
        assertEquals(9.0, Path.of(graph, List.of("A", "B", "D")).getWeight());
        assertThrows(IllegalArgumentException.class, () -> Path.of(graph, List.of("A", "D")));
        assertThrows(IllegalArgumentException.class, () -> new Path<>(List.of(), 0));
        assertEquals("[A, B, D] (9.0)", Path.of(graph, List.of("A", "B", "D")).toString());
        new EqualsTester()
                .addEqualityGroup(new Path<>(List.of("A", "B"), 1), new Path<>(new ArrayList<>(List.of("A", "B")), 1))
                .addEqualityGroup(new Path<>(List.of("A", "B"), 2))
                .addEqualityGroup(new Path<>(List.of("B", "A"), 1))
                .testEquals();
    }
}

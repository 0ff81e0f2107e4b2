/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.path;

import com.powsybl.graphalgo.GraphFixtures;
import com.powsybl.graphalgo.NegativeWeightException;
import com.powsybl.graphalgo.graph.AdjacencyListGraph;
import com.powsybl.graphalgo.graph.Edge;
import com.powsybl.graphalgo.graph.JGraphTConverter;
import com.powsybl.graphalgo.traversal.AbstractTraversalListener;
import org.jgrapht.alg.interfaces.ShortestPathAlgorithm;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Weighted shortest paths, checked against JGraphT Dijkstra implementation.
 */
class DijkstraShortestPathTest {

    private static final Logger LOGGER = LoggerFactory.getLogger(DijkstraShortestPathTest.class);

    private static final double EPSILON = 1e-9;

    @Test
    void testShortestPath() {
        DijkstraShortestPath<String> dijkstra = new DijkstraShortestPath<>(GraphFixtures.createWeightedDiamond());
        Path<String> path = dijkstra.computePath("A", "D").orElseThrow();
        assertEquals(List.of("A", "B", "D"), path.getNodes());
        assertEquals(9.0, path.getWeight(), EPSILON);
    }

    @Test
    void testShortestPathTree() {
        ShortestPathTree<String> tree = new DijkstraShortestPath<>(GraphFixtures.createWeightedDiamond()).computeAll("A");
        assertEquals("A", tree.getStart());
        assertEquals(0.0, tree.getDistance("A"), EPSILON);
        assertEquals(4.0, tree.getDistance("B"), EPSILON);
        assertEquals(2.0, tree.getDistance("C"), EPSILON);
        assertEquals(9.0, tree.getDistance("D"), EPSILON);
        assertEquals(List.of("A", "C", "B", "D"), List.copyOf(tree.getDistances().keySet()));
        assertEquals(Optional.of("B"), tree.getPredecessor("D"));
        assertEquals(Optional.empty(), tree.getPredecessor("A"));
        assertEquals(List.of("A"), tree.getPath("A").orElseThrow().getNodes());
    }

    @Test
    void testUnreachable() {
        AdjacencyListGraph<String> graph = GraphFixtures.createWeightedDiamond();
        graph.addNode("E");
        DijkstraShortestPath<String> dijkstra = new DijkstraShortestPath<>(graph);
        ShortestPathTree<String> tree = dijkstra.computeAll("A");
        assertFalse(tree.isReachable("E"));
        assertEquals(Double.POSITIVE_INFINITY, tree.getDistance("E"));
        assertTrue(tree.getPath("E").isEmpty());
        assertTrue(dijkstra.computePath("D", "A").isEmpty());
        assertTrue(dijkstra.computePath("A", "Z").isEmpty());
    }

    @Test
    void testImprovedDistance() {
        // B is first reached through a heavy edge, then improved through C
        AdjacencyListGraph<String> graph = AdjacencyListGraph.directed();
        graph.addEdge("A", "B", 10);
        graph.addEdge("A", "C", 1);
        graph.addEdge("C", "B", 2);
        graph.addEdge("B", "D", 1);
        List<String> relaxations = new ArrayList<>();
        DijkstraShortestPath<String> dijkstra = new DijkstraShortestPath<>(graph, new AbstractTraversalListener<String>() {
            @Override
            public void onEdgeRelaxed(String from, String to, double distance) {
                relaxations.add(from + "->" + to + "=" + distance);
            }
        });
        Path<String> path = dijkstra.computePath("A", "D").orElseThrow();
        assertEquals(List.of("A", "C", "B", "D"), path.getNodes());
        assertEquals(4.0, path.getWeight(), EPSILON);
        assertEquals(List.of("A->B=10.0", "A->C=1.0", "C->B=3.0", "B->D=4.0"), relaxations);
    }

    @Test
    void testNegativeWeightRejected() {
        AdjacencyListGraph<String> graph = GraphFixtures.createWeightedDiamond();
        graph.addEdge("D", "E", -1);
        NegativeWeightException e = assertThrows(NegativeWeightException.class, () -> new DijkstraShortestPath<>(graph));
        assertEquals(new Edge<>("D", "E", -1), e.getEdge());
        assertEquals("Negative weight -1.0 on edge D -> E, shortest paths cannot be computed", e.getMessage());
    }

    @Test
    void testNegativeWeightAddedAfterCreation() {
        AdjacencyListGraph<String> graph = AdjacencyListGraph.directed();
        graph.addEdge("A", "B", 1);
        graph.addEdge("A", "C", 5);
        DijkstraShortestPath<String> dijkstra = new DijkstraShortestPath<>(graph);
        assertEquals(1.0, dijkstra.computeAll("A").getDistance("B"));

        graph.addEdge("C", "B", -10);
        NegativeWeightException e = assertThrows(NegativeWeightException.class, () -> dijkstra.computeAll("A"));
        assertEquals(new Edge<>("C", "B", -10), e.getEdge());
        assertThrows(NegativeWeightException.class, () -> dijkstra.computePath("A", "B"));
    }

    @Test
    void testUnitWeightsMatchBreadthFirstSearch() {
        AdjacencyListGraph<Integer> graph = AdjacencyListGraph.directed();
        AdjacencyListGraph<Integer> weighted = GraphFixtures.createRandom(5, true, 30, 0.1);
        weighted.getEdges().forEach(e -> graph.addEdge(e.getFrom(), e.getTo()));
        weighted.getNodes().forEach(graph::addNode);
        DijkstraShortestPath<Integer> dijkstra = new DijkstraShortestPath<>(graph);
        for (Integer target : graph.getNodes()) {
            Optional<Path<Integer>> bfsPath = PathFinder.shortestPath(graph, 0, target);
            Optional<Path<Integer>> dijkstraPath = dijkstra.computePath(0, target);
            assertEquals(bfsPath.isPresent(), dijkstraPath.isPresent());
            if (bfsPath.isPresent()) {
                assertEquals(bfsPath.get().getLength(), dijkstraPath.get().getWeight(), EPSILON);
            }
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 4, 5})
    void testAgainstJGraphT(long seed) {
        for (boolean directed : new boolean[] {true, false}) {
            AdjacencyListGraph<Integer> graph = GraphFixtures.createRandom(seed, directed, 40, 0.1);
            ShortestPathAlgorithm.SingleSourcePaths<Integer, DefaultWeightedEdge> reference
                    = new org.jgrapht.alg.shortestpath.DijkstraShortestPath<>(JGraphTConverter.toJGraphT(graph)).getPaths(0);
            ShortestPathTree<Integer> tree = new DijkstraShortestPath<>(graph).computeAll(0);
            for (Integer target : graph.getNodes()) {
                assertEquals(reference.getWeight(target), tree.getDistance(target), EPSILON);
                tree.getPath(target).ifPresent(path -> assertEquals(path.getWeight(), Path.of(graph, path.getNodes()).getWeight(), EPSILON));
            }
            LOGGER.info("Seed {}, directed {}: {} reachable nodes", seed, directed, tree.getDistances().size());
        }
    }

    @Test
    void testEarlyExitGivesSameCost() {
        AdjacencyListGraph<Integer> graph = GraphFixtures.createRandom(8, false, 30, 0.15);
        DijkstraShortestPath<Integer> dijkstra = new DijkstraShortestPath<>(graph);
        ShortestPathTree<Integer> tree = dijkstra.computeAll(0);
        for (Integer target : graph.getNodes()) {
            double expected = tree.getDistance(target);
            dijkstra.computePath(0, target).ifPresentOrElse(
                path -> assertEquals(expected, path.getWeight(), EPSILON),
                () -> assertEquals(Double.POSITIVE_INFINITY, expected));
        }
    }

    @Test
    void testWeightFunction() {
        AdjacencyListGraph<String> flights = AdjacencyListGraph.directed();
        flights.addEdge("PAR", "LON", 340);
        flights.addEdge("LON", "NYC", 5570);
        flights.addEdge("PAR", "NYC", 5840);
        Map<String, Double> prices = Map.of("PAR-LON", 80.0, "LON-NYC", 400.0, "PAR-NYC", 600.0);
        ToDoubleFunction<Edge<String>> price = edge -> prices.get(edge.getFrom() + "-" + edge.getTo());

        Path<String> shortest = new DijkstraShortestPath<>(flights).computePath("PAR", "NYC").orElseThrow();
        assertEquals(List.of("PAR", "NYC"), shortest.getNodes());
        assertEquals(5840.0, shortest.getWeight(), EPSILON);

        Path<String> cheapest = new DijkstraShortestPath<>(flights, price).computePath("PAR", "NYC").orElseThrow();
        assertEquals(List.of("PAR", "LON", "NYC"), cheapest.getNodes());
        assertEquals(480.0, cheapest.getWeight(), EPSILON);

        NegativeWeightException e = assertThrows(NegativeWeightException.class,
                () -> new DijkstraShortestPath<>(flights, edge -> -price.applyAsDouble(edge)));
        assertEquals(new Edge<>("PAR", "LON", -80.0), e.getEdge());
        assertThrows(IllegalArgumentException.class, () -> new DijkstraShortestPath<>(flights, edge -> Double.NaN));
    }
}

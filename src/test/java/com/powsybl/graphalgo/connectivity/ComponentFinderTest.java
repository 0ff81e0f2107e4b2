/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.connectivity;

import com.powsybl.graphalgo.GraphFixtures;
import com.powsybl.graphalgo.graph.AdjacencyListGraph;
import com.powsybl.graphalgo.graph.JGraphTConverter;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.*;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Component finding with every algorithm, checked against JGraphT connectivity inspector.
 */
class ComponentFinderTest {

    @ParameterizedTest
    @EnumSource(ComponentAlgorithm.class)
    void testTwoComponents(ComponentAlgorithm algorithm) {
        List<Set<Integer>> components = ComponentFinder.findComponents(GraphFixtures.createTwoComponents(), algorithm);
        assertEquals(List.of(Set.of(0, 1, 2), Set.of(3, 4)), components);
    }

    @ParameterizedTest
    @EnumSource(ComponentAlgorithm.class)
    void testDirectedGraphGivesWeakComponents(ComponentAlgorithm algorithm) {
        // 1 cannot reach 0 nor 2 following edge directions, but all three are weakly connected
        AdjacencyListGraph<Integer> graph = AdjacencyListGraph.directed();
        graph.addEdge(0, 1);
        graph.addEdge(2, 1);
        graph.addEdge(3, 4);
        graph.addNode(5);
        assertEquals(List.of(Set.of(0, 1, 2), Set.of(3, 4), Set.of(5)), ComponentFinder.findComponents(graph, algorithm));
    }

    @Test
    void testMembersInDiscoveryOrder() {
        AdjacencyListGraph<String> graph = AdjacencyListGraph.undirected();
        graph.addEdge("A", "C");
        graph.addEdge("A", "B");
        graph.addEdge("C", "D");
        assertEquals(List.of("A", "C", "D", "B"), List.copyOf(ComponentFinder.findComponents(graph, ComponentAlgorithm.DFS).get(0)));
        assertEquals(List.of("A", "C", "B", "D"), List.copyOf(ComponentFinder.findComponents(graph, ComponentAlgorithm.BFS).get(0)));
    }

    private static Stream<Arguments> getRandomGraphs() {
        return Stream.of(
                Arguments.of(1L, false, 0.02),
                Arguments.of(2L, false, 0.05),
                Arguments.of(3L, true, 0.02),
                Arguments.of(4L, true, 0.04));
    }

    @ParameterizedTest
    @MethodSource("getRandomGraphs")
    void testAlgorithmsAgree(long seed, boolean directed, double edgeProbability) {
        AdjacencyListGraph<Integer> graph = GraphFixtures.createRandom(seed, directed, 60, edgeProbability);
        Set<Set<Integer>> reference = new HashSet<>(new ConnectivityInspector<>(JGraphTConverter.toJGraphT(graph)).connectedSets());
        for (ComponentAlgorithm algorithm : ComponentAlgorithm.values()) {
            List<Set<Integer>> components = ComponentFinder.findComponents(graph, algorithm);
            assertEquals(reference, new HashSet<>(components));
            // components partition the nodes
            assertEquals(graph.getNodeCount(), components.stream().mapToInt(Set::size).sum());
        }
        assertEquals(reference.size() == 1, ComponentFinder.isConnected(graph));
    }

    @Test
    void testIsConnected() {
        assertTrue(ComponentFinder.isConnected(AdjacencyListGraph.undirected()));
        assertFalse(ComponentFinder.isConnected(GraphFixtures.createTwoComponents()));
        AdjacencyListGraph<Integer> graph = GraphFixtures.createTwoComponents();
        graph.addEdge(2, 3);
        assertTrue(ComponentFinder.isConnected(graph));
        // weakly connected
        assertTrue(ComponentFinder.isConnected(GraphFixtures.createDirectedTree()));
    }

    @Test
    void testMetrics() {
        AdjacencyListGraph<Integer> graph = GraphFixtures.createTwoComponents();
        graph.addNode(5);
        graph.addNode(6);
        ConnectivityMetrics metrics = ConnectivityMetrics.of(graph);
        assertEquals(7, metrics.getNodeCount());
        assertEquals(4, metrics.getComponentCount());
        assertEquals(3, metrics.getLargestComponentSize());
        assertEquals(2, metrics.getIsolatedNodeCount());
        assertEquals(3.0 / 7, metrics.getConnectivityRatio(), 1e-12);
        assertFalse(metrics.isConnected());

        ConnectivityMetrics empty = ConnectivityMetrics.of(AdjacencyListGraph.<Integer>directed(), ComponentAlgorithm.UNION_FIND);
        assertEquals(0, empty.getComponentCount());
        assertEquals(1.0, empty.getConnectivityRatio());
        assertTrue(empty.isConnected());
    }
}

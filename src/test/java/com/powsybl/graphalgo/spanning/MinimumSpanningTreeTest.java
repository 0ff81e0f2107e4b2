/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.spanning;

import com.powsybl.graphalgo.GraphFixtures;
import com.powsybl.graphalgo.connectivity.ComponentFinder;
import com.powsybl.graphalgo.connectivity.UnionFind;
import com.powsybl.graphalgo.graph.AdjacencyListGraph;
import com.powsybl.graphalgo.graph.Edge;
import com.powsybl.graphalgo.graph.JGraphTConverter;
import org.jgrapht.alg.spanning.KruskalMinimumSpanningTree;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Kruskal and Prim results, checked against JGraphT on random graphs.
 */
class MinimumSpanningTreeTest {

    private static final double EPSILON = 1e-9;

    /**
     * Cities linked by roads, weight being the distance.
     */
    private static AdjacencyListGraph<String> createCities() {
        AdjacencyListGraph<String> graph = AdjacencyListGraph.undirected();
        graph.addEdge("A", "B", 4);
        graph.addEdge("A", "C", 2);
        graph.addEdge("B", "C", 1);
        graph.addEdge("B", "D", 5);
        graph.addEdge("C", "D", 8);
        graph.addEdge("C", "E", 10);
        graph.addEdge("D", "E", 2);
        graph.addEdge("D", "F", 6);
        graph.addEdge("E", "F", 3);
        return graph;
    }

    @Test
    void testKruskal() {
        SpanningTree<String> tree = MinimumSpanningTree.kruskal(createCities());
        assertEquals(List.of(new Edge<>("B", "C", 1),
                             new Edge<>("A", "C", 2),
                             new Edge<>("D", "E", 2),
                             new Edge<>("E", "F", 3),
                             new Edge<>("B", "D", 5)),
                     tree.getEdges());
        assertEquals(13, tree.getTotalWeight(), EPSILON);
    }

    @Test
    void testPrim() {
        SpanningTree<String> tree = MinimumSpanningTree.prim(createCities(), "A");
        assertEquals(List.of(new Edge<>("A", "C", 2),
                             new Edge<>("C", "B", 1),
                             new Edge<>("B", "D", 5),
                             new Edge<>("D", "E", 2),
                             new Edge<>("E", "F", 3)),
                     tree.getEdges());
        assertEquals(13, tree.getTotalWeight(), EPSILON);
        assertEquals(0, MinimumSpanningTree.prim(createCities(), "Z").getEdgeCount());
    }

    @Test
    void testDirectedRejected() {
        AdjacencyListGraph<String> graph = GraphFixtures.createWeightedDiamond();
        assertThrows(IllegalArgumentException.class, () -> MinimumSpanningTree.kruskal(graph));
        assertThrows(IllegalArgumentException.class, () -> MinimumSpanningTree.prim(graph, "A"));
    }

    @Test
    void testForest() {
        AdjacencyListGraph<Integer> graph = GraphFixtures.createTwoComponents();
        assertEquals(3, MinimumSpanningTree.kruskal(graph).getEdgeCount());
        assertEquals(2, MinimumSpanningTree.prim(graph, 0).getEdgeCount());
        assertEquals(1, MinimumSpanningTree.prim(graph, 4).getEdgeCount());
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 4, 5})
    void testAgainstJGraphT(long seed) {
        AdjacencyListGraph<Integer> graph = GraphFixtures.createRandom(seed, false, 30, 0.2);
        double expectedWeight = new KruskalMinimumSpanningTree<>(JGraphTConverter.toJGraphT(graph)).getSpanningTree().getWeight();
        SpanningTree<Integer> kruskal = MinimumSpanningTree.kruskal(graph);
        assertEquals(expectedWeight, kruskal.getTotalWeight(), EPSILON);
        int componentCount = ComponentFinder.findComponents(graph).size();
        assertEquals(graph.getNodeCount() - componentCount, kruskal.getEdgeCount());

        // no cycle in the tree
        UnionFind<Integer> unionFind = new UnionFind<>(graph.getNodes());
        for (Edge<Integer> edge : kruskal.getEdges()) {
            assertTrue(unionFind.union(edge.getFrom(), edge.getTo()));
        }

        if (componentCount == 1) {
            assertEquals(expectedWeight, MinimumSpanningTree.prim(graph, 0).getTotalWeight(), EPSILON);
        }
    }
}

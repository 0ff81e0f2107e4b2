/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.graph;

import org.jgrapht.graph.DefaultWeightedEdge;
import org.jgrapht.graph.SimpleDirectedWeightedGraph;
import org.jgrapht.graph.SimpleWeightedGraph;

import java.util.Objects;

/**
 * Conversion of a graph into its JGraphT counterpart, to benefit from JGraphT algorithms or to cross-check results.
 */
public final class JGraphTConverter {

    private JGraphTConverter() {
    }

    public static <N> org.jgrapht.Graph<N, DefaultWeightedEdge> toJGraphT(Graph<N> graph) {
        Objects.requireNonNull(graph);
        org.jgrapht.Graph<N, DefaultWeightedEdge> jgraphtGraph = graph.isDirected()
                ? new SimpleDirectedWeightedGraph<>(DefaultWeightedEdge.class)
                : new SimpleWeightedGraph<>(DefaultWeightedEdge.class);
        for (N node : graph.getNodes()) {
            jgraphtGraph.addVertex(node);
        }
        for (Edge<N> edge : graph.getEdges()) {
            DefaultWeightedEdge e = jgraphtGraph.addEdge(edge.getFrom(), edge.getTo());
            jgraphtGraph.setEdgeWeight(e, edge.getWeight());
        }
        return jgraphtGraph;
    }
}

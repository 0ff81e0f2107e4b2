/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.graphalgo.connectivity.ComponentAlgorithm;
import com.powsybl.graphalgo.traversal.DfsStrategy;
import de.vandermeer.asciitable.AsciiTable;
import de.vandermeer.asciitable.CWC_LongestWord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Default behavior of the algorithms run through {@link GraphAlgorithms}.
 */
public class GraphAlgorithmParameters {

    private static final Logger LOGGER = LoggerFactory.getLogger(GraphAlgorithmParameters.class);

    public static final String MODULE_NAME = "graph-algorithms-default-parameters";

    public static final String DFS_STRATEGY_PARAM_NAME = "dfsStrategy";

    public static final String COMPONENT_ALGORITHM_PARAM_NAME = "componentAlgorithm";

    public static final String MAX_PATH_EDGES_PARAM_NAME = "maxPathEdges";

    public static final String TRACE_STEPS_PARAM_NAME = "traceSteps";

    public static final DfsStrategy DFS_STRATEGY_DEFAULT_VALUE = DfsStrategy.ITERATIVE;

    public static final ComponentAlgorithm COMPONENT_ALGORITHM_DEFAULT_VALUE = ComponentAlgorithm.DFS;

    /**
     * No bound on the number of edges of enumerated paths.
     */
    public static final int MAX_PATH_EDGES_DEFAULT_VALUE = -1;

    public static final boolean TRACE_STEPS_DEFAULT_VALUE = false;

    public static final List<String> PARAMETER_NAMES = List.of(DFS_STRATEGY_PARAM_NAME,
                                                               COMPONENT_ALGORITHM_PARAM_NAME,
                                                               MAX_PATH_EDGES_PARAM_NAME,
                                                               TRACE_STEPS_PARAM_NAME);

    private DfsStrategy dfsStrategy = DFS_STRATEGY_DEFAULT_VALUE;

    private ComponentAlgorithm componentAlgorithm = COMPONENT_ALGORITHM_DEFAULT_VALUE;

    private int maxPathEdges = MAX_PATH_EDGES_DEFAULT_VALUE;

    private boolean traceSteps = TRACE_STEPS_DEFAULT_VALUE;

    public DfsStrategy getDfsStrategy() {
        return dfsStrategy;
    }

    public GraphAlgorithmParameters setDfsStrategy(DfsStrategy dfsStrategy) {
        this.dfsStrategy = Objects.requireNonNull(dfsStrategy);
        return this;
    }

    public ComponentAlgorithm getComponentAlgorithm() {
        return componentAlgorithm;
    }

    public GraphAlgorithmParameters setComponentAlgorithm(ComponentAlgorithm componentAlgorithm) {
        this.componentAlgorithm = Objects.requireNonNull(componentAlgorithm);
        return this;
    }

    public int getMaxPathEdges() {
        return maxPathEdges;
    }

    public GraphAlgorithmParameters setMaxPathEdges(int maxPathEdges) {
        if (maxPathEdges < -1) {
            throw new IllegalArgumentException("Invalid value for parameter " + MAX_PATH_EDGES_PARAM_NAME + ": " + maxPathEdges);
        }
        this.maxPathEdges = maxPathEdges;
        return this;
    }

    public boolean isTraceSteps() {
        return traceSteps;
    }

    public GraphAlgorithmParameters setTraceSteps(boolean traceSteps) {
        this.traceSteps = traceSteps;
        return this;
    }

    public static GraphAlgorithmParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static GraphAlgorithmParameters load(PlatformConfig platformConfig) {
        Objects.requireNonNull(platformConfig);
        GraphAlgorithmParameters parameters = new GraphAlgorithmParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
                .ifPresent(config -> parameters
                        .setDfsStrategy(config.getEnumProperty(DFS_STRATEGY_PARAM_NAME, DfsStrategy.class, DFS_STRATEGY_DEFAULT_VALUE))
                        .setComponentAlgorithm(config.getEnumProperty(COMPONENT_ALGORITHM_PARAM_NAME, ComponentAlgorithm.class, COMPONENT_ALGORITHM_DEFAULT_VALUE))
                        .setMaxPathEdges(config.getIntProperty(MAX_PATH_EDGES_PARAM_NAME, MAX_PATH_EDGES_DEFAULT_VALUE))
                        .setTraceSteps(config.getBooleanProperty(TRACE_STEPS_PARAM_NAME, TRACE_STEPS_DEFAULT_VALUE)));
        return parameters;
    }

    public static GraphAlgorithmParameters load(Map<String, String> properties) {
        return new GraphAlgorithmParameters().update(properties);
    }

    public GraphAlgorithmParameters update(Map<String, String> properties) {
        Objects.requireNonNull(properties);
        Optional.ofNullable(properties.get(DFS_STRATEGY_PARAM_NAME))
                .ifPresent(prop -> this.setDfsStrategy(DfsStrategy.valueOf(prop)));
        Optional.ofNullable(properties.get(COMPONENT_ALGORITHM_PARAM_NAME))
                .ifPresent(prop -> this.setComponentAlgorithm(ComponentAlgorithm.valueOf(prop)));
        Optional.ofNullable(properties.get(MAX_PATH_EDGES_PARAM_NAME))
                .ifPresent(prop -> this.setMaxPathEdges(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(TRACE_STEPS_PARAM_NAME))
                .ifPresent(prop -> this.setTraceSteps(Boolean.parseBoolean(prop)));
        return this;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(4);
        map.put(DFS_STRATEGY_PARAM_NAME, dfsStrategy);
        map.put(COMPONENT_ALGORITHM_PARAM_NAME, componentAlgorithm);
        map.put(MAX_PATH_EDGES_PARAM_NAME, maxPathEdges);
        map.put(TRACE_STEPS_PARAM_NAME, traceSteps);
        return map;
    }

    public void log() {
        if (LOGGER.isInfoEnabled()) {
            AsciiTable at = new AsciiTable();
            at.addRule();
            at.addRow("Name", "Value");
            at.addRule();
            toMap().forEach((name, value) -> at.addRow(name, Objects.toString(value, "")));
            at.addRule();
            at.getRenderer().setCWC(new CWC_LongestWord());
            at.setPaddingLeftRight(1, 1);
            LOGGER.info("Graph algorithm parameters:\n{}", at.render());
        }
    }

    @Override
    public String toString() {
        return "GraphAlgorithmParameters(" + toMap().entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(", ")) + ")";
    }
}

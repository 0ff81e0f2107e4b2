/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.traversal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Listener decorator logging every algorithm step at trace level.
 *
 * @param <N> node identifier type
 */
public class TraversalListenerTracer<N> implements TraversalListener<N> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TraversalListenerTracer.class);

    private final TraversalListener<N> delegate;

    protected TraversalListenerTracer(TraversalListener<N> delegate) {
        this.delegate = Objects.requireNonNull(delegate);
    }

    /**
     * Wrap the given listener into a tracer, only if trace level is enabled.
     */
    public static <N> TraversalListener<N> trace(TraversalListener<N> listener) {
        Objects.requireNonNull(listener);
        if (LOGGER.isTraceEnabled()) {
            return new TraversalListenerTracer<>(listener);
        }
        return listener;
    }

    @Override
    public void onNodeDiscovered(N node, N parent) {
        LOGGER.trace("onNodeDiscovered(node='{}', parent='{}')", node, parent);
        delegate.onNodeDiscovered(node, parent);
    }

    @Override
    public void onNodeVisited(N node) {
        LOGGER.trace("onNodeVisited(node='{}')", node);
        delegate.onNodeVisited(node);
    }

    @Override
    public void onBacktrack(N node) {
        LOGGER.trace("onBacktrack(node='{}')", node);
        delegate.onBacktrack(node);
    }

    @Override
    public void onEdgeRelaxed(N from, N to, double distance) {
        LOGGER.trace("onEdgeRelaxed(from='{}', to='{}', distance={})", from, to, distance);
        delegate.onEdgeRelaxed(from, to, distance);
    }
}

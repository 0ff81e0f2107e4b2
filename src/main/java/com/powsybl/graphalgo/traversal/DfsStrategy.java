/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.traversal;

/**
 * How depth-first explorations are run. Both strategies explore neighbors in insertion order and reach the same
 * nodes.
 */
public enum DfsStrategy {
    /**
     * Natural recursive formulation. Call stack depth grows with the longest explored path, so a deep graph may
     * exhaust it.
     */
    RECURSIVE,

    /**
     * Explicit stack formulation, safe whatever the depth of the graph.
     */
    ITERATIVE
}

/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphalgo.connectivity;

import java.util.*;

/**
 * Disjoint sets forest, with path compression and union by rank.
 *
 * @param <N> element type
 */
public class UnionFind<N> {

    private final Map<N, N> parents = new LinkedHashMap<>();

    private final Map<N, Integer> ranks = new HashMap<>();

    private int componentCount = 0;

    public UnionFind() {
    }

    public UnionFind(Collection<N> elements) {
        Objects.requireNonNull(elements).forEach(this::add);
    }

    /**
     * Add an element as a singleton set.
     *
     * @return false if the element was already known
     */
    public boolean add(N element) {
        Objects.requireNonNull(element);
        if (parents.containsKey(element)) {
            return false;
        }
        parents.put(element, element);
        ranks.put(element, 0);
        componentCount++;
        return true;
    }

    /**
     * Return the representative of the set of the given element.
     */
    public N find(N element) {
        Objects.requireNonNull(element);
        if (!parents.containsKey(element)) {
            throw new IllegalArgumentException("Unknown element: " + element);
        }
        N root = element;
        N parent;
        while (!(parent = parents.get(root)).equals(root)) {
            root = parent;
        }
        // compress the path, every element on it now points directly to the root
        N current = element;
        while (!current.equals(root)) {
            N next = parents.get(current);
            parents.put(current, root);
            current = next;
        }
        return root;
    }

    /**
     * Merge the sets of the two given elements.
     *
     * @return true if the sets have been merged, false if both elements were already in the same set
     */
    public boolean union(N element1, N element2) {
        N root1 = find(element1);
        N root2 = find(element2);
        if (root1.equals(root2)) {
            return false;
        }
        int rank1 = ranks.get(root1);
        int rank2 = ranks.get(root2);
        if (rank1 < rank2) {
            parents.put(root1, root2);
        } else if (rank1 > rank2) {
            parents.put(root2, root1);
        } else {
            parents.put(root2, root1);
            ranks.put(root1, rank1 + 1);
        }
        componentCount--;
        return true;
    }

    public boolean connected(N element1, N element2) {
        return find(element1).equals(find(element2));
    }

    public int size() {
        return parents.size();
    }

    public int getComponentCount() {
        return componentCount;
    }

    /**
     * Return the sets, ordered by their first added element, members being in addition order.
     */
    public List<Set<N>> getComponents() {
        Map<N, Set<N>> componentsByRoot = new LinkedHashMap<>();
        for (N element : new ArrayList<>(parents.keySet())) {
            componentsByRoot.computeIfAbsent(find(element), k -> new LinkedHashSet<>()).add(element);
        }
        return new ArrayList<>(componentsByRoot.values());
    }
}

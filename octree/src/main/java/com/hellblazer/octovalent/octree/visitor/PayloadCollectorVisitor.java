/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Octovalent.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.octovalent.octree.visitor;

import com.hellblazer.octovalent.octree.OctreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Visitor that collects the payload of every payload-bearing node accepted by a filter. Visits the whole tree.
 *
 * @param <T> the payload type
 * @author hal.hildebrand
 */
public class PayloadCollectorVisitor<T> implements OctreeVisitor<T> {

    private final List<T>                  payloads = new ArrayList<>();
    private final Predicate<OctreeNode<T>> filter;

    /**
     * Collect every payload
     */
    public PayloadCollectorVisitor() {
        this(node -> true);
    }

    public PayloadCollectorVisitor(Predicate<OctreeNode<T>> filter) {
        this.filter = filter;
    }

    public List<T> getPayloads() {
        return Collections.unmodifiableList(payloads);
    }

    /**
     * @return the collected payloads as a new mutable list
     */
    public List<T> toList() {
        return new ArrayList<>(payloads);
    }

    @Override
    public boolean visitNode(OctreeNode<T> node) {
        if (node.hasData() && filter.test(node)) {
            node.getData().ifPresent(payloads::add);
        }
        return true;
    }
}

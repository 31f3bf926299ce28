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

/**
 * Visitor for depth-first, pre-order traversal of an octree.
 *
 * @param <T> the payload type
 * @author hal.hildebrand
 */
public interface OctreeVisitor<T> {

    /**
     * Called when entering a node during traversal.
     *
     * @param node the node being visited, its depth is {@link OctreeNode#getDepth()}
     * @return true to continue into the node's children, false to skip them
     */
    boolean visitNode(OctreeNode<T> node);

    /**
     * Called when leaving a node after its children have been visited. Only called if visitNode returned true.
     *
     * @param node the node being left
     */
    default void leaveNode(OctreeNode<T> node) {
        // Default: do nothing
    }
}

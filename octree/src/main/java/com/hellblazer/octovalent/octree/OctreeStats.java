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
package com.hellblazer.octovalent.octree;

/**
 * Aggregate structure of one or more octrees.
 *
 * @param totalNodes      every node, leaf or internal
 * @param leafNodes       nodes without children
 * @param internalNodes   nodes with 8 children
 * @param nodesWithData   nodes carrying a payload
 * @param maxDepthReached deepest node depth observed
 * @author hal.hildebrand
 */
public record OctreeStats(int totalNodes, int leafNodes, int internalNodes, int nodesWithData, int maxDepthReached) {

    public static final OctreeStats EMPTY = new OctreeStats(0, 0, 0, 0, 0);

    /**
     * Sum the counts of two trees, keeping the deeper of the two depths
     */
    public OctreeStats combine(OctreeStats other) {
        return new OctreeStats(totalNodes + other.totalNodes, leafNodes + other.leafNodes,
                               internalNodes + other.internalNodes, nodesWithData + other.nodesWithData,
                               Math.max(maxDepthReached, other.maxDepthReached));
    }
}

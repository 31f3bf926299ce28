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
import com.hellblazer.octovalent.octree.OctreeStats;

import java.util.TreeMap;

/**
 * Visitor that counts nodes, leaves and payloads, overall and at each depth of the tree.
 *
 * @param <T> the payload type
 * @author hal.hildebrand
 */
public class NodeCountVisitor<T> implements OctreeVisitor<T> {

    private final TreeMap<Integer, Integer> nodesPerDepth    = new TreeMap<>();
    private final TreeMap<Integer, Integer> payloadsPerDepth = new TreeMap<>();
    private       int                       totalNodes       = 0;
    private       int                       leafNodes        = 0;
    private       int                       nodesWithData    = 0;
    private       int                       maxDepthObserved = 0;

    public int getLeafNodes() {
        return leafNodes;
    }

    public int getMaxDepthObserved() {
        return maxDepthObserved;
    }

    public int getNodesAtDepth(int depth) {
        return nodesPerDepth.getOrDefault(depth, 0);
    }

    public int getNodesWithData() {
        return nodesWithData;
    }

    public int getPayloadsAtDepth(int depth) {
        return payloadsPerDepth.getOrDefault(depth, 0);
    }

    /**
     * Get statistics as a formatted string.
     *
     * @return formatted statistics
     */
    public String getStatistics() {
        var sb = new StringBuilder();
        sb.append("Octree Statistics:\n");
        sb.append("  Total nodes: ").append(totalNodes).append("\n");
        sb.append("  Leaf nodes: ").append(leafNodes).append("\n");
        sb.append("  Nodes with data: ").append(nodesWithData).append("\n");
        sb.append("  Max depth: ").append(maxDepthObserved).append("\n");
        sb.append("  Nodes per depth:\n");
        nodesPerDepth.forEach((depth, nodes) -> sb.append("    Depth ")
                                                  .append(depth)
                                                  .append(": ")
                                                  .append(nodes)
                                                  .append(" nodes, ")
                                                  .append(getPayloadsAtDepth(depth))
                                                  .append(" payloads")
                                                  .append("\n"));
        return sb.toString();
    }

    public int getTotalNodes() {
        return totalNodes;
    }

    public void reset() {
        nodesPerDepth.clear();
        payloadsPerDepth.clear();
        totalNodes = 0;
        leafNodes = 0;
        nodesWithData = 0;
        maxDepthObserved = 0;
    }

    /**
     * @return the counts gathered so far
     */
    public OctreeStats toStats() {
        return new OctreeStats(totalNodes, leafNodes, totalNodes - leafNodes, nodesWithData, maxDepthObserved);
    }

    @Override
    public boolean visitNode(OctreeNode<T> node) {
        int depth = node.getDepth();
        totalNodes++;
        nodesPerDepth.merge(depth, 1, Integer::sum);
        if (node.isLeaf()) {
            leafNodes++;
        }
        if (node.hasData()) {
            nodesWithData++;
            payloadsPerDepth.merge(depth, 1, Integer::sum);
        }
        maxDepthObserved = Math.max(maxDepthObserved, depth);
        return true;
    }
}

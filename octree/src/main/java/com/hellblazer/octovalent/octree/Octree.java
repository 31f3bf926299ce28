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

import com.hellblazer.octovalent.geometry.BoundingBox;
import com.hellblazer.octovalent.geometry.OctantIndex;
import com.hellblazer.octovalent.geometry.Vector3;
import com.hellblazer.octovalent.octree.visitor.NodeCountVisitor;
import com.hellblazer.octovalent.octree.visitor.OctreeVisitor;
import com.hellblazer.octovalent.octree.visitor.PayloadCollectorVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Tuple3f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory octree over continuous coordinates. The root covers a fixed bounding box; inserting a point subdivides
 * lazily along the point's path down to the maximum depth, so payloads live in the leaves at that depth and two
 * points are separated by the box hierarchy rather than by insertion order. A later insertion into the same leaf
 * replaces the earlier payload.
 * <p>
 * Points outside the root bounds are silently dropped by {@link #insert} and never found by {@link #find}; callers
 * needing strict bounds enforcement check {@link #contains} first.
 * <p>
 * Thread Safety: This class is NOT thread-safe. It is designed for a single writer; readers must be excluded during
 * mutation. See {@link com.hellblazer.octovalent.octree.temporal.TemporalOctree} for sharding across writers.
 *
 * @param <T> the payload type
 * @author hal.hildebrand
 */
public class Octree<T> {
    private static final Logger log = LoggerFactory.getLogger(Octree.class);

    private final OctreeConfig  config;
    private final byte          maxDepth;
    private       OctreeNode<T> root;

    public Octree(OctreeConfig config) {
        this.config = Objects.requireNonNull(config, "Octree config cannot be null");
        this.maxDepth = config.getMaxDepth();
        this.root = new OctreeNode<>(config.getBounds());
        log.debug("Created octree {}", config);
    }

    public Octree(BoundingBox bounds, int maxDepth) {
        this(OctreeConfig.of(bounds, maxDepth));
    }

    /**
     * Create an octree with the default maximum depth
     */
    public Octree(BoundingBox bounds) {
        this(bounds, OctreeConfig.DEFAULT_MAX_DEPTH);
    }

    /**
     * Number of leaves of a complete tree at the given depth: 8^depth
     */
    public static long leafCountAtDepth(int depth) {
        checkCapacityDepth(depth);
        return 1L << (3 * depth);
    }

    /**
     * Number of nodes of a complete tree of the given depth: (8^(depth+1) - 1) / 7
     */
    public static long theoreticalNodeCount(int depth) {
        checkCapacityDepth(depth);
        var total = 0L;
        for (var d = 0; d <= depth; d++) {
            total += 1L << (3 * d);
        }
        return total;
    }

    private static void checkCapacityDepth(int depth) {
        if (depth < 0 || depth > OctreeConfig.MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException(
            "Capacity depth must be between 0 and " + OctreeConfig.MAX_DEPTH_LIMIT + ": " + depth);
        }
    }

    /**
     * Traverse the whole tree, depth-first
     */
    public void accept(OctreeVisitor<T> visitor) {
        root.accept(visitor);
    }

    /**
     * Discard all nodes and payloads, leaving a single empty root over the same bounds
     */
    public void clear() {
        root = new OctreeNode<>(root.getBounds());
    }

    public boolean contains(Vector3 point) {
        return root.getBounds().contains(point);
    }

    /**
     * @return the depth of the deepest node currently in the tree
     */
    public int effectiveDepth() {
        return stats().maxDepthReached();
    }

    /**
     * Find the payload of the leaf containing the point. Never subdivides.
     *
     * @return the payload, or empty if the point is outside the root bounds or its leaf holds none
     */
    public Optional<T> find(Vector3 point) {
        if (!contains(point)) {
            return Optional.empty();
        }
        return root.findLeaf(point).getData();
    }

    public Optional<T> find(Tuple3f point) {
        return find(Vector3.of(point));
    }

    public BoundingBox getBounds() {
        return root.getBounds();
    }

    public OctreeConfig getConfig() {
        return config;
    }

    public byte getMaxDepth() {
        return maxDepth;
    }

    public OctreeNode<T> getRoot() {
        return root;
    }

    /**
     * Store the payload in the leaf at maximum depth containing the point, subdividing on the way down.
     *
     * @return true if stored, false if the point lies outside the root bounds and the insertion was dropped
     */
    public boolean insert(Vector3 point, T payload) {
        Objects.requireNonNull(payload, "Payload cannot be null");
        if (!contains(point)) {
            log.trace("Dropping insertion at {} outside of {}", point, root.getBounds());
            return false;
        }
        findOrCreateLeaf(point).setData(payload);
        return true;
    }

    public boolean insert(Tuple3f point, T payload) {
        return insert(Vector3.of(point), payload);
    }

    public int leafCount() {
        return stats().leafNodes();
    }

    public int nodeCount() {
        return stats().totalNodes();
    }

    /**
     * Collect the payloads of all leaves whose bounds intersect the query box (inclusive on boundaries). Subtrees whose
     * bounds miss the query are never entered, so the cost is bounded by the number of intersecting nodes.
     */
    public List<T> queryBoundingBox(BoundingBox query) {
        var results = new ArrayList<T>();
        root.collectIntersecting(query, results);
        return results;
    }

    /**
     * Collect the payloads of nodes whose centroid lies within the radius of the center. A negative or NaN radius
     * matches nothing.
     */
    public List<T> queryRadius(Vector3 center, float radius) {
        if (!(radius >= 0.0f)) {
            return Collections.emptyList();
        }
        var radiusSquared = radius * radius;
        if (config.isExhaustiveRadiusQuery()) {
            var collector = new PayloadCollectorVisitor<T>(
            node -> node.getBounds().center().distanceSquared(center) <= radiusSquared);
            root.accept(collector);
            return collector.toList();
        }
        var results = new ArrayList<T>();
        root.collectWithinRadius(center, radiusSquared, results);
        return results;
    }

    public List<T> queryRadius(Tuple3f center, float radius) {
        return queryRadius(Vector3.of(center), radius);
    }

    /**
     * Full traversal computing the node counts of the tree
     */
    public OctreeStats stats() {
        var counter = new NodeCountVisitor<T>();
        root.accept(counter);
        return counter.toStats();
    }

    /**
     * Eagerly subdivide the whole tree so every leaf reaches min(depth, maxDepth)
     */
    public void subdivideToDepth(int depth) {
        var target = Math.min(depth, maxDepth);
        log.debug("Subdividing {} to depth {}", root.getBounds(), target);
        root.subdivideTo(target);
    }

    @Override
    public String toString() {
        return "Octree{bounds=" + root.getBounds() + ", maxDepth=" + maxDepth + "}";
    }

    private OctreeNode<T> findOrCreateLeaf(Vector3 point) {
        var current = root;
        while (current.getDepth() < maxDepth) {
            current.subdivide();
            current = current.getChild(OctantIndex.fromPosition(point, current.getBounds().center()));
        }
        return current;
    }
}

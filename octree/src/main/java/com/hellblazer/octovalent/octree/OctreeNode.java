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
import com.hellblazer.octovalent.octree.visitor.OctreeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the pointer based octree. A node is either a leaf, which may carry a payload, or an internal node owning
 * exactly 8 children indexed by {@link OctantIndex}. The leaf to internal transition happens once, through
 * {@link #subdivide()}, and is never reversed.
 * <p>
 * Thread Safety: This class is NOT thread-safe. A tree has a single writer, readers must be excluded while it
 * mutates.
 *
 * @param <T> the payload type
 * @author hal.hildebrand
 */
public class OctreeNode<T> {
    private static final Logger log = LoggerFactory.getLogger(OctreeNode.class);

    private final BoundingBox     bounds;
    private final byte            depth;
    private       OctreeNode<T>[] children;
    private       T               data;

    /**
     * Create a root node
     */
    public OctreeNode(BoundingBox bounds) {
        this(bounds, (byte) 0);
    }

    public OctreeNode(BoundingBox bounds, byte depth) {
        this.bounds = Objects.requireNonNull(bounds, "Bounds cannot be null");
        this.depth = depth;
    }

    /**
     * Accept a visitor, pre-order. Children are skipped when {@link OctreeVisitor#visitNode} returns false, and
     * {@link OctreeVisitor#leaveNode} is only called for nodes whose children were entered.
     */
    public void accept(OctreeVisitor<T> visitor) {
        if (!visitor.visitNode(this)) {
            return;
        }
        if (children != null) {
            for (var child : children) {
                child.accept(visitor);
            }
        }
        visitor.leaveNode(this);
    }

    public void clearData() {
        data = null;
    }

    /**
     * Descend from this node without subdividing, following the octant of the point at each level
     *
     * @return the leaf whose region the point classifies into
     */
    public OctreeNode<T> findLeaf(Vector3 point) {
        var current = this;
        while (current.children != null) {
            current = current.children[OctantIndex.fromPosition(point, current.bounds.center()).value()];
        }
        return current;
    }

    public BoundingBox getBounds() {
        return bounds;
    }

    /**
     * Raw child access
     *
     * @param index the octant index, 0-7
     * @return the child, or null if this node is a leaf
     * @throws IndexOutOfBoundsException if the index is outside [0,7]
     */
    public OctreeNode<T> getChild(int index) {
        Objects.checkIndex(index, OctantIndex.OCTANTS);
        return children == null ? null : children[index];
    }

    public OctreeNode<T> getChild(OctantIndex octant) {
        return getChild(octant.value());
    }

    public Optional<T> getData() {
        return Optional.ofNullable(data);
    }

    public byte getDepth() {
        return depth;
    }

    public boolean hasChildren() {
        return children != null;
    }

    public boolean hasData() {
        return data != null;
    }

    public boolean isLeaf() {
        return children == null;
    }

    public void setData(T data) {
        this.data = Objects.requireNonNull(data, "Payload cannot be null");
    }

    /**
     * Split this leaf into 8 children, one per octant, each bounded by combining this node's corners with its center
     * according to the octant's sign bits. No-op if the node is already internal. An internal node carries no payload,
     * so a payload present at this point is discarded.
     */
    @SuppressWarnings("unchecked")
    public void subdivide() {
        if (children != null) {
            return;
        }
        var split = (OctreeNode<T>[]) new OctreeNode[OctantIndex.OCTANTS];
        var childDepth = (byte) (depth + 1);
        for (var octant : OctantIndex.all()) {
            split[octant.value()] = new OctreeNode<>(bounds.octant(octant), childDepth);
        }
        if (data != null) {
            log.debug("Discarding payload of node at depth {} {} on subdivision", depth, bounds);
            data = null;
        }
        children = split;
    }

    @Override
    public String toString() {
        return "OctreeNode{depth=" + depth + ", bounds=" + bounds + ", leaf=" + isLeaf() + ", data=" + data + "}";
    }

    /**
     * Collect the payloads of the leaves whose bounds intersect the query, pruning every subtree whose bounds do not
     */
    void collectIntersecting(BoundingBox query, List<T> results) {
        if (!bounds.intersects(query)) {
            return;
        }
        if (children == null) {
            if (data != null) {
                results.add(data);
            }
            return;
        }
        for (var child : children) {
            child.collectIntersecting(query, results);
        }
    }

    /**
     * Collect the payloads of nodes whose centroid lies within the radius of the center. Subtrees whose bounds are
     * farther than the radius are pruned: every centroid below lies inside those bounds.
     */
    void collectWithinRadius(Vector3 center, float radiusSquared, List<T> results) {
        if (bounds.distanceSquaredTo(center) > radiusSquared) {
            return;
        }
        if (data != null && bounds.center().distanceSquared(center) <= radiusSquared) {
            results.add(data);
        }
        if (children != null) {
            for (var child : children) {
                child.collectWithinRadius(center, radiusSquared, results);
            }
        }
    }

    /**
     * Eagerly subdivide the subtree rooted here until every leaf reaches the target depth
     */
    void subdivideTo(int targetDepth) {
        if (depth >= targetDepth) {
            return;
        }
        subdivide();
        for (var child : children) {
            child.subdivideTo(targetDepth);
        }
    }
}

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

import java.util.Objects;

/**
 * Immutable construction parameters of an {@link Octree}: the root bounds, the depth bound and the radius query
 * traversal mode.
 *
 * @author hal.hildebrand
 */
public final class OctreeConfig {

    /** Depth used when none is configured */
    public static final byte DEFAULT_MAX_DEPTH = 8;

    /** Deepest tree whose capacity (8^(depth+1) - 1) / 7 is still representable as a long */
    public static final byte MAX_DEPTH_LIMIT = 20;

    private final BoundingBox bounds;
    private final byte        maxDepth;
    private final boolean     exhaustiveRadiusQuery;

    private OctreeConfig(Builder builder) {
        this.bounds = builder.bounds;
        this.maxDepth = builder.maxDepth;
        this.exhaustiveRadiusQuery = builder.exhaustiveRadiusQuery;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with the given bounds and depth, pruned radius queries
     */
    public static OctreeConfig of(BoundingBox bounds, int maxDepth) {
        return builder().withBounds(bounds).withMaxDepth(maxDepth).build();
    }

    public BoundingBox getBounds() {
        return bounds;
    }

    public byte getMaxDepth() {
        return maxDepth;
    }

    /**
     * Whether radius queries visit every node instead of pruning subtrees that lie outside the query sphere. Both
     * modes return the same payloads; the exhaustive mode exists for comparison and profiling.
     */
    public boolean isExhaustiveRadiusQuery() {
        return exhaustiveRadiusQuery;
    }

    /**
     * @return a builder initialised from this configuration
     */
    public Builder toBuilder() {
        return new Builder().withBounds(bounds).withMaxDepth(maxDepth).withExhaustiveRadiusQuery(
        exhaustiveRadiusQuery);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OctreeConfig that)) {
            return false;
        }
        return maxDepth == that.maxDepth && exhaustiveRadiusQuery == that.exhaustiveRadiusQuery && bounds.equals(
        that.bounds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bounds, maxDepth, exhaustiveRadiusQuery);
    }

    @Override
    public String toString() {
        return "OctreeConfig{bounds=" + bounds + ", maxDepth=" + maxDepth + ", exhaustiveRadiusQuery="
        + exhaustiveRadiusQuery + "}";
    }

    public static class Builder {
        private BoundingBox bounds;
        private byte        maxDepth              = DEFAULT_MAX_DEPTH;
        private boolean     exhaustiveRadiusQuery = false;

        private Builder() {
        }

        public Builder withBounds(BoundingBox bounds) {
            this.bounds = Objects.requireNonNull(bounds, "Bounds cannot be null");
            return this;
        }

        public Builder withMaxDepth(int maxDepth) {
            if (maxDepth < 0 || maxDepth > MAX_DEPTH_LIMIT) {
                throw new IllegalArgumentException(
                "Max depth must be between 0 and " + MAX_DEPTH_LIMIT + ": " + maxDepth);
            }
            this.maxDepth = (byte) maxDepth;
            return this;
        }

        public Builder withExhaustiveRadiusQuery(boolean exhaustive) {
            this.exhaustiveRadiusQuery = exhaustive;
            return this;
        }

        public OctreeConfig build() {
            if (bounds == null) {
                throw new IllegalArgumentException("Octree bounds must be configured");
            }
            return new OctreeConfig(this);
        }
    }
}

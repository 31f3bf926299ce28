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
package com.hellblazer.octovalent.geometry;

import java.util.Objects;

/**
 * Axis-aligned bounding box. All containment and intersection tests are inclusive on every boundary.
 * <p>
 * The box is expected to satisfy {@code min <= max} on each axis. This is a precondition of the caller and is not
 * validated here: an inverted box contains no point and its derived values (size, volume) are meaningless.
 *
 * @author hal.hildebrand
 */
public record BoundingBox(Vector3 min, Vector3 max) {

    public BoundingBox {
        Objects.requireNonNull(min, "min corner cannot be null");
        Objects.requireNonNull(max, "max corner cannot be null");
    }

    public BoundingBox(float minX, float minY, float minZ, float maxX, float maxY, float maxZ) {
        this(new Vector3(minX, minY, minZ), new Vector3(maxX, maxY, maxZ));
    }

    /**
     * Create the cube with the given minimum corner and edge length
     */
    public static BoundingBox cube(Vector3 origin, float extent) {
        return new BoundingBox(origin, origin.add(Vector3.uniform(extent)));
    }

    public Vector3 center() {
        return min.add(max).scale(0.5f);
    }

    public Vector3 size() {
        return max.subtract(min);
    }

    public float volume() {
        var s = size();
        return s.x() * s.y() * s.z();
    }

    public boolean contains(Vector3 point) {
        return point.x() >= min.x() && point.x() <= max.x() && point.y() >= min.y() && point.y() <= max.y()
        && point.z() >= min.z() && point.z() <= max.z();
    }

    public boolean intersects(BoundingBox other) {
        return !(max.x() < other.min.x() || min.x() > other.max.x() || max.y() < other.min.y()
                 || min.y() > other.max.y() || max.z() < other.min.z() || min.z() > other.max.z());
    }

    /**
     * Squared distance from the point to the closest point of this box, zero if the point is inside
     */
    public float distanceSquaredTo(Vector3 point) {
        var dx = axisGap(point.x(), min.x(), max.x());
        var dy = axisGap(point.y(), min.y(), max.y());
        var dz = axisGap(point.z(), min.z(), max.z());
        return dx * dx + dy * dy + dz * dz;
    }

    /**
     * Derive the child box of the given octant. A positive sign on an axis selects {@code [center, max]}, a negative
     * sign selects {@code [min, center]}.
     */
    public BoundingBox octant(OctantIndex octant) {
        var c = center();
        var childMin = new Vector3(octant.xPositive() ? c.x() : min.x(), octant.yPositive() ? c.y() : min.y(),
                                   octant.zPositive() ? c.z() : min.z());
        var childMax = new Vector3(octant.xPositive() ? max.x() : c.x(), octant.yPositive() ? max.y() : c.y(),
                                   octant.zPositive() ? max.z() : c.z());
        return new BoundingBox(childMin, childMax);
    }

    private static float axisGap(float v, float lo, float hi) {
        if (v < lo) {
            return lo - v;
        }
        if (v > hi) {
            return v - hi;
        }
        return 0.0f;
    }

    @Override
    public String toString() {
        return "[" + min + " -> " + max + "]";
    }
}

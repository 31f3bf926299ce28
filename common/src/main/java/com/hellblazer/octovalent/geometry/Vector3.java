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

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;

/**
 * Immutable 3D vector with float coordinates. Arithmetic follows plain IEEE-754 float semantics, no normalisation or
 * validation is performed.
 *
 * @author hal.hildebrand
 */
public record Vector3(float x, float y, float z) {

    public static final Vector3 ZERO = new Vector3(0.0f, 0.0f, 0.0f);

    /**
     * Create a vector from any vecmath tuple (Point3f, Vector3f, ...)
     */
    public static Vector3 of(Tuple3f tuple) {
        return new Vector3(tuple.x, tuple.y, tuple.z);
    }

    /**
     * Create a vector with all coordinates set to the same value
     */
    public static Vector3 uniform(float value) {
        return new Vector3(value, value, value);
    }

    public Vector3 add(Vector3 other) {
        return new Vector3(x + other.x, y + other.y, z + other.z);
    }

    public Vector3 subtract(Vector3 other) {
        return new Vector3(x - other.x, y - other.y, z - other.z);
    }

    public Vector3 scale(float scalar) {
        return new Vector3(x * scalar, y * scalar, z * scalar);
    }

    public Vector3 divide(float scalar) {
        return new Vector3(x / scalar, y / scalar, z / scalar);
    }

    public float dot(Vector3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    /**
     * @return the Euclidean norm of this vector
     */
    public float magnitude() {
        return (float) Math.sqrt(dot(this));
    }

    /**
     * Squared Euclidean distance, avoids the square root for comparisons
     */
    public float distanceSquared(Vector3 other) {
        var dx = x - other.x;
        var dy = y - other.y;
        var dz = z - other.z;
        return dx * dx + dy * dy + dz * dz;
    }

    public float distance(Vector3 other) {
        return (float) Math.sqrt(distanceSquared(other));
    }

    /**
     * Get the coordinate along the given axis
     */
    public float get(Axis axis) {
        return switch (axis) {
            case X -> x;
            case Y -> y;
            case Z -> z;
        };
    }

    public Point3f toPoint3f() {
        return new Point3f(x, y, z);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}

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

import java.util.List;

/**
 * One of the 8 octants around a center point, encoded in 3 bits: bit 0 is the X sign, bit 1 the Y sign and bit 2 the
 * Z sign, a set bit meaning positive.
 * <pre>
 *   0 (000) -> (-, -, -)      4 (100) -> (-, -, +)
 *   1 (001) -> (+, -, -)      5 (101) -> (+, -, +)
 *   2 (010) -> (-, +, -)      6 (110) -> (-, +, +)
 *   3 (011) -> (+, +, -)      7 (111) -> (+, +, +)
 * </pre>
 * Interpreting the octants as the vertices of a cube, the Hamming distance between two indices is the adjacency
 * class of the vertices (edge, face diagonal, space diagonal) and the Euclidean distance between them is exactly
 * {@code sqrt(hamming)} on the half-unit cube, independent of any absolute coordinates.
 *
 * @author hal.hildebrand
 */
public record OctantIndex(int value) {

    public static final int OCTANTS = 8;

    private static final OctantIndex[] ALL = new OctantIndex[OCTANTS];

    // Rotation permutations, [quarter turns][octant] -> octant. Counter-clockwise looking down the positive axis.
    private static final byte[][] ROTATE_X = { { 0, 1, 2, 3, 4, 5, 6, 7 }, { 2, 3, 6, 7, 0, 1, 4, 5 },
                                               { 6, 7, 4, 5, 2, 3, 0, 1 }, { 4, 5, 0, 1, 6, 7, 2, 3 } };
    private static final byte[][] ROTATE_Y = { { 0, 1, 2, 3, 4, 5, 6, 7 }, { 4, 0, 6, 2, 5, 1, 7, 3 },
                                               { 5, 4, 7, 6, 1, 0, 3, 2 }, { 1, 5, 3, 7, 0, 4, 2, 6 } };
    private static final byte[][] ROTATE_Z = { { 0, 1, 2, 3, 4, 5, 6, 7 }, { 1, 3, 0, 2, 5, 7, 4, 6 },
                                               { 3, 2, 1, 0, 7, 6, 5, 4 }, { 2, 0, 3, 1, 6, 4, 7, 5 } };

    static {
        for (var i = 0; i < OCTANTS; i++) {
            ALL[i] = new OctantIndex(i);
        }
    }

    public OctantIndex {
        value = value & 0x7;
    }

    /**
     * @return the canonical instance for the value, masked into [0,7]
     */
    public static OctantIndex of(int value) {
        return ALL[value & 0x7];
    }

    /**
     * @return all 8 octants in index order
     */
    public static List<OctantIndex> all() {
        return List.of(ALL);
    }

    public static OctantIndex fromSigns(boolean xPositive, boolean yPositive, boolean zPositive) {
        return of((zPositive ? 4 : 0) | (yPositive ? 2 : 0) | (xPositive ? 1 : 0));
    }

    /**
     * Classify a point relative to a center. A coordinate equal to the center's resolves to the positive side.
     */
    public static OctantIndex fromPosition(Vector3 point, Vector3 center) {
        return fromSigns(point.x() >= center.x(), point.y() >= center.y(), point.z() >= center.z());
    }

    /**
     * Classify coordinates relative to the origin, zero resolving to positive
     */
    public static OctantIndex fromCoords(float x, float y, float z) {
        return fromSigns(x >= 0.0f, y >= 0.0f, z >= 0.0f);
    }

    public boolean xPositive() {
        return (value & Axis.X.mask()) != 0;
    }

    public boolean yPositive() {
        return (value & Axis.Y.mask()) != 0;
    }

    public boolean zPositive() {
        return (value & Axis.Z.mask()) != 0;
    }

    public boolean isPositive(Axis axis) {
        return (value & axis.mask()) != 0;
    }

    /**
     * @return +1 or -1
     */
    public int xSign() {
        return xPositive() ? 1 : -1;
    }

    public int ySign() {
        return yPositive() ? 1 : -1;
    }

    public int zSign() {
        return zPositive() ? 1 : -1;
    }

    public int hammingDistance(OctantIndex other) {
        return Integer.bitCount(value ^ other.value);
    }

    /**
     * Distance between the two octant vertices of the half-unit cube {-0.5,+0.5}^3: 1, sqrt(2) or sqrt(3)
     */
    public float euclideanDistance(OctantIndex other) {
        return euclideanDistance(other, false);
    }

    /**
     * @param unitCube true for vertices at {-1,+1}^3, doubling the half-unit distance
     */
    public float euclideanDistance(OctantIndex other, boolean unitCube) {
        var base = (float) Math.sqrt(hammingDistance(other));
        return unitCube ? 2.0f * base : base;
    }

    public ConnectionType connectionType(OctantIndex other) {
        return ConnectionType.fromHamming(hammingDistance(other));
    }

    /**
     * @return the 3 octants sharing a cube edge with this one, in X, Y, Z flip order
     */
    public List<OctantIndex> edgeNeighbors() {
        return List.of(flip(0x1), flip(0x2), flip(0x4));
    }

    /**
     * @return the 3 octants across a face diagonal, in XY, XZ, YZ flip order
     */
    public List<OctantIndex> faceNeighbors() {
        return List.of(flip(0x3), flip(0x5), flip(0x6));
    }

    /**
     * @return the octant across the space diagonal
     */
    public OctantIndex opposite() {
        return invert();
    }

    /**
     * Reflect across the XY plane (negate Z)
     */
    public OctantIndex reflectXY() {
        return flip(Axis.Z.mask());
    }

    /**
     * Reflect across the XZ plane (negate Y)
     */
    public OctantIndex reflectXZ() {
        return flip(Axis.Y.mask());
    }

    /**
     * Reflect across the YZ plane (negate X)
     */
    public OctantIndex reflectYZ() {
        return flip(Axis.X.mask());
    }

    /**
     * Negate the given axis
     */
    public OctantIndex reflect(Axis axis) {
        return flip(axis.mask());
    }

    public OctantIndex invert() {
        return flip(0x7);
    }

    public OctantIndex rotateX(int degrees) {
        return of(ROTATE_X[quarterTurns(degrees)][value]);
    }

    public OctantIndex rotateY(int degrees) {
        return of(ROTATE_Y[quarterTurns(degrees)][value]);
    }

    public OctantIndex rotateZ(int degrees) {
        return of(ROTATE_Z[quarterTurns(degrees)][value]);
    }

    public OctantIndex rotate(Axis axis, int degrees) {
        return switch (axis) {
            case X -> rotateX(degrees);
            case Y -> rotateY(degrees);
            case Z -> rotateZ(degrees);
        };
    }

    private OctantIndex flip(int mask) {
        return of(value ^ mask);
    }

    private static int quarterTurns(int degrees) {
        if (degrees % 90 != 0) {
            throw new IllegalArgumentException("Rotation must be a multiple of 90 degrees: " + degrees);
        }
        return Math.floorMod(degrees / 90, 4);
    }

    @Override
    public String toString() {
        return (xPositive() ? "+" : "-") + (yPositive() ? "+" : "-") + (zPositive() ? "+" : "-");
    }
}

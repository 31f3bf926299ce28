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

/**
 * How two cube vertices (octants) are connected, by the Hamming distance of their indices
 *
 * @author hal.hildebrand
 */
public enum ConnectionType {
    IDENTICAL, EDGE, FACE_DIAGONAL, SPACE_DIAGONAL;

    public static ConnectionType fromHamming(int hamming) {
        return switch (hamming) {
            case 0 -> IDENTICAL;
            case 1 -> EDGE;
            case 2 -> FACE_DIAGONAL;
            case 3 -> SPACE_DIAGONAL;
            default -> throw new IllegalArgumentException("Octant Hamming distance must be 0-3: " + hamming);
        };
    }

    /**
     * @return the Hamming distance this connection corresponds to
     */
    public int hamming() {
        return ordinal();
    }
}

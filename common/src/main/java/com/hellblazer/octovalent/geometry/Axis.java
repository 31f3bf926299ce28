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
 * The three coordinate axes, each carrying the bit it occupies in an {@link OctantIndex}
 *
 * @author hal.hildebrand
 */
public enum Axis {
    X(0x1), Y(0x2), Z(0x4);

    private final int mask;

    Axis(int mask) {
        this.mask = mask;
    }

    /**
     * @return the octant bit encoding the sign of this axis
     */
    public int mask() {
        return mask;
    }
}

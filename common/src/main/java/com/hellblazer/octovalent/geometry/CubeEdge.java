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
 * An edge of the octant cube: two octants differing only in the bit of {@code axis}, {@code from} holding the
 * negative side
 *
 * @author hal.hildebrand
 */
public record CubeEdge(OctantIndex from, OctantIndex to, Axis axis) {

    /**
     * @return true if the edge joins the two octants, in either direction
     */
    public boolean connects(OctantIndex a, OctantIndex b) {
        return (from.equals(a) && to.equals(b)) || (from.equals(b) && to.equals(a));
    }
}

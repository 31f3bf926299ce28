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
package com.hellblazer.octovalent.octree.temporal;

import com.hellblazer.octovalent.geometry.Axis;
import com.hellblazer.octovalent.geometry.OctantIndex;
import com.hellblazer.octovalent.geometry.Phase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class PhaseOctantMatrixTest {

    @Test
    public void testFactories() {
        var zeros = PhaseOctantMatrix.zeros();
        assertTrue(zeros.allMatch(v -> v == 0.0));
        assertEquals(0.0, zeros.sum());

        var twos = PhaseOctantMatrix.filled(2.0);
        assertEquals(2.0 * PhaseOctantMatrix.CELLS, twos.sum());
        assertEquals(2.0, twos.average());

        var identity = PhaseOctantMatrix.identity();
        assertEquals(12.0, identity.sum());
        assertEquals(1.0, identity.at(9, 1));
        assertEquals(0.0, identity.at(9, 2));
        assertEquals(12, identity.count(v -> v == 1.0));
    }

    @Test
    public void testAccess() {
        var m = PhaseOctantMatrix.zeros();
        m.set(Phase.of(3), OctantIndex.of(5), 4.5);
        assertEquals(4.5, m.get(Phase.of(3), OctantIndex.of(5)));
        assertEquals(4.5, m.at(3, 5));
        m.set(11, 7, -1.0);
        assertEquals(-1.0, m.get(Phase.of(11), OctantIndex.of(7)));
        m.increment(Phase.of(3), OctantIndex.of(5), 0.5);
        assertEquals(5.0, m.at(3, 5));

        assertEquals(-1.0, m.min());
        assertEquals(5.0, m.max());
        assertTrue(m.anyMatch(v -> v < 0));

        assertThrows(IndexOutOfBoundsException.class, () -> m.at(12, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> m.at(0, 8));
        assertThrows(IndexOutOfBoundsException.class, () -> m.set(-1, 0, 1.0));
    }

    @Test
    public void testRowsAndColumns() {
        var m = PhaseOctantMatrix.zeros();
        m.transform((phase, octant, v) -> phase.value() * 10 + octant.value());
        assertArrayEquals(new double[] { 40, 41, 42, 43, 44, 45, 46, 47 }, m.row(Phase.of(4)));
        var column = m.column(OctantIndex.of(2));
        assertEquals(12, column.length);
        assertEquals(112.0, column[11]);

        m.row(Phase.of(4))[0] = 1000;
        assertEquals(40.0, m.at(4, 0), "row returns a copy");

        var visited = new int[1];
        m.forEach((phase, octant, v) -> {
            assertEquals(phase.value() * 10 + octant.value(), v);
            visited[0]++;
        });
        assertEquals(PhaseOctantMatrix.CELLS, visited[0]);
    }

    @Test
    public void testRotateTemporal() {
        var m = PhaseOctantMatrix.zeros();
        m.set(Phase.of(10), OctantIndex.of(1), 7.0);
        var shifted = m.rotateTemporal(3);
        assertEquals(7.0, shifted.get(Phase.of(1), OctantIndex.of(1)));
        assertEquals(7.0, shifted.sum());
        assertEquals(m, shifted.rotateTemporal(-3));
        assertEquals(m, m.rotateTemporal(12));
        assertEquals(7.0, m.at(10, 1), "rotation leaves the source untouched");
    }

    @Test
    public void testSpatialSymmetries() {
        var m = PhaseOctantMatrix.zeros();
        m.set(Phase.of(0), OctantIndex.of(3), 1.0); // ++-
        assertEquals(1.0, m.mirrorSpatial(Axis.X).get(Phase.of(0), OctantIndex.of(2)));
        assertEquals(1.0, m.mirrorSpatial(Axis.Z).get(Phase.of(0), OctantIndex.of(7)));
        assertEquals(1.0, m.invertSpatial().get(Phase.of(0), OctantIndex.of(4)));
        assertEquals(m, m.invertSpatial().invertSpatial());
        assertEquals(m, m.mirrorSpatial(Axis.Y).mirrorSpatial(Axis.Y));
    }

    @Test
    public void testCorrelation() {
        var m = PhaseOctantMatrix.zeros();
        m.transform((phase, octant, v) -> phase.value() + octant.value() * 0.5);
        var negated = PhaseOctantMatrix.zeros();
        negated.transform((phase, octant, v) -> -m.get(phase, octant));

        assertEquals(1.0, m.correlation(m), 1e-12);
        assertEquals(-1.0, m.correlation(negated), 1e-12);
        assertEquals(0.0, m.correlation(PhaseOctantMatrix.filled(3.0)));
    }

    @Test
    public void testClearAndEquality() {
        var m = PhaseOctantMatrix.identity();
        assertEquals(PhaseOctantMatrix.identity(), m);
        assertEquals(PhaseOctantMatrix.identity().hashCode(), m.hashCode());
        m.clear();
        assertEquals(PhaseOctantMatrix.zeros(), m);
        assertTrue(m.toString().startsWith("PhaseOctantMatrix ["));
    }
}

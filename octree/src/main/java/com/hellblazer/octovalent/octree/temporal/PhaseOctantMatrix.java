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

import java.util.Arrays;
import java.util.Objects;
import java.util.function.DoublePredicate;
import java.util.function.UnaryOperator;

/**
 * A 12 x 8 grid of values, one row per {@link Phase} and one column per {@link OctantIndex}. Typed access through
 * phase and octant values is total; raw integer access fails fast outside the grid.
 *
 * @author hal.hildebrand
 */
public final class PhaseOctantMatrix {

    public static final int ROWS  = Phase.PHASES;
    public static final int COLS  = OctantIndex.OCTANTS;
    public static final int CELLS = ROWS * COLS;

    private final double[][] cells = new double[ROWS][COLS];

    /**
     * Callback receiving each cell of the matrix
     */
    @FunctionalInterface
    public interface CellConsumer {
        void accept(Phase phase, OctantIndex octant, double value);
    }

    /**
     * Function computing the new value of a cell
     */
    @FunctionalInterface
    public interface CellFunction {
        double apply(Phase phase, OctantIndex octant, double value);
    }

    public static PhaseOctantMatrix filled(double value) {
        var m = new PhaseOctantMatrix();
        m.fill(value);
        return m;
    }

    /**
     * Diagonal-like pattern: cell (p, p % 8) is 1, the rest 0
     */
    public static PhaseOctantMatrix identity() {
        var m = new PhaseOctantMatrix();
        for (var p = 0; p < ROWS; p++) {
            m.cells[p][p % COLS] = 1.0;
        }
        return m;
    }

    public static PhaseOctantMatrix zeros() {
        return new PhaseOctantMatrix();
    }

    public boolean allMatch(DoublePredicate predicate) {
        for (var row : cells) {
            for (var v : row) {
                if (!predicate.test(v)) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean anyMatch(DoublePredicate predicate) {
        for (var row : cells) {
            for (var v : row) {
                if (predicate.test(v)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Raw access
     *
     * @throws IndexOutOfBoundsException if phase is outside [0,11] or octant outside [0,7]
     */
    public double at(int phase, int octant) {
        return cells[Objects.checkIndex(phase, ROWS)][Objects.checkIndex(octant, COLS)];
    }

    public double average() {
        return sum() / CELLS;
    }

    public void clear() {
        fill(0.0);
    }

    /**
     * @return the 12 values of the octant, in phase order
     */
    public double[] column(OctantIndex octant) {
        var column = new double[ROWS];
        for (var p = 0; p < ROWS; p++) {
            column[p] = cells[p][octant.value()];
        }
        return column;
    }

    /**
     * Pearson correlation of the two matrices' cells, in [-1, 1]. Zero when either matrix is constant.
     */
    public double correlation(PhaseOctantMatrix other) {
        var meanA = average();
        var meanB = other.average();
        var numerator = 0.0;
        var denomA = 0.0;
        var denomB = 0.0;
        for (var p = 0; p < ROWS; p++) {
            for (var o = 0; o < COLS; o++) {
                var da = cells[p][o] - meanA;
                var db = other.cells[p][o] - meanB;
                numerator += da * db;
                denomA += da * da;
                denomB += db * db;
            }
        }
        var denom = Math.sqrt(denomA * denomB);
        return denom > 0.0 ? numerator / denom : 0.0;
    }

    public int count(DoublePredicate predicate) {
        var count = 0;
        for (var row : cells) {
            for (var v : row) {
                if (predicate.test(v)) {
                    count++;
                }
            }
        }
        return count;
    }

    public void fill(double value) {
        for (var row : cells) {
            Arrays.fill(row, value);
        }
    }

    public void forEach(CellConsumer consumer) {
        for (var p = 0; p < ROWS; p++) {
            for (var o = 0; o < COLS; o++) {
                consumer.accept(Phase.of(p), OctantIndex.of(o), cells[p][o]);
            }
        }
    }

    public double get(Phase phase, OctantIndex octant) {
        return cells[phase.value()][octant.value()];
    }

    /**
     * Add to the cell's current value
     */
    public void increment(Phase phase, OctantIndex octant, double delta) {
        cells[phase.value()][octant.value()] += delta;
    }

    /**
     * Reflect every octant through the origin
     */
    public PhaseOctantMatrix invertSpatial() {
        return remapOctants(OctantIndex::invert);
    }

    public double max() {
        var result = cells[0][0];
        for (var row : cells) {
            for (var v : row) {
                result = Math.max(result, v);
            }
        }
        return result;
    }

    public double min() {
        var result = cells[0][0];
        for (var row : cells) {
            for (var v : row) {
                result = Math.min(result, v);
            }
        }
        return result;
    }

    /**
     * Mirror the columns by negating the axis on each octant
     */
    public PhaseOctantMatrix mirrorSpatial(Axis axis) {
        return remapOctants(octant -> octant.reflect(axis));
    }

    /**
     * Shift the rows circularly: row p moves to p + shift
     */
    public PhaseOctantMatrix rotateTemporal(int shift) {
        var result = new PhaseOctantMatrix();
        for (var p = 0; p < ROWS; p++) {
            System.arraycopy(cells[p], 0, result.cells[Math.floorMod(p + shift, ROWS)], 0, COLS);
        }
        return result;
    }

    /**
     * @return a copy of the 8 values of the phase, in octant order
     */
    public double[] row(Phase phase) {
        return cells[phase.value()].clone();
    }

    public void set(Phase phase, OctantIndex octant, double value) {
        cells[phase.value()][octant.value()] = value;
    }

    /**
     * Raw update
     *
     * @throws IndexOutOfBoundsException if phase is outside [0,11] or octant outside [0,7]
     */
    public void set(int phase, int octant, double value) {
        cells[Objects.checkIndex(phase, ROWS)][Objects.checkIndex(octant, COLS)] = value;
    }

    public double sum() {
        var total = 0.0;
        for (var row : cells) {
            for (var v : row) {
                total += v;
            }
        }
        return total;
    }

    public void transform(CellFunction function) {
        for (var p = 0; p < ROWS; p++) {
            for (var o = 0; o < COLS; o++) {
                cells[p][o] = function.apply(Phase.of(p), OctantIndex.of(o), cells[p][o]);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PhaseOctantMatrix that && Arrays.deepEquals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("PhaseOctantMatrix [\n");
        for (var p = 0; p < ROWS; p++) {
            sb.append("  ").append(Arrays.toString(cells[p]));
            if (p < ROWS - 1) {
                sb.append(",");
            }
            sb.append("\n");
        }
        return sb.append("]").toString();
    }

    private PhaseOctantMatrix remapOctants(UnaryOperator<OctantIndex> mapping) {
        var result = new PhaseOctantMatrix();
        for (var p = 0; p < ROWS; p++) {
            for (var octant : OctantIndex.all()) {
                result.cells[p][mapping.apply(octant).value()] = cells[p][octant.value()];
            }
        }
        return result;
    }
}

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

import java.util.ArrayList;
import java.util.List;

/**
 * One of the 12 temporal phases. Phases cycle like the hours of a clock and each labels one of the 12 edges of the
 * octant cube: phases 0-3 are the X-parallel edges, 4-7 the Y-parallel edges and 8-11 the Z-parallel edges.
 *
 * @author hal.hildebrand
 */
public record Phase(int value) implements Comparable<Phase> {

    public static final int PHASES = 12;

    private static final Phase[] ALL = new Phase[PHASES];

    static {
        for (var i = 0; i < PHASES; i++) {
            ALL[i] = new Phase(i);
        }
    }

    public Phase {
        value = Math.floorMod(value, PHASES);
    }

    /**
     * @return the phase for the value, wrapped circularly into [0,11]
     */
    public static Phase of(int value) {
        return ALL[Math.floorMod(value, PHASES)];
    }

    /**
     * @return true if the raw value addresses a phase slot without wrapping
     */
    public static boolean isValid(int value) {
        return value >= 0 && value < PHASES;
    }

    public static List<Phase> all() {
        return List.of(ALL);
    }

    /**
     * @return the 12 consecutive phases beginning at start
     */
    public static List<Phase> cycle(Phase start) {
        var phases = new ArrayList<Phase>(PHASES);
        for (var i = 0; i < PHASES; i++) {
            phases.add(start.advance(i));
        }
        return phases;
    }

    /**
     * @return the 4 phases labelling the edges parallel to the axis
     */
    public static List<Phase> phasesOf(Axis axis) {
        var first = axis.ordinal() * 4;
        return List.of(ALL[first], ALL[first + 1], ALL[first + 2], ALL[first + 3]);
    }

    /**
     * Phase reached at the given time within a repeating cycle of the given period
     */
    public static Phase fromTime(float seconds, float cyclePeriod) {
        var phaseDuration = cyclePeriod / PHASES;
        return of((int) Math.floor(seconds / phaseDuration));
    }

    /**
     * Fraction [0,1) of the current phase elapsed at the given time
     */
    public static float progress(float seconds, float cyclePeriod) {
        var phaseDuration = cyclePeriod / PHASES;
        var inPhase = seconds % phaseDuration;
        if (inPhase < 0) {
            inPhase += phaseDuration;
        }
        return inPhase / phaseDuration;
    }

    /**
     * The phase labelling the cube edge between two adjacent octants
     *
     * @throws IllegalArgumentException if the octants do not share an edge
     */
    public static Phase fromEdge(OctantIndex a, OctantIndex b) {
        for (var phase : ALL) {
            if (phase.edge().connects(a, b)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Octants " + a + " and " + b + " are not connected by an edge");
    }

    public Phase next() {
        return advance(1);
    }

    public Phase previous() {
        return advance(-1);
    }

    public Phase advance(int phases) {
        return of(value + phases);
    }

    /**
     * Shortest circular distance, in [0,6]
     */
    public int distance(Phase other) {
        var diff = Math.floorMod(other.value - value, PHASES);
        return diff <= PHASES / 2 ? diff : PHASES - diff;
    }

    public boolean isOpposite(Phase other) {
        return distance(other) == PHASES / 2;
    }

    public boolean isAdjacent(Phase other) {
        return distance(other) == 1;
    }

    /**
     * @return the axis the edge labelled by this phase runs along
     */
    public Axis axis() {
        return Axis.values()[value / 4];
    }

    /**
     * @return the group of 3 phases this phase belongs to, [0,3]
     */
    public int quadrant() {
        return value / 3;
    }

    /**
     * Offset of the start of this phase within a cycle of the given period
     */
    public float toTime(float cyclePeriod) {
        return value * cyclePeriod / PHASES;
    }

    /**
     * The cube edge labelled by this phase. Within an axis group the edges are ordered by the two remaining sign bits.
     */
    public CubeEdge edge() {
        var axis = axis();
        var k = value % 4;
        var base = switch (axis) {
            case X -> k << 1;
            case Y -> (k & 0x1) | ((k & 0x2) << 1);
            case Z -> k;
        };
        return new CubeEdge(OctantIndex.of(base), OctantIndex.of(base | axis.mask()), axis);
    }

    public String toClock() {
        return String.format("%02d:00", value);
    }

    @Override
    public int compareTo(Phase o) {
        return Integer.compare(value, o.value);
    }

    @Override
    public String toString() {
        return "Phase_" + value;
    }
}

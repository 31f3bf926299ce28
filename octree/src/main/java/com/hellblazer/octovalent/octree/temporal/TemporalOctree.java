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

import com.hellblazer.octovalent.geometry.BoundingBox;
import com.hellblazer.octovalent.geometry.OctantIndex;
import com.hellblazer.octovalent.geometry.Phase;
import com.hellblazer.octovalent.geometry.Vector3;
import com.hellblazer.octovalent.octree.Octree;
import com.hellblazer.octovalent.octree.OctreeConfig;
import com.hellblazer.octovalent.octree.OctreeStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Twelve independent octrees, one per {@link Phase}, all built over the same bounds and depth bound. There is no
 * state shared between the phases: each one is a static shard, so up to 12 writers may proceed concurrently without
 * synchronization provided each writes only to its own phase. A single phase remains single-writer, like
 * {@link Octree}.
 * <p>
 * Operations addressed by a raw integer phase outside [0,11] are ignored (insertions dropped, queries empty). Only
 * the raw accessor {@link #getPhaseOctree(int)} fails fast.
 *
 * @param <T> the payload type
 * @author hal.hildebrand
 */
public class TemporalOctree<T> {
    private static final Logger log = LoggerFactory.getLogger(TemporalOctree.class);

    private final List<Octree<T>> phases;
    private final OctreeConfig    config;

    public TemporalOctree(OctreeConfig config) {
        this.config = Objects.requireNonNull(config, "Octree config cannot be null");
        var trees = new ArrayList<Octree<T>>(Phase.PHASES);
        for (var phase = 0; phase < Phase.PHASES; phase++) {
            trees.add(new Octree<>(config));
        }
        this.phases = Collections.unmodifiableList(trees);
        log.info("Created temporal octree with {} phases: {}", Phase.PHASES, config);
    }

    public TemporalOctree(BoundingBox bounds, int maxDepth) {
        this(OctreeConfig.of(bounds, maxDepth));
    }

    public TemporalOctree(BoundingBox bounds) {
        this(bounds, OctreeConfig.DEFAULT_MAX_DEPTH);
    }

    /**
     * Clear every phase
     */
    public void clear() {
        phases.forEach(Octree::clear);
    }

    public void clear(int phase) {
        if (checkPhase(phase)) {
            phases.get(phase).clear();
        }
    }

    public Optional<T> find(int phase, Vector3 point) {
        if (!checkPhase(phase)) {
            return Optional.empty();
        }
        return phases.get(phase).find(point);
    }

    public Optional<T> find(Phase phase, Vector3 point) {
        return phases.get(phase.value()).find(point);
    }

    public OctreeConfig getConfig() {
        return config;
    }

    /**
     * Raw access to the octree of a phase
     *
     * @throws IndexOutOfBoundsException if the phase is outside [0,11]
     */
    public Octree<T> getPhaseOctree(int phase) {
        return phases.get(Objects.checkIndex(phase, Phase.PHASES));
    }

    public Octree<T> getPhaseOctree(Phase phase) {
        return phases.get(phase.value());
    }

    /**
     * Sum of the statistics of all phases, the depth being the deepest across phases
     */
    public OctreeStats globalStats() {
        var total = OctreeStats.EMPTY;
        for (var tree : phases) {
            total = total.combine(tree.stats());
        }
        return total;
    }

    /**
     * @return true if stored, false if the phase is invalid or the point out of bounds
     */
    public boolean insert(int phase, Vector3 point, T payload) {
        if (!checkPhase(phase)) {
            return false;
        }
        return phases.get(phase).insert(point, payload);
    }

    public boolean insert(Phase phase, Vector3 point, T payload) {
        return phases.get(phase.value()).insert(point, payload);
    }

    /**
     * Count the payloads of each phase by the root octant they lie in. A payload is attributed to the octant of its
     * node's centroid relative to the root center.
     */
    public PhaseOctantMatrix occupancy() {
        var matrix = PhaseOctantMatrix.zeros();
        var rootCenter = config.getBounds().center();
        for (var phase : Phase.all()) {
            phases.get(phase.value()).accept(node -> {
                if (node.hasData()) {
                    matrix.increment(phase, OctantIndex.fromPosition(node.getBounds().center(), rootCenter), 1.0);
                }
                return true;
            });
        }
        return matrix;
    }

    public List<T> queryBoundingBox(int phase, BoundingBox query) {
        if (!checkPhase(phase)) {
            return Collections.emptyList();
        }
        return phases.get(phase).queryBoundingBox(query);
    }

    public List<T> queryBoundingBox(Phase phase, BoundingBox query) {
        return phases.get(phase.value()).queryBoundingBox(query);
    }

    /**
     * Fan the query out to every phase, concatenating the results in phase order
     */
    public List<T> queryBoundingBoxAllPhases(BoundingBox query) {
        var results = new ArrayList<T>();
        for (var tree : phases) {
            results.addAll(tree.queryBoundingBox(query));
        }
        return results;
    }

    public List<T> queryRadius(int phase, Vector3 center, float radius) {
        if (!checkPhase(phase)) {
            return Collections.emptyList();
        }
        return phases.get(phase).queryRadius(center, radius);
    }

    public List<T> queryRadius(Phase phase, Vector3 center, float radius) {
        return phases.get(phase.value()).queryRadius(center, radius);
    }

    private boolean checkPhase(int phase) {
        if (Phase.isValid(phase)) {
            return true;
        }
        log.trace("Ignoring invalid phase {}", phase);
        return false;
    }
}

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
package com.hellblazer.octovalent.octree;

import com.hellblazer.octovalent.geometry.BoundingBox;
import com.hellblazer.octovalent.geometry.Vector3;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Basic test of the Octree container
 *
 * @author hal.hildebrand
 */
public class OctreeTest {

    private static final BoundingBox BOUNDS = new BoundingBox(0, 0, 0, 10, 10, 10);

    private Octree<Integer> octree;

    @BeforeEach
    void setUp() {
        octree = new Octree<>(BOUNDS, 3);
        octree.insert(new Vector3(5, 5, 5), 42);
        octree.insert(new Vector3(2, 8, 3), 99);
    }

    @Test
    void testFind() {
        assertEquals(Optional.of(42), octree.find(new Vector3(5, 5, 5)));
        assertEquals(Optional.of(99), octree.find(new Vector3(2, 8, 3)));
        assertEquals(Optional.of(42), octree.find(new Point3f(5, 5, 5)));
        assertTrue(octree.find(new Vector3(9, 1, 1)).isEmpty(), "empty leaf holds no payload");
    }

    @Test
    void testRadiusQuery() {
        var near = octree.queryRadius(new Vector3(5, 5, 5), 2.0f);
        assertTrue(near.contains(42));
        assertFalse(near.contains(99));

        var wide = octree.queryRadius(new Vector3(5, 5, 5), 7.0f);
        assertEquals(Set.of(42, 99), new HashSet<>(wide));

        assertTrue(octree.queryRadius(new Vector3(5, 5, 5), -1.0f).isEmpty());
        assertTrue(octree.queryRadius(new Vector3(5, 5, 5), Float.NaN).isEmpty());
        assertTrue(octree.queryRadius(new Vector3(100, 100, 100), 10.0f).isEmpty());
    }

    @Test
    void testOutOfBoundsInsertionIsDropped() {
        var before = octree.stats();
        assertFalse(octree.insert(new Vector3(100, 100, 100), 7));
        assertFalse(octree.insert(new Point3f(-0.01f, 5, 5), 8));
        assertTrue(octree.find(new Vector3(100, 100, 100)).isEmpty());
        assertEquals(before, octree.stats());
        assertEquals(2, octree.stats().nodesWithData());
    }

    @Test
    void testFindOutsideBoundsNeverMatches() {
        // (12, 12, 12) classifies into the same octant path as (9.9, 9.9, 9.9) but is outside the root
        octree.insert(new Vector3(9.9f, 9.9f, 9.9f), 5);
        assertEquals(Optional.of(5), octree.find(new Vector3(9.9f, 9.9f, 9.9f)));
        assertTrue(octree.find(new Vector3(12, 12, 12)).isEmpty());
    }

    @Test
    void testBoundingBoxQuery() {
        assertEquals(Set.of(42, 99), new HashSet<>(octree.queryBoundingBox(BOUNDS)));
        assertEquals(List.of(99), octree.queryBoundingBox(new BoundingBox(0, 6, 0, 3, 10, 4)));
        assertEquals(List.of(42), octree.queryBoundingBox(new BoundingBox(4.5f, 4.5f, 4.5f, 5.5f, 5.5f, 5.5f)));
        assertTrue(octree.queryBoundingBox(new BoundingBox(20, 20, 20, 30, 30, 30)).isEmpty());
    }

    @Test
    void testLastInsertionWins() {
        octree.insert(new Vector3(5, 5, 5), 43);
        assertEquals(Optional.of(43), octree.find(new Vector3(5, 5, 5)));
        assertEquals(2, octree.stats().nodesWithData());
    }

    @Test
    void testLazySubdivisionAlongThePath() {
        var tree = new Octree<String>(BOUNDS, 3);
        tree.insert(new Vector3(1, 1, 1), "a");
        var stats = tree.stats();
        // one chain of 3 subdivisions: root + 3 * 8 children
        assertEquals(25, stats.totalNodes());
        assertEquals(22, stats.leafNodes());
        assertEquals(3, stats.internalNodes());
        assertEquals(1, stats.nodesWithData());
        assertEquals(3, stats.maxDepthReached());
        assertEquals(3, tree.effectiveDepth());
        assertEquals(25, tree.nodeCount());
        assertEquals(22, tree.leafCount());
    }

    @Test
    void testPayloadsLiveAtMaximumDepth() {
        octree.accept(node -> {
            assertTrue(node.getDepth() <= octree.getMaxDepth(), "depth bound violated by " + node);
            if (node.hasData()) {
                assertTrue(node.isLeaf());
                assertEquals(octree.getMaxDepth(), node.getDepth());
            }
            return true;
        });
    }

    @Test
    void testSubdivideToDepth() {
        var tree = new Octree<Integer>(BOUNDS, 3);
        tree.subdivideToDepth(2);
        var stats = tree.stats();
        assertEquals(Octree.theoreticalNodeCount(2), stats.totalNodes());
        assertEquals(Octree.leafCountAtDepth(2), stats.leafNodes());
        assertEquals(0, stats.nodesWithData());

        tree.subdivideToDepth(10);
        stats = tree.stats();
        assertEquals(Octree.theoreticalNodeCount(3), stats.totalNodes(), "clamped to the max depth");
        assertEquals(3, stats.maxDepthReached());

        tree.insert(new Vector3(5, 5, 5), 1);
        assertEquals(Octree.theoreticalNodeCount(3), tree.nodeCount(), "pre-built structure is reused");
        assertEquals(Optional.of(1), tree.find(new Vector3(5, 5, 5)));
    }

    @Test
    void testSubdivideToDepthKeepsExistingPayloads() {
        octree.subdivideToDepth(3);
        assertEquals(Optional.of(42), octree.find(new Vector3(5, 5, 5)));
        assertEquals(Optional.of(99), octree.find(new Vector3(2, 8, 3)));
        assertEquals(2, octree.stats().nodesWithData());
    }

    @Test
    void testClear() {
        octree.clear();
        assertEquals(new OctreeStats(1, 1, 0, 0, 0), octree.stats());
        assertTrue(octree.find(new Vector3(5, 5, 5)).isEmpty());
        assertEquals(BOUNDS, octree.getBounds());

        octree.insert(new Vector3(5, 5, 5), 1);
        assertEquals(Optional.of(1), octree.find(new Vector3(5, 5, 5)));
    }

    @Test
    void testDepthZeroTree() {
        var tree = new Octree<String>(BOUNDS, 0);
        assertTrue(tree.insert(new Vector3(1, 2, 3), "root"));
        assertEquals(new OctreeStats(1, 1, 0, 1, 0), tree.stats());
        assertEquals(Optional.of("root"), tree.find(new Vector3(9, 9, 9)));
        assertEquals(List.of("root"), tree.queryBoundingBox(new BoundingBox(9, 9, 9, 20, 20, 20)));
        assertEquals(List.of("root"), tree.queryRadius(new Vector3(5, 5, 5), 0.0f));
    }

    @Test
    void testCapacity() {
        assertEquals(1, Octree.theoreticalNodeCount(0));
        assertEquals(1, Octree.leafCountAtDepth(0));
        assertEquals(9, Octree.theoreticalNodeCount(1));
        assertEquals(8, Octree.leafCountAtDepth(1));
        assertEquals(73, Octree.theoreticalNodeCount(2));
        assertEquals(64, Octree.leafCountAtDepth(2));
        assertEquals(16_777_216L, Octree.leafCountAtDepth(8));
        for (var d = 0; d <= OctreeConfig.MAX_DEPTH_LIMIT; d++) {
            var expected = (Octree.leafCountAtDepth(d) * 8 - 1) / 7;
            if (d < OctreeConfig.MAX_DEPTH_LIMIT) {
                assertEquals(expected, Octree.theoreticalNodeCount(d));
            }
            assertTrue(Octree.theoreticalNodeCount(d) > 0);
        }
        assertThrows(IllegalArgumentException.class, () -> Octree.theoreticalNodeCount(-1));
        assertThrows(IllegalArgumentException.class, () -> Octree.leafCountAtDepth(21));
    }

    @Test
    void testNullPayloadRejected() {
        assertThrows(NullPointerException.class, () -> octree.insert(new Vector3(1, 1, 1), null));
    }

    @Test
    void testDefaults() {
        var tree = new Octree<Integer>(BOUNDS);
        assertEquals(OctreeConfig.DEFAULT_MAX_DEPTH, tree.getMaxDepth());
        assertFalse(tree.getConfig().isExhaustiveRadiusQuery());
        assertTrue(tree.getRoot().isLeaf());
        assertTrue(tree.contains(new Vector3(10, 10, 10)));
        assertFalse(tree.contains(new Vector3(10, 10, 10.5f)));
    }
}

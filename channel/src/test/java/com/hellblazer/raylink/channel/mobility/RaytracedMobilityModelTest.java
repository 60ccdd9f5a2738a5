/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Raylink.
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
package com.hellblazer.raylink.channel.mobility;

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class RaytracedMobilityModelTest {

    @Test
    void testStationaryByDefault() {
        var node = new RaytracedMobilityModel(1, new Point3d(1, 2, 3));

        assertEquals(1, node.nodeId());
        assertSame(TrajectoryDescriptor.CONSTANT, node.trajectory());
    }

    @Test
    void testPositionIsCopied() {
        var initial = new Point3d(1, 2, 3);
        var node = new RaytracedMobilityModel(1, initial);

        initial.x = 50;
        node.getPosition().y = 50;
        assertEquals(new Point3d(1, 2, 3), node.getPosition());

        var update = new Point3d(4, 5, 6);
        node.setPosition(update);
        update.z = 50;
        assertEquals(new Point3d(4, 5, 6), node.getPosition());
    }

    @Test
    void testDistance() {
        var a = new RaytracedMobilityModel(1, new Point3d(0, 0, 0));
        var b = new RaytracedMobilityModel(2, new Point3d(3, 4, 0), TrajectoryDescriptor.RandomWalk.defaults());

        assertEquals(5.0, a.distanceFrom(b), 1e-12);
        assertEquals(5.0, b.distanceFrom(a), 1e-12);
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new RaytracedMobilityModel(-1, new Point3d()));
        assertThrows(NullPointerException.class, () -> new RaytracedMobilityModel(1, null));
        assertThrows(NullPointerException.class, () -> new RaytracedMobilityModel(1, new Point3d(), null));
    }
}

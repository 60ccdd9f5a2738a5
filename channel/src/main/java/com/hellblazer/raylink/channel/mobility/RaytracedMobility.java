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

import javax.vecmath.Point3d;

/**
 * Mobility capability required by the channel state cache.
 * <p>
 * Trajectories of raytraced nodes are simulated inside the oracle. The node's local position is therefore written
 * back from the positions the oracle used, and the oracle is told at session start how to reconstruct each
 * trajectory.
 *
 * @author hal.hildebrand
 */
public interface RaytracedMobility extends MobilityModel {

    /**
     * Overwrite the node's position with one reported by the oracle.
     *
     * @param position new position
     */
    void setPosition(Point3d position);

    /**
     * @return the trajectory description sent to the oracle at session start
     */
    TrajectoryDescriptor trajectory();
}

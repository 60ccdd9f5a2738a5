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
import java.util.Objects;

/**
 * The mobility model for nodes whose channels are raytraced.
 * <p>
 * Holds the last known position and the trajectory description. Movement itself happens inside the oracle; the
 * cache writes the oracle's positions back here whenever it serves channel state for this node.
 *
 * @author hal.hildebrand
 */
public class RaytracedMobilityModel implements RaytracedMobility {

    private final int                  nodeId;
    private final TrajectoryDescriptor trajectory;
    private final Point3d              position;

    /**
     * Create a stationary node.
     *
     * @param nodeId   node id
     * @param position initial position
     */
    public RaytracedMobilityModel(int nodeId, Point3d position) {
        this(nodeId, position, TrajectoryDescriptor.CONSTANT);
    }

    /**
     * @param nodeId     node id
     * @param position   initial position
     * @param trajectory how the oracle moves the node
     */
    public RaytracedMobilityModel(int nodeId, Point3d position, TrajectoryDescriptor trajectory) {
        if (nodeId < 0) {
            throw new IllegalArgumentException("nodeId must be non-negative: " + nodeId);
        }
        Objects.requireNonNull(position, "position cannot be null");
        Objects.requireNonNull(trajectory, "trajectory cannot be null");
        this.nodeId = nodeId;
        this.position = new Point3d(position);
        this.trajectory = trajectory;
    }

    @Override
    public int nodeId() {
        return nodeId;
    }

    @Override
    public Point3d getPosition() {
        return new Point3d(position);
    }

    @Override
    public void setPosition(Point3d position) {
        Objects.requireNonNull(position, "position cannot be null");
        this.position.set(position);
    }

    @Override
    public TrajectoryDescriptor trajectory() {
        return trajectory;
    }

    @Override
    public String toString() {
        return "RaytracedMobilityModel{node=" + nodeId + ", position=" + position + ", trajectory=" + trajectory + "}";
    }
}

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
 * Position source for one simulated node.
 *
 * @author hal.hildebrand
 */
public interface MobilityModel {

    /**
     * @return the id of the node this model moves
     */
    int nodeId();

    /**
     * @return the node's current position (a copy)
     */
    Point3d getPosition();

    /**
     * @param other another mobility model
     * @return euclidean distance in metres
     */
    default double distanceFrom(MobilityModel other) {
        return getPosition().distance(other.getPosition());
    }
}

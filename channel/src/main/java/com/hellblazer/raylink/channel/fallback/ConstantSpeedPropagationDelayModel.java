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
package com.hellblazer.raylink.channel.fallback;

import com.hellblazer.raylink.channel.PropagationDelayModel;
import com.hellblazer.raylink.channel.mobility.MobilityModel;

import java.time.Duration;

/**
 * Delay of a straight line path at constant propagation speed.
 *
 * @author hal.hildebrand
 */
public class ConstantSpeedPropagationDelayModel implements PropagationDelayModel {

    private final double speed;

    public ConstantSpeedPropagationDelayModel() {
        this(FreeSpacePropagationLossModel.SPEED_OF_LIGHT);
    }

    /**
     * @param speed propagation speed (m/s)
     */
    public ConstantSpeedPropagationDelayModel(double speed) {
        if (!(speed > 0.0)) {
            throw new IllegalArgumentException("speed must be positive: " + speed);
        }
        this.speed = speed;
    }

    @Override
    public Duration getDelay(MobilityModel a, MobilityModel b) {
        return delay(a.distanceFrom(b));
    }

    /**
     * @param distance metres
     * @return delay, rounded to the nanosecond
     */
    public Duration delay(double distance) {
        return Duration.ofNanos(Math.round(distance / speed * 1e9));
    }
}

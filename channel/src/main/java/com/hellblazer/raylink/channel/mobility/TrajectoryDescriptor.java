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

import com.hellblazer.raylink.channel.ChannelStateException.ConfigurationException;

import java.time.Duration;
import java.util.Objects;

/**
 * Describes how the oracle should move a node. The starting point is the node's position at session start.
 *
 * @author hal.hildebrand
 */
public sealed interface TrajectoryDescriptor permits TrajectoryDescriptor.ConstantPosition,
                                                     TrajectoryDescriptor.RandomWalk {

    /** Node never moves. */
    TrajectoryDescriptor CONSTANT = new ConstantPosition();

    record ConstantPosition() implements TrajectoryDescriptor {
    }

    /**
     * Random walk that redraws speed and direction whenever its mode condition triggers.
     *
     * @param mode      the redraw condition
     * @param distance  metres between redraws, used in {@link WalkMode#DISTANCE}
     * @param time      time between redraws, used in {@link WalkMode#TIME}
     * @param speed     speed distribution in m/s
     * @param direction direction distribution in radians
     */
    record RandomWalk(WalkMode mode, double distance, Duration time, RandomVariable speed, RandomVariable direction)
    implements TrajectoryDescriptor {

        public static final double         DEFAULT_DISTANCE  = 1.0;
        public static final Duration       DEFAULT_TIME      = Duration.ofSeconds(1);
        public static final RandomVariable DEFAULT_SPEED     = new RandomVariable.Uniform(2.0, 4.0);
        public static final RandomVariable DEFAULT_DIRECTION = new RandomVariable.Uniform(0.0, 6.283184);

        public RandomWalk {
            Objects.requireNonNull(mode, "mode cannot be null");
            Objects.requireNonNull(time, "time cannot be null");
            Objects.requireNonNull(speed, "speed cannot be null");
            Objects.requireNonNull(direction, "direction cannot be null");
            if (mode == WalkMode.DISTANCE && !(distance > 0.0)) {
                throw new ConfigurationException("Distance value must be greater than 0 meters: " + distance);
            }
            if (mode == WalkMode.TIME && (time.isZero() || time.isNegative())) {
                throw new ConfigurationException("Time value must be greater than 0 seconds: " + time);
            }
        }

        public static RandomWalk byDistance(double distance, RandomVariable speed, RandomVariable direction) {
            return new RandomWalk(WalkMode.DISTANCE, distance, DEFAULT_TIME, speed, direction);
        }

        public static RandomWalk byTime(Duration time, RandomVariable speed, RandomVariable direction) {
            return new RandomWalk(WalkMode.TIME, DEFAULT_DISTANCE, time, speed, direction);
        }

        public static RandomWalk reflecting(RandomVariable speed, RandomVariable direction) {
            return new RandomWalk(WalkMode.WALL, DEFAULT_DISTANCE, DEFAULT_TIME, speed, direction);
        }

        /**
         * Walk with the defaults: redraw every metre, speed uniform in [2, 4] m/s, any direction.
         */
        public static RandomWalk defaults() {
            return byDistance(DEFAULT_DISTANCE, DEFAULT_SPEED, DEFAULT_DIRECTION);
        }
    }
}

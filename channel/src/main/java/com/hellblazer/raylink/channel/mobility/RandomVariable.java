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

/**
 * Distribution descriptor for the random variables of a random walk. The oracle draws the samples; the simulator
 * only describes the distribution.
 *
 * @author hal.hildebrand
 */
public sealed interface RandomVariable permits RandomVariable.Uniform, RandomVariable.Constant,
                                               RandomVariable.Normal {

    /**
     * @param min lower bound
     * @param max upper bound
     */
    record Uniform(double min, double max) implements RandomVariable {
        public Uniform {
            if (min > max) {
                throw new IllegalArgumentException("Uniform min " + min + " > max " + max);
            }
        }
    }

    record Constant(double value) implements RandomVariable {
    }

    /**
     * @param mean     mean
     * @param variance variance, not standard deviation
     */
    record Normal(double mean, double variance) implements RandomVariable {
        public Normal {
            if (variance < 0.0) {
                throw new IllegalArgumentException("Normal variance must be non-negative: " + variance);
            }
        }
    }
}

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

import com.hellblazer.raylink.channel.PropagationLossModel;
import com.hellblazer.raylink.channel.mobility.MobilityModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Friis free space pathloss.
 * <p>
 * {@code L = -10 log10(lambda^2 / (16 pi^2 d^2 L_sys))}, clamped below by the minimum loss. The model is only
 * accurate in the far field; distances under three wavelengths are computed anyway and logged.
 *
 * @author hal.hildebrand
 */
public class FreeSpacePropagationLossModel implements PropagationLossModel {

    /** Speed of light in vacuum (m/s). */
    public static final double SPEED_OF_LIGHT = 299792458.0;

    private static final Logger log = LoggerFactory.getLogger(FreeSpacePropagationLossModel.class);

    private final double frequencyHz;
    private final double lambda;
    private final double systemLoss;
    private final double minLossDb;

    /**
     * Lossless system, no minimum loss.
     *
     * @param frequencyHz carrier frequency (Hz)
     */
    public FreeSpacePropagationLossModel(double frequencyHz) {
        this(frequencyHz, 1.0, 0.0);
    }

    /**
     * @param frequencyHz carrier frequency (Hz)
     * @param systemLoss  linear system loss, at least 1
     * @param minLossDb   lower bound on the returned loss (dB)
     */
    public FreeSpacePropagationLossModel(double frequencyHz, double systemLoss, double minLossDb) {
        if (!(frequencyHz > 0.0)) {
            throw new IllegalArgumentException("frequency must be positive: " + frequencyHz);
        }
        if (systemLoss < 1.0) {
            throw new IllegalArgumentException("systemLoss must be >= 1: " + systemLoss);
        }
        this.frequencyHz = frequencyHz;
        this.lambda = SPEED_OF_LIGHT / frequencyHz;
        this.systemLoss = systemLoss;
        this.minLossDb = minLossDb;
    }

    @Override
    public double calcRxPower(double txPowerDbm, MobilityModel a, MobilityModel b) {
        return txPowerDbm - loss(a.distanceFrom(b));
    }

    /**
     * @param distance metres
     * @return pathloss (dB), at least the minimum loss
     */
    public double loss(double distance) {
        if (distance <= 0.0) {
            return minLossDb;
        }
        if (distance < 3 * lambda) {
            log.trace("Distance {}m under three wavelengths ({}m); free space loss is inaccurate", distance,
                      3 * lambda);
        }
        double numerator = lambda * lambda;
        double denominator = 16 * Math.PI * Math.PI * distance * distance * systemLoss;
        double lossDb = -10 * Math.log10(numerator / denominator);
        return Math.max(lossDb, minLossDb);
    }

    @Override
    public String toString() {
        return String.format("FreeSpacePropagationLossModel[f=%.0fHz, systemLoss=%.2f, minLoss=%.2fdB]", frequencyHz,
                             systemLoss, minLossDb);
    }
}

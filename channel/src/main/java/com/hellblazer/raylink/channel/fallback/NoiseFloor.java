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

/**
 * Receiver noise floor from thermal noise, N = F * k * T * B.
 *
 * @author hal.hildebrand
 */
public final class NoiseFloor {

    /** Boltzmann constant (J/K). */
    public static final double BOLTZMANN = 1.3803e-23;

    /** Receiver temperature (K). */
    public static final double TEMPERATURE_KELVIN = 293.0;

    /** Receiver noise figure, linear. Accounts for the non-idealities of the receiver. */
    public static final double NOISE_FIGURE = 5.0;

    private NoiseFloor() {
    }

    /**
     * @param bandwidthHz noise bandwidth in Hz
     * @return noise floor in dBm for the default receiver
     */
    public static double dBm(double bandwidthHz) {
        return dBm(bandwidthHz, NOISE_FIGURE);
    }

    /**
     * @param bandwidthHz noise bandwidth in Hz
     * @param noiseFigure linear noise figure
     * @return noise floor in dBm
     */
    public static double dBm(double bandwidthHz, double noiseFigure) {
        if (bandwidthHz < 0.0) {
            throw new IllegalArgumentException("bandwidth must be non-negative: " + bandwidthHz);
        }
        double thermalWatts = BOLTZMANN * TEMPERATURE_KELVIN * bandwidthHz;
        double noiseWatts = noiseFigure * thermalWatts;
        return 10.0 * Math.log10(noiseWatts / 1e-3);
    }
}

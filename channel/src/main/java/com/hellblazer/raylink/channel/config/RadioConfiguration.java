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
package com.hellblazer.raylink.channel.config;

import com.hellblazer.raylink.channel.ChannelStateException.ConfigurationException;
import com.hellblazer.raylink.channel.fallback.NoiseFloor;

import java.util.Objects;

/**
 * Radio parameters shared with the oracle at session start.
 * <p>
 * Bandwidth and FFT size are the effective values the oracle computes over: the channel plus its guard bands. Use
 * {@link #configure(int, int, int, int)} to derive them from the nominal channel.
 * <p>
 * Immutable. The noise floor is derived once, at construction.
 *
 * @author hal.hildebrand
 */
public final class RadioConfiguration {

    /** Guard band multiplier applied to nominal bandwidth and FFT size. */
    public static final int GUARD_MULTIPLIER = 3;

    /** Upper bound for the nominal channel bandwidth (MHz). */
    public static final int MAX_CHANNEL_BANDWIDTH_MHZ = 10000;

    /** Default minimum coherence time: 100 s. */
    public static final int DEFAULT_MIN_COHERENCE_TIME_MS = 100000;

    public static final int DEFAULT_CENTER_FREQUENCY_MHZ = 5210;
    public static final int DEFAULT_CHANNEL_BANDWIDTH_MHZ = 80;
    public static final int DEFAULT_FFT_SIZE = 1024;
    public static final int DEFAULT_SUBCARRIER_SPACING_HZ = 78125;

    private final int    centerFrequencyMhz;
    private final int    channelBandwidthMhz;
    private final int    fftSize;
    private final int    subcarrierSpacingHz;
    private final int    minCoherenceTimeMs;
    private final double noiseFloorDbm;

    /**
     * @param centerFrequencyMhz  centre frequency (MHz)
     * @param channelBandwidthMhz effective bandwidth including guard bands (MHz)
     * @param fftSize             effective FFT size including guard bands
     * @param subcarrierSpacingHz OFDM subcarrier spacing (Hz)
     * @param minCoherenceTimeMs  upper bound the oracle applies to validity windows (ms)
     * @throws ConfigurationException if a parameter is out of range
     */
    public RadioConfiguration(int centerFrequencyMhz, int channelBandwidthMhz, int fftSize, int subcarrierSpacingHz,
                              int minCoherenceTimeMs) {
        if (centerFrequencyMhz <= 0) {
            throw new ConfigurationException("Center frequency must be positive: " + centerFrequencyMhz);
        }
        if (channelBandwidthMhz <= 0 || channelBandwidthMhz > MAX_CHANNEL_BANDWIDTH_MHZ * GUARD_MULTIPLIER) {
            throw new ConfigurationException(
            "Channel bandwidth must be between 1 and " + MAX_CHANNEL_BANDWIDTH_MHZ * GUARD_MULTIPLIER + " MHz: "
            + channelBandwidthMhz);
        }
        if (fftSize < 0) {
            throw new ConfigurationException("FFT size must be positive: " + fftSize);
        }
        if (subcarrierSpacingHz < 0) {
            throw new ConfigurationException("OFDM subcarrier spacing must be positive: " + subcarrierSpacingHz);
        }
        if (minCoherenceTimeMs <= 0) {
            throw new ConfigurationException("Minimum coherence time must be positive: " + minCoherenceTimeMs);
        }
        this.centerFrequencyMhz = centerFrequencyMhz;
        this.channelBandwidthMhz = channelBandwidthMhz;
        this.fftSize = fftSize;
        this.subcarrierSpacingHz = subcarrierSpacingHz;
        this.minCoherenceTimeMs = minCoherenceTimeMs;
        this.noiseFloorDbm = NoiseFloor.dBm(channelBandwidthMhz * 1e6);
    }

    /**
     * Configure from the nominal channel, applying the guard band multiplier.
     *
     * @param centerFrequencyMhz  centre frequency (MHz)
     * @param channelBandwidthMhz nominal channel bandwidth (MHz)
     * @param fftSize             nominal FFT size over the channel
     * @param subcarrierSpacingHz OFDM subcarrier spacing (Hz)
     * @return the effective configuration
     */
    public static RadioConfiguration configure(int centerFrequencyMhz, int channelBandwidthMhz, int fftSize,
                                               int subcarrierSpacingHz) {
        return configure(centerFrequencyMhz, channelBandwidthMhz, fftSize, subcarrierSpacingHz,
                         DEFAULT_MIN_COHERENCE_TIME_MS);
    }

    /**
     * Configure from the nominal channel, applying the guard band multiplier.
     *
     * @param centerFrequencyMhz  centre frequency (MHz)
     * @param channelBandwidthMhz nominal channel bandwidth (MHz)
     * @param fftSize             nominal FFT size over the channel
     * @param subcarrierSpacingHz OFDM subcarrier spacing (Hz)
     * @param minCoherenceTimeMs  minimum channel coherence time (ms)
     * @return the effective configuration
     */
    public static RadioConfiguration configure(int centerFrequencyMhz, int channelBandwidthMhz, int fftSize,
                                               int subcarrierSpacingHz, int minCoherenceTimeMs) {
        if (channelBandwidthMhz <= 0 || channelBandwidthMhz > MAX_CHANNEL_BANDWIDTH_MHZ) {
            throw new ConfigurationException(
            "Channel bandwidth must be between 1 and " + MAX_CHANNEL_BANDWIDTH_MHZ + " MHz: " + channelBandwidthMhz);
        }
        if (fftSize < 0) {
            throw new ConfigurationException("FFT size must be positive: " + fftSize);
        }
        return new RadioConfiguration(centerFrequencyMhz, channelBandwidthMhz * GUARD_MULTIPLIER,
                                      fftSize * GUARD_MULTIPLIER, subcarrierSpacingHz, minCoherenceTimeMs);
    }

    /**
     * Configure for a Wi-Fi channel.
     *
     * @param standard            the Wi-Fi standard
     * @param centerFrequencyMhz  centre frequency (MHz)
     * @param channelBandwidthMhz nominal channel width (MHz)
     * @return the effective configuration
     */
    public static RadioConfiguration forWifi(WifiStandard standard, int centerFrequencyMhz, int channelBandwidthMhz) {
        return configure(centerFrequencyMhz, channelBandwidthMhz, standard.fftSize(channelBandwidthMhz),
                         standard.subcarrierSpacingHz());
    }

    /**
     * Wi-Fi 6, 80 MHz at 5210 MHz.
     */
    public static RadioConfiguration defaultConfig() {
        return configure(DEFAULT_CENTER_FREQUENCY_MHZ, DEFAULT_CHANNEL_BANDWIDTH_MHZ, DEFAULT_FFT_SIZE,
                         DEFAULT_SUBCARRIER_SPACING_HZ);
    }

    public int centerFrequencyMhz() {
        return centerFrequencyMhz;
    }

    public double centerFrequencyHz() {
        return centerFrequencyMhz * 1e6;
    }

    public int channelBandwidthMhz() {
        return channelBandwidthMhz;
    }

    public int fftSize() {
        return fftSize;
    }

    public int subcarrierSpacingHz() {
        return subcarrierSpacingHz;
    }

    public int minCoherenceTimeMs() {
        return minCoherenceTimeMs;
    }

    /**
     * @return noise floor over the effective bandwidth (dBm)
     */
    public double noiseFloorDbm() {
        return noiseFloorDbm;
    }

    public RadioConfiguration withMinCoherenceTimeMs(int newMinCoherenceTimeMs) {
        return new RadioConfiguration(centerFrequencyMhz, channelBandwidthMhz, fftSize, subcarrierSpacingHz,
                                      newMinCoherenceTimeMs);
    }

    @Override
    public String toString() {
        return String.format("RadioConfiguration[fc=%dMHz, B=%dMHz, FFT=%d, spacing=%dHz, MinTc=%dms, noise=%.2fdBm]",
                             centerFrequencyMhz, channelBandwidthMhz, fftSize, subcarrierSpacingHz,
                             minCoherenceTimeMs, noiseFloorDbm);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (RadioConfiguration) obj;
        return centerFrequencyMhz == other.centerFrequencyMhz && channelBandwidthMhz == other.channelBandwidthMhz
        && fftSize == other.fftSize && subcarrierSpacingHz == other.subcarrierSpacingHz
        && minCoherenceTimeMs == other.minCoherenceTimeMs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(centerFrequencyMhz, channelBandwidthMhz, fftSize, subcarrierSpacingHz, minCoherenceTimeMs);
    }
}

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

/**
 * OFDM numerology of the Wi-Fi standards the oracle can model.
 *
 * @author hal.hildebrand
 */
public enum WifiStandard {
    UNSPECIFIED(0, 0),
    IEEE_802_11A(64, 312500),
    IEEE_802_11B(0, 0),
    IEEE_802_11G(64, 312500),
    IEEE_802_11P(64, 312500),
    IEEE_802_11N(64, 312500),
    IEEE_802_11AC(64, 312500),
    IEEE_802_11AD(0, 0),
    IEEE_802_11AX(256, 78125),
    IEEE_802_11BE(256, 78125);

    private final int fftPer20Mhz;
    private final int subcarrierSpacingHz;

    WifiStandard(int fftPer20Mhz, int subcarrierSpacingHz) {
        this.fftPer20Mhz = fftPer20Mhz;
        this.subcarrierSpacingHz = subcarrierSpacingHz;
    }

    public boolean isSupported() {
        return fftPer20Mhz > 0;
    }

    /**
     * FFT size over a channel. Legacy OFDM standards use a fixed 64 point FFT; HT/VHT and HE/EHT scale with the
     * number of 20 MHz subchannels.
     *
     * @param channelWidthMhz channel width (MHz)
     * @return FFT size over the channel, excluding guard bands
     */
    public int fftSize(int channelWidthMhz) {
        requireSupported();
        return switch (this) {
            case IEEE_802_11A, IEEE_802_11G, IEEE_802_11P -> fftPer20Mhz;
            default -> fftPer20Mhz * (channelWidthMhz / 20);
        };
    }

    /**
     * @return OFDM subcarrier spacing (Hz)
     */
    public int subcarrierSpacingHz() {
        requireSupported();
        return subcarrierSpacingHz;
    }

    private void requireSupported() {
        if (!isSupported()) {
            throw new ConfigurationException("Wi-Fi standard not supported: " + this);
        }
    }
}

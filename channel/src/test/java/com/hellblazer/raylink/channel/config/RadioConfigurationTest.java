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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class RadioConfigurationTest {

    @Test
    void testGuardBandsApplied() {
        var radio = RadioConfiguration.configure(2412, 20, 64, 312500);

        assertEquals(2412, radio.centerFrequencyMhz());
        assertEquals(60, radio.channelBandwidthMhz());
        assertEquals(192, radio.fftSize());
        assertEquals(312500, radio.subcarrierSpacingHz());
        assertEquals(RadioConfiguration.DEFAULT_MIN_COHERENCE_TIME_MS, radio.minCoherenceTimeMs());
    }

    @Test
    void testNoiseFloorOverEffectiveBandwidth() {
        var radio = RadioConfiguration.configure(2412, 20, 64, 312500);

        assertEquals(NoiseFloor.dBm(60e6), radio.noiseFloorDbm(), 1e-12);
        assertEquals(-89.16, radio.noiseFloorDbm(), 0.01);
    }

    @Test
    void testDefaults() {
        var radio = RadioConfiguration.defaultConfig();

        assertEquals(5210, radio.centerFrequencyMhz());
        assertEquals(240, radio.channelBandwidthMhz());
        assertEquals(3072, radio.fftSize());
        assertEquals(78125, radio.subcarrierSpacingHz());
        assertEquals(100000, radio.minCoherenceTimeMs());
        assertEquals(5.21e9, radio.centerFrequencyHz(), 1.0);
    }

    @Test
    void testWifiNumerology() {
        assertEquals(RadioConfiguration.defaultConfig(), RadioConfiguration.forWifi(WifiStandard.IEEE_802_11AX, 5210, 80));

        var legacy = RadioConfiguration.forWifi(WifiStandard.IEEE_802_11A, 5180, 20);
        assertEquals(192, legacy.fftSize());
        assertEquals(312500, legacy.subcarrierSpacingHz());
    }

    @Test
    void testValidation() {
        assertThrows(ConfigurationException.class, () -> RadioConfiguration.configure(-1, 20, 64, 312500));
        assertThrows(ConfigurationException.class, () -> RadioConfiguration.configure(2412, -1, 64, 312500));
        assertThrows(ConfigurationException.class, () -> RadioConfiguration.configure(2412, 10001, 64, 312500));
        assertThrows(ConfigurationException.class, () -> RadioConfiguration.configure(2412, 20, -1, 312500));
        assertThrows(ConfigurationException.class, () -> RadioConfiguration.configure(2412, 20, 64, -1));
        assertThrows(ConfigurationException.class, () -> RadioConfiguration.configure(2412, 20, 64, 312500, 0));

        assertDoesNotThrow(() -> RadioConfiguration.configure(1, 10000, 0, 0));
    }

    @Test
    void testZeroFrequencyAndBandwidthRejected() {
        assertThrows(ConfigurationException.class, () -> new RadioConfiguration(0, 60, 192, 312500, 100000));
        assertThrows(ConfigurationException.class, () -> new RadioConfiguration(2412, 0, 192, 312500, 100000));
        assertThrows(ConfigurationException.class, () -> RadioConfiguration.configure(0, 20, 64, 312500));
        assertThrows(ConfigurationException.class, () -> RadioConfiguration.configure(2412, 0, 64, 312500));
    }

    @Test
    void testWithMinCoherenceTime() {
        var radio = RadioConfiguration.defaultConfig();
        var shorter = radio.withMinCoherenceTimeMs(50);

        assertEquals(50, shorter.minCoherenceTimeMs());
        assertEquals(radio.channelBandwidthMhz(), shorter.channelBandwidthMhz());
        assertNotEquals(radio, shorter);
        assertEquals(radio, shorter.withMinCoherenceTimeMs(100000));
        assertEquals(radio.hashCode(), shorter.withMinCoherenceTimeMs(100000).hashCode());
    }
}

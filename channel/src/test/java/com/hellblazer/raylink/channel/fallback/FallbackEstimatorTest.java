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

import com.hellblazer.raylink.channel.config.RadioConfiguration;
import com.hellblazer.raylink.channel.mobility.RaytracedMobilityModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class FallbackEstimatorTest {

    private RadioConfiguration     radio;
    private RaytracedMobilityModel a;
    private RaytracedMobilityModel near;
    private RaytracedMobilityModel far;

    @BeforeEach
    void setUp() {
        radio = RadioConfiguration.configure(2412, 20, 64, 312500);
        a = new RaytracedMobilityModel(1, new Point3d());
        near = new RaytracedMobilityModel(2, new Point3d(10, 0, 0));
        far = new RaytracedMobilityModel(3, new Point3d(100, 0, 0));
    }

    @Test
    void testEstimatorUsesConfiguredRadio() {
        var estimator = new FallbackEstimator(radio, 0.0);

        assertEquals(radio.noiseFloorDbm(), estimator.noiseFloorDbm());
        assertEquals(new FreeSpacePropagationLossModel(2.412e9).calcRxPower(-20.0, a, far),
                     estimator.rxPower(-20.0, a, far), 1e-9);
    }

    @Test
    void testBelowNoiseFloorDecision() {
        var estimator = new FallbackEstimator(radio, 0.0);

        assertTrue(estimator.isBelowNoiseFloor(-20.0, a, far));
        assertFalse(estimator.isBelowNoiseFloor(20.0, a, far));
        assertFalse(estimator.isBelowNoiseFloor(-20.0, a, near));
    }

    @Test
    void testMarginRaisesTheBar() {
        var rx = new FallbackEstimator(radio, 0.0).rxPower(-20.0, a, far);
        var gap = radio.noiseFloorDbm() - rx;

        assertTrue(new FallbackEstimator(radio, gap - 0.5).isBelowNoiseFloor(-20.0, a, far));
        assertFalse(new FallbackEstimator(radio, gap + 0.5).isBelowNoiseFloor(-20.0, a, far));
    }

    @Test
    void testLossIsTransmitMinusReceived() {
        var estimator = new FallbackEstimator(radio, 0.0);

        assertEquals(-20.0 - estimator.rxPower(-20.0, a, far), estimator.loss(a, far), 1e-9);
        assertEquals(Duration.ofNanos(334), estimator.delay(a, far));
    }
}

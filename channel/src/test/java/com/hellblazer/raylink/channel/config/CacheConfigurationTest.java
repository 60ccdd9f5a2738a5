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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class CacheConfigurationTest {

    @Test
    void testDefaults() {
        var config = CacheConfiguration.defaultConfig();

        assertTrue(config.caching());
        assertTrue(config.optimize());
        assertEquals(0.0, config.optimizeMarginDb());
        assertEquals(20.0, config.delayProbeTxPowerDbm());
        assertEquals(0, config.fullSweepInterval());
    }

    @Test
    void testWithMethods() {
        var config = CacheConfiguration.defaultConfig()
                                       .withCaching(false)
                                       .withOptimize(false)
                                       .withOptimizeMarginDb(3.0)
                                       .withDelayProbeTxPowerDbm(10.0)
                                       .withFullSweepInterval(100);

        assertFalse(config.caching());
        assertFalse(config.optimize());
        assertEquals(3.0, config.optimizeMarginDb());
        assertEquals(10.0, config.delayProbeTxPowerDbm());
        assertEquals(100, config.fullSweepInterval());
        assertEquals(config, new CacheConfiguration(false, false, 3.0, 10.0, 100));
        assertNotEquals(config, CacheConfiguration.defaultConfig());
    }

    @Test
    void testValidation() {
        assertThrows(ConfigurationException.class,
                     () -> CacheConfiguration.defaultConfig().withOptimizeMarginDb(Double.NaN));
        assertThrows(ConfigurationException.class,
                     () -> CacheConfiguration.defaultConfig().withOptimizeMarginDb(Double.POSITIVE_INFINITY));
        assertThrows(ConfigurationException.class, () -> CacheConfiguration.defaultConfig().withFullSweepInterval(-1));
    }
}

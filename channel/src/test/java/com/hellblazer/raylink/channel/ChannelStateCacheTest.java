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
package com.hellblazer.raylink.channel;

import com.hellblazer.raylink.channel.ChannelStateException.CacheConsistencyException;
import com.hellblazer.raylink.channel.ChannelStateException.ConfigurationException;
import com.hellblazer.raylink.channel.ChannelStateException.ProtocolViolationException;
import com.hellblazer.raylink.channel.config.CacheConfiguration;
import com.hellblazer.raylink.channel.config.RadioConfiguration;
import com.hellblazer.raylink.channel.mobility.MobilityModel;
import com.hellblazer.raylink.channel.mobility.RaytracedMobilityModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Tests for ChannelStateCache - windowed lookup, refill, fast path and position write-back.
 *
 * @author hal.hildebrand
 */
class ChannelStateCacheTest {

    private static final Point3d POSITION_A = new Point3d(0, 0, 0);
    private static final Point3d POSITION_B = new Point3d(10, 0, 0);
    private static final Point3d POSITION_C = new Point3d(0, 10, 0);

    private ChannelOracle          oracle;
    private AtomicLong             now;
    private RadioConfiguration     radio;
    private ChannelStateCache      cache;
    private RaytracedMobilityModel a;
    private RaytracedMobilityModel b;
    private RaytracedMobilityModel c;

    @BeforeEach
    void setUp() {
        oracle = mock(ChannelOracle.class);
        now = new AtomicLong();
        radio = RadioConfiguration.configure(2412, 20, 64, 312500);
        cache = new ChannelStateCache(oracle, now::get, radio);
        a = new RaytracedMobilityModel(1, POSITION_A);
        b = new RaytracedMobilityModel(2, POSITION_B);
        c = new RaytracedMobilityModel(3, POSITION_C);
    }

    @Test
    void testSecondLookupIsServedFromCache() {
        when(oracle.query(1, 2, 0L)).thenReturn(List.of(entry(1, 2, 0, 1_000_000_000L, 60.0)));

        var first = cache.getLoss(a, b, 20.0);
        var second = cache.getLoss(a, b, 20.0);

        assertEquals(60.0, first);
        assertEquals(first, second);
        verify(oracle, times(1)).query(anyInt(), anyInt(), anyLong());

        var stats = cache.getStatistics();
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(1, stats.roundTrips());
        assertEquals(0.5, stats.hitRatio(), 1e-9);
    }

    @Test
    void testReciprocalQueriesShareOneEntry() {
        when(oracle.query(1, 2, 0L)).thenReturn(List.of(entry(1, 2, 0, 1000, 72.5)));

        assertEquals(72.5, cache.getLoss(a, b));
        assertEquals(72.5, cache.getLoss(b, a));
        assertEquals(Duration.ofNanos(33), cache.getDelay(b, a));

        verify(oracle, times(1)).query(anyInt(), anyInt(), anyLong());
        assertEquals(1, cache.bucket(CacheKey.of(2, 1)).size());
    }

    @Test
    void testEntryServedThroughEndOfWindowThenRefilled() {
        when(oracle.query(anyInt(), anyInt(), anyLong())).thenReturn(List.of(entry(1, 2, 0, 1000, 60.0)))
                                                         .thenReturn(List.of(entry(1, 2, 1001, 2000, 65.0)));

        assertEquals(60.0, cache.getLoss(a, b));
        now.set(1000);
        assertEquals(60.0, cache.getLoss(a, b));
        verify(oracle, times(1)).query(anyInt(), anyInt(), anyLong());

        now.set(1001);
        assertEquals(65.0, cache.getLoss(a, b));
        verify(oracle).query(1, 2, 1001L);
        assertEquals(1, cache.size(), "Expired entry should have been swept");
    }

    @Test
    void testLookAheadFanOutAvoidsRoundTrips() {
        when(oracle.query(1, 2, 0L)).thenReturn(
        List.of(entry(1, 2, 0, 100, 60.0), entry(1, 3, 0, 100, 61.0), entry(1, 2, 101, 200, 62.0),
                entry(1, 3, 101, 200, 63.0)));

        assertEquals(60.0, cache.getLoss(a, b));
        assertEquals(61.0, cache.getLoss(a, c));

        now.set(150);
        assertEquals(62.0, cache.getLoss(a, b));
        assertEquals(63.0, cache.getLoss(c, a));

        verify(oracle, times(1)).query(anyInt(), anyInt(), anyLong());
        var stats = cache.getStatistics();
        assertEquals(3, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(2, stats.buckets());
        assertEquals(2, stats.entries());
    }

    @Test
    void testFirstLiveEntryWinsOnOverlap() {
        when(oracle.query(1, 2, 50L)).thenReturn(List.of(entry(1, 2, 0, 100, 70.0), entry(1, 2, 0, 200, 80.0)));

        now.set(50);
        assertEquals(70.0, cache.getLoss(a, b));

        now.set(150);
        assertEquals(80.0, cache.getLoss(a, b));
        verify(oracle, times(1)).query(anyInt(), anyInt(), anyLong());
    }

    @Test
    void testPositionsWrittenBackInQueryOrientation() {
        var oracleTx = new Point3d(5, 0, 0);
        var oracleRx = new Point3d(0, 0, 7);
        when(oracle.query(1, 2, 0L)).thenReturn(
        List.of(CacheEntry.wideband(20, 55.0, 0, 1000, 2, 1, oracleTx, oracleRx)));

        cache.getLoss(a, b);

        assertEquals(oracleRx, a.getPosition());
        assertEquals(oracleTx, b.getPosition());

        a.setPosition(POSITION_A);
        b.setPosition(POSITION_B);
        cache.getLoss(b, a);

        assertEquals(oracleRx, a.getPosition());
        assertEquals(oracleTx, b.getPosition());
    }

    @Test
    void testFastPathSkipsOracle() {
        var far = new RaytracedMobilityModel(4, new Point3d(100, 0, 0));
        var estimate = cache.getFallback();

        var loss = cache.getLoss(a, far, -20.0);

        assertEquals(-20.0 - estimate.rxPower(-20.0, a, far), loss, 1e-9);
        assertEquals(estimate.loss(a, far), loss, 1e-9);
        verifyNoInteractions(oracle);

        var stats = cache.getStatistics();
        assertEquals(1, stats.shortCircuits());
        assertEquals(0, stats.lookups());
        assertEquals(new Point3d(100, 0, 0), far.getPosition(), "Fast path never moves nodes");
    }

    @Test
    void testFastPathDelayUsesConstantSpeed() {
        var far = new RaytracedMobilityModel(4, new Point3d(10_000, 0, 0));

        assertEquals(Duration.ofNanos(33356), cache.getDelay(a, far));
        verifyNoInteractions(oracle);
        assertEquals(1, cache.getStatistics().shortCircuits());
    }

    @Test
    void testOptimizeDisabledAlwaysRaytraces() {
        cache = new ChannelStateCache(oracle, now::get, radio, CacheConfiguration.defaultConfig().withOptimize(false));
        var far = new RaytracedMobilityModel(4, new Point3d(100, 0, 0));
        when(oracle.query(1, 4, 0L)).thenReturn(List.of(entry(1, 4, 0, 1000, 95.0)));

        assertEquals(95.0, cache.getLoss(a, far, -20.0));
        verify(oracle).query(1, 4, 0L);
        assertEquals(0, cache.getStatistics().shortCircuits());
    }

    @Test
    void testMarginKeepsBorderlineLinkRaytraced() {
        var far = new RaytracedMobilityModel(4, new Point3d(100, 0, 0));
        var rx = cache.getFallback().rxPower(-20.0, a, far);
        var margin = radio.noiseFloorDbm() - rx + 1.0;
        cache = new ChannelStateCache(oracle, now::get, radio,
                                      CacheConfiguration.defaultConfig().withOptimizeMarginDb(margin));
        when(oracle.query(1, 4, 0L)).thenReturn(List.of(entry(1, 4, 0, 1000, 95.0)));

        assertEquals(95.0, cache.getLoss(a, far, -20.0));
        verify(oracle).query(1, 4, 0L);
    }

    @Test
    void testCsiAndFrequenciesNeverShortCircuit() {
        var far = new RaytracedMobilityModel(4, new Point3d(10_000, 0, 0));
        var frequencies = List.of(2.4e9, 2.4003125e9);
        var cfr = List.of(new Complex(1.0e-6, 0.0), new Complex(0.0, -2.0e-6));
        when(oracle.query(1, 4, 0L)).thenReturn(
        List.of(new CacheEntry(33356, 120.0, 0, 1000, 1, 4, POSITION_A, new Point3d(10_000, 0, 0), frequencies,
                               cfr)));

        assertEquals(cfr, cache.getCsi(a, far));
        assertEquals(frequencies, cache.getFrequencies(far, a));
        verify(oracle, times(1)).query(anyInt(), anyInt(), anyLong());
        assertEquals(0, cache.getStatistics().shortCircuits());
    }

    @Test
    void testNoLiveEntryAfterRefillIsConsistencyViolation() {
        when(oracle.query(1, 2, 500L)).thenReturn(List.of(entry(1, 3, 0, 1000, 60.0), entry(1, 2, 0, 100, 60.0)));
        now.set(500);

        var e = assertThrows(CacheConsistencyException.class, () -> cache.getLoss(a, b));
        assertTrue(e.getMessage().contains("[1<->2]"));
        assertEquals(1, cache.bucket(CacheKey.of(1, 3)).size(), "Other pairs are still ingested");
    }

    @Test
    void testMissingResponseIsProtocolViolation() {
        when(oracle.query(1, 2, 0L)).thenReturn(null);

        assertThrows(ProtocolViolationException.class, () -> cache.getLoss(a, b));
    }

    @Test
    void testCachingDisabledRoundTripsEveryLookup() {
        cache = new ChannelStateCache(oracle, now::get, radio, CacheConfiguration.defaultConfig().withCaching(false));
        when(oracle.query(1, 2, 0L)).thenReturn(List.of(entry(1, 2, 0, 1000, 60.0)));

        cache.getLoss(a, b);
        cache.getLoss(a, b);

        verify(oracle, times(2)).query(1, 2, 0L);
        assertEquals(0, cache.getStatistics().hits());
        assertEquals(2, cache.getStatistics().misses());
    }

    @Test
    void testSweepExpiredDropsEmptiedBuckets() {
        when(oracle.query(1, 2, 0L)).thenReturn(
        List.of(entry(1, 2, 0, 500, 60.0), entry(1, 3, 0, 100, 61.0), entry(2, 3, 0, 100, 62.0)));
        cache.getLoss(a, b);
        assertEquals(3, cache.size());

        now.set(200);
        assertEquals(2, cache.sweepExpired());
        assertEquals(1, cache.size());
        assertEquals(1, cache.getStatistics().buckets());
        assertTrue(cache.bucket(CacheKey.of(1, 3)).isEmpty());
    }

    @Test
    void testPeriodicFullSweep() {
        cache = new ChannelStateCache(oracle, now::get, radio,
                                      CacheConfiguration.defaultConfig().withFullSweepInterval(2));
        when(oracle.query(1, 2, 0L)).thenReturn(List.of(entry(1, 2, 0, 1000, 60.0), entry(1, 3, 0, 10, 61.0)));

        cache.getLoss(a, b);
        assertEquals(2, cache.size());

        now.set(500);
        cache.getLoss(a, b);
        assertEquals(1, cache.size());
    }

    @Test
    void testClearKeepsCounters() {
        when(oracle.query(anyInt(), anyInt(), anyLong())).thenReturn(List.of(entry(1, 2, 0, 1000, 60.0)));
        cache.getLoss(a, b);

        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(1, cache.getStatistics().misses());
        cache.getLoss(a, b);
        verify(oracle, times(2)).query(anyInt(), anyInt(), anyLong());
    }

    @Test
    void testStatisticsBeforeAnyLookup() {
        var stats = cache.getStatistics();

        assertEquals(0, stats.lookups());
        assertEquals(0.0, stats.hitRatio());
        cache.printStatistics();
    }

    @Test
    void testEndToEndTwoStationaryNodes() {
        when(oracle.query(1, 2, 0L)).thenReturn(
        List.of(CacheEntry.wideband(33, 62.3, 0, 100_000_000_000L, 1, 2, POSITION_A, POSITION_B)));

        var first = cache.getLoss(a, b, 20.0);
        assertEquals(1, cache.getStatistics().roundTrips());

        var second = cache.getLoss(a, b, 20.0);
        assertEquals(1, cache.getStatistics().roundTrips());
        assertEquals(first, second);
        assertEquals(POSITION_A, a.getPosition());
        assertEquals(POSITION_B, b.getPosition());
    }

    @Test
    void testConfigurationErrors() {
        assertThrows(ConfigurationException.class, () -> new ChannelStateCache(null, now::get, radio));
        assertThrows(ConfigurationException.class, () -> new ChannelStateCache(oracle, null, radio));
        assertThrows(ConfigurationException.class, () -> new ChannelStateCache(oracle, now::get, null));

        var plain = mock(MobilityModel.class);
        when(plain.nodeId()).thenReturn(9);
        when(plain.getPosition()).thenReturn(new Point3d());
        assertThrows(ConfigurationException.class, () -> cache.getLoss(a, plain));
        assertThrows(ConfigurationException.class, () -> cache.getDelay(plain, a));
        assertThrows(ConfigurationException.class, () -> cache.getCsi(a, null));

        var twin = new RaytracedMobilityModel(1, POSITION_B);
        assertThrows(ConfigurationException.class, () -> cache.getLoss(a, twin));
        verifyNoInteractions(oracle);
    }

    private static CacheEntry entry(int tx, int rx, long start, long end, double loss) {
        return CacheEntry.wideband(33, loss, start, end, tx, rx, position(tx), position(rx));
    }

    private static Point3d position(int id) {
        return switch (id) {
            case 1 -> POSITION_A;
            case 2 -> POSITION_B;
            case 3 -> POSITION_C;
            default -> new Point3d(100, 0, 0);
        };
    }
}

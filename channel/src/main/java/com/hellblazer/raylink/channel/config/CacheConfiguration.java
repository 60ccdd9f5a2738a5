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

import java.util.Objects;

/**
 * Behaviour switches of the channel state cache.
 * <p>
 * Immutable; use the {@code withX} methods to derive variants.
 *
 * @author hal.hildebrand
 */
public final class CacheConfiguration {

    /** Default fast path margin (dB). */
    public static final double DEFAULT_OPTIMIZE_MARGIN_DB = 0.0;

    /** Transmit power assumed when deciding whether a delay query can skip the oracle (dBm). */
    public static final double DEFAULT_DELAY_PROBE_TX_POWER_DBM = 20.0;

    /** Full table sweeps are off by default. */
    public static final int DEFAULT_FULL_SWEEP_INTERVAL = 0;

    private final boolean caching;
    private final boolean optimize;
    private final double  optimizeMarginDb;
    private final double  delayProbeTxPowerDbm;
    private final int     fullSweepInterval;

    /**
     * @param caching              serve from stored entries; when false every lookup is a round trip
     * @param optimize             skip the oracle for links below the noise floor
     * @param optimizeMarginDb     margin added to the estimated received power before comparing to the noise floor
     * @param delayProbeTxPowerDbm transmit power assumed for delay queries on the fast path
     * @param fullSweepInterval    sweep expired entries of every bucket after this many lookups, 0 disables
     */
    public CacheConfiguration(boolean caching, boolean optimize, double optimizeMarginDb, double delayProbeTxPowerDbm,
                              int fullSweepInterval) {
        if (Double.isNaN(optimizeMarginDb) || Double.isInfinite(optimizeMarginDb)) {
            throw new ConfigurationException("Optimize margin must be finite: " + optimizeMarginDb);
        }
        if (fullSweepInterval < 0) {
            throw new ConfigurationException("Full sweep interval must be non-negative: " + fullSweepInterval);
        }
        this.caching = caching;
        this.optimize = optimize;
        this.optimizeMarginDb = optimizeMarginDb;
        this.delayProbeTxPowerDbm = delayProbeTxPowerDbm;
        this.fullSweepInterval = fullSweepInterval;
    }

    public static CacheConfiguration defaultConfig() {
        return new CacheConfiguration(true, true, DEFAULT_OPTIMIZE_MARGIN_DB, DEFAULT_DELAY_PROBE_TX_POWER_DBM,
                                      DEFAULT_FULL_SWEEP_INTERVAL);
    }

    public boolean caching() {
        return caching;
    }

    public boolean optimize() {
        return optimize;
    }

    public double optimizeMarginDb() {
        return optimizeMarginDb;
    }

    public double delayProbeTxPowerDbm() {
        return delayProbeTxPowerDbm;
    }

    public int fullSweepInterval() {
        return fullSweepInterval;
    }

    public CacheConfiguration withCaching(boolean newCaching) {
        return new CacheConfiguration(newCaching, optimize, optimizeMarginDb, delayProbeTxPowerDbm, fullSweepInterval);
    }

    public CacheConfiguration withOptimize(boolean newOptimize) {
        return new CacheConfiguration(caching, newOptimize, optimizeMarginDb, delayProbeTxPowerDbm, fullSweepInterval);
    }

    public CacheConfiguration withOptimizeMarginDb(double newMargin) {
        return new CacheConfiguration(caching, optimize, newMargin, delayProbeTxPowerDbm, fullSweepInterval);
    }

    public CacheConfiguration withDelayProbeTxPowerDbm(double newPower) {
        return new CacheConfiguration(caching, optimize, optimizeMarginDb, newPower, fullSweepInterval);
    }

    public CacheConfiguration withFullSweepInterval(int newInterval) {
        return new CacheConfiguration(caching, optimize, optimizeMarginDb, delayProbeTxPowerDbm, newInterval);
    }

    @Override
    public String toString() {
        return String.format(
        "CacheConfiguration[caching=%s, optimize=%s, margin=%.2fdB, delayProbe=%.2fdBm, fullSweepInterval=%d]",
        caching, optimize, optimizeMarginDb, delayProbeTxPowerDbm, fullSweepInterval);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (CacheConfiguration) obj;
        return caching == other.caching && optimize == other.optimize
        && Double.compare(optimizeMarginDb, other.optimizeMarginDb) == 0
        && Double.compare(delayProbeTxPowerDbm, other.delayProbeTxPowerDbm) == 0
        && fullSweepInterval == other.fullSweepInterval;
    }

    @Override
    public int hashCode() {
        return Objects.hash(caching, optimize, optimizeMarginDb, delayProbeTxPowerDbm, fullSweepInterval);
    }
}

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

import javax.vecmath.Point3d;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * One oracle-computed channel state, valid over the simulated-time window {@code [startNanos, endNanos]}.
 * <p>
 * The tx/rx orientation is the one the oracle computed the state in, which need not match the orientation of the
 * query that caused it. The recorded positions are the frame of reference the oracle used and are authoritative
 * for this entry.
 * <p>
 * Immutable. Positions are copied in and out since {@link Point3d} is mutable.
 *
 * @param delayNanos     propagation delay
 * @param widebandLossDb wideband pathloss in dB
 * @param startNanos     first simulated instant the state is valid
 * @param endNanos       last simulated instant the state is valid
 * @param txId           transmitter node id as computed by the oracle
 * @param rxId           receiver node id as computed by the oracle
 * @param txPosition     transmitter position used by the oracle
 * @param rxPosition     receiver position used by the oracle
 * @param frequencies    subcarrier centre frequencies in Hz, may be empty
 * @param cfr            channel frequency response per subcarrier, same length as frequencies
 * @author hal.hildebrand
 */
public record CacheEntry(long delayNanos, double widebandLossDb, long startNanos, long endNanos, int txId, int rxId,
                         Point3d txPosition, Point3d rxPosition, List<Double> frequencies, List<Complex> cfr) {

    public CacheEntry {
        Objects.requireNonNull(txPosition, "txPosition cannot be null");
        Objects.requireNonNull(rxPosition, "rxPosition cannot be null");
        Objects.requireNonNull(frequencies, "frequencies cannot be null");
        Objects.requireNonNull(cfr, "cfr cannot be null");
        if (startNanos > endNanos) {
            throw new IllegalArgumentException("Window start after end: [" + startNanos + ", " + endNanos + "]");
        }
        if (frequencies.size() != cfr.size()) {
            throw new IllegalArgumentException(
            "Frequencies and CFR differ in length: " + frequencies.size() + " != " + cfr.size());
        }
        txPosition = new Point3d(txPosition);
        rxPosition = new Point3d(rxPosition);
        frequencies = List.copyOf(frequencies);
        cfr = List.copyOf(cfr);
    }

    /**
     * Entry without per-subcarrier state.
     */
    public static CacheEntry wideband(long delayNanos, double widebandLossDb, long startNanos, long endNanos,
                                      int txId, int rxId, Point3d txPosition, Point3d rxPosition) {
        return new CacheEntry(delayNanos, widebandLossDb, startNanos, endNanos, txId, rxId, txPosition, rxPosition,
                              List.of(), List.of());
    }

    public CacheKey key() {
        return CacheKey.of(txId, rxId);
    }

    public Duration delay() {
        return Duration.ofNanos(delayNanos);
    }

    public int subcarrierCount() {
        return cfr.size();
    }

    /**
     * @param now simulated time in nanoseconds
     * @return true if {@code start <= now <= end}
     */
    public boolean isLive(long now) {
        return startNanos <= now && now <= endNanos;
    }

    /**
     * @param now simulated time in nanoseconds
     * @return true if the window closed before now
     */
    public boolean isExpired(long now) {
        return endNanos < now;
    }

    @Override
    public Point3d txPosition() {
        return new Point3d(txPosition);
    }

    @Override
    public Point3d rxPosition() {
        return new Point3d(rxPosition);
    }

    /**
     * The position the oracle used for the given endpoint of this entry.
     *
     * @param nodeId txId or rxId
     * @return a copy of that endpoint's position
     */
    public Point3d positionOf(int nodeId) {
        if (nodeId == txId) {
            return txPosition();
        }
        if (nodeId == rxId) {
            return rxPosition();
        }
        throw new IllegalArgumentException("Node " + nodeId + " is not an endpoint of " + key());
    }

    @Override
    public String toString() {
        return String.format("CacheEntry{%d->%d, window=[%d, %d]ns, delay=%dns, loss=%.2fdB, subcarriers=%d}", txId,
                             rxId, startNanos, endNanos, delayNanos, widebandLossDb, cfr.size());
    }
}

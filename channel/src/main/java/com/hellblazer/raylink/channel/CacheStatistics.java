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

/**
 * Point-in-time snapshot of the cache counters. Reporting only.
 *
 * @param hits          lookups served from a stored entry
 * @param misses        lookups that required an oracle round trip
 * @param roundTrips    oracle round trips performed
 * @param shortCircuits lookups answered by the fallback estimator without touching the cache
 * @param buckets       node pairs with at least one stored entry
 * @param entries       stored entries, live or not yet swept
 * @author hal.hildebrand
 */
public record CacheStatistics(long hits, long misses, long roundTrips, long shortCircuits, int buckets, int entries) {

    /**
     * @return cache lookups, excluding short circuits
     */
    public long lookups() {
        return hits + misses;
    }

    /**
     * @return hits / lookups, or 0 when nothing has been looked up
     */
    public double hitRatio() {
        var lookups = lookups();
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    @Override
    public String toString() {
        return String.format("CacheStatistics{lookups=%d, misses=%d, hitRatio=%.4f, roundTrips=%d, shortCircuits=%d, "
                             + "buckets=%d, entries=%d}", lookups(), misses, hitRatio(), roundTrips, shortCircuits,
                             buckets, entries);
    }
}

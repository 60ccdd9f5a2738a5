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
 * Canonical key for the unordered pair of nodes sharing one reciprocal channel.
 * <p>
 * The smaller node id is always stored first, so {@code CacheKey.of(a, b).equals(CacheKey.of(b, a))}.
 *
 * @param first  the smaller node id
 * @param second the larger node id
 * @author hal.hildebrand
 */
public record CacheKey(int first, int second) implements Comparable<CacheKey> {

    public CacheKey {
        if (first < 0 || second < 0) {
            throw new IllegalArgumentException("Node ids must be non-negative: " + first + ", " + second);
        }
        if (first > second) {
            throw new IllegalArgumentException("CacheKey not canonical: " + first + " > " + second);
        }
    }

    /**
     * Canonicalize a pair of node ids.
     *
     * @param a one endpoint
     * @param b the other endpoint
     * @return the key shared by (a, b) and (b, a)
     */
    public static CacheKey of(int a, int b) {
        return a < b ? new CacheKey(a, b) : new CacheKey(b, a);
    }

    @Override
    public int compareTo(CacheKey other) {
        if (first != other.first) {
            return Integer.compare(first, other.first);
        }
        return Integer.compare(second, other.second);
    }

    @Override
    public String toString() {
        return "[" + first + "<->" + second + "]";
    }
}

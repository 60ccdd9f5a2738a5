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

import java.util.List;

/**
 * The request/reply seam to the external ray-tracing oracle.
 * <p>
 * A query is one synchronous round trip: it blocks the calling simulation thread until the reply arrives while
 * simulated time stays frozen. The reply is a flat list of channel states, usually covering more than the queried
 * pair: other receivers of the same transmitter and future validity windows computed ahead of need. Interpreting
 * that fan-out is the cache's job.
 *
 * @author hal.hildebrand
 */
public interface ChannelOracle {

    /**
     * Perform exactly one channel state exchange.
     *
     * @param txId      the querying transmitter
     * @param rxId      the querying receiver
     * @param timeNanos current simulated time
     * @return every channel state carried by the reply, in wire order
     * @throws ChannelStateException.TransportFailureException  if no reply is received
     * @throws ChannelStateException.ProtocolViolationException if the reply is not a channel state response
     */
    List<CacheEntry> query(int txId, int rxId, long timeNanos);
}

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
import com.hellblazer.raylink.channel.fallback.FallbackEstimator;
import com.hellblazer.raylink.channel.mobility.MobilityModel;
import com.hellblazer.raylink.channel.mobility.NodeRoster;
import com.hellblazer.raylink.channel.mobility.RaytracedMobility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pull-through cache of raytraced channel state, keyed by unordered node pair and windowed in simulated time.
 * <p>
 * Every accessor follows the same sequence:
 * <ol>
 *   <li>Fast path: if optimization is on and the free space received power plus margin is below the noise floor,
 *   answer from the fallback estimator without touching the store or the oracle</li>
 *   <li>Sweep expired entries of the pair's bucket and serve the first live entry in insertion order</li>
 *   <li>On a miss, perform one oracle round trip, ingest every returned entry under its own pair, and look again.
 *   Still nothing live is a {@link CacheConsistencyException}</li>
 *   <li>Write the serving entry's positions back onto the two endpoints, in query orientation</li>
 * </ol>
 * <p>
 * One reciprocal channel serves both directions, so {@code (a, b)} and {@code (b, a)} share a bucket. Entries are
 * valid over the closed window {@code [start, end]}: an entry is served at {@code now == end} and swept once
 * {@code end < now}.
 * <p>
 * A single lock covers the whole sequence. The simulation thread is normally the only caller; the lock keeps a
 * multi-threaded host from issuing two refills for the same gap.
 *
 * @author hal.hildebrand
 */
public class ChannelStateCache {

    private static final Logger log = LoggerFactory.getLogger(ChannelStateCache.class);

    private final ChannelOracle                     oracle;
    private final SimulationClock                   clock;
    private final CacheConfiguration                configuration;
    private final FallbackEstimator                 fallback;
    private final Map<CacheKey, List<CacheEntry>>   store;
    private final ReentrantLock                     lock;

    // Statistics
    private final AtomicLong hits;
    private final AtomicLong misses;
    private final AtomicLong roundTrips;
    private final AtomicLong shortCircuits;

    /**
     * Create a cache with the default behaviour: caching and fast path on, zero margin.
     *
     * @param oracle the oracle session
     * @param clock  the simulation clock
     * @param radio  radio parameters, for the fallback estimator
     */
    public ChannelStateCache(ChannelOracle oracle, SimulationClock clock, RadioConfiguration radio) {
        this(oracle, clock, radio, CacheConfiguration.defaultConfig());
    }

    /**
     * @param oracle        the oracle session
     * @param clock         the simulation clock
     * @param radio         radio parameters, for the fallback estimator
     * @param configuration cache behaviour
     * @throws ConfigurationException if any collaborator is missing
     */
    public ChannelStateCache(ChannelOracle oracle, SimulationClock clock, RadioConfiguration radio,
                             CacheConfiguration configuration) {
        if (oracle == null) {
            throw new ConfigurationException("ChannelStateCache must have a reference to a ChannelOracle");
        }
        if (clock == null) {
            throw new ConfigurationException("ChannelStateCache must have a SimulationClock");
        }
        if (radio == null || configuration == null) {
            throw new ConfigurationException("ChannelStateCache must have radio and cache configuration");
        }
        this.oracle = oracle;
        this.clock = clock;
        this.configuration = configuration;
        this.fallback = new FallbackEstimator(radio, configuration.optimizeMarginDb());
        this.store = new HashMap<>();
        this.lock = new ReentrantLock();
        this.hits = new AtomicLong();
        this.misses = new AtomicLong();
        this.roundTrips = new AtomicLong();
        this.shortCircuits = new AtomicLong();

        log.debug("ChannelStateCache created: {}, {}", radio, configuration);
    }

    /**
     * Propagation delay between two nodes.
     * <p>
     * On the fast path the probe transmit power of the configuration decides, and the constant speed delay is
     * returned.
     *
     * @param a transmitter
     * @param b receiver
     * @return propagation delay
     */
    public Duration getDelay(MobilityModel a, MobilityModel b) {
        lock.lock();
        try {
            var tx = NodeRoster.requireRaytraced(a);
            var rx = NodeRoster.requireRaytraced(b);
            if (belowNoiseFloor(configuration.delayProbeTxPowerDbm(), tx, rx)) {
                var delay = fallback.delay(tx, rx);
                log.debug("Skipped raytracing for delay {} -> {}; constant speed delay used: {}", tx.nodeId(),
                          rx.nodeId(), delay);
                return delay;
            }
            return serve(tx, rx).delay();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wideband pathloss between two nodes. Always raytraced.
     *
     * @param a transmitter
     * @param b receiver
     * @return loss (dB)
     */
    public double getLoss(MobilityModel a, MobilityModel b) {
        lock.lock();
        try {
            return serve(NodeRoster.requireRaytraced(a), NodeRoster.requireRaytraced(b)).widebandLossDb();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wideband pathloss between two nodes, skipping the oracle when the link cannot reach the receiver.
     *
     * @param a          transmitter
     * @param b          receiver
     * @param txPowerDbm transmit power (dBm)
     * @return loss (dB); the free space loss on the fast path
     */
    public double getLoss(MobilityModel a, MobilityModel b, double txPowerDbm) {
        lock.lock();
        try {
            var tx = NodeRoster.requireRaytraced(a);
            var rx = NodeRoster.requireRaytraced(b);
            if (configuration.optimize()) {
                double rxPowerDbm = fallback.rxPower(txPowerDbm, tx, rx);
                if (rxPowerDbm + fallback.marginDb() < fallback.noiseFloorDbm()) {
                    shortCircuits.incrementAndGet();
                    double loss = txPowerDbm - rxPowerDbm;
                    log.debug("Skipped raytracing for loss {} -> {}; free space loss used: {}dB", tx.nodeId(),
                              rx.nodeId(), loss);
                    return loss;
                }
            }
            return serve(tx, rx).widebandLossDb();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Channel frequency response between two nodes. Always raytraced.
     *
     * @param a transmitter
     * @param b receiver
     * @return one coefficient per subcarrier, empty if the oracle computed none
     */
    public List<Complex> getCsi(MobilityModel a, MobilityModel b) {
        return getEntry(a, b).cfr();
    }

    /**
     * Subcarrier frequencies matching {@link #getCsi(MobilityModel, MobilityModel)}.
     *
     * @param a transmitter
     * @param b receiver
     * @return subcarrier centre frequencies (Hz)
     */
    public List<Double> getFrequencies(MobilityModel a, MobilityModel b) {
        return getEntry(a, b).frequencies();
    }

    /**
     * The entry serving the link at the current simulated time. Always raytraced.
     *
     * @param a transmitter
     * @param b receiver
     * @return the serving entry, in the oracle's orientation
     */
    public CacheEntry getEntry(MobilityModel a, MobilityModel b) {
        lock.lock();
        try {
            return serve(NodeRoster.requireRaytraced(a), NodeRoster.requireRaytraced(b));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every expired entry from every bucket, and drop emptied buckets.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        lock.lock();
        try {
            return sweepAll(clock.now());
        } finally {
            lock.unlock();
        }
    }

    /**
     * The stored entries of a pair, in insertion order, without sweeping.
     *
     * @param key the pair
     * @return a snapshot of the bucket, empty if none
     */
    public List<CacheEntry> bucket(CacheKey key) {
        lock.lock();
        try {
            var bucket = store.get(key);
            return bucket == null ? List.of() : List.copyOf(bucket);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of stored entries
     */
    public int size() {
        lock.lock();
        try {
            return store.values().stream().mapToInt(List::size).sum();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop all stored entries. Counters are kept.
     */
    public void clear() {
        lock.lock();
        try {
            store.clear();
        } finally {
            lock.unlock();
        }
    }

    public CacheStatistics getStatistics() {
        lock.lock();
        try {
            return new CacheStatistics(hits.get(), misses.get(), roundTrips.get(), shortCircuits.get(), store.size(),
                                       store.values().stream().mapToInt(List::size).sum());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Log the lookup summary line.
     */
    public void printStatistics() {
        var stats = getStatistics();
        log.info("Channel state cache #lookups: {}, #misses: {}, hit ratio: {}", stats.lookups(), stats.misses(),
                 String.format("%.4f", stats.hitRatio()));
    }

    public FallbackEstimator getFallback() {
        return fallback;
    }

    private boolean belowNoiseFloor(double txPowerDbm, MobilityModel a, MobilityModel b) {
        if (configuration.optimize() && fallback.isBelowNoiseFloor(txPowerDbm, a, b)) {
            shortCircuits.incrementAndGet();
            return true;
        }
        return false;
    }

    private CacheEntry serve(RaytracedMobility a, RaytracedMobility b) {
        if (a.nodeId() == b.nodeId()) {
            throw new ConfigurationException("Channel endpoints must be different nodes: " + a.nodeId());
        }
        var now = clock.now();
        var key = CacheKey.of(a.nodeId(), b.nodeId());

        log.trace("Channel state lookup for {} -> {} at {}ns", a.nodeId(), b.nodeId(), now);

        if (configuration.fullSweepInterval() > 0
        && (hits.get() + misses.get() + 1) % configuration.fullSweepInterval() == 0) {
            sweepAll(now);
        }

        CacheEntry entry = null;
        if (configuration.caching()) {
            entry = firstLive(key, now);
            if (entry != null) {
                hits.incrementAndGet();
                log.debug("Cache hit for {} -> {}", a.nodeId(), b.nodeId());
            }
        }
        if (entry == null) {
            misses.incrementAndGet();
            log.info("Cache miss for {} -> {} at {}ns", a.nodeId(), b.nodeId(), now);
            refill(a.nodeId(), b.nodeId(), now);
            entry = firstLive(key, now);
            if (entry == null) {
                throw new CacheConsistencyException(key, now);
            }
        }

        alignPositions(a, b, entry);
        return entry;
    }

    private void refill(int txId, int rxId, long now) {
        roundTrips.incrementAndGet();
        var records = oracle.query(txId, rxId, now);
        if (records == null) {
            throw new ProtocolViolationException("Oracle returned no channel state response for " + txId + " -> "
                                                 + rxId);
        }
        var pairs = new HashSet<CacheKey>();
        for (var record : records) {
            var key = record.key();
            store.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            pairs.add(key);
            log.debug("Ingested {}", record);
        }
        log.info("Channel state response for {} -> {}: {} entries across {} pairs", txId, rxId, records.size(),
                 pairs.size());
    }

    /**
     * Sweep the pair's expired entries, then return its first live entry in insertion order.
     */
    private CacheEntry firstLive(CacheKey key, long now) {
        var bucket = store.get(key);
        if (bucket == null) {
            return null;
        }
        bucket.removeIf(entry -> entry.isExpired(now));
        if (bucket.isEmpty()) {
            store.remove(key);
            return null;
        }
        for (var entry : bucket) {
            if (entry.isLive(now)) {
                return entry;
            }
        }
        return null;
    }

    private int sweepAll(long now) {
        int removed = 0;
        var iterator = store.values().iterator();
        while (iterator.hasNext()) {
            var bucket = iterator.next();
            int before = bucket.size();
            bucket.removeIf(entry -> entry.isExpired(now));
            removed += before - bucket.size();
            if (bucket.isEmpty()) {
                iterator.remove();
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired entries at {}ns, {} pairs remain", removed, now, store.size());
        }
        return removed;
    }

    /**
     * The oracle computed the entry in one orientation only; make both endpoints observe the positions it used,
     * whichever order they were queried in.
     */
    private void alignPositions(RaytracedMobility a, RaytracedMobility b, CacheEntry entry) {
        updatePosition(a, entry.positionOf(a.nodeId()));
        updatePosition(b, entry.positionOf(b.nodeId()));
    }

    private void updatePosition(RaytracedMobility node, Point3d position) {
        var previous = node.getPosition();
        if (!previous.equals(position)) {
            node.setPosition(position);
            log.info("Updated position of node {} from {} to {}", node.nodeId(), previous, position);
        }
    }

    @Override
    public String toString() {
        return "ChannelStateCache{" + getStatistics() + "}";
    }
}

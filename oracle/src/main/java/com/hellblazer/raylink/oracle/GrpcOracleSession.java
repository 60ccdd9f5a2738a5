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
package com.hellblazer.raylink.oracle;

import com.hellblazer.raylink.channel.CacheEntry;
import com.hellblazer.raylink.channel.ChannelOracle;
import com.hellblazer.raylink.channel.ChannelStateException.ConfigurationException;
import com.hellblazer.raylink.channel.ChannelStateException.ProtocolViolationException;
import com.hellblazer.raylink.channel.ChannelStateException.TransportFailureException;
import com.hellblazer.raylink.channel.config.SessionConfiguration;
import com.hellblazer.raylink.channel.mobility.NodeRoster;
import com.hellblazer.raylink.oracle.proto.ChannelOracleServiceGrpc;
import com.hellblazer.raylink.oracle.proto.Envelope;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Oracle session over gRPC.
 * <p>
 * Each exchange is one blocking unary call carrying an {@link Envelope} each way. No deadline is set: the simulation
 * is paused in wall-clock time while the oracle works, and simulated time does not advance. A lock keeps at most one
 * request outstanding.
 * <p>
 * Lifecycle: {@link #start(NodeRoster)} once, any number of {@link #query(int, int, long)}, then {@link #close()}.
 * Every failure is fatal for the run and is logged before it is thrown.
 *
 * @author hal.hildebrand
 */
public class GrpcOracleSession implements ChannelOracle, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GrpcOracleSession.class);

    private enum State {
        CREATED, STARTED, CLOSED
    }

    private final SessionConfiguration                                     configuration;
    private final ManagedChannel                                           channel;
    private final ChannelOracleServiceGrpc.ChannelOracleServiceBlockingStub stub;
    private final ReentrantLock                                            lock = new ReentrantLock();
    private volatile State                                                 state = State.CREATED;

    /**
     * Connect to the oracle at the configured target over plaintext.
     *
     * @param configuration session parameters
     */
    public GrpcOracleSession(SessionConfiguration configuration) {
        this(configuration, ManagedChannelBuilder.forTarget(configuration.target()).usePlaintext().build());
    }

    /**
     * Use an existing channel. The session owns it from here on and shuts it down on close.
     *
     * @param configuration session parameters
     * @param channel       channel to the oracle
     */
    public GrpcOracleSession(SessionConfiguration configuration, ManagedChannel channel) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
        this.stub = ChannelOracleServiceGrpc.newBlockingStub(channel);
        log.debug("Oracle session created for {}", configuration);
    }

    /**
     * Send the session start message and wait for its acknowledgment.
     *
     * @param roster every raytraced node of the simulation
     * @throws ConfigurationException     if the session was already started or closed, or the roster is empty
     * @throws ProtocolViolationException if the oracle does not acknowledge
     */
    public void start(NodeRoster roster) {
        Objects.requireNonNull(roster, "roster cannot be null");
        lock.lock();
        try {
            if (state != State.CREATED) {
                throw new ConfigurationException("Oracle session already " + state.name().toLowerCase());
            }
            if (roster.isEmpty()) {
                throw new ConfigurationException("Oracle session needs at least one raytraced node");
            }
            log.info("Connecting to oracle at {}: mode {}, submode {}, {} nodes, scene {}", configuration.target(),
                     configuration.mode(), configuration.subMode(), roster.size(), configuration.scene());

            var reply = exchange(OracleMessages.sessionInit(configuration, roster), "session start");
            requireOk(reply, "session start");
            state = State.STARTED;

            log.info("Oracle session started: {}", configuration.radio());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<CacheEntry> query(int txId, int rxId, long timeNanos) {
        lock.lock();
        try {
            if (state != State.STARTED) {
                throw new ConfigurationException("Oracle session not started; state: " + state);
            }
            var reply = exchange(OracleMessages.channelStateRequest(txId, rxId, timeNanos),
                                 "channel state request " + txId + " -> " + rxId);
            if (!reply.hasChannelStateResponse()) {
                ProtocolViolationException violation;
                if (reply.hasAck() && !reply.getAck().getOk()) {
                    violation = new ProtocolViolationException("Reply after channel state request is an error",
                                                               reply.getAck().getErrorMessage());
                } else {
                    violation = new ProtocolViolationException(
                    "Reply after channel state request is not a channel state response: " + reply.getKindCase());
                }
                log.error(violation.getMessage());
                throw violation;
            }
            var response = reply.getChannelStateResponse();
            log.debug("Channel state response for {} -> {} at {}ns: {} records", txId, rxId, timeNanos,
                      response.getCsiCount());
            return OracleMessages.entries(response);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Send the session close message, require its acknowledgment, and shut the transport down. Closing a session
     * that was never started only shuts the transport down. Idempotent.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (state == State.CLOSED) {
                return;
            }
            var wasStarted = state == State.STARTED;
            state = State.CLOSED;
            try {
                if (wasStarted) {
                    requireOk(exchange(OracleMessages.sessionClose(), "session close"), "session close");
                }
            } finally {
                shutdown();
            }
            log.info("Oracle session closed");
        } finally {
            lock.unlock();
        }
    }

    public boolean isStarted() {
        return state == State.STARTED;
    }

    private Envelope exchange(Envelope request, String what) {
        try {
            return stub.exchange(request);
        } catch (StatusRuntimeException e) {
            log.error("No reply from oracle at {} for {}: {}", configuration.target(), what, e.getStatus());
            throw new TransportFailureException("Failed to receive reply after " + what + ": " + e.getStatus(), e);
        }
    }

    private void requireOk(Envelope reply, String what) {
        if (!reply.hasAck()) {
            var violation = new ProtocolViolationException(
            "Oracle " + what + " FAILED: reply is not an ack: " + reply.getKindCase());
            log.error(violation.getMessage());
            throw violation;
        }
        if (!reply.getAck().getOk()) {
            var violation = new ProtocolViolationException("Oracle " + what + " FAILED with error",
                                                           reply.getAck().getErrorMessage());
            log.error(violation.getMessage());
            throw violation;
        }
    }

    private void shutdown() {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "GrpcOracleSession{target=" + configuration.target() + ", state=" + state + "}";
    }
}

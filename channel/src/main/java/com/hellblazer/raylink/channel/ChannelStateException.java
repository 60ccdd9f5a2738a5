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
 * Sealed exception hierarchy for channel state acquisition.
 * <p>
 * Every member of this hierarchy is fatal for the simulation run. The oracle is treated as a trusted collaborator
 * that is available for the whole run, so there is no retry or local recovery: callers abort with the diagnostic.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link ProtocolViolationException} - oracle reply of the wrong kind, missing or negative acknowledgment,
 * malformed channel record</li>
 * <li>{@link TransportFailureException} - no reply received from the oracle</li>
 * <li>{@link ConfigurationException} - missing oracle, incompatible mobility, radio parameters out of range</li>
 * <li>{@link CacheConsistencyException} - no live entry for the queried pair after a refill</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class ChannelStateException extends RuntimeException
    permits ChannelStateException.ProtocolViolationException,
            ChannelStateException.TransportFailureException,
            ChannelStateException.ConfigurationException,
            ChannelStateException.CacheConsistencyException {

    /**
     * Constructs a new channel state exception with the specified detail message.
     *
     * @param message the detail message
     */
    public ChannelStateException(String message) {
        super(message);
    }

    /**
     * Constructs a new channel state exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public ChannelStateException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The oracle replied, but not with what the protocol requires.
     */
    public static final class ProtocolViolationException extends ChannelStateException {
        private final String oracleMessage;

        public ProtocolViolationException(String message) {
            this(message, null);
        }

        /**
         * @param message       the detail message
         * @param oracleMessage the error text supplied by the oracle, or null if it supplied none
         */
        public ProtocolViolationException(String message, String oracleMessage) {
            super(oracleMessage == null || oracleMessage.isEmpty() ? message : message + ": " + oracleMessage);
            this.oracleMessage = oracleMessage;
        }

        /**
         * @return the error text supplied by the oracle, or null
         */
        public String getOracleMessage() {
            return oracleMessage;
        }
    }

    /**
     * No reply was received from the oracle.
     */
    public static final class TransportFailureException extends ChannelStateException {

        public TransportFailureException(String message) {
            super(message);
        }

        public TransportFailureException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Setup is invalid. Detected eagerly, before the simulation proceeds.
     */
    public static final class ConfigurationException extends ChannelStateException {

        public ConfigurationException(String message) {
            super(message);
        }
    }

    /**
     * A refill did not produce a live entry for the pair that triggered it.
     */
    public static final class CacheConsistencyException extends ChannelStateException {

        /**
         * @param key       the canonical key of the queried pair
         * @param timeNanos the simulated time of the query
         */
        public CacheConsistencyException(CacheKey key, long timeNanos) {
            super(String.format("Oracle response holds no live channel state for %s at %dns", key, timeNanos));
        }
    }
}

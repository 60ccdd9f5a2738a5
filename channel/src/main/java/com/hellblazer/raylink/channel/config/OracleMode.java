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

/**
 * How much channel state the oracle computes per request.
 *
 * @author hal.hildebrand
 */
public enum OracleMode {
    /** Only the requested link. */
    SINGLE_PAIR(1),
    /** The transmitter to every other node. */
    FULL_MESH(2),
    /** As FULL_MESH, plus future windows; the submode sets the look-ahead depth. */
    FULL_MESH_LOOKAHEAD(3);

    private final int wireValue;

    OracleMode(int wireValue) {
        this.wireValue = wireValue;
    }

    public static OracleMode fromWire(int value) {
        for (var mode : values()) {
            if (mode.wireValue == value) {
                return mode;
            }
        }
        throw new ConfigurationException("Unknown oracle mode: " + value);
    }

    public int wireValue() {
        return wireValue;
    }
}

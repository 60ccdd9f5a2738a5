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

import com.hellblazer.raylink.channel.ChannelStateException.ConfigurationException;
import com.hellblazer.raylink.channel.mobility.MobilityModel;

import java.time.Duration;

/**
 * Delay model backed by the channel state cache.
 *
 * @author hal.hildebrand
 */
public class RaytracedPropagationDelayModel implements PropagationDelayModel {

    private ChannelStateCache cache;

    public RaytracedPropagationDelayModel() {
    }

    public RaytracedPropagationDelayModel(ChannelStateCache cache) {
        this.cache = cache;
    }

    public void setChannelStateCache(ChannelStateCache cache) {
        this.cache = cache;
    }

    @Override
    public Duration getDelay(MobilityModel a, MobilityModel b) {
        if (cache == null) {
            throw new ConfigurationException("RaytracedPropagationDelayModel must have a ChannelStateCache");
        }
        return cache.getDelay(a, b);
    }
}

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
package com.hellblazer.raylink.channel.mobility;

import com.hellblazer.raylink.channel.ChannelStateException.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The set of raytraced nodes of one simulation, by node id.
 * <p>
 * Explicitly constructed and handed to whoever needs id to node lookups: the session start message and simulator
 * glue that maps trace contexts to nodes. Iteration is in ascending id order.
 *
 * @author hal.hildebrand
 */
public class NodeRoster {

    private final TreeMap<Integer, RaytracedMobility> nodes = new TreeMap<>();

    /**
     * Check that a mobility model carries the raytraced capability.
     *
     * @param mobility any mobility model
     * @return the same model, as its raytraced capability
     * @throws ConfigurationException if the model is null or not raytraced
     */
    public static RaytracedMobility requireRaytraced(MobilityModel mobility) {
        if (mobility == null) {
            throw new ConfigurationException("Mobility model is missing");
        }
        if (!(mobility instanceof RaytracedMobility raytraced)) {
            throw new ConfigurationException(
            "Node " + mobility.nodeId() + " is not using RaytracedMobility: " + mobility.getClass().getName());
        }
        return raytraced;
    }

    /**
     * Add a node.
     *
     * @param mobility the node's mobility
     * @return this roster
     * @throws ConfigurationException if the model is not raytraced or its id is already registered
     */
    public NodeRoster add(MobilityModel mobility) {
        var raytraced = requireRaytraced(mobility);
        var previous = nodes.putIfAbsent(raytraced.nodeId(), raytraced);
        if (previous != null) {
            throw new ConfigurationException("Duplicate node id in roster: " + raytraced.nodeId());
        }
        return this;
    }

    public Optional<RaytracedMobility> get(int nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /**
     * @param nodeId node id
     * @return the node
     * @throws ConfigurationException if the id is unknown
     */
    public RaytracedMobility require(int nodeId) {
        var node = nodes.get(nodeId);
        if (node == null) {
            throw new ConfigurationException("Unknown node id: " + nodeId);
        }
        return node;
    }

    public boolean contains(int nodeId) {
        return nodes.containsKey(nodeId);
    }

    /**
     * @return all nodes in ascending id order
     */
    public Collection<RaytracedMobility> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public String toString() {
        return "NodeRoster{nodes=" + nodes.keySet() + "}";
    }
}

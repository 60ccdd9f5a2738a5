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
import com.hellblazer.raylink.channel.ChannelStateException.ConfigurationException;
import com.hellblazer.raylink.channel.ChannelStateException.ProtocolViolationException;
import com.hellblazer.raylink.channel.Complex;
import com.hellblazer.raylink.channel.config.SessionConfiguration;
import com.hellblazer.raylink.channel.mobility.NodeRoster;
import com.hellblazer.raylink.channel.mobility.RaytracedMobility;
import com.hellblazer.raylink.channel.mobility.TrajectoryDescriptor;
import com.hellblazer.raylink.oracle.proto.*;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Conversions between the domain model and the oracle wire messages.
 *
 * @author hal.hildebrand
 */
public final class OracleMessages {

    private OracleMessages() {
    }

    /**
     * Session start message: configuration plus one descriptor per roster node, in id order.
     *
     * @param configuration session parameters
     * @param roster        the raytraced nodes
     * @return the request envelope
     */
    public static Envelope sessionInit(SessionConfiguration configuration, NodeRoster roster) {
        var radio = configuration.radio();
        var init = SessionInit.newBuilder()
                              .setScene(configuration.scene())
                              .setSeed(configuration.seed())
                              .setCenterFrequencyMhz(radio.centerFrequencyMhz())
                              .setChannelBandwidthMhz(radio.channelBandwidthMhz())
                              .setFftSize(radio.fftSize())
                              .setMinCoherenceTimeMs(radio.minCoherenceTimeMs())
                              .setSubcarrierSpacingHz(radio.subcarrierSpacingHz())
                              .setTimeEvolutionModel(configuration.timeEvolutionModel())
                              .setMode(configuration.mode().wireValue())
                              .setSubMode(configuration.subMode());
        for (var node : roster.nodes()) {
            init.addNodes(describe(node));
        }
        return Envelope.newBuilder().setSessionInit(init).build();
    }

    /**
     * @param node a raytraced node
     * @return its descriptor, starting from the node's current position
     */
    public static NodeDescriptor describe(RaytracedMobility node) {
        var builder = NodeDescriptor.newBuilder().setId(node.nodeId());
        var position = vector(node.getPosition());
        var trajectory = node.trajectory();
        if (trajectory instanceof TrajectoryDescriptor.RandomWalk walk) {
            var model = RandomWalkModel.newBuilder()
                                       .setPosition(position)
                                       .setSpeed(randomVariable(walk.speed()))
                                       .setDirection(randomVariable(walk.direction()));
            switch (walk.mode()) {
                case DISTANCE -> model.setDistanceValue(walk.distance());
                case TIME -> model.setTimeValue(walk.time().toNanos());
                case WALL -> model.setWallValue(true);
            }
            builder.setRandomWalkModel(model);
        } else {
            builder.setConstantPositionModel(ConstantPositionModel.newBuilder().setPosition(position));
        }
        return builder.build();
    }

    public static com.hellblazer.raylink.oracle.proto.RandomVariable randomVariable(
    com.hellblazer.raylink.channel.mobility.RandomVariable variable) {
        var builder = com.hellblazer.raylink.oracle.proto.RandomVariable.newBuilder();
        if (variable instanceof com.hellblazer.raylink.channel.mobility.RandomVariable.Uniform uniform) {
            builder.setUniform(com.hellblazer.raylink.oracle.proto.RandomVariable.Uniform.newBuilder()
                                                                                       .setMin(uniform.min())
                                                                                       .setMax(uniform.max()));
        } else if (variable instanceof com.hellblazer.raylink.channel.mobility.RandomVariable.Constant constant) {
            builder.setConstant(com.hellblazer.raylink.oracle.proto.RandomVariable.Constant.newBuilder()
                                                                                         .setValue(constant.value()));
        } else if (variable instanceof com.hellblazer.raylink.channel.mobility.RandomVariable.Normal normal) {
            builder.setNormal(com.hellblazer.raylink.oracle.proto.RandomVariable.Normal.newBuilder()
                                                                                     .setMean(normal.mean())
                                                                                     .setVariance(normal.variance()));
        } else {
            throw new ConfigurationException("RandomVariable must be Uniform, Constant, or Normal: " + variable);
        }
        return builder.build();
    }

    public static Envelope channelStateRequest(int txId, int rxId, long timeNanos) {
        return Envelope.newBuilder()
                       .setChannelStateRequest(
                       ChannelStateRequest.newBuilder().setTxId(txId).setRxId(rxId).setTimeNs(timeNanos))
                       .build();
    }

    public static Envelope sessionClose() {
        return Envelope.newBuilder().setSessionClose(SessionClose.getDefaultInstance()).build();
    }

    public static Envelope ack() {
        return Envelope.newBuilder().setAck(Ack.newBuilder().setOk(true)).build();
    }

    /**
     * @param message the error text
     * @return a negative acknowledgment
     */
    public static Envelope error(String message) {
        return Envelope.newBuilder()
                       .setAck(Ack.newBuilder().setOk(false).setErrorMessage(message == null ? "" : message))
                       .build();
    }

    /**
     * Flatten a channel state response into entries, one per (record, receiver), in wire order.
     *
     * @param response the oracle's response
     * @return the entries
     * @throws ProtocolViolationException if a record is malformed
     */
    public static List<CacheEntry> entries(ChannelStateResponse response) {
        var entries = new ArrayList<CacheEntry>();
        for (var csi : response.getCsiList()) {
            if (!csi.hasTx()) {
                throw new ProtocolViolationException("Channel state record without transmitter");
            }
            if (csi.getStartTimeNs() > csi.getEndTimeNs()) {
                throw new ProtocolViolationException(
                "Channel state record window start after end: [" + csi.getStartTimeNs() + ", " + csi.getEndTimeNs()
                + "]");
            }
            var tx = csi.getTx();
            var txPosition = point(tx.getPosition());
            for (var rx : csi.getRxList()) {
                var frequencies = new ArrayList<Double>(rx.getSubcarriersCount());
                var cfr = new ArrayList<Complex>(rx.getSubcarriersCount());
                for (var subcarrier : rx.getSubcarriersList()) {
                    frequencies.add(subcarrier.getFrequencyHz());
                    cfr.add(new Complex(subcarrier.getCsiReal(), subcarrier.getCsiImag()));
                }
                entries.add(new CacheEntry(rx.getDelayNs(), rx.getWidebandLossDb(), csi.getStartTimeNs(),
                                           csi.getEndTimeNs(), tx.getId(), rx.getId(), txPosition,
                                           point(rx.getPosition()), frequencies, cfr));
            }
        }
        return entries;
    }

    /**
     * Group entries sharing window and transmitter into records, preserving first-appearance order.
     *
     * @param entries channel states
     * @return the response message
     */
    public static ChannelStateResponse response(List<CacheEntry> entries) {
        var records = new LinkedHashMap<List<Long>, CsiRecord.Builder>();
        for (var entry : entries) {
            var group = List.of(entry.startNanos(), entry.endNanos(), (long) entry.txId());
            var record = records.computeIfAbsent(group, g -> CsiRecord.newBuilder()
                                                                      .setStartTimeNs(entry.startNanos())
                                                                      .setEndTimeNs(entry.endNanos())
                                                                      .setTx(TxNode.newBuilder()
                                                                                   .setId(entry.txId())
                                                                                   .setPosition(vector(
                                                                                   entry.txPosition()))));
            var rx = RxNode.newBuilder()
                           .setId(entry.rxId())
                           .setPosition(vector(entry.rxPosition()))
                           .setDelayNs(entry.delayNanos())
                           .setWidebandLossDb(entry.widebandLossDb());
            for (int i = 0; i < entry.subcarrierCount(); i++) {
                var h = entry.cfr().get(i);
                rx.addSubcarriers(Subcarrier.newBuilder()
                                            .setFrequencyHz(entry.frequencies().get(i))
                                            .setCsiReal(h.real())
                                            .setCsiImag(h.imaginary()));
            }
            record.addRx(rx);
        }
        var response = ChannelStateResponse.newBuilder();
        records.values().forEach(response::addCsi);
        return response.build();
    }

    public static Vector3 vector(Point3d point) {
        return Vector3.newBuilder().setX(point.x).setY(point.y).setZ(point.z).build();
    }

    public static Point3d point(Vector3 vector) {
        return new Point3d(vector.getX(), vector.getY(), vector.getZ());
    }
}

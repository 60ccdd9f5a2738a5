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
import com.hellblazer.raylink.oracle.proto.ChannelOracleServiceGrpc;
import com.hellblazer.raylink.oracle.proto.ChannelStateRequest;
import com.hellblazer.raylink.oracle.proto.Envelope;
import com.hellblazer.raylink.oracle.proto.SessionInit;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Server side of the oracle exchange.
 * <p>
 * Decodes each request envelope and dispatches it to the matching handler. Handler failures and unexpected request
 * kinds are answered with a negative acknowledgment carrying the message, so the client sees the oracle's
 * diagnostic rather than a transport error.
 *
 * @author hal.hildebrand
 */
public abstract class ChannelOracleServer extends ChannelOracleServiceGrpc.ChannelOracleServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(ChannelOracleServer.class);

    @Override
    public void exchange(Envelope request, StreamObserver<Envelope> responseObserver) {
        Envelope reply;
        try {
            reply = switch (request.getKindCase()) {
                case SESSION_INIT -> {
                    onSessionInit(request.getSessionInit());
                    yield OracleMessages.ack();
                }
                case CHANNEL_STATE_REQUEST -> Envelope.newBuilder()
                                                      .setChannelStateResponse(OracleMessages.response(
                                                      onChannelState(request.getChannelStateRequest())))
                                                      .build();
                case SESSION_CLOSE -> {
                    onSessionClose();
                    yield OracleMessages.ack();
                }
                default -> OracleMessages.error("Unexpected request: " + request.getKindCase());
            };
        } catch (RuntimeException e) {
            log.warn("Oracle failed to handle {}: {}", request.getKindCase(), e.getMessage(), e);
            reply = OracleMessages.error(e.getMessage());
        }
        responseObserver.onNext(reply);
        responseObserver.onCompleted();
    }

    /**
     * Prepare the scene and node trajectories.
     *
     * @param init the session start message
     */
    protected abstract void onSessionInit(SessionInit init);

    /**
     * Compute channel state for the request. Must include a window covering the request time for the requested
     * pair; may include other receivers and future windows.
     *
     * @param request the request
     * @return channel states, grouped into records on the wire by window and transmitter
     */
    protected abstract List<CacheEntry> onChannelState(ChannelStateRequest request);

    /**
     * Release the session's resources.
     */
    protected abstract void onSessionClose();
}

package com.questrail.cpor.protocol.model;

import java.util.Objects;

/**
 * Liveness probe carrying both sides' sequence positions.
 */
public record HeartbeatMessage(
        MessageHeader header,
        String heartbeatId,
        long clientSequence,
        long serverSequence,
        boolean requiresResponse
) implements CporMessage
{
    public HeartbeatMessage {
        Objects.requireNonNull(header, "header");
        Checks.nonEmpty(heartbeatId, "heartbeat_id");
        Checks.nonNegative(clientSequence, "client_sequence");
        Checks.nonNegative(serverSequence, "server_sequence");
    }

    public static HeartbeatMessage of(String heartbeatId, long clientSequence, long serverSequence) {
        return new HeartbeatMessage(MessageHeader.DEFAULT, heartbeatId, clientSequence, serverSequence, true);
    }

    @Override
    public MessageKind kind() {
        return MessageKind.HEARTBEAT;
    }
}

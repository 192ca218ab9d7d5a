package com.questrail.cpor.protocol.model;

import java.util.Objects;

/**
 * Request to resume a previous session after reconnecting.
 *
 * @param lastSequenceNumber last sequence number the client received
 * @param clientNonce        fresh nonce, at least 16 bytes
 */
public record ResumeRequest(
        MessageHeader header,
        String clientId,
        long lastSequenceNumber,
        Bytes clientNonce
) implements CporMessage
{
    public ResumeRequest {
        Objects.requireNonNull(header, "header");
        Checks.nonEmpty(clientId, "client_id");
        Checks.nonNegative(lastSequenceNumber, "last_sequence_number");
        Checks.nonce(clientNonce, "client_nonce");
    }

    public static ResumeRequest of(String clientId, long lastSequenceNumber, byte[] clientNonce) {
        return new ResumeRequest(MessageHeader.DEFAULT, clientId, lastSequenceNumber, Bytes.of(clientNonce));
    }

    @Override
    public MessageKind kind() {
        return MessageKind.RESUME_REQUEST;
    }
}

package com.questrail.cpor.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * Connection response, server → client.
 *
 * <p>Contract:</p>
 * <ul>
 *   <li>{@code session_id} non-empty</li>
 *   <li>{@code server_pubkey} exactly 32 bytes</li>
 *   <li>{@code status_code != 0} requires {@code error_message}</li>
 *   <li>{@code max_message_size} &gt; 0</li>
 *   <li>{@code resume_sequence} ≥ 0</li>
 *   <li>{@code ephemeral_pubkey}, if present, exactly 32 bytes</li>
 * </ul>
 *
 * @param errorMessage    may be {@code null} when {@code statusCode == 0}
 * @param ephemeralPubkey registration-flow key, may be {@code null}
 */
public record ConnectResponse(
        MessageHeader header,
        String sessionId,
        Bytes serverPubkey,
        boolean accepted,
        long resumeSequence,
        long statusCode,
        String errorMessage,
        List<String> serverCapabilities,
        long maxMessageSize,
        Bytes ephemeralPubkey
) implements CporMessage
{
    public static final long DEFAULT_MAX_MESSAGE_SIZE = 1_048_576;

    public ConnectResponse {
        Objects.requireNonNull(header, "header");
        Checks.nonEmpty(sessionId, "session_id");
        Checks.publicKey(serverPubkey, "server_pubkey");
        if (statusCode != 0 && (errorMessage == null || errorMessage.isEmpty())) {
            throw new InvalidMessageException("error_message required when status_code != 0");
        }
        if (maxMessageSize <= 0) {
            throw new InvalidMessageException("max_message_size must be a positive integer");
        }
        Checks.nonNegative(resumeSequence, "resume_sequence");
        if (ephemeralPubkey != null && ephemeralPubkey.length() != Checks.PUBLIC_KEY_LENGTH) {
            throw new InvalidMessageException("ephemeral_pubkey must be 32 bytes for Ed25519");
        }
        if (serverCapabilities == null) {
            throw new InvalidMessageException("server_capabilities must be a list");
        }
        if (serverCapabilities.stream().anyMatch(Objects::isNull)) {
            throw new InvalidMessageException("server_capabilities must contain only strings");
        }
        serverCapabilities = List.copyOf(serverCapabilities);
    }

    @Override
    public MessageKind kind() {
        return MessageKind.CONNECT_RESPONSE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MessageHeader header = MessageHeader.DEFAULT;
        private String sessionId;
        private Bytes serverPubkey;
        private boolean accepted;
        private long resumeSequence;
        private long statusCode;
        private String errorMessage;
        private List<String> serverCapabilities = List.of();
        private long maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;
        private Bytes ephemeralPubkey;

        public Builder header(MessageHeader header) {
            this.header = header;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder serverPubkey(byte[] serverPubkey) {
            this.serverPubkey = Bytes.of(serverPubkey);
            return this;
        }

        public Builder accepted(boolean accepted) {
            this.accepted = accepted;
            return this;
        }

        public Builder resumeSequence(long resumeSequence) {
            this.resumeSequence = resumeSequence;
            return this;
        }

        public Builder statusCode(long statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder serverCapabilities(List<String> serverCapabilities) {
            this.serverCapabilities = serverCapabilities;
            return this;
        }

        public Builder maxMessageSize(long maxMessageSize) {
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        public Builder ephemeralPubkey(byte[] ephemeralPubkey) {
            this.ephemeralPubkey = Bytes.of(ephemeralPubkey);
            return this;
        }

        public ConnectResponse build() {
            return new ConnectResponse(header, sessionId, serverPubkey, accepted, resumeSequence,
                    statusCode, errorMessage, serverCapabilities, maxMessageSize, ephemeralPubkey);
        }
    }
}

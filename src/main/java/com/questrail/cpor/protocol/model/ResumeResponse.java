package com.questrail.cpor.protocol.model;

import java.util.Objects;

/**
 * Server's answer to a {@link ResumeRequest}.
 *
 * <p>A refused resume ({@code resumeAccepted == false}) must say why through
 * {@code errorMessage}.</p>
 */
public record ResumeResponse(
        MessageHeader header,
        long statusCode,
        long resumeSequence,
        String errorMessage,
        String sessionId,
        boolean resumeAccepted,
        Bytes serverNonce
) implements CporMessage
{
    public ResumeResponse {
        Objects.requireNonNull(header, "header");
        Checks.nonEmpty(sessionId, "session_id");
        Checks.nonNegative(resumeSequence, "resume_sequence");
        Checks.nonce(serverNonce, "server_nonce");
        if (!resumeAccepted && (errorMessage == null || errorMessage.isEmpty())) {
            throw new InvalidMessageException("error_message required when resume_accepted=False");
        }
    }

    @Override
    public MessageKind kind() {
        return MessageKind.RESUME_RESPONSE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MessageHeader header = MessageHeader.DEFAULT;
        private long statusCode;
        private long resumeSequence;
        private String errorMessage;
        private String sessionId;
        private boolean resumeAccepted;
        private Bytes serverNonce;

        public Builder header(MessageHeader header) {
            this.header = header;
            return this;
        }

        public Builder statusCode(long statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder resumeSequence(long resumeSequence) {
            this.resumeSequence = resumeSequence;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder resumeAccepted(boolean resumeAccepted) {
            this.resumeAccepted = resumeAccepted;
            return this;
        }

        public Builder serverNonce(byte[] serverNonce) {
            this.serverNonce = Bytes.of(serverNonce);
            return this;
        }

        public ResumeResponse build() {
            return new ResumeResponse(header, statusCode, resumeSequence, errorMessage,
                    sessionId, resumeAccepted, serverNonce);
        }
    }
}

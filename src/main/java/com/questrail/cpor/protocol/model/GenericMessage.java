package com.questrail.cpor.protocol.model;

import java.util.Objects;

/**
 * Sequenced application data.
 *
 * @param sequenceNumber position in the sender's stream, ≥ 0
 * @param payload        opaque application bytes, may be empty
 * @param messageType    application-level type tag, non-empty
 * @param priority       advisory priority
 * @param requiresAck    whether the receiver should answer with an {@link AckMessage}
 */
public record GenericMessage(
        MessageHeader header,
        long sequenceNumber,
        Bytes payload,
        String messageType,
        long priority,
        boolean requiresAck
) implements CporMessage
{
    public static final String DEFAULT_MESSAGE_TYPE = "data";

    public GenericMessage {
        Objects.requireNonNull(header, "header");
        Checks.nonNegative(sequenceNumber, "sequence_number");
        Checks.nonEmpty(messageType, "message_type");
        if (payload == null) {
            throw new InvalidMessageException("payload must be bytes");
        }
    }

    @Override
    public MessageKind kind() {
        return MessageKind.GENERIC;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MessageHeader header = MessageHeader.DEFAULT;
        private long sequenceNumber;
        private Bytes payload = Bytes.empty();
        private String messageType = DEFAULT_MESSAGE_TYPE;
        private long priority;
        private boolean requiresAck = true;

        public Builder header(MessageHeader header) {
            this.header = header;
            return this;
        }

        public Builder sequenceNumber(long sequenceNumber) {
            this.sequenceNumber = sequenceNumber;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = Bytes.of(payload);
            return this;
        }

        public Builder messageType(String messageType) {
            this.messageType = messageType;
            return this;
        }

        public Builder priority(long priority) {
            this.priority = priority;
            return this;
        }

        public Builder requiresAck(boolean requiresAck) {
            this.requiresAck = requiresAck;
            return this;
        }

        public GenericMessage build() {
            return new GenericMessage(header, sequenceNumber, payload, messageType, priority, requiresAck);
        }
    }
}

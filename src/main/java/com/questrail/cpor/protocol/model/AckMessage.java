package com.questrail.cpor.protocol.model;

import java.util.Objects;

/**
 * Acknowledgement of a sequence number.
 *
 * @param errorCode set when acknowledging a failure, otherwise {@code null}
 */
public record AckMessage(
        MessageHeader header,
        long ackSequence,
        AckType ackType,
        Long errorCode
) implements CporMessage
{
    public AckMessage {
        Objects.requireNonNull(header, "header");
        Checks.nonNegative(ackSequence, "ack_sequence");
        if (ackType == null) {
            throw new InvalidMessageException("ack_type must be a non-empty string");
        }
    }

    public static AckMessage of(long ackSequence, AckType ackType) {
        return new AckMessage(MessageHeader.DEFAULT, ackSequence, ackType, null);
    }

    @Override
    public MessageKind kind() {
        return MessageKind.ACK;
    }
}

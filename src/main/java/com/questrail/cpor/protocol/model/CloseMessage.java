package com.questrail.cpor.protocol.model;

import java.util.Objects;

/**
 * Connection close notice.
 *
 * @param finalSequence last sequence number sent, may be {@code null}
 */
public record CloseMessage(
        MessageHeader header,
        String reason,
        Long finalSequence,
        boolean graceful
) implements CporMessage
{
    public CloseMessage {
        Objects.requireNonNull(header, "header");
        Checks.nonEmpty(reason, "reason");
        if (finalSequence != null) {
            Checks.nonNegative(finalSequence, "final_sequence");
        }
    }

    public static CloseMessage of(String reason, Long finalSequence, boolean graceful) {
        return new CloseMessage(MessageHeader.DEFAULT, reason, finalSequence, graceful);
    }

    @Override
    public MessageKind kind() {
        return MessageKind.CLOSE;
    }
}

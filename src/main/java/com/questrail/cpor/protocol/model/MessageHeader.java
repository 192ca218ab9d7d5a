package com.questrail.cpor.protocol.model;

/**
 * Attributes shared by every CPOR message.
 *
 * @param version   protocol generation tag; must be {@link #PROTOCOL_VERSION}
 * @param messageId optional message identifier, may be {@code null}
 * @param timestamp optional timestamp (epoch seconds), may be {@code null}
 */
public record MessageHeader(
        String version,
        String messageId,
        Long timestamp
)
{
    public static final String PROTOCOL_VERSION = "CPOR-2";

    /** Header with the current version and no id or timestamp. */
    public static final MessageHeader DEFAULT = new MessageHeader(PROTOCOL_VERSION, null, null);

    public MessageHeader {
        if (!PROTOCOL_VERSION.equals(version)) {
            throw new InvalidMessageException("Invalid protocol version: " + version);
        }
    }

    public static MessageHeader of(String messageId, Long timestamp) {
        return new MessageHeader(PROTOCOL_VERSION, messageId, timestamp);
    }
}

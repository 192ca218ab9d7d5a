package com.questrail.cpor.protocol.model;

/**
 * What an {@link AckMessage} acknowledges.
 */
public enum AckType
{
    MESSAGE("message"),
    HEARTBEAT("heartbeat"),
    BATCH("batch");

    private final String wireName;

    AckType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws InvalidMessageException for any value outside the enumeration
     */
    public static AckType fromWireName(String wireName) {
        for (AckType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new InvalidMessageException("ack_type must be one of: message, heartbeat, batch");
    }
}

package com.questrail.cpor.protocol.model;

/**
 * Severity carried by an {@link ErrorMessage}.
 */
public enum Severity
{
    WARNING("warning"),
    ERROR("error"),
    FATAL("fatal");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws InvalidMessageException for any value outside the enumeration
     */
    public static Severity fromWireName(String wireName) {
        for (Severity severity : values()) {
            if (severity.wireName.equals(wireName)) {
                return severity;
            }
        }
        throw new InvalidMessageException("severity must be one of: warning, error, fatal");
    }
}

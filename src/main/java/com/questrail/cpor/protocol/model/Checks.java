package com.questrail.cpor.protocol.model;

/**
 * Field contract checks shared by the message records. Messages name fields
 * by their wire names so errors read the same on both sides of the codec.
 */
final class Checks
{
    static final int PUBLIC_KEY_LENGTH = 32;
    static final int MIN_NONCE_LENGTH = 16;

    private Checks() {}

    static void nonEmpty(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new InvalidMessageException(field + " must be a non-empty string");
        }
    }

    static void nonNegative(long value, String field) {
        if (value < 0) {
            throw new InvalidMessageException(field + " must be a non-negative integer");
        }
    }

    static void publicKey(Bytes value, String field) {
        if (value == null || value.isEmpty()) {
            throw new InvalidMessageException(field + " must be non-empty bytes");
        }
        if (value.length() != PUBLIC_KEY_LENGTH) {
            throw new InvalidMessageException(field + " must be 32 bytes for Ed25519");
        }
    }

    static void nonce(Bytes value, String field) {
        if (value == null || value.isEmpty()) {
            throw new InvalidMessageException(field + " must be non-empty bytes");
        }
        if (value.length() < MIN_NONCE_LENGTH) {
            throw new InvalidMessageException(field + " must be at least 16 bytes");
        }
    }

    static <T> T present(T value, String field) {
        if (value == null) {
            throw new InvalidMessageException(field + " is required");
        }
        return value;
    }
}

package com.questrail.cpor.protocol.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Immutable byte string used for binary message fields (keys, nonces,
 * payloads).
 *
 * <p>Plain {@code byte[]} has identity equality and is mutable, which would
 * break both message immutability and value equality of decoded messages.
 * Copies are taken on the way in and on the way out.</p>
 */
public final class Bytes
{
    private static final Bytes EMPTY = new Bytes(new byte[0]);

    private final byte[] value;

    private Bytes(byte[] value) {
        this.value = value;
    }

    /**
     * @param value bytes to copy; {@code null} yields {@code null}
     */
    public static Bytes of(byte[] value) {
        return value == null ? null : new Bytes(value.clone());
    }

    public static Bytes empty() {
        return EMPTY;
    }

    /**
     * @return {@code length} copies of {@code b}
     */
    public static Bytes repeat(int b, int length) {
        byte[] out = new byte[length];
        Arrays.fill(out, (byte) b);
        return new Bytes(out);
    }

    public int length() {
        return value.length;
    }

    public boolean isEmpty() {
        return value.length == 0;
    }

    /**
     * @return a copy of the underlying bytes
     */
    public byte[] toByteArray() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bytes that)) return false;
        return Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "Bytes[" + HexFormat.of().formatHex(value) + "]";
    }
}

package com.questrail.cpor.protocol.codec;

/**
 * How {@link CporMessageDecoder#parse(byte[])} decides which message kind a
 * payload carries.
 */
public enum KindResolution
{
    /**
     * The payload must carry a {@code type} discriminant naming one of the ten
     * kinds. Payloads without one are rejected.
     */
    DISCRIMINANT_REQUIRED,

    /**
     * A recognised {@code type} discriminant wins. Payloads without one are
     * classified by which fields they contain, for peers that predate the
     * discriminant. Detection order is fixed; the first matching kind wins.
     */
    LEGACY_STRUCTURAL
}

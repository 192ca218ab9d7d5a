package com.questrail.cpor.config;

import com.questrail.cpor.protocol.codec.KindResolution;

import java.util.Objects;

/**
 * Wire codec settings.
 *
 * <ul>
 *   <li><b>maxMessageSize</b>: largest encoded frame accepted for decoding</li>
 *   <li><b>kindResolution</b>: whether payloads without a {@code type}
 *       discriminant may be classified structurally</li>
 * </ul>
 */
public record CodecConfig(
    int maxMessageSize,
    KindResolution kindResolution
) {
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 1_048_576;

    public CodecConfig {
        Objects.requireNonNull(kindResolution, "kindResolution");
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be positive (was " + maxMessageSize + ")");
        }
    }

    public static CodecConfig defaults() {
        return new CodecConfig(DEFAULT_MAX_MESSAGE_SIZE, KindResolution.DISCRIMINANT_REQUIRED);
    }
}

package com.questrail.cpor.config;

import com.questrail.cpor.crypto.HardwareFallbackPolicy;
import com.questrail.cpor.crypto.KeyStorageKind;

import java.util.Objects;

/**
 * Key management settings consumed by {@code CryptoManager}.
 *
 * <ul>
 *   <li><b>defaultStorage</b>: storage used when a caller does not name one</li>
 *   <li><b>fallbackPolicy</b>: behavior when hardware storage is requested but
 *       unavailable</li>
 *   <li><b>nonceSize</b>: size of nonces produced for connect/resume requests
 *       (16-64 bytes, the
 *       minimum a connect request accepts)</li>
 * </ul>
 */
public record CryptoConfig(
    KeyStorageKind defaultStorage,
    HardwareFallbackPolicy fallbackPolicy,
    int nonceSize
) {
    public static final int MIN_NONCE_SIZE = 16;
    public static final int MAX_NONCE_SIZE = 64;

    public CryptoConfig {
        Objects.requireNonNull(defaultStorage, "defaultStorage");
        Objects.requireNonNull(fallbackPolicy, "fallbackPolicy");
        if (nonceSize < MIN_NONCE_SIZE || nonceSize > MAX_NONCE_SIZE) {
            throw new IllegalArgumentException(
                "nonceSize must be in range " + MIN_NONCE_SIZE + ".." + MAX_NONCE_SIZE
                    + " (was " + nonceSize + ")");
        }
    }

    /**
     * Software keys, silent-but-reported fallback, 16-byte nonces.
     */
    public static CryptoConfig defaults() {
        return new CryptoConfig(KeyStorageKind.SOFTWARE, HardwareFallbackPolicy.FALL_BACK_TO_SOFTWARE, 16);
    }
}

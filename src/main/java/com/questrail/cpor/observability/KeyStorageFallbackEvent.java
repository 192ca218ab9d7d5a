package com.questrail.cpor.observability;

import com.questrail.cpor.crypto.KeyStorageKind;

import java.time.Instant;

/**
 * Record emitted when a key was generated in a different storage than the
 * caller requested (hardware unavailable, software substituted).
 */
public record KeyStorageFallbackEvent(
    Instant timestamp,
    String keyId,
    KeyStorageKind requested,
    KeyStorageKind actual
) {
}

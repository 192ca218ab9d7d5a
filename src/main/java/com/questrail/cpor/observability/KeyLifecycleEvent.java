package com.questrail.cpor.observability;

import com.questrail.cpor.crypto.KeyStorageKind;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing a key being created in, or removed from, a key store.
 */
public record KeyLifecycleEvent(
    Instant timestamp,
    String keyId,
    KeyStorageKind storage,
    Action action
) {
    public enum Action {
        GENERATED,
        DELETED
    }

    public KeyLifecycleEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(storage, "storage");
        Objects.requireNonNull(action, "action");
    }
}

package com.questrail.cpor.crypto;

import java.util.Optional;

/**
 * Where the private half of a key pair lives.
 *
 * <p>The wire name is what a {@code ConnectRequest} advertises in its
 * {@code key_storage} field.</p>
 */
public enum KeyStorageKind
{
    /** In-process key material held by {@link CryptoManager}. */
    SOFTWARE("software"),

    /** Opaque handle into a {@link SecureKeyStore}; private material never leaves the store. */
    TPM("tpm");

    private final String wireName;

    KeyStorageKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a storage kind by its wire name.
     *
     * @return the matching kind, or empty for any other value
     */
    public static Optional<KeyStorageKind> fromWireName(String wireName) {
        for (KeyStorageKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}

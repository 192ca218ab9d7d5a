package com.questrail.cpor.crypto;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.Objects;

/**
 * One Ed25519 identity known to a {@link CryptoManager}.
 *
 * <h2>Storage semantics</h2>
 * <ul>
 *   <li>{@link KeyStorageKind#SOFTWARE}: the private key is held in process and
 *       may be exported via {@link #privateKeyBytes()}</li>
 *   <li>{@link KeyStorageKind#TPM}: only an opaque handle (the key id) exists
 *       here; any attempt to read private material fails with
 *       {@link KeyStorageException}</li>
 * </ul>
 *
 * <p>Instances are immutable. Equality is by key id, storage and public key.</p>
 */
public final class KeyPair
{
    private final String keyId;
    private final KeyStorageKind storage;
    private final PublicKey publicKey;
    private final byte[] publicKeyBytes;
    private final PrivateKey privateKey;

    private KeyPair(String keyId, KeyStorageKind storage, PublicKey publicKey, PrivateKey privateKey) {
        this.keyId = Objects.requireNonNull(keyId, "keyId");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.publicKey = Objects.requireNonNull(publicKey, "publicKey");
        this.publicKeyBytes = Ed25519.rawPublicKey(publicKey);
        this.privateKey = privateKey;
    }

    static KeyPair software(String keyId, java.security.KeyPair jcaKeys) {
        return new KeyPair(keyId, KeyStorageKind.SOFTWARE, jcaKeys.getPublic(),
                Objects.requireNonNull(jcaKeys.getPrivate(), "private key"));
    }

    static KeyPair hardware(String keyId, byte[] rawPublicKey) {
        return new KeyPair(keyId, KeyStorageKind.TPM, Ed25519.publicKeyFromRaw(rawPublicKey), null);
    }

    public String keyId() {
        return keyId;
    }

    /**
     * The storage that actually holds this key. When hardware storage was
     * requested but unavailable this reports {@link KeyStorageKind#SOFTWARE}.
     */
    public KeyStorageKind storage() {
        return storage;
    }

    public PublicKey publicKey() {
        return publicKey;
    }

    /**
     * @return a copy of the raw 32-byte public key
     */
    public byte[] publicKeyBytes() {
        return publicKeyBytes.clone();
    }

    /**
     * @return a copy of the raw 32-byte private key seed
     * @throws KeyStorageException for hardware-held keys
     */
    public byte[] privateKeyBytes() {
        return Ed25519.rawPrivateKey(requirePrivateKey());
    }

    PrivateKey requirePrivateKey() {
        if (privateKey == null) {
            throw new KeyStorageException("Cannot export private key from TPM storage: " + keyId);
        }
        return privateKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyPair that)) return false;
        return keyId.equals(that.keyId)
                && storage == that.storage
                && Arrays.equals(publicKeyBytes, that.publicKeyBytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyId, storage, Arrays.hashCode(publicKeyBytes));
    }

    @Override
    public String toString() {
        return "KeyPair[keyId=" + keyId + ", storage=" + storage + "]";
    }
}

package com.questrail.cpor.crypto;

/**
 * Pluggable hardware-backed key storage.
 *
 * <p>Private key material never leaves an implementation of this interface;
 * callers only ever see raw 32-byte public keys and 64-byte signatures.
 * Implementations are selected by injection when a {@link CryptoManager} is
 * constructed.</p>
 *
 * <p>Key enumeration is deliberately not part of this contract, so keys held
 * here are not reported by {@link CryptoManager#listKeys()}.</p>
 */
public interface SecureKeyStore
{
    /**
     * @return whether the store is present and functional
     */
    boolean isAvailable();

    /**
     * Creates a new Ed25519 key inside the store.
     *
     * @return the raw 32-byte public key
     * @throws TpmException if the id already exists or the store fails
     */
    byte[] generateKey(String keyId);

    /**
     * Signs {@code data} with a stored key.
     *
     * @return the 64-byte signature
     * @throws TpmException if the id is unknown or the store fails
     */
    byte[] sign(String keyId, byte[] data);

    /**
     * @return the raw 32-byte public key of a stored key
     * @throws TpmException if the id is unknown
     */
    byte[] getPublicKey(String keyId);

    /**
     * @return {@code true} if a key was removed, {@code false} if none existed
     */
    boolean deleteKey(String keyId);
}

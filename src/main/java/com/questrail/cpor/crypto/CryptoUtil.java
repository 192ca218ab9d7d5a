package com.questrail.cpor.crypto;

import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Stateless helpers shared by the protocol: nonces, session keys, timing-safe
 * comparison and key id derivation.
 */
public final class CryptoUtil
{
    public static final int MIN_NONCE_SIZE = 1;
    public static final int MAX_NONCE_SIZE = 1024;
    public static final int SESSION_KEY_SIZE = 32;
    public static final String DEFAULT_KEY_ID_PREFIX = "cpor";

    private static final int KEY_ID_BYTES = 8;

    private static final ThreadLocal<SecureRandom> RANDOM = ThreadLocal.withInitial(SecureRandom::new);

    private CryptoUtil() {}

    /**
     * Returns {@code size} cryptographically secure random bytes.
     *
     * @throws IllegalArgumentException unless {@code 1 <= size <= 1024}
     */
    public static byte[] generateNonce(int size) {
        if (size < MIN_NONCE_SIZE || size > MAX_NONCE_SIZE) {
            throw new IllegalArgumentException(
                    "Nonce size must be between " + MIN_NONCE_SIZE + " and " + MAX_NONCE_SIZE
                            + " bytes (was " + size + ")");
        }
        byte[] nonce = new byte[size];
        RANDOM.get().nextBytes(nonce);
        return nonce;
    }

    public static byte[] generateSessionKey() {
        return generateNonce(SESSION_KEY_SIZE);
    }

    /**
     * Compares two byte arrays in time independent of where they differ.
     */
    public static boolean constantTimeEquals(byte[] a, byte[] b) {
        return MessageDigest.isEqual(
                Objects.requireNonNull(a, "a"),
                Objects.requireNonNull(b, "b"));
    }

    public static String deriveKeyId(byte[] publicKey) {
        return deriveKeyId(publicKey, DEFAULT_KEY_ID_PREFIX);
    }

    /**
     * Derives {@code prefix_<hex of first 8 key bytes>}.
     *
     * @throws IllegalArgumentException if the key is not 32 bytes
     */
    public static String deriveKeyId(byte[] publicKey, String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (publicKey == null || publicKey.length != Ed25519.PUBLIC_KEY_LENGTH) {
            throw new IllegalArgumentException("Public key must be " + Ed25519.PUBLIC_KEY_LENGTH + " bytes");
        }
        return prefix + "_" + HexFormat.of().formatHex(Arrays.copyOf(publicKey, KEY_ID_BYTES));
    }

    /**
     * @return whether the bytes decode as an Ed25519 public key; never throws
     */
    public static boolean isValidEd25519PublicKey(byte[] keyBytes) {
        if (keyBytes == null || keyBytes.length != Ed25519.PUBLIC_KEY_LENGTH) {
            return false;
        }
        try {
            Ed25519.publicKeyFromRaw(keyBytes);
            return true;
        } catch (VerificationException e) {
            return false;
        }
    }

    /**
     * @return whether the bytes decode as an Ed25519 private key seed; never throws
     */
    public static boolean isValidEd25519PrivateKey(byte[] keyBytes) {
        if (keyBytes == null || keyBytes.length != Ed25519.PRIVATE_KEY_LENGTH) {
            return false;
        }
        try {
            Ed25519.privateKeyFromRaw(keyBytes);
            return true;
        } catch (KeyStorageException e) {
            return false;
        }
    }
}

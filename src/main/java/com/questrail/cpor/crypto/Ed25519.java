package com.questrail.cpor.crypto;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Ed25519
 * -----------------------------------------------------------------------------
 * Thin wrapper over the JDK's {@code Ed25519} provider.
 *
 * <p>The protocol exchanges raw keys (32 bytes) and raw signatures (64 bytes).
 * The JDK works with X.509 / PKCS#8 encodings, so raw keys are converted by
 * prefixing the fixed DER header for the Ed25519 algorithm identifier.</p>
 *
 * <p>Failure classification:</p>
 * <ul>
 *   <li>malformed inputs (lengths, undecodable keys) raise
 *       {@link VerificationException} or {@link SigningException}</li>
 *   <li>a well-formed signature that does not verify returns {@code false}</li>
 * </ul>
 */
public final class Ed25519
{
    public static final String ALGORITHM = "Ed25519";

    public static final int PUBLIC_KEY_LENGTH = 32;
    public static final int PRIVATE_KEY_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 64;

    private static final byte[] X509_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");
    private static final byte[] PKCS8_PREFIX = HexFormat.of().parseHex("302e020100300506032b657004220420");

    private Ed25519() {}

    /**
     * Generates a fresh JCA key pair.
     *
     * @throws KeyGenerationException if no Ed25519 provider is installed
     */
    public static java.security.KeyPair generateKeyPair() {
        try {
            return KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new KeyGenerationException("Ed25519 key generation unavailable", e);
        }
    }

    /**
     * Produces a 64-byte signature over {@code data}.
     *
     * @throws SigningException if the key is not a usable Ed25519 private key
     */
    public static byte[] sign(PrivateKey privateKey, byte[] data) {
        Objects.requireNonNull(privateKey, "privateKey");
        Objects.requireNonNull(data, "data");
        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initSign(privateKey);
            signature.update(data);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new SigningException("Failed to sign with Ed25519 key", e);
        }
    }

    /**
     * Verifies {@code signature} over {@code data}.
     *
     * @return {@code true} iff the signature is valid for this key and data
     * @throws VerificationException if the signature is not 64 bytes or the key
     *         cannot be used for Ed25519 verification
     */
    public static boolean verify(PublicKey publicKey, byte[] data, byte[] signature) {
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(data, "data");
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            throw new VerificationException("Signature must be " + SIGNATURE_LENGTH + " bytes");
        }

        final Signature verifier;
        try {
            verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(publicKey);
        } catch (InvalidKeyException e) {
            throw new VerificationException("Key is not an Ed25519 public key", e);
        } catch (GeneralSecurityException e) {
            throw new VerificationException("Ed25519 verification unavailable", e);
        }

        try {
            verifier.update(data);
            return verifier.verify(signature);
        } catch (SignatureException e) {
            // The provider rejects some structurally invalid R/S encodings by
            // throwing; for a correctly sized signature that is a mismatch.
            return false;
        }
    }

    /**
     * Decodes a raw 32-byte public key.
     *
     * @throws VerificationException if the bytes are not a valid Ed25519 point
     */
    public static PublicKey publicKeyFromRaw(byte[] raw) {
        if (raw == null || raw.length != PUBLIC_KEY_LENGTH) {
            throw new VerificationException("Public key must be " + PUBLIC_KEY_LENGTH + " bytes");
        }
        try {
            return KeyFactory.getInstance(ALGORITHM)
                    .generatePublic(new X509EncodedKeySpec(concat(X509_PREFIX, raw)));
        } catch (InvalidKeySpecException e) {
            throw new VerificationException("Invalid Ed25519 public key", e);
        } catch (GeneralSecurityException e) {
            throw new VerificationException("Ed25519 key decoding unavailable", e);
        }
    }

    /**
     * Decodes a raw 32-byte private key seed.
     *
     * @throws KeyStorageException if the bytes cannot be decoded
     */
    public static PrivateKey privateKeyFromRaw(byte[] raw) {
        if (raw == null || raw.length != PRIVATE_KEY_LENGTH) {
            throw new KeyStorageException("Private key must be " + PRIVATE_KEY_LENGTH + " bytes");
        }
        try {
            return KeyFactory.getInstance(ALGORITHM)
                    .generatePrivate(new PKCS8EncodedKeySpec(concat(PKCS8_PREFIX, raw)));
        } catch (GeneralSecurityException e) {
            throw new KeyStorageException("Invalid Ed25519 private key", e);
        }
    }

    /**
     * Extracts the raw 32-byte public key from a JCA key.
     */
    public static byte[] rawPublicKey(PublicKey publicKey) {
        return trailing(publicKey.getEncoded(), PUBLIC_KEY_LENGTH, "public");
    }

    /**
     * Extracts the raw 32-byte seed from a JCA private key.
     */
    public static byte[] rawPrivateKey(PrivateKey privateKey) {
        return trailing(privateKey.getEncoded(), PRIVATE_KEY_LENGTH, "private");
    }

    private static byte[] trailing(byte[] encoded, int length, String what) {
        if (encoded == null || encoded.length < length) {
            throw new KeyStorageException("Unexpected Ed25519 " + what + " key encoding");
        }
        return Arrays.copyOfRange(encoded, encoded.length - length, encoded.length);
    }

    private static byte[] concat(byte[] prefix, byte[] raw) {
        byte[] out = Arrays.copyOf(prefix, prefix.length + raw.length);
        System.arraycopy(raw, 0, out, prefix.length, raw.length);
        return out;
    }
}

package com.questrail.cpor.protocol.sign;

import com.questrail.cpor.crypto.CryptoException;
import com.questrail.cpor.crypto.CryptoManager;
import com.questrail.cpor.crypto.Ed25519;
import com.questrail.cpor.crypto.VerificationException;
import com.questrail.cpor.protocol.codec.CporMessageEncoder;
import com.questrail.cpor.protocol.model.CporMessage;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;

/**
 * MessageSigner
 * ============================================================================
 * Ed25519 signatures over the canonical encoding of a message.
 *
 * <p>The signed bytes are exactly {@link CporMessageEncoder#encode}. Verifying
 * re-encodes the message, so a signature only checks out against a message
 * whose every field (header included) equals the one that was signed.</p>
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li>valid signature → {@code true}</li>
 *   <li>signature by another key, over other content, or not 64 bytes long →
 *       {@code false}</li>
 *   <li>public key that is not a usable Ed25519 key →
 *       {@link MessageSignatureException}</li>
 * </ul>
 */
public final class MessageSigner
{
    private final CporMessageEncoder encoder;
    private final CryptoManager cryptoManager;

    public MessageSigner(CporMessageEncoder encoder, CryptoManager cryptoManager) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.cryptoManager = Objects.requireNonNull(cryptoManager, "cryptoManager");
    }

    /**
     * Signs with a key held by the crypto manager (software or hardware).
     *
     * @return 64-byte signature
     * @throws MessageSignatureException if the key is unknown or signing fails
     */
    public byte[] sign(CporMessage message, String keyId) {
        byte[] encoded = encoder.encode(message);
        try {
            return cryptoManager.signData(keyId, encoded);
        } catch (CryptoException e) {
            throw new MessageSignatureException("Failed to sign message: " + e.getMessage(), e);
        }
    }

    /**
     * Signs with a caller-held private key.
     */
    public byte[] sign(CporMessage message, PrivateKey privateKey) {
        byte[] encoded = encoder.encode(message);
        try {
            return Ed25519.sign(privateKey, encoded);
        } catch (CryptoException e) {
            throw new MessageSignatureException("Failed to sign message: " + e.getMessage(), e);
        }
    }

    /**
     * @param publicKey raw 32-byte Ed25519 public key
     */
    public boolean verify(CporMessage message, byte[] signature, byte[] publicKey) {
        final PublicKey key;
        try {
            key = Ed25519.publicKeyFromRaw(publicKey);
        } catch (VerificationException e) {
            throw new MessageSignatureException("Failed to verify signature: " + e.getMessage(), e);
        }
        return verify(message, signature, key);
    }

    public boolean verify(CporMessage message, byte[] signature, PublicKey publicKey) {
        Objects.requireNonNull(publicKey, "publicKey");
        if (signature == null || signature.length != Ed25519.SIGNATURE_LENGTH) {
            return false;
        }
        byte[] encoded = encoder.encode(message);
        try {
            return Ed25519.verify(publicKey, encoded, signature);
        } catch (VerificationException e) {
            throw new MessageSignatureException("Failed to verify signature: " + e.getMessage(), e);
        }
    }
}

package com.questrail.cpor.crypto;

import java.security.PrivateKey;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process stand-in for a hardware key store.
 *
 * <p>Keys are generated and used exactly as a device would expose them: only
 * public keys and signatures leave this class. Availability can be switched
 * off to exercise the software fallback path.</p>
 */
public final class SimulatedHardwareKeyStore implements SecureKeyStore
{
    private final Map<String, java.security.KeyPair> keys = new ConcurrentHashMap<>();
    private volatile boolean available;

    public SimulatedHardwareKeyStore() {
        this(true);
    }

    public SimulatedHardwareKeyStore(boolean available) {
        this.available = available;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public byte[] generateKey(String keyId) {
        Objects.requireNonNull(keyId, "keyId");
        requireAvailable();
        java.security.KeyPair generated;
        try {
            generated = Ed25519.generateKeyPair();
        } catch (KeyGenerationException e) {
            throw new TpmException("Failed to generate TPM key " + keyId, e);
        }
        if (keys.putIfAbsent(keyId, generated) != null) {
            throw new TpmException("Key " + keyId + " already exists in TPM");
        }
        return Ed25519.rawPublicKey(generated.getPublic());
    }

    @Override
    public byte[] sign(String keyId, byte[] data) {
        PrivateKey privateKey = require(keyId).getPrivate();
        try {
            return Ed25519.sign(privateKey, data);
        } catch (SigningException e) {
            throw new TpmException("Failed to sign with TPM key " + keyId, e);
        }
    }

    @Override
    public byte[] getPublicKey(String keyId) {
        return Ed25519.rawPublicKey(require(keyId).getPublic());
    }

    @Override
    public boolean deleteKey(String keyId) {
        return keys.remove(keyId) != null;
    }

    private void requireAvailable() {
        if (!available) {
            throw new TpmException("TPM not available");
        }
    }

    private java.security.KeyPair require(String keyId) {
        requireAvailable();
        java.security.KeyPair pair = keys.get(Objects.requireNonNull(keyId, "keyId"));
        if (pair == null) {
            throw new TpmException("Key " + keyId + " not found in TPM");
        }
        return pair;
    }
}

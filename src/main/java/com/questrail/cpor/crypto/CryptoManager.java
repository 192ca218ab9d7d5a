package com.questrail.cpor.crypto;

import com.questrail.cpor.config.CryptoConfig;
import com.questrail.cpor.observability.CporObservabilitySink;
import com.questrail.cpor.observability.KeyLifecycleEvent;
import com.questrail.cpor.observability.KeyStorageFallbackEvent;
import com.questrail.cpor.observability.Slf4jCporObservabilitySink;

import java.security.PublicKey;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CryptoManager
 * ============================================================================
 * Owns the Ed25519 identities used to sign CPOR messages.
 *
 * <h2>Key stores</h2>
 * Two stores are consulted, always in this order:
 * <ol>
 *   <li>the in-memory software keystore owned by this instance</li>
 *   <li>the injected {@link SecureKeyStore} (hardware-backed)</li>
 * </ol>
 *
 * Software keys live only as long as this instance. Hardware keys are owned by
 * the external store; this class holds no state for them.
 *
 * <h2>Hardware fallback</h2>
 * When {@link KeyStorageKind#TPM} is requested and the store reports itself
 * unavailable, {@link CryptoConfig#fallbackPolicy()} decides between
 * substituting a software key (reported to the observability sink and visible
 * through {@link KeyPair#storage()}) and failing.
 *
 * <h2>Concurrency</h2>
 * Generation, deletion and signing are serialized per key id through a fixed
 * set of lock stripes. Operations on different ids proceed in parallel.
 */
public final class CryptoManager
{
    private static final int LOCK_STRIPES = 64;

    private final SecureKeyStore secureStore;
    private final CryptoConfig config;
    private final CporObservabilitySink sink;
    private final Clock clock;

    private final Map<String, KeyPair> softwareKeys = new ConcurrentHashMap<>();
    private final Object[] locks = new Object[LOCK_STRIPES];

    /**
     * Creates a manager backed by a {@link SimulatedHardwareKeyStore}, default
     * configuration and SLF4J logging.
     */
    public CryptoManager() {
        this(new SimulatedHardwareKeyStore(), CryptoConfig.defaults(), new Slf4jCporObservabilitySink());
    }

    public CryptoManager(SecureKeyStore secureStore, CryptoConfig config, CporObservabilitySink sink) {
        this(secureStore, config, sink, Clock.systemUTC());
    }

    public CryptoManager(SecureKeyStore secureStore,
                         CryptoConfig config,
                         CporObservabilitySink sink,
                         Clock clock) {
        this.secureStore = Objects.requireNonNull(secureStore, "secureStore");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    public boolean isHardwareAvailable() {
        return secureStore.isAvailable();
    }

    public CryptoConfig config() {
        return config;
    }

    /**
     * Generates a key pair in the configured default storage.
     */
    public KeyPair generateKeypair(String keyId) {
        return generateKeypair(keyId, config.defaultStorage());
    }

    /**
     * Generates a new Ed25519 key pair under {@code keyId}.
     *
     * @param keyId   unique identifier, not already known to either store
     * @param storage requested storage
     * @return the key pair; {@link KeyPair#storage()} reports the storage used
     * @throws KeyGenerationException if the id is taken or generation fails
     * @throws TpmException if hardware is required by policy but unavailable
     */
    public KeyPair generateKeypair(String keyId, KeyStorageKind storage) {
        Objects.requireNonNull(storage, "storage");
        if (keyId == null || keyId.isBlank()) {
            throw new KeyGenerationException("keyId must be a non-empty string");
        }

        synchronized (lockFor(keyId)) {
            if (softwareKeys.containsKey(keyId) || hardwarePublicKey(keyId).isPresent()) {
                throw new KeyGenerationException("Key " + keyId + " already exists");
            }

            if (storage == KeyStorageKind.TPM) {
                if (secureStore.isAvailable()) {
                    return generateHardwareKeypair(keyId);
                }
                if (config.fallbackPolicy() == HardwareFallbackPolicy.REQUIRE_HARDWARE) {
                    throw new TpmException("TPM not available and hardware storage is required for key " + keyId);
                }
                sink.onStorageFallback(new KeyStorageFallbackEvent(
                        clock.instant(), keyId, KeyStorageKind.TPM, KeyStorageKind.SOFTWARE));
            }

            return generateSoftwareKeypair(keyId);
        }
    }

    private KeyPair generateSoftwareKeypair(String keyId) {
        KeyPair keyPair = KeyPair.software(keyId, Ed25519.generateKeyPair());
        softwareKeys.put(keyId, keyPair);
        sink.onKeyEvent(new KeyLifecycleEvent(
                clock.instant(), keyId, KeyStorageKind.SOFTWARE, KeyLifecycleEvent.Action.GENERATED));
        return keyPair;
    }

    private KeyPair generateHardwareKeypair(String keyId) {
        final KeyPair keyPair;
        try {
            keyPair = KeyPair.hardware(keyId, secureStore.generateKey(keyId));
        } catch (TpmException | VerificationException e) {
            throw new KeyGenerationException("Failed to generate TPM key pair " + keyId, e);
        }
        sink.onKeyEvent(new KeyLifecycleEvent(
                clock.instant(), keyId, KeyStorageKind.TPM, KeyLifecycleEvent.Action.GENERATED));
        return keyPair;
    }

    /**
     * Looks up a key pair; software keys first, then the hardware store.
     * Hardware results carry only the public half.
     */
    public Optional<KeyPair> findKeypair(String keyId) {
        Objects.requireNonNull(keyId, "keyId");
        KeyPair software = softwareKeys.get(keyId);
        if (software != null) {
            return Optional.of(software);
        }
        return hardwarePublicKey(keyId).map(raw -> KeyPair.hardware(keyId, raw));
    }

    /**
     * Signs {@code data} with the named key.
     *
     * @return 64-byte Ed25519 signature
     * @throws KeyStorageException if no store holds {@code keyId}
     * @throws SigningException if the signing primitive fails
     */
    public byte[] signData(String keyId, byte[] data) {
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(data, "data");

        synchronized (lockFor(keyId)) {
            KeyPair software = softwareKeys.get(keyId);
            if (software != null) {
                try {
                    return Ed25519.sign(software.requirePrivateKey(), data);
                } catch (SigningException e) {
                    throw new SigningException("Failed to sign with software key " + keyId, e);
                }
            }

            if (hardwarePublicKey(keyId).isEmpty()) {
                throw new KeyStorageException("Key " + keyId + " not found in any storage");
            }
            try {
                return secureStore.sign(keyId, data);
            } catch (TpmException e) {
                throw new SigningException("Failed to sign with TPM key " + keyId, e);
            }
        }
    }

    /**
     * Verifies a signature against a raw 32-byte public key.
     *
     * @throws VerificationException if the key or signature is malformed
     */
    public boolean verifySignature(byte[] publicKey, byte[] data, byte[] signature) {
        return Ed25519.verify(Ed25519.publicKeyFromRaw(publicKey), data, signature);
    }

    /**
     * Verifies a signature against an already decoded public key.
     *
     * @throws VerificationException if the key is not Ed25519 or the signature
     *         is not 64 bytes
     */
    public boolean verifySignature(PublicKey publicKey, byte[] data, byte[] signature) {
        return Ed25519.verify(publicKey, data, signature);
    }

    public boolean verifySignature(KeyPair keyPair, byte[] data, byte[] signature) {
        return Ed25519.verify(keyPair.publicKey(), data, signature);
    }

    /**
     * Removes {@code keyId} from both stores.
     *
     * @return whether anything was removed
     */
    public boolean deleteKey(String keyId) {
        Objects.requireNonNull(keyId, "keyId");

        synchronized (lockFor(keyId)) {
            boolean deleted = false;

            if (softwareKeys.remove(keyId) != null) {
                deleted = true;
                sink.onKeyEvent(new KeyLifecycleEvent(
                        clock.instant(), keyId, KeyStorageKind.SOFTWARE, KeyLifecycleEvent.Action.DELETED));
            }

            if (secureStore.isAvailable() && secureStore.deleteKey(keyId)) {
                deleted = true;
                sink.onKeyEvent(new KeyLifecycleEvent(
                        clock.instant(), keyId, KeyStorageKind.TPM, KeyLifecycleEvent.Action.DELETED));
            }

            return deleted;
        }
    }

    /**
     * Lists software-held key ids in sorted order. Hardware-held keys are not
     * enumerable through {@link SecureKeyStore}.
     */
    public List<String> listKeys() {
        List<String> ids = new ArrayList<>(softwareKeys.keySet());
        Collections.sort(ids);
        return Collections.unmodifiableList(ids);
    }

    /**
     * @return a fresh nonce of the configured size
     */
    public byte[] generateNonce() {
        return CryptoUtil.generateNonce(config.nonceSize());
    }

    private Optional<byte[]> hardwarePublicKey(String keyId) {
        if (!secureStore.isAvailable()) {
            return Optional.empty();
        }
        try {
            return Optional.of(secureStore.getPublicKey(keyId));
        } catch (TpmException notFound) {
            return Optional.empty();
        }
    }

    private Object lockFor(String keyId) {
        return locks[Math.floorMod(keyId.hashCode(), LOCK_STRIPES)];
    }
}

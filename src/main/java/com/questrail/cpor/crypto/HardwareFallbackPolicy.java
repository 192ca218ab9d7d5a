package com.questrail.cpor.crypto;

/**
 * Decides what {@link CryptoManager#generateKeypair(String, KeyStorageKind)}
 * does when hardware-backed storage is requested but the
 * {@link SecureKeyStore} reports itself unavailable.
 *
 * <p>Callers with compliance requirements for hardware-held keys must select
 * {@link #REQUIRE_HARDWARE}. Whatever the policy, the storage actually used is
 * reported by {@link KeyPair#storage()}.</p>
 */
public enum HardwareFallbackPolicy
{
    /**
     * Substitute an in-process software key and report the substitution to the
     * observability sink.
     */
    FALL_BACK_TO_SOFTWARE,

    /**
     * Fail the generation with a {@link TpmException}.
     */
    REQUIRE_HARDWARE
}

package com.questrail.cpor.crypto;

/**
 * Raised when an Ed25519 key pair cannot be generated or registered.
 */
public final class KeyGenerationException extends CryptoException
{
    public KeyGenerationException(String message) {
        super(message);
    }

    public KeyGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}

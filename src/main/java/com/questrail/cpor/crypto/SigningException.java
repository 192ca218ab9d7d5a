package com.questrail.cpor.crypto;

/**
 * Raised when the signing primitive itself cannot run (unusable key, provider failure).
 */
public final class SigningException extends CryptoException
{
    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.cpor.crypto;

/**
 * Raised by a {@link SecureKeyStore} for hardware-store failures
 * (duplicate or unknown key id, unavailable device).
 */
public final class TpmException extends CryptoException
{
    public TpmException(String message) {
        super(message);
    }

    public TpmException(String message, Throwable cause) {
        super(message, cause);
    }
}

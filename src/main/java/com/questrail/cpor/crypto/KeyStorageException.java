package com.questrail.cpor.crypto;

/**
 * Raised when a key cannot be found in, or read from, any configured store.
 */
public final class KeyStorageException extends CryptoException
{
    public KeyStorageException(String message) {
        super(message);
    }

    public KeyStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.cpor.crypto;

/**
 * Root of the key lifecycle and signature primitive failures.
 *
 * <p>These are recoverable by the caller choosing a different key or storage
 * kind. Nothing in this package retries.</p>
 */
public class CryptoException extends RuntimeException
{
    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}

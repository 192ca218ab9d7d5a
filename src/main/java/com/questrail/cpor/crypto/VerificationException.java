package com.questrail.cpor.crypto;

/**
 * Raised when a verification cannot be attempted because its inputs are malformed.
 *
 * <p>A well-formed signature that simply does not match is reported as
 * {@code false}, never as this exception.</p>
 */
public final class VerificationException extends CryptoException
{
    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}

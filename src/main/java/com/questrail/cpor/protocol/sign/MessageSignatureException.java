package com.questrail.cpor.protocol.sign;

import com.questrail.cpor.protocol.CporProtocolException;

/**
 * Indicates that a message could not be signed or verified at all, for
 * example because the key is unusable.
 *
 * <p>A signature that does not match is not an error; verification reports it
 * as {@code false}.</p>
 */
public final class MessageSignatureException extends CporProtocolException
{
    public MessageSignatureException(String message) {
        super(message);
    }

    public MessageSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.cpor.protocol;

/**
 * Root of all message schema, codec and message-signature failures.
 *
 * <p>Unchecked: every failure here reflects either a caller contract
 * violation or a poisoned frame, neither of which is worth retrying.</p>
 */
public class CporProtocolException extends RuntimeException
{
    public CporProtocolException(String message) {
        super(message);
    }

    public CporProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}

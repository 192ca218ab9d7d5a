package com.questrail.cpor.protocol.model;

import com.questrail.cpor.protocol.CporProtocolException;

/**
 * Indicates that a field violates a message kind's contract, or that the kind
 * of a decoded payload cannot be determined.
 *
 * <p>Always raised before any message instance becomes observable.</p>
 */
public final class InvalidMessageException extends CporProtocolException
{
    public InvalidMessageException(String message) {
        super(message);
    }

    public InvalidMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.cpor.protocol.codec;

import com.questrail.cpor.protocol.CporProtocolException;

/**
 * Indicates that a byte stream is not a valid CBOR encoding of a message map.
 *
 * <p>The frame should be treated as poisoned: dropped and logged, never
 * retried with the same bytes.</p>
 */
public final class SerializationException extends CporProtocolException
{
    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}

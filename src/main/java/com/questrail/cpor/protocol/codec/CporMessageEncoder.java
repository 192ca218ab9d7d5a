package com.questrail.cpor.protocol.codec;

import com.questrail.cpor.protocol.model.CporMessage;

/**
 * CporMessageEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between semantic messages and wire bytes.
 *
 * <p>Encoding is deterministic: equal messages always produce identical bytes.
 * Message signatures are computed over this output, so any change to field
 * order or representation invalidates previously produced signatures.</p>
 */
public interface CporMessageEncoder
{
    /**
     * @param message a valid message
     * @return the encoded payload
     * @throws SerializationException if the message cannot be written
     */
    byte[] encode(CporMessage message);
}

package com.questrail.cpor.protocol.codec;

import com.questrail.cpor.protocol.model.CporMessage;
import com.questrail.cpor.protocol.model.InvalidMessageException;

/**
 * CporMessageDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between wire bytes and semantic messages.
 *
 * <p>Failures are classified in two groups:</p>
 * <ul>
 *   <li>{@link SerializationException}: the bytes are not a well-formed payload
 *       (oversized, not CBOR, not a map)</li>
 *   <li>{@link InvalidMessageException}: the payload is well-formed but its kind
 *       cannot be determined or its fields violate the message contract</li>
 * </ul>
 *
 * <p>Every message returned has passed full construction-time validation.</p>
 */
public interface CporMessageDecoder
{
    /**
     * Decodes a payload of unknown kind.
     */
    CporMessage parse(byte[] payload);

    /**
     * Decodes a payload that is expected to hold a message of {@code type}.
     *
     * @throws InvalidMessageException if the payload's discriminant names a
     *         different kind
     */
    <T extends CporMessage> T decode(byte[] payload, Class<T> type);
}

package com.questrail.cpor.protocol.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.questrail.cpor.protocol.codec.CporMessageEncoder;
import com.questrail.cpor.protocol.codec.SerializationException;
import com.questrail.cpor.protocol.internal.fields.MessageFieldEncoder;
import com.questrail.cpor.protocol.model.CporMessage;

import java.util.Objects;

/**
 * CBOR implementation of {@link CporMessageEncoder}.
 *
 * <p>Writes the canonical field map from {@link MessageFieldEncoder} as a
 * single definite-length CBOR map. Stateless and thread-safe.</p>
 */
public final class CborMessageEncoder implements CporMessageEncoder
{
    @Override
    public byte[] encode(CporMessage message) {
        Objects.requireNonNull(message, "message");
        try {
            return CborMappers.mapper().writeValueAsBytes(MessageFieldEncoder.toFields(message));
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize message to CBOR: " + e.getOriginalMessage(), e);
        }
    }
}

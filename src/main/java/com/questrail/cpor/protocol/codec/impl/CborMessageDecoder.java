package com.questrail.cpor.protocol.codec.impl;

import com.questrail.cpor.config.CodecConfig;
import com.questrail.cpor.protocol.codec.CporMessageDecoder;
import com.questrail.cpor.protocol.codec.SerializationException;
import com.questrail.cpor.protocol.internal.fields.MessageFieldDecoder;
import com.questrail.cpor.protocol.model.CporMessage;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * CBOR implementation of {@link CporMessageDecoder}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>size check against {@link CodecConfig#maxMessageSize()}</li>
 *   <li>CBOR parse of exactly one top-level item, which must be a map</li>
 *   <li>kind resolution per {@link CodecConfig#kindResolution()}</li>
 *   <li>typed construction through {@link MessageFieldDecoder}</li>
 * </ol>
 *
 * <p>Stateless apart from its configuration; safe for concurrent use.</p>
 */
public final class CborMessageDecoder implements CporMessageDecoder
{
    private final CodecConfig config;

    public CborMessageDecoder() {
        this(CodecConfig.defaults());
    }

    public CborMessageDecoder(CodecConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public CporMessage parse(byte[] payload) {
        return MessageFieldDecoder.fromFields(readMap(payload), config.kindResolution());
    }

    @Override
    public <T extends CporMessage> T decode(byte[] payload, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return MessageFieldDecoder.fromFields(readMap(payload), type);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> readMap(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (payload.length > config.maxMessageSize()) {
            throw new SerializationException("Message of " + payload.length
                    + " bytes exceeds maximum size of " + config.maxMessageSize() + " bytes");
        }

        final Object decoded;
        try {
            decoded = CborMappers.mapper().readValue(payload, Object.class);
        } catch (IOException e) {
            throw new SerializationException("Failed to decode CBOR data: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Some malformed inputs surface as unchecked parser errors
            throw new SerializationException("Failed to decode CBOR data: " + e, e);
        }

        // The CBOR parser reports every map key as a field name, so keys are always text
        if (!(decoded instanceof Map<?, ?> map)) {
            throw new SerializationException("Failed to decode CBOR data: CBOR data must be a mapping");
        }
        return (Map<String, Object>) map;
    }
}

package com.questrail.cpor.protocol.codec.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

/**
 * Shared Jackson CBOR mapper.
 *
 * <p>{@link CBORMapper} is thread-safe once configured, so one instance
 * serves every encoder and decoder. Trailing bytes after the top-level item
 * are rejected.</p>
 */
final class CborMappers
{
    private static final CBORMapper MAPPER = CBORMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private CborMappers() {}

    static CBORMapper mapper() {
        return MAPPER;
    }
}

/**
 * CPOR Codec
 * =============================================================================
 *
 * <p>Conversion between {@link com.questrail.cpor.protocol.model.CporMessage}
 * instances and their wire payloads.</p>
 *
 * <h2>Wire form</h2>
 * <p>A payload is one CBOR map with text keys. The base fields {@code version},
 * {@code message_id} and {@code timestamp} come first, then the {@code type}
 * discriminant, then the variant fields in declaration order. Unset optional
 * fields are omitted rather than written as null. Binary fields are CBOR byte
 * strings.</p>
 *
 * <h2>Placement</h2>
 * <pre>
 *   byte[] payload
 *        → CporMessageDecoder     (CBOR, size limit, kind resolution)
 *            → CporMessage        (validated by construction)
 * </pre>
 *
 * <p>Framing on a byte stream is not part of this layer; see
 * {@code com.questrail.cpor.transport.netty}.</p>
 */
package com.questrail.cpor.protocol.codec;

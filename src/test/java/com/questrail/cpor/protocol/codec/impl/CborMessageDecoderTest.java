package com.questrail.cpor.protocol.codec.impl;

import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.questrail.cpor.config.CodecConfig;
import com.questrail.cpor.protocol.CporProtocolException;
import com.questrail.cpor.protocol.SampleMessages;
import com.questrail.cpor.protocol.codec.KindResolution;
import com.questrail.cpor.protocol.codec.SerializationException;
import com.questrail.cpor.protocol.model.AckMessage;
import com.questrail.cpor.protocol.model.ConnectRequest;
import com.questrail.cpor.protocol.model.CporMessage;
import com.questrail.cpor.protocol.model.GenericMessage;
import com.questrail.cpor.protocol.model.HeartbeatMessage;
import com.questrail.cpor.protocol.model.InvalidMessageException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decode-path behaviour of {@link CborMessageDecoder}: classification of
 * failures, kind resolution and the size limit.
 */
final class CborMessageDecoderTest
{
    private final CBORMapper cbor = new CBORMapper();
    private final CborMessageEncoder encoder = new CborMessageEncoder();
    private final CborMessageDecoder decoder = new CborMessageDecoder();

    private byte[] cbor(Object value) throws Exception
    {
        return cbor.writeValueAsBytes(value);
    }

    @Test
    void randomBytesFailWithProtocolExceptionOnly()
    {
        Random random = new Random(20240601L);
        for (int i = 0; i < 500; i++) {
            byte[] junk = new byte[1 + random.nextInt(64)];
            random.nextBytes(junk);
            try {
                decoder.parse(junk);
            } catch (CporProtocolException expected) {
                // SerializationException or InvalidMessageException are both acceptable here
                assertNotNull(expected.getMessage());
            }
        }
    }

    @Test
    void emptyInputIsSerializationFailure()
    {
        assertThrows(SerializationException.class, () -> decoder.parse(new byte[0]));
    }

    @Test
    void cborListIsRejectedAsNotAMapping() throws Exception
    {
        SerializationException e = assertThrows(SerializationException.class,
                () -> decoder.parse(cbor(List.of(1, 2, 3))));
        assertTrue(e.getMessage().contains("must be a mapping"));
    }

    @Test
    void cborScalarIsRejectedAsNotAMapping() throws Exception
    {
        assertThrows(SerializationException.class, () -> decoder.parse(cbor("hello")));
    }

    @Test
    void trailingBytesAreRejected()
    {
        byte[] valid = encoder.encode(SampleMessages.heartbeatMessage());
        byte[] padded = new byte[valid.length + 1];
        System.arraycopy(valid, 0, padded, 0, valid.length);

        assertThrows(SerializationException.class, () -> decoder.parse(padded));
    }

    @Test
    void unknownDiscriminantIsInvalidMessage() throws Exception
    {
        InvalidMessageException e = assertThrows(InvalidMessageException.class,
                () -> decoder.parse(cbor(Map.of("version", "CPOR-2", "type", "teleport"))));
        assertTrue(e.getMessage().startsWith("Unknown message type"));
    }

    @Test
    void unrecognisedMapWithoutDiscriminantIsInvalidMessage() throws Exception
    {
        assertThrows(InvalidMessageException.class, () -> decoder.parse(cbor(Map.of("foo", 1))));
    }

    @Test
    void missingDiscriminantIsRejectedByDefault() throws Exception
    {
        Map<String, Object> legacy = new LinkedHashMap<>();
        legacy.put("heartbeat_id", "hb");
        legacy.put("client_sequence", 1);
        legacy.put("server_sequence", 2);

        assertThrows(InvalidMessageException.class, () -> decoder.parse(cbor(legacy)));
    }

    @Test
    void legacyResolutionClassifiesByStructure() throws Exception
    {
        CborMessageDecoder legacyDecoder = new CborMessageDecoder(
                new CodecConfig(CodecConfig.DEFAULT_MAX_MESSAGE_SIZE, KindResolution.LEGACY_STRUCTURAL));

        Map<String, Object> legacy = new LinkedHashMap<>();
        legacy.put("heartbeat_id", "hb");
        legacy.put("client_sequence", 1);
        legacy.put("server_sequence", 2);

        CporMessage decoded = legacyDecoder.parse(cbor(legacy));
        HeartbeatMessage heartbeat = assertInstanceOf(HeartbeatMessage.class, decoded);
        assertEquals("hb", heartbeat.heartbeatId());
        assertTrue(heartbeat.requiresResponse());
    }

    @Test
    void legacyResolutionStillHonoursDiscriminant() throws Exception
    {
        CborMessageDecoder legacyDecoder = new CborMessageDecoder(
                new CodecConfig(CodecConfig.DEFAULT_MAX_MESSAGE_SIZE, KindResolution.LEGACY_STRUCTURAL));

        // Would structurally look like an ack, but the discriminant says generic
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "generic");
        fields.put("ack_sequence", 3);
        fields.put("sequence_number", 9);
        fields.put("payload", new byte[] { 1 });

        assertInstanceOf(GenericMessage.class, legacyDecoder.parse(cbor(fields)));
    }

    @Test
    void typedDecodeRejectsOtherDiscriminant()
    {
        byte[] heartbeat = encoder.encode(SampleMessages.heartbeatMessage());

        InvalidMessageException e = assertThrows(InvalidMessageException.class,
                () -> decoder.decode(heartbeat, AckMessage.class));
        assertEquals("type must be 'ack'", e.getMessage());
    }

    @Test
    void unknownFieldsAreIgnored() throws Exception
    {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("version", "CPOR-2");
        fields.put("type", "ack");
        fields.put("ack_sequence", 5);
        fields.put("flavour", "vanilla");

        AckMessage ack = assertInstanceOf(AckMessage.class, decoder.parse(cbor(fields)));
        assertEquals(5, ack.ackSequence());
    }

    @Test
    void absentRequiredFieldsFailValidation() throws Exception
    {
        InvalidMessageException e = assertThrows(InvalidMessageException.class,
                () -> decoder.parse(cbor(Map.of("type", "connect_request"))));
        assertEquals("client_id must be a non-empty string", e.getMessage());
    }

    @Test
    void wrongWireTypeIsInvalidMessage() throws Exception
    {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "ack");
        fields.put("ack_sequence", "five");

        assertThrows(InvalidMessageException.class, () -> decoder.parse(cbor(fields)));
    }

    @Test
    void wrongVersionIsInvalidMessage() throws Exception
    {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("version", "CPOR-1");
        fields.put("type", "ack");
        fields.put("ack_sequence", 1);

        InvalidMessageException e = assertThrows(InvalidMessageException.class,
                () -> decoder.parse(cbor(fields)));
        assertEquals("Invalid protocol version: CPOR-1", e.getMessage());
    }

    @Test
    void bogusAckTypeOnTheWireIsInvalidMessage() throws Exception
    {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "ack");
        fields.put("ack_sequence", 5);
        fields.put("ack_type", "bogus");

        InvalidMessageException e = assertThrows(InvalidMessageException.class,
                () -> decoder.parse(cbor(fields)));
        assertEquals("ack_type must be one of: message, heartbeat, batch", e.getMessage());
    }

    @Test
    void invalidKeyStorageOnTheWireIsInvalidMessage()
    {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "connect_request");
        fields.put("client_id", "c1");
        fields.put("client_pubkey", SampleMessages.filled(1, 32));
        fields.put("nonce", SampleMessages.filled(2, 16));
        fields.put("key_storage", "hsm");

        InvalidMessageException e = assertThrows(InvalidMessageException.class,
                () -> decoder.parse(cbor.writeValueAsBytes(fields)));
        assertEquals("key_storage must be 'tpm' or 'software'", e.getMessage());
    }

    @Test
    void oversizedPayloadIsRejectedBeforeDecoding()
    {
        CborMessageDecoder small = new CborMessageDecoder(new CodecConfig(16, KindResolution.DISCRIMINANT_REQUIRED));
        byte[] encoded = encoder.encode(SampleMessages.connectRequest());

        SerializationException e = assertThrows(SerializationException.class, () -> small.parse(encoded));
        assertTrue(e.getMessage().contains("exceeds maximum size"));
    }

    @Test
    void explicitNullsTakeDefaults() throws Exception
    {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "connect_request");
        fields.put("message_id", null);
        fields.put("client_id", "c1");
        fields.put("client_pubkey", SampleMessages.filled(1, 32));
        fields.put("nonce", SampleMessages.filled(2, 16));
        fields.put("capabilities", null);
        fields.put("key_storage", null);

        ConnectRequest request = assertInstanceOf(ConnectRequest.class, decoder.parse(cbor(fields)));
        assertNull(request.header().messageId());
        assertEquals(List.of(), request.capabilities());
        assertNull(request.keyStorage());
    }
}

package com.questrail.cpor.protocol.codec.impl;

import com.questrail.cpor.protocol.SampleMessages;
import com.questrail.cpor.protocol.model.AckMessage;
import com.questrail.cpor.protocol.model.AckType;
import com.questrail.cpor.protocol.model.Bytes;
import com.questrail.cpor.protocol.model.CloseMessage;
import com.questrail.cpor.protocol.model.ConnectRequest;
import com.questrail.cpor.protocol.model.ConnectResponse;
import com.questrail.cpor.protocol.model.CporMessage;
import com.questrail.cpor.protocol.model.ErrorMessage;
import com.questrail.cpor.protocol.model.MessageHeader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Semantic round trips through the CBOR codec:
 *   CporMessage -> bytes -> CporMessage
 */
final class CborMessageCodecRoundTripTest
{
    private final CborMessageEncoder encoder = new CborMessageEncoder();
    private final CborMessageDecoder decoder = new CborMessageDecoder();

    @Test
    void everyKindSurvivesParse()
    {
        for (CporMessage original : SampleMessages.oneOfEach()) {
            CporMessage decoded = decoder.parse(encoder.encode(original));

            assertEquals(original, decoded, "round trip of " + original.kind());
            assertEquals(original.kind(), decoded.kind());
        }
    }

    @Test
    void everyKindSurvivesTypedDecode()
    {
        for (CporMessage original : SampleMessages.oneOfEach()) {
            CporMessage decoded = decoder.decode(encoder.encode(original), original.getClass());
            assertEquals(original, decoded);
        }
    }

    @Test
    void connectRequestFieldsMatchOriginals()
    {
        ConnectRequest original = ConnectRequest.builder()
                .clientId("c1")
                .clientPubkey(SampleMessages.filled(0x01, 32))
                .nonce(SampleMessages.filled(0x02, 16))
                .capabilities(List.of("resume"))
                .build();

        ConnectRequest decoded = decoder.decode(encoder.encode(original), ConnectRequest.class);

        assertEquals("c1", decoded.clientId());
        assertEquals(Bytes.repeat(0x01, 32), decoded.clientPubkey());
        assertEquals(Bytes.repeat(0x02, 16), decoded.nonce());
        assertEquals(List.of("resume"), decoded.capabilities());
        assertEquals(0, decoded.resumeSequence());
        assertFalse(decoded.registrationFlag());
        assertEquals("CPOR-2", decoded.protocolVersion());
        assertNull(decoded.keyStorage());
        assertEquals(MessageHeader.DEFAULT, decoded.header());
    }

    @Test
    void unsetOptionalsStayUnset()
    {
        ConnectResponse response = ConnectResponse.builder()
                .sessionId("s1")
                .serverPubkey(SampleMessages.filled(0x03, 32))
                .build();
        CloseMessage close = CloseMessage.of("bye", null, false);
        AckMessage ack = AckMessage.of(0, AckType.MESSAGE);
        ErrorMessage error = ErrorMessage.builder().errorMessage("oops").build();

        ConnectResponse decodedResponse = decoder.decode(encoder.encode(response), ConnectResponse.class);
        assertNull(decodedResponse.errorMessage());
        assertNull(decodedResponse.ephemeralPubkey());

        assertNull(decoder.decode(encoder.encode(close), CloseMessage.class).finalSequence());
        assertNull(decoder.decode(encoder.encode(ack), AckMessage.class).errorCode());
        assertNull(decoder.decode(encoder.encode(error), ErrorMessage.class).details());
    }

    @Test
    void encodingIsDeterministic()
    {
        for (CporMessage message : SampleMessages.oneOfEach()) {
            assertArrayEquals(encoder.encode(message), encoder.encode(message));
        }
    }

    @Test
    void largeSequenceNumbersRoundTrip()
    {
        AckMessage ack = AckMessage.of(Long.MAX_VALUE, AckType.HEARTBEAT);
        assertEquals(ack, decoder.parse(encoder.encode(ack)));
    }
}

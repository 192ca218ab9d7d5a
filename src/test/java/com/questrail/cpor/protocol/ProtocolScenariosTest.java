package com.questrail.cpor.protocol;

import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.questrail.cpor.crypto.CryptoManager;
import com.questrail.cpor.crypto.KeyPair;
import com.questrail.cpor.protocol.codec.impl.CborMessageDecoder;
import com.questrail.cpor.protocol.codec.impl.CborMessageEncoder;
import com.questrail.cpor.protocol.codec.KindResolution;
import com.questrail.cpor.protocol.internal.fields.MessageFieldDecoder;
import com.questrail.cpor.protocol.model.BatchMessage;
import com.questrail.cpor.protocol.model.Bytes;
import com.questrail.cpor.protocol.model.ConnectRequest;
import com.questrail.cpor.protocol.model.CporMessage;
import com.questrail.cpor.protocol.model.InvalidMessageException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behaviour through the public entry points.
 */
final class ProtocolScenariosTest
{
    @Test
    void connectRequestRoundTripsThroughCbor()
    {
        ConnectRequest original = ConnectRequest.builder()
                .clientId("c1")
                .clientPubkey(SampleMessages.filled(0x01, 32))
                .nonce(SampleMessages.filled(0x02, 16))
                .capabilities(List.of("resume"))
                .build();

        CporMessage decoded = new CborMessageDecoder().parse(new CborMessageEncoder().encode(original));

        ConnectRequest request = assertInstanceOf(ConnectRequest.class, decoded);
        assertEquals(original, request);
        assertEquals("c1", request.clientId());
        assertEquals(Bytes.repeat(0x01, 32), request.clientPubkey());
        assertEquals(Bytes.repeat(0x02, 16), request.nonce());
        assertEquals(List.of("resume"), request.capabilities());
    }

    @Test
    void softwareKeySignatureChecksContent()
    {
        CryptoManager crypto = new CryptoManager();
        KeyPair k1 = crypto.generateKeypair("k1");

        byte[] signature = crypto.signData("k1", "hello".getBytes(StandardCharsets.UTF_8));

        assertTrue(crypto.verifySignature(k1.publicKeyBytes(), "hello".getBytes(StandardCharsets.UTF_8), signature));
        assertFalse(crypto.verifySignature(k1.publicKeyBytes(), "hellx".getBytes(StandardCharsets.UTF_8), signature));
    }

    @Test
    void oversubscribedBatchIsRejected()
    {
        assertThrows(InvalidMessageException.class,
                () -> BatchMessage.of(List.<Map<String, Object>>of(Map.of(), Map.of(), Map.of()), "b1", 2));
    }

    @Test
    void bogusAckTypeIsRejected() throws Exception
    {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "ack");
        fields.put("ack_sequence", 5);
        fields.put("ack_type", "bogus");

        InvalidMessageException fromFields = assertThrows(InvalidMessageException.class,
                () -> MessageFieldDecoder.fromFields(fields, KindResolution.DISCRIMINANT_REQUIRED));
        assertTrue(fromFields.getMessage().startsWith("ack_type must be one of"));

        byte[] wire = new CBORMapper().writeValueAsBytes(fields);
        InvalidMessageException fromWire = assertThrows(InvalidMessageException.class,
                () -> new CborMessageDecoder().parse(wire));
        assertEquals(fromFields.getMessage(), fromWire.getMessage());
    }
}

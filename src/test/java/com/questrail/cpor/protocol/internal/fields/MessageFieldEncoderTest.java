package com.questrail.cpor.protocol.internal.fields;

import com.questrail.cpor.protocol.SampleMessages;
import com.questrail.cpor.protocol.codec.KindResolution;
import com.questrail.cpor.protocol.model.AckMessage;
import com.questrail.cpor.protocol.model.AckType;
import com.questrail.cpor.protocol.model.CloseMessage;
import com.questrail.cpor.protocol.model.CporMessage;
import com.questrail.cpor.protocol.model.MessageHeader;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Canonical field maps: order, omission of unset optionals and wire value
 * types.
 */
final class MessageFieldEncoderTest
{
    @Test
    void baseFieldsAndDiscriminantComeFirst()
    {
        Map<String, Object> fields = MessageFieldEncoder.toFields(SampleMessages.connectRequest());

        assertEquals(List.of(
                "version", "message_id", "timestamp", "type",
                "client_id", "client_pubkey", "resume_sequence", "nonce",
                "registration_flag", "protocol_version", "capabilities", "key_storage"),
                new ArrayList<>(fields.keySet()));
        assertEquals("connect_request", fields.get("type"));
        assertEquals("tpm", fields.get("key_storage"));
        assertEquals(1_700_000_000L, fields.get("timestamp"));
    }

    @Test
    void unsetOptionalsAreOmitted()
    {
        Map<String, Object> close = MessageFieldEncoder.toFields(CloseMessage.of("bye", null, true));
        assertEquals(List.of("version", "type", "reason", "graceful"), new ArrayList<>(close.keySet()));

        Map<String, Object> ack = MessageFieldEncoder.toFields(AckMessage.of(1, AckType.MESSAGE));
        assertFalse(ack.containsKey("error_code"));
        assertFalse(ack.containsKey("message_id"));
        assertEquals("message", ack.get("ack_type"));
    }

    @Test
    void binaryFieldsAreByteArrays()
    {
        Map<String, Object> fields = MessageFieldEncoder.toFields(SampleMessages.genericMessage());

        assertArrayEquals(new byte[] { 0x00, 0x7F, (byte) 0xFF }, (byte[]) fields.get("payload"));
        assertEquals(42L, fields.get("sequence_number"));
    }

    @Test
    void nestedBatchBinaryIsByteArray()
    {
        Map<String, Object> fields = MessageFieldEncoder.toFields(SampleMessages.batchMessage());

        List<?> messages = (List<?>) fields.get("messages");
        Map<?, ?> first = (Map<?, ?>) messages.get(0);
        assertArrayEquals(new byte[] { 1, 2 }, (byte[]) first.get("payload"));
    }

    @Test
    void fieldMapIsUnmodifiable()
    {
        Map<String, Object> fields = MessageFieldEncoder.toFields(SampleMessages.heartbeatMessage());
        assertThrows(UnsupportedOperationException.class, () -> fields.put("x", 1));
    }

    @Test
    void fieldsRoundTripWithoutCbor()
    {
        for (CporMessage message : SampleMessages.oneOfEach()) {
            Map<String, Object> fields = MessageFieldEncoder.toFields(message);
            assertEquals(message, MessageFieldDecoder.fromFields(fields, KindResolution.DISCRIMINANT_REQUIRED));
        }
    }

    @Test
    void headerDefaultsWhenVersionAbsent()
    {
        CporMessage decoded = MessageFieldDecoder.fromFields(
                Map.of("type", "ack", "ack_sequence", 3L), KindResolution.DISCRIMINANT_REQUIRED);
        assertEquals(MessageHeader.DEFAULT, decoded.header());
    }
}

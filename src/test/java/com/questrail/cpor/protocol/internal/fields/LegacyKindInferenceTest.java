package com.questrail.cpor.protocol.internal.fields;

import com.questrail.cpor.protocol.model.InvalidMessageException;
import com.questrail.cpor.protocol.model.MessageKind;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural classification, including the precedence between overlapping
 * predicates.
 */
final class LegacyKindInferenceTest
{
    private static Map<String, Object> keys(String... names)
    {
        Map<String, Object> out = new HashMap<>();
        for (String name : names) {
            out.put(name, 1);
        }
        return out;
    }

    @Test
    void eachPredicateInIsolation()
    {
        assertEquals(MessageKind.CONNECT_REQUEST, LegacyKindInference.infer(keys("client_id", "client_pubkey")));
        assertEquals(MessageKind.CONNECT_REQUEST, LegacyKindInference.infer(keys("client_id", "public_key")));
        assertEquals(MessageKind.CONNECT_RESPONSE,
                LegacyKindInference.infer(keys("session_id", "accepted", "server_public_key")));
        assertEquals(MessageKind.GENERIC, LegacyKindInference.infer(keys("sequence_counter", "payload")));
        assertEquals(MessageKind.RESUME_REQUEST,
                LegacyKindInference.infer(keys("last_received_sequence", "client_nonce")));
        assertEquals(MessageKind.RESUME_RESPONSE, LegacyKindInference.infer(keys("status_code", "server_nonce")));
        assertEquals(MessageKind.BATCH, LegacyKindInference.infer(keys("messages", "batch_id")));
        assertEquals(MessageKind.HEARTBEAT, LegacyKindInference.infer(keys("heartbeat_id")));
        assertEquals(MessageKind.HEARTBEAT, LegacyKindInference.infer(keys("timestamp")));
        assertEquals(MessageKind.CLOSE, LegacyKindInference.infer(keys("reason", "final_sequence")));
        assertEquals(MessageKind.ACK, LegacyKindInference.infer(keys("ack_counter")));
        assertEquals(MessageKind.ERROR, LegacyKindInference.infer(keys("error_code", "message")));
    }

    @Test
    void connectRequestWinsOverResumeRequest()
    {
        assertEquals(MessageKind.CONNECT_REQUEST, LegacyKindInference.infer(
                keys("client_id", "client_pubkey", "last_sequence_number", "client_nonce")));
    }

    @Test
    void resumeResponseWinsOverErrorWhenStatusAndSequencePresent()
    {
        assertEquals(MessageKind.RESUME_RESPONSE, LegacyKindInference.infer(
                keys("status_code", "resume_sequence", "error_code", "error_message")));
    }

    @Test
    void timestampMakesAnyLaterKindLookLikeHeartbeat()
    {
        assertEquals(MessageKind.HEARTBEAT, LegacyKindInference.infer(keys("timestamp", "reason", "graceful")));
        assertEquals(MessageKind.HEARTBEAT, LegacyKindInference.infer(keys("timestamp", "ack_sequence")));
        assertEquals(MessageKind.ACK, LegacyKindInference.infer(keys("ack_sequence")));
    }

    @Test
    void closeWinsOverAck()
    {
        assertEquals(MessageKind.CLOSE, LegacyKindInference.infer(keys("reason", "graceful", "ack_sequence")));
    }

    @Test
    void partialMatchesFallThrough()
    {
        // connect response without pubkey, generic without payload
        assertThrows(InvalidMessageException.class,
                () -> LegacyKindInference.infer(keys("session_id", "accepted", "sequence_number")));
    }

    @Test
    void noMatchListsKeys()
    {
        InvalidMessageException e = assertThrows(InvalidMessageException.class,
                () -> LegacyKindInference.infer(Map.of("foo", 1)));
        assertEquals("Cannot determine message type from data: [foo]", e.getMessage());
    }
}

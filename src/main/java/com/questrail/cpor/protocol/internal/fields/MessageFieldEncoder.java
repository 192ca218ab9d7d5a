package com.questrail.cpor.protocol.internal.fields;

import com.questrail.cpor.protocol.model.AckMessage;
import com.questrail.cpor.protocol.model.BatchMessage;
import com.questrail.cpor.protocol.model.Bytes;
import com.questrail.cpor.protocol.model.CloseMessage;
import com.questrail.cpor.protocol.model.ConnectRequest;
import com.questrail.cpor.protocol.model.ConnectResponse;
import com.questrail.cpor.protocol.model.CporMessage;
import com.questrail.cpor.protocol.model.ErrorMessage;
import com.questrail.cpor.protocol.model.GenericMessage;
import com.questrail.cpor.protocol.model.HeartbeatMessage;
import com.questrail.cpor.protocol.model.MessageHeader;
import com.questrail.cpor.protocol.model.ResumeRequest;
import com.questrail.cpor.protocol.model.ResumeResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MessageFieldEncoder
 * ============================================================================
 * Produces the canonical field map of a message.
 *
 * <p>The map is what gets written to the wire, so its iteration order is the
 * wire order and is part of the signing contract:</p>
 * <ol>
 *   <li>{@code version}, {@code message_id}, {@code timestamp}</li>
 *   <li>{@code type}</li>
 *   <li>variant fields in record declaration order</li>
 * </ol>
 *
 * <p>Unset optional fields are omitted. Binary values are {@code byte[]},
 * integers {@link Long}, enumerations their wire names.</p>
 */
public final class MessageFieldEncoder
{
    private MessageFieldEncoder() {}

    /**
     * @return an unmodifiable, insertion-ordered map of wire field names to
     *         wire values
     */
    public static Map<String, Object> toFields(CporMessage message) {
        Objects.requireNonNull(message, "message");

        Fields out = new Fields();
        MessageHeader header = message.header();
        out.put("version", header.version());
        out.putIfSet("message_id", header.messageId());
        out.putIfSet("timestamp", header.timestamp());
        out.put("type", message.kind().discriminant());

        if (message instanceof ConnectRequest m) {
            out.put("client_id", m.clientId());
            out.put("client_pubkey", m.clientPubkey());
            out.put("resume_sequence", m.resumeSequence());
            out.put("nonce", m.nonce());
            out.put("registration_flag", m.registrationFlag());
            out.put("protocol_version", m.protocolVersion());
            out.put("capabilities", m.capabilities());
            out.putIfSet("key_storage", m.keyStorage() == null ? null : m.keyStorage().wireName());
        } else if (message instanceof ConnectResponse m) {
            out.put("session_id", m.sessionId());
            out.put("server_pubkey", m.serverPubkey());
            out.put("accepted", m.accepted());
            out.put("resume_sequence", m.resumeSequence());
            out.put("status_code", m.statusCode());
            out.putIfSet("error_message", m.errorMessage());
            out.put("server_capabilities", m.serverCapabilities());
            out.put("max_message_size", m.maxMessageSize());
            out.putIfSet("ephemeral_pubkey", m.ephemeralPubkey());
        } else if (message instanceof GenericMessage m) {
            out.put("sequence_number", m.sequenceNumber());
            out.put("payload", m.payload());
            out.put("message_type", m.messageType());
            out.put("priority", m.priority());
            out.put("requires_ack", m.requiresAck());
        } else if (message instanceof ResumeRequest m) {
            out.put("client_id", m.clientId());
            out.put("last_sequence_number", m.lastSequenceNumber());
            out.put("client_nonce", m.clientNonce());
        } else if (message instanceof ResumeResponse m) {
            out.put("status_code", m.statusCode());
            out.put("resume_sequence", m.resumeSequence());
            out.putIfSet("error_message", m.errorMessage());
            out.put("session_id", m.sessionId());
            out.put("resume_accepted", m.resumeAccepted());
            out.put("server_nonce", m.serverNonce());
        } else if (message instanceof BatchMessage m) {
            out.put("messages", m.messages());
            out.put("batch_id", m.batchId());
            out.put("total_count", m.totalCount());
        } else if (message instanceof HeartbeatMessage m) {
            out.put("heartbeat_id", m.heartbeatId());
            out.put("client_sequence", m.clientSequence());
            out.put("server_sequence", m.serverSequence());
            out.put("requires_response", m.requiresResponse());
        } else if (message instanceof CloseMessage m) {
            out.put("reason", m.reason());
            out.putIfSet("final_sequence", m.finalSequence());
            out.put("graceful", m.graceful());
        } else if (message instanceof AckMessage m) {
            out.put("ack_sequence", m.ackSequence());
            out.put("ack_type", m.ackType().wireName());
            out.putIfSet("error_code", m.errorCode());
        } else if (message instanceof ErrorMessage m) {
            out.put("error_code", m.errorCode());
            out.put("error_message", m.errorMessage());
            out.put("severity", m.severity().wireName());
            out.put("recoverable", m.recoverable());
            out.putIfSet("details", m.details());
        } else {
            throw new IllegalStateException("Unhandled message type: " + message.getClass().getName());
        }

        return Collections.unmodifiableMap(out.map);
    }

    private static Object toWire(Object value) {
        if (value instanceof Bytes b) {
            return b.toByteArray();
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(toWire(item));
            }
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(e.getKey(), toWire(e.getValue()));
            }
            return out;
        }
        return value;
    }

    private static final class Fields
    {
        private final Map<String, Object> map = new LinkedHashMap<>();

        void put(String name, Object value) {
            map.put(name, toWire(value));
        }

        void putIfSet(String name, Object value) {
            if (value != null) {
                put(name, value);
            }
        }
    }
}

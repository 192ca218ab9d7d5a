package com.questrail.cpor.protocol.internal.fields;

import com.questrail.cpor.protocol.model.InvalidMessageException;
import com.questrail.cpor.protocol.model.MessageKind;

import java.util.ArrayList;
import java.util.Map;

/**
 * Classifies a field map that carries no {@code type} discriminant by which
 * keys it contains.
 *
 * <p>Predicates are evaluated in this exact order and the first match wins:</p>
 * <ol>
 *   <li>{@code client_id} and ({@code client_pubkey} or {@code public_key}) → connect request</li>
 *   <li>{@code session_id}, {@code accepted} and ({@code server_pubkey} or
 *       {@code server_public_key}) → connect response</li>
 *   <li>({@code sequence_number} or {@code sequence_counter}) and {@code payload} → generic</li>
 *   <li>({@code last_sequence_number} or {@code last_received_sequence}) and
 *       {@code client_nonce} → resume request</li>
 *   <li>({@code resume_accepted} or {@code status_code}) and ({@code server_nonce} or
 *       {@code resume_sequence}) → resume response</li>
 *   <li>{@code messages} and {@code batch_id} → batch</li>
 *   <li>{@code heartbeat_id}, or {@code timestamp} without {@code type} → heartbeat</li>
 *   <li>{@code reason} and ({@code graceful} or {@code final_sequence}) → close</li>
 *   <li>{@code ack_sequence} or {@code ack_counter} → ack</li>
 *   <li>{@code error_code} and ({@code error_message} or {@code message}) → error</li>
 * </ol>
 *
 * <p>Alias keys ({@code public_key}, {@code sequence_counter}, ...) only take
 * part in classification. Field values are always read from the canonical
 * names.</p>
 */
final class LegacyKindInference
{
    private LegacyKindInference() {}

    static MessageKind infer(Map<String, ?> data) {
        if (has(data, "client_id") && (has(data, "client_pubkey") || has(data, "public_key"))) {
            return MessageKind.CONNECT_REQUEST;
        }
        if (has(data, "session_id") && has(data, "accepted")
                && (has(data, "server_pubkey") || has(data, "server_public_key"))) {
            return MessageKind.CONNECT_RESPONSE;
        }
        if ((has(data, "sequence_number") || has(data, "sequence_counter")) && has(data, "payload")) {
            return MessageKind.GENERIC;
        }
        if ((has(data, "last_sequence_number") || has(data, "last_received_sequence"))
                && has(data, "client_nonce")) {
            return MessageKind.RESUME_REQUEST;
        }
        if ((has(data, "resume_accepted") || has(data, "status_code"))
                && (has(data, "server_nonce") || has(data, "resume_sequence"))) {
            return MessageKind.RESUME_RESPONSE;
        }
        if (has(data, "messages") && has(data, "batch_id")) {
            return MessageKind.BATCH;
        }
        if (has(data, "heartbeat_id") || (has(data, "timestamp") && !has(data, "type"))) {
            return MessageKind.HEARTBEAT;
        }
        if (has(data, "reason") && (has(data, "graceful") || has(data, "final_sequence"))) {
            return MessageKind.CLOSE;
        }
        if (has(data, "ack_sequence") || has(data, "ack_counter")) {
            return MessageKind.ACK;
        }
        if (has(data, "error_code") && (has(data, "error_message") || has(data, "message"))) {
            return MessageKind.ERROR;
        }
        throw new InvalidMessageException(
                "Cannot determine message type from data: " + new ArrayList<>(data.keySet()));
    }

    private static boolean has(Map<String, ?> data, String key) {
        return data.containsKey(key);
    }
}

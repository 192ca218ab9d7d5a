package com.questrail.cpor.protocol.internal.fields;

import com.questrail.cpor.crypto.KeyStorageKind;
import com.questrail.cpor.protocol.codec.KindResolution;
import com.questrail.cpor.protocol.model.AckMessage;
import com.questrail.cpor.protocol.model.AckType;
import com.questrail.cpor.protocol.model.BatchMessage;
import com.questrail.cpor.protocol.model.Bytes;
import com.questrail.cpor.protocol.model.CloseMessage;
import com.questrail.cpor.protocol.model.ConnectRequest;
import com.questrail.cpor.protocol.model.ConnectResponse;
import com.questrail.cpor.protocol.model.CporMessage;
import com.questrail.cpor.protocol.model.ErrorMessage;
import com.questrail.cpor.protocol.model.GenericMessage;
import com.questrail.cpor.protocol.model.HeartbeatMessage;
import com.questrail.cpor.protocol.model.InvalidMessageException;
import com.questrail.cpor.protocol.model.MessageHeader;
import com.questrail.cpor.protocol.model.MessageKind;
import com.questrail.cpor.protocol.model.ResumeRequest;
import com.questrail.cpor.protocol.model.ResumeResponse;
import com.questrail.cpor.protocol.model.Severity;

import java.util.Map;
import java.util.Objects;

/**
 * MessageFieldDecoder
 * ============================================================================
 * Builds a typed message from a decoded field map.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Unknown keys are ignored.</li>
 *   <li>Absent keys (and explicit nulls) take the field's default; the message
 *       constructor then rejects defaults that are not valid.</li>
 *   <li>Values of the wrong wire type fail with
 *       {@link InvalidMessageException}.</li>
 * </ul>
 *
 * <p>This class never produces a partially valid message: every path ends in
 * a record constructor.</p>
 */
public final class MessageFieldDecoder
{
    private MessageFieldDecoder() {}

    /**
     * Decodes a map whose kind is determined by its discriminant or, when
     * {@code resolution} allows, by its structure.
     */
    public static CporMessage fromFields(Map<String, ?> fields, KindResolution resolution) {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(resolution, "resolution");
        return decodeAs(resolveKind(fields, resolution), new WireFields(fields));
    }

    /**
     * Decodes a map expected to hold a message of {@code type}. A discriminant,
     * if present, must name that kind.
     */
    public static <T extends CporMessage> T fromFields(Map<String, ?> fields, Class<T> type) {
        Objects.requireNonNull(fields, "fields");
        MessageKind kind = MessageKind.forClass(type);
        WireFields wire = new WireFields(fields);
        String discriminant = wire.optionalString("type");
        if (discriminant != null && !discriminant.equals(kind.discriminant())) {
            throw new InvalidMessageException("type must be '" + kind.discriminant() + "'");
        }
        return type.cast(decodeAs(kind, wire));
    }

    /**
     * Determines the kind of {@code fields} without decoding them.
     *
     * @throws InvalidMessageException if the discriminant is unknown, or is
     *         missing and cannot be inferred under {@code resolution}
     */
    public static MessageKind resolveKind(Map<String, ?> fields, KindResolution resolution) {
        Object type = fields.get("type");
        if (type != null) {
            if (!(type instanceof String discriminant)) {
                throw new InvalidMessageException("type must be a string");
            }
            return MessageKind.fromDiscriminant(discriminant)
                    .orElseThrow(() -> new InvalidMessageException("Unknown message type: " + discriminant));
        }
        if (resolution == KindResolution.LEGACY_STRUCTURAL) {
            return LegacyKindInference.infer(fields);
        }
        throw new InvalidMessageException("Message has no type discriminant");
    }

    private static CporMessage decodeAs(MessageKind kind, WireFields f) {
        MessageHeader header = new MessageHeader(
                f.string("version", MessageHeader.PROTOCOL_VERSION),
                f.optionalString("message_id"),
                f.optionalInteger("timestamp"));

        switch (kind) {
            case CONNECT_REQUEST:
                return new ConnectRequest(
                        header,
                        f.string("client_id", ""),
                        f.bytes("client_pubkey", Bytes.empty()),
                        f.integer("resume_sequence", 0),
                        f.bytes("nonce", Bytes.empty()),
                        f.bool("registration_flag", false),
                        f.string("protocol_version", MessageHeader.PROTOCOL_VERSION),
                        f.stringList("capabilities"),
                        keyStorage(f.optionalString("key_storage")));
            case CONNECT_RESPONSE:
                return new ConnectResponse(
                        header,
                        f.string("session_id", ""),
                        f.bytes("server_pubkey", Bytes.empty()),
                        f.bool("accepted", false),
                        f.integer("resume_sequence", 0),
                        f.integer("status_code", 0),
                        f.optionalString("error_message"),
                        f.stringList("server_capabilities"),
                        f.integer("max_message_size", ConnectResponse.DEFAULT_MAX_MESSAGE_SIZE),
                        f.optionalBytes("ephemeral_pubkey"));
            case GENERIC:
                return new GenericMessage(
                        header,
                        f.integer("sequence_number", 0),
                        f.bytes("payload", Bytes.empty()),
                        f.string("message_type", GenericMessage.DEFAULT_MESSAGE_TYPE),
                        f.integer("priority", 0),
                        f.bool("requires_ack", true));
            case RESUME_REQUEST:
                return new ResumeRequest(
                        header,
                        f.string("client_id", ""),
                        f.integer("last_sequence_number", 0),
                        f.bytes("client_nonce", Bytes.empty()));
            case RESUME_RESPONSE:
                return new ResumeResponse(
                        header,
                        f.integer("status_code", 0),
                        f.integer("resume_sequence", 0),
                        f.optionalString("error_message"),
                        f.string("session_id", ""),
                        f.bool("resume_accepted", false),
                        f.bytes("server_nonce", Bytes.empty()));
            case BATCH:
                return BatchMessage.of(
                        header,
                        f.mapList("messages"),
                        f.string("batch_id", ""),
                        f.integer("total_count", 0));
            case HEARTBEAT:
                return new HeartbeatMessage(
                        header,
                        f.string("heartbeat_id", ""),
                        f.integer("client_sequence", 0),
                        f.integer("server_sequence", 0),
                        f.bool("requires_response", true));
            case CLOSE:
                return new CloseMessage(
                        header,
                        f.string("reason", ""),
                        f.optionalInteger("final_sequence"),
                        f.bool("graceful", true));
            case ACK:
                return new AckMessage(
                        header,
                        f.integer("ack_sequence", 0),
                        AckType.fromWireName(f.string("ack_type", AckType.MESSAGE.wireName())),
                        f.optionalInteger("error_code"));
            case ERROR:
                return ErrorMessage.builder()
                        .header(header)
                        .errorCode(f.integer("error_code", 0))
                        .errorMessage(f.string("error_message", ""))
                        .severity(Severity.fromWireName(f.string("severity", Severity.ERROR.wireName())))
                        .recoverable(f.bool("recoverable", true))
                        .details(f.optionalMap("details"))
                        .build();
            default:
                throw new IllegalStateException("Unhandled message kind: " + kind);
        }
    }

    private static KeyStorageKind keyStorage(String wireName) {
        if (wireName == null) {
            return null;
        }
        return KeyStorageKind.fromWireName(wireName)
                .orElseThrow(() -> new InvalidMessageException("key_storage must be 'tpm' or 'software'"));
    }
}

package com.questrail.cpor.protocol.model;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Closed registry of CPOR message kinds, keyed by the {@code type}
 * discriminant carried on the wire.
 *
 * <p>The set is fixed at ten; there is no runtime registration.</p>
 */
public enum MessageKind
{
    CONNECT_REQUEST("connect_request", ConnectRequest.class),
    CONNECT_RESPONSE("connect_response", ConnectResponse.class),
    GENERIC("generic", GenericMessage.class),
    RESUME_REQUEST("resume_request", ResumeRequest.class),
    RESUME_RESPONSE("resume_response", ResumeResponse.class),
    BATCH("batch", BatchMessage.class),
    HEARTBEAT("heartbeat", HeartbeatMessage.class),
    CLOSE("close", CloseMessage.class),
    ACK("ack", AckMessage.class),
    ERROR("error", ErrorMessage.class);

    private static final Map<String, MessageKind> BY_DISCRIMINANT =
            Stream.of(values()).collect(Collectors.toUnmodifiableMap(MessageKind::discriminant, Function.identity()));

    private final String discriminant;
    private final Class<? extends CporMessage> messageClass;

    MessageKind(String discriminant, Class<? extends CporMessage> messageClass) {
        this.discriminant = discriminant;
        this.messageClass = messageClass;
    }

    public String discriminant() {
        return discriminant;
    }

    public Class<? extends CporMessage> messageClass() {
        return messageClass;
    }

    public static Optional<MessageKind> fromDiscriminant(String discriminant) {
        return Optional.ofNullable(BY_DISCRIMINANT.get(discriminant));
    }

    /**
     * @throws IllegalArgumentException if {@code type} is not a message record
     */
    public static MessageKind forClass(Class<? extends CporMessage> type) {
        for (MessageKind kind : values()) {
            if (kind.messageClass.equals(type)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Not a CPOR message type: " + type);
    }
}

package com.questrail.cpor.protocol.model;

import com.questrail.cpor.crypto.KeyStorageKind;

import java.util.List;
import java.util.Objects;

/**
 * Initial connection request, client → server.
 *
 * <p>
 * Presents the client's Ed25519 identity and a fresh nonce. A non-zero
 * {@code resumeSequence} asks the server to continue from that point rather
 * than from zero; {@code registrationFlag} starts the registration flow.
 * </p>
 *
 * <p>Contract:</p>
 * <ul>
 *   <li>{@code client_id} non-empty</li>
 *   <li>{@code client_pubkey} exactly 32 bytes</li>
 *   <li>{@code nonce} at least 16 bytes</li>
 *   <li>{@code resume_sequence} ≥ 0</li>
 *   <li>{@code capabilities} a list</li>
 *   <li>{@code key_storage}, if set, is {@code tpm} or {@code software}</li>
 * </ul>
 *
 * @param keyStorage storage advertised for the client key, may be {@code null}
 */
public record ConnectRequest(
        MessageHeader header,
        String clientId,
        Bytes clientPubkey,
        long resumeSequence,
        Bytes nonce,
        boolean registrationFlag,
        String protocolVersion,
        List<String> capabilities,
        KeyStorageKind keyStorage
) implements CporMessage
{
    public ConnectRequest {
        Objects.requireNonNull(header, "header");
        Checks.nonEmpty(clientId, "client_id");
        Checks.publicKey(clientPubkey, "client_pubkey");
        Checks.nonce(nonce, "nonce");
        Checks.nonNegative(resumeSequence, "resume_sequence");
        Checks.present(protocolVersion, "protocol_version");
        if (capabilities == null) {
            throw new InvalidMessageException("capabilities must be a list");
        }
        if (capabilities.stream().anyMatch(Objects::isNull)) {
            throw new InvalidMessageException("capabilities must contain only strings");
        }
        capabilities = List.copyOf(capabilities);
    }

    @Override
    public MessageKind kind() {
        return MessageKind.CONNECT_REQUEST;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MessageHeader header = MessageHeader.DEFAULT;
        private String clientId;
        private Bytes clientPubkey;
        private long resumeSequence;
        private Bytes nonce;
        private boolean registrationFlag;
        private String protocolVersion = MessageHeader.PROTOCOL_VERSION;
        private List<String> capabilities = List.of();
        private KeyStorageKind keyStorage;

        public Builder header(MessageHeader header) {
            this.header = header;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientPubkey(byte[] clientPubkey) {
            this.clientPubkey = Bytes.of(clientPubkey);
            return this;
        }

        public Builder resumeSequence(long resumeSequence) {
            this.resumeSequence = resumeSequence;
            return this;
        }

        public Builder nonce(byte[] nonce) {
            this.nonce = Bytes.of(nonce);
            return this;
        }

        public Builder registrationFlag(boolean registrationFlag) {
            this.registrationFlag = registrationFlag;
            return this;
        }

        public Builder protocolVersion(String protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder capabilities(List<String> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder keyStorage(KeyStorageKind keyStorage) {
            this.keyStorage = keyStorage;
            return this;
        }

        public ConnectRequest build() {
            return new ConnectRequest(header, clientId, clientPubkey, resumeSequence, nonce,
                    registrationFlag, protocolVersion, capabilities, keyStorage);
        }
    }
}

package com.questrail.cpor.protocol.model;

/**
 * Canonical semantic representation of a CPOR protocol message.
 *
 * <h2>Validity</h2>
 * <p>
 * Every implementation validates its fields in its constructor. An instance
 * that exists is fully valid; there is no partially valid message. Decoding
 * goes through the same constructors, so decoded messages are re-validated by
 * construction.
 * </p>
 *
 * <h2>Immutability</h2>
 * <p>
 * Binary fields are held as {@link Bytes}, collections are unmodifiable
 * copies. Messages may be shared between threads without synchronization.
 * </p>
 *
 * <p>
 * Wire concerns (field names, CBOR, omission of unset fields) are handled by
 * the codec layer, not here.
 * </p>
 */
public sealed interface CporMessage
        permits ConnectRequest,
                ConnectResponse,
                GenericMessage,
                ResumeRequest,
                ResumeResponse,
                BatchMessage,
                HeartbeatMessage,
                CloseMessage,
                AckMessage,
                ErrorMessage
{
    /**
     * @return version, message id and timestamp of this message
     */
    MessageHeader header();

    /**
     * @return the registry entry for this message's type
     */
    MessageKind kind();
}

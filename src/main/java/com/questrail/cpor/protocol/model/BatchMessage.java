package com.questrail.cpor.protocol.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A batch of sub-message payloads.
 *
 * <p>
 * Entries are untyped field maps, not {@link CporMessage} instances; a
 * receiver that wants typed sub-messages decodes each entry itself. A batch may
 * be one of several carrying the same {@code batchId}, so {@code totalCount}
 * bounds the entries here rather than matching them.
 * </p>
 */
public record BatchMessage(
        MessageHeader header,
        List<Map<String, Object>> messages,
        String batchId,
        long totalCount
) implements CporMessage
{
    public BatchMessage {
        Objects.requireNonNull(header, "header");
        messages = UntypedPayloads.freezeMapList(messages, "messages");
        Checks.nonEmpty(batchId, "batch_id");
        if (totalCount <= 0) {
            throw new InvalidMessageException("total_count must be a positive integer");
        }
        if (messages.size() > totalCount) {
            throw new InvalidMessageException("messages count cannot exceed total_count");
        }
    }

    public static BatchMessage of(List<? extends Map<String, ?>> messages, String batchId, long totalCount) {
        return of(MessageHeader.DEFAULT, messages, batchId, totalCount);
    }

    public static BatchMessage of(MessageHeader header,
                                  List<? extends Map<String, ?>> messages,
                                  String batchId,
                                  long totalCount) {
        return new BatchMessage(header, UntypedPayloads.freezeMapList(messages, "messages"), batchId, totalCount);
    }

    @Override
    public MessageKind kind() {
        return MessageKind.BATCH;
    }
}

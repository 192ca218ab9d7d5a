package com.questrail.cpor.protocol.model;

import java.util.Map;
import java.util.Objects;

/**
 * Protocol-level error report.
 *
 * @param details free-form diagnostic map, may be {@code null}
 */
public record ErrorMessage(
        MessageHeader header,
        long errorCode,
        String errorMessage,
        Severity severity,
        boolean recoverable,
        Map<String, Object> details
) implements CporMessage
{
    public ErrorMessage {
        Objects.requireNonNull(header, "header");
        Checks.nonEmpty(errorMessage, "error_message");
        if (severity == null) {
            throw new InvalidMessageException("severity must be one of: warning, error, fatal");
        }
        if (details != null) {
            details = UntypedPayloads.freezeMap(details, "details");
        }
    }

    @Override
    public MessageKind kind() {
        return MessageKind.ERROR;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MessageHeader header = MessageHeader.DEFAULT;
        private long errorCode;
        private String errorMessage;
        private Severity severity = Severity.ERROR;
        private boolean recoverable = true;
        private Map<String, ?> details;

        public Builder header(MessageHeader header) {
            this.header = header;
            return this;
        }

        public Builder errorCode(long errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder recoverable(boolean recoverable) {
            this.recoverable = recoverable;
            return this;
        }

        public Builder details(Map<String, ?> details) {
            this.details = details;
            return this;
        }

        public ErrorMessage build() {
            return new ErrorMessage(header, errorCode, errorMessage, severity, recoverable,
                    details == null ? null : UntypedPayloads.freezeMap(details, "details"));
        }
    }
}

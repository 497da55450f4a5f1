package io.agentrelay.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One unit of agent-to-agent communication.
 *
 * <p>Instances are immutable. {@code createdAtMs == 0} means "not stamped yet" and an empty
 * {@code id} means "not assigned yet"; the bus fills both in when the envelope is sent.
 * {@code expiresAtMs}, {@code inResponseTo} and {@code transactionRef} are nullable.
 */
public record Envelope(
        String id,
        String from,
        String to,
        MessageKind kind,
        String content,
        Map<String, Object> payload,
        long createdAtMs,
        Long expiresAtMs,
        Priority priority,
        String inResponseTo,
        String transactionRef,
        Map<String, Object> metadata
) {
    public Envelope {
        kind = kind == null ? MessageKind.ERROR : kind;
        content = content == null ? "" : content;
        payload = copyOf(payload);
        metadata = copyOf(metadata);
        priority = priority == null ? Priority.NORMAL : priority;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    public boolean isExpiredAt(long nowMs) {
        return expiresAtMs != null && expiresAtMs <= nowMs;
    }

    public Envelope stamped(String assignedId, long assignedCreatedAtMs) {
        return new Envelope(
                assignedId,
                from,
                to,
                kind,
                content,
                payload,
                assignedCreatedAtMs,
                expiresAtMs,
                priority,
                inResponseTo,
                transactionRef,
                metadata
        );
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .from(from)
                .to(to)
                .kind(kind)
                .content(content)
                .payload(payload)
                .createdAtMs(createdAtMs)
                .expiresAtMs(expiresAtMs)
                .priority(priority)
                .inResponseTo(inResponseTo)
                .transactionRef(transactionRef)
                .metadata(metadata);
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static final class Builder {
        private String id;
        private String from;
        private String to;
        private MessageKind kind = MessageKind.PING;
        private String content = "";
        private Map<String, Object> payload = Map.of();
        private long createdAtMs;
        private Long expiresAtMs;
        private Priority priority = Priority.NORMAL;
        private String inResponseTo;
        private String transactionRef;
        private Map<String, Object> metadata = Map.of();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        public Builder to(String to) {
            this.to = to;
            return this;
        }

        public Builder kind(MessageKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder createdAtMs(long createdAtMs) {
            this.createdAtMs = createdAtMs;
            return this;
        }

        public Builder expiresAtMs(Long expiresAtMs) {
            this.expiresAtMs = expiresAtMs;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder inResponseTo(String inResponseTo) {
            this.inResponseTo = inResponseTo;
            return this;
        }

        public Builder transactionRef(String transactionRef) {
            this.transactionRef = transactionRef;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Envelope build() {
            return new Envelope(
                    id,
                    from,
                    to,
                    kind,
                    content,
                    payload,
                    createdAtMs,
                    expiresAtMs,
                    priority,
                    inResponseTo,
                    transactionRef,
                    metadata
            );
        }
    }
}

package io.agentrelay.model;

import java.util.Optional;

/**
 * Delivery priority. Declaration order is the serving order: HIGH first, LOW last.
 */
public enum Priority {
    HIGH("High"),
    NORMAL("Normal"),
    LOW("Low");

    private final String wireName;

    Priority(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        return tryParse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown priority: " + raw));
    }

    public static Optional<Priority> tryParse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(trimmed) || value.wireName.equalsIgnoreCase(trimmed)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}

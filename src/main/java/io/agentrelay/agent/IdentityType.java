package io.agentrelay.agent;

public enum IdentityType {
    AGENT,
    USER,
    SERVICE;

    public static IdentityType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return AGENT;
        }
        for (IdentityType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown identity type: " + raw);
    }
}

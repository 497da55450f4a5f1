package io.agentrelay.agent;

public enum AgentAvailability {
    AVAILABLE("Available"),
    BUSY("Busy"),
    OFFLINE("Offline"),
    MAINTENANCE("Maintenance");

    private final String wireName;

    AgentAvailability(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static AgentAvailability fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return AVAILABLE;
        }
        for (AgentAvailability value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent status: " + raw);
    }
}

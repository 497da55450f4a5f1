package io.agentrelay.reputation;

public record ReputationEntry(
        String agentId,
        long delta,
        String reason,
        String refId,
        long recordedAtMs
) {
}

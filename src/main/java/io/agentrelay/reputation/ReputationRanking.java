package io.agentrelay.reputation;

public record ReputationRanking(
        String agentId,
        long score,
        int rank
) {
}

package io.agentrelay.reputation;

import io.agentrelay.model.BusResult;

import java.util.List;

/**
 * Reputation (karma) collaborator. The bus only ever awards or deducts; scoring policy lives
 * behind this interface.
 */
public interface ReputationService {
    BusResult<Long> award(String agentId, long amount, String reason, String refId);

    BusResult<Long> deduct(String agentId, long amount, String reason, String refId);

    long score(String agentId);

    /**
     * Highest scores first; equal scores ordered by agent id.
     */
    List<ReputationRanking> topAgents(int limit);
}

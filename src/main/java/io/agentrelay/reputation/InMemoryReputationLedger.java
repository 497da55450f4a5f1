package io.agentrelay.reputation;

import io.agentrelay.agent.AgentChecks;
import io.agentrelay.agent.IdentityValidator;
import io.agentrelay.model.BusError;
import io.agentrelay.model.BusResult;
import io.agentrelay.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class InMemoryReputationLedger implements ReputationService {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReputationLedger.class);

    private final IdentityValidator identityValidator;
    private final Clock clock;
    private final Map<String, Long> scores = new HashMap<>();
    private final List<ReputationEntry> history = new ArrayList<>();

    public InMemoryReputationLedger(IdentityValidator identityValidator, Clock clock) {
        this.identityValidator = identityValidator;
        this.clock = clock;
    }

    @Override
    public BusResult<Long> award(String agentId, long amount, String reason, String refId) {
        if (amount < 0) {
            return BusResult.fail(ErrorKind.PROTOCOL_ERROR, "Award amount must be positive: " + amount);
        }
        return apply(agentId, amount, reason, refId);
    }

    @Override
    public BusResult<Long> deduct(String agentId, long amount, String reason, String refId) {
        if (amount < 0) {
            return BusResult.fail(ErrorKind.PROTOCOL_ERROR, "Deduction amount must be positive: " + amount);
        }
        return apply(agentId, -amount, reason, refId);
    }

    @Override
    public synchronized long score(String agentId) {
        return scores.getOrDefault(agentId, 0L);
    }

    @Override
    public synchronized List<ReputationRanking> topAgents(int limit) {
        List<Map.Entry<String, Long>> sorted = new ArrayList<>(scores.entrySet());
        sorted.sort(Comparator.<Map.Entry<String, Long>>comparingLong(Map.Entry::getValue)
                .reversed()
                .thenComparing(Map.Entry::getKey));
        List<ReputationRanking> out = new ArrayList<>();
        int max = Math.max(0, limit);
        for (int i = 0; i < sorted.size() && i < max; i++) {
            Map.Entry<String, Long> entry = sorted.get(i);
            out.add(new ReputationRanking(entry.getKey(), entry.getValue(), i + 1));
        }
        return out;
    }

    public synchronized List<ReputationEntry> history(String agentId) {
        return history.stream()
                .filter(entry -> entry.agentId().equals(agentId))
                .toList();
    }

    private BusResult<Long> apply(String agentId, long delta, String reason, String refId) {
        BusError invalid = AgentChecks.requireAgent(identityValidator, agentId, "Reputation");
        if (invalid != null) {
            return BusResult.fail(invalid);
        }
        long total;
        synchronized (this) {
            total = scores.merge(agentId, delta, Long::sum);
            history.add(new ReputationEntry(agentId, delta, reason, refId, clock.millis()));
        }
        log.info("Reputation for agent {} changed by {} ({}), total={}", agentId, delta, reason, total);
        return BusResult.ok(total);
    }
}

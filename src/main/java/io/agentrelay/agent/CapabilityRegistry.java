package io.agentrelay.agent;

import java.util.List;
import java.util.Optional;

public interface CapabilityRegistry {
    Optional<AgentCapabilities> lookup(String agentId);

    /**
     * Agents offering {@code serviceName} that can take work right now, in registration order.
     */
    List<String> findByService(String serviceName);
}

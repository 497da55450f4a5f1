package io.agentrelay.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * One entry of {@code agents.json}: an identity plus, for agents, its advertised capabilities.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentSeed(
        String id,
        String name,
        String type,
        List<String> services,
        List<String> skills,
        Map<String, BigDecimal> pricing,
        String status,
        Integer maxConcurrentTasks,
        String description
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AgentSeedFile(List<AgentSeed> agents) {
    }
}

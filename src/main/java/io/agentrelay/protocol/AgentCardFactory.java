package io.agentrelay.protocol;

import io.agentrelay.agent.AgentCapabilities;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the discovery card an agent publishes to peers.
 */
public final class AgentCardFactory {
    public static final String PROTOCOL = "jsonrpc2.0";
    public static final String AUTH_SCHEME = "bearer";

    private final String endpoint;
    private final String version;

    public AgentCardFactory(String endpoint, String version) {
        this.endpoint = endpoint;
        this.version = version;
    }

    public String endpoint() {
        return endpoint;
    }

    public String version() {
        return version;
    }

    public Map<String, Object> build(String agentId, String displayName, AgentCapabilities capabilities, long reputation) {
        Map<String, Object> caps = new LinkedHashMap<>();
        caps.put("services", capabilities.services());
        caps.put("skills", capabilities.skills());

        Map<String, Object> connection = new LinkedHashMap<>();
        connection.put("endpoint", endpoint);
        connection.put("protocol", PROTOCOL);
        connection.put("auth", Map.of("scheme", AUTH_SCHEME));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("pricing", capabilities.pricing());
        metadata.put("status", capabilities.status().wireName());
        metadata.put("description", capabilities.description() == null ? "" : capabilities.description());
        metadata.put("reputation", reputation);
        metadata.put("max_concurrent_tasks", capabilities.maxConcurrentTasks());
        metadata.put("active_tasks", capabilities.activeTasks());

        Map<String, Object> card = new LinkedHashMap<>();
        card.put("agent_id", agentId);
        card.put("name", displayName == null || displayName.isBlank() ? agentId : displayName);
        card.put("version", version);
        card.put("capabilities", caps);
        card.put("connection", connection);
        card.put("metadata", metadata);
        return card;
    }
}

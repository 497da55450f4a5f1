package io.agentrelay.agent;

import io.agentrelay.model.BusError;
import io.agentrelay.model.BusResult;
import io.agentrelay.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Capability registry kept in process memory, with a service-name index for discovery.
 */
public final class InMemoryCapabilityRegistry implements CapabilityRegistry {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCapabilityRegistry.class);

    private final IdentityValidator identityValidator;
    private final ServiceDirectoryBridge directoryBridge;
    private final Map<String, AgentCapabilities> capabilities = new LinkedHashMap<>();
    private final Map<String, Set<String>> serviceIndex = new LinkedHashMap<>();

    public InMemoryCapabilityRegistry(IdentityValidator identityValidator) {
        this(identityValidator, ServiceDirectoryBridge.notConfigured());
    }

    public InMemoryCapabilityRegistry(IdentityValidator identityValidator, ServiceDirectoryBridge directoryBridge) {
        this.identityValidator = identityValidator;
        this.directoryBridge = directoryBridge == null ? ServiceDirectoryBridge.notConfigured() : directoryBridge;
    }

    public BusResult<AgentCapabilities> register(String agentId, AgentCapabilities registered) {
        BusError invalid = AgentChecks.requireAgent(identityValidator, agentId, "Registering");
        if (invalid != null) {
            return BusResult.fail(invalid);
        }
        if (registered == null) {
            return BusResult.fail(ErrorKind.PROTOCOL_ERROR, "Capabilities are required");
        }
        synchronized (this) {
            capabilities.put(agentId, registered);
            for (Set<String> agents : serviceIndex.values()) {
                agents.remove(agentId);
            }
            for (String service : registered.services()) {
                serviceIndex.computeIfAbsent(service, ignored -> new LinkedHashSet<>()).add(agentId);
            }
        }
        mirrorToDirectory(agentId, registered);
        return BusResult.ok(registered);
    }

    @Override
    public synchronized Optional<AgentCapabilities> lookup(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(capabilities.get(agentId));
    }

    @Override
    public synchronized List<String> findByService(String serviceName) {
        Set<String> agents = serviceName == null ? null : serviceIndex.get(serviceName);
        if (agents == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String agentId : agents) {
            AgentCapabilities caps = capabilities.get(agentId);
            if (caps != null && caps.hasCapacity()) {
                out.add(agentId);
            }
        }
        return out;
    }

    public synchronized List<String> findBySkill(String skill) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, AgentCapabilities> entry : capabilities.entrySet()) {
            AgentCapabilities caps = entry.getValue();
            if (caps.status() == AgentAvailability.AVAILABLE && caps.hasSkill(skill)) {
                out.add(entry.getKey());
            }
        }
        return out;
    }

    public synchronized List<String> availableAgents() {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, AgentCapabilities> entry : capabilities.entrySet()) {
            if (entry.getValue().hasCapacity()) {
                out.add(entry.getKey());
            }
        }
        return out;
    }

    public synchronized BusResult<AgentCapabilities> updateStatus(String agentId, AgentAvailability status) {
        AgentCapabilities current = capabilities.get(agentId);
        if (current == null) {
            return BusResult.fail(ErrorKind.NOT_FOUND, "No capabilities found for agent " + agentId);
        }
        AgentCapabilities next = current.withStatus(status);
        capabilities.put(agentId, next);
        return BusResult.ok(next);
    }

    public synchronized BusResult<AgentCapabilities> updateActiveTasks(String agentId, int activeTasks) {
        AgentCapabilities current = capabilities.get(agentId);
        if (current == null) {
            return BusResult.fail(ErrorKind.NOT_FOUND, "No capabilities found for agent " + agentId);
        }
        AgentCapabilities next = current.withActiveTasks(activeTasks);
        capabilities.put(agentId, next);
        return BusResult.ok(next);
    }

    private void mirrorToDirectory(String agentId, AgentCapabilities registered) {
        try {
            ServiceDirectoryBridge.RegistrationOutcome outcome = directoryBridge.register(agentId, registered);
            switch (outcome.status()) {
                case REGISTERED -> log.info("Agent {} registered with service directory", agentId);
                case FAILED -> log.warn("Failed to register agent {} with service directory: {}", agentId, outcome.message());
                case NOT_CONFIGURED -> log.debug("Service directory not configured, skipping agent {}", agentId);
            }
        } catch (RuntimeException e) {
            log.warn("Error during service directory registration for agent {}: {}", agentId, e.getMessage());
        }
    }
}

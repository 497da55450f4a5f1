package io.agentrelay.agent;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process identity directory. Stands in for an external identity store when none is wired.
 */
public final class AgentDirectory implements IdentityValidator {
    private final Map<String, AgentIdentity> identities = new ConcurrentHashMap<>();

    public void register(AgentIdentity identity) {
        if (identity == null || identity.id() == null || identity.id().isBlank()) {
            throw new IllegalArgumentException("identity id cannot be empty");
        }
        identities.put(identity.id(), identity);
    }

    public void registerAgent(String id, String name) {
        register(new AgentIdentity(id, name == null || name.isBlank() ? id : name, IdentityType.AGENT));
    }

    public Optional<AgentIdentity> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(identities.get(id));
    }

    public Collection<String> listAgentIds() {
        return identities.values().stream()
                .filter(AgentIdentity::isAgent)
                .map(AgentIdentity::id)
                .sorted()
                .toList();
    }

    public List<AgentIdentity> list() {
        return identities.values().stream()
                .sorted((a, b) -> a.id().compareTo(b.id()))
                .toList();
    }

    @Override
    public IdentityResolution resolve(String id) {
        return IdentityResolution.of(findById(id).orElse(null));
    }
}

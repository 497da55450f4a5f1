package io.agentrelay.agent;

public record AgentIdentity(
        String id,
        String name,
        IdentityType type
) {
    public boolean isAgent() {
        return type == IdentityType.AGENT;
    }
}

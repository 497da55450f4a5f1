package io.agentrelay.agent;

/**
 * What an identity lookup tells the bus. {@code displayName} is null for unknown identities.
 */
public record IdentityResolution(
        boolean exists,
        boolean isAgent,
        String displayName
) {
    private static final IdentityResolution UNKNOWN = new IdentityResolution(false, false, null);

    public static IdentityResolution unknown() {
        return UNKNOWN;
    }

    public static IdentityResolution of(AgentIdentity identity) {
        if (identity == null) {
            return UNKNOWN;
        }
        return new IdentityResolution(true, identity.isAgent(), identity.name());
    }
}

package io.agentrelay.agent;

/**
 * Resolves an identifier to "does it exist, and may it speak the agent protocol".
 * Implementations may block on I/O; callers never hold a mailbox lock while calling.
 */
@FunctionalInterface
public interface IdentityValidator {
    IdentityResolution resolve(String id);
}

package io.agentrelay.agent;

import io.agentrelay.model.BusError;
import io.agentrelay.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AgentChecks {
    private static final Logger log = LoggerFactory.getLogger(AgentChecks.class);

    private AgentChecks() {
    }

    /**
     * Returns {@code null} when {@code agentId} resolves to an agent, otherwise the validation
     * error to report. {@code role} prefixes the message ("Sender", "Recipient"). A validator that
     * throws is reported as {@link ErrorKind#INTERNAL_ERROR}.
     */
    public static BusError requireAgent(IdentityValidator identities, String agentId, String role) {
        if (agentId == null || agentId.isBlank()) {
            return BusError.of(ErrorKind.UNKNOWN_AGENT, role + " agent id is missing");
        }
        IdentityResolution resolution;
        try {
            resolution = identities.resolve(agentId);
        } catch (RuntimeException e) {
            log.warn("Identity lookup for {} failed: {}", agentId, e.getMessage());
            return BusError.of(ErrorKind.INTERNAL_ERROR, role + " agent " + agentId + " could not be resolved: " + e.getMessage());
        }
        if (resolution == null || !resolution.exists()) {
            return BusError.of(ErrorKind.UNKNOWN_AGENT, role + " agent " + agentId + " not found");
        }
        if (!resolution.isAgent()) {
            return BusError.of(ErrorKind.NOT_AN_AGENT, role + " " + agentId + " is not an Agent type");
        }
        return null;
    }
}

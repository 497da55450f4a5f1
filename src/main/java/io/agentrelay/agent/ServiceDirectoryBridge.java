package io.agentrelay.agent;

/**
 * Optional outbound bridge that mirrors agent registrations into an external service directory.
 * A runtime without a directory passes {@link #notConfigured()}.
 */
public interface ServiceDirectoryBridge {
    RegistrationOutcome register(String agentId, AgentCapabilities capabilities);

    static ServiceDirectoryBridge notConfigured() {
        return (agentId, capabilities) -> RegistrationOutcome.notConfigured();
    }

    enum RegistrationStatus {
        REGISTERED,
        FAILED,
        NOT_CONFIGURED
    }

    record RegistrationOutcome(
            RegistrationStatus status,
            String message
    ) {
        public static RegistrationOutcome registered(String message) {
            return new RegistrationOutcome(RegistrationStatus.REGISTERED, message);
        }

        public static RegistrationOutcome failed(String message) {
            return new RegistrationOutcome(RegistrationStatus.FAILED, message);
        }

        public static RegistrationOutcome notConfigured() {
            return new RegistrationOutcome(RegistrationStatus.NOT_CONFIGURED, "service directory not configured");
        }
    }
}

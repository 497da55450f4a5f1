package io.agentrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class AgentRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "agentrelay-settings.json";
    public static final String AGENTS_FILE_NAME = "agents.json";

    private final Path rootDir;

    public AgentRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static AgentRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new AgentRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path agentsFile() {
        return rootDir.resolve(AGENTS_FILE_NAME);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditLogFile() {
        return auditRoot().resolve("audit.log");
    }
}

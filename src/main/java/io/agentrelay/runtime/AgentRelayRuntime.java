package io.agentrelay.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import io.agentrelay.agent.AgentAvailability;
import io.agentrelay.agent.AgentCapabilities;
import io.agentrelay.agent.AgentDirectory;
import io.agentrelay.agent.AgentIdentity;
import io.agentrelay.agent.IdentityType;
import io.agentrelay.agent.InMemoryCapabilityRegistry;
import io.agentrelay.agent.ServiceDirectoryBridge;
import io.agentrelay.bus.MessageBus;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.config.RelaySettings;
import io.agentrelay.mailbox.MailboxStore;
import io.agentrelay.model.BusResult;
import io.agentrelay.observability.AuditLogger;
import io.agentrelay.observability.LoggingNotificationSink;
import io.agentrelay.observability.NotificationSink;
import io.agentrelay.protocol.AgentCardFactory;
import io.agentrelay.protocol.JsonRpcErrorCodes;
import io.agentrelay.protocol.JsonRpcRequest;
import io.agentrelay.protocol.JsonRpcResponse;
import io.agentrelay.protocol.ProtocolTranscoder;
import io.agentrelay.reputation.InMemoryReputationLedger;
import io.agentrelay.task.TaskLedger;
import io.agentrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-wide context object. Owns one instance of every component and wires the in-memory
 * collaborators together; nothing in the tree is a singleton.
 */
public final class AgentRelayRuntime {
    private static final Logger log = LoggerFactory.getLogger(AgentRelayRuntime.class);
    public static final String AUDIT_SECRET_ENV = "AGENTRELAY_AUDIT_SECRET";
    private static final List<String> AUDITED_PARAMS = List.of("to_agent_id", "task_id", "message_id", "transaction_hash");

    private final AgentRelayConfig config;
    private final Clock clock;
    private final AgentDirectory directory;
    private final InMemoryCapabilityRegistry registry;
    private final InMemoryReputationLedger reputation;
    private final MailboxStore mailboxes;
    private final MessageBus bus;
    private final TaskLedger tasks;
    private final ProtocolTranscoder transcoder;
    private final AuditLogger auditLogger;
    private volatile RelaySettings settings;

    public AgentRelayRuntime(AgentRelayConfig config) {
        this(config, Clock.systemUTC(), new LoggingNotificationSink(), ServiceDirectoryBridge.notConfigured());
    }

    public AgentRelayRuntime(
            AgentRelayConfig config,
            Clock clock,
            NotificationSink notifications,
            ServiceDirectoryBridge serviceDirectory
    ) {
        this.config = config;
        this.clock = clock;
        this.settings = RelaySettings.defaults();
        this.directory = new AgentDirectory();
        this.registry = new InMemoryCapabilityRegistry(directory, serviceDirectory);
        this.reputation = new InMemoryReputationLedger(directory, clock);
        this.mailboxes = new MailboxStore(settings.mailboxCapacity());
        this.bus = new MessageBus(mailboxes, directory, notifications, clock);
        this.tasks = new TaskLedger(bus, directory, reputation, clock);
        this.transcoder = new ProtocolTranscoder(
                bus,
                tasks,
                directory,
                registry,
                reputation,
                new AgentCardFactory(settings.rpcEndpoint(), settings.agentVersion()),
                clock
        );
        this.auditLogger = new AuditLogger(config.auditLogFile(), System.getenv(AUDIT_SECRET_ENV), clock);
    }

    public void init() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create root directory: " + config.rootDir(), e);
        }
        reloadSettings();
        int seeded = loadAgents();
        log.info("AgentRelay runtime ready at {} with {} seeded identities", config.rootDir(), seeded);
    }

    public SettingsReloadOutcome reloadSettings() {
        Path file = config.settingsFile();
        long checkedAtMs = clock.millis();
        RelaySettings previous = settings;
        RelaySettings resolved;
        String source;
        if (Files.exists(file)) {
            try {
                RelaySettings.SettingsFile raw = Jsons.mapper().readValue(file.toFile(), RelaySettings.SettingsFile.class);
                resolved = RelaySettings.fromFile(raw, RelaySettings.defaults());
                source = "file";
            } catch (IOException e) {
                throw new RuntimeException("Failed to read settings file: " + file, e);
            }
        } else {
            resolved = RelaySettings.defaults();
            source = "defaults";
        }
        apply(resolved);
        List<String> changedFields = previous.changedFields(resolved);
        boolean changed = !changedFields.isEmpty();
        audit("runtime.settings.load", "system", "runtime/settings", changed ? "reloaded" : "ok", Map.of(
                "config", file.toString(),
                "source", source,
                "changed", changed,
                "changed_fields", changedFields
        ));
        return new SettingsReloadOutcome(changed, "file".equals(source), file.toString(), resolved, source, checkedAtMs, changedFields);
    }

    public RelaySettings currentSettings() {
        return settings;
    }

    public JsonRpcResponse handleRpc(JsonRpcRequest request, String fromAgent) {
        JsonRpcResponse response = transcoder.dispatch(request, fromAgent);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("request_id", request == null ? null : request.id());
        details.put("method", request == null ? null : request.method());
        Map<String, Object> params = request == null || request.params() == null ? Map.of() : request.params();
        for (String key : AUDITED_PARAMS) {
            if (params.get(key) != null) {
                details.put(key, params.get(key));
            }
        }
        if (response.hasError()) {
            details.put("error_code", response.error().code());
            details.put("error_message", response.error().message());
        }
        String method = request == null || request.method() == null ? "invalid" : request.method();
        audit("rpc.dispatch", fromAgent, "rpc/" + method, response.hasError() ? "error" : "ok", details);
        return response;
    }

    /**
     * Parses a raw JSON-RPC body. Malformed JSON yields a {@code -32700} response, and well-formed
     * JSON that is not a request object (an array body, non-object params) yields {@code -32600};
     * both carry a null id.
     */
    public JsonRpcResponse handleRpcJson(String body, String fromAgent) {
        JsonRpcRequest request;
        try {
            request = Jsons.mapper().readValue(body == null ? "" : body, JsonRpcRequest.class);
        } catch (MismatchedInputException e) {
            if (body == null || body.isBlank()) {
                return unparsed(fromAgent, JsonRpcErrorCodes.PARSE_ERROR, "Parse error", e);
            }
            return unparsed(fromAgent, JsonRpcErrorCodes.INVALID_REQUEST, "Invalid Request", e);
        } catch (JsonProcessingException e) {
            return unparsed(fromAgent, JsonRpcErrorCodes.PARSE_ERROR, "Parse error", e);
        }
        return handleRpc(request, fromAgent);
    }

    public MaintenanceOutcome runMaintenance() {
        int compacted = bus.compactExpired(settings.expiredRetentionMs());
        if (compacted > 0) {
            log.info("Compacted {} expired envelopes", compacted);
        }
        return new MaintenanceOutcome(compacted, mailboxes.totalDepth(), clock.millis());
    }

    public RuntimeStats stats() {
        return new RuntimeStats(bus.stats(), tasks.size(), directory.listAgentIds().size(), registry.availableAgents().size());
    }

    public AgentRelayConfig config() {
        return config;
    }

    public AgentDirectory directory() {
        return directory;
    }

    public InMemoryCapabilityRegistry registry() {
        return registry;
    }

    public InMemoryReputationLedger reputation() {
        return reputation;
    }

    public MessageBus bus() {
        return bus;
    }

    public TaskLedger tasks() {
        return tasks;
    }

    public ProtocolTranscoder transcoder() {
        return transcoder;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    private void apply(RelaySettings next) {
        settings = next;
        mailboxes.capacity(next.mailboxCapacity());
        bus.paymentCurrency(next.paymentCurrency());
        tasks.reputationPolicy(next.completionReward(), next.failurePenalty());
        transcoder.cardFactory(new AgentCardFactory(next.rpcEndpoint(), next.agentVersion()));
    }

    private int loadAgents() {
        Path file = config.agentsFile();
        if (!Files.exists(file)) {
            return 0;
        }
        AgentSeed.AgentSeedFile seeds;
        try {
            seeds = Jsons.mapper().readValue(file.toFile(), AgentSeed.AgentSeedFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read agents file: " + file, e);
        }
        if (seeds == null || seeds.agents() == null) {
            return 0;
        }
        List<String> skipped = new ArrayList<>();
        int count = 0;
        for (AgentSeed seed : seeds.agents()) {
            if (seed == null || seed.id() == null || seed.id().isBlank()) {
                skipped.add(String.valueOf(seed == null ? null : seed.name()));
                continue;
            }
            IdentityType type = IdentityType.fromString(seed.type());
            directory.register(new AgentIdentity(seed.id(), seed.name() == null ? seed.id() : seed.name(), type));
            count++;
            if (type == IdentityType.AGENT && (seed.services() != null || seed.skills() != null)) {
                AgentCapabilities caps = new AgentCapabilities(
                        seed.services(),
                        seed.skills(),
                        seed.pricing(),
                        AgentAvailability.fromString(seed.status()),
                        seed.maxConcurrentTasks() == null ? 1 : seed.maxConcurrentTasks(),
                        0,
                        seed.description(),
                        Map.of()
                );
                BusResult<AgentCapabilities> registered = registry.register(seed.id(), caps);
                if (registered.isError()) {
                    log.warn("Capabilities for {} not registered: {}", seed.id(), registered.error().message());
                }
            }
        }
        if (!skipped.isEmpty()) {
            log.warn("Skipped {} agent entries without an id in {}", skipped.size(), file);
        }
        return count;
    }

    private JsonRpcResponse unparsed(String fromAgent, int code, String message, JsonProcessingException cause) {
        audit("rpc.dispatch", fromAgent, "rpc/unparsed", "error", Map.of(
                "error_code", code,
                "error_message", cause.getOriginalMessage() == null ? "" : cause.getOriginalMessage()
        ));
        return JsonRpcResponse.failure(null, code, message);
    }

    private void audit(String action, String actor, String resource, String result, Map<String, Object> details) {
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, actor == null ? "anonymous" : actor, resource, result, details));
        } catch (RuntimeException e) {
            log.warn("Audit write for {} failed: {}", action, e.getMessage());
        }
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean configExists,
            String sourcePath,
            RelaySettings settings,
            String message,
            long checkedAtMs,
            List<String> changedFields
    ) {
    }

    public record MaintenanceOutcome(
            int compacted,
            long pendingDepth,
            long ranAtMs
    ) {
    }

    public record RuntimeStats(
            MessageBus.BusStats bus,
            int tasks,
            int agents,
            int availableAgents
    ) {
    }
}

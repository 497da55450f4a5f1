package io.agentrelay.runtime;

import io.agentrelay.ManualClock;
import io.agentrelay.agent.ServiceDirectoryBridge;
import io.agentrelay.bus.MessageBus;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.model.DelegatedTask;
import io.agentrelay.model.Envelope;
import io.agentrelay.model.MessageKind;
import io.agentrelay.protocol.JsonRpcErrorCodes;
import io.agentrelay.protocol.JsonRpcResponse;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AgentRelayRuntimeTest {
    private static final long T0 = 1_700_000_000_000L;

    private static final String AGENTS_JSON = """
            {
              "agents": [
                {"id": "agent-planner", "name": "Planner", "services": ["planning"], "skills": ["decomposition"]},
                {"id": "agent-worker", "name": "Worker", "type": "agent", "services": ["summarize"],
                 "pricing": {"summarize": 0.05}, "status": "Available", "maxConcurrentTasks": 2},
                {"id": "user-1", "name": "Operator", "type": "user"}
              ]
            }
            """;

    @Test
    void initSeedsAgentsAndDispatchesJsonRpc() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-runtime-");
        try {
            Files.writeString(root.resolve("agents.json"), AGENTS_JSON, StandardCharsets.UTF_8);
            List<String> notified = new ArrayList<>();
            AgentRelayRuntime runtime = runtime(root, notified);
            runtime.init();

            Assertions.assertEquals(List.of("agent-planner", "agent-worker"), runtime.directory().listAgentIds());
            Assertions.assertEquals(List.of("agent-worker"), runtime.registry().findByService("summarize"));

            JsonRpcResponse sent = runtime.handleRpcJson("""
                    {"jsonrpc":"2.0","method":"service_request","id":"r-1",
                     "params":{"to_agent_id":"agent-worker","content":"summarize please","priority":"High"}}
                    """, "agent-planner");

            Assertions.assertFalse(sent.hasError());
            List<Envelope> inbox = runtime.bus().listPending("agent-worker");
            Assertions.assertEquals(1, inbox.size());
            Assertions.assertTrue(MessageBus.isMessageId(inbox.get(0).id()), inbox.get(0).id());
            Assertions.assertEquals("r-1", sent.id());
            Assertions.assertEquals(MessageKind.SERVICE_REQUEST, inbox.get(0).kind());
            Assertions.assertEquals(List.of("agent-worker:A2A Message: ServiceRequest"), notified);

            JsonRpcResponse fromUser = runtime.handleRpcJson(
                    "{\"jsonrpc\":\"2.0\",\"method\":\"service_request\",\"id\":\"r-2\",\"params\":{\"to_agent_id\":\"agent-worker\"}}",
                    "user-1");
            Assertions.assertEquals(JsonRpcErrorCodes.INTERNAL_ERROR, fromUser.error().code());
            Assertions.assertEquals(Map.of("kind", "NOT_AN_AGENT"), fromUser.error().data());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedJsonIsParseErrorAndEveryCallIsAudited() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-runtime-audit-");
        try {
            AgentRelayRuntime runtime = runtime(root, new ArrayList<>());
            runtime.init();

            JsonRpcResponse parse = runtime.handleRpcJson("{not json", "agent-x");
            JsonRpcResponse ping = runtime.handleRpcJson("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":\"t1\"}", "agent-x");

            Assertions.assertEquals(JsonRpcErrorCodes.PARSE_ERROR, parse.error().code());
            Assertions.assertNull(parse.id());
            Assertions.assertFalse(ping.hasError());

            List<String> lines = Files.readAllLines(root.resolve("audit").resolve("audit.log"), StandardCharsets.UTF_8);
            Assertions.assertEquals(3, lines.size());
            Assertions.assertTrue(lines.get(0).contains("\"action\":\"runtime.settings.load\""));
            Assertions.assertTrue(lines.get(1).contains("\"resource\":\"rpc/unparsed\""));
            Assertions.assertTrue(lines.get(2).contains("\"resource\":\"rpc/ping\""));
            Assertions.assertTrue(runtime.auditLogger().verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void wellFormedJsonOfTheWrongShapeIsInvalidRequest() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-runtime-shape-");
        try {
            AgentRelayRuntime runtime = runtime(root, new ArrayList<>());
            runtime.init();

            JsonRpcResponse arrayBody = runtime.handleRpcJson("[1]", "agent-x");
            JsonRpcResponse arrayParams = runtime.handleRpcJson(
                    "{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":\"p\",\"params\":[1]}", "agent-x");
            JsonRpcResponse broken = runtime.handleRpcJson("{not json", "agent-x");
            JsonRpcResponse empty = runtime.handleRpcJson("", "agent-x");

            Assertions.assertEquals(JsonRpcErrorCodes.INVALID_REQUEST, arrayBody.error().code());
            Assertions.assertNull(arrayBody.id());
            Assertions.assertEquals(JsonRpcErrorCodes.INVALID_REQUEST, arrayParams.error().code());
            Assertions.assertNull(arrayParams.id());
            Assertions.assertEquals(JsonRpcErrorCodes.PARSE_ERROR, broken.error().code());
            Assertions.assertEquals(JsonRpcErrorCodes.PARSE_ERROR, empty.error().code());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void numericIdIsEchoedAndPaymentReferencesAreMaskedInTheAudit() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-runtime-payment-");
        try {
            Files.writeString(root.resolve("agents.json"), AGENTS_JSON, StandardCharsets.UTF_8);
            AgentRelayRuntime runtime = runtime(root, new ArrayList<>());
            runtime.init();

            JsonRpcResponse paid = runtime.handleRpcJson("""
                    {"jsonrpc":"2.0","method":"payment_request","id":5,
                     "params":{"to_agent_id":"agent-planner","amount":"1.5","transaction_hash":"5VfYx3kq9PzR2mTn8Lw4"}}
                    """, "agent-worker");

            Assertions.assertFalse(paid.hasError(), String.valueOf(paid.error()));
            Assertions.assertEquals(5, paid.id());
            String audit = Files.readString(root.resolve("audit").resolve("audit.log"), StandardCharsets.UTF_8);
            Assertions.assertTrue(audit.contains("\"transaction_hash\":\"***8Lw4\""), audit);
            Assertions.assertFalse(audit.contains("5VfYx3kq9PzR2mTn8Lw4"));
            Assertions.assertTrue(audit.contains("\"request_id\":5"), audit);
            Assertions.assertTrue(runtime.auditLogger().verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void seededCapabilityListsSkipNullEntries() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-runtime-seed-");
        try {
            Files.writeString(root.resolve("agents.json"), """
                    {"agents": [{"id": "agent-worker", "name": "Worker", "services": [null, "summarize", " "], "skills": [null]}]}
                    """, StandardCharsets.UTF_8);
            AgentRelayRuntime runtime = runtime(root, new ArrayList<>());
            runtime.init();

            Assertions.assertEquals(List.of("agent-worker"), runtime.registry().findByService("summarize"));
            Assertions.assertEquals(List.of("summarize"), runtime.registry().lookup("agent-worker").orElseThrow().services());
            Assertions.assertTrue(runtime.registry().lookup("agent-worker").orElseThrow().skills().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsFileDrivesComponentsAndReloadReportsChanges() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-runtime-settings-");
        try {
            Files.writeString(root.resolve("agents.json"), AGENTS_JSON, StandardCharsets.UTF_8);
            Files.writeString(root.resolve("agentrelay-settings.json"),
                    "{\"completionReward\": 3, \"paymentCurrency\": \"USDC\", \"rpcEndpoint\": \"http://relay:9000/rpc\"}",
                    StandardCharsets.UTF_8);
            AgentRelayRuntime runtime = runtime(root, new ArrayList<>());
            runtime.init();

            Assertions.assertEquals("USDC", runtime.currentSettings().paymentCurrency());
            Envelope payment = runtime.bus()
                    .sendPaymentRequest("agent-worker", "agent-planner", new BigDecimal("1"), "work", null)
                    .orElseThrow();
            Assertions.assertEquals("USDC", payment.payload().get("currency"));

            DelegatedTask task = runtime.tasks()
                    .delegate("agent-planner", "agent-worker", "summarize", "", Map.of(), List.of())
                    .orElseThrow();
            runtime.tasks().complete(task.taskId(), Map.of(), "done");
            Assertions.assertEquals(3L, runtime.reputation().score("agent-worker"));

            JsonRpcResponse card = runtime.handleRpcJson(
                    "{\"jsonrpc\":\"2.0\",\"method\":\"get_agent_card\",\"id\":\"c\",\"params\":{\"agent_id\":\"agent-worker\"}}",
                    "agent-planner");
            Map<?, ?> connection = (Map<?, ?>) ((Map<?, ?>) card.result()).get("connection");
            Assertions.assertEquals("http://relay:9000/rpc", connection.get("endpoint"));

            Files.writeString(root.resolve("agentrelay-settings.json"), "{\"mailboxCapacity\": 5}", StandardCharsets.UTF_8);
            AgentRelayRuntime.SettingsReloadOutcome reload = runtime.reloadSettings();
            Assertions.assertTrue(reload.changed());
            Assertions.assertTrue(reload.changedFields().contains("mailboxCapacity"));
            Assertions.assertTrue(reload.changedFields().contains("paymentCurrency"));
            Assertions.assertFalse(runtime.reloadSettings().changed());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void maintenanceCompactsExpiredEnvelopesPastRetention() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-runtime-maint-");
        try {
            Files.writeString(root.resolve("agents.json"), AGENTS_JSON, StandardCharsets.UTF_8);
            Files.writeString(root.resolve("agentrelay-settings.json"), "{\"expiredRetentionMs\": 1000}", StandardCharsets.UTF_8);
            ManualClock clock = new ManualClock(T0);
            AgentRelayRuntime runtime = new AgentRelayRuntime(
                    AgentRelayConfig.fromRoot(root.toString()),
                    clock,
                    (from, to, summary) -> { },
                    ServiceDirectoryBridge.notConfigured()
            );
            runtime.init();
            runtime.bus().send(Envelope.builder()
                    .from("agent-planner")
                    .to("agent-worker")
                    .expiresAtMs(T0 + 100L)
                    .build());

            Assertions.assertEquals(0, runtime.runMaintenance().compacted());
            clock.advance(2_000L);
            AgentRelayRuntime.MaintenanceOutcome outcome = runtime.runMaintenance();

            Assertions.assertEquals(1, outcome.compacted());
            Assertions.assertEquals(0L, outcome.pendingDepth());
            Assertions.assertEquals(1L, runtime.stats().bus().compactedTotal());
        } finally {
            deleteRecursively(root);
        }
    }

    private static AgentRelayRuntime runtime(Path root, List<String> notified) {
        return new AgentRelayRuntime(
                AgentRelayConfig.fromRoot(root.toString()),
                new ManualClock(T0),
                (from, to, summary) -> notified.add(to + ":" + summary),
                ServiceDirectoryBridge.notConfigured()
        );
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}

package io.agentrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.runtime.AgentRelayRuntime;
import io.agentrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class AgentRelayCommandTest {

    @Test
    void initWritesTemplatesAndDispatchAnswersPing() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-cli-");
        PrintStream originalOut = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
            int initCode = new CommandLine(new AgentRelayCommand()).execute("--root", root.toString(), "init");
            Assertions.assertEquals(0, initCode);
            Assertions.assertTrue(Files.exists(root.resolve("agentrelay-settings.json")));
            Assertions.assertTrue(Files.exists(root.resolve("agents.json")));

            captured.reset();
            int pingCode = new CommandLine(new AgentRelayCommand()).execute(
                    "--root", root.toString(),
                    "dispatch",
                    "--from", "agent-planner",
                    "--request", "{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":\"t1\"}"
            );
            Assertions.assertEquals(0, pingCode);
            JsonNode response = Jsons.mapper().readTree(captured.toString(StandardCharsets.UTF_8));
            Assertions.assertEquals("pong", response.path("result").path("status").asText());
            Assertions.assertEquals("t1", response.path("id").asText());

            captured.reset();
            int cardCode = new CommandLine(new AgentRelayCommand()).execute(
                    "--root", root.toString(),
                    "dispatch",
                    "--from", "agent-planner",
                    "--request", "{\"jsonrpc\":\"2.0\",\"method\":\"get_agent_card\",\"id\":\"c1\",\"params\":{\"agent_id\":\"agent-worker\"}}"
            );
            Assertions.assertEquals(0, cardCode);
            JsonNode card = Jsons.mapper().readTree(captured.toString(StandardCharsets.UTF_8));
            Assertions.assertEquals("Worker", card.path("result").path("name").asText());
        } finally {
            System.setOut(originalOut);
            deleteRecursively(root);
        }
    }

    @Test
    void reportingCommandsPrintStateAndVerifyAuditChain() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-cli-report-");
        PrintStream originalOut = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
            Assertions.assertEquals(0, new CommandLine(new AgentRelayCommand()).execute("--root", root.toString(), "init"));

            captured.reset();
            Assertions.assertEquals(0, new CommandLine(new AgentRelayCommand()).execute("--root", root.toString(), "agents"));
            JsonNode agents = Jsons.mapper().readTree(captured.toString(StandardCharsets.UTF_8));
            Assertions.assertEquals(2, agents.size());
            Assertions.assertEquals("agent-planner", agents.get(0).path("id").asText());

            captured.reset();
            Assertions.assertEquals(0, new CommandLine(new AgentRelayCommand()).execute("--root", root.toString(), "settings"));
            JsonNode settings = Jsons.mapper().readTree(captured.toString(StandardCharsets.UTF_8));
            Assertions.assertTrue(settings.path("configExists").asBoolean());

            captured.reset();
            Assertions.assertEquals(0, new CommandLine(new AgentRelayCommand()).execute("--root", root.toString(), "stats"));
            JsonNode stats = Jsons.mapper().readTree(captured.toString(StandardCharsets.UTF_8));
            Assertions.assertEquals(2, stats.path("agents").asInt());
            Assertions.assertEquals(0, stats.path("tasks").asInt());

            Assertions.assertEquals(0, new CommandLine(new AgentRelayCommand()).execute(
                    "--root", root.toString(),
                    "dispatch",
                    "--from", "agent-planner",
                    "--request", "{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":\"p1\"}"
            ));
            captured.reset();
            Assertions.assertEquals(0, new CommandLine(new AgentRelayCommand()).execute("--root", root.toString(), "audit-verify"));
            Assertions.assertTrue(Jsons.mapper().readTree(captured.toString(StandardCharsets.UTF_8)).path("valid").asBoolean());

            Path auditFile = AgentRelayConfig.fromRoot(root.toString()).auditLogFile();
            String tampered = Files.readString(auditFile, StandardCharsets.UTF_8).replace("\"p1\"", "\"p2\"");
            Files.writeString(auditFile, tampered, StandardCharsets.UTF_8);
            Assertions.assertEquals(2, new CommandLine(new AgentRelayCommand()).execute("--root", root.toString(), "audit-verify"));
        } finally {
            System.setOut(originalOut);
            deleteRecursively(root);
        }
    }

    @Test
    void rpcEndpointTakesSenderFromHeader() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-cli-http-");
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        try {
            Files.writeString(root.resolve("agents.json"), """
                    {"agents": [{"id": "agent-a", "name": "A"}, {"id": "agent-b", "name": "B"}]}
                    """, StandardCharsets.UTF_8);
            AgentRelayRuntime runtime = new AgentRelayRuntime(AgentRelayConfig.fromRoot(root.toString()));
            runtime.init();
            server.createContext("/rpc", exchange -> AgentRelayCommand.ServeRpcCommand.handle(runtime, exchange));
            server.start();
            URI uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/rpc");
            HttpClient client = HttpClient.newHttpClient();

            HttpResponse<String> sent = client.send(HttpRequest.newBuilder(uri)
                    .header(AgentRelayCommand.AGENT_ID_HEADER, "agent-a")
                    .POST(HttpRequest.BodyPublishers.ofString(
                            "{\"jsonrpc\":\"2.0\",\"method\":\"task_delegation\",\"id\":\"d-1\","
                                    + "\"params\":{\"to_agent_id\":\"agent-b\",\"content\":\"do it\"}}"))
                    .build(), HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(200, sent.statusCode());
            Assertions.assertEquals("sent", Jsons.mapper().readTree(sent.body()).path("result").path("status").asText());
            Assertions.assertEquals("agent-a", runtime.bus().listPending("agent-b").get(0).from());

            HttpResponse<String> malformed = client.send(HttpRequest.newBuilder(uri)
                    .POST(HttpRequest.BodyPublishers.ofString("{oops"))
                    .build(), HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(-32700, Jsons.mapper().readTree(malformed.body()).path("error").path("code").asInt());

            HttpResponse<String> get = client.send(HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(405, get.statusCode());
        } finally {
            server.stop(0);
            deleteRecursively(root);
        }
    }

    @Test
    void delegatedTaskLifecycleRunsOverHttp() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-cli-tasks-");
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        try {
            Files.writeString(root.resolve("agents.json"), """
                    {"agents": [{"id": "agent-a", "name": "A"}, {"id": "agent-b", "name": "B", "services": ["analyze"]}]}
                    """, StandardCharsets.UTF_8);
            AgentRelayRuntime runtime = new AgentRelayRuntime(AgentRelayConfig.fromRoot(root.toString()));
            runtime.init();
            server.createContext("/rpc", exchange -> AgentRelayCommand.ServeRpcCommand.handle(runtime, exchange));
            server.start();
            URI uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/rpc");
            HttpClient client = HttpClient.newHttpClient();

            JsonNode delegated = post(client, uri, "agent-a", "{\"jsonrpc\":\"2.0\",\"method\":\"delegate_task\",\"id\":1,"
                    + "\"params\":{\"to_agent_id\":\"agent-b\",\"task_name\":\"analyze\",\"task_parameters\":{\"window\":\"24h\"}}}");
            Assertions.assertEquals(1, delegated.path("id").asInt());
            Assertions.assertTrue(delegated.path("id").isNumber());
            String taskId = delegated.path("result").path("task_id").asText();
            Assertions.assertEquals("PENDING", delegated.path("result").path("status").asText());

            JsonNode inbox = post(client, uri, "agent-b", "{\"jsonrpc\":\"2.0\",\"method\":\"list_pending_messages\",\"id\":2}");
            Assertions.assertEquals(1, inbox.path("result").path("count").asInt());
            JsonNode message = inbox.path("result").path("messages").get(0);
            Assertions.assertEquals("task_delegation", message.path("method").asText());

            JsonNode acked = post(client, uri, "agent-b", "{\"jsonrpc\":\"2.0\",\"method\":\"acknowledge_message\",\"id\":3,"
                    + "\"params\":{\"message_id\":\"" + message.path("message_id").asText() + "\"}}");
            Assertions.assertEquals("acknowledged", acked.path("result").path("status").asText());

            JsonNode completed = post(client, uri, "agent-b", "{\"jsonrpc\":\"2.0\",\"method\":\"complete_task\",\"id\":4,"
                    + "\"params\":{\"task_id\":\"" + taskId + "\",\"result_data\":{\"errors\":0}}}");
            Assertions.assertEquals("COMPLETED", completed.path("result").path("status").asText());

            JsonNode tasks = post(client, uri, "agent-a", "{\"jsonrpc\":\"2.0\",\"method\":\"get_tasks\",\"id\":5,"
                    + "\"params\":{\"status\":\"completed\"}}");
            Assertions.assertEquals(taskId, tasks.path("result").path("tasks").get(0).path("task_id").asText());

            JsonNode top = post(client, uri, "agent-a", "{\"jsonrpc\":\"2.0\",\"method\":\"top_agents\",\"id\":6,\"params\":{\"limit\":1}}");
            Assertions.assertEquals("agent-b", top.path("result").path("agents").get(0).path("agent_id").asText());

            JsonNode notification = post(client, uri, "agent-a", "{\"jsonrpc\":\"2.0\",\"method\":\"list_pending_messages\",\"id\":7}");
            Assertions.assertEquals("task_completion", notification.path("result").path("messages").get(0).path("method").asText());
        } finally {
            server.stop(0);
            deleteRecursively(root);
        }
    }

    private static JsonNode post(HttpClient client, URI uri, String agentId, String body) throws Exception {
        HttpResponse<String> response = client.send(HttpRequest.newBuilder(uri)
                .header(AgentRelayCommand.AGENT_ID_HEADER, agentId)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build(), HttpResponse.BodyHandlers.ofString());
        Assertions.assertEquals(200, response.statusCode());
        return Jsons.mapper().readTree(response.body());
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

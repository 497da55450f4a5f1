package io.agentrelay.cli;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.config.RelaySettings;
import io.agentrelay.protocol.JsonRpcResponse;
import io.agentrelay.runtime.AgentRelayRuntime;
import io.agentrelay.runtime.AgentSeed;
import io.agentrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Command(
        name = "agentrelay",
        mixinStandardHelpOptions = true,
        description = "Agent-to-agent message bus and JSON-RPC 2.0 endpoint",
        subcommands = {
                AgentRelayCommand.InitCommand.class,
                AgentRelayCommand.DispatchCommand.class,
                AgentRelayCommand.ServeRpcCommand.class,
                AgentRelayCommand.SettingsCommand.class,
                AgentRelayCommand.AgentsCommand.class,
                AgentRelayCommand.StatsCommand.class,
                AgentRelayCommand.AuditVerifyCommand.class
        }
)
public final class AgentRelayCommand implements Runnable {
    static final String AGENT_ID_HEADER = "X-Agent-Id";

    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | dispatch | serve-rpc | settings | agents | stats | audit-verify");
    }

    AgentRelayRuntime runtime() {
        return new AgentRelayRuntime(AgentRelayConfig.fromRoot(root));
    }

    @Command(name = "init", description = "Create the data root with default settings and an agents.json template")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() throws IOException {
            AgentRelayConfig config = AgentRelayConfig.fromRoot(parent.root);
            Files.createDirectories(config.rootDir());
            if (!Files.exists(config.settingsFile())) {
                Files.writeString(config.settingsFile(), Jsons.toJson(RelaySettings.defaults()), StandardCharsets.UTF_8);
            }
            if (!Files.exists(config.agentsFile())) {
                Files.writeString(config.agentsFile(), Jsons.toJson(sampleAgents()), StandardCharsets.UTF_8);
            }
            AgentRelayRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println("Initialized AgentRelay at: " + config.rootDir());
            return 0;
        }

        private static AgentSeed.AgentSeedFile sampleAgents() {
            List<AgentSeed> agents = new ArrayList<>();
            agents.add(new AgentSeed(
                    "agent-planner",
                    "Planner",
                    "agent",
                    List.of("planning"),
                    List.of("task-decomposition"),
                    Map.of("planning", new BigDecimal("0.10")),
                    "available",
                    2,
                    "Breaks requests into delegated tasks"
            ));
            agents.add(new AgentSeed(
                    "agent-worker",
                    "Worker",
                    "agent",
                    List.of("summarize"),
                    List.of("nlp"),
                    Map.of("summarize", new BigDecimal("0.05")),
                    "available",
                    4,
                    "Executes delegated work"
            ));
            return new AgentSeed.AgentSeedFile(agents);
        }
    }

    @Command(name = "dispatch", description = "Dispatch one JSON-RPC request and print the response")
    static final class DispatchCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--from"}, required = true, description = "Authenticated sender agent id")
        String from;

        @Option(names = {"--request-file"}, description = "Path to a JSON-RPC request body")
        String requestFile;

        @Option(names = {"--request"}, description = "Inline JSON-RPC request body")
        String request;

        @Override
        public Integer call() throws IOException {
            String body;
            if (request != null && !request.isBlank()) {
                body = request;
            } else if (requestFile != null && !requestFile.isBlank()) {
                body = Files.readString(Paths.get(requestFile), StandardCharsets.UTF_8);
            } else {
                throw new IllegalArgumentException("either --request or --request-file is required");
            }
            AgentRelayRuntime runtime = parent.runtime();
            runtime.init();
            JsonRpcResponse response = runtime.handleRpcJson(body, from);
            System.out.println(Jsons.toJson(response));
            return response.hasError() ? 1 : 0;
        }
    }

    @Command(name = "serve-rpc", description = "Expose JSON-RPC dispatch over HTTP POST")
    static final class ServeRpcCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--port"}, defaultValue = "8088", description = "Bind port")
        int port;

        @Option(names = {"--path"}, defaultValue = "/rpc", description = "RPC path")
        String path;

        @Option(names = {"--maintenance-interval-ms"}, defaultValue = "60000",
                description = "Interval between expired-envelope compaction passes")
        long maintenanceIntervalMs;

        @Override
        public Integer call() throws Exception {
            AgentRelayRuntime runtime = parent.runtime();
            runtime.init();
            HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext(path, exchange -> handle(runtime, exchange));
            server.setExecutor(Executors.newFixedThreadPool(4));
            ScheduledExecutorService maintenance = Executors.newSingleThreadScheduledExecutor();
            long interval = Math.max(1_000L, maintenanceIntervalMs);
            maintenance.scheduleAtFixedRate(runtime::runMaintenance, interval, interval, TimeUnit.MILLISECONDS);
            server.start();
            System.out.println("JSON-RPC endpoint listening on http://127.0.0.1:" + port + path);
            Thread.currentThread().join();
            return 0;
        }

        static void handle(AgentRelayRuntime runtime, HttpExchange exchange) throws IOException {
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", "POST");
                    exchange.sendResponseHeaders(405, -1);
                    return;
                }
                String body;
                try (InputStream in = exchange.getRequestBody()) {
                    body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
                String from = exchange.getRequestHeaders().getFirst(AGENT_ID_HEADER);
                JsonRpcResponse response = runtime.handleRpcJson(body, from);
                byte[] bytes = Jsons.toCompactJson(response).getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            } finally {
                exchange.close();
            }
        }
    }

    @Command(name = "settings", description = "Reload agentrelay-settings.json and print effective values")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            AgentRelayRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.reloadSettings()));
            return 0;
        }
    }

    @Command(name = "agents", description = "List seeded identities with their registered capabilities")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            AgentRelayRuntime runtime = parent.runtime();
            runtime.init();
            List<Map<String, Object>> rows = new ArrayList<>();
            runtime.directory().list().forEach(identity -> {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("id", identity.id());
                row.put("name", identity.name());
                row.put("type", identity.type().name());
                runtime.registry().lookup(identity.id()).ifPresent(caps -> row.put("capabilities", caps));
                rows.add(row);
            });
            System.out.println(Jsons.toJson(rows));
            return 0;
        }
    }

    @Command(name = "stats", description = "Show runtime status counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            AgentRelayRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.stats()));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            AgentRelayRuntime runtime = parent.runtime();
            boolean valid = runtime.auditLogger().verifyChain();
            Path file = runtime.auditLogger().auditFile();
            System.out.println(Jsons.toJson(Map.of("file", file.toString(), "valid", valid)));
            return valid ? 0 : 2;
        }
    }
}

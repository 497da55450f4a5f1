package io.agentrelay.protocol;

import io.agentrelay.agent.AgentCapabilities;
import io.agentrelay.agent.CapabilityRegistry;
import io.agentrelay.agent.IdentityResolution;
import io.agentrelay.agent.IdentityValidator;
import io.agentrelay.bus.MessageBus;
import io.agentrelay.model.BusError;
import io.agentrelay.model.BusResult;
import io.agentrelay.model.DelegatedTask;
import io.agentrelay.model.Envelope;
import io.agentrelay.model.ErrorKind;
import io.agentrelay.model.MessageKind;
import io.agentrelay.model.Priority;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.reputation.ReputationRanking;
import io.agentrelay.reputation.ReputationService;
import io.agentrelay.task.TaskLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts envelopes to and from JSON-RPC 2.0 requests and dispatches inbound requests.
 *
 * <p>{@link #dispatch} never throws: every failure, including unexpected exceptions, comes back as
 * an error response carrying the request id.
 *
 * <p>Besides the message kinds it forwards to the bus, dispatch serves a set of relay methods that
 * act on behalf of the authenticated sender: reading and acknowledging its own mailbox, delegating,
 * completing and listing tasks, and the reputation leaderboard.
 */
public final class ProtocolTranscoder {
    private static final Logger log = LoggerFactory.getLogger(ProtocolTranscoder.class);

    static final String FROM_AGENT_ID = "from_agent_id";
    static final String TO_AGENT_ID = "to_agent_id";
    static final String MESSAGE_TYPE = "message_type";
    static final String CONTENT = "content";
    static final String PAYLOAD = "payload";
    static final String TIMESTAMP = "timestamp";
    static final String PRIORITY = "priority";
    static final String EXPIRES_AT = "expires_at";
    static final String TRANSACTION_HASH = "transaction_hash";
    static final String RESPONSE_TO = "response_to_message_id";
    static final String METADATA = "metadata";

    public static final String METHOD_GET_AGENT_CARD = "get_agent_card";
    public static final String METHOD_FIND_AGENTS_BY_SERVICE = "find_agents_by_service";
    public static final String METHOD_LIST_PENDING_MESSAGES = "list_pending_messages";
    public static final String METHOD_ACKNOWLEDGE_MESSAGE = "acknowledge_message";
    public static final String METHOD_DELEGATE_TASK = "delegate_task";
    public static final String METHOD_COMPLETE_TASK = "complete_task";
    public static final String METHOD_GET_TASKS = "get_tasks";
    public static final String METHOD_TOP_AGENTS = "top_agents";

    static final int DEFAULT_TOP_AGENTS = 10;
    static final int MAX_TOP_AGENTS = 100;

    private final MessageBus bus;
    private final TaskLedger tasks;
    private final IdentityValidator identities;
    private final CapabilityRegistry capabilities;
    private final ReputationService reputation;
    private final Clock clock;
    private volatile AgentCardFactory cards;

    public ProtocolTranscoder(
            MessageBus bus,
            TaskLedger tasks,
            IdentityValidator identities,
            CapabilityRegistry capabilities,
            ReputationService reputation,
            AgentCardFactory cards,
            Clock clock
    ) {
        this.bus = bus;
        this.tasks = tasks;
        this.identities = identities;
        this.capabilities = capabilities;
        this.reputation = reputation;
        this.cards = cards;
        this.clock = clock;
    }

    public void cardFactory(AgentCardFactory cards) {
        this.cards = cards;
    }

    public JsonRpcRequest toRequest(Envelope envelope) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(FROM_AGENT_ID, envelope.from());
        params.put(TO_AGENT_ID, envelope.to());
        params.put(MESSAGE_TYPE, envelope.kind().displayName());
        params.put(CONTENT, envelope.content());
        params.put(PAYLOAD, envelope.payload());
        params.put(TIMESTAMP, Instant.ofEpochMilli(envelope.createdAtMs()).toString());
        params.put(PRIORITY, envelope.priority().wireName());
        if (envelope.expiresAtMs() != null) {
            params.put(EXPIRES_AT, Instant.ofEpochMilli(envelope.expiresAtMs()).toString());
        }
        if (envelope.transactionRef() != null) {
            params.put(TRANSACTION_HASH, envelope.transactionRef());
        }
        if (envelope.inResponseTo() != null) {
            params.put(RESPONSE_TO, envelope.inResponseTo());
        }
        if (!envelope.metadata().isEmpty()) {
            params.put(METADATA, envelope.metadata());
        }
        return JsonRpcRequest.of(envelope.kind().method(), params, envelope.id());
    }

    /**
     * Decodes {@code request} into an envelope sent by {@code impliedFrom}. The sender named in the
     * params is ignored; the caller's authenticated id always wins. The request id becomes the
     * message id only when it has the bus's message-id shape; any other correlation id is left
     * for the bus to replace.
     */
    public Envelope fromRequest(JsonRpcRequest request, String impliedFrom) {
        Map<String, Object> params = request.params() == null ? Map.of() : request.params();
        Long createdAt = readInstantMs(params.get(TIMESTAMP));
        String messageId = request.id() instanceof String candidate && MessageBus.isMessageId(candidate)
                ? candidate
                : null;
        return Envelope.builder()
                .id(messageId)
                .from(impliedFrom)
                .to(readString(params.get(TO_AGENT_ID)))
                .kind(MessageKind.fromMethod(request.method()))
                .content(readString(params.get(CONTENT)))
                .payload(readMap(params.get(PAYLOAD)))
                .createdAtMs(createdAt == null ? 0L : createdAt)
                .expiresAtMs(readInstantMs(params.get(EXPIRES_AT)))
                .priority(Priority.tryParse(readString(params.get(PRIORITY))).orElse(Priority.NORMAL))
                .transactionRef(readString(params.get(TRANSACTION_HASH)))
                .inResponseTo(readString(params.get(RESPONSE_TO)))
                .metadata(readMap(params.get(METADATA)))
                .build();
    }

    public JsonRpcResponse dispatch(JsonRpcRequest request, String fromAgent) {
        if (request == null) {
            return JsonRpcResponse.failure(null, JsonRpcErrorCodes.INVALID_REQUEST, "Invalid Request");
        }
        Object id = request.id();
        if (!JsonRpcRequest.VERSION.equals(request.jsonrpc()) || request.method() == null || request.method().isBlank()) {
            return JsonRpcResponse.failure(id, JsonRpcErrorCodes.INVALID_REQUEST, "Invalid Request");
        }
        try {
            return switch (request.method()) {
                case "ping" -> JsonRpcResponse.success(id, pong());
                case "capability_query" -> capabilityQuery(id, params(request));
                case METHOD_GET_AGENT_CARD -> agentCard(id, params(request));
                case METHOD_FIND_AGENTS_BY_SERVICE -> findAgentsByService(id, params(request));
                case "service_request", "task_delegation", "payment_request" -> forward(request, fromAgent);
                case METHOD_LIST_PENDING_MESSAGES -> listPending(id, fromAgent);
                case METHOD_ACKNOWLEDGE_MESSAGE -> acknowledge(id, params(request), fromAgent);
                case METHOD_DELEGATE_TASK -> delegateTask(id, params(request), fromAgent);
                case METHOD_COMPLETE_TASK -> completeTask(id, params(request), fromAgent);
                case METHOD_GET_TASKS -> getTasks(id, params(request), fromAgent);
                case METHOD_TOP_AGENTS -> topAgents(id, params(request));
                default -> JsonRpcResponse.failure(id, JsonRpcErrorCodes.METHOD_NOT_FOUND,
                        "Method not found: " + request.method());
            };
        } catch (RuntimeException e) {
            log.error("Dispatch of {} from {} failed", request.method(), fromAgent, e);
            return JsonRpcResponse.failure(id, JsonRpcErrorCodes.INTERNAL_ERROR, "Internal error: " + e.getMessage());
        }
    }

    private Map<String, Object> pong() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "pong");
        result.put(TIMESTAMP, clock.instant().toString());
        return result;
    }

    private JsonRpcResponse capabilityQuery(Object id, Map<String, Object> params) {
        String agentId = readString(params.get(TO_AGENT_ID));
        AgentCapabilities caps = agentId == null ? null : capabilities.lookup(agentId).orElse(null);
        if (caps == null) {
            return agentNotFound(id, agentId);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("agent_id", agentId);
        result.put("services", caps.services());
        result.put("skills", caps.skills());
        result.put("pricing", caps.pricing());
        result.put("status", caps.status().wireName());
        result.put("reputation", reputation.score(agentId));
        result.put("max_concurrent_tasks", caps.maxConcurrentTasks());
        result.put("active_tasks", caps.activeTasks());
        return JsonRpcResponse.success(id, result);
    }

    private JsonRpcResponse agentCard(Object id, Map<String, Object> params) {
        String agentId = readString(params.get("agent_id"));
        if (agentId == null) {
            agentId = readString(params.get(TO_AGENT_ID));
        }
        AgentCapabilities caps = agentId == null ? null : capabilities.lookup(agentId).orElse(null);
        if (caps == null) {
            return agentNotFound(id, agentId);
        }
        IdentityResolution identity = identities.resolve(agentId);
        String displayName = identity == null ? null : identity.displayName();
        return JsonRpcResponse.success(id, cards.build(agentId, displayName, caps, reputation.score(agentId)));
    }

    private JsonRpcResponse findAgentsByService(Object id, Map<String, Object> params) {
        String service = readString(params.get("service"));
        if (service == null || service.isBlank()) {
            return invalidParams(id, "service is required");
        }
        List<String> agentIds = capabilities.findByService(service);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("service", service);
        result.put("agent_ids", agentIds);
        return JsonRpcResponse.success(id, result);
    }

    private JsonRpcResponse forward(JsonRpcRequest request, String fromAgent) {
        Envelope envelope = fromRequest(request, fromAgent);
        BusResult<Envelope> sent = bus.send(envelope);
        if (sent.isError()) {
            return domainFailure(request.id(), JsonRpcErrorCodes.INTERNAL_ERROR, sent.error());
        }
        Envelope delivered = sent.value();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message_id", delivered.id());
        result.put("status", "sent");
        result.put(TIMESTAMP, Instant.ofEpochMilli(delivered.createdAtMs()).toString());
        return JsonRpcResponse.success(request.id(), result);
    }

    private JsonRpcResponse listPending(Object id, String fromAgent) {
        if (fromAgent == null || fromAgent.isBlank()) {
            return senderRequired(id);
        }
        List<Map<String, Object>> messages = new ArrayList<>();
        for (Envelope envelope : bus.listPending(fromAgent)) {
            messages.add(describeEnvelope(envelope));
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("agent_id", fromAgent);
        result.put("count", messages.size());
        result.put("messages", messages);
        return JsonRpcResponse.success(id, result);
    }

    private JsonRpcResponse acknowledge(Object id, Map<String, Object> params, String fromAgent) {
        if (fromAgent == null || fromAgent.isBlank()) {
            return senderRequired(id);
        }
        String messageId = readString(params.get("message_id"));
        if (messageId == null || messageId.isBlank()) {
            return invalidParams(id, "message_id is required");
        }
        BusResult<Envelope> removed = bus.acknowledge(fromAgent, messageId);
        if (removed.isError()) {
            return domainFailure(id, JsonRpcErrorCodes.MESSAGE_NOT_FOUND, removed.error());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message_id", messageId);
        result.put("status", "acknowledged");
        return JsonRpcResponse.success(id, result);
    }

    private JsonRpcResponse delegateTask(Object id, Map<String, Object> params, String fromAgent) {
        String toAgent = readString(params.get(TO_AGENT_ID));
        String name = readString(params.get("task_name"));
        if (toAgent == null || toAgent.isBlank() || name == null || name.isBlank()) {
            return invalidParams(id, "to_agent_id and task_name are required");
        }
        BusResult<DelegatedTask> delegated = tasks.delegate(
                fromAgent,
                toAgent,
                name,
                readString(params.get("task_description")),
                readMap(params.get("task_parameters")),
                readStringList(params.get("required_capabilities"))
        );
        if (delegated.isError()) {
            return domainFailure(id, JsonRpcErrorCodes.INTERNAL_ERROR, delegated.error());
        }
        return JsonRpcResponse.success(id, describeTask(delegated.value()));
    }

    private JsonRpcResponse completeTask(Object id, Map<String, Object> params, String fromAgent) {
        String taskId = readString(params.get("task_id"));
        if (taskId == null || taskId.isBlank()) {
            return invalidParams(id, "task_id is required");
        }
        BusResult<DelegatedTask> current = tasks.query(taskId);
        if (current.isError() || fromAgent == null || !fromAgent.equals(current.value().toAgent())) {
            return taskNotFound(id, taskId);
        }
        BusResult<DelegatedTask> completed = tasks.complete(
                taskId,
                readMap(params.get("result_data")),
                readString(params.get("completion_notes"))
        );
        if (completed.isError()) {
            int code = completed.error().kind() == ErrorKind.NOT_FOUND
                    ? JsonRpcErrorCodes.TASK_NOT_FOUND
                    : JsonRpcErrorCodes.INTERNAL_ERROR;
            return domainFailure(id, code, completed.error());
        }
        return JsonRpcResponse.success(id, describeTask(completed.value()));
    }

    private JsonRpcResponse getTasks(Object id, Map<String, Object> params, String fromAgent) {
        if (fromAgent == null || fromAgent.isBlank()) {
            return senderRequired(id);
        }
        String taskId = readString(params.get("task_id"));
        if (taskId != null && !taskId.isBlank()) {
            BusResult<DelegatedTask> found = tasks.query(taskId);
            if (found.isError() || !found.value().involves(fromAgent)) {
                return taskNotFound(id, taskId);
            }
            return JsonRpcResponse.success(id, describeTask(found.value()));
        }
        TaskStatus filter;
        try {
            filter = TaskStatus.fromString(readString(params.get("status")));
        } catch (IllegalArgumentException e) {
            return invalidParams(id, e.getMessage());
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (DelegatedTask task : tasks.queryByAgent(fromAgent, filter)) {
            rows.add(describeTask(task));
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("agent_id", fromAgent);
        result.put("count", rows.size());
        result.put("tasks", rows);
        return JsonRpcResponse.success(id, result);
    }

    private JsonRpcResponse topAgents(Object id, Map<String, Object> params) {
        Object rawLimit = params.get("limit");
        int limit = DEFAULT_TOP_AGENTS;
        if (rawLimit != null) {
            if (!(rawLimit instanceof Number number) || number.intValue() < 1) {
                return invalidParams(id, "limit must be a positive integer");
            }
            limit = Math.min(MAX_TOP_AGENTS, number.intValue());
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (ReputationRanking ranking : reputation.topAgents(limit)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("rank", ranking.rank());
            row.put("agent_id", ranking.agentId());
            row.put("reputation", ranking.score());
            rows.add(row);
        }
        return JsonRpcResponse.success(id, Map.of("agents", rows));
    }

    private Map<String, Object> describeEnvelope(Envelope envelope) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("message_id", envelope.id());
        row.put("method", envelope.kind().method());
        row.putAll(toRequest(envelope).params());
        return row;
    }

    private static Map<String, Object> describeTask(DelegatedTask task) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("task_id", task.taskId());
        row.put(FROM_AGENT_ID, task.fromAgent());
        row.put(TO_AGENT_ID, task.toAgent());
        row.put("linked_message_id", task.linkedMessageId());
        row.put("task_name", task.name());
        row.put("task_description", task.description());
        row.put("task_parameters", task.parameters());
        row.put("required_capabilities", task.requiredCapabilities());
        row.put("status", task.status().name());
        row.put("created_at", Instant.ofEpochMilli(task.createdAtMs()).toString());
        row.put("updated_at", Instant.ofEpochMilli(task.updatedAtMs()).toString());
        if (task.completedAtMs() != null) {
            row.put("completed_at", Instant.ofEpochMilli(task.completedAtMs()).toString());
        }
        if (task.completionNotes() != null) {
            row.put("completion_notes", task.completionNotes());
        }
        row.put("result_data", task.resultData());
        return row;
    }

    private static JsonRpcResponse domainFailure(Object id, int code, BusError error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("kind", error.kind().name());
        return JsonRpcResponse.failure(id, new JsonRpcError(code, error.message(), data));
    }

    private static JsonRpcResponse senderRequired(Object id) {
        return JsonRpcResponse.failure(id, JsonRpcErrorCodes.INVALID_REQUEST, "Invalid Request: sender agent id is required");
    }

    private static JsonRpcResponse invalidParams(Object id, String detail) {
        return JsonRpcResponse.failure(id, JsonRpcErrorCodes.INVALID_PARAMS, "Invalid params: " + detail);
    }

    private static JsonRpcResponse taskNotFound(Object id, String taskId) {
        return JsonRpcResponse.failure(id, JsonRpcErrorCodes.TASK_NOT_FOUND, "Task " + taskId + " not found");
    }

    private static JsonRpcResponse agentNotFound(Object id, String agentId) {
        return JsonRpcResponse.failure(id, JsonRpcErrorCodes.AGENT_NOT_FOUND, "Agent " + agentId + " not found");
    }

    private static Map<String, Object> params(JsonRpcRequest request) {
        return request.params() == null ? Map.of() : request.params();
    }

    private static String readString(Object raw) {
        if (raw == null) {
            return null;
        }
        return raw instanceof String s ? s : String.valueOf(raw);
    }

    private static List<String> readStringList(Object raw) {
        if (!(raw instanceof List<?> source)) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (Object value : source) {
            if (value != null) {
                out.add(String.valueOf(value));
            }
        }
        return out;
    }

    private static Map<String, Object> readMap(Object raw) {
        if (!(raw instanceof Map<?, ?> source)) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (entry.getKey() != null) {
                out.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return out;
    }

    private static Long readInstantMs(Object raw) {
        if (raw instanceof Number number) {
            return number.longValue();
        }
        if (!(raw instanceof String text) || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text.trim()).toEpochMilli();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable instant '{}'", text);
            return null;
        }
    }
}

package io.agentrelay.task;

import io.agentrelay.agent.AgentChecks;
import io.agentrelay.agent.IdentityValidator;
import io.agentrelay.bus.MessageBus;
import io.agentrelay.model.BusError;
import io.agentrelay.model.BusResult;
import io.agentrelay.model.DelegatedTask;
import io.agentrelay.model.Envelope;
import io.agentrelay.model.ErrorKind;
import io.agentrelay.model.MessageKind;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.reputation.ReputationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Delegation state machine layered over the message bus.
 *
 * <p>A task is committed only after its delegation envelope was accepted by the bus. Each
 * transition is applied atomically per task; notification envelopes and reputation calls run
 * after the transition is committed and never undo it.
 */
public final class TaskLedger {
    private static final Logger log = LoggerFactory.getLogger(TaskLedger.class);
    public static final long DEFAULT_COMPLETION_REWARD = 10L;
    public static final long DEFAULT_FAILURE_PENALTY = 5L;

    private final MessageBus bus;
    private final IdentityValidator identities;
    private final ReputationService reputation;
    private final Clock clock;
    private final ConcurrentMap<String, DelegatedTask> tasks = new ConcurrentHashMap<>();
    private volatile long completionReward = DEFAULT_COMPLETION_REWARD;
    private volatile long failurePenalty = DEFAULT_FAILURE_PENALTY;

    public TaskLedger(MessageBus bus, IdentityValidator identities, ReputationService reputation, Clock clock) {
        this.bus = bus;
        this.identities = identities;
        this.reputation = reputation;
        this.clock = clock;
    }

    public void reputationPolicy(long completionReward, long failurePenalty) {
        this.completionReward = Math.max(0L, completionReward);
        this.failurePenalty = Math.max(0L, failurePenalty);
    }

    public BusResult<DelegatedTask> delegate(
            String fromAgentId,
            String toAgentId,
            String name,
            String description,
            Map<String, Object> parameters,
            List<String> requiredCapabilities
    ) {
        BusError senderError = AgentChecks.requireAgent(identities, fromAgentId, "Sender");
        if (senderError != null) {
            return BusResult.fail(senderError);
        }
        BusError recipientError = AgentChecks.requireAgent(identities, toAgentId, "Recipient");
        if (recipientError != null) {
            return BusResult.fail(recipientError);
        }

        String taskId = "tsk_" + UUID.randomUUID();
        String messageId = "msg_" + UUID.randomUUID();
        long nowMs = clock.millis();
        DelegatedTask task = DelegatedTask.pending(
                taskId,
                fromAgentId,
                toAgentId,
                messageId,
                name,
                description,
                parameters,
                requiredCapabilities,
                nowMs
        );

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", taskId);
        payload.put("task_name", name);
        payload.put("task_description", description);
        payload.put("task_parameters", task.parameters());
        payload.put("required_capabilities", task.requiredCapabilities());
        Envelope delegation = Envelope.builder()
                .id(messageId)
                .from(fromAgentId)
                .to(toAgentId)
                .kind(MessageKind.TASK_DELEGATION)
                .content(description)
                .payload(payload)
                .createdAtMs(nowMs)
                .build();

        BusResult<Envelope> sent = bus.send(delegation);
        if (sent.isError()) {
            return BusResult.fail(sent.error().kind(),
                    "Failed to send task delegation message: " + sent.error().message());
        }
        tasks.put(taskId, task);
        log.info("Task '{}' {} delegated from agent {} to agent {}", name, taskId, fromAgentId, toAgentId);
        return BusResult.ok(task);
    }

    public BusResult<DelegatedTask> accept(String taskId) {
        BusResult<DelegatedTask> moved = transition(taskId, TaskStatus.IN_PROGRESS, null,
                current -> current.transitioned(TaskStatus.IN_PROGRESS, clock.millis()));
        if (moved.success()) {
            DelegatedTask task = moved.value();
            notifyParty(task.toAgent(), task.fromAgent(), MessageKind.TASK_ACCEPTANCE,
                    "Task '" + task.name() + "' accepted", taskPayload(task));
        }
        return moved;
    }

    public BusResult<DelegatedTask> reject(String taskId, String reason) {
        BusResult<DelegatedTask> moved = transition(taskId, TaskStatus.CANCELLED, TaskStatus.PENDING,
                task -> task.finished(TaskStatus.CANCELLED, clock.millis(), reason, task.resultData()));
        if (moved.success()) {
            DelegatedTask task = moved.value();
            Map<String, Object> payload = taskPayload(task);
            payload.put("reason", reason == null ? "" : reason);
            notifyParty(task.toAgent(), task.fromAgent(), MessageKind.TASK_REJECTION,
                    "Task '" + task.name() + "' rejected", payload);
        }
        return moved;
    }

    public BusResult<DelegatedTask> update(String taskId, String progressNotes, Map<String, Object> progressData) {
        AtomicReference<BusError> failure = new AtomicReference<>();
        DelegatedTask updated = tasks.computeIfPresent(taskId, (id, current) -> {
            if (current.status() != TaskStatus.IN_PROGRESS) {
                failure.set(BusError.of(ErrorKind.INVALID_TRANSITION,
                        "Task " + id + " is " + current.status() + ", updates require IN_PROGRESS"));
                return current;
            }
            return current.transitioned(TaskStatus.IN_PROGRESS, clock.millis());
        });
        if (updated == null) {
            return notFound(taskId);
        }
        if (failure.get() != null) {
            return BusResult.fail(failure.get());
        }
        Map<String, Object> payload = taskPayload(updated);
        payload.put("progress_notes", progressNotes == null ? "" : progressNotes);
        payload.put("progress_data", progressData == null ? Map.of() : progressData);
        notifyParty(updated.toAgent(), updated.fromAgent(), MessageKind.TASK_UPDATE,
                "Task '" + updated.name() + "' progress update", payload);
        return BusResult.ok(updated);
    }

    public BusResult<DelegatedTask> complete(String taskId, Map<String, Object> resultData, String completionNotes) {
        BusResult<DelegatedTask> moved = transition(taskId, TaskStatus.COMPLETED, null,
                current -> current.finished(TaskStatus.COMPLETED, clock.millis(), completionNotes, resultData));
        if (moved.isError()) {
            return moved;
        }
        DelegatedTask task = moved.value();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", task.taskId());
        payload.put("task_name", task.name());
        payload.put("completion_notes", completionNotes == null ? "" : completionNotes);
        payload.put("result_data", task.resultData());
        notifyParty(task.toAgent(), task.fromAgent(), MessageKind.TASK_COMPLETION,
                "Task '" + task.name() + "' completed", payload);

        adjustReputation(task, true, "Completed service: " + task.name() + " (Task: " + task.taskId() + ")");
        log.info("Task {} completed by agent {}", task.taskId(), task.toAgent());
        return moved;
    }

    public BusResult<DelegatedTask> fail(String taskId, String reason) {
        BusResult<DelegatedTask> moved = transition(taskId, TaskStatus.FAILED, TaskStatus.IN_PROGRESS,
                task -> task.finished(TaskStatus.FAILED, clock.millis(), reason, task.resultData()));
        if (moved.isError()) {
            return moved;
        }
        DelegatedTask task = moved.value();
        Map<String, Object> payload = taskPayload(task);
        payload.put("reason", reason == null ? "" : reason);
        notifyParty(task.toAgent(), task.fromAgent(), MessageKind.TASK_UPDATE,
                "Task '" + task.name() + "' failed", payload);
        adjustReputation(task, false, "Service failure: " + reason + " (Task: " + task.taskId() + ")");
        log.warn("Task {} failed at agent {}: {}", task.taskId(), task.toAgent(), reason);
        return moved;
    }

    public BusResult<DelegatedTask> cancel(String taskId, String reason) {
        BusResult<DelegatedTask> moved = transition(taskId, TaskStatus.CANCELLED, null,
                current -> current.finished(TaskStatus.CANCELLED, clock.millis(), reason, current.resultData()));
        if (moved.success()) {
            DelegatedTask task = moved.value();
            Map<String, Object> payload = taskPayload(task);
            payload.put("reason", reason == null ? "" : reason);
            notifyParty(task.fromAgent(), task.toAgent(), MessageKind.TASK_UPDATE,
                    "Task '" + task.name() + "' cancelled", payload);
        }
        return moved;
    }

    public BusResult<DelegatedTask> query(String taskId) {
        DelegatedTask task = taskId == null ? null : tasks.get(taskId);
        if (task == null) {
            return notFound(taskId);
        }
        return BusResult.ok(task);
    }

    public List<DelegatedTask> queryByAgent(String agentId, TaskStatus statusFilter) {
        List<DelegatedTask> out = new ArrayList<>();
        for (DelegatedTask task : tasks.values()) {
            if (task.involves(agentId) && (statusFilter == null || task.status() == statusFilter)) {
                out.add(task);
            }
        }
        out.sort(Comparator.comparingLong(DelegatedTask::createdAtMs).thenComparing(DelegatedTask::taskId));
        return out;
    }

    public int size() {
        return tasks.size();
    }

    private BusResult<DelegatedTask> transition(
            String taskId,
            TaskStatus next,
            TaskStatus requiredCurrent,
            UnaryOperator<DelegatedTask> mutation
    ) {
        if (taskId == null) {
            return notFound(null);
        }
        AtomicReference<BusError> failure = new AtomicReference<>();
        DelegatedTask updated = tasks.computeIfPresent(taskId, (id, current) -> {
            boolean allowed = current.status().canTransitionTo(next)
                    && (requiredCurrent == null || current.status() == requiredCurrent);
            if (!allowed) {
                failure.set(BusError.of(ErrorKind.INVALID_TRANSITION,
                        "Task " + id + " cannot move from " + current.status() + " to " + next));
                return current;
            }
            return mutation.apply(current);
        });
        if (updated == null) {
            return notFound(taskId);
        }
        if (failure.get() != null) {
            return BusResult.fail(failure.get());
        }
        return BusResult.ok(updated);
    }

    private void notifyParty(String fromAgent, String toAgent, MessageKind kind, String content, Map<String, Object> payload) {
        try {
            BusResult<Envelope> sent = bus.send(Envelope.builder()
                    .from(fromAgent)
                    .to(toAgent)
                    .kind(kind)
                    .content(content)
                    .payload(payload)
                    .build());
            if (sent.isError()) {
                log.warn("Task state changed but failed to send {} notification: {}", kind.displayName(), sent.error().message());
            }
        } catch (RuntimeException e) {
            log.warn("Task state changed but {} notification to {} threw: {}", kind.displayName(), toAgent, e.getMessage());
        }
    }

    private void adjustReputation(DelegatedTask task, boolean success, String reason) {
        try {
            BusResult<Long> outcome = success
                    ? reputation.award(task.toAgent(), completionReward, reason, task.taskId())
                    : reputation.deduct(task.toAgent(), failurePenalty, reason, task.taskId());
            if (outcome.isError()) {
                log.warn("Reputation update for agent {} failed: {}", task.toAgent(), outcome.error().message());
            }
        } catch (RuntimeException e) {
            log.warn("Reputation update for agent {} failed: {}", task.toAgent(), e.getMessage());
        }
    }

    private static Map<String, Object> taskPayload(DelegatedTask task) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", task.taskId());
        payload.put("task_name", task.name());
        payload.put("status", task.status().name());
        return payload;
    }

    private static BusResult<DelegatedTask> notFound(String taskId) {
        return BusResult.fail(ErrorKind.NOT_FOUND, "Task " + taskId + " not found");
    }
}

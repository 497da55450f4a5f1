package io.agentrelay.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Tracking record for a delegation. Transitions produce a new instance; the ledger swaps it in
 * atomically.
 */
public record DelegatedTask(
        String taskId,
        String fromAgent,
        String toAgent,
        String linkedMessageId,
        String name,
        String description,
        Map<String, Object> parameters,
        List<String> requiredCapabilities,
        TaskStatus status,
        long createdAtMs,
        long updatedAtMs,
        Long completedAtMs,
        String completionNotes,
        Map<String, Object> resultData
) {
    public DelegatedTask {
        parameters = copyOf(parameters);
        requiredCapabilities = distinctNames(requiredCapabilities);
        resultData = copyOf(resultData);
    }

    public static DelegatedTask pending(
            String taskId,
            String fromAgent,
            String toAgent,
            String linkedMessageId,
            String name,
            String description,
            Map<String, Object> parameters,
            List<String> requiredCapabilities,
            long nowMs
    ) {
        return new DelegatedTask(
                taskId,
                fromAgent,
                toAgent,
                linkedMessageId,
                name,
                description,
                parameters,
                requiredCapabilities,
                TaskStatus.PENDING,
                nowMs,
                nowMs,
                null,
                null,
                Map.of()
        );
    }

    public boolean involves(String agentId) {
        return agentId != null && (agentId.equals(fromAgent) || agentId.equals(toAgent));
    }

    public DelegatedTask transitioned(TaskStatus next, long nowMs) {
        return new DelegatedTask(
                taskId,
                fromAgent,
                toAgent,
                linkedMessageId,
                name,
                description,
                parameters,
                requiredCapabilities,
                next,
                createdAtMs,
                nowMs,
                completedAtMs,
                completionNotes,
                resultData
        );
    }

    public DelegatedTask finished(TaskStatus terminal, long nowMs, String notes, Map<String, Object> result) {
        return new DelegatedTask(
                taskId,
                fromAgent,
                toAgent,
                linkedMessageId,
                name,
                description,
                parameters,
                requiredCapabilities,
                terminal,
                createdAtMs,
                nowMs,
                nowMs,
                notes,
                result
        );
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static List<String> distinctNames(List<String> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> names = new LinkedHashSet<>();
        for (String name : source) {
            if (name != null && !name.isBlank()) {
                names.add(name.trim());
            }
        }
        return List.copyOf(names);
    }
}

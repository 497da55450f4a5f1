package io.agentrelay.agent;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

public record AgentCapabilities(
        List<String> services,
        List<String> skills,
        Map<String, BigDecimal> pricing,
        AgentAvailability status,
        int maxConcurrentTasks,
        int activeTasks,
        String description,
        Map<String, Object> metadata
) {
    public AgentCapabilities {
        services = distinctNames(services);
        skills = distinctNames(skills);
        pricing = pricing == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(pricing));
        status = status == null ? AgentAvailability.AVAILABLE : status;
        maxConcurrentTasks = Math.max(1, maxConcurrentTasks);
        activeTasks = Math.max(0, activeTasks);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static AgentCapabilities of(List<String> services, List<String> skills) {
        return new AgentCapabilities(services, skills, Map.of(), AgentAvailability.AVAILABLE, 1, 0, null, Map.of());
    }

    public boolean hasCapacity() {
        return status == AgentAvailability.AVAILABLE && activeTasks < maxConcurrentTasks;
    }

    public boolean hasSkill(String skill) {
        if (skill == null) {
            return false;
        }
        for (String candidate : skills) {
            if (candidate.equalsIgnoreCase(skill)) {
                return true;
            }
        }
        return false;
    }

    public AgentCapabilities withStatus(AgentAvailability next) {
        return new AgentCapabilities(services, skills, pricing, next, maxConcurrentTasks, activeTasks, description, metadata);
    }

    public AgentCapabilities withActiveTasks(int next) {
        return new AgentCapabilities(services, skills, pricing, status, maxConcurrentTasks, next, description, metadata);
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

package com.medicalcor.crm.routing.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a worker as held by the agent directory. Mutations produce a new instance.
 */
public record AgentProfile(
        String agentId,
        String name,
        String email,
        String phone,
        String role,
        AgentAvailability availability,
        List<AgentSkill> skills,
        List<String> languages,
        int currentTaskCount,
        int maxConcurrentTasks,
        String teamId,
        Instant createdAt,
        Instant updatedAt
) {
    public AgentProfile {
        if (availability == null) availability = AgentAvailability.OFFLINE;
        skills = skills == null ? List.of() : List.copyOf(skills);
        languages = languages == null ? List.of() : List.copyOf(languages);
        currentTaskCount = Math.max(0, currentTaskCount);
        maxConcurrentTasks = Math.max(1, maxConcurrentTasks);
    }

    /**
     * Active entry for a skill. Inactive entries are never returned.
     */
    public Optional<AgentSkill> activeSkill(String skillId) {
        if (skillId == null) return Optional.empty();
        return skills.stream()
                .filter(s -> s.active() && skillId.equals(s.skillId()))
                .findFirst();
    }

    public boolean isAvailable() {
        return availability == AgentAvailability.AVAILABLE;
    }

    public boolean hasCapacity() {
        return currentTaskCount < maxConcurrentTasks;
    }

    public double loadRatio() {
        return (double) currentTaskCount / maxConcurrentTasks;
    }

    public boolean speaks(String language) {
        if (language == null || language.isBlank()) return true;
        return languages.stream().anyMatch(l -> l.equalsIgnoreCase(language));
    }

    public AgentProfile withAvailability(AgentAvailability value, Instant now) {
        return new AgentProfile(agentId, name, email, phone, role, value, skills, languages,
                currentTaskCount, maxConcurrentTasks, teamId, createdAt, now);
    }

    public AgentProfile withTaskCount(int value, Instant now) {
        return new AgentProfile(agentId, name, email, phone, role, availability, skills, languages,
                value, maxConcurrentTasks, teamId, createdAt, now);
    }
}

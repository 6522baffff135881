package com.medicalcor.crm.routing.model;

import java.time.Instant;
import java.util.List;

public record AgentMatchScore(
        String agentId,
        String agentName,
        double totalScore,
        double skillScore,
        double loadRatio,
        int currentTaskCount,
        int primarySkillLevel,
        Instant updatedAt,
        List<String> adjustments
) {
    public AgentMatchScore {
        adjustments = adjustments == null ? List.of() : List.copyOf(adjustments);
    }
}

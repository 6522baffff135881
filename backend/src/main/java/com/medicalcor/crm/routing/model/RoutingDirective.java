package com.medicalcor.crm.routing.model;

import java.util.List;

public record RoutingDirective(
        RoutingStrategy strategy,
        List<SkillRequirement> skillRequirements,
        FallbackBehavior fallbackBehavior,
        int maxQueueTimeSeconds
) {
    public RoutingDirective {
        if (strategy == null) strategy = RoutingStrategy.BEST_MATCH;
        skillRequirements = skillRequirements == null ? List.of() : List.copyOf(skillRequirements);
        if (fallbackBehavior == null) fallbackBehavior = FallbackBehavior.QUEUE;
        maxQueueTimeSeconds = Math.max(0, maxQueueTimeSeconds);
    }
}

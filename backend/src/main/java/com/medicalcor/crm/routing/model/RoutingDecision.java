package com.medicalcor.crm.routing.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one routing request. Immutable; auditing is left to whoever consumes the published decision.
 */
public record RoutingDecision(
        String decisionId,
        String taskId,
        RoutingOutcome outcome,
        String selectedAgentId,
        Double matchScore,
        String reasoning,
        String appliedRuleId,
        String appliedRuleName,
        RoutingStrategy strategy,
        String queueId,
        Integer queuePosition,
        Long estimatedWaitSeconds,
        List<AgentMatchScore> candidates,
        int fallbacksAttempted,
        long processingTimeMs,
        Instant timestamp
) {
    public RoutingDecision {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}

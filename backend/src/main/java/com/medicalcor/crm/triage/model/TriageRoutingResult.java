package com.medicalcor.crm.triage.model;

import com.medicalcor.crm.routing.model.RoutingContext;
import com.medicalcor.crm.routing.model.RoutingDecision;

/**
 * {@code routingDecision} is null for preview requests, which never reach the dispatcher.
 */
public record TriageRoutingResult(
        TriageResult triageResult,
        TaskSkillRequirements skillRequirements,
        RoutingContext routingContext,
        RoutingDecision routingDecision
) {
}

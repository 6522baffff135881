package com.medicalcor.crm.routing.service.strategy;

import com.medicalcor.crm.routing.model.AgentMatchScore;

import java.util.List;

public record SelectionContext(
        String scopeKey,
        String lastAgentId,
        List<AgentMatchScore> candidates
) {
}

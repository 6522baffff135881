package com.medicalcor.crm.routing.model;

import java.time.Instant;

public record RoutingRule(
        String ruleId,
        String name,
        int priority,
        boolean active,
        RoutingConditions conditions,
        RoutingDirective routing,
        Instant createdAt,
        Instant updatedAt
) {
    public RoutingRule {
        if (conditions == null) conditions = RoutingConditions.any();
        if (routing == null) routing = new RoutingDirective(null, null, null, 0);
    }
}

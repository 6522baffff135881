package com.medicalcor.crm.routing.api;

import com.medicalcor.crm.routing.model.RoutingConditions;
import com.medicalcor.crm.routing.model.RoutingDirective;
import jakarta.validation.constraints.NotBlank;

/**
 * A missing {@code rule_id} creates a new rule under a generated id.
 */
public record UpsertRoutingRuleRequest(
        String rule_id,
        @NotBlank(message = "name_required") String name,
        Integer priority,
        Boolean active,
        RoutingConditions conditions,
        RoutingDirective routing
) {
}

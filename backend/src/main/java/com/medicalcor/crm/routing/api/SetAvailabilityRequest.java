package com.medicalcor.crm.routing.api;

import com.medicalcor.crm.routing.model.AgentAvailability;
import jakarta.validation.constraints.NotNull;

public record SetAvailabilityRequest(
        @NotNull(message = "availability_required") AgentAvailability availability
) {
}

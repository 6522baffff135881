package com.medicalcor.crm.routing.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record SetTaskCountRequest(
        @NotNull(message = "current_task_count_required")
        @Min(value = 0, message = "invalid_current_task_count") Integer current_task_count
) {
}

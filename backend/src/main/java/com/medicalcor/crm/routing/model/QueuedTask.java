package com.medicalcor.crm.routing.model;

import java.time.Instant;

public record QueuedTask(
        String taskId,
        String queueId,
        int priority,
        Instant enqueuedAt,
        RoutingContext context
) {
}

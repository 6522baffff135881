package com.medicalcor.crm.routing.api;

import com.medicalcor.crm.routing.model.QueuedTask;

import java.util.List;

public record QueueSummary(
        String queue_id,
        int length,
        long estimated_wait_seconds,
        List<QueuedTask> tasks
) {
}

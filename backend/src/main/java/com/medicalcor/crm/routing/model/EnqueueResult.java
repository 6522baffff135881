package com.medicalcor.crm.routing.model;

public record EnqueueResult(String queueId, int position) {
}

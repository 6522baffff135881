package com.medicalcor.crm.routing.api;

public record TaskPositionResponse(String task_id, int position) {
}

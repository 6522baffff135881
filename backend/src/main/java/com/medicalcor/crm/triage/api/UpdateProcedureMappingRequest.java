package com.medicalcor.crm.triage.api;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record UpdateProcedureMappingRequest(
        @NotNull(message = "skills_required") List<String> skills
) {
}

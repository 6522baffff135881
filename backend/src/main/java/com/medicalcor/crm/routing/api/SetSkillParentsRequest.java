package com.medicalcor.crm.routing.api;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record SetSkillParentsRequest(
        @NotNull(message = "parent_skill_ids_required") List<String> parent_skill_ids
) {
}

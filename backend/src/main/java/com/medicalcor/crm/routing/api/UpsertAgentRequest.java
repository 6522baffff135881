package com.medicalcor.crm.routing.api;

import com.medicalcor.crm.routing.model.AgentAvailability;
import com.medicalcor.crm.routing.model.AgentSkill;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record UpsertAgentRequest(
        @NotBlank(message = "agent_id_required") String agent_id,
        @NotBlank(message = "name_required") String name,
        String email,
        String phone,
        String role,
        AgentAvailability availability,
        List<AgentSkill> skills,
        List<String> languages,
        @Min(value = 0, message = "invalid_current_task_count") Integer current_task_count,
        @Min(value = 1, message = "invalid_max_concurrent_tasks") Integer max_concurrent_tasks,
        String team_id
) {
}

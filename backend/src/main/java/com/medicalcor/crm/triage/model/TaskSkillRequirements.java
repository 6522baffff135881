package com.medicalcor.crm.triage.model;

import com.medicalcor.crm.routing.model.SkillRequirement;

import java.util.List;

public record TaskSkillRequirements(
        List<SkillRequirement> requiredSkills,
        List<SkillRequirement> preferredSkills,
        List<String> preferAgentIds
) {
    public TaskSkillRequirements {
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        preferredSkills = preferredSkills == null ? List.of() : List.copyOf(preferredSkills);
        preferAgentIds = preferAgentIds == null ? List.of() : List.copyOf(preferAgentIds);
    }
}

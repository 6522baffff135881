package com.medicalcor.crm.routing.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Effective matching constraints for one routing attempt: the request merged with the applied rule, if any.
 */
public record TaskRequirements(
        List<SkillRequirement> requiredSkills,
        List<SkillRequirement> preferredSkills,
        List<String> preferAgentIds,
        List<String> excludeAgentIds,
        String teamId,
        String requiredLanguage,
        List<String> preferredLanguages
) {
    public TaskRequirements {
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        preferredSkills = preferredSkills == null ? List.of() : List.copyOf(preferredSkills);
        preferAgentIds = preferAgentIds == null ? List.of() : List.copyOf(preferAgentIds);
        excludeAgentIds = excludeAgentIds == null ? List.of() : List.copyOf(excludeAgentIds);
        preferredLanguages = preferredLanguages == null ? List.of() : List.copyOf(preferredLanguages);
    }

    public static TaskRequirements of(RoutingContext context, RoutingRule rule) {
        var required = new ArrayList<SkillRequirement>(context.requiredSkills());
        if (rule != null) {
            for (var r : rule.routing().skillRequirements()) {
                required.add(SkillRequirement.required(r.skillId(), r.minimumProficiency()));
            }
        }
        return new TaskRequirements(
                required,
                context.preferredSkills(),
                context.preferAgentIds(),
                context.excludeAgentIds(),
                context.teamId(),
                context.requiredLanguage(),
                context.preferredLanguages()
        );
    }

    /**
     * Relaxed variant used by the {@code reassign} fallback: team scope widened to every team, each required
     * skill accepted one proficiency level lower, preferred-skill bonuses dropped. Exclusions and the required
     * language still apply.
     */
    public TaskRequirements relaxed() {
        var downgraded = requiredSkills.stream()
                .map(r -> r.withMinimum(r.minimumProficiency().downgrade()))
                .toList();
        return new TaskRequirements(
                downgraded,
                List.of(),
                preferAgentIds,
                excludeAgentIds,
                null,
                requiredLanguage,
                preferredLanguages
        );
    }

    public SkillRequirement primarySkill() {
        return requiredSkills.isEmpty() ? null : requiredSkills.get(0);
    }
}

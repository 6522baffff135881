package com.medicalcor.crm.triage.model;

import com.medicalcor.crm.routing.model.Proficiency;

import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of the triage mapping tables.
 */
public record TriageRoutingConfig(
        Map<String, List<String>> procedureSkills,
        Map<String, Integer> urgencyPriority,
        Map<String, Integer> leadScoreBoost,
        Map<String, Integer> slaMinutes,
        int defaultSlaMinutes,
        String vipSkillId,
        String escalationSkillId,
        Proficiency defaultProficiency,
        boolean useSuggestedOwnerAsPreference
) {
}

package com.medicalcor.crm.triage.service;

import com.medicalcor.crm.routing.model.Proficiency;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapping tables that turn a triage result into a routing request. Procedure keys are matched case-insensitively.
 */
@ConfigurationProperties(prefix = "app.routing.triage")
public record TriageRoutingProperties(
        Map<String, Integer> urgencyPriority,
        Map<String, Integer> leadScoreBoost,
        Map<String, List<String>> procedureSkills,
        Map<String, Integer> slaMinutes,
        Integer defaultSlaMinutes,
        String vipSkillId,
        String escalationSkillId,
        Proficiency defaultProficiency,
        Boolean useSuggestedOwnerAsPreference
) {
    public TriageRoutingProperties {
        urgencyPriority = urgencyPriority != null ? rekey(urgencyPriority, false) : Map.of(
                "critical", 100,
                "high", 75,
                "normal", 50,
                "low", 25);
        leadScoreBoost = leadScoreBoost != null ? rekey(leadScoreBoost, true) : Map.of(
                "HOT", 20,
                "WARM", 10,
                "COLD", 0,
                "UNQUALIFIED", -10);
        if (procedureSkills == null) {
            var defaults = new LinkedHashMap<String, List<String>>();
            defaults.put("implant", List.of("procedure:implants"));
            defaults.put("all-on-x", List.of("procedure:all-on-x", "procedure:implants"));
            defaults.put("orthodontics", List.of("procedure:orthodontics"));
            defaults.put("whitening", List.of("procedure:cosmetic"));
            defaults.put("veneers", List.of("procedure:cosmetic"));
            defaults.put("general", List.of("procedure:general"));
            procedureSkills = defaults;
        }
        slaMinutes = slaMinutes != null ? rekey(slaMinutes, false) : Map.of(
                "next_available_slot", 15,
                "same_day", 60,
                "next_business_day", 480,
                "nurture_sequence", 1440);
        if (defaultSlaMinutes == null || defaultSlaMinutes <= 0) defaultSlaMinutes = 60;
        if (vipSkillId == null || vipSkillId.isBlank()) vipSkillId = "special:vip";
        if (escalationSkillId == null || escalationSkillId.isBlank()) escalationSkillId = "special:escalation";
        if (defaultProficiency == null) defaultProficiency = Proficiency.INTERMEDIATE;
        if (useSuggestedOwnerAsPreference == null) useSuggestedOwnerAsPreference = true;
    }

    public static TriageRoutingProperties defaults() {
        return new TriageRoutingProperties(null, null, null, null, null, null, null, null, null);
    }

    // property binding may not preserve key case
    private static Map<String, Integer> rekey(Map<String, Integer> source, boolean upper) {
        var out = new LinkedHashMap<String, Integer>();
        source.forEach((k, v) -> {
            if (k != null && v != null) {
                out.put(upper ? k.trim().toUpperCase() : k.trim().toLowerCase(), v);
            }
        });
        return Map.copyOf(out);
    }
}

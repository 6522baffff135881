package com.medicalcor.crm.triage.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Keyword tables for {@link KeywordTriageAssessor}. Keywords are matched as lower-case substrings.
 */
@ConfigurationProperties(prefix = "app.triage")
public record TriageProperties(
        List<String> priorityKeywords,
        List<String> emergencyKeywords,
        List<String> schedulingKeywords,
        List<String> implantProcedures,
        List<String> vipPhones,
        Map<String, String> defaultOwners
) {
    public TriageProperties {
        priorityKeywords = lowered(priorityKeywords != null ? priorityKeywords : List.of(
                "durere", "durere puternica", "umflatura", "urgent", "infectie",
                "abces", "febra", "nu pot manca", "nu pot dormi"));
        emergencyKeywords = lowered(emergencyKeywords != null ? emergencyKeywords : List.of(
                "accident", "cazut", "spart", "urgenta medicala", "nu respir bine"));
        schedulingKeywords = lowered(schedulingKeywords != null ? schedulingKeywords : List.of(
                "urgent", "cat mai repede", "imediat", "prioritar", "maine", "azi", "acum",
                "de urgenta", "cel mai devreme", "prima programare"));
        implantProcedures = lowered(implantProcedures != null ? implantProcedures : List.of("implant", "all-on-x"));
        vipPhones = vipPhones == null ? List.of() : vipPhones.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .toList();
        defaultOwners = defaultOwners != null ? Map.copyOf(defaultOwners) : Map.of(
                "implants", "dr-implant-team",
                "general", "reception-team",
                "priority", "scheduling-team");
    }

    public static TriageProperties defaults() {
        return new TriageProperties(null, null, null, null, null, null);
    }

    public String owner(String key, String fallback) {
        var v = defaultOwners.get(key);
        return v == null || v.isBlank() ? fallback : v;
    }

    private static List<String> lowered(List<String> values) {
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase())
                .toList();
    }
}

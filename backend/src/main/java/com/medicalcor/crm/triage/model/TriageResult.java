package com.medicalcor.crm.triage.model;

import java.util.List;

/**
 * Output of a triage assessment. {@code routingRecommendation} is kept as the collaborator's raw value so that
 * recommendations this service does not know still flow through to SLA derivation.
 */
public record TriageResult(
        TriageUrgency urgencyLevel,
        String routingRecommendation,
        List<String> medicalFlags,
        String suggestedOwner,
        boolean prioritySchedulingRequested,
        String notes
) {
    public static final String NEXT_AVAILABLE_SLOT = "next_available_slot";
    public static final String SAME_DAY = "same_day";
    public static final String NEXT_BUSINESS_DAY = "next_business_day";
    public static final String NURTURE_SEQUENCE = "nurture_sequence";

    public TriageResult {
        if (urgencyLevel == null) urgencyLevel = TriageUrgency.NORMAL;
        medicalFlags = medicalFlags == null ? List.of() : List.copyOf(medicalFlags);
    }
}

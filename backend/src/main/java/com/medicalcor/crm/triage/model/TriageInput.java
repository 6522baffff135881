package com.medicalcor.crm.triage.model;

import com.medicalcor.crm.routing.model.LeadScore;

import java.util.List;

/**
 * One inbound contact as seen by triage. {@code channel} is the raw lead source (web_form, hubspot, voice...).
 */
public record TriageInput(
        String contactId,
        LeadScore leadScore,
        String channel,
        String messageContent,
        List<String> procedureInterest,
        boolean hasExistingRelationship,
        Integer previousAppointments,
        Integer lastContactDays,
        String phone,
        String teamId,
        String language
) {
    public TriageInput {
        if (leadScore == null) leadScore = LeadScore.COLD;
        if (messageContent == null) messageContent = "";
        procedureInterest = procedureInterest == null ? List.of() : List.copyOf(procedureInterest);
    }
}

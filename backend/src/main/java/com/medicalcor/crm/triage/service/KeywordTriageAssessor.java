package com.medicalcor.crm.triage.service;

import com.medicalcor.crm.routing.model.LeadScore;
import com.medicalcor.crm.triage.model.TriageInput;
import com.medicalcor.crm.triage.model.TriageResult;
import com.medicalcor.crm.triage.model.TriageUrgency;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword-driven dental triage. Pain and discomfort keywords signal high purchase intent and ask for priority
 * scheduling; emergency keywords only add a flag advising the patient to call 112, since the clinic does not
 * handle emergencies.
 */
@Component
public class KeywordTriageAssessor implements TriageAssessor {

    private static final int RE_ENGAGEMENT_DAYS = 180;

    private final TriageProperties properties;

    public KeywordTriageAssessor(TriageProperties properties) {
        this.properties = properties;
    }

    @Override
    public TriageResult assess(TriageInput input) {
        if (input == null) throw new IllegalArgumentException("triage_input_required");

        var content = input.messageContent().toLowerCase();
        var flags = new ArrayList<String>();
        var urgency = TriageUrgency.NORMAL;
        var priorityScheduling = false;

        if (properties.emergencyKeywords().stream().anyMatch(content::contains)) {
            flags.add("potential_emergency_refer_112");
        }

        var symptoms = properties.priorityKeywords().stream().filter(content::contains).toList();
        if (!symptoms.isEmpty()) {
            urgency = TriageUrgency.HIGH_PRIORITY;
            priorityScheduling = true;
            flags.add("priority_scheduling_requested");
            for (var s : symptoms) {
                flags.add("symptom:" + s.replaceAll("\\s+", "_"));
            }
        }

        if (!priorityScheduling && properties.schedulingKeywords().stream().anyMatch(content::contains)) {
            priorityScheduling = true;
            flags.add("priority_scheduling_requested");
            urgency = TriageUrgency.HIGH;
        }

        if (input.leadScore() == LeadScore.HOT && urgency == TriageUrgency.NORMAL) {
            urgency = TriageUrgency.HIGH;
        }

        if (input.hasExistingRelationship() && input.previousAppointments() != null && input.previousAppointments() > 0) {
            flags.add("existing_patient");
            if (urgency == TriageUrgency.NORMAL) urgency = TriageUrgency.HIGH;
        }

        if (input.lastContactDays() != null && input.lastContactDays() > RE_ENGAGEMENT_DAYS) {
            flags.add("re_engagement_opportunity");
        }

        var recommendation = recommend(urgency, input.leadScore(), input.channel(), priorityScheduling);
        return new TriageResult(
                urgency,
                recommendation,
                flags,
                suggestedOwner(input.procedureInterest(), urgency),
                priorityScheduling,
                notes(input, flags, urgency, priorityScheduling)
        );
    }

    @Override
    public boolean isVip(String phone) {
        if (phone == null || phone.isBlank()) return false;
        return properties.vipPhones().contains(phone.trim());
    }

    private static String recommend(TriageUrgency urgency, LeadScore leadScore, String channel, boolean priorityScheduling) {
        if (urgency == TriageUrgency.HIGH_PRIORITY) return TriageResult.NEXT_AVAILABLE_SLOT;
        if (priorityScheduling && urgency != TriageUrgency.LOW) return TriageResult.SAME_DAY;
        if (urgency == TriageUrgency.HIGH || leadScore == LeadScore.HOT) return TriageResult.SAME_DAY;
        if (leadScore == LeadScore.WARM || "voice".equalsIgnoreCase(channel)) return TriageResult.NEXT_BUSINESS_DAY;
        return TriageResult.NURTURE_SEQUENCE;
    }

    private String suggestedOwner(List<String> procedures, TriageUrgency urgency) {
        if (urgency == TriageUrgency.HIGH_PRIORITY) {
            return properties.owner("priority", "scheduling-team");
        }
        var implants = procedures.stream()
                .filter(p -> p != null)
                .anyMatch(p -> properties.implantProcedures().contains(p.trim().toLowerCase()));
        if (implants) {
            return properties.owner("implants", "dr-implant-team");
        }
        return properties.owner("general", "reception-team");
    }

    private static String notes(TriageInput input, List<String> flags, TriageUrgency urgency, boolean priorityScheduling) {
        var parts = new ArrayList<String>();
        parts.add("Priority: " + urgency.key().toUpperCase());
        parts.add("Lead Score: " + input.leadScore());
        parts.add("Channel: " + input.channel());
        if (priorityScheduling) parts.add("PRIORITY SCHEDULING REQUESTED");
        if (!input.procedureInterest().isEmpty()) {
            parts.add("Procedures: " + String.join(", ", input.procedureInterest()));
        }
        if (!flags.isEmpty()) parts.add("Flags: " + String.join(", ", flags));
        if (input.hasExistingRelationship()) {
            var prev = input.previousAppointments() == null ? 0 : input.previousAppointments();
            parts.add("Existing patient with " + prev + " previous appointments");
        }
        if (urgency == TriageUrgency.HIGH_PRIORITY) {
            parts.add("Note: Patient reported discomfort. Schedule priority appointment during business hours. "
                    + "Reminder: For life-threatening emergencies, advise calling 112.");
        }
        return String.join(" | ", parts);
    }
}

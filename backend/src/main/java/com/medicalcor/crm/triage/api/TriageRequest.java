package com.medicalcor.crm.triage.api;

import com.medicalcor.crm.routing.model.LeadScore;
import com.medicalcor.crm.triage.model.TriageInput;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record TriageRequest(
        String contact_id,
        @NotNull(message = "lead_score_required") LeadScore lead_score,
        @NotBlank(message = "channel_required") String channel,
        String message_content,
        List<String> procedure_interest,
        Boolean has_existing_relationship,
        @Min(value = 0, message = "invalid_previous_appointments") Integer previous_appointments,
        @Min(value = 0, message = "invalid_last_contact_days") Integer last_contact_days,
        String phone,
        String team_id,
        String language
) {
    public TriageInput toInput() {
        return new TriageInput(
                contact_id,
                lead_score,
                channel.trim(),
                message_content,
                procedure_interest,
                Boolean.TRUE.equals(has_existing_relationship),
                previous_appointments,
                last_contact_days,
                phone,
                team_id,
                language
        );
    }
}

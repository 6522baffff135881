package com.medicalcor.crm.routing.model;

/**
 * One skill entry of a worker. Entries default to active at {@code basic} proficiency.
 */
public record AgentSkill(
        String skillId,
        Proficiency proficiency,
        Boolean active
) {
    public AgentSkill {
        if (skillId == null || skillId.isBlank()) throw new IllegalArgumentException("skill_id_required");
        if (proficiency == null) proficiency = Proficiency.BASIC;
        if (active == null) active = true;
    }
}

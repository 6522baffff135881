package com.medicalcor.crm.routing.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SkillRequirementTest {

    @Test
    void requirement_defaults_to_required_at_basic() {
        var req = new SkillRequirement("implants", null, null);

        assertEquals(Proficiency.BASIC, req.minimumProficiency());
        assertEquals(SkillMatchType.REQUIRED, req.matchType());
    }

    @Test
    void requirement_without_skill_id_is_rejected() {
        var ex = assertThrows(IllegalArgumentException.class, () -> new SkillRequirement(null, null, null));
        assertEquals("skill_id_required", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> SkillRequirement.required(" ", Proficiency.EXPERT));
    }

    @Test
    void agent_skill_defaults_to_active_basic() {
        var skill = new AgentSkill("implants", null, null);

        assertTrue(skill.active());
        assertEquals(Proficiency.BASIC, skill.proficiency());
        assertFalse(new AgentSkill("implants", Proficiency.EXPERT, false).active());
        assertThrows(IllegalArgumentException.class, () -> new AgentSkill("", Proficiency.EXPERT, true));
    }
}

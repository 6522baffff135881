package com.medicalcor.crm.routing.model;

public record SkillRequirement(
        String skillId,
        Proficiency minimumProficiency,
        SkillMatchType matchType
) {
    public SkillRequirement {
        if (skillId == null || skillId.isBlank()) throw new IllegalArgumentException("skill_id_required");
        if (minimumProficiency == null) minimumProficiency = Proficiency.BASIC;
        if (matchType == null) matchType = SkillMatchType.REQUIRED;
    }

    public static SkillRequirement required(String skillId, Proficiency minimumProficiency) {
        return new SkillRequirement(skillId, minimumProficiency, SkillMatchType.REQUIRED);
    }

    public static SkillRequirement preferred(String skillId, Proficiency minimumProficiency) {
        return new SkillRequirement(skillId, minimumProficiency, SkillMatchType.PREFERRED);
    }

    public SkillRequirement withMinimum(Proficiency value) {
        return new SkillRequirement(skillId, value, matchType);
    }
}

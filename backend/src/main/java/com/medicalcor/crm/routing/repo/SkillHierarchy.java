package com.medicalcor.crm.routing.repo;

import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Skill inheritance: a worker holding one of a skill's parent skills may stand in for that skill.
 * Lookups are one level deep and parents are tried in registration order.
 */
@Repository
public class SkillHierarchy {

    private final Map<String, List<String>> parentsBySkill = new ConcurrentHashMap<>();

    public void register(String skillId, List<String> parentSkillIds) {
        if (skillId == null || skillId.isBlank()) throw new IllegalArgumentException("skill_id_required");
        var parents = parentSkillIds == null ? List.<String>of() : parentSkillIds.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(p -> !p.isEmpty() && !p.equals(skillId.trim()))
                .distinct()
                .toList();
        if (parents.isEmpty()) {
            parentsBySkill.remove(skillId.trim());
        } else {
            parentsBySkill.put(skillId.trim(), parents);
        }
    }

    public List<String> parentsOf(String skillId) {
        if (skillId == null) return List.of();
        return parentsBySkill.getOrDefault(skillId, List.of());
    }

    public Map<String, List<String>> snapshot() {
        return new TreeMap<>(parentsBySkill);
    }

    public void clear() {
        parentsBySkill.clear();
    }
}

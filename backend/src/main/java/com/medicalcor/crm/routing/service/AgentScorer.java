package com.medicalcor.crm.routing.service;

import com.medicalcor.crm.routing.model.AgentMatchScore;
import com.medicalcor.crm.routing.model.AgentProfile;
import com.medicalcor.crm.routing.model.AgentSkill;
import com.medicalcor.crm.routing.model.SkillRequirement;
import com.medicalcor.crm.routing.model.TaskRequirements;
import com.medicalcor.crm.routing.repo.SkillHierarchy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Eligibility filter and additive scoring for candidate workers.
 *
 * <p>A candidate earns the base score for satisfying every required skill, a surplus bonus per proficiency level
 * above each requirement, a bonus per satisfied preferred skill, a bonus when listed as a preferred agent and when it
 * speaks a preferred language, minus a penalty proportional to {@code currentTaskCount / maxConcurrentTasks}.
 *
 * <p>With skill inheritance on, a skill the worker lacks is looked up through its parents in the
 * {@link SkillHierarchy}.
 */
public class AgentScorer {

    private final RoutingProperties.Weights weights;
    private final double maxConcurrentTaskRatio;
    private final boolean skillInheritance;
    private final SkillHierarchy skillHierarchy;

    public AgentScorer(RoutingProperties properties, SkillHierarchy skillHierarchy) {
        this.weights = properties.weights();
        this.maxConcurrentTaskRatio = properties.maxConcurrentTaskRatio();
        this.skillInheritance = properties.skillInheritance();
        this.skillHierarchy = skillHierarchy;
    }

    /**
     * The worker's active entry for {@code skillId}, or for its first parent skill the worker holds.
     */
    public Optional<AgentSkill> findSkill(AgentProfile agent, String skillId) {
        var direct = agent.activeSkill(skillId);
        if (direct.isPresent() || !skillInheritance) return direct;
        for (var parentId : skillHierarchy.parentsOf(skillId)) {
            var inherited = agent.activeSkill(parentId);
            if (inherited.isPresent()) return inherited;
        }
        return Optional.empty();
    }

    public boolean satisfies(AgentProfile agent, SkillRequirement requirement) {
        return findSkill(agent, requirement.skillId())
                .map(s -> s.proficiency().atLeast(requirement.minimumProficiency()))
                .orElse(false);
    }

    public List<String> missingSkills(AgentProfile agent, TaskRequirements requirements) {
        var missing = new ArrayList<String>();
        for (var req : requirements.requiredSkills()) {
            var skill = findSkill(agent, req.skillId());
            if (skill.isEmpty()) {
                missing.add(req.skillId());
            } else if (!skill.get().proficiency().atLeast(req.minimumProficiency())) {
                missing.add(req.skillId() + " (proficiency too low)");
            }
        }
        return missing;
    }

    /**
     * Hard constraints only: availability, spare capacity within the task ratio, exclusion list, required language,
     * required skills.
     */
    public boolean isEligible(AgentProfile agent, TaskRequirements requirements) {
        if (agent == null || !agent.isAvailable() || !agent.hasCapacity()) return false;
        if (agent.currentTaskCount() >= agent.maxConcurrentTasks() * maxConcurrentTaskRatio) return false;
        if (requirements.excludeAgentIds().contains(agent.agentId())) return false;
        if (!agent.speaks(requirements.requiredLanguage())) return false;
        for (var req : requirements.requiredSkills()) {
            if (!satisfies(agent, req)) return false;
        }
        return true;
    }

    public AgentMatchScore score(AgentProfile agent, TaskRequirements requirements) {
        var adjustments = new ArrayList<String>();

        double skillScore = weights.requiredSkillBase();
        adjustments.add("required skills satisfied +" + fmt(weights.requiredSkillBase()));

        for (var req : requirements.requiredSkills()) {
            var skill = findSkill(agent, req.skillId()).orElse(null);
            if (skill == null) continue;
            var surplus = skill.proficiency().weight() - req.minimumProficiency().weight();
            if (surplus > 0) {
                var bonus = surplus * weights.proficiencySurplusBonus();
                skillScore += bonus;
                adjustments.add(req.skillId() + " " + skill.proficiency().key() + " exceeds "
                        + req.minimumProficiency().key() + " +" + fmt(bonus));
            }
        }

        for (var pref : requirements.preferredSkills()) {
            if (satisfies(agent, pref)) {
                skillScore += weights.preferredSkillBonus();
                adjustments.add("preferred skill " + pref.skillId() + " +" + fmt(weights.preferredSkillBonus()));
            }
        }

        double total = skillScore;
        if (requirements.preferAgentIds().contains(agent.agentId())) {
            total += weights.preferredAgentBonus();
            adjustments.add("preferred agent +" + fmt(weights.preferredAgentBonus()));
        }

        if (!requirements.preferredLanguages().isEmpty()
                && requirements.preferredLanguages().stream().anyMatch(agent::speaks)) {
            total += weights.preferredLanguageBonus();
            adjustments.add("preferred language +" + fmt(weights.preferredLanguageBonus()));
        }

        var loadRatio = agent.loadRatio();
        var penalty = weights.loadPenalty() * loadRatio;
        if (penalty > 0) {
            total -= penalty;
            adjustments.add("load " + agent.currentTaskCount() + "/" + agent.maxConcurrentTasks() + " -" + fmt(penalty));
        }

        var primary = requirements.primarySkill();
        var primaryLevel = primary == null ? 0 : findSkill(agent, primary.skillId())
                .map(s -> s.proficiency().weight())
                .orElse(0);

        return new AgentMatchScore(
                agent.agentId(),
                agent.name(),
                round(total),
                round(skillScore),
                round(loadRatio),
                agent.currentTaskCount(),
                primaryLevel,
                agent.updatedAt(),
                adjustments
        );
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static String fmt(double v) {
        var r = round(v);
        return r == Math.rint(r) ? String.valueOf((long) r) : String.valueOf(r);
    }
}

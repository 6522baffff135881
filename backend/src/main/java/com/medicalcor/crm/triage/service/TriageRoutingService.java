package com.medicalcor.crm.triage.service;

import com.medicalcor.crm.routing.model.Channel;
import com.medicalcor.crm.routing.model.LeadScore;
import com.medicalcor.crm.routing.model.Proficiency;
import com.medicalcor.crm.routing.model.RoutingContext;
import com.medicalcor.crm.routing.model.SkillRequirement;
import com.medicalcor.crm.routing.model.UrgencyLevel;
import com.medicalcor.crm.routing.service.DispatchService;
import com.medicalcor.crm.triage.model.TaskSkillRequirements;
import com.medicalcor.crm.triage.model.TriageInput;
import com.medicalcor.crm.triage.model.TriageResult;
import com.medicalcor.crm.triage.model.TriageRoutingConfig;
import com.medicalcor.crm.triage.model.TriageRoutingResult;
import com.medicalcor.crm.triage.model.TriageUrgency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a triage assessment into a routing request and hands it to the dispatcher.
 *
 * <p>Priority is the urgency base plus the lead-score boost. Each procedure of interest contributes its mapped skills
 * as required skills; procedures without a mapping contribute nothing. Elevated urgency raises the primary
 * procedure skill to advanced and prefers escalation-trained agents; VIP contacts prefer VIP-trained agents.
 */
@Service
public class TriageRoutingService {

    private static final Logger log = LoggerFactory.getLogger(TriageRoutingService.class);

    private final TriageAssessor triageAssessor;
    private final DispatchService dispatchService;
    private final TriageRoutingProperties properties;

    // lower-cased procedure -> skill ids, mutable at runtime
    private final Map<String, List<String>> procedureSkills = new ConcurrentHashMap<>();

    public TriageRoutingService(
            TriageAssessor triageAssessor,
            DispatchService dispatchService,
            TriageRoutingProperties properties
    ) {
        this.triageAssessor = triageAssessor;
        this.dispatchService = dispatchService;
        this.properties = properties;
        properties.procedureSkills().forEach((procedure, skills) -> {
            if (procedure != null && !procedure.isBlank()) {
                procedureSkills.put(normalize(procedure), cleanSkills(skills));
            }
        });
    }

    public TriageRoutingResult route(TriageInput input) {
        var preview = triageOnly(input);
        var decision = dispatchService.route(preview.routingContext());
        log.info("triage_routed contactId={} urgency={} recommendation={} outcome={} agentId={}",
                input.contactId(),
                preview.triageResult().urgencyLevel().key(),
                preview.triageResult().routingRecommendation(),
                decision.outcome().key(),
                decision.selectedAgentId());
        return new TriageRoutingResult(preview.triageResult(), preview.skillRequirements(), preview.routingContext(), decision);
    }

    public TriageRoutingResult triageOnly(TriageInput input) {
        if (input == null) throw new IllegalArgumentException("triage_input_required");

        var triage = triageAssessor.assess(input);
        var vip = triageAssessor.isVip(input.phone());
        var urgency = mapUrgency(triage.urgencyLevel());
        var skills = buildSkillRequirements(input, triage, urgency, vip);

        var context = RoutingContext.builder()
                .channel(mapChannel(input.channel()))
                .urgencyLevel(urgency)
                .procedureType(input.procedureInterest().isEmpty() ? null : input.procedureInterest().get(0))
                .requiredSkills(skills.requiredSkills())
                .preferredSkills(skills.preferredSkills())
                .preferAgentIds(skills.preferAgentIds())
                .teamId(input.teamId())
                .requiredLanguage(input.language())
                .slaDeadlineMinutes(slaMinutes(triage.routingRecommendation()))
                .existingRelationship(input.hasExistingRelationship())
                .vip(vip)
                .leadScore(input.leadScore())
                .priority(priorityFor(urgency, input.leadScore()))
                .build();

        log.debug("triage_context contactId={} priority={} sla={} required={} preferred={}",
                input.contactId(), context.priority(), context.slaDeadlineMinutes(),
                skills.requiredSkills().size(), skills.preferredSkills().size());
        return new TriageRoutingResult(triage, skills, context, null);
    }

    public TriageRoutingConfig updateProcedureMapping(String procedure, List<String> skills) {
        if (procedure == null || procedure.isBlank()) throw new IllegalArgumentException("procedure_required");
        var cleaned = cleanSkills(skills);
        procedureSkills.put(normalize(procedure), cleaned);
        log.info("procedure_mapping_updated procedure={} skills={}", normalize(procedure), cleaned);
        return getConfig();
    }

    public TriageRoutingConfig getConfig() {
        var snapshot = new LinkedHashMap<String, List<String>>();
        procedureSkills.keySet().stream().sorted().forEach(k -> snapshot.put(k, procedureSkills.get(k)));
        return new TriageRoutingConfig(
                Collections.unmodifiableMap(snapshot),
                properties.urgencyPriority(),
                properties.leadScoreBoost(),
                properties.slaMinutes(),
                properties.defaultSlaMinutes(),
                properties.vipSkillId(),
                properties.escalationSkillId(),
                properties.defaultProficiency(),
                properties.useSuggestedOwnerAsPreference()
        );
    }

    TaskSkillRequirements buildSkillRequirements(TriageInput input, TriageResult triage, UrgencyLevel urgency, boolean vip) {
        var required = new ArrayList<SkillRequirement>();
        var seen = new HashSet<String>();
        for (var procedure : input.procedureInterest()) {
            if (procedure == null) continue;
            for (var skillId : procedureSkills.getOrDefault(normalize(procedure), List.of())) {
                if (seen.add(skillId)) {
                    required.add(SkillRequirement.required(skillId, properties.defaultProficiency()));
                }
            }
        }

        var preferred = new ArrayList<SkillRequirement>();
        if (urgency.isElevated()) {
            if (!required.isEmpty()) {
                var primary = required.get(0);
                if (!primary.minimumProficiency().atLeast(Proficiency.ADVANCED)) {
                    required.set(0, primary.withMinimum(Proficiency.ADVANCED));
                }
            }
            preferred.add(SkillRequirement.preferred(properties.escalationSkillId(), Proficiency.BASIC));
        }
        if (vip) {
            preferred.add(SkillRequirement.preferred(properties.vipSkillId(), Proficiency.BASIC));
        }

        var preferAgents = new ArrayList<String>();
        if (properties.useSuggestedOwnerAsPreference()
                && triage.suggestedOwner() != null
                && !triage.suggestedOwner().isBlank()) {
            preferAgents.add(triage.suggestedOwner().trim());
        }
        return new TaskSkillRequirements(required, preferred, preferAgents);
    }

    static Channel mapChannel(String raw) {
        if (raw == null) return Channel.WEB;
        return switch (raw.trim().toLowerCase()) {
            case "whatsapp" -> Channel.WHATSAPP;
            case "voice" -> Channel.VOICE;
            default -> Channel.WEB;
        };
    }

    static UrgencyLevel mapUrgency(TriageUrgency urgency) {
        if (urgency == null) return UrgencyLevel.NORMAL;
        return switch (urgency) {
            case HIGH_PRIORITY -> UrgencyLevel.CRITICAL;
            case HIGH -> UrgencyLevel.HIGH;
            case NORMAL -> UrgencyLevel.NORMAL;
            case LOW -> UrgencyLevel.LOW;
        };
    }

    int slaMinutes(String routingRecommendation) {
        if (routingRecommendation == null) return properties.defaultSlaMinutes();
        var v = properties.slaMinutes().get(routingRecommendation.trim().toLowerCase());
        return v == null ? properties.defaultSlaMinutes() : v;
    }

    int priorityFor(UrgencyLevel urgency, LeadScore leadScore) {
        var base = properties.urgencyPriority().getOrDefault(urgency.key(), RoutingContext.DEFAULT_PRIORITY);
        var boost = leadScore == null ? 0 : properties.leadScoreBoost().getOrDefault(leadScore.name(), 0);
        return Math.max(0, Math.min(base + boost, 100));
    }

    private static String normalize(String procedure) {
        return procedure.trim().toLowerCase();
    }

    private static List<String> cleanSkills(List<String> skills) {
        if (skills == null) return List.of();
        return skills.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }
}

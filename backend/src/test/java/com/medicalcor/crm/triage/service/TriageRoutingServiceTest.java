package com.medicalcor.crm.triage.service;

import com.medicalcor.crm.routing.model.Channel;
import com.medicalcor.crm.routing.model.LeadScore;
import com.medicalcor.crm.routing.model.Proficiency;
import com.medicalcor.crm.routing.model.RoutingContext;
import com.medicalcor.crm.routing.model.RoutingDecision;
import com.medicalcor.crm.routing.model.RoutingOutcome;
import com.medicalcor.crm.routing.model.RoutingStrategy;
import com.medicalcor.crm.routing.model.SkillRequirement;
import com.medicalcor.crm.routing.model.UrgencyLevel;
import com.medicalcor.crm.routing.service.DispatchService;
import com.medicalcor.crm.triage.model.TriageInput;
import com.medicalcor.crm.triage.model.TriageResult;
import com.medicalcor.crm.triage.model.TriageUrgency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TriageRoutingServiceTest {

    @Mock
    TriageAssessor triageAssessor;

    @Mock
    DispatchService dispatchService;

    private TriageRoutingService service;

    @BeforeEach
    void setUp() {
        service = new TriageRoutingService(triageAssessor, dispatchService, TriageRoutingProperties.defaults());
    }

    @Test
    void maps_channels() {
        assertEquals(Channel.WHATSAPP, TriageRoutingService.mapChannel("whatsapp"));
        assertEquals(Channel.VOICE, TriageRoutingService.mapChannel("VOICE"));
        for (var source : List.of("web", "web_form", "hubspot", "facebook", "google", "referral", "manual")) {
            assertEquals(Channel.WEB, TriageRoutingService.mapChannel(source), source);
        }
        assertEquals(Channel.WEB, TriageRoutingService.mapChannel(null));
    }

    @Test
    void maps_urgency() {
        assertEquals(UrgencyLevel.CRITICAL, TriageRoutingService.mapUrgency(TriageUrgency.HIGH_PRIORITY));
        assertEquals(UrgencyLevel.HIGH, TriageRoutingService.mapUrgency(TriageUrgency.HIGH));
        assertEquals(UrgencyLevel.NORMAL, TriageRoutingService.mapUrgency(TriageUrgency.NORMAL));
        assertEquals(UrgencyLevel.LOW, TriageRoutingService.mapUrgency(TriageUrgency.LOW));
    }

    @Test
    void sla_minutes_follow_recommendation() {
        assertEquals(15, service.slaMinutes("next_available_slot"));
        assertEquals(60, service.slaMinutes("same_day"));
        assertEquals(480, service.slaMinutes("next_business_day"));
        assertEquals(1440, service.slaMinutes("nurture_sequence"));
        assertEquals(60, service.slaMinutes("call_back_next_week"));
        assertEquals(60, service.slaMinutes(null));
    }

    @Test
    void priority_is_urgency_base_plus_lead_boost_clamped() {
        assertEquals(100, service.priorityFor(UrgencyLevel.CRITICAL, LeadScore.HOT));
        assertEquals(95, service.priorityFor(UrgencyLevel.HIGH, LeadScore.HOT));
        assertEquals(60, service.priorityFor(UrgencyLevel.NORMAL, LeadScore.WARM));
        assertEquals(40, service.priorityFor(UrgencyLevel.NORMAL, LeadScore.UNQUALIFIED));
        assertEquals(25, service.priorityFor(UrgencyLevel.LOW, LeadScore.COLD));
    }

    @Test
    void elevated_vip_request_builds_full_context_without_dispatching() {
        var input = input("whatsapp", List.of("Implant", "unknown-procedure"));
        when(triageAssessor.assess(input)).thenReturn(triage(TriageUrgency.HIGH_PRIORITY, "next_available_slot", "scheduling-team"));
        when(triageAssessor.isVip("+40700000001")).thenReturn(true);

        var result = service.triageOnly(input);

        var skills = result.skillRequirements();
        assertEquals(List.of(SkillRequirement.required("procedure:implants", Proficiency.ADVANCED)), skills.requiredSkills());
        assertEquals(List.of(
                SkillRequirement.preferred("special:escalation", Proficiency.BASIC),
                SkillRequirement.preferred("special:vip", Proficiency.BASIC)), skills.preferredSkills());
        assertEquals(List.of("scheduling-team"), skills.preferAgentIds());

        var ctx = result.routingContext();
        assertEquals(Channel.WHATSAPP, ctx.channel());
        assertEquals(UrgencyLevel.CRITICAL, ctx.urgencyLevel());
        assertEquals("Implant", ctx.procedureType());
        assertEquals(15, ctx.slaDeadlineMinutes());
        assertEquals(100, ctx.priority());
        assertTrue(ctx.vip());
        assertEquals("team-a", ctx.teamId());
        assertNull(result.routingDecision());
        verifyNoInteractions(dispatchService);
    }

    @Test
    void only_primary_skill_is_upgraded_for_elevated_urgency() {
        var input = input("web", List.of("all-on-x"));
        when(triageAssessor.assess(input)).thenReturn(triage(TriageUrgency.HIGH, "same_day", null));

        var required = service.triageOnly(input).skillRequirements().requiredSkills();

        assertEquals(List.of(
                SkillRequirement.required("procedure:all-on-x", Proficiency.ADVANCED),
                SkillRequirement.required("procedure:implants", Proficiency.INTERMEDIATE)), required);
    }

    @Test
    void normal_urgency_uses_default_proficiency_and_no_preferences() {
        var input = input("hubspot", List.of("implant", "all-on-x"));
        when(triageAssessor.assess(input)).thenReturn(triage(TriageUrgency.NORMAL, "nurture_sequence", null));

        var result = service.triageOnly(input);

        assertEquals(List.of(
                SkillRequirement.required("procedure:implants", Proficiency.INTERMEDIATE),
                SkillRequirement.required("procedure:all-on-x", Proficiency.INTERMEDIATE)),
                result.skillRequirements().requiredSkills());
        assertTrue(result.skillRequirements().preferredSkills().isEmpty());
        assertTrue(result.skillRequirements().preferAgentIds().isEmpty());
        assertEquals(Channel.WEB, result.routingContext().channel());
        assertEquals(1440, result.routingContext().slaDeadlineMinutes());
    }

    @Test
    void suggested_owner_preference_can_be_disabled() {
        service = new TriageRoutingService(triageAssessor, dispatchService, new TriageRoutingProperties(
                null, null, null, null, null, null, null, null, false));
        var input = input("web", List.of());
        when(triageAssessor.assess(input)).thenReturn(triage(TriageUrgency.NORMAL, "same_day", "reception-team"));

        assertTrue(service.triageOnly(input).skillRequirements().preferAgentIds().isEmpty());
    }

    @Test
    void route_hands_context_to_dispatcher() {
        var input = input("voice", List.of("implant"));
        when(triageAssessor.assess(input)).thenReturn(triage(TriageUrgency.NORMAL, "next_business_day", "reception-team"));
        var decision = new RoutingDecision("d1", "t1", RoutingOutcome.ASSIGNED, "agent-1", 60.0, "ok",
                null, null, RoutingStrategy.BEST_MATCH, null, null, null, List.of(), 0, 1, Instant.now());
        when(dispatchService.route(any())).thenReturn(decision);

        var result = service.route(input);

        var captor = ArgumentCaptor.forClass(RoutingContext.class);
        verify(dispatchService).route(captor.capture());
        assertEquals(Channel.VOICE, captor.getValue().channel());
        assertEquals(480, captor.getValue().slaDeadlineMinutes());
        assertEquals(60, captor.getValue().priority());
        assertSame(decision, result.routingDecision());
    }

    @Test
    void procedure_mapping_can_change_at_runtime() {
        var config = service.updateProcedureMapping(" Whitening ", List.of("procedure:cosmetic", " ", "procedure:bleaching"));

        assertEquals(List.of("procedure:cosmetic", "procedure:bleaching"), config.procedureSkills().get("whitening"));
        assertThrows(UnsupportedOperationException.class, () -> config.procedureSkills().put("x", List.of()));

        var input = input("web", List.of("WHITENING"));
        when(triageAssessor.assess(input)).thenReturn(triage(TriageUrgency.LOW, "nurture_sequence", null));
        assertEquals(2, service.triageOnly(input).skillRequirements().requiredSkills().size());
    }

    @Test
    void blank_procedure_is_rejected() {
        var ex = assertThrows(IllegalArgumentException.class, () -> service.updateProcedureMapping(" ", List.of("x")));
        assertEquals("procedure_required", ex.getMessage());
    }

    @Test
    void config_snapshot_exposes_tables() {
        var config = service.getConfig();

        assertEquals(100, config.urgencyPriority().get("critical"));
        assertEquals(-10, config.leadScoreBoost().get("UNQUALIFIED"));
        assertEquals("special:vip", config.vipSkillId());
        assertEquals(Proficiency.INTERMEDIATE, config.defaultProficiency());
        assertTrue(config.useSuggestedOwnerAsPreference());
        assertTrue(config.procedureSkills().containsKey("implant"));
    }

    private static TriageInput input(String channel, List<String> procedures) {
        return new TriageInput("contact-1", LeadScore.WARM, channel, "mesaj", procedures,
                false, null, null, "+40700000001", "team-a", null);
    }

    private static TriageResult triage(TriageUrgency urgency, String recommendation, String owner) {
        return new TriageResult(urgency, recommendation, List.of(), owner, false, "notes");
    }
}

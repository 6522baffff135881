package com.medicalcor.crm.routing.api;

import com.medicalcor.crm.bootstrap.RoutingApplication;
import com.medicalcor.crm.routing.repo.AgentDirectory;
import com.medicalcor.crm.routing.repo.RoutingQueue;
import com.medicalcor.crm.routing.repo.RoutingRuleStore;
import com.medicalcor.crm.routing.repo.SkillHierarchy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = RoutingApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RoutingApiTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    AgentDirectory agentDirectory;

    @Autowired
    RoutingRuleStore ruleStore;

    @Autowired
    RoutingQueue routingQueue;

    @Autowired
    SkillHierarchy skillHierarchy;

    @BeforeEach
    void reset() {
        agentDirectory.clear();
        ruleStore.clear();
        routingQueue.clear();
        skillHierarchy.clear();
    }

    @Test
    void upsert_and_fetch_agent() throws Exception {
        upsertAgent("a1", "available", "expert");

        mvc.perform(get("/api/v1/routing/agents/{id}", "a1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.agent_id").value("a1"))
                .andExpect(jsonPath("$.data.availability").value("available"))
                .andExpect(jsonPath("$.data.skills[0].skill_id").value("implants"))
                .andExpect(jsonPath("$.data.skills[0].proficiency").value("expert"))
                .andExpect(jsonPath("$.data.max_concurrent_tasks").value(2));

        mvc.perform(get("/api/v1/routing/agents/by-skill/{skill}", "implants").param("min_proficiency", "advanced"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1));
    }

    @Test
    void agent_validation_errors() throws Exception {
        mvc.perform(post("/api/v1/routing/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"agent_id":"a1"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error").value("name_required"));

        mvc.perform(post("/api/v1/routing/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"agent_id":"a1","name":"Ana","skills":[{"skill_id":"implants","proficiency":"guru","active":true}]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_proficiency"));

        mvc.perform(get("/api/v1/routing/agents/{id}", "ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("agent_not_found"));
    }

    @Test
    void route_assigns_available_agent() throws Exception {
        upsertAgent("a1", "available", "expert");

        mvc.perform(post("/api/v1/routing/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"channel":"whatsapp","urgency_level":"high","procedure_type":"implant",
                                 "required_skills":[{"skill_id":"implants","minimum_proficiency":"advanced"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.outcome").value("assigned"))
                .andExpect(jsonPath("$.data.selected_agent_id").value("a1"))
                .andExpect(jsonPath("$.data.strategy").value("best_match"))
                .andExpect(jsonPath("$.data.candidates[0].agent_id").value("a1"));

        mvc.perform(get("/api/v1/routing/agents/{id}", "a1"))
                .andExpect(jsonPath("$.data.current_task_count").value(1));
    }

    @Test
    void queued_task_is_drained_when_agent_comes_online() throws Exception {
        upsertAgent("a1", "offline", "expert");

        mvc.perform(post("/api/v1/routing/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"task_id":"lead-42","priority":80,
                                 "required_skills":[{"skill_id":"implants","minimum_proficiency":"basic"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.outcome").value("queued"))
                .andExpect(jsonPath("$.data.queue_id").value("default"))
                .andExpect(jsonPath("$.data.queue_position").value(1))
                .andExpect(jsonPath("$.data.estimated_wait_seconds").value(120));

        mvc.perform(get("/api/v1/routing/queues/{queueId}", "default"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length").value(1))
                .andExpect(jsonPath("$.data.tasks[0].task_id").value("lead-42"))
                .andExpect(jsonPath("$.data.tasks[0].priority").value(80));

        mvc.perform(get("/api/v1/routing/queues/tasks/{taskId}/position", "lead-42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.position").value(1));

        mvc.perform(post("/api/v1/routing/agents/{id}/availability", "a1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"availability":"available"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.availability").value("available"))
                .andExpect(jsonPath("$.data.current_task_count").value(1));

        mvc.perform(get("/api/v1/routing/queues/tasks/{taskId}/position", "lead-42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("queued_task_not_found"));

        mvc.perform(post("/api/v1/routing/agents/{id}/complete", "a1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.current_task_count").value(0));
    }

    @Test
    void cancel_queued_task() throws Exception {
        mvc.perform(post("/api/v1/routing/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"task_id":"lead-7","team_id":"team-east"}
                                """))
                .andExpect(jsonPath("$.data.outcome").value("queued"))
                .andExpect(jsonPath("$.data.queue_id").value("team-east"));

        mvc.perform(delete("/api/v1/routing/queues/tasks/{taskId}", "lead-7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        mvc.perform(delete("/api/v1/routing/queues/tasks/{taskId}", "lead-7"))
                .andExpect(status().isNotFound());

        mvc.perform(get("/api/v1/routing/queues"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].queue_id").value("default"))
                .andExpect(jsonPath("$.data[1].queue_id").value("team-east"))
                .andExpect(jsonPath("$.data[1].length").value(0));

        mvc.perform(get("/api/v1/routing/queues/{queueId}", "nowhere"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("queue_not_found"));
    }

    @Test
    void routing_rules_crud_and_escalation() throws Exception {
        var res = mvc.perform(post("/api/v1/routing/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"Critical implants","priority":90,
                                 "conditions":{"procedure_types":["implant"],"urgency_levels":["critical"]},
                                 "routing":{"strategy":"skills_first","fallback_behavior":"escalate",
                                            "skill_requirements":[{"skill_id":"surgery","minimum_proficiency":"advanced"}],
                                            "max_queue_time_seconds":120}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.rule_id").isNotEmpty())
                .andExpect(jsonPath("$.data.active").value(true))
                .andExpect(jsonPath("$.data.routing.strategy").value("skills_first"))
                .andReturn();
        var ruleId = objectMapper.readTree(res.getResponse().getContentAsString()).path("data").path("rule_id").asText();

        mvc.perform(get("/api/v1/routing/rules/active"))
                .andExpect(jsonPath("$.data.length()").value(1));

        mvc.perform(post("/api/v1/routing/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"procedure_type":"implant","urgency_level":"critical"}
                                """))
                .andExpect(jsonPath("$.data.outcome").value("escalated"))
                .andExpect(jsonPath("$.data.applied_rule_id").value(ruleId));

        mvc.perform(delete("/api/v1/routing/rules/{id}", ruleId))
                .andExpect(status().isOk());

        mvc.perform(get("/api/v1/routing/rules/{id}", ruleId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("routing_rule_not_found"));
    }

    @Test
    void skills_default_to_active_and_match_checks_reject_blank_skill_ids() throws Exception {
        mvc.perform(post("/api/v1/routing/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"agent_id":"a1","name":"Ana","availability":"available",
                                 "skills":[{"skill_id":"implants","proficiency":"advanced"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.skills[0].active").value(true));

        mvc.perform(post("/api/v1/routing/agents/{id}/match", "a1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"required_skills":[{"skill_id":"implants","minimum_proficiency":"advanced"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.matches").value(true));

        mvc.perform(post("/api/v1/routing/agents/{id}/match", "a1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"required_skills":[{"minimum_proficiency":"basic"}]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("skill_id_required"));
    }

    @Test
    void skill_hierarchy_extends_matching_to_parent_skills() throws Exception {
        upsertAgent("a1", "available", "expert");

        mvc.perform(put("/api/v1/routing/skills/{skillId}/parents", "all-on-x")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"parent_skill_ids":["implants"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data['all-on-x'][0]").value("implants"));

        mvc.perform(post("/api/v1/routing/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"required_skills":[{"skill_id":"all-on-x","minimum_proficiency":"advanced"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.outcome").value("assigned"))
                .andExpect(jsonPath("$.data.selected_agent_id").value("a1"));

        mvc.perform(delete("/api/v1/routing/skills/hierarchy"))
                .andExpect(status().isOk());

        mvc.perform(get("/api/v1/routing/skills/hierarchy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    void rule_with_time_range_round_trips() throws Exception {
        mvc.perform(post("/api/v1/routing/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"rule_id":"night","name":"Night desk",
                                 "conditions":{"time_range":{"start_hour":22,"end_hour":6,"days_of_week":["SATURDAY"]},
                                               "vip":true,"lead_score":"hot"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.conditions.time_range.start_hour").value(22))
                .andExpect(jsonPath("$.data.conditions.time_range.days_of_week[0]").value("SATURDAY"))
                .andExpect(jsonPath("$.data.conditions.vip").value(true))
                .andExpect(jsonPath("$.data.conditions.lead_score").value("HOT"));

        mvc.perform(post("/api/v1/routing/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"Broken","conditions":{"time_range":{"start_hour":30}}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_time_range"));
    }

    @Test
    void unknown_route_is_not_found() throws Exception {
        mvc.perform(get("/api/v1/routing/nothing-here"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    private void upsertAgent(String id, String availability, String proficiency) throws Exception {
        mvc.perform(post("/api/v1/routing/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"agent_id":"%s","name":"Agent %s","availability":"%s",
                                 "skills":[{"skill_id":"implants","proficiency":"%s","active":true}],
                                 "languages":["ro"],"max_concurrent_tasks":2}
                                """.formatted(id, id, availability, proficiency)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));
    }
}

package com.medicalcor.crm.routing.api;

import com.medicalcor.crm.common.api.ApiResponse;
import com.medicalcor.crm.routing.model.AgentAvailability;
import com.medicalcor.crm.routing.model.AgentMatchCheck;
import com.medicalcor.crm.routing.model.AgentProfile;
import com.medicalcor.crm.routing.model.Proficiency;
import com.medicalcor.crm.routing.model.RoutingContext;
import com.medicalcor.crm.routing.repo.AgentDirectory;
import com.medicalcor.crm.routing.service.DispatchService;
import com.medicalcor.crm.routing.service.RoutingProperties;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/api/v1/routing/agents")
public class AgentDirectoryController {

    private static final Logger log = LoggerFactory.getLogger(AgentDirectoryController.class);

    private final AgentDirectory agentDirectory;
    private final DispatchService dispatchService;
    private final RoutingProperties properties;
    private final Clock clock;

    public AgentDirectoryController(
            AgentDirectory agentDirectory,
            DispatchService dispatchService,
            RoutingProperties properties,
            Clock clock
    ) {
        this.agentDirectory = agentDirectory;
        this.dispatchService = dispatchService;
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping
    public ApiResponse<List<AgentProfile>> list() {
        return ApiResponse.ok(agentDirectory.all());
    }

    @GetMapping("/available")
    public ApiResponse<List<AgentProfile>> available(@RequestParam(value = "team_id", required = false) String teamId) {
        return ApiResponse.ok(agentDirectory.available(teamId));
    }

    @GetMapping("/by-skill/{skillId}")
    public ApiResponse<List<AgentProfile>> bySkill(
            @PathVariable("skillId") String skillId,
            @RequestParam(value = "min_proficiency", required = false) String minProficiency
    ) {
        return ApiResponse.ok(agentDirectory.bySkill(skillId, Proficiency.fromKey(minProficiency)));
    }

    @GetMapping("/{agentId}")
    public ApiResponse<AgentProfile> get(@PathVariable("agentId") String agentId) {
        return ApiResponse.ok(requireAgent(agentId));
    }

    @PostMapping
    public ApiResponse<AgentProfile> upsert(@Valid @RequestBody UpsertAgentRequest req) {
        var now = clock.instant();
        var existing = agentDirectory.byId(req.agent_id()).orElse(null);
        var profile = new AgentProfile(
                req.agent_id().trim(),
                req.name().trim(),
                req.email(),
                req.phone(),
                req.role(),
                req.availability(),
                req.skills(),
                req.languages(),
                req.current_task_count() == null ? 0 : req.current_task_count(),
                req.max_concurrent_tasks() == null ? 1 : req.max_concurrent_tasks(),
                req.team_id(),
                existing == null ? now : existing.createdAt(),
                now
        );
        agentDirectory.upsert(profile);
        log.info("agent_upserted agentId={} availability={} teamId={}",
                profile.agentId(), profile.availability().key(), profile.teamId());
        if (profile.isAvailable()) {
            drainAfterCapacityChange(profile.agentId());
        }
        return ApiResponse.ok(requireAgent(profile.agentId()));
    }

    @DeleteMapping("/{agentId}")
    public ApiResponse<Void> remove(@PathVariable("agentId") String agentId) {
        requireAgent(agentId);
        agentDirectory.remove(agentId);
        return ApiResponse.ok(null);
    }

    @PostMapping("/{agentId}/availability")
    public ApiResponse<AgentProfile> setAvailability(
            @PathVariable("agentId") String agentId,
            @Valid @RequestBody SetAvailabilityRequest req
    ) {
        requireAgent(agentId);
        agentDirectory.setAvailability(agentId, req.availability());
        log.info("agent_availability agentId={} availability={}", agentId, req.availability().key());
        if (req.availability() == AgentAvailability.AVAILABLE) {
            drainAfterCapacityChange(agentId);
        }
        return ApiResponse.ok(requireAgent(agentId));
    }

    @PostMapping("/{agentId}/task-count")
    public ApiResponse<AgentProfile> setTaskCount(
            @PathVariable("agentId") String agentId,
            @Valid @RequestBody SetTaskCountRequest req
    ) {
        requireAgent(agentId);
        agentDirectory.setTaskCount(agentId, req.current_task_count());
        return ApiResponse.ok(requireAgent(agentId));
    }

    @PostMapping("/{agentId}/complete")
    public ApiResponse<AgentProfile> complete(@PathVariable("agentId") String agentId) {
        var updated = dispatchService.completeTask(agentId)
                .orElseThrow(() -> new IllegalArgumentException("agent_not_found"));
        if (updated.isAvailable()) {
            drainAfterCapacityChange(agentId);
        }
        return ApiResponse.ok(requireAgent(agentId));
    }

    @PostMapping("/{agentId}/match")
    public ApiResponse<AgentMatchCheck> match(
            @PathVariable("agentId") String agentId,
            @RequestBody RoutingContext context
    ) {
        requireAgent(agentId);
        return ApiResponse.ok(dispatchService.checkAgentMatch(agentId, context));
    }

    private AgentProfile requireAgent(String agentId) {
        return agentDirectory.byId(agentId).orElseThrow(() -> new IllegalArgumentException("agent_not_found"));
    }

    private void drainAfterCapacityChange(String agentId) {
        try {
            var assigned = dispatchService.drainAll(properties.drain().batchSize()).stream()
                    .mapToInt(DispatchService.DrainResult::assignedCount)
                    .sum();
            if (assigned > 0) {
                log.info("queue_drain_on_capacity agentId={} assigned={}", agentId, assigned);
            }
        } catch (Exception e) {
            // the agent update itself succeeded; the scheduled sweep will retry
            log.warn("queue_drain_on_capacity_failed agentId={}", agentId, e);
        }
    }
}

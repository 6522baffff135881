package com.medicalcor.crm.routing.api;

import com.medicalcor.crm.common.api.ApiResponse;
import com.medicalcor.crm.routing.model.RoutingRule;
import com.medicalcor.crm.routing.repo.RoutingRuleStore;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/routing/rules")
public class RoutingRuleController {

    private static final Logger log = LoggerFactory.getLogger(RoutingRuleController.class);

    private final RoutingRuleStore ruleStore;
    private final Clock clock;

    public RoutingRuleController(RoutingRuleStore ruleStore, Clock clock) {
        this.ruleStore = ruleStore;
        this.clock = clock;
    }

    @GetMapping
    public ApiResponse<List<RoutingRule>> list() {
        return ApiResponse.ok(ruleStore.all());
    }

    @GetMapping("/active")
    public ApiResponse<List<RoutingRule>> active() {
        return ApiResponse.ok(ruleStore.active());
    }

    @GetMapping("/{ruleId}")
    public ApiResponse<RoutingRule> get(@PathVariable("ruleId") String ruleId) {
        return ApiResponse.ok(requireRule(ruleId));
    }

    @PostMapping
    public ApiResponse<RoutingRule> upsert(@Valid @RequestBody UpsertRoutingRuleRequest req) {
        var now = clock.instant();
        var ruleId = req.rule_id() == null || req.rule_id().isBlank()
                ? "rule_" + UUID.randomUUID()
                : req.rule_id().trim();
        var existing = ruleStore.byId(ruleId).orElse(null);

        var rule = new RoutingRule(
                ruleId,
                req.name().trim(),
                req.priority() == null ? 0 : req.priority(),
                req.active() == null || req.active(),
                req.conditions(),
                req.routing(),
                existing == null ? now : existing.createdAt(),
                now
        );
        ruleStore.upsert(rule);
        log.info("routing_rule_upserted ruleId={} priority={} active={} strategy={}",
                rule.ruleId(), rule.priority(), rule.active(), rule.routing().strategy().key());
        return ApiResponse.ok(rule);
    }

    @DeleteMapping("/{ruleId}")
    public ApiResponse<Void> remove(@PathVariable("ruleId") String ruleId) {
        requireRule(ruleId);
        ruleStore.remove(ruleId);
        return ApiResponse.ok(null);
    }

    private RoutingRule requireRule(String ruleId) {
        return ruleStore.byId(ruleId).orElseThrow(() -> new IllegalArgumentException("routing_rule_not_found"));
    }
}

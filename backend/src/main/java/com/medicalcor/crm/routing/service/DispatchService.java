package com.medicalcor.crm.routing.service;

import com.medicalcor.crm.routing.model.AgentMatchCheck;
import com.medicalcor.crm.routing.model.AgentMatchScore;
import com.medicalcor.crm.routing.model.AgentProfile;
import com.medicalcor.crm.routing.model.FallbackBehavior;
import com.medicalcor.crm.routing.model.RoutingConditions;
import com.medicalcor.crm.routing.model.RoutingContext;
import com.medicalcor.crm.routing.model.RoutingDecision;
import com.medicalcor.crm.routing.model.RoutingOutcome;
import com.medicalcor.crm.routing.model.RoutingRule;
import com.medicalcor.crm.routing.model.RoutingStrategy;
import com.medicalcor.crm.routing.model.TaskRequirements;
import com.medicalcor.crm.routing.repo.AgentDirectory;
import com.medicalcor.crm.routing.repo.AssignCursorRegistry;
import com.medicalcor.crm.routing.repo.RoutingQueue;
import com.medicalcor.crm.routing.repo.RoutingRuleStore;
import com.medicalcor.crm.routing.service.strategy.SelectionContext;
import com.medicalcor.crm.routing.service.strategy.SelectionStrategyResolver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Selects a worker for a routing request or parks the request in a queue.
 *
 * <p>Candidate selection and the capacity increment are one step: candidates are walked in strategy order and each
 * is reserved through {@link AgentDirectory#tryReserve}, which re-checks availability, capacity and skills against
 * the live record. A candidate taken by a concurrent caller is skipped, so {@code currentTaskCount} never exceeds
 * {@code maxConcurrentTasks}. No call blocks waiting for capacity.
 */
@Service
public class DispatchService {

    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    private final AgentDirectory agentDirectory;
    private final RoutingRuleStore ruleStore;
    private final RoutingQueue routingQueue;
    private final AssignCursorRegistry cursorRegistry;
    private final SelectionStrategyResolver strategyResolver;
    private final AgentScorer agentScorer;
    private final RoutingProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final MeterRegistry meterRegistry;
    private final Timer routeDuration;
    private final Counter reservationConflicts;
    private final Counter drainedTotal;

    public DispatchService(
            AgentDirectory agentDirectory,
            RoutingRuleStore ruleStore,
            RoutingQueue routingQueue,
            AssignCursorRegistry cursorRegistry,
            SelectionStrategyResolver strategyResolver,
            AgentScorer agentScorer,
            RoutingProperties properties,
            ApplicationEventPublisher eventPublisher,
            MeterRegistry meterRegistry,
            Clock clock
    ) {
        this.agentDirectory = agentDirectory;
        this.ruleStore = ruleStore;
        this.routingQueue = routingQueue;
        this.cursorRegistry = cursorRegistry;
        this.strategyResolver = strategyResolver;
        this.agentScorer = agentScorer;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        this.routeDuration = Timer.builder("routing.route.duration")
                .description("Duration of a routing decision")
                .register(meterRegistry);
        this.reservationConflicts = Counter.builder("routing.reservation.conflicts")
                .description("Candidates lost to a concurrent reservation")
                .register(meterRegistry);
        this.drainedTotal = Counter.builder("routing.queue.drained")
                .description("Queued tasks assigned by a queue drain")
                .register(meterRegistry);
    }

    public record DrainResult(String queueId, int assignedCount, List<String> assignedTaskIds, int scanned) {
    }

    private record MatchAttempt(AgentMatchScore selected, List<AgentMatchScore> scored, int qualified) {
        boolean assigned() {
            return selected != null;
        }
    }

    public RoutingDecision route(RoutingContext context) {
        if (context == null) throw new IllegalArgumentException("routing_context_required");

        var startedAt = clock.millis();
        var sample = Timer.start(meterRegistry);
        try {
            var decisionId = UUID.randomUUID().toString();
            var ctx = context.taskId() == null || context.taskId().isBlank() ? context.withTaskId(decisionId) : context;

            var rule = findApplicableRule(ctx).orElse(null);
            var requirements = TaskRequirements.of(ctx, rule);
            var strategy = rule != null ? rule.routing().strategy() : properties.defaultStrategy();
            var fallback = rule != null ? rule.routing().fallbackBehavior() : properties.defaultFallback();

            if (routingQueue.position(ctx.taskId()).isPresent()) {
                // queued tasks are resumed by the drain only, never by a repeated route
                var decision = enqueue(decisionId, ctx, rule, strategy, List.of(), 0, startedAt,
                        "Task already queued; " + ruleLabel(rule) + "; waiting for a queue drain");
                publish(decision);
                return decision;
            }

            var attempt = attemptMatch(requirements, strategy);
            RoutingDecision decision;
            if (attempt.assigned()) {
                decision = assigned(decisionId, ctx, rule, strategy, attempt, 0, startedAt,
                        ruleLabel(rule) + "; " + strategy.key() + " selected " + attempt.selected().agentId()
                                + " with score " + attempt.selected().totalScore()
                                + " (" + String.join(", ", attempt.selected().adjustments()) + ")");
            } else {
                log.warn("routing_no_candidate taskId={} scored={} qualified={} fallback={}",
                        ctx.taskId(), attempt.scored().size(), attempt.qualified(), fallback.key());
                decision = applyFallback(decisionId, ctx, rule, strategy, fallback, requirements, attempt, startedAt);
            }

            publish(decision);
            return decision;
        } finally {
            sample.stop(routeDuration);
        }
    }

    /**
     * Read-only view for monitoring.
     */
    public List<AgentProfile> availableAgents() {
        return agentDirectory.available(null);
    }

    /**
     * Hand back one unit of capacity after the worker finished a task.
     */
    public Optional<AgentProfile> completeTask(String agentId) {
        var updated = agentDirectory.release(agentId);
        updated.ifPresent(a -> log.info("routing_task_completed agentId={} currentTaskCount={}",
                a.agentId(), a.currentTaskCount()));
        return updated;
    }

    public AgentMatchCheck checkAgentMatch(String agentId, RoutingContext context) {
        var agent = agentDirectory.byId(agentId).orElse(null);
        if (agent == null || context == null) {
            return new AgentMatchCheck(false, List.of());
        }
        var rule = findApplicableRule(context).orElse(null);
        var missing = agentScorer.missingSkills(agent, TaskRequirements.of(context, rule));
        return new AgentMatchCheck(missing.isEmpty(), List.copyOf(missing));
    }

    /**
     * Assign queued tasks whose snapshot context now has an eligible worker, in queue order. Tasks that still have
     * no worker keep their place.
     */
    public DrainResult drainQueue(String queueId, int limit) {
        var tasks = routingQueue.tasks(queueId);
        var max = Math.max(0, limit);
        var picked = new ArrayList<String>();

        for (var task : tasks) {
            if (picked.size() >= max) break;
            var startedAt = clock.millis();
            var ctx = task.context() == null
                    ? RoutingContext.builder().taskId(task.taskId()).build()
                    : task.context().withTaskId(task.taskId());

            var rule = findApplicableRule(ctx).orElse(null);
            var strategy = rule != null ? rule.routing().strategy() : properties.defaultStrategy();
            var attempt = attemptMatch(TaskRequirements.of(ctx, rule), strategy);
            if (!attempt.assigned()) continue;

            if (!routingQueue.remove(task.taskId())) {
                // cancelled or drained by someone else meanwhile
                agentDirectory.release(attempt.selected().agentId());
                continue;
            }

            picked.add(task.taskId());
            publish(assigned(UUID.randomUUID().toString(), ctx, rule, strategy, attempt, 0, startedAt,
                    "Drained from queue " + queueId + "; " + ruleLabel(rule) + "; " + strategy.key()
                            + " selected " + attempt.selected().agentId()
                            + " with score " + attempt.selected().totalScore()));
        }

        if (!picked.isEmpty()) {
            drainedTotal.increment(picked.size());
            log.info("routing_queue_drained queueId={} assigned={} scanned={}", queueId, picked.size(), tasks.size());
        }
        return new DrainResult(queueId, picked.size(), List.copyOf(picked), tasks.size());
    }

    public List<DrainResult> drainAll(int limitPerQueue) {
        var results = new ArrayList<DrainResult>();
        for (var queueId : routingQueue.queueIds()) {
            if (routingQueue.length(queueId) == 0) continue;
            try {
                results.add(drainQueue(queueId, limitPerQueue));
            } catch (Exception e) {
                log.warn("routing_queue_drain_failed queueId={}", queueId, e);
            }
        }
        return results;
    }

    private Optional<RoutingRule> findApplicableRule(RoutingContext ctx) {
        var now = ZonedDateTime.now(clock).withZoneSameInstant(properties.timeZone());
        return ruleStore.matching(RoutingConditions.of(ctx)).stream()
                .filter(r -> r.conditions().activeAt(now))
                .findFirst();
    }

    private MatchAttempt attemptMatch(TaskRequirements requirements, RoutingStrategy strategy) {
        var scored = new ArrayList<AgentMatchScore>();
        for (var agent : agentDirectory.available(requirements.teamId())) {
            if (agentScorer.isEligible(agent, requirements)) {
                scored.add(agentScorer.score(agent, requirements));
            }
        }

        var qualified = scored.stream()
                .filter(s -> s.totalScore() >= properties.minimumMatchScore())
                .toList();
        if (qualified.isEmpty()) {
            return new MatchAttempt(null, List.copyOf(scored), 0);
        }

        var scopeKey = scopeKey(requirements, strategy);
        var ctx = new SelectionContext(scopeKey, cursorRegistry.getLastAgent(scopeKey).orElse(null), qualified);
        var ordered = strategyResolver.resolve(strategy).order(ctx);

        for (var candidate : ordered) {
            var reserved = agentDirectory.tryReserve(candidate.agentId(), a -> agentScorer.isEligible(a, requirements));
            if (reserved.isPresent()) {
                cursorRegistry.updateLastAgent(scopeKey, candidate.agentId());
                return new MatchAttempt(candidate, List.copyOf(scored), qualified.size());
            }
            reservationConflicts.increment();
            log.warn("routing_reservation_conflict agentId={}", candidate.agentId());
        }
        return new MatchAttempt(null, List.copyOf(scored), qualified.size());
    }

    private RoutingDecision applyFallback(
            String decisionId,
            RoutingContext ctx,
            RoutingRule rule,
            RoutingStrategy strategy,
            FallbackBehavior fallback,
            TaskRequirements requirements,
            MatchAttempt attempt,
            long startedAt
    ) {
        var why = "No eligible agent (" + attempt.scored().size() + " scored, " + attempt.qualified()
                + " qualified at >= " + properties.minimumMatchScore() + "); " + ruleLabel(rule);

        return switch (fallback) {
            case ESCALATE -> decision(decisionId, ctx, RoutingOutcome.ESCALATED, null, rule, strategy,
                    null, null, null, attempt.scored(), 1, startedAt,
                    why + "; fallback escalate");
            case REASSIGN -> {
                var relaxed = attemptMatch(requirements.relaxed(), strategy);
                if (relaxed.assigned()) {
                    yield assigned(decisionId, ctx, rule, strategy, relaxed, 1, startedAt,
                            why + "; fallback reassign with relaxed constraints (any team, required proficiency "
                                    + "lowered one level, no preferred skills) selected " + relaxed.selected().agentId()
                                    + " with score " + relaxed.selected().totalScore());
                }
                yield enqueue(decisionId, ctx, rule, strategy, relaxed.scored(), 2, startedAt,
                        why + "; fallback reassign found no agent with relaxed constraints");
            }
            case QUEUE -> enqueue(decisionId, ctx, rule, strategy, attempt.scored(), 1, startedAt,
                    why + "; fallback queue");
        };
    }

    private RoutingDecision enqueue(
            String decisionId,
            RoutingContext ctx,
            RoutingRule rule,
            RoutingStrategy strategy,
            List<AgentMatchScore> scored,
            int fallbacksAttempted,
            long startedAt,
            String why
    ) {
        var placed = routingQueue.enqueue(ctx.taskId(), ctx, ctx.priority());
        var wait = routingQueue.estimatedWaitSeconds(placed.queueId());
        return decision(decisionId, ctx, RoutingOutcome.QUEUED, null, rule, strategy,
                placed.queueId(), placed.position(), wait, scored, fallbacksAttempted, startedAt,
                why + "; queued in " + placed.queueId() + " at position " + placed.position()
                        + " (estimated wait " + wait + "s)");
    }

    private RoutingDecision assigned(
            String decisionId,
            RoutingContext ctx,
            RoutingRule rule,
            RoutingStrategy strategy,
            MatchAttempt attempt,
            int fallbacksAttempted,
            long startedAt,
            String why
    ) {
        return decision(decisionId, ctx, RoutingOutcome.ASSIGNED, attempt.selected(), rule, strategy,
                null, null, null, attempt.scored(), fallbacksAttempted, startedAt, why);
    }

    private RoutingDecision decision(
            String decisionId,
            RoutingContext ctx,
            RoutingOutcome outcome,
            AgentMatchScore selected,
            RoutingRule rule,
            RoutingStrategy strategy,
            String queueId,
            Integer queuePosition,
            Long estimatedWaitSeconds,
            List<AgentMatchScore> candidates,
            int fallbacksAttempted,
            long startedAt,
            String reasoning
    ) {
        return new RoutingDecision(
                decisionId,
                ctx.taskId(),
                outcome,
                selected == null ? null : selected.agentId(),
                selected == null ? null : selected.totalScore(),
                reasoning,
                rule == null ? null : rule.ruleId(),
                rule == null ? null : rule.name(),
                strategy,
                queueId,
                queuePosition,
                estimatedWaitSeconds,
                candidates,
                fallbacksAttempted,
                Math.max(0, clock.millis() - startedAt),
                clock.instant()
        );
    }

    private void publish(RoutingDecision decision) {
        Counter.builder("routing.decisions")
                .description("Routing decisions by outcome")
                .tag("outcome", decision.outcome().key())
                .register(meterRegistry)
                .increment();

        log.info("routing_decision decisionId={} taskId={} outcome={} agentId={} score={} rule={} queueId={}",
                decision.decisionId(),
                decision.taskId(),
                decision.outcome().key(),
                decision.selectedAgentId(),
                decision.matchScore(),
                decision.appliedRuleId(),
                decision.queueId());

        eventPublisher.publishEvent(new RoutingDecisionEvent(decision));
    }

    private static String ruleLabel(RoutingRule rule) {
        return rule == null
                ? "no matching routing rule, defaults applied"
                : "rule '" + rule.name() + "' (" + rule.ruleId() + ", priority " + rule.priority() + ")";
    }

    private static String scopeKey(TaskRequirements requirements, RoutingStrategy strategy) {
        return strategy.key() + "|" + (requirements.teamId() == null ? "__all__" : requirements.teamId());
    }
}

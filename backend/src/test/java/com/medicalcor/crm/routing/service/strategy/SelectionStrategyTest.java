package com.medicalcor.crm.routing.service.strategy;

import com.medicalcor.crm.routing.model.AgentMatchScore;
import com.medicalcor.crm.routing.model.RoutingStrategy;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SelectionStrategyTest {

    private static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");

    @Test
    void best_match_orders_by_score_then_proficiency_load_and_age() {
        var candidates = List.of(
                score("low", 40, 40, 0, 2, T0),
                score("busy", 80, 80, 2, 3, T0),
                score("idle", 80, 80, 0, 3, T0.plusSeconds(5)),
                score("idle-older", 80, 80, 0, 3, T0),
                score("expert", 80, 80, 2, 4, T0.plusSeconds(9))
        );

        var ordered = new BestMatchSelectionStrategy().order(new SelectionContext("s", null, candidates));

        assertEquals(List.of("expert", "idle-older", "idle", "busy", "low"), ids(ordered));
    }

    @Test
    void least_occupied_prefers_lowest_task_count() {
        var candidates = List.of(
                score("strong", 90, 90, 2, 4, T0),
                score("free", 45, 45, 0, 2, T0),
                score("free-better", 60, 60, 0, 2, T0)
        );

        var ordered = new LeastOccupiedSelectionStrategy().order(new SelectionContext("s", null, candidates));

        assertEquals(List.of("free-better", "free", "strong"), ids(ordered));
    }

    @Test
    void skills_first_ignores_load_penalty() {
        var candidates = List.of(
                score("loaded-expert", 60, 90, 2, 4, T0),
                score("fresh-basic", 70, 70, 0, 1, T0)
        );

        var ordered = new SkillsFirstSelectionStrategy().order(new SelectionContext("s", null, candidates));

        assertEquals(List.of("loaded-expert", "fresh-basic"), ids(ordered));
    }

    @Test
    void round_robin_starts_after_last_assigned() {
        var candidates = List.of(
                score("c", 50, 50, 0, 1, T0),
                score("a", 90, 90, 0, 1, T0),
                score("b", 70, 70, 0, 1, T0)
        );
        var strategy = new RoundRobinSelectionStrategy();

        assertEquals(List.of("a", "b", "c"), ids(strategy.order(new SelectionContext("s", null, candidates))));
        assertEquals(List.of("b", "c", "a"), ids(strategy.order(new SelectionContext("s", "a", candidates))));
        assertEquals(List.of("a", "b", "c"), ids(strategy.order(new SelectionContext("s", "c", candidates))));
        // last assigned agent no longer qualifies
        assertEquals(List.of("c", "a", "b"), ids(strategy.order(new SelectionContext("s", "bb", candidates))));
    }

    @Test
    void strategies_return_empty_for_no_candidates() {
        assertTrue(new BestMatchSelectionStrategy().order(new SelectionContext("s", null, List.of())).isEmpty());
        assertTrue(new RoundRobinSelectionStrategy().order(null).isEmpty());
    }

    @Test
    void resolver_falls_back_to_best_match() {
        var best = new BestMatchSelectionStrategy();
        var rr = new RoundRobinSelectionStrategy();
        var resolver = new DefaultSelectionStrategyResolver(Map.of("best_match", best, "round_robin", rr));

        assertSame(rr, resolver.resolve(RoutingStrategy.ROUND_ROBIN));
        assertSame(best, resolver.resolve(RoutingStrategy.SKILLS_FIRST));
        assertSame(best, resolver.resolve(null));
    }

    @Test
    void resolver_without_strategies_fails() {
        var resolver = new DefaultSelectionStrategyResolver(Map.of());
        var ex = assertThrows(IllegalStateException.class, () -> resolver.resolve(RoutingStrategy.BEST_MATCH));
        assertEquals("selection_strategy_not_found", ex.getMessage());
    }

    private static AgentMatchScore score(String id, double total, double skill, int load, int primaryLevel, Instant updatedAt) {
        return new AgentMatchScore(id, id, total, skill, load / 3.0, load, primaryLevel, updatedAt, List.of());
    }

    private static List<String> ids(List<AgentMatchScore> scores) {
        return scores.stream().map(AgentMatchScore::agentId).toList();
    }
}

package com.medicalcor.crm.routing.service.strategy;

import com.medicalcor.crm.routing.model.RoutingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class DefaultSelectionStrategyResolver implements SelectionStrategyResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultSelectionStrategyResolver.class);

    private final Map<String, SelectionStrategy> strategies;

    public DefaultSelectionStrategyResolver(Map<String, SelectionStrategy> strategies) {
        this.strategies = strategies;
    }

    @Override
    public SelectionStrategy resolve(RoutingStrategy strategy) {
        var key = strategy == null ? RoutingStrategy.BEST_MATCH.key() : strategy.key();
        var picked = strategies == null ? null : strategies.get(key);
        if (picked != null) return picked;

        var fallback = strategies == null ? null : strategies.get(RoutingStrategy.BEST_MATCH.key());
        if (fallback != null) {
            log.warn("unknown_selection_strategy strategy={} fallback=best_match", key);
            return fallback;
        }

        throw new IllegalStateException("selection_strategy_not_found");
    }
}

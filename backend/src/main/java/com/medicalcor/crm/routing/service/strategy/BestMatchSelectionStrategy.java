package com.medicalcor.crm.routing.service.strategy;

import com.medicalcor.crm.routing.model.AgentMatchScore;
import org.springframework.stereotype.Component;

import java.util.List;

@Component("best_match")
public class BestMatchSelectionStrategy implements SelectionStrategy {

    @Override
    public List<AgentMatchScore> order(SelectionContext ctx) {
        if (ctx == null || ctx.candidates() == null || ctx.candidates().isEmpty()) return List.of();
        return ctx.candidates().stream().sorted(BY_SCORE).toList();
    }
}

package com.medicalcor.crm.routing.service.strategy;

import com.medicalcor.crm.routing.model.AgentMatchScore;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Skill component decides; load and the remaining score only break ties.
 */
@Component("skills_first")
public class SkillsFirstSelectionStrategy implements SelectionStrategy {

    private static final Comparator<AgentMatchScore> ORDER = Comparator
            .comparingDouble(AgentMatchScore::skillScore).reversed()
            .thenComparingInt(AgentMatchScore::currentTaskCount)
            .thenComparing(BY_SCORE);

    @Override
    public List<AgentMatchScore> order(SelectionContext ctx) {
        if (ctx == null || ctx.candidates() == null || ctx.candidates().isEmpty()) return List.of();
        return ctx.candidates().stream().sorted(ORDER).toList();
    }
}

package com.medicalcor.crm.routing.service.strategy;

import com.medicalcor.crm.routing.model.AgentMatchScore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rotates through qualified candidates in agent-id order, starting after the agent last assigned in the same scope.
 */
@Component("round_robin")
public class RoundRobinSelectionStrategy implements SelectionStrategy {

    @Override
    public List<AgentMatchScore> order(SelectionContext ctx) {
        if (ctx == null || ctx.candidates() == null || ctx.candidates().isEmpty()) return List.of();

        var candidates = ctx.candidates().stream()
                .sorted(Comparator.comparing(AgentMatchScore::agentId))
                .toList();
        var last = ctx.lastAgentId();

        // first agent after the last assigned one; the last one may have dropped out of the pool
        int startIdx = 0;
        if (last != null && !last.isBlank()) {
            for (int i = 0; i < candidates.size(); i++) {
                if (candidates.get(i).agentId().compareTo(last) > 0) {
                    startIdx = i;
                    break;
                }
            }
        }

        var rotated = new ArrayList<AgentMatchScore>(candidates.size());
        for (int offset = 0; offset < candidates.size(); offset++) {
            rotated.add(candidates.get((startIdx + offset) % candidates.size()));
        }
        return rotated;
    }
}

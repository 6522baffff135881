package com.medicalcor.crm.routing.service.strategy;

import com.medicalcor.crm.routing.model.AgentMatchScore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

public interface SelectionStrategy {

    /**
     * Score first, then highest proficiency on the primary required skill, then lowest load, then least recently
     * updated. Agent id settles anything left.
     */
    Comparator<AgentMatchScore> BY_SCORE = Comparator
            .comparingDouble(AgentMatchScore::totalScore).reversed()
            .thenComparing(Comparator.comparingInt(AgentMatchScore::primarySkillLevel).reversed())
            .thenComparingInt(AgentMatchScore::currentTaskCount)
            .thenComparing(AgentMatchScore::updatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(AgentMatchScore::agentId);

    /**
     * @return qualified candidates in the order capacity should be attempted; empty if none
     */
    List<AgentMatchScore> order(SelectionContext ctx);
}

package com.medicalcor.crm.routing.repo;

import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last worker assigned per routing scope, read by the round-robin strategy.
 */
@Repository
public class AssignCursorRegistry {

    private final Map<String, String> lastAgentByScope = new ConcurrentHashMap<>();

    public Optional<String> getLastAgent(String scopeKey) {
        if (scopeKey == null) return Optional.empty();
        return Optional.ofNullable(lastAgentByScope.get(scopeKey));
    }

    public void updateLastAgent(String scopeKey, String agentId) {
        if (scopeKey == null || agentId == null) return;
        lastAgentByScope.put(scopeKey, agentId);
    }

    public void clear() {
        lastAgentByScope.clear();
    }
}

package com.medicalcor.crm.routing.repo;

import com.medicalcor.crm.routing.model.RoutingConditions;
import com.medicalcor.crm.routing.model.RoutingRule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Replacing a rule keeps its original insertion slot, which is what breaks priority ties.
 */
public class InMemoryRoutingRuleStore implements RoutingRuleStore {

    private static final Comparator<RoutingRule> BY_PRIORITY_DESC =
            Comparator.comparingInt(RoutingRule::priority).reversed();

    private final Map<String, RoutingRule> rules = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void upsert(RoutingRule rule) {
        if (rule == null || rule.ruleId() == null || rule.ruleId().isBlank()) {
            throw new IllegalArgumentException("rule_id_required");
        }
        lock.writeLock().lock();
        try {
            rules.put(rule.ruleId(), rule);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void remove(String ruleId) {
        if (ruleId == null) return;
        lock.writeLock().lock();
        try {
            rules.remove(ruleId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<RoutingRule> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(rules.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            rules.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<RoutingRule> active() {
        var list = new ArrayList<RoutingRule>();
        for (var r : all()) {
            if (r.active()) list.add(r);
        }
        // List.sort is stable
        list.sort(BY_PRIORITY_DESC);
        return List.copyOf(list);
    }

    @Override
    public Optional<RoutingRule> byId(String ruleId) {
        if (ruleId == null) return Optional.empty();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(rules.get(ruleId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<RoutingRule> matching(RoutingConditions query) {
        return active().stream()
                .filter(r -> r.conditions().admits(query))
                .toList();
    }
}

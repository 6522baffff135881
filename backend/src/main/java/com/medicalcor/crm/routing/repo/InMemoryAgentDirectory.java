package com.medicalcor.crm.routing.repo;

import com.medicalcor.crm.routing.model.AgentAvailability;
import com.medicalcor.crm.routing.model.AgentProfile;
import com.medicalcor.crm.routing.model.Proficiency;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Profiles are immutable records swapped under a write lock, so readers only ever copy whole records.
 */
public class InMemoryAgentDirectory implements AgentDirectory {

    private final Map<String, AgentProfile> agents = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public InMemoryAgentDirectory(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void upsert(AgentProfile profile) {
        if (profile == null || profile.agentId() == null || profile.agentId().isBlank()) {
            throw new IllegalArgumentException("agent_id_required");
        }
        lock.writeLock().lock();
        try {
            agents.put(profile.agentId(), profile);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void remove(String agentId) {
        if (agentId == null) return;
        lock.writeLock().lock();
        try {
            agents.remove(agentId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<AgentProfile> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(agents.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            agents.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<AgentProfile> available(String teamId) {
        var team = teamId == null || teamId.isBlank() ? null : teamId;
        return all().stream()
                .filter(AgentProfile::isAvailable)
                .filter(a -> team == null || team.equals(a.teamId()))
                .toList();
    }

    @Override
    public Optional<AgentProfile> byId(String agentId) {
        if (agentId == null) return Optional.empty();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(agents.get(agentId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<AgentProfile> bySkill(String skillId, Proficiency minProficiency) {
        return all().stream()
                .filter(a -> a.activeSkill(skillId)
                        .map(s -> s.proficiency().atLeast(minProficiency))
                        .orElse(false))
                .toList();
    }

    @Override
    public void setAvailability(String agentId, AgentAvailability availability) {
        if (availability == null) return;
        update(agentId, a -> a.withAvailability(availability, clock.instant()));
    }

    @Override
    public void setTaskCount(String agentId, int taskCount) {
        update(agentId, a -> a.withTaskCount(taskCount, clock.instant()));
    }

    @Override
    public Optional<AgentProfile> tryReserve(String agentId, Predicate<AgentProfile> stillEligible) {
        if (agentId == null) return Optional.empty();
        lock.writeLock().lock();
        try {
            var current = agents.get(agentId);
            if (current == null || !current.isAvailable() || !current.hasCapacity()) {
                return Optional.empty();
            }
            if (stillEligible != null && !stillEligible.test(current)) {
                return Optional.empty();
            }
            var reserved = current.withTaskCount(current.currentTaskCount() + 1, clock.instant());
            agents.put(agentId, reserved);
            return Optional.of(reserved);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<AgentProfile> release(String agentId) {
        return update(agentId, a -> a.withTaskCount(Math.max(0, a.currentTaskCount() - 1), clock.instant()));
    }

    private Optional<AgentProfile> update(String agentId, UnaryOperator<AgentProfile> change) {
        if (agentId == null) return Optional.empty();
        lock.writeLock().lock();
        try {
            var current = agents.get(agentId);
            if (current == null) return Optional.empty();
            var next = change.apply(current);
            agents.put(agentId, next);
            return Optional.of(next);
        } finally {
            lock.writeLock().unlock();
        }
    }
}

package com.medicalcor.crm.routing.repo;

import com.medicalcor.crm.routing.model.AgentAvailability;
import com.medicalcor.crm.routing.model.AgentProfile;
import com.medicalcor.crm.routing.model.Proficiency;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Registry of worker profiles. Lookups of unknown ids return empty, and mutations of unknown ids are no-ops.
 */
public interface AgentDirectory {

    /**
     * Insert or fully replace a profile by id.
     */
    void upsert(AgentProfile profile);

    void remove(String agentId);

    List<AgentProfile> all();

    void clear();

    /**
     * Workers whose availability is {@code available}, restricted to one team when {@code teamId} is non-blank.
     */
    List<AgentProfile> available(String teamId);

    Optional<AgentProfile> byId(String agentId);

    /**
     * Workers holding an active entry for {@code skillId} at {@code minProficiency} or above (any level when null).
     */
    List<AgentProfile> bySkill(String skillId, Proficiency minProficiency);

    void setAvailability(String agentId, AgentAvailability availability);

    void setTaskCount(String agentId, int taskCount);

    /**
     * Atomically increment the worker's task count if it is still available, below capacity and accepted by
     * {@code stillEligible}, all evaluated against the current record.
     *
     * @return the updated profile, or empty if the reservation was refused
     */
    Optional<AgentProfile> tryReserve(String agentId, Predicate<AgentProfile> stillEligible);

    /**
     * Decrement the worker's task count, never below zero.
     */
    Optional<AgentProfile> release(String agentId);
}

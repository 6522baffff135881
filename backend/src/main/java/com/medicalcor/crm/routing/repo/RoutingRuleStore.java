package com.medicalcor.crm.routing.repo;

import com.medicalcor.crm.routing.model.RoutingConditions;
import com.medicalcor.crm.routing.model.RoutingRule;

import java.util.List;
import java.util.Optional;

public interface RoutingRuleStore {

    void upsert(RoutingRule rule);

    void remove(String ruleId);

    List<RoutingRule> all();

    void clear();

    /**
     * Active rules by descending priority; equal priorities keep insertion order.
     */
    List<RoutingRule> active();

    Optional<RoutingRule> byId(String ruleId);

    /**
     * Active rules, in {@link #active()} order, whose conditions admit the given partial query.
     */
    List<RoutingRule> matching(RoutingConditions query);
}

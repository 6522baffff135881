package com.medicalcor.crm.routing.service;

import com.medicalcor.crm.routing.model.RoutingDecision;

/**
 * Published once per decision; delivery to the worker and audit persistence happen in listeners outside this module.
 */
public record RoutingDecisionEvent(RoutingDecision decision) {
}

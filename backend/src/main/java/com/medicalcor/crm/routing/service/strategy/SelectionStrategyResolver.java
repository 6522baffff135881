package com.medicalcor.crm.routing.service.strategy;

import com.medicalcor.crm.routing.model.RoutingStrategy;

public interface SelectionStrategyResolver {

    SelectionStrategy resolve(RoutingStrategy strategy);
}

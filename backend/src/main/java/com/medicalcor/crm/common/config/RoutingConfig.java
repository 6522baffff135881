package com.medicalcor.crm.common.config;

import com.medicalcor.crm.routing.repo.AgentDirectory;
import com.medicalcor.crm.routing.repo.InMemoryAgentDirectory;
import com.medicalcor.crm.routing.repo.InMemoryRoutingQueue;
import com.medicalcor.crm.routing.repo.InMemoryRoutingRuleStore;
import com.medicalcor.crm.routing.repo.RoutingQueue;
import com.medicalcor.crm.routing.repo.RoutingRuleStore;
import com.medicalcor.crm.routing.repo.SkillHierarchy;
import com.medicalcor.crm.routing.service.AgentScorer;
import com.medicalcor.crm.routing.service.RoutingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * In-memory stores. Swapping in durable implementations means replacing these beans.
 */
@Configuration
public class RoutingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AgentDirectory agentDirectory(Clock clock) {
        return new InMemoryAgentDirectory(clock);
    }

    @Bean
    public RoutingRuleStore routingRuleStore() {
        return new InMemoryRoutingRuleStore();
    }

    @Bean
    public RoutingQueue routingQueue(RoutingProperties properties, Clock clock) {
        var queue = properties.queue();
        return new InMemoryRoutingQueue(queue.defaultQueueId(), queue.averageHandlingSeconds(), clock);
    }

    @Bean
    public AgentScorer agentScorer(RoutingProperties properties, SkillHierarchy skillHierarchy) {
        return new AgentScorer(properties, skillHierarchy);
    }
}

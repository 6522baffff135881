package com.medicalcor.crm.routing.service;

import com.medicalcor.crm.routing.model.FallbackBehavior;
import com.medicalcor.crm.routing.model.RoutingStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.time.ZoneOffset;

@ConfigurationProperties(prefix = "app.routing")
public record RoutingProperties(
        RoutingStrategy defaultStrategy,
        FallbackBehavior defaultFallback,
        double minimumMatchScore,
        double maxConcurrentTaskRatio,
        Boolean skillInheritance,
        ZoneId timeZone,
        Weights weights,
        Queue queue,
        Drain drain
) {
    public RoutingProperties {
        if (defaultStrategy == null) defaultStrategy = RoutingStrategy.BEST_MATCH;
        if (defaultFallback == null) defaultFallback = FallbackBehavior.QUEUE;
        if (minimumMatchScore <= 0) minimumMatchScore = 30;
        if (maxConcurrentTaskRatio <= 0 || maxConcurrentTaskRatio > 1) maxConcurrentTaskRatio = 1.0;
        if (skillInheritance == null) skillInheritance = true;
        if (timeZone == null) timeZone = ZoneOffset.UTC;
        if (weights == null) weights = new Weights(50, 5, 10, 20, 5, 30);
        if (queue == null) queue = new Queue(null, 0);
        if (drain == null) drain = new Drain(false, 50);
    }

    public static RoutingProperties defaults() {
        return new RoutingProperties(null, null, 0, 0, null, null, null, null, null);
    }

    public record Weights(
            double requiredSkillBase,
            double proficiencySurplusBonus,
            double preferredSkillBonus,
            double preferredAgentBonus,
            double preferredLanguageBonus,
            double loadPenalty
    ) {
    }

    public record Queue(String defaultQueueId, long averageHandlingSeconds) {
        public Queue {
            if (defaultQueueId == null || defaultQueueId.isBlank()) defaultQueueId = "default";
            if (averageHandlingSeconds <= 0) averageHandlingSeconds = 120;
        }
    }

    public record Drain(boolean enabled, int batchSize) {
        public Drain {
            batchSize = Math.max(1, Math.min(batchSize <= 0 ? 50 : batchSize, 500));
        }
    }
}

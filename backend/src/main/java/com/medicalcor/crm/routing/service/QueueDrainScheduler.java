package com.medicalcor.crm.routing.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically retries queued tasks against the current agent pool.
 */
@Component
@ConditionalOnProperty(prefix = "app.routing.drain", name = "enabled", havingValue = "true")
public class QueueDrainScheduler {

    private static final Logger log = LoggerFactory.getLogger(QueueDrainScheduler.class);

    private final DispatchService dispatchService;
    private final int batchSize;

    public QueueDrainScheduler(DispatchService dispatchService, RoutingProperties properties) {
        this.dispatchService = dispatchService;
        this.batchSize = properties.drain().batchSize();
    }

    @Scheduled(fixedDelayString = "${app.routing.drain.interval-ms:5000}")
    public void drainQueues() {
        try {
            for (var result : dispatchService.drainAll(batchSize)) {
                if (result.assignedCount() > 0) {
                    log.info("queue_drain queueId={} assigned={}", result.queueId(), result.assignedCount());
                }
            }
        } catch (Exception e) {
            log.warn("queue_drain_failed", e);
        }
    }
}

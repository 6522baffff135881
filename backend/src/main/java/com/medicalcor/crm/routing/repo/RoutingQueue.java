package com.medicalcor.crm.routing.repo;

import com.medicalcor.crm.routing.model.EnqueueResult;
import com.medicalcor.crm.routing.model.QueuedTask;
import com.medicalcor.crm.routing.model.RoutingContext;

import java.util.List;
import java.util.Optional;

/**
 * Priority-ordered holding area for tasks waiting on a worker. A task lives in exactly one queue: the context's
 * team id when present, otherwise {@link #defaultQueueId()}.
 */
public interface RoutingQueue {

    String defaultQueueId();

    void ensureQueue(String queueId);

    /**
     * Insert behind every task of greater or equal priority. Enqueueing an id that is already queued is a no-op
     * that reports the task's current placement.
     */
    EnqueueResult enqueue(String taskId, RoutingContext context, int priority);

    Optional<String> dequeue(String queueId);

    /**
     * 1-indexed rank within the task's queue, computed at call time.
     */
    Optional<Integer> position(String taskId);

    long estimatedWaitSeconds(String queueId);

    boolean remove(String taskId);

    int length(String queueId);

    List<QueuedTask> tasks(String queueId);

    List<String> queueIds();

    void clear();
}

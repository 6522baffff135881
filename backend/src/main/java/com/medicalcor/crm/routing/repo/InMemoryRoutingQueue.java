package com.medicalcor.crm.routing.repo;

import com.medicalcor.crm.routing.model.EnqueueResult;
import com.medicalcor.crm.routing.model.QueuedTask;
import com.medicalcor.crm.routing.model.RoutingContext;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Each queue is guarded by its own monitor; operations on different queues never contend.
 * The task index is only written while holding the owning queue's monitor.
 */
public class InMemoryRoutingQueue implements RoutingQueue {

    private final String defaultQueueId;
    private final long averageHandlingSeconds;
    private final Clock clock;

    private final ConcurrentMap<String, TaskQueue> queues = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> taskIndex = new ConcurrentHashMap<>();

    public InMemoryRoutingQueue(String defaultQueueId, long averageHandlingSeconds, Clock clock) {
        this.defaultQueueId = defaultQueueId == null || defaultQueueId.isBlank() ? "default" : defaultQueueId;
        this.averageHandlingSeconds = Math.max(0, averageHandlingSeconds);
        this.clock = clock;
        ensureQueue(this.defaultQueueId);
    }

    @Override
    public String defaultQueueId() {
        return defaultQueueId;
    }

    @Override
    public void ensureQueue(String queueId) {
        if (queueId == null || queueId.isBlank()) return;
        queues.computeIfAbsent(queueId, TaskQueue::new);
    }

    @Override
    public EnqueueResult enqueue(String taskId, RoutingContext context, int priority) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("task_id_required");
        }
        var queueId = context != null && context.teamId() != null ? context.teamId() : defaultQueueId;
        var queue = queues.computeIfAbsent(queueId, TaskQueue::new);

        synchronized (queue) {
            var existingQueueId = taskIndex.putIfAbsent(taskId, queueId);
            if (existingQueueId == null) {
                var task = new QueuedTask(taskId, queueId, priority, clock.instant(), context);
                return new EnqueueResult(queueId, queue.insert(task));
            }
        }
        // Already queued (possibly elsewhere); report where it sits now.
        var current = taskIndex.get(taskId);
        return new EnqueueResult(current == null ? queueId : current, position(taskId).orElse(0));
    }

    @Override
    public Optional<String> dequeue(String queueId) {
        var queue = queueId == null ? null : queues.get(queueId);
        if (queue == null) return Optional.empty();
        synchronized (queue) {
            if (queue.tasks.isEmpty()) return Optional.empty();
            var head = queue.tasks.remove(0);
            taskIndex.remove(head.taskId(), queueId);
            return Optional.of(head.taskId());
        }
    }

    @Override
    public Optional<Integer> position(String taskId) {
        var queueId = taskId == null ? null : taskIndex.get(taskId);
        var queue = queueId == null ? null : queues.get(queueId);
        if (queue == null) return Optional.empty();
        synchronized (queue) {
            var idx = queue.indexOf(taskId);
            return idx < 0 ? Optional.empty() : Optional.of(idx + 1);
        }
    }

    @Override
    public long estimatedWaitSeconds(String queueId) {
        return length(queueId) * averageHandlingSeconds;
    }

    @Override
    public boolean remove(String taskId) {
        var queueId = taskId == null ? null : taskIndex.get(taskId);
        var queue = queueId == null ? null : queues.get(queueId);
        if (queue == null) return false;
        synchronized (queue) {
            var idx = queue.indexOf(taskId);
            if (idx < 0) return false;
            queue.tasks.remove(idx);
            taskIndex.remove(taskId, queueId);
            return true;
        }
    }

    @Override
    public int length(String queueId) {
        var queue = queueId == null ? null : queues.get(queueId);
        if (queue == null) return 0;
        synchronized (queue) {
            return queue.tasks.size();
        }
    }

    @Override
    public List<QueuedTask> tasks(String queueId) {
        var queue = queueId == null ? null : queues.get(queueId);
        if (queue == null) return List.of();
        synchronized (queue) {
            return List.copyOf(queue.tasks);
        }
    }

    @Override
    public List<String> queueIds() {
        return queues.keySet().stream().sorted().toList();
    }

    @Override
    public void clear() {
        queues.clear();
        taskIndex.clear();
        ensureQueue(defaultQueueId);
    }

    private static final class TaskQueue {
        private final String queueId;
        private final List<QueuedTask> tasks = new ArrayList<>();

        private TaskQueue(String queueId) {
            this.queueId = queueId;
        }

        /**
         * @return 1-indexed position of the inserted task
         */
        private int insert(QueuedTask task) {
            var idx = tasks.size();
            for (int i = 0; i < tasks.size(); i++) {
                if (tasks.get(i).priority() < task.priority()) {
                    idx = i;
                    break;
                }
            }
            tasks.add(idx, task);
            return idx + 1;
        }

        private int indexOf(String taskId) {
            for (int i = 0; i < tasks.size(); i++) {
                if (tasks.get(i).taskId().equals(taskId)) return i;
            }
            return -1;
        }

        @Override
        public String toString() {
            return "TaskQueue{" + queueId + ", size=" + tasks.size() + "}";
        }
    }
}

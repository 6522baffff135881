package com.medicalcor.crm.routing.api;

import com.medicalcor.crm.common.api.ApiResponse;
import com.medicalcor.crm.routing.repo.RoutingQueue;
import com.medicalcor.crm.routing.service.DispatchService;
import com.medicalcor.crm.routing.service.RoutingProperties;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/routing/queues")
public class RoutingQueueController {

    private final RoutingQueue routingQueue;
    private final DispatchService dispatchService;
    private final RoutingProperties properties;

    public RoutingQueueController(RoutingQueue routingQueue, DispatchService dispatchService, RoutingProperties properties) {
        this.routingQueue = routingQueue;
        this.dispatchService = dispatchService;
        this.properties = properties;
    }

    @GetMapping
    public ApiResponse<List<QueueSummary>> list() {
        return ApiResponse.ok(routingQueue.queueIds().stream()
                .map(id -> new QueueSummary(id, routingQueue.length(id), routingQueue.estimatedWaitSeconds(id), List.of()))
                .toList());
    }

    @GetMapping("/{queueId}")
    public ApiResponse<QueueSummary> get(@PathVariable("queueId") String queueId) {
        requireQueue(queueId);
        var tasks = routingQueue.tasks(queueId);
        return ApiResponse.ok(new QueueSummary(queueId, tasks.size(), routingQueue.estimatedWaitSeconds(queueId), tasks));
    }

    @GetMapping("/tasks/{taskId}/position")
    public ApiResponse<TaskPositionResponse> position(@PathVariable("taskId") String taskId) {
        var position = routingQueue.position(taskId)
                .orElseThrow(() -> new IllegalArgumentException("queued_task_not_found"));
        return ApiResponse.ok(new TaskPositionResponse(taskId, position));
    }

    @DeleteMapping("/tasks/{taskId}")
    public ApiResponse<Void> remove(@PathVariable("taskId") String taskId) {
        if (!routingQueue.remove(taskId)) {
            throw new IllegalArgumentException("queued_task_not_found");
        }
        return ApiResponse.ok(null);
    }

    @PostMapping("/{queueId}/drain")
    public ApiResponse<DispatchService.DrainResult> drain(
            @PathVariable("queueId") String queueId,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        requireQueue(queueId);
        var max = limit == null ? properties.drain().batchSize() : Math.max(1, Math.min(limit, 500));
        return ApiResponse.ok(dispatchService.drainQueue(queueId, max));
    }

    private void requireQueue(String queueId) {
        if (!routingQueue.queueIds().contains(queueId)) {
            throw new IllegalArgumentException("queue_not_found");
        }
    }
}

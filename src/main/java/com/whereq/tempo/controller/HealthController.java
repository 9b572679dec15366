package com.whereq.tempo.controller;

import com.whereq.tempo.executor.ProcessorRegistry;
import com.whereq.tempo.executor.WorkerScheduler;
import com.whereq.tempo.metrics.MetricsCollector;
import com.whereq.tempo.queue.JobStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and queue status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private JobStore jobStore;

    @Autowired
    private WorkerScheduler workerScheduler;

    @Autowired
    private ProcessorRegistry processorRegistry;

    @Autowired
    private MetricsCollector metricsCollector;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service is running and the queue has headroom")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromSupplier(() -> {
            int queueLength = jobStore.queueLength();

            Map<String, Object> health = new HashMap<>();
            health.put("status", "UP");
            health.put("service", "whereq-tempo");

            Map<String, Object> queueInfo = new HashMap<>();
            queueInfo.put("status", metricsCollector.health(queueLength));
            queueInfo.put("queueLength", queueLength);
            queueInfo.put("running", workerScheduler.runningCount());
            health.put("queue", queueInfo);

            health.put("processors", processorRegistry.types());
            return ResponseEntity.ok(health);
        });
    }
}

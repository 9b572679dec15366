package com.whereq.tempo.controller;

import com.whereq.tempo.metrics.MetricsCollector;
import com.whereq.tempo.model.MetricsSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Operational snapshot for operators. Access control is handled upstream.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Tag(name = "Admin", description = "Queue and admission metrics")
public class AdminMetricsController {

    private final MetricsCollector metricsCollector;

    @GetMapping("/metrics")
    @Operation(summary = "Metrics snapshot", description = "Queue, scheduler and rate limiter state")
    public Mono<ResponseEntity<MetricsSnapshot>> metrics() {
        return Mono.fromSupplier(metricsCollector::snapshot)
            .map(ResponseEntity::ok);
    }
}

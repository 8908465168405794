package com.defaultrisk.infrastructure.health;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reports the batch workers of this instance under {@code /actuator/health} as
 * {@code workers}. DOWN when no worker is running.
 */
@Component("workersHealthIndicator")
@RequiredArgsConstructor
public class WorkerPoolHealthIndicator implements HealthIndicator {

    private final WorkerDiagnosticsService diagnosticsService;

    @Override
    public Health health() {
        List<WorkerSnapshot> workers = diagnosticsService.workers();
        List<String> active = workers.stream()
                .filter(WorkerSnapshot::isRunning)
                .map(WorkerSnapshot::getName)
                .collect(Collectors.toList());

        Health.Builder builder = active.isEmpty() ? Health.down() : Health.up();
        return builder
                .withDetail("activeWorkers", active.size())
                .withDetail("workers", active)
                .build();
    }
}

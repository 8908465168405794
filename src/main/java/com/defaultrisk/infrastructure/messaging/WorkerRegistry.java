package com.defaultrisk.infrastructure.messaging;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * What each worker of this instance is doing right now. Diagnostics only.
 */
@Component
public class WorkerRegistry {

    private final Map<String, WorkerActivity> activities = new ConcurrentHashMap<>();

    public void jobStarted(String workerName, UUID jobId) {
        activities.compute(workerName, (name, current) -> new WorkerActivity(
                name, jobId, Instant.now(), current == null ? 0 : current.getJobsCompleted()));
    }

    public void jobFinished(String workerName) {
        activities.compute(workerName, (name, current) -> new WorkerActivity(
                name, null, null, current == null ? 1 : current.getJobsCompleted() + 1));
    }

    public Optional<WorkerActivity> activity(String workerName) {
        return Optional.ofNullable(activities.get(workerName));
    }

    @Value
    public static class WorkerActivity {
        String workerName;
        UUID activeJobId;
        Instant activeSince;
        long jobsCompleted;
    }
}

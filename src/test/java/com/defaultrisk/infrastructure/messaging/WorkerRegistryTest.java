package com.defaultrisk.infrastructure.messaging;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRegistryTest {

    private final WorkerRegistry registry = new WorkerRegistry();

    @Test
    void activity_tracksCurrentJobAndCompletedCount() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        registry.jobStarted("batch-workers-0", first);
        assertEquals(first, registry.activity("batch-workers-0").orElseThrow().getActiveJobId());
        assertNotNull(registry.activity("batch-workers-0").orElseThrow().getActiveSince());

        registry.jobFinished("batch-workers-0");
        registry.jobStarted("batch-workers-0", second);

        WorkerRegistry.WorkerActivity activity = registry.activity("batch-workers-0").orElseThrow();
        assertEquals(second, activity.getActiveJobId());
        assertEquals(1, activity.getJobsCompleted());

        registry.jobFinished("batch-workers-0");
        assertNull(registry.activity("batch-workers-0").orElseThrow().getActiveJobId());
        assertEquals(2, registry.activity("batch-workers-0").orElseThrow().getJobsCompleted());
    }

    @Test
    void activity_unknownWorker_isEmpty() {
        assertTrue(registry.activity("batch-workers-9").isEmpty());
    }
}

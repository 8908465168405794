package com.defaultrisk.infrastructure.health;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Observed state of one worker: liveness, the job it is running (if any) and the
 * topic partitions reserved to it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerSnapshot {

    private String name;
    private boolean running;
    private UUID activeJobId;
    private Instant activeSince;
    private List<String> reservedPartitions;
    private long jobsCompleted;
}

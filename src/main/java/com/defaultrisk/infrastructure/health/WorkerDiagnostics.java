package com.defaultrisk.infrastructure.health;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkerDiagnostics {

    private List<WorkerSnapshot> workers;
    private long scheduledJobs;
}

package com.defaultrisk.api;

import com.defaultrisk.infrastructure.persistence.entity.BatchJobEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmissionResponse {

    private UUID jobId;
    private BatchJobEntity.JobStatus status;
}

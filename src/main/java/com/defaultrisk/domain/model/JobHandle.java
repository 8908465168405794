package com.defaultrisk.domain.model;

import com.defaultrisk.infrastructure.persistence.entity.BatchJobEntity;
import lombok.Value;

import java.util.UUID;

@Value
public class JobHandle {

    UUID jobId;
    BatchJobEntity.JobStatus status;
}

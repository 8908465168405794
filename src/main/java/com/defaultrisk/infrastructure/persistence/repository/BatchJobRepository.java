package com.defaultrisk.infrastructure.persistence.repository;

import com.defaultrisk.infrastructure.persistence.entity.BatchJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface BatchJobRepository extends JpaRepository<BatchJobEntity, UUID> {

    long countByStatus(BatchJobEntity.JobStatus status);
}

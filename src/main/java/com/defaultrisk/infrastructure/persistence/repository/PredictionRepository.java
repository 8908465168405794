package com.defaultrisk.infrastructure.persistence.repository;

import com.defaultrisk.infrastructure.persistence.entity.PredictionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PredictionRepository extends JpaRepository<PredictionEntity, UUID> {

    List<PredictionEntity> findByCompanyIdOrderByPredictedAtAsc(UUID companyId);
}

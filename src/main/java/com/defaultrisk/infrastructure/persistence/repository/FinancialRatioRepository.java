package com.defaultrisk.infrastructure.persistence.repository;

import com.defaultrisk.infrastructure.persistence.entity.FinancialRatioEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FinancialRatioRepository extends JpaRepository<FinancialRatioEntity, UUID> {

    List<FinancialRatioEntity> findByCompanyIdOrderByCreatedAtAsc(UUID companyId);
}

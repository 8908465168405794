package com.defaultrisk.domain.service;

import com.defaultrisk.domain.exception.CompanyConflictException;
import com.defaultrisk.domain.model.CompanyDescriptor;
import com.defaultrisk.infrastructure.persistence.entity.CompanyEntity;
import com.defaultrisk.infrastructure.persistence.repository.CompanyRepository;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.UUID;

/**
 * Lookup-or-create of companies by stock symbol.
 *
 * Resolution Flow:
 * 1. Look the symbol up in the caller's unit of work
 * 2. If absent, insert the company in its own transaction, committed immediately
 * 3. If the insert loses a race on the unique symbol constraint, look up again
 *
 * Creating in a separate transaction keeps a constraint violation from poisoning the
 * caller's unit of work, and makes the new company visible to every other worker as
 * soon as it exists. A conflict whose winner is not yet visible is retried
 * (see {@code resilience4j.retry.instances.companyResolution}).
 */
@Slf4j
@Service
public class CompanyResolver {

    private final CompanyRepository companyRepository;
    private final TransactionTemplate createTemplate;
    private final MeterRegistry meterRegistry;

    public CompanyResolver(CompanyRepository companyRepository,
                           PlatformTransactionManager transactionManager,
                           MeterRegistry meterRegistry) {
        this.companyRepository = companyRepository;
        this.meterRegistry = meterRegistry;
        this.createTemplate = new TransactionTemplate(transactionManager);
        this.createTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.createTemplate.setName("company-create");
    }

    /**
     * @return id of the existing or newly created company
     */
    @Retry(name = "companyResolution")
    public UUID resolve(CompanyDescriptor descriptor) {
        Optional<CompanyEntity> existing = companyRepository.findBySymbol(descriptor.getSymbol());
        if (existing.isPresent()) {
            log.debug("Resolved existing company {} -> {}", descriptor.getSymbol(), existing.get().getCompanyId());
            return existing.get().getCompanyId();
        }

        try {
            CompanyEntity created = createTemplate.execute(status -> companyRepository.saveAndFlush(
                    CompanyEntity.builder()
                            .symbol(descriptor.getSymbol())
                            .name(descriptor.getName())
                            .marketCap(descriptor.getMarketCap())
                            .sector(descriptor.getSector())
                            .build()));

            Counter.builder("company.resolved")
                    .tag("result", "created")
                    .register(meterRegistry)
                    .increment();

            log.info("Created company {} ({})", descriptor.getSymbol(), created.getCompanyId());
            return created.getCompanyId();

        } catch (DataIntegrityViolationException e) {
            log.info("Company {} was created concurrently, falling back to lookup", descriptor.getSymbol());

            Counter.builder("company.resolved")
                    .tag("result", "conflict")
                    .register(meterRegistry)
                    .increment();

            return companyRepository.findBySymbol(descriptor.getSymbol())
                    .map(CompanyEntity::getCompanyId)
                    .orElseThrow(() -> new CompanyConflictException(
                            descriptor.getSymbol(), FailureMessages.describe(e), e));
        }
    }
}

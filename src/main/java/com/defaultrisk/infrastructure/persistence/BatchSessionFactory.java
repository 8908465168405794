package com.defaultrisk.infrastructure.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.jpa.EntityManagerHolder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Opens {@link BatchSession}s backed by one JPA {@link EntityManager} per batch.
 *
 * The entity manager is bound to the worker thread for the lifetime of the session,
 * so every repository call and every per-record transaction of the batch goes through
 * it. On rollback the transaction manager clears the bound persistence context, which
 * keeps a failed record's pending state out of later records.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchSessionFactory {

    private final EntityManagerFactory entityManagerFactory;
    private final PlatformTransactionManager transactionManager;

    public BatchSession open() {
        if (TransactionSynchronizationManager.hasResource(entityManagerFactory)) {
            throw new IllegalStateException("A persistence session is already bound to this thread");
        }
        EntityManager entityManager = entityManagerFactory.createEntityManager();
        TransactionSynchronizationManager.bindResource(entityManagerFactory, new EntityManagerHolder(entityManager));
        log.debug("Opened batch session on thread {}", Thread.currentThread().getName());
        return new JpaBatchSession(entityManager);
    }

    private final class JpaBatchSession implements BatchSession {

        private final EntityManager entityManager;
        private TransactionStatus current;
        private boolean closed;

        private JpaBatchSession(EntityManager entityManager) {
            this.entityManager = entityManager;
        }

        @Override
        public void begin() {
            if (closed) {
                throw new IllegalStateException("Batch session is closed");
            }
            if (current != null && !current.isCompleted()) {
                throw new IllegalStateException("A unit of work is already open");
            }
            DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
            definition.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
            definition.setName("batch-record");
            current = transactionManager.getTransaction(definition);
        }

        @Override
        public void commit() {
            if (current == null || current.isCompleted()) {
                throw new IllegalStateException("No open unit of work to commit");
            }
            TransactionStatus status = current;
            current = null;
            transactionManager.commit(status);
            // committed records stay in the database, not in memory
            entityManager.clear();
        }

        @Override
        public void rollback() {
            if (current == null || current.isCompleted()) {
                current = null;
                return;
            }
            TransactionStatus status = current;
            current = null;
            transactionManager.rollback(status);
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                rollback();
            } catch (RuntimeException e) {
                log.warn("Failed to roll back open unit of work while closing batch session: {}", e.getMessage(), e);
            }
            try {
                TransactionSynchronizationManager.unbindResourceIfPossible(entityManagerFactory);
                if (entityManager.isOpen()) {
                    entityManager.close();
                }
                log.debug("Closed batch session on thread {}", Thread.currentThread().getName());
            } catch (RuntimeException e) {
                log.warn("Failed to release batch session: {}", e.getMessage(), e);
            }
        }
    }
}

package com.defaultrisk.infrastructure.persistence;

/**
 * Persistence session owned by exactly one pipeline run.
 *
 * One session spans the whole batch; each record is its own unit of work between
 * {@link #begin()} and {@link #commit()} or {@link #rollback()}. {@link #close()}
 * releases the session and never throws.
 */
public interface BatchSession extends AutoCloseable {

    void begin();

    void commit();

    /**
     * Discard the current unit of work. A no-op when none is open.
     */
    void rollback();

    @Override
    void close();
}

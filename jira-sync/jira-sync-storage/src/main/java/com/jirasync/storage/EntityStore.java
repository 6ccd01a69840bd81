package com.jirasync.storage;

import com.jirasync.storage.model.EntityKind;
import com.jirasync.storage.model.ExternalEntityRef;
import com.jirasync.storage.model.IssueRecord;
import com.jirasync.storage.model.ProjectRecord;
import com.jirasync.storage.model.SyncedRecord;

import java.util.List;
import java.util.Optional;

/**
 * SPI for the local store that mirrors Jira projects and issues.
 *
 * <p>Implementations cover an in-process map
 * ({@link com.jirasync.storage.memory.InMemoryEntityStore}) and any JDBC database
 * ({@link com.jirasync.storage.jdbc.JdbcEntityStore}).
 *
 * <p>All mutation goes through {@link #atomically(ExternalEntityRef, StoreWork)}.
 * A unit of work is all-or-nothing, and units touching the same
 * {@link ExternalEntityRef} are serialized while units for different refs run
 * independently. A unit may touch refs other than its primary one; callers lock
 * issues before their project wherever both are needed.
 */
public interface EntityStore {

    /**
     * Returns the store type identifier.
     * @return e.g. "MEMORY", "JDBC"
     */
    String getStoreType();

    /**
     * Runs {@code work} as one atomic unit. Every ref the session touches is
     * locked from first use until the unit ends.
     *
     * @param ref  the primary record the unit operates on
     * @param work the read-modify-write logic
     * @return whatever {@code work} returns
     * @throws PersistenceConflictException if the unit collided with a concurrent
     *         write and was rolled back; safe to retry
     */
    <T> T atomically(ExternalEntityRef ref, StoreWork<T> work) throws PersistenceConflictException;

    /**
     * Reads the committed state of a record, including inactive (soft-deleted) ones.
     */
    Optional<SyncedRecord> find(ExternalEntityRef ref);

    default Optional<ProjectRecord> findProject(String sourceSystemId) {
        return find(ExternalEntityRef.project(sourceSystemId)).map(ProjectRecord.class::cast);
    }

    default Optional<IssueRecord> findIssue(String sourceSystemId) {
        return find(ExternalEntityRef.issue(sourceSystemId)).map(IssueRecord.class::cast);
    }

    /** Returns every issue linked to the project with the given local id. */
    List<IssueRecord> findIssuesByProject(long projectLocalId);

    /** Counts stored records of a kind, inactive ones included. */
    long count(EntityKind kind);

    /**
     * Releases pooled connections or other resources held by this store.
     */
    void close();
}

package com.jirasync.storage;

import com.jirasync.storage.model.ExternalEntityRef;
import com.jirasync.storage.model.IssueRecord;
import com.jirasync.storage.model.SyncedRecord;

import java.util.List;
import java.util.Optional;

/**
 * Record-level operations available inside one {@link EntityStore#atomically} unit.
 *
 * <p>Every ref passed to a session method is locked until the unit ends. Records
 * returned are detached copies; changes become visible to others only when the
 * unit completes without an exception.
 */
public interface RecordSession {

    /**
     * Looks up a record by its Jira identity, inactive records included.
     */
    Optional<SyncedRecord> findByExternalRef(ExternalEntityRef ref) throws PersistenceConflictException;

    /**
     * Returns the issues whose project reference is {@code projectSourceId},
     * inactive ones included, each locked like {@link #findByExternalRef}.
     * Issues are locked in source id order.
     */
    List<IssueRecord> findIssuesOfProject(String projectSourceId) throws PersistenceConflictException;

    /**
     * Inserts a new record and assigns its local id.
     *
     * @return the assigned local id, also set on {@code record}
     * @throws PersistenceConflictException if a record with the same ref already exists
     */
    long insert(SyncedRecord record) throws PersistenceConflictException;

    /**
     * Replaces the stored state of an existing record, matched by its ref.
     */
    void update(SyncedRecord record) throws PersistenceConflictException;

    /**
     * Physically removes a record. Removing a project also removes its issues.
     *
     * @return {@code true} if a record was present and removed
     */
    boolean delete(ExternalEntityRef ref) throws PersistenceConflictException;
}

package com.jirasync.webhooks.sync;

import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.storage.RecordSession;
import com.jirasync.storage.model.SyncedRecord;
import com.jirasync.webhooks.model.EntitySnapshot;

/**
 * Kind-specific half of an upsert: how a snapshot becomes a new record and how
 * it is merged into an existing one. {@link UpsertResolver} owns the decision
 * of which to call and stamps the sync bookkeeping fields afterwards.
 *
 * <p>Both methods run inside the resolver's unit of work and may use the
 * session, e.g. to link an issue to its project.
 */
public interface RecordMapper<S extends EntitySnapshot> {

    SyncedRecord create(S snapshot, RecordSession session, MappingContext context)
            throws PersistenceConflictException;

    /** Copies the fields present in {@code snapshot} onto {@code existing}. */
    void merge(SyncedRecord existing, S snapshot, RecordSession session, MappingContext context)
            throws PersistenceConflictException;

    /**
     * Returns {@code true} if a record that {@code snapshot} depends on was
     * deleted at or after the snapshot's modification time, in which case the
     * snapshot is not applied. Checked before {@link #create} and {@link #merge}.
     */
    default boolean isSuperseded(S snapshot, RecordSession session) throws PersistenceConflictException {
        return false;
    }
}

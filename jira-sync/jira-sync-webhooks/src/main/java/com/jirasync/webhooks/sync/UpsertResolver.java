package com.jirasync.webhooks.sync;

import com.jirasync.storage.EntityStore;
import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.storage.RecordSession;
import com.jirasync.storage.model.EntityKind;
import com.jirasync.storage.model.ExternalEntityRef;
import com.jirasync.storage.model.IssueRecord;
import com.jirasync.storage.model.SyncedRecord;
import com.jirasync.webhooks.model.EntitySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Reconciles one incoming snapshot with the local store.
 *
 * <p>Each call is a single {@link EntityStore#atomically} unit keyed by the
 * entity's {@link ExternalEntityRef} and ends in exactly one
 * {@link UpsertOutcome}:
 * <pre>
 *   created / updated, no record           -> INSERTED
 *   created / updated, record, not stale   -> MERGED
 *   created / updated, record, stale       -> NO_OP_STALE
 *   created / updated, parent deleted later -> NO_OP_STALE
 *   deleted, active record                 -> DELETED
 *   deleted, no record or tombstone        -> NO_OP_ABSENT
 * </pre>
 * A created event for an existing record is handled exactly like an update.
 *
 * <p>Deleting a project also deletes its issues in the same unit: under
 * {@link DeletionPolicy#SOFT} every active issue becomes a tombstone carrying
 * the deletion time, under {@link DeletionPolicy#HARD} the store removes the
 * rows. The issues are locked before the project, the same order issue units
 * use.
 */
public class UpsertResolver {

    private static final Logger log = LoggerFactory.getLogger(UpsertResolver.class);

    private final EntityStore    store;
    private final StalenessGuard stalenessGuard;
    private final DeletionPolicy deletionPolicy;
    private final Clock          clock;

    public UpsertResolver(EntityStore store, StalenessPolicy stalenessPolicy,
                          DeletionPolicy deletionPolicy, Clock clock) {
        this.store          = store;
        this.stalenessGuard = new StalenessGuard(stalenessPolicy);
        this.deletionPolicy = deletionPolicy;
        this.clock          = clock;
    }

    public UpsertResolver(EntityStore store) {
        this(store, StalenessPolicy.SOURCE_TIMESTAMP, DeletionPolicy.SOFT, Clock.systemUTC());
    }

    /**
     * @param ref       identity of the affected entity
     * @param incoming  the entity as described by the event
     * @param operation what the event asks for
     * @param mapper    kind-specific record mapping; unused for deletes
     * @throws PersistenceConflictException if the unit collided with a concurrent
     *         write; nothing was written and the call may be repeated
     */
    public <S extends EntitySnapshot> UpsertResult resolve(ExternalEntityRef ref, S incoming,
                                                           SyncOperation operation, RecordMapper<S> mapper)
            throws PersistenceConflictException {
        return store.atomically(ref, session -> {
            MappingContext context = new MappingContext(clock.instant());
            UpsertOutcome outcome = operation == SyncOperation.DELETED
                    ? delete(session, ref, incoming.getLastModified(), context)
                    : upsert(session, ref, session.findByExternalRef(ref), incoming, mapper, context);
            return new UpsertResult(outcome, context.isPlaceholderCreated());
        });
    }

    private <S extends EntitySnapshot> UpsertOutcome upsert(RecordSession session, ExternalEntityRef ref,
                                                            Optional<SyncedRecord> existing, S incoming,
                                                            RecordMapper<S> mapper, MappingContext context)
            throws PersistenceConflictException {
        Instant lastModified = incoming.getLastModified();

        if (existing.isPresent() && stalenessGuard.isStale(existing.get(), lastModified)) {
            SyncedRecord record = existing.get();
            log.info("Stale event for {}: incoming lastModified={} stored={} localModifiedAt={} active={}",
                    ref, lastModified, record.getExternalLastModified(),
                    record.getLocalModifiedAt(), record.isActive());
            return UpsertOutcome.NO_OP_STALE;
        }
        if (mapper.isSuperseded(incoming, session)) {
            log.info("Stale event for {}: a record it depends on was deleted at or after {}", ref, lastModified);
            return UpsertOutcome.NO_OP_STALE;
        }

        if (existing.isEmpty()) {
            SyncedRecord created = mapper.create(incoming, session, context);
            stamp(created, lastModified, context);
            long id = session.insert(created);
            log.debug("Inserted {} as localId={}", ref, id);
            return UpsertOutcome.INSERTED;
        }

        SyncedRecord record = existing.get();
        mapper.merge(record, incoming, session, context);
        stamp(record, lastModified, context);
        session.update(record);
        log.debug("Merged {} (localId={})", ref, record.getLocalId());
        return UpsertOutcome.MERGED;
    }

    private UpsertOutcome delete(RecordSession session, ExternalEntityRef ref, Instant eventTime,
                                 MappingContext context)
            throws PersistenceConflictException {
        boolean project = ref.getEntityKind() == EntityKind.PROJECT;
        if (project) {
            session.findIssuesOfProject(ref.getSourceSystemId());
        }
        Optional<SyncedRecord> existing = session.findByExternalRef(ref);
        if (existing.isEmpty() || !existing.get().isActive()) {
            log.debug("Nothing to delete for {}", ref);
            return UpsertOutcome.NO_OP_ABSENT;
        }

        if (deletionPolicy == DeletionPolicy.HARD) {
            session.delete(ref);
        } else {
            SyncedRecord record = existing.get();
            tombstone(record, eventTime, context);
            session.update(record);
            if (project) {
                // re-read: issues may have been linked between the first lookup and the project lock
                int deactivated = 0;
                for (IssueRecord issue : session.findIssuesOfProject(ref.getSourceSystemId())) {
                    if (issue.isActive()) {
                        tombstone(issue, eventTime, context);
                        session.update(issue);
                        deactivated++;
                    }
                }
                if (deactivated > 0) {
                    log.info("Deactivated {} issues of deleted {}", deactivated, ref);
                }
            }
        }
        log.debug("Deleted {} ({})", ref, deletionPolicy);
        return UpsertOutcome.DELETED;
    }

    private static void tombstone(SyncedRecord record, Instant eventTime, MappingContext context) {
        record.setActive(false);
        Instant stored = record.getExternalLastModified();
        if (stored == null || eventTime.isAfter(stored)) {
            record.setExternalLastModified(eventTime);
        }
        record.setLastSyncedAt(context.now());
    }

    private static void stamp(SyncedRecord record, Instant lastModified, MappingContext context) {
        record.setExternalLastModified(lastModified);
        record.setLastSyncedAt(context.now());
        record.setActive(true);
    }
}

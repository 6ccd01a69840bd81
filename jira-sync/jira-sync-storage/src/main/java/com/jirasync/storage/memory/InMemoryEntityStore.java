package com.jirasync.storage.memory;

import com.jirasync.storage.EntityStore;
import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.storage.RecordSession;
import com.jirasync.storage.StoreWork;
import com.jirasync.storage.model.EntityKind;
import com.jirasync.storage.model.ExternalEntityRef;
import com.jirasync.storage.model.IssueRecord;
import com.jirasync.storage.model.SyncedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * {@link EntityStore} held entirely in process memory.
 *
 * <h2>Configuration</h2>
 * <pre>
 *   InMemoryEntityStore store = InMemoryEntityStore.create();
 *
 *   // Fail a unit of work after waiting 500 ms for a record lock:
 *   InMemoryEntityStore store = InMemoryEntityStore.withLockTimeout(500);
 * </pre>
 *
 * <p>Each {@link ExternalEntityRef} has its own lock, taken when a unit first
 * touches the ref and released when the unit ends, so units for different
 * records never contend. A lock entry lives only while some unit holds or waits
 * for it. Writes made inside a unit are buffered and applied when the unit
 * returns; an exception discards them. Stored records are never mutated in
 * place, which lets {@link #find} read without locking.
 */
public class InMemoryEntityStore implements EntityStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

    public static final long DEFAULT_LOCK_TIMEOUT_MS = 2_000;

    private final Map<ExternalEntityRef, SyncedRecord>  records = new ConcurrentHashMap<>();
    private final Map<ExternalEntityRef, RefLock>       locks   = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();
    private final long lockTimeoutMs;

    private InMemoryEntityStore(long lockTimeoutMs) {
        this.lockTimeoutMs = lockTimeoutMs;
        log.info("InMemoryEntityStore created (lockTimeoutMs={})", lockTimeoutMs);
    }

    public static InMemoryEntityStore create() {
        return new InMemoryEntityStore(DEFAULT_LOCK_TIMEOUT_MS);
    }

    public static InMemoryEntityStore withLockTimeout(long lockTimeoutMs) {
        if (lockTimeoutMs <= 0) {
            throw new IllegalArgumentException("lockTimeoutMs must be positive");
        }
        return new InMemoryEntityStore(lockTimeoutMs);
    }

    @Override public String getStoreType() { return "MEMORY"; }

    public long getLockTimeoutMs() { return lockTimeoutMs; }

    @Override
    public <T> T atomically(ExternalEntityRef ref, StoreWork<T> work) throws PersistenceConflictException {
        MemorySession session = new MemorySession();
        try {
            T result = work.execute(session);
            session.commit();
            return result;
        } finally {
            session.releaseLocks();
        }
    }

    @Override
    public Optional<SyncedRecord> find(ExternalEntityRef ref) {
        return Optional.ofNullable(records.get(ref)).map(SyncedRecord::copy);
    }

    @Override
    public List<IssueRecord> findIssuesByProject(long projectLocalId) {
        return records.values().stream()
                .filter(r -> r instanceof IssueRecord)
                .map(r -> (IssueRecord) r)
                .filter(i -> i.getProjectLocalId() == projectLocalId)
                .sorted(Comparator.comparing(IssueRecord::getLocalId))
                .map(IssueRecord::copy)
                .toList();
    }

    @Override
    public long count(EntityKind kind) {
        return records.values().stream().filter(r -> r.getEntityKind() == kind).count();
    }

    @Override
    public void close() {
        log.debug("InMemoryEntityStore closed ({} records)", records.size());
    }

    /** Number of refs currently locked or waited for. */
    int lockCount() {
        return locks.size();
    }

    // ------------------------------------------------------------------
    // Per-ref locks
    // ------------------------------------------------------------------

    /** A lock plus the number of units holding or waiting for it; the count only changes inside {@code compute}. */
    private static final class RefLock {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    private RefLock acquire(ExternalEntityRef ref) throws PersistenceConflictException {
        RefLock entry = locks.compute(ref, (r, current) -> {
            RefLock l = current == null ? new RefLock() : current;
            l.users++;
            return l;
        });
        try {
            if (!entry.lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS)) {
                release(ref, entry, false);
                throw new PersistenceConflictException(
                        "Timed out after " + lockTimeoutMs + " ms waiting for lock on " + ref);
            }
        } catch (InterruptedException e) {
            release(ref, entry, false);
            Thread.currentThread().interrupt();
            throw new PersistenceConflictException("Interrupted while waiting for lock on " + ref, e);
        }
        return entry;
    }

    private void release(ExternalEntityRef ref, RefLock entry, boolean locked) {
        if (locked) {
            entry.lock.unlock();
        }
        locks.computeIfPresent(ref, (r, current) -> --current.users == 0 ? null : current);
    }

    private static boolean belongsTo(SyncedRecord r, String projectSourceId) {
        return r instanceof IssueRecord && projectSourceId.equals(((IssueRecord) r).getProjectSourceId());
    }

    // ------------------------------------------------------------------
    // Unit of work
    // ------------------------------------------------------------------

    private final class MemorySession implements RecordSession {

        private final Map<ExternalEntityRef, RefLock> held = new LinkedHashMap<>();
        /** Buffered writes; an empty Optional marks a removal. */
        private final Map<ExternalEntityRef, Optional<SyncedRecord>> pending = new LinkedHashMap<>();

        void lock(ExternalEntityRef ref) throws PersistenceConflictException {
            if (held.containsKey(ref)) return;
            held.put(ref, acquire(ref));
        }

        void releaseLocks() {
            held.forEach((ref, entry) -> release(ref, entry, true));
            held.clear();
        }

        @Override
        public Optional<SyncedRecord> findByExternalRef(ExternalEntityRef ref) throws PersistenceConflictException {
            lock(ref);
            return current(ref).map(SyncedRecord::copy);
        }

        @Override
        public List<IssueRecord> findIssuesOfProject(String projectSourceId) throws PersistenceConflictException {
            List<ExternalEntityRef> refs = Stream.concat(
                            records.values().stream(),
                            pending.values().stream().flatMap(Optional::stream))
                    .filter(r -> belongsTo(r, projectSourceId))
                    .map(SyncedRecord::getRef)
                    .distinct()
                    .sorted(Comparator.comparing(ExternalEntityRef::getSourceSystemId))
                    .toList();
            List<IssueRecord> issues = new ArrayList<>();
            for (ExternalEntityRef ref : refs) {
                lock(ref);
                current(ref).filter(r -> belongsTo(r, projectSourceId))
                        .ifPresent(r -> issues.add((IssueRecord) r.copy()));
            }
            return issues;
        }

        @Override
        public long insert(SyncedRecord record) throws PersistenceConflictException {
            ExternalEntityRef ref = record.getRef();
            lock(ref);
            if (current(ref).isPresent()) {
                throw new PersistenceConflictException("Record already exists for " + ref);
            }
            long id = idSequence.incrementAndGet();
            record.setLocalId(id);
            pending.put(ref, Optional.of(record.copy()));
            return id;
        }

        @Override
        public void update(SyncedRecord record) throws PersistenceConflictException {
            ExternalEntityRef ref = record.getRef();
            lock(ref);
            SyncedRecord existing = current(ref).orElseThrow(() ->
                    new PersistenceConflictException("No record to update for " + ref));
            SyncedRecord copy = record.copy();
            copy.setLocalId(existing.getLocalId());
            pending.put(ref, Optional.of(copy));
        }

        @Override
        public boolean delete(ExternalEntityRef ref) throws PersistenceConflictException {
            lock(ref);
            if (current(ref).isEmpty()) return false;
            pending.put(ref, Optional.empty());
            return true;
        }

        private Optional<SyncedRecord> current(ExternalEntityRef ref) {
            Optional<SyncedRecord> buffered = pending.get(ref);
            if (buffered != null) return buffered;
            return Optional.ofNullable(records.get(ref));
        }

        void commit() {
            for (Map.Entry<ExternalEntityRef, Optional<SyncedRecord>> e : pending.entrySet()) {
                ExternalEntityRef ref = e.getKey();
                if (e.getValue().isPresent()) {
                    records.put(ref, e.getValue().get());
                } else {
                    SyncedRecord removed = records.remove(ref);
                    if (removed != null && removed.getEntityKind() == EntityKind.PROJECT) {
                        cascadeIssues(removed.getLocalId());
                    }
                }
            }
        }

        private void cascadeIssues(long projectLocalId) {
            int before = records.size();
            records.values().removeIf(r -> r instanceof IssueRecord
                    && ((IssueRecord) r).getProjectLocalId() == projectLocalId);
            int removed = before - records.size();
            if (removed > 0) {
                log.debug("Removed {} issues of project localId={}", removed, projectLocalId);
            }
        }
    }
}

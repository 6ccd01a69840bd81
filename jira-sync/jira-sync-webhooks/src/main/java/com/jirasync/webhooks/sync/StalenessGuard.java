package com.jirasync.webhooks.sync;

import com.jirasync.storage.model.SyncedRecord;

import java.time.Instant;

/**
 * Decides whether an incoming snapshot may overwrite a stored record.
 *
 * <p>For an active record the snapshot is applied when its modification time
 * is not older than the record's {@code externalLastModified}; equal times are
 * applied so a redelivery converges to the same state. An inactive record is a
 * tombstone and is only revived by a strictly newer snapshot. A record with no
 * {@code externalLastModified} (a placeholder) accepts anything.
 */
public class StalenessGuard {

    private final StalenessPolicy policy;

    public StalenessGuard(StalenessPolicy policy) {
        this.policy = policy;
    }

    public StalenessPolicy getPolicy() { return policy; }

    /** Returns {@code true} if a snapshot modified at {@code incoming} must not be applied. */
    public boolean isStale(SyncedRecord existing, Instant incoming) {
        Instant stored = existing.getExternalLastModified();
        if (stored != null) {
            if (existing.isActive() ? incoming.isBefore(stored) : !incoming.isAfter(stored)) {
                return true;
            }
        }
        if (policy == StalenessPolicy.RESPECT_LOCAL_EDITS) {
            Instant localEdit = existing.getLocalModifiedAt();
            return localEdit != null && incoming.isBefore(localEdit);
        }
        return false;
    }
}

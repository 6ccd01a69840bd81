package com.jirasync.storage.model;

import java.time.Instant;

/**
 * Common state of every locally mirrored Jira entity.
 *
 * <p>Records are plain mutable holders. Stores hand out copies, so a record
 * obtained from one unit of work can be modified freely and written back with
 * {@link com.jirasync.storage.RecordSession#update(SyncedRecord)}.
 *
 * <p>{@code externalLastModified} is the source-system modification time of the
 * snapshot last applied; it is {@code null} for placeholders that were never
 * populated by a genuine event. {@code localModifiedAt} marks edits made on the
 * local side (for example by an outbound sync) and is never written by inbound
 * processing.
 */
public abstract class SyncedRecord {

    private Long    localId;
    private String  sourceSystemId;
    private String  key;
    private Instant externalLastModified;
    private Instant lastSyncedAt;
    private Instant localModifiedAt;
    private boolean active = true;

    protected SyncedRecord() {}

    protected SyncedRecord(SyncedRecord other) {
        this.localId              = other.localId;
        this.sourceSystemId       = other.sourceSystemId;
        this.key                  = other.key;
        this.externalLastModified = other.externalLastModified;
        this.lastSyncedAt         = other.lastSyncedAt;
        this.localModifiedAt      = other.localModifiedAt;
        this.active               = other.active;
    }

    public abstract EntityKind getEntityKind();

    /** Returns a detached deep copy of this record. */
    public abstract SyncedRecord copy();

    public ExternalEntityRef getRef() {
        return ExternalEntityRef.of(getEntityKind(), sourceSystemId);
    }

    public Long    getLocalId()              { return localId; }
    public String  getSourceSystemId()       { return sourceSystemId; }
    public String  getKey()                  { return key; }
    public Instant getExternalLastModified() { return externalLastModified; }
    public Instant getLastSyncedAt()         { return lastSyncedAt; }
    public Instant getLocalModifiedAt()      { return localModifiedAt; }
    public boolean isActive()                { return active; }

    public void setLocalId(Long localId)                         { this.localId = localId; }
    public void setSourceSystemId(String sourceSystemId)         { this.sourceSystemId = sourceSystemId; }
    public void setKey(String key)                               { this.key = key; }
    public void setExternalLastModified(Instant lastModified)    { this.externalLastModified = lastModified; }
    public void setLastSyncedAt(Instant lastSyncedAt)            { this.lastSyncedAt = lastSyncedAt; }
    public void setLocalModifiedAt(Instant localModifiedAt)      { this.localModifiedAt = localModifiedAt; }
    public void setActive(boolean active)                        { this.active = active; }
}

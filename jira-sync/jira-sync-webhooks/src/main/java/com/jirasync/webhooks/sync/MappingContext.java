package com.jirasync.webhooks.sync;

import java.time.Instant;

/** Per-unit state shared between {@link UpsertResolver} and a {@link RecordMapper}. */
public final class MappingContext {

    private final Instant now;
    private boolean placeholderCreated;

    MappingContext(Instant now) {
        this.now = now;
    }

    /** Sync time to stamp on every record written in this unit. */
    public Instant now() { return now; }

    public void markPlaceholderCreated()    { this.placeholderCreated = true; }
    public boolean isPlaceholderCreated()   { return placeholderCreated; }
}

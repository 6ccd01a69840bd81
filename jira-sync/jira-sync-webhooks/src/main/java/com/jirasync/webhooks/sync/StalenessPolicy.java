package com.jirasync.webhooks.sync;

/** Which timestamps an incoming snapshot must not be older than to be applied. */
public enum StalenessPolicy {
    /** Compare against the source modification time of the last applied snapshot only. */
    SOURCE_TIMESTAMP,
    /** Also refuse snapshots older than the record's local-edit marker. */
    RESPECT_LOCAL_EDITS
}

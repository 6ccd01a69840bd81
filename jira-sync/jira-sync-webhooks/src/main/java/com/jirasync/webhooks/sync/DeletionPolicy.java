package com.jirasync.webhooks.sync;

/** How a delete event is applied to the local record. */
public enum DeletionPolicy {
    /** Mark the record inactive and keep it as a tombstone. */
    SOFT,
    /** Remove the row; removing a project removes its issues. */
    HARD
}

package com.jirasync.webhooks.sync;

/** What {@link UpsertResolver} did with one incoming snapshot. */
public enum UpsertOutcome {
    /** No local record existed; one was created. */
    INSERTED,
    /** The existing record was updated from the snapshot. */
    MERGED,
    /** The snapshot was older than the stored state and was dropped. */
    NO_OP_STALE,
    /** The local record was removed or marked inactive. */
    DELETED,
    /** A delete found nothing to remove. */
    NO_OP_ABSENT
}

package com.jirasync.webhooks.sync;

/** The operation a webhook event asks for. */
public enum SyncOperation {
    CREATED,
    UPDATED,
    DELETED
}

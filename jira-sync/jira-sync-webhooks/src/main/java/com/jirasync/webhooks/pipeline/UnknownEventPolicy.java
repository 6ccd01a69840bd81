package com.jirasync.webhooks.pipeline;

/** What to do with a delivery whose event type has no registered processor. */
public enum UnknownEventPolicy {

    /** Answer REJECTED so the sender sees the problem. */
    REJECT,

    /** Answer ACCEPTED with reason "ignored". The event is still logged. */
    IGNORE
}

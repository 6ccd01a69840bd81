package com.jirasync.webhooks.sync;

/** Outcome of one {@link UpsertResolver#resolve} call. */
public final class UpsertResult {

    private final UpsertOutcome outcome;
    private final boolean       placeholderCreated;

    UpsertResult(UpsertOutcome outcome, boolean placeholderCreated) {
        this.outcome            = outcome;
        this.placeholderCreated = placeholderCreated;
    }

    public UpsertOutcome getOutcome()         { return outcome; }

    /** {@code true} if a placeholder parent project was inserted along the way. */
    public boolean isPlaceholderCreated()     { return placeholderCreated; }

    @Override
    public String toString() {
        return placeholderCreated ? outcome + " (placeholder parent created)" : outcome.toString();
    }
}

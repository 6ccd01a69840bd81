package com.jirasync.webhooks.processor;

import com.jirasync.storage.model.ExternalEntityRef;
import com.jirasync.webhooks.sync.UpsertOutcome;
import com.jirasync.webhooks.sync.UpsertResult;

/** Result of an {@link EventProcessor} run. */
public final class ProcessingResult {

    private final String            eventType;
    private final ExternalEntityRef ref;
    private final UpsertOutcome     outcome;
    private final boolean           placeholderCreated;

    public ProcessingResult(String eventType, ExternalEntityRef ref, UpsertOutcome outcome,
                            boolean placeholderCreated) {
        this.eventType          = eventType;
        this.ref                = ref;
        this.outcome            = outcome;
        this.placeholderCreated = placeholderCreated;
    }

    static ProcessingResult of(String eventType, ExternalEntityRef ref, UpsertResult result) {
        return new ProcessingResult(eventType, ref, result.getOutcome(), result.isPlaceholderCreated());
    }

    public String            getEventType()        { return eventType; }
    public ExternalEntityRef getRef()              { return ref; }
    public UpsertOutcome     getOutcome()          { return outcome; }
    public boolean           isPlaceholderCreated() { return placeholderCreated; }

    @Override
    public String toString() {
        return "ProcessingResult{eventType='" + eventType + "', ref=" + ref +
               ", outcome=" + outcome + ", placeholderCreated=" + placeholderCreated + '}';
    }
}

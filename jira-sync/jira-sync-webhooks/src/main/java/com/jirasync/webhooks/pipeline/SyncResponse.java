package com.jirasync.webhooks.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jirasync.webhooks.error.WebhookProcessingException;
import com.jirasync.webhooks.processor.ProcessingResult;
import com.jirasync.webhooks.sync.UpsertOutcome;

/**
 * Answer to one webhook delivery, serialized as the HTTP response body.
 *
 * <pre>
 *   {"status":"ACCEPTED","outcome":"INSERTED","eventType":"jira:issue_created",
 *    "sourceSystemId":"10002","placeholderCreated":true}
 *   {"status":"REJECTED","reason":"Issue snapshot has no summary", ...}
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SyncResponse {

    public enum Status {
        /** Processed, including no-op outcomes. Maps to 2xx. */
        ACCEPTED,
        /** Non-retriable problem with the delivery itself. Maps to 4xx. */
        REJECTED,
        /** Internal failure; the sender should retry. Maps to 5xx. */
        FAILED
    }

    public static final String REASON_IGNORED = "ignored";

    private final Status        status;
    private final String        reason;
    private final UpsertOutcome outcome;
    private final String        eventType;
    private final String        sourceSystemId;
    private final Boolean       placeholderCreated;

    private SyncResponse(Status status, String reason, UpsertOutcome outcome, String eventType,
                         String sourceSystemId, Boolean placeholderCreated) {
        this.status             = status;
        this.reason             = reason;
        this.outcome            = outcome;
        this.eventType          = eventType;
        this.sourceSystemId     = sourceSystemId;
        this.placeholderCreated = placeholderCreated;
    }

    public static SyncResponse accepted(ProcessingResult result) {
        return new SyncResponse(Status.ACCEPTED, null, result.getOutcome(), result.getEventType(),
                result.getRef().getSourceSystemId(), result.isPlaceholderCreated());
    }

    public static SyncResponse ignored(String eventType, String sourceSystemId) {
        return new SyncResponse(Status.ACCEPTED, REASON_IGNORED, null, eventType, sourceSystemId, null);
    }

    public static SyncResponse rejected(WebhookProcessingException e) {
        return new SyncResponse(Status.REJECTED, e.getMessage(), null, e.getEventType(),
                e.getSourceSystemId(), null);
    }

    public static SyncResponse failed(String reason) {
        return new SyncResponse(Status.FAILED, reason, null, null, null, null);
    }

    public Status        getStatus()             { return status; }
    public String        getReason()             { return reason; }
    public UpsertOutcome getOutcome()            { return outcome; }
    public String        getEventType()          { return eventType; }
    public String        getSourceSystemId()     { return sourceSystemId; }
    public Boolean       getPlaceholderCreated() { return placeholderCreated; }

    @Override
    public String toString() {
        return "SyncResponse{status=" + status + ", reason='" + reason + "', outcome=" + outcome +
               ", eventType='" + eventType + "', sourceSystemId=" + sourceSystemId + '}';
    }
}

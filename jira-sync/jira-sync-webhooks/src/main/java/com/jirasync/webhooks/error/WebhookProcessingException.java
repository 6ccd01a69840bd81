package com.jirasync.webhooks.error;

/**
 * Base class for expected, non-retriable failures while processing one webhook
 * delivery. Carries the event type and Jira id when they are known so every
 * log line about the failure can name them.
 */
public class WebhookProcessingException extends Exception {

    private final String eventType;
    private final String sourceSystemId;

    public WebhookProcessingException(String message, String eventType, String sourceSystemId) {
        super(message);
        this.eventType      = eventType;
        this.sourceSystemId = sourceSystemId;
    }

    public WebhookProcessingException(String message, String eventType, String sourceSystemId, Throwable cause) {
        super(message, cause);
        this.eventType      = eventType;
        this.sourceSystemId = sourceSystemId;
    }

    /** The delivery's event type, or {@code null} if it could not be read. */
    public String getEventType()      { return eventType; }

    /** The affected entity's Jira id, or {@code null} if it could not be read. */
    public String getSourceSystemId() { return sourceSystemId; }
}

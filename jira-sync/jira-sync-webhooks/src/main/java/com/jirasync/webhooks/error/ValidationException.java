package com.jirasync.webhooks.error;

/** Thrown when a snapshot lacks a field the receiving processor needs. */
public class ValidationException extends WebhookProcessingException {

    public ValidationException(String message, String eventType, String sourceSystemId) {
        super(message, eventType, sourceSystemId);
    }

    public ValidationException(String message, String eventType, String sourceSystemId, Throwable cause) {
        super(message, eventType, sourceSystemId, cause);
    }
}

package com.jirasync.webhooks.error;

/** Thrown when a request body cannot be decoded into a webhook envelope. */
public class MalformedPayloadException extends WebhookProcessingException {

    public MalformedPayloadException(String message) {
        super(message, null, null);
    }

    public MalformedPayloadException(String message, String eventType) {
        super(message, eventType, null);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, null, null, cause);
    }
}

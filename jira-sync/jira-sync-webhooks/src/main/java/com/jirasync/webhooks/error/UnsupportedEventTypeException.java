package com.jirasync.webhooks.error;

/** Thrown by the processor registry for an event type it has no processor for. */
public class UnsupportedEventTypeException extends WebhookProcessingException {

    public UnsupportedEventTypeException(String eventType) {
        super("Unsupported event type: " + eventType, eventType, null);
    }
}

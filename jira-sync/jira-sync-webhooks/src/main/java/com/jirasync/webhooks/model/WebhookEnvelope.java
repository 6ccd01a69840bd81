package com.jirasync.webhooks.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One decoded Jira webhook delivery.
 *
 * Built once per request by {@link com.jirasync.webhooks.parser.WebhookPayloadParser}
 * and discarded after dispatch; never persisted. The entity payload is the
 * snapshot of the project or issue as of the event, with unknown fields kept.
 */
public final class WebhookEnvelope {

    /** Tag such as "jira:issue_created" or "project_updated". */
    private final String eventType;

    /** Event time reported by Jira. */
    private final Instant timestamp;

    /** Snapshot of the affected entity; always contains an "id". */
    private final Map<String, Object> entityPayload;

    public WebhookEnvelope(String eventType, Instant timestamp, Map<String, Object> entityPayload) {
        this.eventType     = Objects.requireNonNull(eventType, "eventType");
        this.timestamp     = Objects.requireNonNull(timestamp, "timestamp");
        this.entityPayload = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(entityPayload, "entityPayload")));
    }

    public String              getEventType()     { return eventType; }
    public Instant             getTimestamp()     { return timestamp; }
    public Map<String, Object> getEntityPayload() { return entityPayload; }

    /** The Jira id of the affected entity. */
    public String getSourceSystemId() {
        return PayloadFields.text(entityPayload, "id");
    }

    @Override
    public String toString() {
        return "WebhookEnvelope{eventType='" + eventType + '\'' +
               ", sourceSystemId=" + getSourceSystemId() +
               ", timestamp=" + timestamp + '}';
    }
}

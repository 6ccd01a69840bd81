package com.jirasync.webhooks.model;

import com.jirasync.webhooks.error.ValidationException;

import java.time.Instant;
import java.util.Map;

/**
 * Typed view of the entity carried by a {@link WebhookEnvelope}.
 *
 * <p>{@code lastModified} drives the staleness guard. It is read from the
 * snapshot's {@code lastModified} field, or Jira's {@code updated} field, and
 * falls back to the envelope timestamp.
 */
public abstract class EntitySnapshot {

    private final String  id;
    private final String  key;
    private final Instant lastModified;

    protected EntitySnapshot(String id, String key, Instant lastModified) {
        this.id           = id;
        this.key          = key;
        this.lastModified = lastModified;
    }

    public String  getId()           { return id; }
    public String  getKey()          { return key; }
    public Instant getLastModified() { return lastModified; }

    protected static Instant lastModifiedOf(WebhookEnvelope envelope) throws ValidationException {
        Map<String, Object> payload = envelope.getEntityPayload();
        Object raw = payload.get("lastModified");
        if (raw == null) {
            raw = payload.get("updated");
        }
        if (raw == null) {
            return envelope.getTimestamp();
        }
        try {
            return Timestamps.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid lastModified: " + e.getMessage(),
                    envelope.getEventType(), envelope.getSourceSystemId(), e);
        }
    }
}

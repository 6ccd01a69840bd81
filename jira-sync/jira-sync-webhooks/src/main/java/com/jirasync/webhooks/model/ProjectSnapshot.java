package com.jirasync.webhooks.model;

import com.jirasync.webhooks.error.ValidationException;

import java.time.Instant;
import java.util.Map;

/** A Jira project as described by a project event. */
public final class ProjectSnapshot extends EntitySnapshot {

    private final String name;

    public ProjectSnapshot(String id, String key, String name, Instant lastModified) {
        super(id, key, lastModified);
        this.name = name;
    }

    public static ProjectSnapshot from(WebhookEnvelope envelope) throws ValidationException {
        Map<String, Object> p = envelope.getEntityPayload();
        return new ProjectSnapshot(
                PayloadFields.text(p, "id"),
                PayloadFields.text(p, "key"),
                PayloadFields.text(p, "name"),
                lastModifiedOf(envelope));
    }

    public String getName() { return name; }

    @Override
    public String toString() {
        return "ProjectSnapshot{id='" + getId() + "', name='" + name + "', lastModified=" + getLastModified() + '}';
    }
}

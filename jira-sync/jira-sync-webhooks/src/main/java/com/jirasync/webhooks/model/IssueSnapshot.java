package com.jirasync.webhooks.model;

import com.jirasync.webhooks.error.ValidationException;

import java.time.Instant;
import java.util.Map;

/**
 * A Jira issue as described by an issue event, including the reference to its
 * owning project.
 *
 * <p>The project reference is read from a {@code project} object
 * ({@code {"id": "10000", "key": "ED", "name": "Editor"}}), a {@code project}
 * string holding the id, or a flat {@code projectId} field.
 */
public final class IssueSnapshot extends EntitySnapshot {

    private final String summary;
    private final String status;
    private final String projectId;
    private final String projectKey;
    private final String projectName;

    private IssueSnapshot(Builder b) {
        super(b.id, b.key, b.lastModified);
        this.summary     = b.summary;
        this.status      = b.status;
        this.projectId   = b.projectId;
        this.projectKey  = b.projectKey;
        this.projectName = b.projectName;
    }

    public static IssueSnapshot from(WebhookEnvelope envelope) throws ValidationException {
        Map<String, Object> p = envelope.getEntityPayload();
        Builder b = builder()
                .id(PayloadFields.text(p, "id"))
                .key(PayloadFields.text(p, "key"))
                .summary(PayloadFields.text(p, "summary"))
                .status(PayloadFields.textOrName(p, "status"))
                .lastModified(lastModifiedOf(envelope));

        Map<String, Object> project = PayloadFields.object(p, "project");
        if (project != null) {
            b.projectId(PayloadFields.text(project, "id"))
             .projectKey(PayloadFields.text(project, "key"))
             .projectName(PayloadFields.text(project, "name"));
        } else {
            String ref = PayloadFields.text(p, "project");
            b.projectId(ref != null ? ref : PayloadFields.text(p, "projectId"));
        }
        return b.build();
    }

    public String getSummary()     { return summary; }
    public String getStatus()      { return status; }
    public String getProjectId()   { return projectId; }
    public String getProjectKey()  { return projectKey; }
    public String getProjectName() { return projectName; }

    @Override
    public String toString() {
        return "IssueSnapshot{id='" + getId() + "', key='" + getKey() +
               "', projectId='" + projectId + "', lastModified=" + getLastModified() + '}';
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String  id;
        private String  key;
        private String  summary;
        private String  status;
        private String  projectId;
        private String  projectKey;
        private String  projectName;
        private Instant lastModified;

        private Builder() {}

        public Builder id(String id)                     { this.id = id; return this; }
        public Builder key(String key)                   { this.key = key; return this; }
        public Builder summary(String summary)           { this.summary = summary; return this; }
        public Builder status(String status)             { this.status = status; return this; }
        public Builder projectId(String projectId)       { this.projectId = projectId; return this; }
        public Builder projectKey(String projectKey)     { this.projectKey = projectKey; return this; }
        public Builder projectName(String projectName)   { this.projectName = projectName; return this; }
        public Builder lastModified(Instant lastModified) { this.lastModified = lastModified; return this; }
        public IssueSnapshot build()                     { return new IssueSnapshot(this); }
    }
}

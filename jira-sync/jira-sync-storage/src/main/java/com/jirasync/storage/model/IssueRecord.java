package com.jirasync.storage.model;

/** Local mirror of a Jira issue, linked to its owning {@link ProjectRecord} by local id. */
public class IssueRecord extends SyncedRecord {

    private String summary;
    private String status;
    private long   projectLocalId;
    private String projectSourceId;

    public IssueRecord() {}

    private IssueRecord(IssueRecord other) {
        super(other);
        this.summary         = other.summary;
        this.status          = other.status;
        this.projectLocalId  = other.projectLocalId;
        this.projectSourceId = other.projectSourceId;
    }

    @Override public EntityKind getEntityKind() { return EntityKind.ISSUE; }

    @Override public IssueRecord copy() { return new IssueRecord(this); }

    public String getSummary()         { return summary; }
    public String getStatus()          { return status; }
    public long   getProjectLocalId()  { return projectLocalId; }
    public String getProjectSourceId() { return projectSourceId; }

    public void setSummary(String summary)                 { this.summary = summary; }
    public void setStatus(String status)                   { this.status = status; }
    public void setProjectLocalId(long projectLocalId)     { this.projectLocalId = projectLocalId; }
    public void setProjectSourceId(String projectSourceId) { this.projectSourceId = projectSourceId; }

    @Override
    public String toString() {
        return "IssueRecord{localId=" + getLocalId() +
               ", sourceSystemId='" + getSourceSystemId() + '\'' +
               ", key='" + getKey() + '\'' +
               ", projectSourceId='" + projectSourceId + '\'' +
               ", active=" + isActive() + '}';
    }
}

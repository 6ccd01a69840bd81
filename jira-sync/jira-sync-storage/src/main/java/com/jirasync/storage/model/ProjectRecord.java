package com.jirasync.storage.model;

/**
 * Local mirror of a Jira project.
 *
 * <p>A placeholder project is created when an issue arrives for a project that
 * has not been seen yet, or one that was deleted before the issue changed. It
 * carries whatever the issue knew about its project and is enriched by the next
 * genuine project event.
 */
public class ProjectRecord extends SyncedRecord {

    private String  name;
    private boolean placeholder;

    public ProjectRecord() {}

    private ProjectRecord(ProjectRecord other) {
        super(other);
        this.name        = other.name;
        this.placeholder = other.placeholder;
    }

    @Override public EntityKind getEntityKind() { return EntityKind.PROJECT; }

    @Override public ProjectRecord copy() { return new ProjectRecord(this); }

    public String  getName()       { return name; }
    public boolean isPlaceholder() { return placeholder; }

    public void setName(String name)                { this.name = name; }
    public void setPlaceholder(boolean placeholder) { this.placeholder = placeholder; }

    @Override
    public String toString() {
        return "ProjectRecord{localId=" + getLocalId() +
               ", sourceSystemId='" + getSourceSystemId() + '\'' +
               ", name='" + name + '\'' +
               ", placeholder=" + placeholder +
               ", active=" + isActive() + '}';
    }
}

package com.jirasync.webhooks.sync;

import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.storage.RecordSession;
import com.jirasync.storage.model.ExternalEntityRef;
import com.jirasync.storage.model.IssueRecord;
import com.jirasync.storage.model.ProjectRecord;
import com.jirasync.storage.model.SyncedRecord;
import com.jirasync.webhooks.model.IssueSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Maps issue snapshots onto {@link IssueRecord}s and links each issue to its
 * project.
 *
 * <p>When the referenced project is not stored yet, a placeholder
 * {@link ProjectRecord} is inserted in the same unit of work from whatever the
 * issue says about its project. The placeholder has no
 * {@code externalLastModified}, so the first genuine project event for that id
 * enriches it. The project is always locked after the issue, never before.
 *
 * <p>A project that was soft-deleted is handled by the issue's modification
 * time: an issue snapshot not newer than the deletion is superseded and not
 * applied, a strictly newer one revives the project as a placeholder.
 */
public class IssueRecordMapper implements RecordMapper<IssueSnapshot> {

    private static final Logger log = LoggerFactory.getLogger(IssueRecordMapper.class);

    @Override
    public SyncedRecord create(IssueSnapshot snapshot, RecordSession session, MappingContext context)
            throws PersistenceConflictException {
        IssueRecord i = new IssueRecord();
        i.setSourceSystemId(snapshot.getId());
        i.setKey(snapshot.getKey());
        i.setSummary(snapshot.getSummary());
        i.setStatus(snapshot.getStatus());
        i.setProjectSourceId(snapshot.getProjectId());
        i.setProjectLocalId(linkProject(snapshot, session, context));
        return i;
    }

    @Override
    public void merge(SyncedRecord existing, IssueSnapshot snapshot, RecordSession session, MappingContext context)
            throws PersistenceConflictException {
        IssueRecord i = (IssueRecord) existing;
        if (snapshot.getKey() != null)     i.setKey(snapshot.getKey());
        if (snapshot.getSummary() != null) i.setSummary(snapshot.getSummary());
        if (snapshot.getStatus() != null)  i.setStatus(snapshot.getStatus());

        if (!snapshot.getProjectId().equals(i.getProjectSourceId())) {
            log.info("Issue {} moved from project {} to {}",
                    i.getSourceSystemId(), i.getProjectSourceId(), snapshot.getProjectId());
        }
        i.setProjectSourceId(snapshot.getProjectId());
        i.setProjectLocalId(linkProject(snapshot, session, context));
    }

    @Override
    public boolean isSuperseded(IssueSnapshot snapshot, RecordSession session) throws PersistenceConflictException {
        Optional<SyncedRecord> project = session.findByExternalRef(ExternalEntityRef.project(snapshot.getProjectId()));
        if (project.isEmpty() || project.get().isActive()) {
            return false;
        }
        Instant deletedAt = project.get().getExternalLastModified();
        return deletedAt != null && !snapshot.getLastModified().isAfter(deletedAt);
    }

    /** Returns the local id of the issue's project, creating or reviving a placeholder if needed. */
    private long linkProject(IssueSnapshot snapshot, RecordSession session, MappingContext context)
            throws PersistenceConflictException {
        ExternalEntityRef projectRef = ExternalEntityRef.project(snapshot.getProjectId());
        Optional<SyncedRecord> found = session.findByExternalRef(projectRef);

        if (found.isEmpty()) {
            ProjectRecord placeholder = new ProjectRecord();
            placeholder.setSourceSystemId(snapshot.getProjectId());
            placeholder.setKey(snapshot.getProjectKey());
            placeholder.setName(snapshot.getProjectName());
            placeholder.setPlaceholder(true);
            placeholder.setLastSyncedAt(context.now());
            long id = session.insert(placeholder);
            context.markPlaceholderCreated();
            log.info("Created placeholder project {} (localId={}) for issue {}",
                    snapshot.getProjectId(), id, snapshot.getId());
            return id;
        }

        ProjectRecord project = (ProjectRecord) found.get();
        if (!project.isActive()) {
            project.setActive(true);
            project.setPlaceholder(true);
            fillPlaceholder(project, snapshot);
            project.setLastSyncedAt(context.now());
            session.update(project);
            context.markPlaceholderCreated();
            log.info("Revived deleted project {} as placeholder for issue {}",
                    project.getSourceSystemId(), snapshot.getId());
            return project.getLocalId();
        }
        if (project.isPlaceholder() && fillPlaceholder(project, snapshot)) {
            project.setLastSyncedAt(context.now());
            session.update(project);
        }
        return project.getLocalId();
    }

    /** Fills gaps in a placeholder from the issue's project reference. */
    private static boolean fillPlaceholder(ProjectRecord project, IssueSnapshot snapshot) {
        boolean changed = false;
        if (project.getKey() == null && snapshot.getProjectKey() != null) {
            project.setKey(snapshot.getProjectKey());
            changed = true;
        }
        if (project.getName() == null && snapshot.getProjectName() != null) {
            project.setName(snapshot.getProjectName());
            changed = true;
        }
        return changed;
    }
}

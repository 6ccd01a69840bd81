package com.jirasync.webhooks.sync;

import com.jirasync.storage.RecordSession;
import com.jirasync.storage.model.ProjectRecord;
import com.jirasync.storage.model.SyncedRecord;
import com.jirasync.webhooks.model.ProjectSnapshot;

/** Maps project snapshots onto {@link ProjectRecord}s. A genuine event always clears the placeholder flag. */
public class ProjectRecordMapper implements RecordMapper<ProjectSnapshot> {

    @Override
    public SyncedRecord create(ProjectSnapshot snapshot, RecordSession session, MappingContext context) {
        ProjectRecord p = new ProjectRecord();
        p.setSourceSystemId(snapshot.getId());
        p.setKey(snapshot.getKey());
        p.setName(snapshot.getName());
        p.setPlaceholder(false);
        return p;
    }

    @Override
    public void merge(SyncedRecord existing, ProjectSnapshot snapshot, RecordSession session, MappingContext context) {
        ProjectRecord p = (ProjectRecord) existing;
        if (snapshot.getKey() != null)  p.setKey(snapshot.getKey());
        if (snapshot.getName() != null) p.setName(snapshot.getName());
        p.setPlaceholder(false);
    }
}

package com.jirasync.webhooks.processor;

import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.storage.model.ExternalEntityRef;
import com.jirasync.webhooks.error.ValidationException;
import com.jirasync.webhooks.model.ProjectSnapshot;
import com.jirasync.webhooks.model.WebhookEnvelope;
import com.jirasync.webhooks.sync.ProjectRecordMapper;
import com.jirasync.webhooks.sync.SyncOperation;
import com.jirasync.webhooks.sync.UpsertResolver;

/**
 * Handles {@code project_created} and {@code project_updated}. Both insert the
 * project when it is unknown and merge it otherwise; the snapshot must carry a
 * name.
 */
public class ProjectUpsertProcessor implements EventProcessor {

    private final UpsertResolver      resolver;
    private final SyncOperation       operation;
    private final ProjectRecordMapper mapper = new ProjectRecordMapper();

    public ProjectUpsertProcessor(UpsertResolver resolver, SyncOperation operation) {
        if (operation == SyncOperation.DELETED) {
            throw new IllegalArgumentException("Use EntityDeleteProcessor for deletes");
        }
        this.resolver  = resolver;
        this.operation = operation;
    }

    @Override
    public ProcessingResult process(WebhookEnvelope envelope)
            throws ValidationException, PersistenceConflictException {
        ProjectSnapshot snapshot = ProjectSnapshot.from(envelope);
        FieldLimits.checkProject(envelope.getEventType(), snapshot);
        if (snapshot.getName() == null) {
            throw new ValidationException("Project snapshot has no name",
                    envelope.getEventType(), snapshot.getId());
        }
        ExternalEntityRef ref = ExternalEntityRef.project(snapshot.getId());
        return ProcessingResult.of(envelope.getEventType(), ref,
                resolver.resolve(ref, snapshot, operation, mapper));
    }
}

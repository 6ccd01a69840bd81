package com.jirasync.webhooks.processor;

import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.storage.model.ExternalEntityRef;
import com.jirasync.webhooks.error.ValidationException;
import com.jirasync.webhooks.model.IssueSnapshot;
import com.jirasync.webhooks.model.WebhookEnvelope;
import com.jirasync.webhooks.sync.IssueRecordMapper;
import com.jirasync.webhooks.sync.SyncOperation;
import com.jirasync.webhooks.sync.UpsertResolver;

/**
 * Handles {@code issue_created} and {@code issue_updated}. The snapshot must
 * carry a summary and the id of the owning project; an unknown project gets a
 * placeholder record.
 */
public class IssueUpsertProcessor implements EventProcessor {

    private final UpsertResolver    resolver;
    private final SyncOperation     operation;
    private final IssueRecordMapper mapper = new IssueRecordMapper();

    public IssueUpsertProcessor(UpsertResolver resolver, SyncOperation operation) {
        if (operation == SyncOperation.DELETED) {
            throw new IllegalArgumentException("Use EntityDeleteProcessor for deletes");
        }
        this.resolver  = resolver;
        this.operation = operation;
    }

    @Override
    public ProcessingResult process(WebhookEnvelope envelope)
            throws ValidationException, PersistenceConflictException {
        IssueSnapshot snapshot = IssueSnapshot.from(envelope);
        FieldLimits.checkIssue(envelope.getEventType(), snapshot);
        if (snapshot.getSummary() == null) {
            throw new ValidationException("Issue snapshot has no summary",
                    envelope.getEventType(), snapshot.getId());
        }
        if (snapshot.getProjectId() == null) {
            throw new ValidationException("Issue snapshot has no project id",
                    envelope.getEventType(), snapshot.getId());
        }
        ExternalEntityRef ref = ExternalEntityRef.issue(snapshot.getId());
        return ProcessingResult.of(envelope.getEventType(), ref,
                resolver.resolve(ref, snapshot, operation, mapper));
    }
}

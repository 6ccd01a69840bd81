package com.jirasync.webhooks.processor;

import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.storage.model.EntityKind;
import com.jirasync.storage.model.ExternalEntityRef;
import com.jirasync.webhooks.error.ValidationException;
import com.jirasync.webhooks.model.EntitySnapshot;
import com.jirasync.webhooks.model.IssueSnapshot;
import com.jirasync.webhooks.model.ProjectSnapshot;
import com.jirasync.webhooks.model.WebhookEnvelope;
import com.jirasync.webhooks.sync.SyncOperation;
import com.jirasync.webhooks.sync.UpsertResolver;

/**
 * Handles {@code project_deleted} and {@code issue_deleted}. Only the entity id
 * is needed; deleting something already absent succeeds as a no-op.
 */
public class EntityDeleteProcessor implements EventProcessor {

    private final UpsertResolver resolver;
    private final EntityKind     kind;

    public EntityDeleteProcessor(UpsertResolver resolver, EntityKind kind) {
        this.resolver = resolver;
        this.kind     = kind;
    }

    @Override
    public ProcessingResult process(WebhookEnvelope envelope)
            throws ValidationException, PersistenceConflictException {
        EntitySnapshot snapshot = kind == EntityKind.PROJECT
                ? ProjectSnapshot.from(envelope)
                : IssueSnapshot.from(envelope);
        FieldLimits.checkId(envelope.getEventType(), snapshot.getId());
        ExternalEntityRef ref = ExternalEntityRef.of(kind, snapshot.getId());
        return ProcessingResult.of(envelope.getEventType(), ref,
                resolver.resolve(ref, snapshot, SyncOperation.DELETED, null));
    }
}

package com.jirasync.webhooks.processor;

import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.webhooks.error.WebhookProcessingException;
import com.jirasync.webhooks.model.WebhookEnvelope;

/**
 * SPI for applying one kind of Jira webhook event to the local store.
 *
 * <p>Implementations are registered with an {@link EventProcessorRegistry}
 * under the event name they handle. They must be thread-safe: the same
 * instance is called concurrently for unrelated deliveries.
 */
@FunctionalInterface
public interface EventProcessor {

    /**
     * Applies the event to the store.
     *
     * @param envelope the decoded delivery
     * @return what happened to the local record
     * @throws WebhookProcessingException if the snapshot cannot be processed
     *         (not retriable)
     * @throws PersistenceConflictException if the write collided with a
     *         concurrent one (retriable)
     */
    ProcessingResult process(WebhookEnvelope envelope)
            throws WebhookProcessingException, PersistenceConflictException;
}

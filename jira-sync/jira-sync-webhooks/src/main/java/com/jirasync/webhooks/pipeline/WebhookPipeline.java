package com.jirasync.webhooks.pipeline;

import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.webhooks.error.MalformedPayloadException;
import com.jirasync.webhooks.error.UnsupportedEventTypeException;
import com.jirasync.webhooks.error.WebhookProcessingException;
import com.jirasync.webhooks.model.WebhookEnvelope;
import com.jirasync.webhooks.parser.WebhookPayloadParser;
import com.jirasync.webhooks.processor.EventProcessor;
import com.jirasync.webhooks.processor.EventProcessorRegistry;
import com.jirasync.webhooks.processor.ProcessingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one delivery through parse, classify and process.
 *
 * <p>Expected failures become a REJECTED {@link SyncResponse}. A
 * {@link PersistenceConflictException} is retried up to {@code conflictRetries}
 * times without sleeping and then propagated, so the caller can answer with a
 * retriable status. Any other exception is logged and propagated.
 *
 * <p>Instances are thread-safe.
 */
public class WebhookPipeline {

    private static final Logger log = LoggerFactory.getLogger(WebhookPipeline.class);

    private final WebhookPayloadParser   parser;
    private final EventProcessorRegistry registry;
    private final UnknownEventPolicy     unknownEventPolicy;
    private final int                    conflictRetries;

    public WebhookPipeline(WebhookPayloadParser parser, EventProcessorRegistry registry,
                           UnknownEventPolicy unknownEventPolicy, int conflictRetries) {
        if (conflictRetries < 0) {
            throw new IllegalArgumentException("conflictRetries must be >= 0, got " + conflictRetries);
        }
        this.parser             = parser;
        this.registry           = registry;
        this.unknownEventPolicy = unknownEventPolicy;
        this.conflictRetries    = conflictRetries;
    }

    /**
     * @param body        the raw request body
     * @param contentType the declared content type, may be {@code null}
     * @return ACCEPTED or REJECTED
     * @throws PersistenceConflictException if the write kept colliding with
     *         concurrent writes; nothing was written
     */
    public SyncResponse handle(byte[] body, String contentType) throws PersistenceConflictException {
        WebhookEnvelope envelope;
        try {
            envelope = parser.parse(body, contentType);
        } catch (MalformedPayloadException e) {
            log.warn("Rejected malformed delivery eventType={} sourceSystemId={}: {}",
                    e.getEventType(), e.getSourceSystemId(), e.getMessage());
            return SyncResponse.rejected(e);
        }

        EventProcessor processor;
        try {
            processor = registry.forEventType(envelope.getEventType());
        } catch (UnsupportedEventTypeException e) {
            if (unknownEventPolicy == UnknownEventPolicy.IGNORE) {
                log.info("Ignored unsupported eventType={} sourceSystemId={}",
                        envelope.getEventType(), envelope.getSourceSystemId());
                return SyncResponse.ignored(envelope.getEventType(), envelope.getSourceSystemId());
            }
            log.warn("Rejected unsupported eventType={} sourceSystemId={}",
                    envelope.getEventType(), envelope.getSourceSystemId());
            return SyncResponse.rejected(e);
        }

        return process(processor, envelope);
    }

    private SyncResponse process(EventProcessor processor, WebhookEnvelope envelope)
            throws PersistenceConflictException {
        int attempt = 0;
        while (true) {
            try {
                ProcessingResult result = processor.process(envelope);
                log.info("Processed eventType={} ref={} outcome={}{}",
                        result.getEventType(), result.getRef(), result.getOutcome(),
                        result.isPlaceholderCreated() ? " (placeholder project created)" : "");
                return SyncResponse.accepted(result);
            } catch (WebhookProcessingException e) {
                log.warn("Rejected eventType={} sourceSystemId={}: {}",
                        envelope.getEventType(), envelope.getSourceSystemId(), e.getMessage());
                return SyncResponse.rejected(e);
            } catch (PersistenceConflictException e) {
                if (attempt >= conflictRetries) {
                    log.warn("Conflict persisted after {} attempt(s) for eventType={} sourceSystemId={}: {}",
                            attempt + 1, envelope.getEventType(), envelope.getSourceSystemId(), e.getMessage());
                    throw e;
                }
                attempt++;
                log.warn("Conflict for eventType={} sourceSystemId={}, retrying ({}/{}): {}",
                        envelope.getEventType(), envelope.getSourceSystemId(),
                        attempt, conflictRetries, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected failure for eventType={} sourceSystemId={}",
                        envelope.getEventType(), envelope.getSourceSystemId(), e);
                throw e;
            }
        }
    }

    public UnknownEventPolicy getUnknownEventPolicy() { return unknownEventPolicy; }
    public int                getConflictRetries()    { return conflictRetries; }
}

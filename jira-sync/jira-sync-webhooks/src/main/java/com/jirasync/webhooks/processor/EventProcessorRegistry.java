package com.jirasync.webhooks.processor;

import com.jirasync.storage.model.EntityKind;
import com.jirasync.webhooks.error.UnsupportedEventTypeException;
import com.jirasync.webhooks.model.EventType;
import com.jirasync.webhooks.sync.SyncOperation;
import com.jirasync.webhooks.sync.UpsertResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Exact-match table from event name to {@link EventProcessor}.
 *
 * <p>The table is built once and is read-only afterwards, so lookups need no
 * synchronization. A tag may carry a domain prefix ({@code jira:issue_created});
 * the prefix is stripped only when the domain is one of the accepted ones.
 *
 * <pre>
 *   EventProcessorRegistry registry = EventProcessorRegistry.builder()
 *       .acceptedDomains(Set.of("jira"))
 *       .register(EventType.ISSUE_CREATED, new IssueUpsertProcessor(resolver, SyncOperation.CREATED))
 *       .build();
 *
 *   EventProcessor processor = registry.forEventType("jira:issue_created");
 * </pre>
 */
public final class EventProcessorRegistry {

    private static final Logger log = LoggerFactory.getLogger(EventProcessorRegistry.class);

    private final Map<String, EventProcessor> processors;
    private final Set<String>                 acceptedDomains;

    private EventProcessorRegistry(Builder b) {
        this.processors      = Collections.unmodifiableMap(new LinkedHashMap<>(b.processors));
        this.acceptedDomains = Collections.unmodifiableSet(new LinkedHashSet<>(b.acceptedDomains));
    }

    /**
     * Registry with the six project/issue processors wired to {@code resolver}.
     */
    public static EventProcessorRegistry defaults(UpsertResolver resolver, Set<String> acceptedDomains) {
        return builder()
                .acceptedDomains(acceptedDomains)
                .register(EventType.PROJECT_CREATED, new ProjectUpsertProcessor(resolver, SyncOperation.CREATED))
                .register(EventType.PROJECT_UPDATED, new ProjectUpsertProcessor(resolver, SyncOperation.UPDATED))
                .register(EventType.PROJECT_DELETED, new EntityDeleteProcessor(resolver, EntityKind.PROJECT))
                .register(EventType.ISSUE_CREATED,   new IssueUpsertProcessor(resolver, SyncOperation.CREATED))
                .register(EventType.ISSUE_UPDATED,   new IssueUpsertProcessor(resolver, SyncOperation.UPDATED))
                .register(EventType.ISSUE_DELETED,   new EntityDeleteProcessor(resolver, EntityKind.ISSUE))
                .build();
    }

    /**
     * Looks up the processor for a raw event tag.
     *
     * @throws UnsupportedEventTypeException if the tag has a foreign domain or
     *         its name is not registered
     */
    public EventProcessor forEventType(String eventType) throws UnsupportedEventTypeException {
        if (eventType == null) {
            throw new UnsupportedEventTypeException(null);
        }
        String domain = EventType.domainOf(eventType);
        if (domain != null && !acceptedDomains.contains(domain)) {
            throw new UnsupportedEventTypeException(eventType);
        }
        EventProcessor processor = processors.get(EventType.nameOf(eventType));
        if (processor == null) {
            throw new UnsupportedEventTypeException(eventType);
        }
        return processor;
    }

    public Set<String> registeredEventNames() { return processors.keySet(); }
    public Set<String> getAcceptedDomains()   { return acceptedDomains; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final Map<String, EventProcessor> processors = new LinkedHashMap<>();
        private Set<String> acceptedDomains = Set.of(EventType.JIRA_DOMAIN);

        public Builder acceptedDomains(Set<String> domains) { this.acceptedDomains = domains; return this; }

        public Builder register(String eventName, EventProcessor processor) {
            if (eventName == null || eventName.isBlank()) {
                throw new IllegalArgumentException("eventName is required");
            }
            if (processor == null) {
                throw new IllegalArgumentException("processor is required for " + eventName);
            }
            if (processors.putIfAbsent(eventName, processor) != null) {
                throw new IllegalStateException("A processor is already registered for " + eventName);
            }
            log.debug("Registered {} for eventName='{}'", processor.getClass().getSimpleName(), eventName);
            return this;
        }

        public EventProcessorRegistry build() {
            if (acceptedDomains == null) {
                throw new IllegalStateException("acceptedDomains must not be null");
            }
            if (processors.isEmpty()) {
                throw new IllegalStateException("At least one processor must be registered");
            }
            return new EventProcessorRegistry(this);
        }
    }
}

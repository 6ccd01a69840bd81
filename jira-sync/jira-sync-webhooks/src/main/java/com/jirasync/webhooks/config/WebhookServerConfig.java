package com.jirasync.webhooks.config;

import com.jirasync.webhooks.model.EventType;
import com.jirasync.webhooks.pipeline.UnknownEventPolicy;
import com.jirasync.webhooks.sync.DeletionPolicy;
import com.jirasync.webhooks.sync.StalenessPolicy;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable configuration for the Jira sync service.
 *
 * Build with the nested {@link Builder}:
 * <pre>
 *   WebhookServerConfig config = WebhookServerConfig.builder()
 *       .port(8080)
 *       .path("/webhooks/jira")
 *       .unknownEventPolicy(UnknownEventPolicy.REJECT)
 *       .deletionPolicy(DeletionPolicy.SOFT)
 *       .storeConfig(Map.of("type", "MEMORY"))
 *       .build();
 * </pre>
 * or load it from properties with the {@code jira-sync.} prefix:
 * <pre>
 *   jira-sync.server.port=8080
 *   jira-sync.events.unknownPolicy=IGNORE
 *   jira-sync.store.type=JDBC
 *   jira-sync.store.jdbcUrl=jdbc:h2:./data/jira-sync
 * </pre>
 * Every {@code jira-sync.store.*} key is handed to
 * {@link com.jirasync.storage.EntityStoreFactory} without the prefix.
 */
public final class WebhookServerConfig {

    public static final String PREFIX       = "jira-sync.";
    public static final String STORE_PREFIX = PREFIX + "store.";

    private final int                 port;
    private final String              path;
    private final int                 maxThreads;
    private final long                processingTimeoutMs;
    private final Set<String>         acceptedDomains;
    private final UnknownEventPolicy  unknownEventPolicy;
    private final StalenessPolicy     stalenessPolicy;
    private final DeletionPolicy      deletionPolicy;
    private final int                 conflictRetries;
    private final Map<String, String> storeConfig;

    private WebhookServerConfig(Builder b) {
        this.port                = b.port;
        this.path                = b.path;
        this.maxThreads          = b.maxThreads;
        this.processingTimeoutMs = b.processingTimeoutMs;
        this.acceptedDomains     = Collections.unmodifiableSet(new LinkedHashSet<>(b.acceptedDomains));
        this.unknownEventPolicy  = b.unknownEventPolicy;
        this.stalenessPolicy     = b.stalenessPolicy;
        this.deletionPolicy      = b.deletionPolicy;
        this.conflictRetries     = b.conflictRetries;
        this.storeConfig         = Collections.unmodifiableMap(new LinkedHashMap<>(b.storeConfig));
    }

    public int                 getPort()                { return port; }
    public String              getPath()                { return path; }
    public int                 getMaxThreads()          { return maxThreads; }
    public long                getProcessingTimeoutMs() { return processingTimeoutMs; }
    public Set<String>         getAcceptedDomains()     { return acceptedDomains; }
    public UnknownEventPolicy  getUnknownEventPolicy()  { return unknownEventPolicy; }
    public StalenessPolicy     getStalenessPolicy()     { return stalenessPolicy; }
    public DeletionPolicy      getDeletionPolicy()      { return deletionPolicy; }
    public int                 getConflictRetries()     { return conflictRetries; }
    public Map<String, String> getStoreConfig()         { return storeConfig; }

    public static Builder builder() { return new Builder(); }

    /**
     * Reads {@code jira-sync.*} keys from {@code props}; missing keys keep their
     * defaults and keys without the prefix are ignored.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static WebhookServerConfig fromProperties(Properties props) {
        Builder b = builder();
        String v;
        if ((v = get(props, "server.port")) != null)                b.port(parseInt("server.port", v));
        if ((v = get(props, "server.path")) != null)                b.path(v);
        if ((v = get(props, "server.maxThreads")) != null)          b.maxThreads(parseInt("server.maxThreads", v));
        if ((v = get(props, "server.processingTimeoutMs")) != null) b.processingTimeoutMs(parseLong("server.processingTimeoutMs", v));
        if ((v = get(props, "events.acceptedDomains")) != null)     b.acceptedDomains(splitList(v));
        if ((v = get(props, "events.unknownPolicy")) != null)       b.unknownEventPolicy(parseEnum(UnknownEventPolicy.class, "events.unknownPolicy", v));
        if ((v = get(props, "sync.stalenessPolicy")) != null)       b.stalenessPolicy(parseEnum(StalenessPolicy.class, "sync.stalenessPolicy", v));
        if ((v = get(props, "sync.deletionPolicy")) != null)        b.deletionPolicy(parseEnum(DeletionPolicy.class, "sync.deletionPolicy", v));
        if ((v = get(props, "sync.conflictRetries")) != null)       b.conflictRetries(parseInt("sync.conflictRetries", v));

        Map<String, String> store = new LinkedHashMap<>();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(STORE_PREFIX)) {
                store.put(name.substring(STORE_PREFIX.length()), props.getProperty(name).trim());
            }
        }
        if (!store.isEmpty()) {
            b.storeConfig(store);
        }
        return b.build();
    }

    // ------------------------------------------------------------------
    // Property parsing helpers
    // ------------------------------------------------------------------

    private static String get(Properties props, String key) {
        String value = props.getProperty(PREFIX + key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(PREFIX + key + " must be one of "
                    + Arrays.toString(type.getEnumConstants()) + ", got '" + value + "'", e);
        }
    }

    private static Set<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public String toString() {
        // storeConfig is left out, it may hold a password
        return "WebhookServerConfig{port=" + port + ", path='" + path + "', maxThreads=" + maxThreads +
               ", processingTimeoutMs=" + processingTimeoutMs + ", acceptedDomains=" + acceptedDomains +
               ", unknownEventPolicy=" + unknownEventPolicy + ", stalenessPolicy=" + stalenessPolicy +
               ", deletionPolicy=" + deletionPolicy + ", conflictRetries=" + conflictRetries +
               ", storeType=" + storeConfig.getOrDefault("type", "MEMORY") + '}';
    }

    public static final class Builder {
        private int                 port                = 8080;
        private String              path                = "/webhooks/jira";
        private int                 maxThreads          = 16;
        private long                processingTimeoutMs = 5000;
        private Set<String>         acceptedDomains     = Set.of(EventType.JIRA_DOMAIN);
        private UnknownEventPolicy  unknownEventPolicy  = UnknownEventPolicy.REJECT;
        private StalenessPolicy     stalenessPolicy     = StalenessPolicy.SOURCE_TIMESTAMP;
        private DeletionPolicy      deletionPolicy      = DeletionPolicy.SOFT;
        private int                 conflictRetries     = 1;
        private Map<String, String> storeConfig         = Map.of("type", "MEMORY");

        public Builder port(int port)                                  { this.port = port; return this; }
        public Builder path(String path)                               { this.path = path; return this; }
        public Builder maxThreads(int maxThreads)                      { this.maxThreads = maxThreads; return this; }
        public Builder processingTimeoutMs(long timeoutMs)             { this.processingTimeoutMs = timeoutMs; return this; }
        public Builder acceptedDomains(Set<String> domains)            { this.acceptedDomains = domains; return this; }
        public Builder unknownEventPolicy(UnknownEventPolicy policy)   { this.unknownEventPolicy = policy; return this; }
        public Builder stalenessPolicy(StalenessPolicy policy)         { this.stalenessPolicy = policy; return this; }
        public Builder deletionPolicy(DeletionPolicy policy)           { this.deletionPolicy = policy; return this; }
        public Builder conflictRetries(int retries)                    { this.conflictRetries = retries; return this; }
        public Builder storeConfig(Map<String, String> storeConfig)    { this.storeConfig = storeConfig; return this; }

        public WebhookServerConfig build() {
            if (port < 0 || port > 65535) {
                throw new IllegalStateException("port must be between 0 and 65535, got " + port);
            }
            if (path == null || !path.startsWith("/")) {
                throw new IllegalStateException("path must start with '/', got " + path);
            }
            if (maxThreads < 1) {
                throw new IllegalStateException("maxThreads must be >= 1, got " + maxThreads);
            }
            if (processingTimeoutMs < 1) {
                throw new IllegalStateException("processingTimeoutMs must be >= 1, got " + processingTimeoutMs);
            }
            if (conflictRetries < 0) {
                throw new IllegalStateException("conflictRetries must be >= 0, got " + conflictRetries);
            }
            if (acceptedDomains == null || unknownEventPolicy == null || stalenessPolicy == null
                    || deletionPolicy == null || storeConfig == null) {
                throw new IllegalStateException("policies, acceptedDomains and storeConfig must not be null");
            }
            return new WebhookServerConfig(this);
        }
    }
}

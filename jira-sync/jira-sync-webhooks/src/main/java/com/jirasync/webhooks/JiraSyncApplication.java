package com.jirasync.webhooks;

import com.jirasync.storage.EntityStore;
import com.jirasync.storage.EntityStoreFactory;
import com.jirasync.webhooks.config.WebhookServerConfig;
import com.jirasync.webhooks.parser.WebhookPayloadParser;
import com.jirasync.webhooks.pipeline.WebhookPipeline;
import com.jirasync.webhooks.processor.EventProcessorRegistry;
import com.jirasync.webhooks.server.JiraWebhookServer;
import com.jirasync.webhooks.sync.UpsertResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Properties;

/**
 * Command-line entry point.
 *
 * <pre>
 *   java -jar jira-sync-webhooks.jar [config.properties]
 * </pre>
 * Configuration is layered: {@code jira-sync.properties} from the classpath,
 * then the optional file argument, then {@code -Djira-sync.*} system properties.
 */
public final class JiraSyncApplication {

    private static final Logger log = LoggerFactory.getLogger(JiraSyncApplication.class);
    private static final String DEFAULT_CONFIG = "/jira-sync.properties";

    private JiraSyncApplication() {}

    public static void main(String[] args) throws Exception {
        WebhookServerConfig config = WebhookServerConfig.fromProperties(loadProperties(args));
        log.info("Starting with {}", config);

        EntityStore store = EntityStoreFactory.fromConfig(config.getStoreConfig());
        JiraWebhookServer server = new JiraWebhookServer(config, buildPipeline(config, store, Clock.systemUTC()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.stop();
            } catch (Exception e) {
                log.error("Error while stopping webhook server", e);
            } finally {
                store.close();
            }
        }, "jira-sync-shutdown"));

        server.start();
        server.join();
    }

    /** Wires parser, processors and resolver over {@code store} as configured. */
    public static WebhookPipeline buildPipeline(WebhookServerConfig config, EntityStore store, Clock clock) {
        UpsertResolver resolver = new UpsertResolver(store, config.getStalenessPolicy(),
                config.getDeletionPolicy(), clock);
        EventProcessorRegistry registry = EventProcessorRegistry.defaults(resolver, config.getAcceptedDomains());
        log.info("Registered processors for {}", registry.registeredEventNames());
        return new WebhookPipeline(new WebhookPayloadParser(), registry,
                config.getUnknownEventPolicy(), config.getConflictRetries());
    }

    static Properties loadProperties(String[] args) throws IOException {
        Properties props = new Properties();
        try (InputStream in = JiraSyncApplication.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (in != null) {
                props.load(in);
            }
        }
        if (args.length > 0) {
            Path file = Path.of(args[0]);
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
            log.info("Loaded configuration from {}", file.toAbsolutePath());
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(WebhookServerConfig.PREFIX)) {
                props.setProperty(name, System.getProperty(name));
            }
        }
        return props;
    }
}

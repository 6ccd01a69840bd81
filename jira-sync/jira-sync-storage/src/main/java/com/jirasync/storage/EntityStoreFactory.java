package com.jirasync.storage;

import com.jirasync.storage.jdbc.JdbcEntityStore;
import com.jirasync.storage.memory.InMemoryEntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Factory that creates the configured {@link EntityStore}.
 *
 * <p>In-memory, for tests and throw-away deployments:
 * <pre>
 *   EntityStore s = EntityStoreFactory.fromConfig(Map.of("type", "MEMORY", "lockTimeoutMs", "2000"));
 * </pre>
 * Any JDBC database reachable with a driver on the classpath:
 * <pre>
 *   EntityStore s = EntityStoreFactory.fromConfig(Map.of(
 *       "type",        "JDBC",
 *       "jdbcUrl",     "jdbc:h2:./data/jira-sync",
 *       "username",    "sa",
 *       "password",    "",
 *       "maxPoolSize", "16",
 *       "connectionTimeoutMs", "5000"
 *   ));
 * </pre>
 * {@code lockTimeoutMs} applies to the in-memory store only; a database's row
 * lock timeout is set on the database itself, e.g. H2's {@code LOCK_TIMEOUT}
 * URL setting.
 */
public final class EntityStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(EntityStoreFactory.class);

    private EntityStoreFactory() {}

    /**
     * Creates a store from an explicit configuration map.
     *
     * @param config key/value configuration map (see class javadoc for keys)
     * @return the configured {@link EntityStore}
     */
    public static EntityStore fromConfig(Map<String, String> config) {
        String type = config.getOrDefault("type", "MEMORY").trim().toUpperCase();
        log.info("Creating EntityStore of type '{}'", type);

        return switch (type) {
            case "MEMORY" -> {
                Long timeout = longValue(config, "lockTimeoutMs");
                yield timeout == null ? InMemoryEntityStore.create() : InMemoryEntityStore.withLockTimeout(timeout);
            }

            case "JDBC" -> {
                String url = config.get("jdbcUrl");
                if (url == null || url.isBlank()) {
                    throw new IllegalArgumentException("JDBC store requires 'jdbcUrl' in config");
                }
                JdbcEntityStore.Builder b = JdbcEntityStore.builder()
                        .jdbcUrl(url)
                        .username(config.get("username"))
                        .password(config.get("password"));
                Long poolSize = longValue(config, "maxPoolSize");
                if (poolSize != null) {
                    b.maxPoolSize(Math.toIntExact(poolSize));
                }
                Long connectionTimeout = longValue(config, "connectionTimeoutMs");
                if (connectionTimeout != null) {
                    b.connectionTimeoutMs(connectionTimeout);
                }
                if (config.containsKey("initializeSchema")) {
                    b.initializeSchema(Boolean.parseBoolean(config.get("initializeSchema").trim()));
                }
                yield b.build();
            }

            default -> throw new IllegalArgumentException("Unknown EntityStore type: " + type);
        };
    }

    private static Long longValue(Map<String, String> config, String key) {
        String value = config.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }
}

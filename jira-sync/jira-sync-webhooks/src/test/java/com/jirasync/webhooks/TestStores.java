package com.jirasync.webhooks;

import com.jirasync.storage.EntityStore;
import com.jirasync.storage.jdbc.JdbcEntityStore;

import java.util.UUID;

/** Stores for tests that run against both store implementations. */
public final class TestStores {

    private TestStores() {}

    /** A JDBC store on a private, empty H2 in-memory database. */
    public static EntityStore h2() {
        return JdbcEntityStore.builder()
                .jdbcUrl("jdbc:h2:mem:jira-sync-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .username("sa")
                .password("")
                .maxPoolSize(10)
                .build();
    }
}

package com.jirasync.storage.jdbc;

import com.jirasync.storage.EntityStore;
import com.jirasync.storage.EntityStoreException;
import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.storage.StoreWork;
import com.jirasync.storage.model.EntityKind;
import com.jirasync.storage.model.ExternalEntityRef;
import com.jirasync.storage.model.IssueRecord;
import com.jirasync.storage.model.SyncedRecord;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link EntityStore} backed by a relational database through a HikariCP pool.
 *
 * <h2>Configuration</h2>
 * <pre>
 *   JdbcEntityStore store = JdbcEntityStore.builder()
 *       .jdbcUrl("jdbc:h2:./data/jira-sync;LOCK_TIMEOUT=2000")
 *       .username("sa")
 *       .password("")
 *       .maxPoolSize(16)
 *       .build();
 * </pre>
 *
 * <p>Every unit of work runs in its own transaction. Rows are locked with
 * {@code SELECT ... FOR UPDATE}; two units racing to insert the same Jira id
 * are separated by the unique constraint on {@code source_id}, and the loser
 * gets a {@link PersistenceConflictException}.
 */
public class JdbcEntityStore implements EntityStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEntityStore.class);

    static final String SCHEMA_RESOURCE = "/db/jira-sync-schema.sql";

    private final HikariDataSource dataSource;

    private JdbcEntityStore(Builder b) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(b.jdbcUrl);
        if (b.username != null) {
            config.setUsername(b.username);
        }
        if (b.password != null) {
            config.setPassword(b.password);
        }
        config.setPoolName("jira-sync-store");
        config.setMaximumPoolSize(b.maxPoolSize);
        config.setConnectionTimeout(b.connectionTimeoutMs);
        this.dataSource = new HikariDataSource(config);

        if (b.initializeSchema) {
            initializeSchema();
        }
        log.info("JdbcEntityStore connected to {} (maxPoolSize={})", b.jdbcUrl, b.maxPoolSize);
    }

    public static Builder builder() { return new Builder(); }

    @Override public String getStoreType() { return "JDBC"; }

    public long getConnectionTimeoutMs() { return dataSource.getConnectionTimeout(); }

    @Override
    public <T> T atomically(ExternalEntityRef ref, StoreWork<T> work) throws PersistenceConflictException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(new JdbcRecordSession(conn));
                conn.commit();
                return result;
            } catch (PersistenceConflictException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            } catch (SQLException e) {
                rollback(conn, e);
                if (JdbcRecordSession.isConflict(e)) {
                    throw new PersistenceConflictException("Commit conflict for " + ref, e);
                }
                throw new EntityStoreException("Commit failed for " + ref, e);
            }
        } catch (SQLException e) {
            throw new EntityStoreException("Could not obtain connection for " + ref, e);
        }
    }

    @Override
    public Optional<SyncedRecord> find(ExternalEntityRef ref) {
        EntityKind kind = ref.getEntityKind();
        String sql = "SELECT " + JdbcRecordSession.columns(kind) + " FROM " + JdbcRecordSession.table(kind) +
                     " WHERE source_id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, ref.getSourceSystemId());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(JdbcRecordSession.read(kind, rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new EntityStoreException("Failed to read " + ref, e);
        }
    }

    @Override
    public List<IssueRecord> findIssuesByProject(long projectLocalId) {
        String sql = "SELECT " + JdbcRecordSession.ISSUE_COLUMNS +
                     " FROM jira_issue WHERE project_id = ? ORDER BY local_id";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, projectLocalId);
            List<IssueRecord> issues = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    issues.add(JdbcRecordSession.readIssue(rs));
                }
            }
            return issues;
        } catch (SQLException e) {
            throw new EntityStoreException("Failed to list issues of project localId=" + projectLocalId, e);
        }
    }

    @Override
    public long count(EntityKind kind) {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + JdbcRecordSession.table(kind))) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new EntityStoreException("Failed to count " + kind, e);
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.info("JdbcEntityStore closed");
        }
    }

    // ------------------------------------------------------------------

    private void initializeSchema() {
        String script;
        try (InputStream in = JdbcEntityStore.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new EntityStoreException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new EntityStoreException("Could not read " + SCHEMA_RESOURCE, e);
        }

        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            for (String statement : splitStatements(script)) {
                st.execute(statement);
            }
        } catch (SQLException e) {
            dataSource.close();
            throw new EntityStoreException("Schema initialization failed", e);
        }
        log.debug("Schema from {} applied", SCHEMA_RESOURCE);
    }

    static List<String> splitStatements(String script) {
        StringBuilder cleaned = new StringBuilder();
        for (String line : script.split("\\R")) {
            if (!line.trim().startsWith("--")) {
                cleaned.append(line).append('\n');
            }
        }
        List<String> statements = new ArrayList<>();
        for (String s : cleaned.toString().split(";")) {
            if (!s.isBlank()) statements.add(s.trim());
        }
        return statements;
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    public static final class Builder {
        private String  jdbcUrl;
        private String  username;
        private String  password;
        private int     maxPoolSize         = 10;
        private long    connectionTimeoutMs = 5_000;
        private boolean initializeSchema    = true;

        private Builder() {}

        public Builder jdbcUrl(String url)                 { this.jdbcUrl = url; return this; }
        public Builder username(String username)           { this.username = username; return this; }
        public Builder password(String password)           { this.password = password; return this; }
        public Builder maxPoolSize(int size)               { this.maxPoolSize = size; return this; }
        public Builder connectionTimeoutMs(long ms)        { this.connectionTimeoutMs = ms; return this; }
        public Builder initializeSchema(boolean initialize) { this.initializeSchema = initialize; return this; }

        public JdbcEntityStore build() {
            if (jdbcUrl == null || jdbcUrl.isBlank()) {
                throw new IllegalStateException("jdbcUrl is required");
            }
            if (maxPoolSize < 1) {
                throw new IllegalStateException("maxPoolSize must be at least 1");
            }
            if (connectionTimeoutMs < 250) {
                throw new IllegalStateException("connectionTimeoutMs must be at least 250");
            }
            return new JdbcEntityStore(this);
        }
    }
}

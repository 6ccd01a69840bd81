package com.jirasync.storage.jdbc;

import com.jirasync.storage.EntityStoreException;
import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.storage.RecordSession;
import com.jirasync.storage.model.EntityKind;
import com.jirasync.storage.model.ExternalEntityRef;
import com.jirasync.storage.model.IssueRecord;
import com.jirasync.storage.model.ProjectRecord;
import com.jirasync.storage.model.SyncedRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link RecordSession} bound to one JDBC transaction. Rows are locked with
 * {@code SELECT ... FOR UPDATE} and stay locked until the transaction ends.
 */
final class JdbcRecordSession implements RecordSession {

    static final String PROJECT_COLUMNS =
            "local_id, source_id, project_key, name, placeholder, active, " +
            "external_last_modified, last_synced_at, local_modified_at";

    static final String ISSUE_COLUMNS =
            "local_id, source_id, issue_key, summary, status, project_id, project_source_id, active, " +
            "external_last_modified, last_synced_at, local_modified_at";

    private static final String INSERT_PROJECT =
            "INSERT INTO jira_project (source_id, project_key, name, placeholder, active, " +
            "external_last_modified, last_synced_at, local_modified_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_PROJECT =
            "UPDATE jira_project SET project_key = ?, name = ?, placeholder = ?, active = ?, " +
            "external_last_modified = ?, last_synced_at = ?, local_modified_at = ? WHERE source_id = ?";

    private static final String INSERT_ISSUE =
            "INSERT INTO jira_issue (source_id, issue_key, summary, status, project_id, project_source_id, " +
            "active, external_last_modified, last_synced_at, local_modified_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_ISSUE =
            "UPDATE jira_issue SET issue_key = ?, summary = ?, status = ?, project_id = ?, " +
            "project_source_id = ?, active = ?, external_last_modified = ?, last_synced_at = ?, " +
            "local_modified_at = ? WHERE source_id = ?";

    private final Connection conn;

    JdbcRecordSession(Connection conn) {
        this.conn = conn;
    }

    @Override
    public Optional<SyncedRecord> findByExternalRef(ExternalEntityRef ref) throws PersistenceConflictException {
        String sql = "SELECT " + columns(ref.getEntityKind()) + " FROM " + table(ref.getEntityKind()) +
                     " WHERE source_id = ? FOR UPDATE";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, ref.getSourceSystemId());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(ref.getEntityKind(), rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw translate("select " + ref, e);
        }
    }

    @Override
    public List<IssueRecord> findIssuesOfProject(String projectSourceId) throws PersistenceConflictException {
        String sql = "SELECT " + ISSUE_COLUMNS + " FROM jira_issue WHERE project_source_id = ? " +
                     "ORDER BY source_id FOR UPDATE";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, projectSourceId);
            List<IssueRecord> issues = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    issues.add(readIssue(rs));
                }
            }
            return issues;
        } catch (SQLException e) {
            throw translate("select issues of project " + projectSourceId, e);
        }
    }

    @Override
    public long insert(SyncedRecord record) throws PersistenceConflictException {
        boolean project = record.getEntityKind() == EntityKind.PROJECT;
        try (PreparedStatement ps = conn.prepareStatement(
                project ? INSERT_PROJECT : INSERT_ISSUE, Statement.RETURN_GENERATED_KEYS)) {
            if (project) {
                ProjectRecord p = (ProjectRecord) record;
                ps.setString(1, p.getSourceSystemId());
                ps.setString(2, p.getKey());
                ps.setString(3, p.getName());
                ps.setBoolean(4, p.isPlaceholder());
                ps.setBoolean(5, p.isActive());
                setInstant(ps, 6, p.getExternalLastModified());
                setInstant(ps, 7, p.getLastSyncedAt());
                setInstant(ps, 8, p.getLocalModifiedAt());
            } else {
                IssueRecord i = (IssueRecord) record;
                ps.setString(1, i.getSourceSystemId());
                ps.setString(2, i.getKey());
                ps.setString(3, i.getSummary());
                ps.setString(4, i.getStatus());
                ps.setLong(5, i.getProjectLocalId());
                ps.setString(6, i.getProjectSourceId());
                ps.setBoolean(7, i.isActive());
                setInstant(ps, 8, i.getExternalLastModified());
                setInstant(ps, 9, i.getLastSyncedAt());
                setInstant(ps, 10, i.getLocalModifiedAt());
            }
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new EntityStoreException("No generated key returned for " + record.getRef());
                }
                long id = keys.getLong(1);
                record.setLocalId(id);
                return id;
            }
        } catch (SQLException e) {
            throw translate("insert " + record.getRef(), e);
        }
    }

    @Override
    public void update(SyncedRecord record) throws PersistenceConflictException {
        boolean project = record.getEntityKind() == EntityKind.PROJECT;
        try (PreparedStatement ps = conn.prepareStatement(project ? UPDATE_PROJECT : UPDATE_ISSUE)) {
            if (project) {
                ProjectRecord p = (ProjectRecord) record;
                ps.setString(1, p.getKey());
                ps.setString(2, p.getName());
                ps.setBoolean(3, p.isPlaceholder());
                ps.setBoolean(4, p.isActive());
                setInstant(ps, 5, p.getExternalLastModified());
                setInstant(ps, 6, p.getLastSyncedAt());
                setInstant(ps, 7, p.getLocalModifiedAt());
                ps.setString(8, p.getSourceSystemId());
            } else {
                IssueRecord i = (IssueRecord) record;
                ps.setString(1, i.getKey());
                ps.setString(2, i.getSummary());
                ps.setString(3, i.getStatus());
                ps.setLong(4, i.getProjectLocalId());
                ps.setString(5, i.getProjectSourceId());
                ps.setBoolean(6, i.isActive());
                setInstant(ps, 7, i.getExternalLastModified());
                setInstant(ps, 8, i.getLastSyncedAt());
                setInstant(ps, 9, i.getLocalModifiedAt());
                ps.setString(10, i.getSourceSystemId());
            }
            if (ps.executeUpdate() == 0) {
                throw new PersistenceConflictException("No record to update for " + record.getRef());
            }
        } catch (SQLException e) {
            throw translate("update " + record.getRef(), e);
        }
    }

    @Override
    public boolean delete(ExternalEntityRef ref) throws PersistenceConflictException {
        String sql = "DELETE FROM " + table(ref.getEntityKind()) + " WHERE source_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, ref.getSourceSystemId());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw translate("delete " + ref, e);
        }
    }

    // ------------------------------------------------------------------
    // Row mapping, shared with JdbcEntityStore
    // ------------------------------------------------------------------

    static String table(EntityKind kind) {
        return kind == EntityKind.PROJECT ? "jira_project" : "jira_issue";
    }

    static String columns(EntityKind kind) {
        return kind == EntityKind.PROJECT ? PROJECT_COLUMNS : ISSUE_COLUMNS;
    }

    static SyncedRecord read(EntityKind kind, ResultSet rs) throws SQLException {
        return kind == EntityKind.PROJECT ? readProject(rs) : readIssue(rs);
    }

    static ProjectRecord readProject(ResultSet rs) throws SQLException {
        ProjectRecord p = new ProjectRecord();
        p.setLocalId(rs.getLong("local_id"));
        p.setSourceSystemId(rs.getString("source_id"));
        p.setKey(rs.getString("project_key"));
        p.setName(rs.getString("name"));
        p.setPlaceholder(rs.getBoolean("placeholder"));
        readCommon(p, rs);
        return p;
    }

    static IssueRecord readIssue(ResultSet rs) throws SQLException {
        IssueRecord i = new IssueRecord();
        i.setLocalId(rs.getLong("local_id"));
        i.setSourceSystemId(rs.getString("source_id"));
        i.setKey(rs.getString("issue_key"));
        i.setSummary(rs.getString("summary"));
        i.setStatus(rs.getString("status"));
        i.setProjectLocalId(rs.getLong("project_id"));
        i.setProjectSourceId(rs.getString("project_source_id"));
        readCommon(i, rs);
        return i;
    }

    private static void readCommon(SyncedRecord r, ResultSet rs) throws SQLException {
        r.setActive(rs.getBoolean("active"));
        r.setExternalLastModified(getInstant(rs, "external_last_modified"));
        r.setLastSyncedAt(getInstant(rs, "last_synced_at"));
        r.setLocalModifiedAt(getInstant(rs, "local_modified_at"));
    }

    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    /**
     * Integrity violations (SQLSTATE class 23), transaction rollbacks such as
     * deadlocks (class 40) and lock timeouts (H2's HYT00) are retriable conflicts;
     * everything else is a store failure.
     */
    static boolean isConflict(SQLException e) {
        String state = e.getSQLState();
        return state != null && (state.startsWith("23") || state.startsWith("40") || "HYT00".equals(state));
    }

    private static PersistenceConflictException translate(String operation, SQLException e) {
        if (isConflict(e)) {
            return new PersistenceConflictException(
                    "Conflict during " + operation + " (SQLSTATE " + e.getSQLState() + ")", e);
        }
        throw new EntityStoreException("Failed to " + operation, e);
    }
}

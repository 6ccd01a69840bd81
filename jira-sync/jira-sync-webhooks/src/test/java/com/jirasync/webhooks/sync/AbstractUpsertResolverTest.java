package com.jirasync.webhooks.sync;

import com.jirasync.storage.EntityStore;
import com.jirasync.storage.model.EntityKind;
import com.jirasync.storage.model.ExternalEntityRef;
import com.jirasync.storage.model.IssueRecord;
import com.jirasync.storage.model.ProjectRecord;
import com.jirasync.storage.model.SyncedRecord;
import com.jirasync.webhooks.model.IssueSnapshot;
import com.jirasync.webhooks.model.ProjectSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

/**
 * Resolver behaviour shared by every {@link EntityStore}; subclasses supply the store.
 */
abstract class AbstractUpsertResolverTest {

    private static final Instant T0  = Instant.parse("2025-01-01T00:00:00Z");
    private static final Instant T1  = Instant.parse("2025-01-01T00:00:05Z");
    private static final Instant T2  = Instant.parse("2025-01-01T00:00:10Z");
    private static final Instant T3  = Instant.parse("2025-01-01T00:00:15Z");
    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private static final ExternalEntityRef PRJ_1 = ExternalEntityRef.project("PRJ-1");
    private static final ExternalEntityRef ISS_1 = ExternalEntityRef.issue("ISS-1");
    private static final ExternalEntityRef ISS_2 = ExternalEntityRef.issue("ISS-2");

    private EntityStore    store;
    private UpsertResolver resolver;

    private final ProjectRecordMapper projects = new ProjectRecordMapper();
    private final IssueRecordMapper   issues   = new IssueRecordMapper();

    protected abstract EntityStore createStore();

    @BeforeEach
    void setUp() {
        store = createStore();
        resolver = resolver(StalenessPolicy.SOURCE_TIMESTAMP, DeletionPolicy.SOFT);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Nested
    @DisplayName("Projects")
    class Projects {

        @Test
        @DisplayName("Should be idempotent for a redelivered event")
        void shouldBeIdempotent() throws Exception {
            ProjectSnapshot created = new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0);

            assertThat(upsert(created, SyncOperation.CREATED).getOutcome()).isEqualTo(UpsertOutcome.INSERTED);
            ProjectRecord first = store.findProject("PRJ-1").orElseThrow();
            assertThat(upsert(created, SyncOperation.CREATED).getOutcome()).isEqualTo(UpsertOutcome.MERGED);
            ProjectRecord second = store.findProject("PRJ-1").orElseThrow();

            assertThat(store.count(EntityKind.PROJECT)).isEqualTo(1);
            assertThat(second.getLocalId()).isEqualTo(first.getLocalId());
            assertThat(second.getName()).isEqualTo(first.getName());
            assertThat(second.getExternalLastModified()).isEqualTo(T0);
            assertThat(second.getLastSyncedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should converge to the newest snapshot whatever the arrival order")
        void shouldIgnoreOlderSnapshot() throws Exception {
            upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha v2", T2), SyncOperation.UPDATED);

            UpsertResult late = upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha v1", T1), SyncOperation.UPDATED);

            assertThat(late.getOutcome()).isEqualTo(UpsertOutcome.NO_OP_STALE);
            ProjectRecord p = store.findProject("PRJ-1").orElseThrow();
            assertThat(p.getName()).isEqualTo("Alpha v2");
            assertThat(p.getExternalLastModified()).isEqualTo(T2);
        }

        @Test
        @DisplayName("Should insert on an update for an unknown project")
        void shouldAutoCreateOnUpdate() throws Exception {
            UpsertResult result = upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0), SyncOperation.UPDATED);

            assertThat(result.getOutcome()).isEqualTo(UpsertOutcome.INSERTED);
            assertThat(store.findProject("PRJ-1")).isPresent();
        }

        @Test
        @DisplayName("Should keep stored values for fields absent from an update")
        void shouldKeepAbsentFields() throws Exception {
            upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0), SyncOperation.CREATED);

            upsert(new ProjectSnapshot("PRJ-1", null, "Alpha renamed", T1), SyncOperation.UPDATED);

            ProjectRecord p = store.findProject("PRJ-1").orElseThrow();
            assertThat(p.getKey()).isEqualTo("ALPHA");
            assertThat(p.getName()).isEqualTo("Alpha renamed");
        }

        @Test
        @DisplayName("Should soft delete once and report later deletes as absent")
        void shouldDeleteIdempotently() throws Exception {
            upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0), SyncOperation.CREATED);

            assertThat(delete(PRJ_1, T1).getOutcome()).isEqualTo(UpsertOutcome.DELETED);
            assertThat(delete(PRJ_1, T1).getOutcome()).isEqualTo(UpsertOutcome.NO_OP_ABSENT);
            assertThat(delete(ExternalEntityRef.project("PRJ-404"), T1).getOutcome())
                    .isEqualTo(UpsertOutcome.NO_OP_ABSENT);

            ProjectRecord tombstone = store.findProject("PRJ-1").orElseThrow();
            assertThat(tombstone.isActive()).isFalse();
            assertThat(tombstone.getExternalLastModified()).isEqualTo(T1);
        }

        @Test
        @DisplayName("Should not let a late update resurrect a deleted project")
        void shouldGuardTombstone() throws Exception {
            upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0), SyncOperation.CREATED);
            delete(PRJ_1, T2);

            UpsertResult late = upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha late", T1), SyncOperation.UPDATED);
            assertThat(late.getOutcome()).isEqualTo(UpsertOutcome.NO_OP_STALE);
            assertThat(store.findProject("PRJ-1").orElseThrow().isActive()).isFalse();

            UpsertResult recreated = upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha again", T3), SyncOperation.CREATED);
            assertThat(recreated.getOutcome()).isEqualTo(UpsertOutcome.MERGED);
            ProjectRecord p = store.findProject("PRJ-1").orElseThrow();
            assertThat(p.isActive()).isTrue();
            assertThat(p.getName()).isEqualTo("Alpha again");
        }

        @Test
        @DisplayName("Should hard delete the project together with its issues")
        void shouldHardDeleteWithIssues() throws Exception {
            UpsertResolver hard = resolver(StalenessPolicy.SOURCE_TIMESTAMP, DeletionPolicy.HARD);
            hard.resolve(PRJ_1, new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0), SyncOperation.CREATED, projects);
            hard.resolve(ISS_1, issue("ISS-1", "PRJ-1", "Fix login", T0), SyncOperation.CREATED, issues);

            UpsertResult result = hard.resolve(PRJ_1, new ProjectSnapshot("PRJ-1", null, null, T1),
                    SyncOperation.DELETED, null);

            assertThat(result.getOutcome()).isEqualTo(UpsertOutcome.DELETED);
            assertThat(store.findProject("PRJ-1")).isEmpty();
            assertThat(store.findIssue("ISS-1")).isEmpty();
        }

        @Test
        @DisplayName("Should keep local edits newer than the snapshot when configured to")
        void shouldRespectLocalEdits() throws Exception {
            UpsertResolver respecting = resolver(StalenessPolicy.RESPECT_LOCAL_EDITS, DeletionPolicy.SOFT);
            respecting.resolve(PRJ_1, new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0), SyncOperation.CREATED, projects);
            store.atomically(PRJ_1, s -> {
                SyncedRecord r = s.findByExternalRef(PRJ_1).orElseThrow();
                r.setLocalModifiedAt(T2);
                s.update(r);
                return null;
            });

            UpsertResult older = respecting.resolve(PRJ_1, new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha v1", T1),
                    SyncOperation.UPDATED, projects);
            UpsertResult newer = respecting.resolve(PRJ_1, new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha v3", T3),
                    SyncOperation.UPDATED, projects);

            assertThat(older.getOutcome()).isEqualTo(UpsertOutcome.NO_OP_STALE);
            assertThat(newer.getOutcome()).isEqualTo(UpsertOutcome.MERGED);
            assertThat(store.findProject("PRJ-1").orElseThrow().getName()).isEqualTo("Alpha v3");
        }
    }

    @Nested
    @DisplayName("Project deletion")
    class ProjectDeletion {

        @Test
        @DisplayName("Should deactivate the active issues of a soft deleted project")
        void shouldDeactivateIssues() throws Exception {
            upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0), SyncOperation.CREATED);
            upsert(new ProjectSnapshot("PRJ-2", "BETA", "Beta", T0), SyncOperation.CREATED);
            upsertIssue(issue("ISS-1", "PRJ-1", "Fix login", T0), SyncOperation.CREATED);
            upsertIssue(issue("ISS-2", "PRJ-1", "Add logout", T0), SyncOperation.CREATED);
            upsertIssue(issue("ISS-3", "PRJ-2", "Other project", T0), SyncOperation.CREATED);
            delete(ISS_2, T1);

            UpsertResult result = delete(PRJ_1, T2);

            assertThat(result.getOutcome()).isEqualTo(UpsertOutcome.DELETED);
            IssueRecord cascaded = store.findIssue("ISS-1").orElseThrow();
            assertThat(cascaded.isActive()).isFalse();
            assertThat(cascaded.getExternalLastModified()).isEqualTo(T2);
            assertThat(cascaded.getLastSyncedAt()).isEqualTo(NOW);
            // already deleted on its own, keeps its deletion time
            assertThat(store.findIssue("ISS-2").orElseThrow().getExternalLastModified()).isEqualTo(T1);
            assertThat(store.findIssue("ISS-3").orElseThrow().isActive()).isTrue();
            assertThat(store.findProject("PRJ-2").orElseThrow().isActive()).isTrue();
        }

        @Test
        @DisplayName("Should ignore issue events not newer than the project deletion")
        void shouldIgnoreIssueOlderThanProjectDeletion() throws Exception {
            upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0), SyncOperation.CREATED);
            upsertIssue(issue("ISS-1", "PRJ-1", "Fix login", T0), SyncOperation.CREATED);
            delete(PRJ_1, T2);

            UpsertResult lateCreate = upsertIssue(issue("ISS-2", "PRJ-1", "Add logout", T1), SyncOperation.CREATED);
            UpsertResult sameTime   = upsertIssue(issue("ISS-3", "PRJ-1", "Add search", T2), SyncOperation.CREATED);
            UpsertResult lateUpdate = upsertIssue(issue("ISS-1", "PRJ-1", "Fix login v2", T1), SyncOperation.UPDATED);

            assertThat(lateCreate.getOutcome()).isEqualTo(UpsertOutcome.NO_OP_STALE);
            assertThat(sameTime.getOutcome()).isEqualTo(UpsertOutcome.NO_OP_STALE);
            assertThat(lateUpdate.getOutcome()).isEqualTo(UpsertOutcome.NO_OP_STALE);
            assertThat(store.findIssue("ISS-2")).isEmpty();
            assertThat(store.findIssue("ISS-3")).isEmpty();
            assertThat(store.findIssue("ISS-1").orElseThrow().getSummary()).isEqualTo("Fix login");
            assertThat(store.findProject("PRJ-1").orElseThrow().isActive()).isFalse();
        }

        @Test
        @DisplayName("Should revive a deleted project as placeholder for a newer issue")
        void shouldReviveProjectAsPlaceholder() throws Exception {
            upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0), SyncOperation.CREATED);
            long localId = store.findProject("PRJ-1").orElseThrow().getLocalId();
            delete(PRJ_1, T1);

            UpsertResult result = upsertIssue(issue("ISS-1", "PRJ-1", "Fix login", T2), SyncOperation.CREATED);

            assertThat(result.getOutcome()).isEqualTo(UpsertOutcome.INSERTED);
            assertThat(result.isPlaceholderCreated()).isTrue();
            ProjectRecord revived = store.findProject("PRJ-1").orElseThrow();
            assertThat(revived.getLocalId()).isEqualTo(localId);
            assertThat(revived.isActive()).isTrue();
            assertThat(revived.isPlaceholder()).isTrue();
            assertThat(revived.getName()).isEqualTo("Alpha");
            assertThat(revived.getExternalLastModified()).isEqualTo(T1);
            assertThat(store.findIssue("ISS-1").orElseThrow().getProjectLocalId()).isEqualTo(localId);

            // the deletion time still guards the project against older snapshots
            UpsertResult older = upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha old", T0), SyncOperation.UPDATED);
            UpsertResult newer = upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha new", T3), SyncOperation.UPDATED);
            assertThat(older.getOutcome()).isEqualTo(UpsertOutcome.NO_OP_STALE);
            assertThat(newer.getOutcome()).isEqualTo(UpsertOutcome.MERGED);
            ProjectRecord enriched = store.findProject("PRJ-1").orElseThrow();
            assertThat(enriched.isPlaceholder()).isFalse();
            assertThat(enriched.getName()).isEqualTo("Alpha new");
        }

        @Test
        @DisplayName("Should reactivate a cascaded issue and its project on a newer issue update")
        void shouldReactivateCascadedIssue() throws Exception {
            upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0), SyncOperation.CREATED);
            upsertIssue(issue("ISS-1", "PRJ-1", "Fix login", T0), SyncOperation.CREATED);
            delete(PRJ_1, T1);

            UpsertResult result = upsertIssue(issue("ISS-1", "PRJ-1", "Fix login again", T2), SyncOperation.UPDATED);

            assertThat(result.getOutcome()).isEqualTo(UpsertOutcome.MERGED);
            assertThat(result.isPlaceholderCreated()).isTrue();
            IssueRecord i = store.findIssue("ISS-1").orElseThrow();
            assertThat(i.isActive()).isTrue();
            assertThat(i.getSummary()).isEqualTo("Fix login again");
            assertThat(store.findProject("PRJ-1").orElseThrow().isActive()).isTrue();
        }

        @Test
        @DisplayName("Should leave no active issue under a deleted project")
        void shouldNotLeaveActiveOrphans() throws Exception {
            upsertIssue(issue("ISS-1", "PRJ-1", "Fix login", T0), SyncOperation.CREATED);
            delete(PRJ_1, T1);

            ProjectRecord p = store.findProject("PRJ-1").orElseThrow();
            assertThat(p.isActive()).isFalse();
            assertThat(store.findIssuesByProject(p.getLocalId()))
                    .isNotEmpty()
                    .noneMatch(IssueRecord::isActive);
        }
    }

    @Nested
    @DisplayName("Issues")
    class Issues {

        @Test
        @DisplayName("Should create a placeholder for an unknown project and link the issue to it")
        void shouldCreatePlaceholder() throws Exception {
            UpsertResult result = upsertIssue(issue("ISS-1", "PRJ-9", "Fix login", T1), SyncOperation.CREATED);

            assertThat(result.getOutcome()).isEqualTo(UpsertOutcome.INSERTED);
            assertThat(result.isPlaceholderCreated()).isTrue();

            ProjectRecord placeholder = store.findProject("PRJ-9").orElseThrow();
            assertThat(placeholder.isPlaceholder()).isTrue();
            assertThat(placeholder.isActive()).isTrue();
            assertThat(placeholder.getExternalLastModified()).isNull();
            assertThat(store.findIssuesByProject(placeholder.getLocalId()))
                    .extracting(IssueRecord::getSourceSystemId).containsExactly("ISS-1");
        }

        @Test
        @DisplayName("Should enrich the placeholder with the first genuine project event")
        void shouldEnrichPlaceholder() throws Exception {
            upsertIssue(issue("ISS-1", "PRJ-9", "Fix login", T2), SyncOperation.CREATED);
            long placeholderId = store.findProject("PRJ-9").orElseThrow().getLocalId();

            // older than the issue, still applied to a placeholder
            UpsertResult result = upsert(new ProjectSnapshot("PRJ-9", "NINE", "Nine", T0), SyncOperation.CREATED);

            assertThat(result.getOutcome()).isEqualTo(UpsertOutcome.MERGED);
            ProjectRecord p = store.findProject("PRJ-9").orElseThrow();
            assertThat(p.getLocalId()).isEqualTo(placeholderId);
            assertThat(p.isPlaceholder()).isFalse();
            assertThat(p.getName()).isEqualTo("Nine");
            assertThat(p.getExternalLastModified()).isEqualTo(T0);
            assertThat(store.findIssue("ISS-1").orElseThrow().getProjectLocalId()).isEqualTo(placeholderId);
        }

        @Test
        @DisplayName("Should fill placeholder gaps from later issue events")
        void shouldFillPlaceholderFromIssue() throws Exception {
            upsertIssue(issue("ISS-1", "PRJ-9", "Fix login", T1), SyncOperation.CREATED);

            IssueSnapshot withProjectDetails = IssueSnapshot.builder()
                    .id("ISS-2").summary("Add logout").projectId("PRJ-9")
                    .projectKey("NINE").projectName("Nine").lastModified(T1)
                    .build();
            UpsertResult result = upsertIssue(withProjectDetails, SyncOperation.CREATED);

            assertThat(result.isPlaceholderCreated()).isFalse();
            ProjectRecord p = store.findProject("PRJ-9").orElseThrow();
            assertThat(p.isPlaceholder()).isTrue();
            assertThat(p.getKey()).isEqualTo("NINE");
            assertThat(p.getName()).isEqualTo("Nine");
        }

        @Test
        @DisplayName("Should link to an existing project without creating a placeholder")
        void shouldLinkExistingProject() throws Exception {
            upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0), SyncOperation.CREATED);

            UpsertResult result = upsertIssue(issue("ISS-1", "PRJ-1", "Fix login", T1), SyncOperation.CREATED);

            assertThat(result.isPlaceholderCreated()).isFalse();
            assertThat(store.count(EntityKind.PROJECT)).isEqualTo(1);
            assertThat(store.findIssue("ISS-1").orElseThrow().getProjectLocalId())
                    .isEqualTo(store.findProject("PRJ-1").orElseThrow().getLocalId());
        }

        @Test
        @DisplayName("Should relink an issue that moved to another project")
        void shouldRelinkMovedIssue() throws Exception {
            upsert(new ProjectSnapshot("PRJ-1", "ALPHA", "Alpha", T0), SyncOperation.CREATED);
            upsert(new ProjectSnapshot("PRJ-2", "BETA", "Beta", T0), SyncOperation.CREATED);
            upsertIssue(issue("ISS-1", "PRJ-1", "Fix login", T1), SyncOperation.CREATED);

            UpsertResult moved = upsertIssue(issue("ISS-1", "PRJ-2", "Fix login", T2), SyncOperation.UPDATED);

            assertThat(moved.getOutcome()).isEqualTo(UpsertOutcome.MERGED);
            IssueRecord i = store.findIssue("ISS-1").orElseThrow();
            assertThat(i.getProjectSourceId()).isEqualTo("PRJ-2");
            assertThat(i.getProjectLocalId()).isEqualTo(store.findProject("PRJ-2").orElseThrow().getLocalId());
        }

        @Test
        @DisplayName("Should ignore a stale issue update without touching its project")
        void shouldIgnoreStaleIssue() throws Exception {
            upsertIssue(issue("ISS-1", "PRJ-1", "Current", T2), SyncOperation.CREATED);

            UpsertResult stale = upsertIssue(issue("ISS-1", "PRJ-7", "Old", T1), SyncOperation.UPDATED);

            assertThat(stale.getOutcome()).isEqualTo(UpsertOutcome.NO_OP_STALE);
            assertThat(stale.isPlaceholderCreated()).isFalse();
            assertThat(store.findProject("PRJ-7")).isEmpty();
            assertThat(store.findIssue("ISS-1").orElseThrow().getSummary()).isEqualTo("Current");
        }

        @Test
        @DisplayName("Should soft delete an issue and keep its project")
        void shouldSoftDeleteIssue() throws Exception {
            upsertIssue(issue("ISS-1", "PRJ-1", "Fix login", T0), SyncOperation.CREATED);

            assertThat(delete(ISS_1, T1).getOutcome()).isEqualTo(UpsertOutcome.DELETED);

            assertThat(store.findIssue("ISS-1").orElseThrow().isActive()).isFalse();
            assertThat(store.findProject("PRJ-1").orElseThrow().isActive()).isTrue();
        }
    }

    // ------------------------------------------------------------------

    private UpsertResolver resolver(StalenessPolicy staleness, DeletionPolicy deletion) {
        return new UpsertResolver(store, staleness, deletion, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private UpsertResult upsert(ProjectSnapshot snapshot, SyncOperation operation) throws Exception {
        return resolver.resolve(ExternalEntityRef.project(snapshot.getId()), snapshot, operation, projects);
    }

    private UpsertResult upsertIssue(IssueSnapshot snapshot, SyncOperation operation) throws Exception {
        return resolver.resolve(ExternalEntityRef.issue(snapshot.getId()), snapshot, operation, issues);
    }

    private UpsertResult delete(ExternalEntityRef ref, Instant at) throws Exception {
        ProjectSnapshot snapshot = new ProjectSnapshot(ref.getSourceSystemId(), null, null, at);
        return resolver.resolve(ref, snapshot, SyncOperation.DELETED, null);
    }

    private static IssueSnapshot issue(String id, String projectId, String summary, Instant lastModified) {
        return IssueSnapshot.builder()
                .id(id)
                .key("KEY-" + id)
                .summary(summary)
                .projectId(projectId)
                .lastModified(lastModified)
                .build();
    }
}

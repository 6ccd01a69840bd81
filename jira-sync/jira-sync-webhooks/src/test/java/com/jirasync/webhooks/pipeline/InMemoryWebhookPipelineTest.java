package com.jirasync.webhooks.pipeline;

import com.jirasync.storage.EntityStore;
import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.storage.memory.InMemoryEntityStore;
import com.jirasync.webhooks.config.WebhookServerConfig;
import com.jirasync.webhooks.sync.UpsertOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("Webhook pipeline on the in-memory store")
class InMemoryWebhookPipelineTest extends AbstractWebhookPipelineTest {

    @Override
    protected EntityStore createStore() {
        return InMemoryEntityStore.create();
    }

    @Test
    @DisplayName("Should retry a conflicting write once and then succeed")
    void shouldRetryConflict() throws Exception {
        EntityStore flaky = spy(InMemoryEntityStore.create());
        doThrow(new PersistenceConflictException("busy"))
                .doCallRealMethod()
                .when(flaky).atomically(any(), any());
        WebhookPipeline retrying = pipeline(WebhookServerConfig.builder().conflictRetries(1).build(), flaky);

        SyncResponse response = retrying.handle(bytes("""
                {"eventType":"project_created","timestamp":"2025-01-01T00:00:00Z",
                 "entityPayload":{"id":"PRJ-1","name":"Alpha"}}"""), JSON);

        assertThat(response.getOutcome()).isEqualTo(UpsertOutcome.INSERTED);
        verify(flaky, times(2)).atomically(any(), any());
        assertThat(flaky.findProject("PRJ-1")).isPresent();
    }

    @Test
    @DisplayName("Should propagate a conflict once retries are exhausted")
    void shouldPropagatePersistentConflict() throws Exception {
        EntityStore blocked = spy(InMemoryEntityStore.create());
        doThrow(new PersistenceConflictException("busy")).when(blocked).atomically(any(), any());
        WebhookPipeline retrying = pipeline(WebhookServerConfig.builder().conflictRetries(2).build(), blocked);

        assertThatThrownBy(() -> retrying.handle(bytes("""
                {"eventType":"project_created","timestamp":"2025-01-01T00:00:00Z",
                 "entityPayload":{"id":"PRJ-1","name":"Alpha"}}"""), JSON))
                .isInstanceOf(PersistenceConflictException.class);
        verify(blocked, times(3)).atomically(any(), any());
    }
}

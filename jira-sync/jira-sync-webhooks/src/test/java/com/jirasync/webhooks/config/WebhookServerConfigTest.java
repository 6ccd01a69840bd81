package com.jirasync.webhooks.config;

import com.jirasync.webhooks.pipeline.UnknownEventPolicy;
import com.jirasync.webhooks.sync.DeletionPolicy;
import com.jirasync.webhooks.sync.StalenessPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Webhook server configuration")
class WebhookServerConfigTest {

    @Test
    @DisplayName("Should use the documented defaults")
    void shouldApplyDefaults() {
        WebhookServerConfig config = WebhookServerConfig.builder().build();

        assertThat(config.getPort()).isEqualTo(8080);
        assertThat(config.getPath()).isEqualTo("/webhooks/jira");
        assertThat(config.getMaxThreads()).isEqualTo(16);
        assertThat(config.getProcessingTimeoutMs()).isEqualTo(5000);
        assertThat(config.getAcceptedDomains()).containsExactly("jira");
        assertThat(config.getUnknownEventPolicy()).isEqualTo(UnknownEventPolicy.REJECT);
        assertThat(config.getStalenessPolicy()).isEqualTo(StalenessPolicy.SOURCE_TIMESTAMP);
        assertThat(config.getDeletionPolicy()).isEqualTo(DeletionPolicy.SOFT);
        assertThat(config.getConflictRetries()).isEqualTo(1);
        assertThat(config.getStoreConfig()).containsEntry("type", "MEMORY");
    }

    @Test
    @DisplayName("Should read prefixed properties and pass store keys through")
    void shouldReadProperties() {
        Properties props = new Properties();
        props.setProperty("jira-sync.server.port", "9090");
        props.setProperty("jira-sync.server.path", "/hooks");
        props.setProperty("jira-sync.server.processingTimeoutMs", "750");
        props.setProperty("jira-sync.events.acceptedDomains", "jira, jira-cloud ,");
        props.setProperty("jira-sync.events.unknownPolicy", "ignore");
        props.setProperty("jira-sync.sync.stalenessPolicy", "RESPECT_LOCAL_EDITS");
        props.setProperty("jira-sync.sync.deletionPolicy", "hard");
        props.setProperty("jira-sync.sync.conflictRetries", "3");
        props.setProperty("jira-sync.store.type", "JDBC");
        props.setProperty("jira-sync.store.jdbcUrl", "jdbc:h2:mem:cfg");
        props.setProperty("unrelated.key", "x");

        WebhookServerConfig config = WebhookServerConfig.fromProperties(props);

        assertThat(config.getPort()).isEqualTo(9090);
        assertThat(config.getPath()).isEqualTo("/hooks");
        assertThat(config.getProcessingTimeoutMs()).isEqualTo(750);
        assertThat(config.getAcceptedDomains()).containsExactly("jira", "jira-cloud");
        assertThat(config.getUnknownEventPolicy()).isEqualTo(UnknownEventPolicy.IGNORE);
        assertThat(config.getStalenessPolicy()).isEqualTo(StalenessPolicy.RESPECT_LOCAL_EDITS);
        assertThat(config.getDeletionPolicy()).isEqualTo(DeletionPolicy.HARD);
        assertThat(config.getConflictRetries()).isEqualTo(3);
        assertThat(config.getStoreConfig())
                .containsExactlyInAnyOrderEntriesOf(Map.of("type", "JDBC", "jdbcUrl", "jdbc:h2:mem:cfg"));
        assertThat(config.getMaxThreads()).isEqualTo(16);
    }

    @Test
    @DisplayName("Should name the offending key for unparseable values")
    void shouldRejectBadValues() {
        Properties port = new Properties();
        port.setProperty("jira-sync.server.port", "eighty");
        Properties policy = new Properties();
        policy.setProperty("jira-sync.sync.deletionPolicy", "SOMETIMES");

        assertThatThrownBy(() -> WebhookServerConfig.fromProperties(port))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jira-sync.server.port");
        assertThatThrownBy(() -> WebhookServerConfig.fromProperties(policy))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SOFT");
    }

    @Test
    @DisplayName("Should validate ranges in build()")
    void shouldValidateOnBuild() {
        assertThatThrownBy(() -> WebhookServerConfig.builder().port(70000).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> WebhookServerConfig.builder().path("webhooks").build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> WebhookServerConfig.builder().conflictRetries(-1).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> WebhookServerConfig.builder().processingTimeoutMs(0).build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should keep credentials out of toString")
    void shouldHidePassword() {
        WebhookServerConfig config = WebhookServerConfig.builder()
                .storeConfig(Map.of("type", "JDBC", "jdbcUrl", "jdbc:h2:mem:x", "password", "s3cret"))
                .build();

        assertThat(config.toString()).doesNotContain("s3cret").contains("storeType=JDBC");
    }
}

package com.jirasync.webhooks.pipeline;

import com.jirasync.storage.EntityStore;
import com.jirasync.webhooks.TestStores;
import org.junit.jupiter.api.DisplayName;

@DisplayName("Webhook pipeline on H2")
class JdbcWebhookPipelineTest extends AbstractWebhookPipelineTest {

    @Override
    protected EntityStore createStore() {
        return TestStores.h2();
    }
}

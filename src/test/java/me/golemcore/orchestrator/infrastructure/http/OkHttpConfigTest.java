package me.golemcore.orchestrator.infrastructure.http;

import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeoutsAndDisableRetries() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getHttp().setConnectTimeout(2000);
        properties.getHttp().setReadTimeout(15000);

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(2000, client.connectTimeoutMillis());
        assertEquals(15000, client.readTimeoutMillis());
        assertEquals(60000, client.writeTimeoutMillis());
        assertFalse(client.retryOnConnectionFailure());
    }
}

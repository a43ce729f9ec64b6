package me.golemcore.orchestrator.adapter.outbound.llm;

import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmAdapterFactoryTest {

    private OrchestratorProperties properties;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
    }

    @Test
    void shouldSelectConfiguredProvider() {
        properties.getLlm().setProvider("langchain4j");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j, noop));
        factory.init();

        assertEquals("langchain4j", factory.getProviderId());
        assertSame(langchain4j, factory.getActiveAdapter());
        assertTrue(factory.isAvailable());
    }

    @Test
    void shouldFallbackToNoopWhenProviderNotFound() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j, noop));
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertFalse(factory.isAvailable());
    }

    @Test
    void shouldFallbackToFirstAdapterWhenNoopMissing() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j));
        factory.init();

        assertSame(langchain4j, factory.getActiveAdapter());
    }

    @Test
    void shouldDelegateChatToActiveAdapter() {
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmRequest request = LlmRequest.builder().agentName("WriterAgent").build();
        CompletableFuture<LlmResponse> response = CompletableFuture.completedFuture(LlmResponse.text("draft"));
        when(langchain4j.chat(request)).thenReturn(response);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j));
        factory.init();

        assertSame(response, factory.chat(request));
        verify(langchain4j).chat(request);
        assertEquals("openai/gpt-4o-mini", factory.getCurrentModel());
    }

    @Test
    void shouldFailChatWithoutAdapters() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        CompletionException error = assertThrows(CompletionException.class,
                () -> factory.chat(LlmRequest.builder().build()).join());
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("none", factory.getProviderId());
    }

    private static LlmProviderAdapter createMockAdapter(String providerId, boolean available) {
        LlmProviderAdapter adapter = mock(LlmProviderAdapter.class);
        when(adapter.getProviderId()).thenReturn(providerId);
        when(adapter.isAvailable()).thenReturn(available);
        when(adapter.getCurrentModel()).thenReturn("openai/gpt-4o-mini");
        return adapter;
    }
}

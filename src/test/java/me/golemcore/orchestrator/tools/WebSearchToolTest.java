package me.golemcore.orchestrator.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.http.FeignClientFactory;
import me.golemcore.orchestrator.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebSearchToolTest {

    private static final String BASE_URL = "http://search.test";

    private OkHttpMockEngine engine;
    private OrchestratorProperties properties;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new OrchestratorProperties();
        properties.getTools().getWebSearch().setBaseUrl(BASE_URL);
        properties.getTools().getWebSearch().setApiKey("brave-key");
    }

    @Test
    void shouldFormatSearchResults() {
        engine.enqueueJson(200, """
                {"web":{"results":[
                  {"title":"Rust 1.80","url":"https://blog.rust-lang.org/1.80","description":"Release notes"},
                  {"title":"LazyCell","url":"https://doc.rust-lang.org/lazycell","extra":"ignored"}
                ]}}
                """);
        WebSearchTool tool = createTool();

        ToolResult result = tool.execute(Map.of("query", "rust release")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Search results for \"rust release\" (2 results):"));
        assertTrue(result.getOutput().contains("**Rust 1.80**"));
        assertTrue(result.getOutput().contains("https://blog.rust-lang.org/1.80"));
        assertTrue(result.getOutput().contains("**LazyCell**"));
        assertEquals(Map.of("query", "rust release", "count", 2), result.getData());
    }

    @Test
    void shouldSendQueryCountAndSubscriptionToken() {
        engine.enqueueJson(200, "{\"web\":{\"results\":[]}}");
        WebSearchTool tool = createTool();

        tool.execute(Map.of("query", "golden retriever", "count", 50)).join();

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("/res/v1/web/search", request.url().encodedPath());
        assertEquals("golden retriever", request.queryParameter("q"));
        assertEquals("20", request.queryParameter("count"));
        assertEquals("brave-key", request.header("X-Subscription-Token"));
    }

    @Test
    void shouldUseDefaultCountWhenNotGiven() {
        engine.enqueueJson(200, "{}");
        WebSearchTool tool = createTool();

        tool.execute(Map.of("query", "markets")).join();

        assertEquals("5", engine.takeRequest().queryParameter("count"));
    }

    @Test
    void shouldReportEmptyResults() {
        engine.enqueueJson(200, "{\"web\":{\"results\":[]}}");
        WebSearchTool tool = createTool();

        ToolResult result = tool.execute(Map.of("query", "xyzzy")).join();

        assertTrue(result.isSuccess());
        assertEquals("No results found for: xyzzy", result.getOutput());
    }

    @Test
    void shouldRequireQuery() {
        WebSearchTool tool = createTool();

        ToolResult result = tool.execute(Map.of("count", 3)).join();

        assertFalse(result.isSuccess());
        assertEquals("Search query is required", result.getError());
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldDisableWithoutApiKey() {
        properties.getTools().getWebSearch().setApiKey(" ");
        WebSearchTool tool = createTool();

        ToolResult result = tool.execute(Map.of("query", "anything")).join();

        assertFalse(tool.isEnabled());
        assertFalse(result.isSuccess());
        assertEquals("Web search is not configured", result.getError());
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldReturnFailureForClientError() {
        engine.enqueueJson(400, "{\"error\":\"bad query\"}");
        WebSearchTool tool = createTool();

        ToolResult result = tool.execute(Map.of("query", "bad")).join();

        assertFalse(result.isSuccess());
        assertEquals("Web search failed (HTTP 400)", result.getError());
        assertEquals("Error: Web search failed (HTTP 400)", result.toMessageContent());
    }

    @Test
    void shouldThrowTransientFailureForRateLimit() {
        engine.enqueueJson(429, "{\"error\":\"rate limited\"}");
        WebSearchTool tool = createTool();

        CompletionException error = assertThrows(CompletionException.class,
                () -> tool.execute(Map.of("query", "busy")).join());

        FeignException cause = assertInstanceOf(FeignException.class, error.getCause());
        assertEquals(429, cause.status());
    }

    @Test
    void shouldDescribeQueryParameter() {
        WebSearchTool tool = createTool();

        assertEquals(WebSearchTool.TOOL_NAME, tool.getDefinition().getName());
        assertTrue(tool.getDefinition().getInputSchema().containsKey("required"));
    }

    private WebSearchTool createTool() {
        WebSearchTool tool = new WebSearchTool(new FeignClientFactory(engine.client(), new ObjectMapper()),
                properties);
        tool.init();
        return tool;
    }
}

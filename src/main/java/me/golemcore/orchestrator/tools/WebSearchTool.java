package me.golemcore.orchestrator.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.system.InvocationErrorClassifier;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Web search over the Brave Search API, exposed to agents as
 * {@code web_search}.
 *
 * <p>
 * Transient HTTP failures (429, 5xx, timeouts) are thrown so the calling
 * agent's retry policy handles them; other API errors are reported to the
 * model as a failed result.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code orchestrator.tools.web-search.enabled} - Enable/disable
 * <li>{@code orchestrator.tools.web-search.api-key} - Brave API key (required)
 * <li>{@code orchestrator.tools.web-search.default-count} - Number of results
 * (default 5)
 * </ul>
 *
 * @see <a href="https://brave.com/search/api/">Brave Search API</a>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSearchTool implements ToolComponent {

    public static final String TOOL_NAME = "web_search";

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_COUNT = "count";
    private static final int MAX_COUNT = 20;

    private final FeignClientFactory feignClientFactory;
    private final OrchestratorProperties properties;

    private WebSearchApi searchApi;
    private boolean enabled;
    private String apiKey;
    private int defaultCount;

    @PostConstruct
    public void init() {
        OrchestratorProperties.WebSearchToolProperties config = properties.getTools().getWebSearch();
        this.enabled = config.isEnabled();
        this.apiKey = config.getApiKey();
        this.defaultCount = config.getDefaultCount();

        if (enabled && (apiKey == null || apiKey.isBlank())) {
            log.warn("[WebSearch] Enabled but API key is not configured. Disabling.");
            this.enabled = false;
        }

        if (enabled) {
            this.searchApi = feignClientFactory.create(WebSearchApi.class, config.getBaseUrl());
            log.info("[WebSearch] Initialized (default results: {})", defaultCount);
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Search the web. Returns titles, URLs and descriptions of the top results.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", "string",
                                        "description", "The search query"),
                                PARAM_COUNT, Map.of(
                                        "type", "integer",
                                        "description", "Number of results to return (1-" + MAX_COUNT
                                                + ", default: " + defaultCount + ")")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object queryValue = parameters.get(PARAM_QUERY);
            String query = queryValue != null ? String.valueOf(queryValue) : null;
            if (query == null || query.isBlank()) {
                return ToolResult.failure("Search query is required");
            }
            if (!enabled) {
                return ToolResult.failure("Web search is not configured");
            }

            int count = defaultCount;
            if (parameters.get(PARAM_COUNT) instanceof Number n) {
                count = Math.max(1, Math.min(MAX_COUNT, n.intValue()));
            }
            return search(query, count);
        });
    }

    private ToolResult search(String query, int count) {
        log.debug("[WebSearch] query='{}', count={}", query, count);
        try {
            WebSearchResponse response = searchApi.search(apiKey, query, count);
            return buildSuccessResult(query, response);
        } catch (FeignException e) {
            if (InvocationErrorClassifier.isTransient(e)) {
                log.warn("[WebSearch] Transient failure (status {}) for query: {}", e.status(), query);
                throw e;
            }
            log.error("[WebSearch] API error (status {}) for query: {}", e.status(), query, e);
            return ToolResult.failure("Web search failed (HTTP " + e.status() + ")");
        }
    }

    private ToolResult buildSuccessResult(String query, WebSearchResponse response) {
        if (response == null || response.getWeb() == null || response.getWeb().getResults() == null
                || response.getWeb().getResults().isEmpty()) {
            return ToolResult.success("No results found for: " + query);
        }

        List<WebResult> results = response.getWeb().getResults();

        String output = results.stream()
                .map(r -> String.format("**%s**%n%s%n%s",
                        r.getTitle(),
                        r.getUrl(),
                        r.getDescription() != null ? r.getDescription() : ""))
                .collect(Collectors.joining("\n\n"));

        String header = String.format("Search results for \"%s\" (%d results):%n%n", query, results.size());

        return ToolResult.success(header + output, Map.of(
                PARAM_QUERY, query,
                PARAM_COUNT, results.size()));
    }

    interface WebSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}")
        @Headers({
                "Accept: application/json",
                "X-Subscription-Token: {apiKey}"
        })
        WebSearchResponse search(
                @Param("apiKey") String apiKey,
                @Param("query") String query,
                @Param("count") int count);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebSearchResponse {
        private WebResults web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResults {
        private List<WebResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResult {
        private String title;
        private String url;
        private String description;
    }
}

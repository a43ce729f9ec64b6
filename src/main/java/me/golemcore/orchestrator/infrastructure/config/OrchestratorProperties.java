package me.golemcore.orchestrator.infrastructure.config;

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

import lombok.Data;
import me.golemcore.orchestrator.domain.model.FailureKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of the orchestrator, bound from {@code orchestrator.*}.
 *
 * <p>
 * Besides runtime settings ({@link LlmProperties}, {@link HttpProperties},
 * {@link ToolLoopProperties}, {@link RunnerProperties}) this holds the
 * declarative workflow definitions: named retry policies, agents, composites
 * and the workflows that use them. Agents and composites share one name
 * space. Everything is read once at startup.
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private RunnerProperties runner = new RunnerProperties();
    private ExportProperties export = new ExportProperties();
    private Map<String, RetryPolicyProperties> retryPolicies = new LinkedHashMap<>();
    private List<AgentProperties> agents = new ArrayList<>();
    private List<CompositeProperties> composites = new ArrayList<>();
    private List<WorkflowProperties> workflows = new ArrayList<>();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /**
         * Adapter to use: {@code langchain4j} or {@code none}.
         */
        private String provider = "langchain4j";
        private String defaultModel = "openai/gpt-4o-mini";
        private Double temperature = 0.7;
        private Duration requestTimeout = Duration.ofSeconds(120);
        private Map<String, ProviderProperties> providers = new LinkedHashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private WebSearchToolProperties webSearch = new WebSearchToolProperties();
    }

    @Data
    public static class WebSearchToolProperties {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl = "https://api.search.brave.com";
        private int defaultCount = 5;
    }

    // ==================== EXECUTION ====================

    @Data
    public static class ToolLoopProperties {
        /**
         * Model calls allowed per agent execution before giving up, unless the
         * agent overrides it.
         */
        private int maxIterations = 10;
    }

    @Data
    public static class RunnerProperties {
        /**
         * State key the run input is stored under.
         */
        private String inputKey = "user_input";
        /**
         * How long a caller waits for a run; unset means no limit.
         */
        private Duration timeout;
    }

    @Data
    public static class ExportProperties {
        private String directory = "reports";
    }

    // ==================== WORKFLOWS ====================

    @Data
    public static class RetryPolicyProperties {
        private int maxAttempts = 5;
        private Duration initialDelay = Duration.ofSeconds(1);
        private double multiplier = 7.0;
        private List<FailureKind> retryOn = new ArrayList<>(List.of(
                FailureKind.RATE_LIMITED,
                FailureKind.SERVER_ERROR,
                FailureKind.SERVICE_UNAVAILABLE,
                FailureKind.GATEWAY_TIMEOUT));
    }

    @Data
    public static class AgentProperties {
        private String name;
        private String description;
        private String instruction;
        private String outputKey;
        private List<String> tools = new ArrayList<>();
        /**
         * Name of an entry in {@code retry-policies}; unset means the defaults.
         */
        private String retryPolicy;
        private String model;
        private Integer maxToolIterations;
    }

    public enum CompositeType {
        SEQUENTIAL, PARALLEL
    }

    @Data
    public static class CompositeProperties {
        private String name;
        private CompositeType type = CompositeType.SEQUENTIAL;
        private List<String> children = new ArrayList<>();
    }

    @Data
    public static class WorkflowProperties {
        private String name;
        private String description;
        private String root;
    }
}

package me.golemcore.orchestrator.domain.model;

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

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Immutable description of an agent: instruction template, optional output
 * key, callable tools and retry policy. Built once during workflow
 * construction and shared read-only by every run.
 */
@Value
@Builder
@ToString(of = { "name", "outputKey", "model" })
public final class AgentDefinition implements WorkflowNode {

    String name;
    String description;
    String instruction;
    String outputKey;
    @Builder.Default
    List<ToolBinding> tools = List.of();
    @Builder.Default
    RetryPolicy retryPolicy = RetryPolicy.defaults();
    String model;
    Integer maxToolIterations;

    public boolean hasOutputKey() {
        return outputKey != null && !outputKey.isBlank();
    }

    public Optional<ToolBinding> findTool(String toolName) {
        if (toolName == null) {
            return Optional.empty();
        }
        return tools.stream()
                .filter(binding -> toolName.equals(binding.getName()))
                .findFirst();
    }
}

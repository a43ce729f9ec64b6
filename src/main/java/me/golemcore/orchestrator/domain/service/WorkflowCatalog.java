package me.golemcore.orchestrator.domain.service;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.exception.UnknownWorkflowException;
import me.golemcore.orchestrator.domain.model.RetryPolicy;
import me.golemcore.orchestrator.domain.workflow.AgentSpec;
import me.golemcore.orchestrator.domain.workflow.Workflow;
import me.golemcore.orchestrator.domain.workflow.WorkflowBuilder;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds every workflow declared under {@code orchestrator.workflows} once at
 * startup and serves them by name. An invalid definition fails startup.
 *
 * <p>
 * Named retry policies are created once here, so every agent referencing the
 * same name shares one policy instance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowCatalog {

    private final OrchestratorProperties properties;
    private final List<ToolComponent> tools;

    private final Map<String, Workflow> workflows = new LinkedHashMap<>();

    @PostConstruct
    public void init() {
        Map<String, RetryPolicy> retryPolicies = buildRetryPolicies();
        for (ToolComponent tool : tools) {
            if (!tool.isEnabled()) {
                log.warn("[Catalog] Tool '{}' is not configured; calls to it will report an error",
                        tool.getToolName());
            }
        }

        for (OrchestratorProperties.WorkflowProperties definition : properties.getWorkflows()) {
            Workflow workflow = buildWorkflow(definition, retryPolicies);
            workflows.put(workflow.getName(), workflow);
            log.info("[Catalog] Registered workflow '{}' (root {}, {} components)", workflow.getName(),
                    workflow.getRoot().getName(), workflow.getComponents().size());
        }
    }

    public Workflow get(String name) {
        Workflow workflow = workflows.get(name);
        if (workflow == null) {
            throw new UnknownWorkflowException(name);
        }
        return workflow;
    }

    public List<Workflow> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(workflows.values()));
    }

    private Workflow buildWorkflow(OrchestratorProperties.WorkflowProperties definition,
            Map<String, RetryPolicy> retryPolicies) {
        WorkflowBuilder builder = WorkflowBuilder.named(definition.getName())
                .description(definition.getDescription());
        tools.forEach(builder::tool);
        retryPolicies.forEach(builder::retryPolicy);

        for (OrchestratorProperties.AgentProperties agent : properties.getAgents()) {
            builder.agent(AgentSpec.builder()
                    .name(agent.getName())
                    .description(agent.getDescription())
                    .instruction(agent.getInstruction())
                    .outputKey(agent.getOutputKey())
                    .tools(new ArrayList<>(agent.getTools()))
                    .retryPolicy(agent.getRetryPolicy())
                    .model(agent.getModel())
                    .maxToolIterations(agent.getMaxToolIterations())
                    .build());
        }
        for (OrchestratorProperties.CompositeProperties composite : properties.getComposites()) {
            if (composite.getType() == OrchestratorProperties.CompositeType.PARALLEL) {
                builder.parallel(composite.getName(), composite.getChildren());
            } else {
                builder.sequential(composite.getName(), composite.getChildren());
            }
        }
        return builder.root(definition.getRoot()).build();
    }

    private Map<String, RetryPolicy> buildRetryPolicies() {
        Map<String, RetryPolicy> policies = new LinkedHashMap<>();
        properties.getRetryPolicies().forEach((name, config) -> policies.put(name, new RetryPolicy(
                config.getMaxAttempts(),
                config.getInitialDelay(),
                config.getMultiplier(),
                config.getRetryOn() != null ? Set.copyOf(config.getRetryOn()) : Set.of())));
        return policies;
    }
}

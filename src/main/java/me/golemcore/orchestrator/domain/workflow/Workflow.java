package me.golemcore.orchestrator.domain.workflow;

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

import me.golemcore.orchestrator.domain.model.AgentDefinition;
import me.golemcore.orchestrator.domain.model.WorkflowNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, immutable workflow: a root node and every component reachable
 * from it. Safe to run any number of times, concurrently.
 */
public final class Workflow {

    private final String name;
    private final String description;
    private final WorkflowNode root;
    private final Map<String, WorkflowNode> components;

    Workflow(String name, String description, WorkflowNode root, Map<String, WorkflowNode> components) {
        this.name = name;
        this.description = description;
        this.root = root;
        this.components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public WorkflowNode getRoot() {
        return root;
    }

    public Map<String, WorkflowNode> getComponents() {
        return components;
    }

    public Optional<AgentDefinition> findAgent(String agentName) {
        WorkflowNode node = components.get(agentName);
        return node instanceof AgentDefinition agent ? Optional.of(agent) : Optional.empty();
    }

    @Override
    public String toString() {
        return "Workflow[" + name + ", root=" + root.getName() + "]";
    }
}

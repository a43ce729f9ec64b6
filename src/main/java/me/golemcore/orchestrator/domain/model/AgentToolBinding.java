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

import java.util.Objects;

/**
 * Exposes another agent as a callable tool. The model passes one string
 * argument, {@value #REQUEST_PARAMETER}, which becomes the wrapped agent's
 * user message.
 */
public record AgentToolBinding(AgentDefinition agent) implements ToolBinding {

    public static final String REQUEST_PARAMETER = "request";

    public AgentToolBinding {
        Objects.requireNonNull(agent, "agent");
    }

    @Override
    public ToolDefinition getDefinition() {
        String description = agent.getDescription() != null && !agent.getDescription().isBlank()
                ? agent.getDescription()
                : "Delegate a task to the " + agent.getName() + " agent";
        return ToolDefinition.singleString(agent.getName(), description, REQUEST_PARAMETER,
                "The task or question for the " + agent.getName() + " agent");
    }
}

package me.golemcore.orchestrator.domain.system.toolloop;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.WorkflowException;
import me.golemcore.orchestrator.domain.model.AgentDefinition;
import me.golemcore.orchestrator.domain.model.AgentToolBinding;
import me.golemcore.orchestrator.domain.model.ExecutionScope;
import me.golemcore.orchestrator.domain.model.ExternalToolBinding;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ToolBinding;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.service.RetryExecutor;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves a tool call against the agent's declared tools and runs it.
 *
 * <p>
 * External tools run under the agent's retry policy; agents exposed as tools
 * run through {@link AgentToolAdapter}. A name the agent does not declare gets
 * a synthetic failure result so the model can correct itself.
 */
@RequiredArgsConstructor
@Slf4j
public class DefaultToolExecutor implements ToolExecutorPort {

    private final RetryExecutor retryExecutor;
    private final AgentToolAdapter agentToolAdapter;

    @Override
    public ToolExecutionOutcome execute(AgentDefinition agent, Message.ToolCall toolCall, ExecutionScope scope) {
        Optional<ToolBinding> binding = agent.findTool(toolCall.getName());
        if (binding.isEmpty()) {
            log.warn("[ToolLoop] {} requested undeclared tool '{}'", agent.getName(), toolCall.getName());
            return ToolExecutionOutcome.synthetic(toolCall, "Unknown tool: " + toolCall.getName());
        }

        Map<String, Object> arguments = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        ToolBinding toolBinding = binding.get();
        if (toolBinding instanceof ExternalToolBinding external) {
            return ToolExecutionOutcome.of(toolCall, executeExternal(agent, external, arguments));
        }
        AgentToolBinding agentTool = (AgentToolBinding) toolBinding;
        return ToolExecutionOutcome.of(toolCall, agentToolAdapter.invoke(agentTool, arguments, scope));
    }

    private ToolResult executeExternal(AgentDefinition agent, ExternalToolBinding binding,
            Map<String, Object> arguments) {
        String toolName = binding.getName();
        try {
            ToolResult result = retryExecutor.invoke("tool " + toolName,
                    () -> binding.tool().execute(arguments).join(), agent.getRetryPolicy());
            if (result == null) {
                return ToolResult.failure("Tool returned no result");
            }
            log.debug("[ToolLoop] {} -> {} success={}", agent.getName(), toolName, result.isSuccess());
            return result;
        } catch (WorkflowException e) {
            throw e.enterComponent(toolName);
        }
    }
}

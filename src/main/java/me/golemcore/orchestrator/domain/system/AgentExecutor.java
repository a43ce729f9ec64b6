package me.golemcore.orchestrator.domain.system;

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
import me.golemcore.orchestrator.domain.model.ExecutionScope;
import me.golemcore.orchestrator.domain.service.InstructionTemplateRenderer;
import me.golemcore.orchestrator.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.orchestrator.domain.system.toolloop.ToolLoopTurnResult;
import org.springframework.stereotype.Component;

/**
 * Executes a single agent: renders its instruction against session state, runs
 * the tool loop, and writes the final answer under the agent's output key.
 *
 * <p>
 * Lifecycle: Pending, Rendering, Invoking/ToolLoop, then Completed or Failed.
 * Rendering fails before any model call when the instruction references an
 * absent key. Failures propagate with the agent name added to their component
 * path; on failure nothing is written to state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentExecutor {

    private final InstructionTemplateRenderer templateRenderer;
    private final ToolLoopSystem toolLoopSystem;

    public String execute(AgentDefinition agent, ExecutionScope scope, String input) {
        String agentName = agent.getName();
        try {
            log.debug("[Agent] {} Rendering", agentName);
            String instruction = templateRenderer.render(agent.getInstruction(), scope.state());

            log.debug("[Agent] {} Invoking ({} tools)", agentName, agent.getTools().size());
            ToolLoopTurnResult turn = toolLoopSystem.runLoop(agent, scope, instruction, input);

            String result = turn.finalAnswer();
            if (agent.hasOutputKey()) {
                scope.state().set(agent.getOutputKey(), result);
            }
            log.info("[Agent] {} Completed: {} model calls, {} tool calls, {} chars{}",
                    agentName, turn.llmCalls(), turn.toolExecutions(), result.length(),
                    agent.hasOutputKey() ? " -> " + agent.getOutputKey() : "");
            return result;
        } catch (WorkflowException e) {
            log.debug("[Agent] {} Failed: {}", agentName, e.getDetail());
            throw e.enterComponent(agentName);
        }
    }
}

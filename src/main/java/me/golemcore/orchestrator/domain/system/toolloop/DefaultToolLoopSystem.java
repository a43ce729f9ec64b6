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

import me.golemcore.orchestrator.domain.exception.InvocationFailedException;
import me.golemcore.orchestrator.domain.exception.ToolLoopExceededException;
import me.golemcore.orchestrator.domain.model.AgentDefinition;
import me.golemcore.orchestrator.domain.model.ExecutionScope;
import me.golemcore.orchestrator.domain.model.FailureKind;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ModelReply;
import me.golemcore.orchestrator.domain.model.ToolBinding;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.service.RetryExecutor;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tool loop of one agent execution.
 *
 * <p>
 * Contract: 1) the model returns tool calls, 2) every call is dispatched in
 * order and its result appended to the conversation, 3) the model is asked
 * again, until it returns a final answer. Each model call runs under the
 * agent's retry policy. Exceeding the agent's iteration bound is a failure.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final RetryExecutor retryExecutor;
    private final OrchestratorProperties.ToolLoopProperties settings;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, RetryExecutor retryExecutor,
            OrchestratorProperties.ToolLoopProperties settings) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.retryExecutor = retryExecutor;
        this.settings = settings;
    }

    @Override
    public ToolLoopTurnResult runLoop(AgentDefinition agent, ExecutionScope scope, String systemPrompt,
            String input) {
        int maxIterations = resolveMaxIterations(agent);
        List<ToolDefinition> tools = agent.getTools().stream()
                .map(ToolBinding::getDefinition)
                .toList();

        List<Message> messages = new ArrayList<>();
        messages.add(Message.user(input != null ? input : ""));

        int llmCalls = 0;
        int toolExecutions = 0;

        while (llmCalls < maxIterations) {
            // 1) Model call
            LlmRequest request = LlmRequest.builder()
                    .model(agent.getModel())
                    .systemPrompt(systemPrompt)
                    .messages(List.copyOf(messages))
                    .tools(tools)
                    .sessionId(scope.sessionId())
                    .agentName(agent.getName())
                    .build();
            LlmResponse response = retryExecutor.invoke("model call", () -> llmPort.chat(request).join(),
                    agent.getRetryPolicy());
            llmCalls++;

            ModelReply reply = response != null ? response.getReply() : null;
            if (reply == null) {
                throw new InvocationFailedException(FailureKind.OTHER, "Model returned no reply");
            }

            // 2) Final answer
            if (reply instanceof ModelReply.FinalAnswer answer) {
                log.debug("[ToolLoop] {} final answer after {} model calls, {} tool executions",
                        agent.getName(), llmCalls, toolExecutions);
                return new ToolLoopTurnResult(answer.text(), llmCalls, toolExecutions, messages);
            }

            // 3) No model call left to read the results: stop before running any tool
            if (llmCalls >= maxIterations) {
                break;
            }

            // 4) Assistant tool calls, then one result per call
            List<Message.ToolCall> calls = withIds(((ModelReply.ToolCalls) reply).calls(), llmCalls);
            messages.add(Message.assistantToolCalls(calls));
            for (Message.ToolCall call : calls) {
                log.debug("[ToolLoop] {} calling tool {}", agent.getName(), call.getName());
                ToolExecutionOutcome outcome = toolExecutor.execute(agent, call, scope);
                toolExecutions++;
                messages.add(Message.toolResult(outcome.toolCallId(), outcome.toolName(),
                        outcome.messageContent()));
            }
        }

        log.warn("[ToolLoop] {} reached {} model calls without a final answer", agent.getName(), maxIterations);
        throw new ToolLoopExceededException(maxIterations);
    }

    private int resolveMaxIterations(AgentDefinition agent) {
        if (agent.getMaxToolIterations() != null && agent.getMaxToolIterations() > 0) {
            return agent.getMaxToolIterations();
        }
        return settings != null ? settings.getMaxIterations() : 10;
    }

    private static List<Message.ToolCall> withIds(List<Message.ToolCall> calls, int iteration) {
        List<Message.ToolCall> result = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            Message.ToolCall call = calls.get(i);
            if (call.getId() == null || call.getId().isBlank()) {
                call = Message.ToolCall.builder()
                        .id("call_" + iteration + "_" + i)
                        .name(call.getName())
                        .arguments(call.getArguments())
                        .build();
            }
            result.add(call);
        }
        return result;
    }
}

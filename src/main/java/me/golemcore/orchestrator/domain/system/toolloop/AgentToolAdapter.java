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
import me.golemcore.orchestrator.domain.model.AgentToolBinding;
import me.golemcore.orchestrator.domain.model.ExecutionScope;
import me.golemcore.orchestrator.domain.model.ToolResult;

import java.util.Map;

/**
 * Executes an agent exposed as a tool. The wrapped agent runs synchronously in
 * the caller's scope, so its output key is visible to later components, and
 * its result text becomes the tool result.
 *
 * <p>
 * The call is not retried as a whole: the wrapped agent's own model and tool
 * calls run under its retry policy.
 */
@RequiredArgsConstructor
@Slf4j
public class AgentToolAdapter {

    private final AgentInvoker agentInvoker;

    public ToolResult invoke(AgentToolBinding binding, Map<String, Object> arguments, ExecutionScope scope) {
        Object request = arguments != null ? arguments.get(AgentToolBinding.REQUEST_PARAMETER) : null;
        if (request == null || String.valueOf(request).isBlank()) {
            return ToolResult.failure("Missing required argument '" + AgentToolBinding.REQUEST_PARAMETER + "'");
        }

        String agentName = binding.agent().getName();
        log.debug("[AgentTool] Delegating to {}", agentName);
        String result = agentInvoker.invoke(binding.agent(), scope, String.valueOf(request));
        return ToolResult.success(result);
    }
}

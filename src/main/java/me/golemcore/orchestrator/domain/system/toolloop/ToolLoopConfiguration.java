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

import me.golemcore.orchestrator.domain.service.RetryExecutor;
import me.golemcore.orchestrator.domain.system.AgentExecutor;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wiring of the tool loop. Agents exposed as tools call back into the
 * {@link AgentExecutor}, which itself depends on the loop, so the adapter
 * resolves the executor lazily.
 */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public AgentToolAdapter agentToolAdapter(ObjectProvider<AgentExecutor> agentExecutor) {
        return new AgentToolAdapter((agent, scope, input) -> agentExecutor.getObject().execute(agent, scope, input));
    }

    @Bean
    public ToolExecutorPort toolExecutorPort(RetryExecutor retryExecutor, AgentToolAdapter agentToolAdapter) {
        return new DefaultToolExecutor(retryExecutor, agentToolAdapter);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            RetryExecutor retryExecutor, OrchestratorProperties properties) {
        return new DefaultToolLoopSystem(llmPort, toolExecutorPort, retryExecutor, properties.getToolLoop());
    }
}

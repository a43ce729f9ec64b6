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

import me.golemcore.orchestrator.domain.model.AgentDefinition;
import me.golemcore.orchestrator.domain.model.ExecutionScope;

/**
 * Bounded model/tool conversation of a single agent execution.
 */
public interface ToolLoopSystem {

    /**
     * Runs the loop until the model gives a final answer.
     *
     * @param agent
     *            the executing agent
     * @param scope
     *            session scope tools run in
     * @param systemPrompt
     *            the rendered instruction
     * @param input
     *            the user message
     * @throws me.golemcore.orchestrator.domain.exception.ToolLoopExceededException
     *             if the iteration bound is reached first
     */
    ToolLoopTurnResult runLoop(AgentDefinition agent, ExecutionScope scope, String systemPrompt, String input);
}

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

import me.golemcore.orchestrator.domain.model.Message;

import java.util.List;

/**
 * Result of one tool loop: the final answer, how many model calls and tool
 * executions it took, and the conversation that led there.
 */
public record ToolLoopTurnResult(String finalAnswer, int llmCalls, int toolExecutions, List<Message> transcript) {

    public ToolLoopTurnResult {
        transcript = List.copyOf(transcript);
    }
}

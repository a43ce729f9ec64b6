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
import me.golemcore.orchestrator.domain.model.ToolResult;

/**
 * Outcome of a single tool call as fed back to the model. {@code synthetic}
 * marks results produced without executing anything (e.g. an undeclared tool
 * name).
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult, String messageContent,
        boolean synthetic) {

    public static ToolExecutionOutcome of(Message.ToolCall toolCall, ToolResult result) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, result.toMessageContent(),
                false);
    }

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, String reason) {
        ToolResult result = ToolResult.failure(reason);
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, result.toMessageContent(),
                true);
    }
}

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

import java.util.List;
import java.util.Objects;

/**
 * What the model answered: either a final text or a non-empty list of tool
 * calls to dispatch before asking again.
 */
public sealed interface ModelReply permits ModelReply.FinalAnswer, ModelReply.ToolCalls {

    static ModelReply finalAnswer(String text) {
        return new FinalAnswer(text);
    }

    static ModelReply toolCalls(List<Message.ToolCall> calls) {
        return new ToolCalls(calls);
    }

    record FinalAnswer(String text) implements ModelReply {
        public FinalAnswer {
            text = text != null ? text : "";
        }
    }

    record ToolCalls(List<Message.ToolCall> calls) implements ModelReply {
        public ToolCalls {
            Objects.requireNonNull(calls, "calls");
            if (calls.isEmpty()) {
                throw new IllegalArgumentException("ToolCalls reply requires at least one call");
            }
            calls = List.copyOf(calls);
        }
    }
}

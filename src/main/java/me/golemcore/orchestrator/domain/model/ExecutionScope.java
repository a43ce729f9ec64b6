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

import me.golemcore.orchestrator.domain.state.SharedState;

import java.util.Objects;

/**
 * Where a node runs: the session it belongs to, the session's original input
 * and the store it reads and writes.
 */
public record ExecutionScope(String sessionId, String userInput, SharedState state) {

    public ExecutionScope {
        Objects.requireNonNull(state, "state");
    }

    public ExecutionScope withState(SharedState branchState) {
        return new ExecutionScope(sessionId, userInput, branchState);
    }
}

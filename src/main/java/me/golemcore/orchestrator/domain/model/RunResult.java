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

import lombok.Builder;
import lombok.Value;
import me.golemcore.orchestrator.domain.state.StateView;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a completed run: the root node's output and a read-only view of
 * the final session state.
 */
@Value
@Builder
public class RunResult {

    String sessionId;
    String workflowName;
    String input;
    String output;
    NodeResult rootResult;
    StateView finalState;
    Instant startedAt;
    Instant completedAt;

    public Duration getDuration() {
        return Duration.between(startedAt, completedAt);
    }
}

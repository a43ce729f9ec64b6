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

import lombok.Value;

import java.util.List;

/**
 * Runs its children concurrently against a snapshot of the state taken at
 * fan-out and merges their writes once every child has succeeded.
 */
@Value
public final class ParallelNode implements WorkflowNode {

    String name;
    List<WorkflowNode> children;

    public ParallelNode(String name, List<WorkflowNode> children) {
        this.name = name;
        this.children = List.copyOf(children);
    }
}

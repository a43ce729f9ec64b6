package me.golemcore.orchestrator.domain.workflow;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative agent description used while assembling a workflow. Tools and
 * the retry policy are referenced by name and resolved by
 * {@link WorkflowBuilder#build()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSpec {

    private String name;
    private String description;
    private String instruction;
    private String outputKey;
    @Builder.Default
    private List<String> tools = new ArrayList<>();
    private String retryPolicy;
    private String model;
    private Integer maxToolIterations;
}

package me.golemcore.orchestrator.domain.service;

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
import me.golemcore.orchestrator.domain.model.RunResult;
import me.golemcore.orchestrator.domain.workflow.Workflow;
import me.golemcore.orchestrator.domain.workflow.WorkflowRunner;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.inbound.WorkflowRunPort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs catalogued workflows by name, applying the configured run timeout.
 */
@Service
@RequiredArgsConstructor
public class WorkflowRunService implements WorkflowRunPort {

    private final WorkflowCatalog catalog;
    private final WorkflowRunner runner;
    private final OrchestratorProperties properties;

    @Override
    public List<WorkflowSummary> listWorkflows() {
        return catalog.getAll().stream()
                .map(workflow -> new WorkflowSummary(workflow.getName(), workflow.getDescription()))
                .toList();
    }

    @Override
    public RunResult run(String workflowName, String input) {
        Workflow workflow = catalog.get(workflowName);
        return runner.run(workflow, input, properties.getRunner().getTimeout());
    }
}

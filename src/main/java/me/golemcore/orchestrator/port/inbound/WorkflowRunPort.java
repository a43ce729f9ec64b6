package me.golemcore.orchestrator.port.inbound;

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

import me.golemcore.orchestrator.domain.model.RunResult;

import java.util.List;

/**
 * Inbound use case: start a named workflow with a user request.
 */
public interface WorkflowRunPort {

    List<WorkflowSummary> listWorkflows();

    /**
     * Runs the workflow to completion (or until the configured timeout).
     *
     * @throws me.golemcore.orchestrator.domain.exception.UnknownWorkflowException
     *             if no workflow has that name
     */
    RunResult run(String workflowName, String input);

    /**
     * Name and description of a registered workflow.
     */
    record WorkflowSummary(String name, String description) {
    }
}

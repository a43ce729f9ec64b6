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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.InvocationFailedException;
import me.golemcore.orchestrator.domain.exception.WorkflowException;
import me.golemcore.orchestrator.domain.exception.WorkflowTimeoutException;
import me.golemcore.orchestrator.domain.model.ExecutionScope;
import me.golemcore.orchestrator.domain.model.FailureKind;
import me.golemcore.orchestrator.domain.model.NodeResult;
import me.golemcore.orchestrator.domain.model.RunResult;
import me.golemcore.orchestrator.domain.state.SessionStateStore;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorConfiguration;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for running a workflow once: creates a fresh session with its
 * own state store, seeds the input, executes the root and returns the result
 * together with a read-only view of the final state.
 *
 * <p>
 * With a timeout the caller stops waiting after the deadline
 * ({@link WorkflowTimeoutException}); the work already started keeps running
 * to completion in the background.
 */
@Component
@Slf4j
public class WorkflowRunner {

    private final WorkflowExecutor workflowExecutor;
    private final OrchestratorProperties properties;
    private final ExecutorService runExecutor;
    private final Clock clock;

    public WorkflowRunner(WorkflowExecutor workflowExecutor, OrchestratorProperties properties,
            @Qualifier(OrchestratorConfiguration.BRANCH_EXECUTOR) ExecutorService runExecutor, Clock clock) {
        this.workflowExecutor = workflowExecutor;
        this.properties = properties;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    public RunResult run(Workflow workflow, String input) {
        return run(workflow, input, null);
    }

    public RunResult run(Workflow workflow, String input, Duration timeout) {
        String sessionId = UUID.randomUUID().toString();
        String userInput = input != null ? input : "";
        SessionStateStore state = new SessionStateStore(sessionId);
        state.set(properties.getRunner().getInputKey(), userInput);
        ExecutionScope scope = new ExecutionScope(sessionId, userInput, state);

        Instant startedAt = clock.instant();
        log.info("[Runner] {} session {} started", workflow.getName(), sessionId);

        NodeResult rootResult;
        try {
            rootResult = timeout != null
                    ? executeWithDeadline(workflow, scope, timeout)
                    : workflowExecutor.execute(workflow.getRoot(), scope);
        } catch (WorkflowException e) {
            e.enterComponent(workflow.getName());
            log.error("[Runner] {} session {} failed: {}", workflow.getName(), sessionId, e.getMessage());
            throw e;
        }

        Instant completedAt = clock.instant();
        log.info("[Runner] {} session {} completed in {}ms", workflow.getName(), sessionId,
                Duration.between(startedAt, completedAt).toMillis());

        return RunResult.builder()
                .sessionId(sessionId)
                .workflowName(workflow.getName())
                .input(userInput)
                .output(rootResult.output())
                .rootResult(rootResult)
                .finalState(state.snapshot())
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }

    private NodeResult executeWithDeadline(Workflow workflow, ExecutionScope scope, Duration timeout) {
        Future<NodeResult> future = runExecutor.submit(() -> workflowExecutor.execute(workflow.getRoot(), scope));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new WorkflowTimeoutException(timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new InvocationFailedException(FailureKind.OTHER, "Run failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvocationFailedException(FailureKind.OTHER, "Interrupted while waiting for run", e);
        }
    }
}

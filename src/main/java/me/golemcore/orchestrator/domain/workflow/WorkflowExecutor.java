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
import me.golemcore.orchestrator.domain.exception.AggregateFailureException;
import me.golemcore.orchestrator.domain.exception.InvocationFailedException;
import me.golemcore.orchestrator.domain.exception.WorkflowException;
import me.golemcore.orchestrator.domain.model.AgentDefinition;
import me.golemcore.orchestrator.domain.model.ExecutionScope;
import me.golemcore.orchestrator.domain.model.FailureKind;
import me.golemcore.orchestrator.domain.model.NodeResult;
import me.golemcore.orchestrator.domain.model.ParallelNode;
import me.golemcore.orchestrator.domain.model.SequentialNode;
import me.golemcore.orchestrator.domain.model.WorkflowNode;
import me.golemcore.orchestrator.domain.state.BranchStateStore;
import me.golemcore.orchestrator.domain.state.StateDelta;
import me.golemcore.orchestrator.domain.state.StateView;
import me.golemcore.orchestrator.domain.system.AgentExecutor;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorConfiguration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Executes workflow nodes.
 *
 * <p>
 * Sequential composites run their children in order in the calling thread
 * against the caller's store; the first failure aborts the rest. Parallel
 * composites snapshot the store, run every child on the branch executor
 * against its own {@link BranchStateStore}, and wait for all of them. Branch
 * writes are merged in declared child order only when every child
 * succeeded; otherwise an {@link AggregateFailureException} lists each failed
 * child and nothing is merged. Siblings are never cancelled.
 */
@Component
@Slf4j
public class WorkflowExecutor {

    private static final String OUTPUT_SEPARATOR = "\n\n";

    private final AgentExecutor agentExecutor;
    private final ExecutorService branchExecutor;

    public WorkflowExecutor(AgentExecutor agentExecutor,
            @Qualifier(OrchestratorConfiguration.BRANCH_EXECUTOR) ExecutorService branchExecutor) {
        this.agentExecutor = agentExecutor;
        this.branchExecutor = branchExecutor;
    }

    public NodeResult execute(WorkflowNode node, ExecutionScope scope) {
        if (node instanceof AgentDefinition agent) {
            String output = agentExecutor.execute(agent, scope, scope.userInput());
            return NodeResult.of(agent.getName(), output);
        }
        if (node instanceof SequentialNode sequential) {
            return executeSequential(sequential, scope);
        }
        if (node instanceof ParallelNode parallel) {
            return executeParallel(parallel, scope);
        }
        throw new IllegalArgumentException("Unsupported workflow node: " + node);
    }

    private NodeResult executeSequential(SequentialNode sequential, ExecutionScope scope) {
        log.debug("[Sequential] {} starting {} children", sequential.getName(), sequential.getChildren().size());
        NodeResult last = null;
        try {
            for (WorkflowNode child : sequential.getChildren()) {
                last = execute(child, scope);
            }
        } catch (WorkflowException e) {
            throw e.enterComponent(sequential.getName());
        }
        return NodeResult.of(sequential.getName(), last != null ? last.output() : "");
    }

    private NodeResult executeParallel(ParallelNode parallel, ExecutionScope scope) {
        List<WorkflowNode> children = parallel.getChildren();
        StateView snapshot = scope.state().snapshot();
        log.debug("[Parallel] {} fanning out {} branches", parallel.getName(), children.size());

        List<BranchStateStore> branchStores = new ArrayList<>(children.size());
        List<Future<NodeResult>> futures = new ArrayList<>(children.size());
        for (WorkflowNode child : children) {
            BranchStateStore branchStore = new BranchStateStore(child.getName(), snapshot);
            ExecutionScope branchScope = scope.withState(branchStore);
            branchStores.add(branchStore);
            futures.add(branchExecutor.submit(() -> execute(child, branchScope)));
        }

        Map<String, String> outputs = new LinkedHashMap<>();
        List<AggregateFailureException.ChildFailure> failures = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            String childName = children.get(i).getName();
            try {
                outputs.put(childName, futures.get(i).get().output());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("[Parallel] {} branch {} failed: {}", parallel.getName(), childName, cause.getMessage());
                failures.add(new AggregateFailureException.ChildFailure(childName, cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InvocationFailedException(FailureKind.OTHER,
                        "Interrupted while waiting for parallel branches", e)
                        .enterComponent(parallel.getName());
            }
        }

        if (!failures.isEmpty()) {
            throw new AggregateFailureException(failures, children.size()).enterComponent(parallel.getName());
        }

        List<StateDelta> deltas = branchStores.stream()
                .map(BranchStateStore::delta)
                .toList();
        List<String> collisions = scope.state().merge(deltas);
        log.debug("[Parallel] {} merged {} branches{}", parallel.getName(), children.size(),
                collisions.isEmpty() ? "" : ", colliding keys " + collisions);

        return new NodeResult(parallel.getName(), String.join(OUTPUT_SEPARATOR, outputs.values()), outputs);
    }
}

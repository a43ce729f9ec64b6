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
import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.exception.ConfigurationException;
import me.golemcore.orchestrator.domain.model.AgentDefinition;
import me.golemcore.orchestrator.domain.model.AgentToolBinding;
import me.golemcore.orchestrator.domain.model.ExternalToolBinding;
import me.golemcore.orchestrator.domain.model.ParallelNode;
import me.golemcore.orchestrator.domain.model.RetryPolicy;
import me.golemcore.orchestrator.domain.model.SequentialNode;
import me.golemcore.orchestrator.domain.model.ToolBinding;
import me.golemcore.orchestrator.domain.model.WorkflowNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Assembles a {@link Workflow} from components referenced by name.
 *
 * <p>
 * Agents and composites share one name space. {@link #build()} validates the
 * whole registration before anything runs: duplicate names, unknown
 * references, names that are both a tool and an agent, empty composites,
 * cycles through agent-as-tool references or composite containment. Parallel
 * siblings writing the same output key only produce a warning; the later
 * sibling's value wins at merge time.
 *
 * <pre>{@code
 * Workflow workflow = WorkflowBuilder.named("blog-pipeline")
 *         .agent(outline).agent(writer).agent(editor)
 *         .sequential("BlogPipeline", "OutlineAgent", "WriterAgent", "EditorAgent")
 *         .root("BlogPipeline")
 *         .build();
 * }</pre>
 */
@Slf4j
public class WorkflowBuilder {

    private final String workflowName;
    private String description;
    private String rootName;

    private final Map<String, AgentSpec> agents = new LinkedHashMap<>();
    private final Map<String, CompositeSpec> composites = new LinkedHashMap<>();
    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();
    private final Map<String, RetryPolicy> retryPolicies = new LinkedHashMap<>();
    private final Set<String> duplicateNames = new LinkedHashSet<>();

    private WorkflowBuilder(String workflowName) {
        this.workflowName = workflowName;
    }

    public static WorkflowBuilder named(String workflowName) {
        if (workflowName == null || workflowName.isBlank()) {
            throw new ConfigurationException("Workflow name must not be blank");
        }
        return new WorkflowBuilder(workflowName);
    }

    public WorkflowBuilder description(String description) {
        this.description = description;
        return this;
    }

    public WorkflowBuilder tool(ToolComponent tool) {
        Objects.requireNonNull(tool, "tool");
        if (tools.putIfAbsent(tool.getToolName(), tool) != null) {
            duplicateNames.add(tool.getToolName());
        }
        return this;
    }

    public WorkflowBuilder retryPolicy(String name, RetryPolicy policy) {
        retryPolicies.put(name, Objects.requireNonNull(policy, "policy"));
        return this;
    }

    public WorkflowBuilder agent(AgentSpec spec) {
        Objects.requireNonNull(spec, "spec");
        String name = requireName(spec.getName(), "Agent");
        if (spec.getTools() == null) {
            spec.setTools(new ArrayList<>());
        }
        if (isRegistered(name)) {
            duplicateNames.add(name);
        } else {
            agents.put(name, spec);
        }
        return this;
    }

    public WorkflowBuilder sequential(String name, String... children) {
        return sequential(name, Arrays.asList(children));
    }

    public WorkflowBuilder sequential(String name, List<String> children) {
        return composite(new CompositeSpec(requireName(name, "Composite"), false, List.copyOf(children)));
    }

    public WorkflowBuilder parallel(String name, String... children) {
        return parallel(name, Arrays.asList(children));
    }

    public WorkflowBuilder parallel(String name, List<String> children) {
        return composite(new CompositeSpec(requireName(name, "Composite"), true, List.copyOf(children)));
    }

    public WorkflowBuilder root(String name) {
        this.rootName = name;
        return this;
    }

    /**
     * Validates every registered component and resolves the root.
     *
     * @throws ConfigurationException
     *             on the first invalid definition found
     */
    public Workflow build() {
        if (!duplicateNames.isEmpty()) {
            throw error("Duplicate component name(s): " + duplicateNames);
        }
        if (rootName == null || rootName.isBlank()) {
            throw error("No root component set");
        }
        if (!isRegistered(rootName)) {
            throw error("Root '" + rootName + "' is not a registered agent or composite");
        }

        agents.values().forEach(this::validateAgent);
        composites.values().forEach(this::validateComposite);
        detectCycles();

        Map<String, WorkflowNode> resolved = new LinkedHashMap<>();
        WorkflowNode root = resolve(rootName, resolved);
        warnOnParallelOutputKeyCollisions(resolved);

        log.debug("[Workflow] {} built: root={}, {} components", workflowName, rootName, resolved.size());
        return new Workflow(workflowName, description, root, resolved);
    }

    // ==================== validation ====================

    private void validateAgent(AgentSpec spec) {
        for (String toolName : spec.getTools()) {
            boolean isExternal = tools.containsKey(toolName);
            boolean isAgent = agents.containsKey(toolName);
            if (isExternal && isAgent) {
                throw error("Tool name '" + toolName + "' used by agent '" + spec.getName()
                        + "' is both an external tool and an agent");
            }
            if (composites.containsKey(toolName)) {
                throw error("Agent '" + spec.getName() + "' references composite '" + toolName
                        + "' as a tool; only agents and external tools can be called");
            }
            if (!isExternal && !isAgent) {
                throw error("Agent '" + spec.getName() + "' references unknown tool '" + toolName + "'");
            }
        }
        if (new HashSet<>(spec.getTools()).size() != spec.getTools().size()) {
            throw error("Agent '" + spec.getName() + "' declares the same tool more than once");
        }
        if (spec.getRetryPolicy() != null && !retryPolicies.containsKey(spec.getRetryPolicy())) {
            throw error("Agent '" + spec.getName() + "' references unknown retry policy '"
                    + spec.getRetryPolicy() + "'");
        }
        if (spec.getMaxToolIterations() != null && spec.getMaxToolIterations() < 1) {
            throw error("Agent '" + spec.getName() + "' must allow at least one model call");
        }
    }

    private void validateComposite(CompositeSpec composite) {
        if (composite.children().isEmpty()) {
            throw error("Composite '" + composite.name() + "' has no children");
        }
        for (String child : composite.children()) {
            if (!isRegistered(child)) {
                throw error("Composite '" + composite.name() + "' references unknown component '" + child + "'");
            }
        }
        if (composite.parallel() && new HashSet<>(composite.children()).size() != composite.children().size()) {
            throw error("Parallel composite '" + composite.name() + "' lists the same child more than once");
        }
    }

    private void detectCycles() {
        Map<String, VisitState> states = new HashMap<>();
        for (String name : allComponentNames()) {
            visit(name, states, new ArrayList<>());
        }
    }

    private void visit(String name, Map<String, VisitState> states, List<String> path) {
        VisitState state = states.get(name);
        if (state == VisitState.DONE) {
            return;
        }
        if (state == VisitState.IN_PROGRESS) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(name), path.size()));
            cycle.add(name);
            throw error("Cycle detected: " + String.join(" -> ", cycle));
        }

        states.put(name, VisitState.IN_PROGRESS);
        path.add(name);
        for (String next : references(name)) {
            visit(next, states, path);
        }
        path.remove(path.size() - 1);
        states.put(name, VisitState.DONE);
    }

    private List<String> references(String name) {
        AgentSpec agent = agents.get(name);
        if (agent != null) {
            return agent.getTools().stream()
                    .filter(agents::containsKey)
                    .toList();
        }
        CompositeSpec composite = composites.get(name);
        return composite != null ? composite.children() : List.of();
    }

    private void warnOnParallelOutputKeyCollisions(Map<String, WorkflowNode> resolved) {
        for (WorkflowNode node : resolved.values()) {
            if (!(node instanceof ParallelNode parallel)) {
                continue;
            }
            Map<String, String> writers = new HashMap<>();
            for (WorkflowNode child : parallel.getChildren()) {
                for (String key : outputKeysOf(child, new HashSet<>())) {
                    String previous = writers.putIfAbsent(key, child.getName());
                    if (previous != null) {
                        log.warn("[Workflow] {}: parallel branches '{}' and '{}' of '{}' both write '{}'; "
                                + "the later branch wins", workflowName, previous, child.getName(),
                                parallel.getName(), key);
                    }
                }
            }
        }
    }

    private static Set<String> outputKeysOf(WorkflowNode node, Set<String> seen) {
        Set<String> keys = new LinkedHashSet<>();
        if (!seen.add(node.getName())) {
            return keys;
        }
        if (node instanceof AgentDefinition agent) {
            if (agent.hasOutputKey()) {
                keys.add(agent.getOutputKey());
            }
            for (ToolBinding tool : agent.getTools()) {
                if (tool instanceof AgentToolBinding agentTool) {
                    keys.addAll(outputKeysOf(agentTool.agent(), seen));
                }
            }
        } else if (node instanceof SequentialNode sequential) {
            sequential.getChildren().forEach(child -> keys.addAll(outputKeysOf(child, seen)));
        } else if (node instanceof ParallelNode parallel) {
            parallel.getChildren().forEach(child -> keys.addAll(outputKeysOf(child, seen)));
        }
        return keys;
    }

    // ==================== resolution ====================

    private WorkflowNode resolve(String name, Map<String, WorkflowNode> resolved) {
        WorkflowNode existing = resolved.get(name);
        if (existing != null) {
            return existing;
        }

        WorkflowNode node;
        AgentSpec agent = agents.get(name);
        if (agent != null) {
            node = resolveAgent(agent, resolved);
        } else {
            CompositeSpec composite = composites.get(name);
            List<WorkflowNode> children = composite.children().stream()
                    .map(child -> resolve(child, resolved))
                    .toList();
            node = composite.parallel()
                    ? new ParallelNode(composite.name(), children)
                    : new SequentialNode(composite.name(), children);
        }
        resolved.put(name, node);
        return node;
    }

    private AgentDefinition resolveAgent(AgentSpec spec, Map<String, WorkflowNode> resolved) {
        List<ToolBinding> bindings = new ArrayList<>();
        for (String toolName : spec.getTools()) {
            ToolComponent external = tools.get(toolName);
            if (external != null) {
                bindings.add(new ExternalToolBinding(external));
            } else {
                bindings.add(new AgentToolBinding((AgentDefinition) resolve(toolName, resolved)));
            }
        }

        RetryPolicy policy = spec.getRetryPolicy() != null
                ? retryPolicies.get(spec.getRetryPolicy())
                : RetryPolicy.defaults();

        return AgentDefinition.builder()
                .name(spec.getName())
                .description(spec.getDescription())
                .instruction(spec.getInstruction())
                .outputKey(spec.getOutputKey())
                .tools(List.copyOf(bindings))
                .retryPolicy(policy)
                .model(spec.getModel())
                .maxToolIterations(spec.getMaxToolIterations())
                .build();
    }

    // ==================== helpers ====================

    private WorkflowBuilder composite(CompositeSpec spec) {
        if (isRegistered(spec.name())) {
            duplicateNames.add(spec.name());
        } else {
            composites.put(spec.name(), spec);
        }
        return this;
    }

    private boolean isRegistered(String name) {
        return agents.containsKey(name) || composites.containsKey(name);
    }

    private Set<String> allComponentNames() {
        Set<String> names = new LinkedHashSet<>(agents.keySet());
        names.addAll(composites.keySet());
        return names;
    }

    private String requireName(String name, String kind) {
        if (name == null || name.isBlank()) {
            throw error(kind + " name must not be blank");
        }
        return name;
    }

    private ConfigurationException error(String message) {
        return new ConfigurationException("Workflow '" + workflowName + "': " + message);
    }

    private enum VisitState {
        IN_PROGRESS, DONE
    }

    private record CompositeSpec(String name, boolean parallel, List<String> children) {
    }
}

package me.golemcore.orchestrator.domain.exception;

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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Base of every failure raised while building or running a workflow.
 *
 * <p>
 * As the exception propagates outwards each agent, composite and the runner
 * prepends its own name, so the message reads
 * {@code Root > Child > Leaf: cause} without changing the exception type.
 */
public class WorkflowException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ArrayDeque<String> componentPath = new ArrayDeque<>();

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Prepends a component name to the path. Returns this exception for
     * {@code throw e.enterComponent(name)}.
     */
    public WorkflowException enterComponent(String componentName) {
        if (componentName == null || componentName.isBlank()) {
            return this;
        }
        synchronized (componentPath) {
            if (!componentName.equals(componentPath.peekFirst())) {
                componentPath.addFirst(componentName);
            }
        }
        return this;
    }

    public List<String> getComponentPath() {
        synchronized (componentPath) {
            return List.copyOf(componentPath);
        }
    }

    /**
     * Message without the component path.
     */
    public String getDetail() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        Deque<String> path;
        synchronized (componentPath) {
            path = new ArrayDeque<>(componentPath);
        }
        if (path.isEmpty()) {
            return getDetail();
        }
        return String.join(" > ", path) + ": " + getDetail();
    }
}

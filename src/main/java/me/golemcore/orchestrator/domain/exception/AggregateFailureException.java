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

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more children of a parallel composite failed. Every failed child is
 * listed; none of the branch writes were merged.
 */
public class AggregateFailureException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    private final transient List<ChildFailure> failures;
    private final int childCount;

    public AggregateFailureException(List<ChildFailure> failures, int childCount) {
        super(describe(failures, childCount), failures.isEmpty() ? null : failures.get(0).cause());
        this.failures = List.copyOf(failures);
        this.childCount = childCount;
        for (int i = 1; i < this.failures.size(); i++) {
            addSuppressed(this.failures.get(i).cause());
        }
    }

    public List<ChildFailure> getFailures() {
        return failures;
    }

    public int getChildCount() {
        return childCount;
    }

    private static String describe(List<ChildFailure> failures, int childCount) {
        return failures.size() + " of " + childCount + " parallel branches failed: "
                + failures.stream()
                        .map(AggregateFailureException::describe)
                        .collect(Collectors.joining("; "));
    }

    private static String describe(ChildFailure failure) {
        if (failure.cause() instanceof WorkflowException workflowException
                && workflowException.getComponentPath().contains(failure.childName())) {
            return workflowException.getMessage();
        }
        return failure.childName() + ": " + failure.cause().getMessage();
    }

    /**
     * Failure of a single parallel child.
     */
    public record ChildFailure(String childName, Throwable cause) {
    }
}

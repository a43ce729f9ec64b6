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

import me.golemcore.orchestrator.domain.model.FailureKind;

/**
 * A retryable failure persisted through every attempt allowed by the policy.
 */
public class RetryExhaustedException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    private final int attempts;
    private final FailureKind lastKind;

    public RetryExhaustedException(String operation, int attempts, FailureKind lastKind, Throwable cause) {
        super(operation + " failed after " + attempts + " attempts (" + lastKind + "): "
                + (cause != null ? cause.getMessage() : "unknown"), cause);
        this.attempts = attempts;
        this.lastKind = lastKind;
    }

    public int getAttempts() {
        return attempts;
    }

    public FailureKind getLastKind() {
        return lastKind;
    }
}

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.InvocationFailedException;
import me.golemcore.orchestrator.domain.exception.RetryExhaustedException;
import me.golemcore.orchestrator.domain.exception.WorkflowException;
import me.golemcore.orchestrator.domain.model.FailureKind;
import me.golemcore.orchestrator.domain.model.RetryPolicy;
import me.golemcore.orchestrator.domain.system.InvocationErrorClassifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs external calls under a {@link RetryPolicy}. This is the only place
 * that sleeps between attempts.
 *
 * <p>
 * A failure whose kind the policy lists is retried after the exponential
 * delay until attempts run out ({@link RetryExhaustedException}). Any other
 * failure surfaces after the first attempt as an
 * {@link InvocationFailedException}. Workflow exceptions raised inside the
 * call (configuration errors, nested agent failures) pass through untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetryExecutor {

    private final BackoffSleeper sleeper;

    public <T> T invoke(String operation, Callable<T> call, RetryPolicy policy) {
        RetryPolicy effectivePolicy = policy != null ? policy : RetryPolicy.defaults();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.call();
            } catch (Exception e) {
                Throwable failure = unwrap(e);
                if (failure instanceof WorkflowException workflowException
                        && !(failure instanceof InvocationFailedException)) {
                    throw workflowException;
                }

                FailureKind kind = InvocationErrorClassifier.classify(failure);
                if (!effectivePolicy.isRetryable(kind)) {
                    log.debug("[Retry] {} failed with non-retryable {}: {}", operation, kind, failure.getMessage());
                    throw asInvocationFailure(operation, kind, failure);
                }
                if (attempt >= effectivePolicy.maxAttempts()) {
                    log.warn("[Retry] {} exhausted {} attempts, last failure {}: {}",
                            operation, attempt, kind, failure.getMessage());
                    throw new RetryExhaustedException(operation, attempt, kind, failure);
                }

                Duration delay = effectivePolicy.delayAfterAttempt(attempt);
                log.warn("[Retry] {} failed with {} (attempt {}/{}), retrying in {}ms",
                        operation, kind, attempt, effectivePolicy.maxAttempts(), delay.toMillis());
                backoff(operation, delay);
            }
        }
    }

    private void backoff(String operation, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvocationFailedException(FailureKind.OTHER,
                    operation + " interrupted while waiting to retry", e);
        }
    }

    private static WorkflowException asInvocationFailure(String operation, FailureKind kind, Throwable failure) {
        if (failure instanceof InvocationFailedException invocationFailed) {
            return invocationFailed;
        }
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return new InvocationFailedException(kind, operation + " failed: " + message, failure);
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

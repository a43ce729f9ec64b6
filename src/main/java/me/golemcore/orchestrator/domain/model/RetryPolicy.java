package me.golemcore.orchestrator.domain.model;

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

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable retry policy for external calls.
 *
 * <p>
 * The delay before attempt {@code n + 1} is
 * {@code initialDelay * multiplier^(n - 1)}, so the defaults (5 attempts, 1 s,
 * base 7) sleep 1 s, 7 s, 49 s and 343 s between the five attempts.
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier,
        Set<FailureKind> retryableKinds) {

    public static final Set<FailureKind> TRANSIENT_KINDS = Collections.unmodifiableSet(EnumSet.of(
            FailureKind.RATE_LIMITED,
            FailureKind.SERVER_ERROR,
            FailureKind.SERVICE_UNAVAILABLE,
            FailureKind.GATEWAY_TIMEOUT));

    private static final RetryPolicy DEFAULTS = new RetryPolicy(5, Duration.ofSeconds(1), 7.0, TRANSIENT_KINDS);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        Objects.requireNonNull(initialDelay, "initialDelay");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, got " + multiplier);
        }
        if (retryableKinds == null || retryableKinds.isEmpty()) {
            retryableKinds = Collections.unmodifiableSet(EnumSet.noneOf(FailureKind.class));
        } else {
            retryableKinds = Collections.unmodifiableSet(EnumSet.copyOf(retryableKinds));
        }
    }

    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Set.of());
    }

    public boolean isRetryable(FailureKind kind) {
        return kind != null && retryableKinds.contains(kind);
    }

    /**
     * Delay to wait after the given failed attempt (1-based) before the next one.
     */
    public Duration delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis(Math.round(millis));
    }
}

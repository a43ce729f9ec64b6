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

/**
 * Classification of a failed external call (model or tool). The retry wrapper
 * decides from the kind alone whether another attempt is made.
 */
public enum FailureKind {

    /** HTTP 429 or a provider rate-limit signal. */
    RATE_LIMITED,

    /** HTTP 500. */
    SERVER_ERROR,

    /** HTTP 503. */
    SERVICE_UNAVAILABLE,

    /** HTTP 504, socket and request timeouts. */
    GATEWAY_TIMEOUT,

    /** Authentication, bad requests, programming errors and anything unknown. */
    OTHER;

    /**
     * Maps an HTTP status to its kind. Only 429, 500, 503 and 504 are
     * transient; every other status, including 501, 502 and 408, is
     * {@link #OTHER}.
     */
    public static FailureKind fromHttpStatus(int status) {
        return switch (status) {
        case 429 -> RATE_LIMITED;
        case 500 -> SERVER_ERROR;
        case 503 -> SERVICE_UNAVAILABLE;
        case 504 -> GATEWAY_TIMEOUT;
        default -> OTHER;
        };
    }
}

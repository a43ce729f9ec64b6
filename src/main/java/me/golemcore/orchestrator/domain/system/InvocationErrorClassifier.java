package me.golemcore.orchestrator.domain.system;

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

import me.golemcore.orchestrator.domain.exception.InvocationFailedException;
import me.golemcore.orchestrator.domain.model.FailureKind;

import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures of model and tool calls to a {@link FailureKind}.
 *
 * <p>
 * Provider exceptions are recognised by class name so the domain does not
 * depend on the LLM SDK or the HTTP client. The cause chain is walked until a
 * throwable yields a definite kind; anything unrecognised is
 * {@link FailureKind#OTHER}.
 */
public final class InvocationErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";
    private static final String CLASS_FEIGN_EXCEPTION = "feign.FeignException";

    private InvocationErrorClassifier() {
    }

    public static FailureKind classify(Throwable throwable) {
        if (throwable == null) {
            return FailureKind.OTHER;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            FailureKind kind = classifyKnownThrowable(current);
            if (kind != null) {
                return kind;
            }
            current = current.getCause();
        }
        return FailureKind.OTHER;
    }

    public static boolean isTransient(Throwable throwable) {
        return classify(throwable) != FailureKind.OTHER;
    }

    private static FailureKind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof InvocationFailedException invocationFailed) {
            return invocationFailed.getKind();
        }
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return FailureKind.OTHER;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return FailureKind.GATEWAY_TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return FailureKind.RATE_LIMITED;
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className)) {
            return FailureKind.GATEWAY_TIMEOUT;
        }
        if (CLASS_INTERNAL_SERVER_EXCEPTION.equals(className)) {
            // langchain4j raises this for any 5xx; the wrapped HttpException carries the real status.
            Throwable cause = throwable.getCause();
            boolean hasStatus = cause != null && CLASS_HTTP_EXCEPTION.equals(cause.getClass().getName());
            return hasStatus ? null : FailureKind.SERVER_ERROR;
        }
        if (CLASS_HTTP_EXCEPTION.equals(className)) {
            return classifyByStatus(readStatus(throwable, "statusCode"));
        }
        if (isFeignException(throwable.getClass())) {
            return classifyByStatus(readStatus(throwable, "status"));
        }
        return null;
    }

    private static FailureKind classifyByStatus(Integer status) {
        if (status == null || status < 400) {
            // No usable status (e.g. an I/O error): look further down the chain.
            return null;
        }
        return FailureKind.fromHttpStatus(status);
    }

    private static boolean isFeignException(Class<?> type) {
        Class<?> current = type;
        while (current != null) {
            if (CLASS_FEIGN_EXCEPTION.equals(current.getName())) {
                return true;
            }
            current = current.getSuperclass();
        }
        return false;
    }

    private static Integer readStatus(Throwable throwable, String accessor) {
        try {
            Method method = throwable.getClass().getMethod(accessor);
            Object result = method.invoke(throwable);
            if (result instanceof Integer status) {
                return status;
            }
        } catch (ReflectiveOperationException e) {
            return null;
        }
        return null;
    }
}

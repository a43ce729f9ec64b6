package me.golemcore.orchestrator.adapter.inbound.web;

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
import me.golemcore.orchestrator.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.orchestrator.domain.exception.AggregateFailureException;
import me.golemcore.orchestrator.domain.exception.ConfigurationException;
import me.golemcore.orchestrator.domain.exception.InvocationFailedException;
import me.golemcore.orchestrator.domain.exception.RetryExhaustedException;
import me.golemcore.orchestrator.domain.exception.ToolLoopExceededException;
import me.golemcore.orchestrator.domain.exception.UnknownWorkflowException;
import me.golemcore.orchestrator.domain.exception.WorkflowException;
import me.golemcore.orchestrator.domain.exception.WorkflowTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Maps workflow failures to HTTP responses: unknown workflow 404,
 * configuration errors 422, failed model or tool calls 502, timeouts 504.
 */
@ControllerAdvice(basePackages = "me.golemcore.orchestrator.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(WorkflowException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleWorkflowException(WorkflowException ex) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.error("[API] {}: {}", status, ex.getMessage());
        } else {
            log.warn("[API] {}: {}", status, ex.getMessage());
        }
        return Mono.just(ResponseEntity.status(status).body(body(status, ex.getMessage(), ex.getComponentPath())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of())));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", List.of())));
    }

    static HttpStatus statusOf(WorkflowException ex) {
        if (ex instanceof UnknownWorkflowException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof ConfigurationException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (ex instanceof WorkflowTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        if (ex instanceof InvocationFailedException || ex instanceof RetryExhaustedException
                || ex instanceof AggregateFailureException || ex instanceof ToolLoopExceededException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ApiErrorResponse body(HttpStatus status, String message, List<String> componentPath) {
        return ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .componentPath(componentPath)
                .build();
    }
}

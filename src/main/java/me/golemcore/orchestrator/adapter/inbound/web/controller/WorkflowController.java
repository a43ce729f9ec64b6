package me.golemcore.orchestrator.adapter.inbound.web.controller;

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
import me.golemcore.orchestrator.adapter.inbound.web.dto.RunWorkflowRequest;
import me.golemcore.orchestrator.adapter.inbound.web.dto.WorkflowRunResponse;
import me.golemcore.orchestrator.adapter.inbound.web.dto.WorkflowSummaryDto;
import me.golemcore.orchestrator.domain.model.RunResult;
import me.golemcore.orchestrator.port.inbound.WorkflowRunPort;
import me.golemcore.orchestrator.port.outbound.ReportExportPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.List;

/**
 * Workflow listing and run endpoints. Runs block until the workflow
 * completes, so they execute on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

    private final WorkflowRunPort workflowRunPort;
    private final ReportExportPort reportExportPort;

    @GetMapping
    public Mono<ResponseEntity<List<WorkflowSummaryDto>>> listWorkflows() {
        List<WorkflowSummaryDto> dtos = workflowRunPort.listWorkflows().stream()
                .map(summary -> WorkflowSummaryDto.builder()
                        .name(summary.name())
                        .description(summary.description())
                        .build())
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @PostMapping("/{name}/runs")
    public Mono<ResponseEntity<WorkflowRunResponse>> runWorkflow(@PathVariable String name,
            @RequestBody RunWorkflowRequest request) {
        if (request == null || request.getInput() == null || request.getInput().isBlank()) {
            return Mono.error(new IllegalArgumentException("input is required"));
        }
        log.info("[API] Run requested for workflow {}", name);
        return Mono.fromCallable(() -> {
            RunResult result = workflowRunPort.run(name, request.getInput());
            Path report = Boolean.TRUE.equals(request.getExport()) ? reportExportPort.export(result) : null;
            return ResponseEntity.ok(toResponse(result, report));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private WorkflowRunResponse toResponse(RunResult result, Path report) {
        return WorkflowRunResponse.builder()
                .sessionId(result.getSessionId())
                .workflow(result.getWorkflowName())
                .output(result.getOutput())
                .branchOutputs(result.getRootResult().branchOutputs())
                .state(result.getFinalState().asMap())
                .startedAt(result.getStartedAt())
                .completedAt(result.getCompletedAt())
                .durationMs(result.getDuration().toMillis())
                .reportPath(report != null ? report.toString() : null)
                .build();
    }
}

package me.golemcore.orchestrator.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRunResponse {
    private String sessionId;
    private String workflow;
    private String output;
    private Map<String, String> branchOutputs;
    private Map<String, Object> state;
    private Instant startedAt;
    private Instant completedAt;
    private long durationMs;
    private String reportPath;
}

package me.golemcore.orchestrator.adapter.outbound.export;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.RunResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ReportExportPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Writes run reports as Markdown files into
 * {@code orchestrator.export.directory}, one file per run named
 * {@code <workflow>_<yyyyMMdd_HHmmss>_<session>.md}. The session id keeps the
 * name unique per run; an existing file is never overwritten.
 *
 * <p>
 * The report holds the workflow name, session, timing, the input, the final
 * output and every entry of the final state. Structured state values are
 * rendered as JSON.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalReportExporter implements ReportExportPort {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Path export(RunResult result) {
        Path directory = resolveDirectory();
        String timestamp = FILE_TIMESTAMP.format(result.getCompletedAt().atZone(ZoneId.systemDefault()));
        Path file = directory.resolve(sanitize(result.getWorkflowName()) + "_" + timestamp + "_"
                + sanitize(result.getSessionId()) + ".md");

        try {
            Files.createDirectories(directory);
            Files.writeString(file, render(result), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report: " + file, e);
        }
        log.info("[Export] Report for {} session {} written to {}", result.getWorkflowName(),
                result.getSessionId(), file);
        return file;
    }

    String render(RunResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(result.getWorkflowName()).append("\n\n");
        sb.append("- Session: ").append(result.getSessionId()).append('\n');
        sb.append("- Started: ").append(result.getStartedAt()).append('\n');
        sb.append("- Completed: ").append(result.getCompletedAt()).append('\n');
        sb.append("- Duration: ").append(result.getDuration().toMillis()).append(" ms\n\n");

        sb.append("## Input\n\n").append(result.getInput()).append("\n\n");
        sb.append("## Output\n\n").append(result.getOutput()).append("\n\n");

        sb.append("## State\n");
        for (Map.Entry<String, Object> entry : result.getFinalState().asMap().entrySet()) {
            sb.append("\n### ").append(entry.getKey()).append("\n\n")
                    .append(renderValue(entry.getValue())).append('\n');
        }
        return sb.toString();
    }

    private String renderValue(Object value) {
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        try {
            return "```json\n" + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value) + "\n```";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("State value cannot be rendered as JSON", e);
        }
    }

    private Path resolveDirectory() {
        String configured = properties.getExport().getDirectory();
        return Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}

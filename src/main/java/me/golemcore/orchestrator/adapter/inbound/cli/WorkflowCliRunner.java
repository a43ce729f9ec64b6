package me.golemcore.orchestrator.adapter.inbound.cli;

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
import me.golemcore.orchestrator.domain.exception.WorkflowException;
import me.golemcore.orchestrator.domain.model.RunResult;
import me.golemcore.orchestrator.port.inbound.WorkflowRunPort;
import me.golemcore.orchestrator.port.outbound.ReportExportPort;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * One-shot command line mode.
 *
 * <pre>
 * java -jar golemcore-orchestrator.jar --workflow=blog-pipeline --input="Write about Rust" [--export]
 * </pre>
 *
 * Runs the workflow once, logs the result (and writes a report with
 * {@code --export}), then shuts the application down with exit code 0 on
 * success and 1 when the run or the report fails. Without {@code --workflow} the application keeps
 * serving HTTP.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowCliRunner implements ApplicationRunner {

    static final String OPTION_WORKFLOW = "workflow";
    static final String OPTION_INPUT = "input";
    static final String OPTION_EXPORT = "export";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final WorkflowRunPort workflowRunPort;
    private final ReportExportPort reportExportPort;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION_WORKFLOW)) {
            return;
        }
        int exitCode = execute(args);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    int execute(ApplicationArguments args) {
        String workflow = firstValue(args, OPTION_WORKFLOW);
        String input = firstValue(args, OPTION_INPUT);
        if (workflow == null || workflow.isBlank() || input == null || input.isBlank()) {
            log.error("[CLI] Usage: --workflow=<name> --input=<text> [--export]. Available workflows: {}",
                    workflowRunPort.listWorkflows().stream().map(WorkflowRunPort.WorkflowSummary::name).toList());
            return EXIT_USAGE;
        }

        try {
            RunResult result = workflowRunPort.run(workflow, input);
            printResult(result);
            if (args.containsOption(OPTION_EXPORT)) {
                return export(result);
            }
            return EXIT_OK;
        } catch (WorkflowException e) {
            log.error("[CLI] Workflow {} failed: {}", workflow, e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int export(RunResult result) {
        try {
            Path report = reportExportPort.export(result);
            log.info("[CLI] Report saved to {}", report);
            return EXIT_OK;
        } catch (UncheckedIOException e) {
            log.error("[CLI] Report for {} could not be written: {}", result.getWorkflowName(), e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void printResult(RunResult result) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" {} ({} ms, session {})", result.getWorkflowName(), result.getDuration().toMillis(),
                result.getSessionId());
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("\n{}", result.getOutput());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" State keys: {}", result.getFinalState().keys());
    }

    private static String firstValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }
}

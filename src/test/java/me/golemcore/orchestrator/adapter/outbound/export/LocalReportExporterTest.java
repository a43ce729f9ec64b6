package me.golemcore.orchestrator.adapter.outbound.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.RunResult;
import me.golemcore.orchestrator.domain.state.StateSnapshot;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalReportExporterTest {

    private static final Instant STARTED = Instant.parse("2026-03-01T08:00:00Z");
    private static final Instant COMPLETED = Instant.parse("2026-03-01T08:00:42Z");

    @TempDir
    Path tempDir;

    private OrchestratorProperties properties;
    private LocalReportExporter exporter;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        properties.getExport().setDirectory(tempDir.resolve("reports").toString());
        exporter = new LocalReportExporter(properties, new ObjectMapper());
    }

    @Test
    void shouldWriteReportNamedAfterWorkflowAndCompletionTime() throws IOException {
        Path file = exporter.export(result("daily-briefing"));

        String expectedName = "daily-briefing_"
                + DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").format(COMPLETED.atZone(ZoneId.systemDefault()))
                + "_session-1.md";
        assertEquals(tempDir.resolve("reports").resolve(expectedName), file);
        assertTrue(Files.exists(file));
        assertTrue(Files.readString(file).startsWith("# daily-briefing\n"));
    }

    @Test
    void shouldKeepReportsOfRunsFinishingInTheSameSecond() throws IOException {
        RunResult first = result("blog-pipeline", "session-a", Instant.parse("2026-03-01T08:00:42.100Z"));
        RunResult second = result("blog-pipeline", "session-b", Instant.parse("2026-03-01T08:00:42.900Z"));

        Path firstFile = exporter.export(first);
        Path secondFile = exporter.export(second);

        assertNotEquals(firstFile, secondFile);
        assertTrue(Files.readString(firstFile).contains("- Session: session-a"));
        assertTrue(Files.readString(secondFile).contains("- Session: session-b"));
    }

    @Test
    void shouldNeverOverwriteExistingReport() throws IOException {
        Path file = exporter.export(result("daily-briefing"));

        assertThrows(UncheckedIOException.class, () -> exporter.export(result("daily-briefing")));
        assertTrue(Files.readString(file).startsWith("# daily-briefing\n"));
    }

    @Test
    void shouldSanitizeWorkflowNameInFileName() {
        Path file = exporter.export(result("blog pipeline/v2"));

        assertTrue(file.getFileName().toString().startsWith("blog_pipeline_v2_"));
    }

    @Test
    void shouldRenderInputOutputAndState() {
        String report = exporter.render(result("daily-briefing"));

        assertTrue(report.contains("- Session: session-1"));
        assertTrue(report.contains("- Duration: 42000 ms"));
        assertTrue(report.contains("## Input\n\nWhat happened today?"));
        assertTrue(report.contains("## Output\n\nMarkets calm, chips up."));
        assertTrue(report.contains("### executive_summary\n\nMarkets calm, chips up."));
        assertTrue(report.contains("### sources\n\n```json\n"));
        assertTrue(report.contains("\"https://news.test/chips\""));
    }

    @Test
    void shouldFailWhenDirectoryCannotBeCreated() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        properties.getExport().setDirectory(blocker.resolve("reports").toString());

        assertThrows(UncheckedIOException.class, () -> exporter.export(result("daily-briefing")));
    }

    private static RunResult result(String workflowName) {
        return result(workflowName, "session-1", COMPLETED);
    }

    private static RunResult result(String workflowName, String sessionId, Instant completedAt) {
        return RunResult.builder()
                .sessionId(sessionId)
                .workflowName(workflowName)
                .input("What happened today?")
                .output("Markets calm, chips up.")
                .finalState(new StateSnapshot(Map.of(
                        "user_input", "What happened today?",
                        "executive_summary", "Markets calm, chips up.",
                        "sources", List.of("https://news.test/chips"))))
                .startedAt(STARTED)
                .completedAt(completedAt)
                .build();
    }
}

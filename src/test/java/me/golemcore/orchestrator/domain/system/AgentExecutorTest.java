package me.golemcore.orchestrator.domain.system;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.exception.InvocationFailedException;
import me.golemcore.orchestrator.domain.exception.MissingVariableException;
import me.golemcore.orchestrator.domain.model.AgentDefinition;
import me.golemcore.orchestrator.domain.model.ExecutionScope;
import me.golemcore.orchestrator.domain.model.FailureKind;
import me.golemcore.orchestrator.domain.service.InstructionTemplateRenderer;
import me.golemcore.orchestrator.domain.state.SessionStateStore;
import me.golemcore.orchestrator.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.orchestrator.domain.system.toolloop.ToolLoopTurnResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentExecutorTest {

    private ToolLoopSystem toolLoop;
    private AgentExecutor executor;
    private SessionStateStore state;
    private ExecutionScope scope;

    @BeforeEach
    void setUp() {
        toolLoop = mock(ToolLoopSystem.class);
        executor = new AgentExecutor(new InstructionTemplateRenderer(new ObjectMapper()), toolLoop);
        state = new SessionStateStore("session-1");
        scope = new ExecutionScope("session-1", "Write about Rust", state);
    }

    @Test
    void shouldRenderInstructionAndStoreAnswerUnderOutputKey() {
        state.set("blog_outline", "1. Ownership");
        AgentDefinition writer = AgentDefinition.builder()
                .name("WriterAgent")
                .instruction("Write from this outline:\n{blog_outline}")
                .outputKey("blog_draft")
                .build();
        when(toolLoop.runLoop(writer, scope, "Write from this outline:\n1. Ownership", "Write about Rust"))
                .thenReturn(new ToolLoopTurnResult("Draft text", 1, 0, List.of()));

        String result = executor.execute(writer, scope, "Write about Rust");

        assertEquals("Draft text", result);
        assertEquals(Optional.of("Draft text"), state.get("blog_draft"));
    }

    @Test
    void shouldLeaveStateUntouchedWithoutOutputKey() {
        AgentDefinition coordinator = AgentDefinition.builder()
                .name("ResearchCoordinator")
                .instruction("Coordinate")
                .build();
        when(toolLoop.runLoop(any(), any(), anyString(), anyString()))
                .thenReturn(new ToolLoopTurnResult("Answer", 3, 2, List.of()));

        assertEquals("Answer", executor.execute(coordinator, scope, "question"));
        assertEquals(List.of(), List.copyOf(state.keys()));
    }

    @Test
    void shouldFailBeforeCallingModelWhenInstructionKeyIsMissing() {
        AgentDefinition editor = AgentDefinition.builder()
                .name("EditorAgent")
                .instruction("Edit: {blog_draft}")
                .outputKey("final_blog")
                .build();

        MissingVariableException error = assertThrows(MissingVariableException.class,
                () -> executor.execute(editor, scope, "input"));

        assertEquals(List.of("EditorAgent"), error.getComponentPath());
        assertEquals("blog_draft", error.getVariable());
        verify(toolLoop, never()).runLoop(any(), any(), any(), any());
        assertFalse(state.contains("final_blog"));
    }

    @Test
    void shouldPrefixAgentNameOnLoopFailure() {
        AgentDefinition researcher = AgentDefinition.builder()
                .name("ResearchAgent")
                .instruction("Research")
                .outputKey("research_findings")
                .build();
        when(toolLoop.runLoop(eq(researcher), any(), anyString(), anyString()))
                .thenThrow(new InvocationFailedException(FailureKind.OTHER, "model call failed: 401")
                        .enterComponent("web_search"));

        InvocationFailedException error = assertThrows(InvocationFailedException.class,
                () -> executor.execute(researcher, scope, "input"));

        assertEquals(List.of("ResearchAgent", "web_search"), error.getComponentPath());
        assertEquals("ResearchAgent > web_search: model call failed: 401", error.getMessage());
        assertFalse(state.contains("research_findings"));
    }
}

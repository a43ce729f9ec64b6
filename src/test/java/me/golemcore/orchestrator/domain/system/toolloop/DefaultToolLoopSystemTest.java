package me.golemcore.orchestrator.domain.system.toolloop;

import me.golemcore.orchestrator.domain.exception.InvocationFailedException;
import me.golemcore.orchestrator.domain.exception.RetryExhaustedException;
import me.golemcore.orchestrator.domain.exception.ToolLoopExceededException;
import me.golemcore.orchestrator.domain.model.AgentDefinition;
import me.golemcore.orchestrator.domain.model.ExecutionScope;
import me.golemcore.orchestrator.domain.model.ExternalToolBinding;
import me.golemcore.orchestrator.domain.model.FailureKind;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.service.RetryExecutor;
import me.golemcore.orchestrator.domain.state.SessionStateStore;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.testsupport.ScriptedLlmPort;
import me.golemcore.orchestrator.testsupport.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static me.golemcore.orchestrator.testsupport.ScriptedLlmPort.toolCall;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolLoopSystemTest {

    private static final String AGENT = "ResearchAgent";

    private ScriptedLlmPort llm;
    private ToolExecutorPort toolExecutor;
    private List<Duration> sleeps;
    private OrchestratorProperties.ToolLoopProperties settings;
    private DefaultToolLoopSystem toolLoop;
    private ExecutionScope scope;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLlmPort();
        toolExecutor = mock(ToolExecutorPort.class);
        sleeps = new ArrayList<>();
        settings = new OrchestratorProperties.ToolLoopProperties();
        toolLoop = new DefaultToolLoopSystem(llm, toolExecutor, new RetryExecutor(sleeps::add), settings);
        scope = new ExecutionScope("session-1", "What is new in Rust?", new SessionStateStore("session-1"));
    }

    @Test
    void shouldReturnFinalAnswerFromFirstModelCall() {
        llm.reply(AGENT, "Rust 1.80 shipped.");

        ToolLoopTurnResult result = toolLoop.runLoop(agent(null), scope, "You are a researcher.",
                "What is new in Rust?");

        assertEquals("Rust 1.80 shipped.", result.finalAnswer());
        assertEquals(1, result.llmCalls());
        assertEquals(0, result.toolExecutions());

        LlmRequest request = llm.requests().get(0);
        assertEquals("You are a researcher.", request.getSystemPrompt());
        assertEquals(AGENT, request.getAgentName());
        assertEquals("session-1", request.getSessionId());
        assertEquals(1, request.getMessages().size());
        assertEquals(Message.ROLE_USER, request.getMessages().get(0).getRole());
        assertEquals("What is new in Rust?", request.getMessages().get(0).getContent());
        assertEquals(List.of("web_search"), request.getTools().stream().map(t -> t.getName()).toList());
        verify(toolExecutor, never()).execute(any(), any(), any());
    }

    @Test
    void shouldFeedToolResultsBackUntilFinalAnswer() {
        Message.ToolCall search = toolCall("call-1", "web_search", Map.of("query", "rust release"));
        llm.callTools(AGENT, search).reply(AGENT, "Rust 1.80 shipped with LazyCell.");
        when(toolExecutor.execute(any(), eq(search), eq(scope)))
                .thenReturn(ToolExecutionOutcome.of(search, ToolResult.success("1.80 release notes")));

        ToolLoopTurnResult result = toolLoop.runLoop(agent(null), scope, "prompt", "What is new in Rust?");

        assertEquals("Rust 1.80 shipped with LazyCell.", result.finalAnswer());
        assertEquals(2, result.llmCalls());
        assertEquals(1, result.toolExecutions());

        List<Message> secondCall = llm.requests().get(1).getMessages();
        assertEquals(3, secondCall.size());
        assertTrue(secondCall.get(1).hasToolCalls());
        assertEquals(Message.ROLE_ASSISTANT, secondCall.get(1).getRole());
        Message toolMessage = secondCall.get(2);
        assertTrue(toolMessage.isToolMessage());
        assertEquals("call-1", toolMessage.getToolCallId());
        assertEquals("web_search", toolMessage.getToolName());
        assertEquals("1.80 release notes", toolMessage.getContent());
    }

    @Test
    void shouldAnswerEveryCallOfOneTurnInOrder() {
        Message.ToolCall first = toolCall("a", "web_search", Map.of("query", "one"));
        Message.ToolCall second = toolCall("b", "web_search", Map.of("query", "two"));
        llm.callTools(AGENT, first, second).reply(AGENT, "done");
        when(toolExecutor.execute(any(), any(), any())).thenAnswer(invocation -> {
            Message.ToolCall call = invocation.getArgument(1);
            return ToolExecutionOutcome.of(call, ToolResult.failure("no results for " + call.getId()));
        });

        toolLoop.runLoop(agent(null), scope, "prompt", "input");

        List<Message> messages = llm.requests().get(1).getMessages();
        assertEquals("a", messages.get(2).getToolCallId());
        assertEquals("Error: no results for a", messages.get(2).getContent());
        assertEquals("b", messages.get(3).getToolCallId());
    }

    @Test
    void shouldAssignIdsToCallsWithoutOne() {
        Message.ToolCall anonymous = toolCall(null, "web_search", Map.of("query", "rust"));
        llm.callTools(AGENT, anonymous).reply(AGENT, "done");
        when(toolExecutor.execute(any(), any(), any())).thenAnswer(invocation -> ToolExecutionOutcome.of(
                invocation.getArgument(1), ToolResult.success("ok")));

        toolLoop.runLoop(agent(null), scope, "prompt", "input");

        ArgumentCaptor<Message.ToolCall> captor = ArgumentCaptor.forClass(Message.ToolCall.class);
        verify(toolExecutor).execute(any(), captor.capture(), any());
        assertEquals("call_1_0", captor.getValue().getId());
        assertNull(anonymous.getId());
    }

    @Test
    void shouldFailWhenAgentNeverProducesFinalAnswer() {
        Message.ToolCall search = toolCall("call", "web_search", Map.of("query", "again"));
        llm.callTools(AGENT, search).callTools(AGENT, search).callTools(AGENT, search);
        when(toolExecutor.execute(any(), any(), any()))
                .thenReturn(ToolExecutionOutcome.of(search, ToolResult.success("more")));

        ToolLoopExceededException error = assertThrows(ToolLoopExceededException.class,
                () -> toolLoop.runLoop(agent(2), scope, "prompt", "input"));

        assertEquals(2, error.getMaxIterations());
        assertEquals(2, llm.requests().size());
        verify(toolExecutor, times(1)).execute(any(), any(), any());
    }

    @Test
    void shouldUseConfiguredBoundWhenAgentHasNone() {
        settings.setMaxIterations(1);
        Message.ToolCall search = toolCall("call", "web_search", Map.of("query", "x"));
        llm.callTools(AGENT, search);
        when(toolExecutor.execute(any(), any(), any()))
                .thenReturn(ToolExecutionOutcome.of(search, ToolResult.success("more")));

        assertThrows(ToolLoopExceededException.class, () -> toolLoop.runLoop(agent(null), scope, "prompt", "input"));
        assertEquals(1, llm.requests().size());
        verify(toolExecutor, never()).execute(any(), any(), any());
    }

    @Test
    void shouldRetryTransientModelFailures() {
        llm.fail(AGENT, new InvocationFailedException(FailureKind.RATE_LIMITED, "429"))
                .fail(AGENT, new InvocationFailedException(FailureKind.SERVER_ERROR, "500"))
                .reply(AGENT, "finally");

        ToolLoopTurnResult result = toolLoop.runLoop(agent(null), scope, "prompt", "input");

        assertEquals("finally", result.finalAnswer());
        assertEquals(1, result.llmCalls());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(7)), sleeps);
    }

    @Test
    void shouldSurfaceExhaustedRetries() {
        for (int i = 0; i < 5; i++) {
            llm.fail(AGENT, new InvocationFailedException(FailureKind.SERVICE_UNAVAILABLE, "503"));
        }

        assertThrows(RetryExhaustedException.class, () -> toolLoop.runLoop(agent(null), scope, "prompt", "input"));
        assertEquals(5, llm.requests().size());
    }

    @Test
    void shouldRejectEmptyModelResponse() {
        llm.step(AGENT, request -> CompletableFuture.completedFuture(LlmResponse.builder().build()));

        InvocationFailedException error = assertThrows(InvocationFailedException.class,
                () -> toolLoop.runLoop(agent(null), scope, "prompt", "input"));

        assertEquals(FailureKind.OTHER, error.getKind());
    }

    private static AgentDefinition agent(Integer maxToolIterations) {
        return AgentDefinition.builder()
                .name(AGENT)
                .instruction("You are a researcher.")
                .tools(List.of(new ExternalToolBinding(StubTool.returning("web_search", "unused"))))
                .maxToolIterations(maxToolIterations)
                .build();
    }
}

package me.golemcore.orchestrator.domain.system.toolloop;

import me.golemcore.orchestrator.domain.service.RetryExecutor;
import me.golemcore.orchestrator.domain.system.AgentExecutor;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class ToolLoopConfigurationTest {

    private final ToolLoopConfiguration configuration = new ToolLoopConfiguration();
    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryExecutor retryExecutor = new RetryExecutor(sleeps::add);

    @Test
    @SuppressWarnings("unchecked")
    void shouldResolveAgentExecutorLazily() {
        ObjectProvider<AgentExecutor> provider = mock(ObjectProvider.class);

        AgentToolAdapter adapter = configuration.agentToolAdapter(provider);

        assertNotNull(adapter);
        verifyNoInteractions(provider);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldCreateDefaultToolExecutor() {
        AgentToolAdapter adapter = configuration.agentToolAdapter(mock(ObjectProvider.class));

        ToolExecutorPort port = configuration.toolExecutorPort(retryExecutor, adapter);

        assertInstanceOf(DefaultToolExecutor.class, port);
    }

    @Test
    void shouldCreateDefaultToolLoopSystem() {
        ToolLoopSystem system = configuration.toolLoopSystem(mock(LlmPort.class), mock(ToolExecutorPort.class),
                retryExecutor, new OrchestratorProperties());

        assertInstanceOf(DefaultToolLoopSystem.class, system);
    }
}

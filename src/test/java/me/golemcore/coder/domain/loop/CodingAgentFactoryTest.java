package me.golemcore.coder.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.coder.domain.middleware.AutoCompactMiddleware;
import me.golemcore.coder.domain.middleware.ContextWarningMiddleware;
import me.golemcore.coder.domain.middleware.MiddlewarePipeline;
import me.golemcore.coder.domain.middleware.PriceLimitMiddleware;
import me.golemcore.coder.domain.middleware.TurnLimitMiddleware;
import me.golemcore.coder.domain.model.AgentMode;
import me.golemcore.coder.domain.model.AgentStats;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.SessionSnapshot;
import me.golemcore.coder.domain.service.ApprovalGate;
import me.golemcore.coder.domain.service.CompactionService;
import me.golemcore.coder.domain.service.ToolRegistry;
import me.golemcore.coder.domain.service.command.CommandEnvironment;
import me.golemcore.coder.infrastructure.config.AutoConfiguration;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.InteractionLogPort;
import me.golemcore.coder.testsupport.ScriptedModelBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CodingAgentFactoryTest {

    @TempDir
    Path workspace;

    private CoderProperties properties;
    private InteractionLogPort interactionLog;
    private ExecutorService ioExecutor;
    private CodingAgentFactory factory;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        properties = new CoderProperties();
        properties.getShell().setWorkspace(workspace.toString());
        properties.getLlm().setInputPricePerMillion(3.0);
        properties.getLlm().setOutputPricePerMillion(15.0);
        interactionLog = mock(InteractionLogPort.class);
        ioExecutor = Executors.newCachedThreadPool();
        ApprovalGate approvalGate = new ApprovalGate(approval -> {
        }, properties, clock);
        factory = new CodingAgentFactory(properties, new ToolRegistry(List.of()), approvalGate,
                new ScriptedModelBackend(), interactionLog, mock(CompactionService.class),
                AutoConfiguration.objectMapper(), clock, CommandEnvironment.of(Map.of()), ioExecutor);
    }

    @AfterEach
    void tearDown() {
        ioExecutor.shutdownNow();
    }

    @Test
    void shouldBuildOnlyAutoCompactByDefault() {
        MiddlewarePipeline pipeline = factory.buildPipeline(properties.getAgent());

        assertEquals(1, pipeline.getMiddlewares().size());
        assertInstanceOf(AutoCompactMiddleware.class, pipeline.getMiddlewares().get(0));
    }

    @Test
    void shouldBuildLimitsInOrder() {
        CoderProperties.AgentProperties agent = properties.getAgent();
        agent.setMaxTurns(10);
        agent.setMaxPrice(1.5);
        agent.setContextWarnings(true);

        MiddlewarePipeline pipeline = factory.buildPipeline(agent);

        assertEquals(4, pipeline.getMiddlewares().size());
        assertInstanceOf(TurnLimitMiddleware.class, pipeline.getMiddlewares().get(0));
        assertInstanceOf(PriceLimitMiddleware.class, pipeline.getMiddlewares().get(1));
        assertInstanceOf(AutoCompactMiddleware.class, pipeline.getMiddlewares().get(2));
        assertInstanceOf(ContextWarningMiddleware.class, pipeline.getMiddlewares().get(3));
    }

    @Test
    void shouldSkipContextWarningWhenAutoCompactDisabled() {
        CoderProperties.AgentProperties agent = properties.getAgent();
        agent.setAutoCompactThreshold(0);
        agent.setContextWarnings(true);

        MiddlewarePipeline pipeline = factory.buildPipeline(agent);

        assertTrue(pipeline.getMiddlewares().isEmpty());
    }

    @Test
    void shouldCreateIndependentAgents() {
        properties.getAgent().setSystemPrompt("Be brief.");

        CodingAgent first = factory.create();
        CodingAgent second = factory.create();

        assertNotEquals(first.getSessionId(), second.getSessionId());
        assertNotSame(first.getModeManager(), second.getModeManager());
        assertEquals("Be brief.", first.getConversation().getSystemMessage().getContent());
        assertEquals(3.0, first.getStats().getInputPricePerMillion());
        assertEquals(15.0, first.getStats().getOutputPricePerMillion());
    }

    @Test
    void shouldForceAutoApproveWhenConfigured() {
        properties.getAgent().setAutoApprove(true);
        properties.getAgent().setInitialMode(AgentMode.PLAN);

        CodingAgent agent = factory.create();

        assertEquals(AgentMode.PLAN, agent.getModeManager().getMode());
        assertTrue(agent.getModeManager().isAutoApprove());
    }

    @Test
    void shouldResumePersistedSession() {
        AgentStats saved = new AgentStats();
        saved.setSteps(4);
        saved.setInputPricePerMillion(99.0);
        SessionSnapshot snapshot = SessionSnapshot.builder()
                .sessionId("session-42")
                .startedAt(Instant.parse("2025-12-31T08:00:00Z"))
                .mode(AgentMode.AUTO)
                .messages(List.of(Message.system("Saved prompt"), Message.user("hello"),
                        Message.assistant("hi", null)))
                .stats(saved)
                .build();
        when(interactionLog.loadSession("session-42")).thenReturn(Optional.of(snapshot));

        Optional<CodingAgent> resumed = factory.resume("session-42");

        assertTrue(resumed.isPresent());
        CodingAgent agent = resumed.get();
        assertEquals("session-42", agent.getSessionId());
        assertEquals(3, agent.getConversation().size());
        assertEquals(AgentMode.AUTO, agent.getModeManager().getMode());
        assertEquals(4, agent.getStats().getSteps());
        assertEquals(3.0, agent.getStats().getInputPricePerMillion());
    }

    @Test
    void shouldReturnEmptyWhenNothingToResume() {
        when(interactionLog.loadSession("missing")).thenReturn(Optional.empty());
        when(interactionLog.findLatestSession()).thenReturn(Optional.empty());

        assertTrue(factory.resume("missing").isEmpty());
        assertTrue(factory.resumeLatest().isEmpty());
    }
}

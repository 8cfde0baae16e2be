package me.golemcore.coder.adapter.inbound.command;

import me.golemcore.coder.domain.loop.CodingAgent;
import me.golemcore.coder.domain.mode.ModeManager;
import me.golemcore.coder.domain.model.AgentMode;
import me.golemcore.coder.domain.model.AgentStats;
import me.golemcore.coder.domain.model.ApprovalDecision;
import me.golemcore.coder.domain.model.ApprovalVerdict;
import me.golemcore.coder.domain.model.Conversation;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.service.ApprovalGate;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.inbound.SessionCommandPort.CommandResult;
import me.golemcore.coder.port.outbound.ApprovalChannelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SessionCommandHandlerTest {

    private static final String SESSION_ID = "session-1";

    private ApprovalGate approvalGate;
    private CodingAgent agent;
    private ModeManager modeManager;
    private AgentStats stats;
    private Conversation conversation;
    private SessionCommandHandler handler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        approvalGate = new ApprovalGate(mock(ApprovalChannelPort.class), new CoderProperties(), clock);
        modeManager = new ModeManager(AgentMode.NORMAL, 10, clock);
        stats = new AgentStats();
        conversation = new Conversation(Message.system("system"));

        agent = mock(CodingAgent.class);
        when(agent.getSessionId()).thenReturn(SESSION_ID);
        when(agent.getModeManager()).thenReturn(modeManager);
        when(agent.getStats()).thenReturn(stats);
        when(agent.getConversation()).thenReturn(conversation);

        handler = new SessionCommandHandler(approvalGate);
    }

    @Test
    void shouldDescribeModeWithoutArguments() {
        CommandResult result = handler.execute(agent, "mode", List.of());

        assertTrue(result.success());
        assertTrue(result.output().contains("NORMAL"));
        assertTrue(result.output().contains("Available modes:"));
        assertTrue(result.output().contains("ARCHITECT"));
    }

    @Test
    void shouldSwitchModeByName() {
        CommandResult result = handler.execute(agent, "/mode", List.of("plan"));

        assertTrue(result.success());
        assertEquals(AgentMode.PLAN, modeManager.getMode());
        assertTrue(result.output().startsWith("Mode changed:"));
    }

    @Test
    void shouldRejectUnknownMode() {
        CommandResult result = handler.execute(agent, "mode", List.of("turbo"));

        assertFalse(result.success());
        assertTrue(result.output().contains("Unknown mode 'turbo'"));
        assertEquals(AgentMode.NORMAL, modeManager.getMode());
    }

    @Test
    void shouldCycleModeWithNext() {
        when(agent.cycleMode()).thenReturn("Mode changed: NORMAL -> AUTO");

        CommandResult result = handler.execute(agent, "mode", List.of("next"));

        assertTrue(result.success());
        verify(agent).cycleMode();
    }

    @Test
    void shouldClearHistory() {
        CommandResult result = handler.execute(agent, "clear", List.of());

        verify(agent).clearHistory();
        assertEquals("Conversation history cleared. New session: " + SESSION_ID, result.output());
    }

    @Test
    void shouldSkipCompactionOfEmptyConversation() {
        CommandResult result = handler.execute(agent, "compact", List.of());

        assertEquals("Nothing to compact.", result.output());
        verify(agent, never()).compact();
    }

    @Test
    void shouldReportTokensAfterCompaction() {
        conversation.append(Message.user("hello"));
        stats.setContextTokens(9000);
        when(agent.compact()).thenAnswer(invocation -> {
            stats.setContextTokens(300);
            return "summary";
        });

        CommandResult result = handler.execute(agent, "compact", List.of());

        assertEquals("Conversation compacted: 9000 -> 300 tokens.", result.output());
    }

    @Test
    void shouldReportStatus() {
        stats.setSteps(4);
        stats.setToolCallsAgreed(2);

        CommandResult result = handler.execute(agent, "status", List.of());

        assertTrue(result.success());
        assertTrue(result.output().contains("Session: " + SESSION_ID));
        assertTrue(result.output().contains("Steps: 4"));
        assertTrue(result.output().contains("2 agreed"));
        assertTrue(result.output().contains("Pending approvals: 0"));
    }

    @Test
    void shouldResolvePendingApproval() {
        CompletableFuture<ApprovalDecision> future = approvalGate.requestApproval("write_file", Map.of(), "call_7");

        CommandResult result = handler.execute(agent, "approve", List.of("call_7", "no", "use", "a", "patch"));

        assertTrue(result.success());
        assertEquals("Tool 'write_file': NO", result.output());
        assertEquals(ApprovalVerdict.NO, future.join().verdict());
        assertEquals("use a patch", future.join().message());
    }

    @Test
    void shouldApproveByDefault() {
        CompletableFuture<ApprovalDecision> future = approvalGate.requestApproval("bash", Map.of(), "call_8");

        handler.execute(agent, "approve", List.of("call_8"));

        assertEquals(ApprovalVerdict.YES, future.join().verdict());
    }

    @Test
    void shouldRejectInvalidApprovals() {
        approvalGate.requestApproval("bash", Map.of(), "call_9");

        assertFalse(handler.execute(agent, "approve", List.of()).success());
        assertFalse(handler.execute(agent, "approve", List.of("unknown")).success());
        CommandResult badVerdict = handler.execute(agent, "approve", List.of("call_9", "maybe"));
        assertFalse(badVerdict.success());
        assertTrue(badVerdict.output().contains("Unknown verdict 'maybe'"));
        assertEquals(1, approvalGate.pendingCount());
    }

    @Test
    void shouldRejectUnknownCommand() {
        CommandResult result = handler.execute(agent, "/deploy", List.of());

        assertFalse(result.success());
        assertEquals("Unknown command: /deploy", result.output());
    }

    @Test
    void shouldListCommands() {
        assertTrue(handler.hasCommand("status"));
        assertFalse(handler.hasCommand("deploy"));
        assertEquals(5, handler.listCommands().size());
    }
}

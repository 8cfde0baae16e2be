package me.golemcore.coder.domain.service;

import me.golemcore.coder.domain.model.ApprovalDecision;
import me.golemcore.coder.domain.model.ApprovalResolvedEvent;
import me.golemcore.coder.domain.model.ApprovalVerdict;
import me.golemcore.coder.domain.model.PendingApproval;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.ApprovalChannelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ApprovalGateTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final String CALL_ID = "call_1";
    private static final String TOOL = "write_file";

    private ApprovalChannelPort channel;
    private ApprovalGate gate;

    @BeforeEach
    void setUp() {
        channel = mock(ApprovalChannelPort.class);
        CoderProperties properties = new CoderProperties();
        properties.getApproval().setTtlSeconds(60);
        gate = new ApprovalGate(channel, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldNotifyChannelWithArgumentSnapshot() {
        Map<String, Object> args = new HashMap<>(Map.of("path", "a.txt"));

        gate.requestApproval(TOOL, args, CALL_ID);
        args.put("path", "changed.txt");

        ArgumentCaptor<PendingApproval> captor = ArgumentCaptor.forClass(PendingApproval.class);
        verify(channel).onApprovalRequested(captor.capture());
        PendingApproval approval = captor.getValue();
        assertEquals(CALL_ID, approval.correlationId());
        assertEquals(TOOL, approval.toolName());
        assertEquals("a.txt", approval.arguments().get("path"));
        assertEquals(NOW, approval.createdAt());
        assertEquals(1, gate.pendingCount());
    }

    @Test
    void shouldCompleteFutureOnResolve() {
        CompletableFuture<ApprovalDecision> future = gate.requestApproval(TOOL, Map.of(), CALL_ID);

        assertTrue(gate.resolve(CALL_ID, ApprovalVerdict.YES, null));

        ApprovalDecision decision = future.join();
        assertEquals(ApprovalVerdict.YES, decision.verdict());
        assertTrue(decision.isApproved());
        assertEquals(0, gate.pendingCount());
    }

    @Test
    void shouldIgnoreSecondResolution() {
        CompletableFuture<ApprovalDecision> future = gate.requestApproval(TOOL, Map.of(), CALL_ID);

        assertTrue(gate.resolve(CALL_ID, ApprovalVerdict.NO, "declined"));
        assertFalse(gate.resolve(CALL_ID, ApprovalVerdict.YES, null));

        assertEquals(ApprovalVerdict.NO, future.join().verdict());
        assertEquals("declined", future.join().message());
    }

    @Test
    void shouldIgnoreUnknownId() {
        assertFalse(gate.resolve("unknown", ApprovalVerdict.YES, null));
        assertFalse(gate.resolve(null, ApprovalVerdict.YES, null));
    }

    @Test
    void shouldRejectDuplicatePendingId() {
        gate.requestApproval(TOOL, Map.of(), CALL_ID);
        Map<String, Object> args = Map.of();

        assertThrows(IllegalStateException.class, () -> gate.requestApproval(TOOL, args, CALL_ID));
    }

    @Test
    void shouldDenyWhenChannelFails() {
        doThrow(new IllegalStateException("console closed")).when(channel).onApprovalRequested(any());

        CompletableFuture<ApprovalDecision> future = gate.requestApproval(TOOL, Map.of(), CALL_ID);

        assertTrue(future.isDone());
        assertEquals(ApprovalVerdict.NO, future.join().verdict());
        assertTrue(future.join().message().contains("console closed"));
        assertEquals(0, gate.pendingCount());
    }

    @Test
    void shouldExpireEntriesOlderThanTtl() {
        CompletableFuture<ApprovalDecision> future = gate.requestApproval(TOOL, Map.of(), CALL_ID);

        assertEquals(0, gate.expire(NOW.plusSeconds(30)));
        assertFalse(future.isDone());

        assertEquals(1, gate.expire(NOW.plusSeconds(61)));
        assertEquals(ApprovalVerdict.NO, future.join().verdict());
        assertEquals(ApprovalGate.EXPIRED_MESSAGE, future.join().message());
        assertFalse(gate.resolve(CALL_ID, ApprovalVerdict.YES, null));
    }

    @Test
    void shouldCancelAsNo() {
        CompletableFuture<ApprovalDecision> future = gate.requestApproval(TOOL, Map.of(), CALL_ID);

        assertTrue(gate.cancel(CALL_ID, "Cancelled by user"));

        assertFalse(future.join().isApproved());
        assertEquals("Cancelled by user", future.join().message());
    }

    @Test
    void shouldResolveFromApplicationEvent() {
        CompletableFuture<ApprovalDecision> future = gate.requestApproval(TOOL, Map.of(), CALL_ID);

        gate.onApprovalResolved(new ApprovalResolvedEvent(CALL_ID, ApprovalVerdict.ALWAYS, null));

        assertEquals(ApprovalVerdict.ALWAYS, future.join().verdict());
        assertTrue(gate.getPending(CALL_ID).isEmpty());
    }

    @Test
    void shouldCancelPendingOnDestroy() {
        CompletableFuture<ApprovalDecision> future = gate.requestApproval(TOOL, Map.of(), CALL_ID);

        gate.destroy();

        assertEquals(ApprovalVerdict.NO, future.join().verdict());
        assertEquals("Shutting down", future.join().message());
    }
}

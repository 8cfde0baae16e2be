package me.golemcore.coder.domain.mode;

import me.golemcore.coder.domain.model.AgentMode;
import me.golemcore.coder.domain.model.ModeTransition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModeManagerTest {

    private static final Map<String, Object> RM_COMMAND = Map.of("command", "rm -rf build");

    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
    }

    @Test
    void shouldDeriveFlagsFromMode() {
        ModeManager manager = new ModeManager(AgentMode.NORMAL, 10, clock);
        assertFalse(manager.isAutoApprove());
        assertFalse(manager.isReadOnly());

        manager.setMode(AgentMode.PLAN);
        assertTrue(manager.isReadOnly());
        assertFalse(manager.isAutoApprove());

        manager.setMode(AgentMode.YOLO);
        assertFalse(manager.isReadOnly());
        assertTrue(manager.isAutoApprove());
    }

    @Test
    void shouldBlockWritesInReadOnlyModesEvenWithForcedAutoApprove() {
        for (AgentMode mode : List.of(AgentMode.PLAN, AgentMode.ARCHITECT)) {
            ModeManager manager = new ModeManager(mode, 10, clock);
            manager.forceAutoApprove(true);

            BlockDecision write = manager.shouldBlock("write_file", Map.of());
            BlockDecision shell = manager.shouldBlock("bash", RM_COMMAND);

            assertTrue(write.blocked(), mode.name());
            assertTrue(write.reason().contains("blocked in"));
            assertTrue(write.reason().contains(mode.name()));
            assertTrue(write.reason().contains("switch to NORMAL or AUTO mode"));
            assertTrue(shell.blocked(), mode.name());
            assertFalse(manager.shouldBlock("read_file", Map.of()).blocked());
            assertFalse(manager.shouldBlock("bash", Map.of("command", "ls")).blocked());
        }
    }

    @Test
    void shouldNeverBlockInWritableModes() {
        ModeManager manager = new ModeManager(AgentMode.NORMAL, 10, clock);

        assertFalse(manager.shouldBlock("write_file", Map.of()).blocked());
        assertFalse(manager.shouldBlock("bash", RM_COMMAND).blocked());
    }

    @Test
    void shouldAutoApproveReadOnlyToolsInReadOnlyModes() {
        ModeManager manager = new ModeManager(AgentMode.PLAN, 10, clock);

        assertTrue(manager.shouldAutoApprove("read_file"));
        assertTrue(manager.shouldAutoApprove("grep"));
        assertFalse(manager.shouldAutoApprove("bash"));
    }

    @Test
    void shouldKeepForcedAutoApproveUntilModeChanges() {
        ModeManager manager = new ModeManager(AgentMode.NORMAL, 10, clock);
        manager.forceAutoApprove(true);
        assertTrue(manager.shouldAutoApprove("bash"));
        assertEquals(AgentMode.NORMAL, manager.getMode());

        manager.setMode(AgentMode.NORMAL);
        assertFalse(manager.shouldAutoApprove("bash"));
    }

    @Test
    void shouldCycleThroughModes() {
        ModeManager manager = new ModeManager(AgentMode.NORMAL, 10, clock);

        assertEquals(AgentMode.AUTO, manager.cycleMode());
        assertEquals(AgentMode.PLAN, manager.cycleMode());
        assertEquals(AgentMode.YOLO, manager.cycleMode());
        assertEquals(AgentMode.ARCHITECT, manager.cycleMode());
        assertEquals(AgentMode.NORMAL, manager.cycleMode());
    }

    @Test
    void shouldParseModeNames() {
        ModeManager manager = new ModeManager(AgentMode.NORMAL, 10, clock);

        assertEquals(AgentMode.PLAN, manager.setModeFromName(" plan "));
        assertEquals(AgentMode.PLAN, manager.getMode());

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> manager.setModeFromName("turbo"));
        assertTrue(error.getMessage().contains("Unknown mode 'turbo'"));
        assertEquals(AgentMode.PLAN, manager.getMode());
    }

    @Test
    void shouldKeepBoundedHistory() {
        ModeManager manager = new ModeManager(AgentMode.NORMAL, 3, clock);
        manager.setMode(AgentMode.AUTO);
        manager.setMode(AgentMode.PLAN);
        manager.setMode(AgentMode.YOLO);

        List<ModeTransition> history = manager.getHistory();
        assertEquals(3, history.size());
        assertEquals(AgentMode.AUTO, history.get(0).mode());
        assertEquals(AgentMode.YOLO, history.get(2).mode());
        assertEquals(clock.instant(), history.get(2).timestamp());
    }

    @Test
    void shouldProvidePromptModifierForRestrictedModes() {
        ModeManager manager = new ModeManager(AgentMode.NORMAL, 10, clock);
        assertNull(manager.getSystemPromptModifier());

        manager.setMode(AgentMode.ARCHITECT);
        assertTrue(manager.getSystemPromptModifier().contains("ARCHITECT MODE"));
    }

    @Test
    void shouldDescribeTransition() {
        String message = ModeManager.getTransitionMessage(AgentMode.NORMAL, AgentMode.PLAN);

        assertTrue(message.contains("NORMAL"));
        assertTrue(message.contains("PLAN"));
        assertTrue(message.contains(AgentMode.PLAN.getDescription()));
    }
}

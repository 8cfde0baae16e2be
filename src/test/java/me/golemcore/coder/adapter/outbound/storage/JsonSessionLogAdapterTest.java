package me.golemcore.coder.adapter.outbound.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.coder.domain.model.AgentMode;
import me.golemcore.coder.domain.model.AgentStats;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.SessionSnapshot;
import me.golemcore.coder.infrastructure.config.AutoConfiguration;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonSessionLogAdapterTest {

    private static final Instant STARTED = Instant.parse("2026-01-01T12:00:00Z");

    @TempDir
    Path sessionsDir;

    private ObjectMapper objectMapper;
    private JsonSessionLogAdapter adapter;

    @BeforeEach
    void setUp() {
        CoderProperties properties = new CoderProperties();
        properties.getStorage().setSessionsDirectory(sessionsDir.toString());
        objectMapper = AutoConfiguration.objectMapper();
        adapter = new JsonSessionLogAdapter(properties, objectMapper);
    }

    @Test
    void shouldSaveAndLoadSession() {
        SessionSnapshot snapshot = snapshot("abc-123", STARTED.plusSeconds(5));

        adapter.saveInteraction(snapshot);
        Optional<SessionSnapshot> loaded = adapter.loadSession("abc-123");

        assertTrue(loaded.isPresent());
        SessionSnapshot restored = loaded.get();
        assertEquals("abc-123", restored.getSessionId());
        assertEquals(STARTED, restored.getStartedAt());
        assertEquals(AgentMode.PLAN, restored.getMode());
        assertEquals(4, restored.getMessages().size());
        Message assistant = restored.getMessages().get(2);
        assertEquals("call_1", assistant.getToolCalls().get(0).getId());
        assertEquals("{\"path\":\"a.txt\"}", assistant.getToolCalls().get(0).getArguments());
        assertEquals("read_file", restored.getMessages().get(3).getToolName());
        assertEquals(12, restored.getStats().getSteps());
        assertEquals(List.of("read_file"), restored.getTools());
        assertEquals(Boolean.FALSE, restored.getConfig().get("autoApprove"));
    }

    @Test
    void shouldOverwriteSnapshotOfSameSession() {
        adapter.saveInteraction(snapshot("abc", STARTED));
        SessionSnapshot updated = snapshot("abc", STARTED.plusSeconds(60));
        List<Message> messages = new ArrayList<>(updated.getMessages());
        messages.add(Message.assistant("final answer", null));
        updated.setMessages(messages);

        adapter.saveInteraction(updated);

        assertEquals(5, adapter.loadSession("abc").orElseThrow().getMessages().size());
        assertFalse(Files.exists(sessionsDir.resolve("session_abc.json.tmp")));
        assertTrue(Files.exists(sessionsDir.resolve("session_abc.json")));
    }

    @Test
    void shouldReturnEmptyForUnknownSession() {
        assertTrue(adapter.loadSession("missing").isEmpty());
    }

    @Test
    void shouldRejectUnsafeSessionId() {
        SessionSnapshot snapshot = snapshot("../escape", STARTED);

        assertThrows(IllegalArgumentException.class, () -> adapter.saveInteraction(snapshot));
        assertThrows(IllegalArgumentException.class, () -> adapter.loadSession("a/b"));
    }

    @Test
    void shouldFindLatestSavedSession() throws Exception {
        adapter.saveInteraction(snapshot("old", STARTED.plusSeconds(10)));
        adapter.saveInteraction(snapshot("newest", STARTED.plusSeconds(30)));
        adapter.saveInteraction(snapshot("middle", STARTED.plusSeconds(20)));
        Files.writeString(sessionsDir.resolve("session_broken.json"), "{not json");

        Optional<SessionSnapshot> latest = adapter.findLatestSession();

        assertEquals("newest", latest.orElseThrow().getSessionId());
    }

    @Test
    void shouldReturnEmptyWhenDirectoryMissing() {
        CoderProperties properties = new CoderProperties();
        properties.getStorage().setSessionsDirectory(sessionsDir.resolve("none").toString());

        assertTrue(new JsonSessionLogAdapter(properties, objectMapper).findLatestSession().isEmpty());
    }

    private static SessionSnapshot snapshot(String sessionId, Instant savedAt) {
        AgentStats stats = new AgentStats();
        stats.setSteps(12);
        stats.setSessionPromptTokens(1500);
        List<Message> messages = List.of(
                Message.system("system prompt"),
                Message.user("read a.txt"),
                Message.assistant(null, List.of(Message.ToolCall.builder()
                        .id("call_1")
                        .name("read_file")
                        .arguments("{\"path\":\"a.txt\"}")
                        .build())),
                Message.toolResult("call_1", "read_file", "contents"));
        return SessionSnapshot.builder()
                .sessionId(sessionId)
                .startedAt(STARTED)
                .savedAt(savedAt)
                .model("gpt-4o-mini")
                .mode(AgentMode.PLAN)
                .messages(messages)
                .stats(stats)
                .tools(List.of("read_file"))
                .config(Map.of("autoApprove", false))
                .build();
    }
}

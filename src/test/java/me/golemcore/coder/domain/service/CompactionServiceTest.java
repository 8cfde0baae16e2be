package me.golemcore.coder.domain.service;

import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.ModelBackendException;
import me.golemcore.coder.port.outbound.ModelBackendPort;
import me.golemcore.coder.port.outbound.ModelErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CompactionServiceTest {

    private static final List<Message> MESSAGES = List.of(
            Message.system("You are a coding agent."),
            Message.user("Fix the failing test in ParserTest"),
            Message.assistant("Looking at it", List.of(Message.ToolCall.builder()
                    .id("call_1")
                    .name("read_file")
                    .arguments("{\"path\":\"ParserTest.java\"}")
                    .build())),
            Message.toolResult("call_1", "read_file", "class ParserTest {}"));

    private ModelBackendPort modelBackend;
    private CompactionService service;

    @BeforeEach
    void setUp() {
        modelBackend = mock(ModelBackendPort.class);
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        service = new CompactionService(modelBackend, new CoderProperties(), clock);
    }

    @Test
    void shouldSummarizeTranscriptWithoutTools() {
        when(modelBackend.complete(any())).thenReturn(response("  User wants ParserTest fixed.  "));

        String summary = service.summarize(MESSAGES);

        assertEquals("User wants ParserTest fixed.", summary);
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(modelBackend).complete(captor.capture());
        LlmRequest request = captor.getValue();
        assertTrue(request.getTools().isEmpty());
        assertEquals(2, request.getMessages().size());
        String transcript = request.getMessages().get(1).getContent();
        assertTrue(transcript.startsWith("Transcript:"));
        assertTrue(transcript.contains("user: Fix the failing test in ParserTest"));
        assertTrue(transcript.contains("assistant called read_file {\"path\":\"ParserTest.java\"}"));
        assertTrue(transcript.contains("tool read_file: class ParserTest {}"));
        assertFalse(transcript.contains("You are a coding agent."));
    }

    @Test
    void shouldFallBackWhenSummaryIsEmpty() {
        when(modelBackend.complete(any())).thenReturn(response(" "));

        assertEquals(CompactionService.FALLBACK_SUMMARY, service.summarize(MESSAGES));
    }

    @Test
    void shouldFallBackWhenBackendFails() {
        when(modelBackend.complete(any())).thenThrow(new ModelBackendException(ModelErrorKind.RATE_LIMIT,
                "openai", "https://api.openai.com/v1", "gpt-4o-mini", "Too many requests", null));

        assertEquals(CompactionService.FALLBACK_SUMMARY, service.summarize(MESSAGES));
    }

    @Test
    void shouldTruncateLongMessages() {
        when(modelBackend.complete(any())).thenReturn(response("summary"));

        service.summarize(List.of(Message.user("x".repeat(5000))));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(modelBackend).complete(captor.capture());
        String transcript = captor.getValue().getMessages().get(1).getContent();
        assertTrue(transcript.endsWith("x..."));
        assertTrue(transcript.length() < 2100);
    }

    private static LlmResponse response(String content) {
        return LlmResponse.builder().message(Message.assistant(content, null)).build();
    }
}

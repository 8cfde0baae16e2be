package me.golemcore.coder.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.ModelBackendException;
import me.golemcore.coder.port.outbound.ModelBackendPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Summarizes a conversation so it can be replaced by a two-message history.
 * Falls back to a plain notice when the model cannot produce a summary.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompactionService {

    static final String FALLBACK_SUMMARY = "Earlier conversation was compacted; no summary is available.";

    private static final int MAX_MESSAGE_CHARS = 2000;
    private static final int MAX_SUMMARY_TOKENS = 2000;

    /**
     * Continuation-oriented summary prompt: the summary replaces the history, so
     * it has to carry everything needed to keep working.
     */
    private static final String SYSTEM_PROMPT = """
            Provide a detailed but concise summary of the coding session transcript below.
            Focus on information needed to continue the work.

            Include, when applicable:
            - the user's goal and constraints
            - what has been done: files read, created or changed, commands run and their outcome
            - what is in progress right now
            - decisions made and open problems
            - concrete next steps

            Keep file paths, identifiers and error messages verbatim.
            Do NOT include greetings or meta-commentary. Output only the summary.""";

    private final ModelBackendPort modelBackend;
    private final CoderProperties properties;
    private final Clock clock;

    /**
     * Summarize the messages into a single text.
     */
    public String summarize(List<Message> messages) {
        LlmRequest request = LlmRequest.builder()
                .model(properties.getLlm().getModel())
                .messages(List.of(
                        Message.system(SYSTEM_PROMPT),
                        Message.user("Transcript:\n\n" + formatConversation(messages))))
                .tools(List.of())
                .temperature(0.3)
                .maxTokens(MAX_SUMMARY_TOKENS)
                .build();

        long start = clock.millis();
        try {
            LlmResponse response = modelBackend.complete(request);
            String summary = response.getMessage() != null ? response.getMessage().getContent() : null;
            if (summary == null || summary.isBlank()) {
                log.warn("[Compaction] Model returned empty summary");
                return FALLBACK_SUMMARY;
            }
            log.info("[Compaction] Summarized {} messages in {}ms ({} chars)",
                    messages.size(), clock.millis() - start, summary.length());
            return summary.trim();
        } catch (ModelBackendException e) {
            log.warn("[Compaction] Summarization failed ({}): {}", e.getKind(), e.getMessage());
            return FALLBACK_SUMMARY;
        }
    }

    private String formatConversation(List<Message> messages) {
        return messages.stream()
                .filter(m -> !m.isSystemMessage())
                .map(this::formatMessage)
                .filter(line -> !line.isBlank())
                .collect(Collectors.joining("\n"));
    }

    private String formatMessage(Message message) {
        StringBuilder sb = new StringBuilder();
        if (message.getContent() != null && !message.getContent().isBlank()) {
            String label = message.isToolMessage() ? "tool " + message.getToolName() : message.getRole();
            sb.append(label).append(": ").append(truncate(message.getContent()));
        }
        if (message.hasToolCalls()) {
            for (Message.ToolCall call : message.getToolCalls()) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append("assistant called ").append(call.getName()).append(' ')
                        .append(truncate(call.getArguments()));
            }
        }
        return sb.toString();
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= MAX_MESSAGE_CHARS) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_CHARS) + "...";
    }
}

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

import me.golemcore.coder.domain.loop.MalformedStreamException;
import me.golemcore.coder.domain.model.LlmChunk;
import me.golemcore.coder.domain.model.LlmResponse;
import me.golemcore.coder.domain.model.LlmUsage;
import me.golemcore.coder.domain.model.Message;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reassembles one assistant message from streamed fragments.
 *
 * <ul>
 * <li>text is coalesced and released every {@code batchSize} content
 * fragments, or earlier when tool calls start arriving
 * <li>tool-call arguments are concatenated per index, indices kept in
 * first-seen order
 * <li>the finish reason is the first non-null one seen
 * <li>usage is taken from the last fragment that carries it
 * </ul>
 * An instance serves one response and is not thread-safe.
 */
public class StreamingResponseAccumulator {

    private final int batchSize;

    private final StringBuilder content = new StringBuilder();
    private final StringBuilder pendingText = new StringBuilder();
    private final Map<Integer, Message.ToolCall> toolCalls = new LinkedHashMap<>();
    private int pendingFragments;
    private int fragmentCount;
    private String finishReason;
    private LlmUsage usage;

    public StreamingResponseAccumulator(int batchSize) {
        this.batchSize = Math.max(1, batchSize);
    }

    /**
     * Consumes one fragment.
     *
     * @return coalesced text to publish now, if a batch is complete
     * @throws MalformedStreamException
     *             if a tool-call fragment has no index
     */
    public Optional<String> accept(LlmChunk chunk) {
        fragmentCount++;
        if (chunk.getUsage() != null) {
            usage = chunk.getUsage();
        }
        if (finishReason == null && chunk.getFinishReason() != null) {
            finishReason = chunk.getFinishReason();
        }

        Message delta = chunk.getMessage();
        if (delta != null) {
            if (delta.getContent() != null && !delta.getContent().isEmpty()) {
                content.append(delta.getContent());
                pendingText.append(delta.getContent());
                pendingFragments++;
            }
            if (delta.hasToolCalls()) {
                for (Message.ToolCall call : delta.getToolCalls()) {
                    mergeToolCall(call);
                }
            }
        }

        if (pendingFragments >= batchSize) {
            return flush();
        }
        if (chunk.hasToolCalls() && chunk.getFinishReason() == null) {
            return flush();
        }
        return Optional.empty();
    }

    /**
     * Releases text buffered since the last batch.
     */
    public Optional<String> flush() {
        pendingFragments = 0;
        if (pendingText.length() == 0) {
            return Optional.empty();
        }
        String text = pendingText.toString();
        pendingText.setLength(0);
        return Optional.of(text);
    }

    /**
     * Builds the final message once the fragment sequence has ended.
     *
     * @throws MalformedStreamException
     *             if no fragment arrived or none carried usage
     */
    public LlmResponse finish() {
        if (fragmentCount == 0) {
            throw new MalformedStreamException("Streamed completion returned no chunks");
        }
        if (usage == null) {
            throw new MalformedStreamException(
                    "Usage data missing from streamed completion (" + fragmentCount + " chunks received)");
        }
        Message message = Message.assistant(
                content.length() > 0 ? content.toString() : null,
                toolCalls.isEmpty() ? null : new ArrayList<>(toolCalls.values()));
        return LlmResponse.builder()
                .message(message)
                .usage(usage)
                .finishReason(finishReason)
                .build();
    }

    private void mergeToolCall(Message.ToolCall call) {
        Integer index = call.getIndex();
        if (index == null) {
            throw new MalformedStreamException("Tool call chunk missing index (chunk " + fragmentCount
                    + ", tool " + call.getName() + ", id " + call.getId() + ")");
        }
        Message.ToolCall existing = toolCalls.get(index);
        if (existing == null) {
            toolCalls.put(index, Message.ToolCall.builder()
                    .index(index)
                    .id(call.getId())
                    .name(call.getName())
                    .arguments(call.getArguments() != null ? call.getArguments() : "")
                    .build());
            return;
        }
        if (existing.getId() == null && call.getId() != null) {
            existing.setId(call.getId());
        }
        if (existing.getName() == null && call.getName() != null) {
            existing.setName(call.getName());
        }
        if (call.getArguments() != null) {
            existing.setArguments(existing.getArguments() + call.getArguments());
        }
    }
}

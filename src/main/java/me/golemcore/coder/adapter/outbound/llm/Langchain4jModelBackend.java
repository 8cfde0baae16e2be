package me.golemcore.coder.adapter.outbound.llm;

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

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.LlmChunk;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;
import me.golemcore.coder.domain.model.LlmUsage;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.domain.service.LlmErrorClassifier;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.ModelBackendPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Model backend for any OpenAI-compatible endpoint, built on langchain4j.
 *
 * <p>
 * langchain4j delivers tool calls only with the completed response, so a
 * streamed answer is text fragments followed by one fragment per tool call and
 * a final fragment with usage and finish reason.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code coder.llm.base-url} - Endpoint, e.g. https://api.openai.com/v1
 * <li>{@code coder.llm.api-key} - API key
 * <li>{@code coder.llm.model} - Model name
 * <li>{@code coder.llm.request-timeout-seconds} - HTTP timeout
 * </ul>
 * Provider failures are rethrown as classified
 * {@link me.golemcore.coder.port.outbound.ModelBackendException}s. Nothing is
 * retried here.
 */
@Component
@Slf4j
public class Langchain4jModelBackend implements ModelBackendPort {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String EMPTY_TOOL_RESULT = "(empty)";

    private final CoderProperties.LlmProperties config;

    private ChatModel chatModel;
    private StreamingChatModel streamingModel;

    public Langchain4jModelBackend(CoderProperties properties) {
        this.config = properties.getLlm();
    }

    @Override
    public String getProviderId() {
        return config.getProvider();
    }

    @Override
    public String getEndpoint() {
        return config.getBaseUrl();
    }

    @Override
    public LlmResponse complete(LlmRequest request) {
        ChatRequest chatRequest = toChatRequest(request);
        try {
            ChatResponse response = chatModel().chat(chatRequest);
            return convertResponse(response);
        } catch (RuntimeException e) {
            log.warn("[LLM] Completion failed: {}", e.getMessage());
            throw LlmErrorClassifier.toBackendException(e, getProviderId(), getEndpoint(), modelName(request));
        }
    }

    @Override
    public Flux<LlmChunk> completeStreaming(LlmRequest request) {
        return Flux.create(sink -> {
            ChatRequest chatRequest = toChatRequest(request);
            try {
                streamingModel().chat(chatRequest, new StreamingChatResponseHandler() {
                    @Override
                    public void onPartialResponse(String partialResponse) {
                        sink.next(LlmChunk.builder()
                                .message(Message.builder().role(Message.ROLE_ASSISTANT).content(partialResponse)
                                        .build())
                                .build());
                    }

                    @Override
                    public void onCompleteResponse(ChatResponse response) {
                        AiMessage aiMessage = response.aiMessage();
                        if (aiMessage != null && aiMessage.hasToolExecutionRequests()) {
                            List<ToolExecutionRequest> requests = aiMessage.toolExecutionRequests();
                            for (int i = 0; i < requests.size(); i++) {
                                sink.next(LlmChunk.builder()
                                        .message(Message.assistant(null, List.of(toToolCall(requests.get(i), i))))
                                        .build());
                            }
                        }
                        sink.next(LlmChunk.builder()
                                .usage(convertUsage(response.tokenUsage()))
                                .finishReason(convertFinishReason(response.finishReason()))
                                .build());
                        sink.complete();
                    }

                    @Override
                    public void onError(Throwable error) {
                        log.warn("[Stream] Streaming completion failed: {}", error.getMessage());
                        sink.error(LlmErrorClassifier.toBackendException(error, getProviderId(), getEndpoint(),
                                modelName(request)));
                    }
                });
            } catch (RuntimeException e) {
                sink.error(LlmErrorClassifier.toBackendException(e, getProviderId(), getEndpoint(),
                        modelName(request)));
            }
        });
    }

    private synchronized ChatModel chatModel() {
        if (chatModel == null) {
            var builder = OpenAiChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .temperature(config.getTemperature())
                    .maxRetries(0)
                    .timeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()));
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (config.getMaxTokens() != null) {
                builder.maxTokens(config.getMaxTokens());
            }
            chatModel = builder.build();
            log.info("[LLM] Initialized {} model {} at {}", config.getProvider(), config.getModel(),
                    config.getBaseUrl());
        }
        return chatModel;
    }

    private synchronized StreamingChatModel streamingModel() {
        if (streamingModel == null) {
            var builder = OpenAiStreamingChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .temperature(config.getTemperature())
                    .timeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()));
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (config.getMaxTokens() != null) {
                builder.maxTokens(config.getMaxTokens());
            }
            streamingModel = builder.build();
            log.info("[LLM] Initialized streaming {} model {}", config.getProvider(), config.getModel());
        }
        return streamingModel;
    }

    private String modelName(LlmRequest request) {
        return request.getModel() != null ? request.getModel() : config.getModel();
    }

    // ==================== Request conversion ====================

    ChatRequest toChatRequest(LlmRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(convertMessages(request.getMessages()))
                .modelName(modelName(request))
                .temperature(request.getTemperature());
        if (request.getMaxTokens() != null) {
            builder.maxOutputTokens(request.getMaxTokens());
        }
        List<ToolSpecification> tools = convertTools(request.getTools());
        if (!tools.isEmpty()) {
            builder.toolSpecifications(tools);
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(List<Message> messages) {
        List<ChatMessage> converted = new ArrayList<>();
        for (Message msg : messages) {
            switch (msg.getRole()) {
            case Message.ROLE_SYSTEM -> converted.add(SystemMessage.from(msg.getContent()));
            case Message.ROLE_USER -> converted.add(UserMessage.from(msg.getContent()));
            case Message.ROLE_ASSISTANT -> converted.add(convertAssistant(msg));
            case Message.ROLE_TOOL -> converted.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    msg.getContent() == null || msg.getContent().isEmpty() ? EMPTY_TOOL_RESULT : msg.getContent()));
            default -> log.warn("[LLM] Unknown message role: {}, message skipped", msg.getRole());
            }
        }
        return converted;
    }

    private static AiMessage convertAssistant(Message msg) {
        String text = msg.getContent();
        if (!msg.hasToolCalls()) {
            return AiMessage.from(text != null ? text : "");
        }
        List<ToolExecutionRequest> requests = msg.getToolCalls().stream()
                .map(tc -> ToolExecutionRequest.builder()
                        .id(tc.getId())
                        .name(tc.getName())
                        .arguments(tc.getArguments() == null || tc.getArguments().isBlank() ? "{}" : tc.getArguments())
                        .build())
                .toList();
        if (text == null || text.isBlank()) {
            return AiMessage.from(requests);
        }
        return AiMessage.from(text, requests);
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream().map(this::convertToolDefinition).toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                schemaBuilder.addProperty(String.valueOf(entry.getKey()),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
                schemaBuilder.required(required.stream().map(String::valueOf).toList());
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = paramSchema.get("type") instanceof String t ? t : "string";
        String description = paramSchema.get("description") instanceof String d && !d.isBlank() ? d : null;

        if (paramSchema.get("enum") instanceof List<?> enumValues && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(enumValues.stream().map(String::valueOf).toList())
                    .description(description)
                    .build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    // ==================== Response conversion ====================

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            List<ToolExecutionRequest> requests = aiMessage.toolExecutionRequests();
            toolCalls = new ArrayList<>(requests.size());
            for (int i = 0; i < requests.size(); i++) {
                toolCalls.add(toToolCall(requests.get(i), i));
            }
        }
        return LlmResponse.builder()
                .message(Message.assistant(aiMessage.text(), toolCalls))
                .usage(convertUsage(response.tokenUsage()))
                .finishReason(convertFinishReason(response.finishReason()))
                .build();
    }

    private static Message.ToolCall toToolCall(ToolExecutionRequest request, int index) {
        return Message.ToolCall.builder()
                .index(index)
                .id(request.id())
                .name(request.name())
                .arguments(request.arguments())
                .build();
    }

    static LlmUsage convertUsage(TokenUsage usage) {
        if (usage == null) {
            return null;
        }
        return LlmUsage.of(
                usage.inputTokenCount() != null ? usage.inputTokenCount() : 0,
                usage.outputTokenCount() != null ? usage.outputTokenCount() : 0);
    }

    static String convertFinishReason(FinishReason reason) {
        if (reason == null) {
            return "stop";
        }
        return switch (reason) {
        case TOOL_EXECUTION -> "tool_calls";
        case LENGTH -> "length";
        case CONTENT_FILTER -> "content_filter";
        default -> "stop";
        };
    }
}

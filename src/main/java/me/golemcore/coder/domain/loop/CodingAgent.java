package me.golemcore.coder.domain.loop;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.component.ToolComponent;
import me.golemcore.coder.domain.component.ToolContext;
import me.golemcore.coder.domain.component.ToolValidationException;
import me.golemcore.coder.domain.middleware.AutoCompactMiddleware;
import me.golemcore.coder.domain.middleware.MiddlewareContext;
import me.golemcore.coder.domain.middleware.MiddlewarePipeline;
import me.golemcore.coder.domain.middleware.ResetReason;
import me.golemcore.coder.domain.mode.ModeManager;
import me.golemcore.coder.domain.model.AgentEvent;
import me.golemcore.coder.domain.model.AgentMode;
import me.golemcore.coder.domain.model.AgentStats;
import me.golemcore.coder.domain.model.ApprovalDecision;
import me.golemcore.coder.domain.model.ApprovalVerdict;
import me.golemcore.coder.domain.model.AssistantEvent;
import me.golemcore.coder.domain.model.AuthorizationDecision;
import me.golemcore.coder.domain.model.CompactEndEvent;
import me.golemcore.coder.domain.model.CompactStartEvent;
import me.golemcore.coder.domain.model.Conversation;
import me.golemcore.coder.domain.model.LlmChunk;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.MiddlewareResult;
import me.golemcore.coder.domain.model.SessionSnapshot;
import me.golemcore.coder.domain.model.ToolCallEvent;
import me.golemcore.coder.domain.model.ToolFailureKind;
import me.golemcore.coder.domain.model.ToolResult;
import me.golemcore.coder.domain.model.ToolResultEvent;
import me.golemcore.coder.domain.service.ApprovalGate;
import me.golemcore.coder.domain.service.CompactionService;
import me.golemcore.coder.domain.service.LlmErrorClassifier;
import me.golemcore.coder.domain.service.StreamingResponseAccumulator;
import me.golemcore.coder.domain.service.ToolAuthorizer;
import me.golemcore.coder.domain.service.ToolRegistry;
import me.golemcore.coder.domain.service.command.SecureCommandExecutor;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.InteractionLogPort;
import me.golemcore.coder.port.outbound.ModelBackendPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Turn execution engine of one coding session.
 *
 * <p>
 * Each call to {@link #act(String)} appends the user message and loops over
 * model turns:
 * <ol>
 * <li>before-turn middleware (stop, inject a reminder, or compact)
 * <li>one model query, streamed or not, producing one assistant message
 * <li>authorization and execution of every tool call, results appended in the
 * order the calls were declared
 * <li>persistence of the session, then after-turn middleware
 * </ol>
 * The loop ends when the assistant answers without tool calls, or when a
 * middleware stops it. Engine failures are persisted, then rethrown to the
 * caller.
 *
 * <p>
 * The conversation is owned by this instance. A {@link ReentrantLock} keeps a
 * single turn (or compaction, or clear) running at a time.
 */
@Slf4j
public class CodingAgent {

    public static final String CANCELLED_MESSAGE = "Cancelled by user";

    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };
    private static final String SKIPPED_BY_USER = "Tool execution skipped by user";
    private static final String LAST_REQUEST_PREFIX = "\n\nLast request from user was: ";

    private final ReentrantLock turnLock = new ReentrantLock();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicInteger pendingTurns = new AtomicInteger();
    private final Object cancelMonitor = new Object();
    private final Set<String> inFlightApprovals = ConcurrentHashMap.newKeySet();

    private final AgentStats stats;
    private final ModeManager modeManager;
    private final ToolAuthorizer authorizer;
    private final ToolRegistry toolRegistry;
    private final ApprovalGate approvalGate;
    private final ModelBackendPort modelBackend;
    private final InteractionLogPort interactionLog;
    private final CompactionService compactionService;
    private final MiddlewarePipeline pipeline;
    private final SecureCommandExecutor commandExecutor;
    private final ObjectMapper objectMapper;
    private final CoderProperties properties;
    private final Path workspace;
    private final Clock clock;

    private volatile String sessionId;
    private volatile Instant startedAt;
    private Conversation conversation;

    @Builder
    CodingAgent(Conversation conversation, AgentStats stats, ModeManager modeManager, ToolAuthorizer authorizer,
            ToolRegistry toolRegistry, ApprovalGate approvalGate, ModelBackendPort modelBackend,
            InteractionLogPort interactionLog, CompactionService compactionService, MiddlewarePipeline pipeline,
            SecureCommandExecutor commandExecutor, ObjectMapper objectMapper, CoderProperties properties,
            Path workspace, Clock clock) {
        this.conversation = conversation;
        this.stats = stats;
        this.modeManager = modeManager;
        this.authorizer = authorizer;
        this.toolRegistry = toolRegistry;
        this.approvalGate = approvalGate;
        this.modelBackend = modelBackend;
        this.interactionLog = interactionLog;
        this.compactionService = compactionService;
        this.pipeline = pipeline;
        this.commandExecutor = commandExecutor;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.workspace = workspace.toAbsolutePath().normalize();
        this.clock = clock;
        this.sessionId = newSessionId();
        this.startedAt = clock.instant();
    }

    /**
     * Runs one user request. The returned sequence is cold: nothing happens
     * until it is subscribed, and it can be subscribed only once. Cancelling the
     * subscription cancels the turn.
     */
    public Flux<AgentEvent> act(String userText) {
        AtomicBoolean subscribed = new AtomicBoolean();
        return Flux.<AgentEvent>create(sink -> {
            if (!subscribed.compareAndSet(false, true)) {
                sink.error(new IllegalStateException("Turn event stream can only be subscribed once"));
                return;
            }
            pendingTurns.incrementAndGet();
            sink.onCancel(this::cancel);
            Schedulers.boundedElastic().schedule(() -> {
                try {
                    runTurn(userText, sink::next);
                    sink.complete();
                } catch (RuntimeException e) {
                    sink.error(e);
                }
            });
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    /**
     * Runs one user request on the calling thread, publishing events to
     * {@code events}.
     */
    public void act(String userText, Consumer<AgentEvent> events) {
        pendingTurns.incrementAndGet();
        runTurn(userText, events);
    }

    private void runTurn(String userText, Consumer<AgentEvent> events) {
        turnLock.lock();
        try {
            conversation.append(Message.user(userText));
            runLoop(events);
        } catch (RuntimeException e) {
            log.error("[Agent] Turn failed in session {}: {}", sessionId, e.getMessage());
            persist();
            throw e;
        } finally {
            finishTurn();
            turnLock.unlock();
        }
    }

    // The cancel flag outlives a turn only while another one is queued.
    private void finishTurn() {
        synchronized (cancelMonitor) {
            if (pendingTurns.decrementAndGet() == 0) {
                cancelRequested.set(false);
            }
        }
    }

    /**
     * Stops dispatch of further tool calls and denies approvals that are being
     * waited on. The running turn persists and returns at its next boundary.
     */
    public void cancel() {
        synchronized (cancelMonitor) {
            if (pendingTurns.get() == 0) {
                log.debug("[Agent] Cancel ignored, no turn running in session {}", sessionId);
                return;
            }
            if (cancelRequested.compareAndSet(false, true)) {
                log.info("[Agent] Cancel requested for session {}", sessionId);
            }
        }
        for (String correlationId : inFlightApprovals) {
            approvalGate.cancel(correlationId, CANCELLED_MESSAGE);
        }
    }

    /**
     * Replaces the conversation with the system message and a summary of it.
     * Starts a new session id.
     *
     * @return the summary text now held in the conversation
     */
    public String compact() {
        turnLock.lock();
        try {
            persist();
            List<Message> messages = conversation.snapshot();
            String lastRequest = lastUserRequest(messages);
            String summary = compactionService.summarize(messages);
            String content = lastRequest != null ? summary + LAST_REQUEST_PREFIX + lastRequest : summary;

            long oldTokens = stats.getContextTokens();
            conversation.replaceWithSummary(content);
            stats.setContextTokens(modelBackend.countTokens(conversation.getMessages()));

            String previousSession = sessionId;
            sessionId = newSessionId();
            startedAt = clock.instant();
            persist();
            pipeline.reset(ResetReason.COMPACT);
            log.info("[Agent] Compacted session {} into {}: {} -> {} tokens", previousSession, sessionId,
                    oldTokens, stats.getContextTokens());
            return content;
        } finally {
            turnLock.unlock();
        }
    }

    /**
     * Drops everything but the system message and starts a new session.
     */
    public void clearHistory() {
        turnLock.lock();
        try {
            persist();
            conversation.truncateToSystem();
            stats.reset();
            pipeline.reset(ResetReason.CLEAR);
            authorizer.clearGrants();
            commandExecutor.resetWorkdir();
            sessionId = newSessionId();
            startedAt = clock.instant();
            log.info("[Agent] History cleared, new session {}", sessionId);
        } finally {
            turnLock.unlock();
        }
    }

    /**
     * Continues a persisted session: its id, messages, counters and mode.
     */
    public void resumeFrom(SessionSnapshot snapshot) {
        turnLock.lock();
        try {
            conversation = Conversation.restore(snapshot.getMessages());
            if (snapshot.getStats() != null) {
                stats.restoreCounters(snapshot.getStats());
            }
            if (snapshot.getMode() != null) {
                modeManager.setMode(snapshot.getMode());
            }
            sessionId = snapshot.getSessionId();
            startedAt = snapshot.getStartedAt() != null ? snapshot.getStartedAt() : clock.instant();
            log.info("[Agent] Resumed session {} ({} messages)", sessionId, conversation.size());
        } finally {
            turnLock.unlock();
        }
    }

    /**
     * @return message describing the transition
     */
    public String setMode(AgentMode mode) {
        AgentMode previous = modeManager.setMode(mode);
        return ModeManager.getTransitionMessage(previous, mode);
    }

    public String cycleMode() {
        AgentMode previous = modeManager.getMode();
        AgentMode next = modeManager.cycleMode();
        return ModeManager.getTransitionMessage(previous, next);
    }

    public Conversation getConversation() {
        return conversation;
    }

    public AgentStats getStats() {
        return stats;
    }

    public String getSessionId() {
        return sessionId;
    }

    public ModeManager getModeManager() {
        return modeManager;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    // ==================== Loop ====================

    private void runLoop(Consumer<AgentEvent> events) {
        while (true) {
            if (cancelRequested.get()) {
                log.info("[Agent] Turn cancelled before model query");
                persist();
                return;
            }

            if (applyMiddleware(pipeline.runBeforeTurn(middlewareContext()), events)) {
                persist();
                return;
            }

            checkSynchronized();
            stats.setSteps(stats.getSteps() + 1);

            LlmResponse response = queryModel(events);
            Message assistant = response.getMessage();
            conversation.append(assistant);

            if (assistant.hasToolCalls()) {
                handleToolCalls(assistant.getToolCalls(), events);
            }
            persist();

            if (cancelRequested.get()) {
                log.info("[Agent] Turn cancelled after {} tool call(s)",
                        assistant.hasToolCalls() ? assistant.getToolCalls().size() : 0);
                return;
            }

            if (applyMiddleware(pipeline.runAfterTurn(middlewareContext()), events)) {
                persist();
                return;
            }

            // Tool results have to go back to the model, so only a non-tool tail ends the turn.
            if (!conversation.last().isToolMessage()
                    && (response.getFinishReason() != null || !assistant.hasToolCalls())) {
                return;
            }
        }
    }

    /**
     * @return true if the loop has to stop
     */
    private boolean applyMiddleware(MiddlewareResult result, Consumer<AgentEvent> events) {
        switch (result.getAction()) {
        case STOP -> {
            log.info("[Agent] Stopped by middleware: {}", result.getReason());
            events.accept(AssistantEvent.stopped(result.getReason()));
            return true;
        }
        case INJECT_MESSAGE -> conversation.appendToLast(result.getMessage());
        case COMPACT -> {
            long oldTokens = stats.getContextTokens();
            Object threshold = result.getMetadata().get(AutoCompactMiddleware.THRESHOLD);
            events.accept(new CompactStartEvent(oldTokens,
                    threshold instanceof Number number ? number.longValue() : 0L));
            String summary = compact();
            events.accept(new CompactEndEvent(oldTokens, stats.getContextTokens(), summary.length()));
        }
        case CONTINUE -> {
            // nothing to do
        }
        }
        return false;
    }

    private void checkSynchronized() {
        if (conversation.size() <= 1) {
            throw new ConversationDesyncException("Conversation history is empty; cannot query the model.");
        }
        Message last = conversation.last();
        if (!last.isUserMessage() && !last.isToolMessage()) {
            throw new ConversationDesyncException("Conversation desynchronised (last message role is '"
                    + last.getRole() + "'). Run /clear and try again.");
        }
    }

    private MiddlewareContext middlewareContext() {
        return new MiddlewareContext(conversation, stats, modeManager.getMode());
    }

    // ==================== Model ====================

    private LlmResponse queryModel(Consumer<AgentEvent> events) {
        LlmRequest request = buildRequest();
        CoderProperties.LlmProperties llm = properties.getLlm();
        long start = clock.millis();
        LlmResponse response;
        try {
            if (llm.isStreaming() && modelBackend.supportsStreaming()) {
                response = streamResponse(request, events);
            } else {
                response = completeResponse(request, events);
            }
        } catch (AgentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw LlmErrorClassifier.toBackendException(e, modelBackend.getProviderId(),
                    modelBackend.getEndpoint(), request.getModel());
        }

        if (response.getUsage() != null) {
            stats.recordUsage(response.getUsage());
        }
        Message message = response.getMessage() != null ? response.getMessage() : Message.assistant(null, null);
        assignToolCallIds(message);
        response.setMessage(message);
        log.debug("[Agent] Model answered in {}ms (finish: {}, tool calls: {})", clock.millis() - start,
                response.getFinishReason(), message.hasToolCalls() ? message.getToolCalls().size() : 0);
        return response;
    }

    private LlmRequest buildRequest() {
        List<Message> messages = conversation.snapshot();
        String modifier = modeManager.getSystemPromptModifier();
        if (modifier != null) {
            messages.set(0, Message.system(conversation.getSystemMessage().getContent() + "\n\n" + modifier));
        }
        CoderProperties.LlmProperties llm = properties.getLlm();
        return LlmRequest.builder()
                .model(llm.getModel())
                .messages(messages)
                .tools(toolRegistry.getDefinitions())
                .temperature(llm.getTemperature())
                .maxTokens(llm.getMaxTokens())
                .build();
    }

    private LlmResponse streamResponse(LlmRequest request, Consumer<AgentEvent> events) {
        CoderProperties.AgentProperties agent = properties.getAgent();
        int batchSize = agent.isDeterministicStreaming() ? 1 : agent.getStreamBatchSize();
        StreamingResponseAccumulator accumulator = new StreamingResponseAccumulator(batchSize);
        for (LlmChunk chunk : modelBackend.completeStreaming(request).toIterable()) {
            accumulator.accept(chunk).ifPresent(text -> events.accept(AssistantEvent.text(text)));
        }
        accumulator.flush().ifPresent(text -> events.accept(AssistantEvent.text(text)));
        return accumulator.finish();
    }

    private LlmResponse completeResponse(LlmRequest request, Consumer<AgentEvent> events) {
        LlmResponse response = modelBackend.complete(request);
        Message message = response.getMessage();
        if (message != null && message.getContent() != null && !message.getContent().isEmpty()) {
            events.accept(AssistantEvent.text(message.getContent()));
        }
        return response;
    }

    /**
     * Gives every tool call of {@code message} a distinct id, replacing missing
     * and repeated ones.
     */
    private static void assignToolCallIds(Message message) {
        if (!message.hasToolCalls()) {
            return;
        }
        Set<String> seen = new HashSet<>();
        for (Message.ToolCall call : message.getToolCalls()) {
            if (call.getId() == null || call.getId().isBlank() || !seen.add(call.getId())) {
                call.setId("call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24));
                seen.add(call.getId());
            }
        }
    }

    // ==================== Tools ====================

    private void handleToolCalls(List<Message.ToolCall> calls, Consumer<AgentEvent> events) {
        boolean parallel = properties.getAgent().isParallelToolExecution();
        List<DispatchedCall> dispatched = new ArrayList<>(calls.size());

        for (Message.ToolCall call : calls) {
            if (cancelRequested.get()) {
                dispatched.add(new DispatchedCall(call, CompletableFuture.completedFuture(ToolOutcome.skipped(
                        ToolFailureKind.CANCELLED, CANCELLED_MESSAGE, Duration.ZERO))));
                continue;
            }
            events.accept(new ToolCallEvent(call.getId(), call.getName(), call.getArguments()));
            CompletableFuture<ToolOutcome> outcome = dispatch(call);
            if (!parallel || usesCommandExecutor(call)) {
                outcome.join();
            }
            dispatched.add(new DispatchedCall(call, outcome));
        }

        for (DispatchedCall entry : dispatched) {
            ToolOutcome outcome = entry.outcome().join();
            Message.ToolCall call = entry.call();
            String content = truncateOutput(outcome.content());
            conversation.append(Message.toolResult(call.getId(), call.getName(), content));
            if (!outcome.skipped()) {
                if (outcome.result().isSuccess()) {
                    stats.setToolCallsSucceeded(stats.getToolCallsSucceeded() + 1);
                } else {
                    stats.setToolCallsFailed(stats.getToolCallsFailed() + 1);
                }
            }
            events.accept(new ToolResultEvent(call.getId(), call.getName(), content,
                    !outcome.skipped() && !outcome.result().isSuccess(), outcome.skipped(),
                    outcome.skipped() ? outcome.content() : null, outcome.duration()));
        }
    }

    // Command tools share the working directory of the session executor.
    private boolean usesCommandExecutor(Message.ToolCall call) {
        return toolRegistry.getTool(call.getName())
                .map(ToolComponent::usesCommandExecutor)
                .orElse(false);
    }

    private CompletableFuture<ToolOutcome> dispatch(Message.ToolCall call) {
        Instant start = clock.instant();
        String toolName = call.getName();

        Optional<ToolComponent> found = toolRegistry.getTool(toolName);
        if (found.isEmpty()) {
            log.warn("[Tools] Model called unknown tool '{}'", toolName);
            return failed(ToolFailureKind.INVALID_ARGUMENTS, "Unknown tool '" + toolName + "'. Available tools: "
                    + String.join(", ", toolRegistry.getToolNames()), start);
        }
        ToolComponent tool = found.get();

        Map<String, Object> arguments;
        try {
            arguments = parseArguments(call.getArguments());
            tool.validate(arguments);
        } catch (JsonProcessingException e) {
            return failed(ToolFailureKind.INVALID_ARGUMENTS,
                    "Invalid JSON arguments for tool '" + toolName + "': " + e.getOriginalMessage(), start);
        } catch (ToolValidationException e) {
            return failed(ToolFailureKind.INVALID_ARGUMENTS,
                    "Invalid arguments for tool '" + toolName + "': " + e.getMessage(), start);
        }

        AuthorizationDecision decision = authorizer.authorize(toolName, arguments, call.getId());
        if (decision.isSkip()) {
            stats.setToolCallsRejected(stats.getToolCallsRejected() + 1);
            return CompletableFuture.completedFuture(ToolOutcome.skipped(ToolFailureKind.POLICY_DENIED,
                    decision.reason(), elapsedSince(start)));
        }
        if (decision.isAwaitApproval()) {
            ApprovalDecision approval = awaitApproval(toolName, arguments, call.getId());
            if (approval.verdict() == ApprovalVerdict.ALWAYS) {
                authorizer.grantAlways(toolName);
            }
            if (!approval.isApproved()) {
                stats.setToolCallsRejected(stats.getToolCallsRejected() + 1);
                ToolFailureKind kind = cancelRequested.get()
                        ? ToolFailureKind.CANCELLED
                        : ToolFailureKind.CONFIRMATION_DENIED;
                String message = approval.message();
                String reason = message != null && !message.isBlank()
                        ? SKIPPED_BY_USER + ": " + message
                        : SKIPPED_BY_USER;
                return CompletableFuture.completedFuture(ToolOutcome.skipped(kind, reason, elapsedSince(start)));
            }
        }

        stats.setToolCallsAgreed(stats.getToolCallsAgreed() + 1);
        ToolContext context = new ToolContext(sessionId, workspace, commandExecutor);
        CompletableFuture<ToolResult> execution;
        try {
            execution = tool.execute(context, arguments);
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        return execution.handle((result, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                log.warn("[Tools] '{}' failed: {}", toolName, cause.getMessage());
                return ToolOutcome.executed(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()),
                        elapsedSince(start));
            }
            return ToolOutcome.executed(result, elapsedSince(start));
        });
    }

    private ApprovalDecision awaitApproval(String toolName, Map<String, Object> arguments, String toolCallId) {
        // The gate is shared by all sessions and tool-call ids repeat across them.
        String correlationId = sessionId + ":" + toolCallId;
        CompletableFuture<ApprovalDecision> future = approvalGate.requestApproval(toolName, arguments,
                correlationId);
        inFlightApprovals.add(correlationId);
        int timeoutSeconds = properties.getApproval().getTimeoutSeconds();
        try {
            if (cancelRequested.get()) {
                approvalGate.cancel(correlationId, CANCELLED_MESSAGE);
            }
            return timeoutSeconds > 0 ? future.get(timeoutSeconds, TimeUnit.SECONDS) : future.get();
        } catch (TimeoutException e) {
            approvalGate.cancel(correlationId, "Approval timed out after " + timeoutSeconds + "s");
            return future.getNow(ApprovalDecision.no("Approval timed out"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelRequested.set(true);
            approvalGate.cancel(correlationId, CANCELLED_MESSAGE);
            return ApprovalDecision.no(CANCELLED_MESSAGE);
        } catch (ExecutionException e) {
            log.warn("[Approval] Waiting for {} failed: {}", correlationId, e.getCause().getMessage());
            return ApprovalDecision.no("Approval failed: " + e.getCause().getMessage());
        } finally {
            inFlightApprovals.remove(correlationId);
        }
    }

    private Map<String, Object> parseArguments(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        LinkedHashMap<String, Object> parsed = objectMapper.readValue(json, ARGUMENTS_TYPE);
        return parsed != null ? parsed : new LinkedHashMap<>();
    }

    private String truncateOutput(String content) {
        int max = properties.getTools().getMaxOutputChars();
        if (max <= 0 || content.length() <= max) {
            return content;
        }
        return content.substring(0, max) + "\n... [output truncated: " + (content.length() - max)
                + " characters omitted]";
    }

    private CompletableFuture<ToolOutcome> failed(ToolFailureKind kind, String message, Instant start) {
        log.debug("[Tools] {}", message);
        return CompletableFuture.completedFuture(
                ToolOutcome.executed(ToolResult.failure(kind, message), elapsedSince(start)));
    }

    private Duration elapsedSince(Instant start) {
        return Duration.between(start, clock.instant());
    }

    // ==================== Persistence ====================

    private void persist() {
        try {
            interactionLog.saveInteraction(snapshot());
        } catch (Exception e) { // NOSONAR - persistence failure must not end the turn
            log.error("[Session] Failed to persist session {}", sessionId, e);
        }
    }

    private SessionSnapshot snapshot() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("autoApprove", modeManager.isAutoApprove());
        config.put("maxTurns", properties.getAgent().getMaxTurns());
        config.put("maxPrice", properties.getAgent().getMaxPrice());
        config.put("autoCompactThreshold", properties.getAgent().getAutoCompactThreshold());
        config.put("workspace", workspace.toString());
        return SessionSnapshot.builder()
                .sessionId(sessionId)
                .startedAt(startedAt)
                .savedAt(clock.instant())
                .model(properties.getLlm().getModel())
                .mode(modeManager.getMode())
                .messages(conversation.snapshot())
                .stats(stats)
                .tools(toolRegistry.getToolNames())
                .config(config)
                .build();
    }

    private static String lastUserRequest(List<Message> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.isUserMessage() && message.getContent() != null && !message.getContent().isBlank()) {
                return message.getContent();
            }
        }
        return null;
    }

    private static String newSessionId() {
        return UUID.randomUUID().toString();
    }

    private record DispatchedCall(Message.ToolCall call, CompletableFuture<ToolOutcome> outcome) {
    }

    /**
     * Result of one call; skipped calls never reached the tool.
     */
    private record ToolOutcome(ToolResult result, boolean skipped, String content, Duration duration) {

        static ToolOutcome executed(ToolResult result, Duration duration) {
            return new ToolOutcome(result, false, result.toMessageContent(), duration);
        }

        static ToolOutcome skipped(ToolFailureKind kind, String reason, Duration duration) {
            return new ToolOutcome(ToolResult.failure(kind, reason), true, reason, duration);
        }
    }
}

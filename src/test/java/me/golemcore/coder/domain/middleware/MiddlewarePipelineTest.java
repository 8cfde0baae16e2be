package me.golemcore.coder.domain.middleware;

import me.golemcore.coder.domain.model.AgentMode;
import me.golemcore.coder.domain.model.AgentStats;
import me.golemcore.coder.domain.model.Conversation;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.MiddlewareResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MiddlewarePipelineTest {

    private AgentStats stats;
    private MiddlewareContext context;

    @BeforeEach
    void setUp() {
        stats = new AgentStats();
        Conversation conversation = new Conversation(Message.system("system"));
        conversation.append(Message.user("hello"));
        context = new MiddlewareContext(conversation, stats, AgentMode.NORMAL);
    }

    @Test
    void shouldStopAfterConfiguredTurns() {
        TurnLimitMiddleware limit = new TurnLimitMiddleware(2);

        assertTrue(limit.beforeTurn(context).isContinue());
        assertTrue(limit.beforeTurn(context).isContinue());
        MiddlewareResult third = limit.beforeTurn(context);

        assertEquals(MiddlewareResult.Action.STOP, third.getAction());
        assertEquals("Turn limit of 2 reached", third.getReason());
        assertEquals(2, limit.getTurnsTaken());
    }

    @Test
    void shouldKeepTurnCountAcrossCompactionButResetOnClear() {
        TurnLimitMiddleware limit = new TurnLimitMiddleware(1);
        limit.beforeTurn(context);

        limit.reset(ResetReason.COMPACT);
        assertFalse(limit.beforeTurn(context).isContinue());

        limit.reset(ResetReason.CLEAR);
        assertTrue(limit.beforeTurn(context).isContinue());
    }

    @Test
    void shouldStopWhenPriceExceeded() {
        stats.setInputPricePerMillion(10.0);
        stats.setSessionPromptTokens(200_000);
        PriceLimitMiddleware limit = new PriceLimitMiddleware(1.0);

        MiddlewareResult result = limit.beforeTurn(context);

        assertEquals(MiddlewareResult.Action.STOP, result.getAction());
        assertTrue(result.getReason().startsWith("Price limit exceeded: $2.0000 > $1.00"));
    }

    @Test
    void shouldContinueWithinPrice() {
        stats.setInputPricePerMillion(10.0);
        stats.setSessionPromptTokens(50_000);

        assertTrue(new PriceLimitMiddleware(1.0).beforeTurn(context).isContinue());
    }

    @Test
    void shouldRequestCompactionAtThreshold() {
        AutoCompactMiddleware compact = new AutoCompactMiddleware(1000);
        stats.setContextTokens(999);
        assertTrue(compact.beforeTurn(context).isContinue());

        stats.setContextTokens(1000);
        MiddlewareResult result = compact.beforeTurn(context);

        assertEquals(MiddlewareResult.Action.COMPACT, result.getAction());
        assertEquals(1000L, result.getMetadata().get(AutoCompactMiddleware.OLD_TOKENS));
        assertEquals(1000L, result.getMetadata().get(AutoCompactMiddleware.THRESHOLD));
    }

    @Test
    void shouldWarnOnceUntilReset() {
        ContextWarningMiddleware warning = new ContextWarningMiddleware(0.5, 1000);
        stats.setContextTokens(400);
        assertTrue(warning.beforeTurn(context).isContinue());

        stats.setContextTokens(600);
        MiddlewareResult first = warning.beforeTurn(context);
        assertEquals(MiddlewareResult.Action.INJECT_MESSAGE, first.getAction());
        assertTrue(first.getMessage().contains("60%"));
        assertTrue(first.getMessage().contains("600/1000"));
        assertTrue(warning.beforeTurn(context).isContinue());

        warning.reset(ResetReason.COMPACT);
        assertEquals(MiddlewareResult.Action.INJECT_MESSAGE, warning.beforeTurn(context).getAction());
    }

    @Test
    void shouldShortCircuitOnFirstNonContinueResult() {
        AtomicInteger laterCalls = new AtomicInteger();
        MiddlewarePipeline pipeline = new MiddlewarePipeline()
                .add(ctx -> MiddlewareResult.stop("first"))
                .add(ctx -> {
                    laterCalls.incrementAndGet();
                    return MiddlewareResult.stop("second");
                });

        MiddlewareResult result = pipeline.runBeforeTurn(context);

        assertEquals("first", result.getReason());
        assertEquals(0, laterCalls.get());
    }

    @Test
    void shouldContinueWhenAllContinue() {
        MiddlewarePipeline pipeline = new MiddlewarePipeline()
                .add(new TurnLimitMiddleware(5))
                .add(new AutoCompactMiddleware(10_000));

        assertTrue(pipeline.runBeforeTurn(context).isContinue());
        assertTrue(pipeline.runAfterTurn(context).isContinue());
    }

    @Test
    void shouldResetEveryMiddleware() {
        TurnLimitMiddleware limit = new TurnLimitMiddleware(1);
        ContextWarningMiddleware warning = new ContextWarningMiddleware(0.5, 100);
        MiddlewarePipeline pipeline = new MiddlewarePipeline().add(limit).add(warning);
        stats.setContextTokens(90);
        pipeline.runBeforeTurn(context);
        pipeline.runBeforeTurn(context);

        pipeline.reset(ResetReason.CLEAR);

        assertEquals(0, limit.getTurnsTaken());
    }

    @Test
    void shouldRejectInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> new TurnLimitMiddleware(0));
        assertThrows(IllegalArgumentException.class, () -> new PriceLimitMiddleware(0));
        assertThrows(IllegalArgumentException.class, () -> new AutoCompactMiddleware(-1));
        assertThrows(IllegalArgumentException.class, () -> new ContextWarningMiddleware(1.5, 100));
    }
}

package me.golemcore.coder.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentStatsTest {

    @Test
    void shouldAccumulateUsageAndTrackLastTurn() {
        AgentStats stats = new AgentStats();

        stats.recordUsage(LlmUsage.of(1000, 200));
        stats.recordUsage(LlmUsage.of(1500, 300));

        assertEquals(2500, stats.getSessionPromptTokens());
        assertEquals(500, stats.getSessionCompletionTokens());
        assertEquals(1500, stats.getLastTurnPromptTokens());
        assertEquals(300, stats.getLastTurnCompletionTokens());
        assertEquals(1800, stats.getContextTokens());
    }

    @Test
    void shouldComputeCostFromPrices() {
        AgentStats stats = new AgentStats();
        stats.setInputPricePerMillion(3.0);
        stats.setOutputPricePerMillion(15.0);

        stats.recordUsage(LlmUsage.of(1_000_000, 100_000));

        assertEquals(4.5, stats.getSessionCost(), 1e-9);
    }

    @Test
    void shouldKeepPricesOnReset() {
        AgentStats stats = new AgentStats();
        stats.setInputPricePerMillion(3.0);
        stats.recordUsage(LlmUsage.of(10, 5));
        stats.setSteps(2);
        stats.setToolCallsFailed(1);

        stats.reset();

        assertEquals(0, stats.getSteps());
        assertEquals(0, stats.getSessionPromptTokens());
        assertEquals(0, stats.getToolCallsFailed());
        assertEquals(3.0, stats.getInputPricePerMillion());
    }
}

package me.golemcore.coder.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/**
 * Counters accumulated over a session. Prices are per million tokens.
 */
@Data
public class AgentStats {

    private int steps;
    private long sessionPromptTokens;
    private long sessionCompletionTokens;
    private int lastTurnPromptTokens;
    private int lastTurnCompletionTokens;
    private long contextTokens;

    private int toolCallsAgreed;
    private int toolCallsRejected;
    private int toolCallsFailed;
    private int toolCallsSucceeded;

    private double inputPricePerMillion;
    private double outputPricePerMillion;

    @JsonIgnore
    public double getSessionCost() {
        return sessionPromptTokens / 1_000_000.0 * inputPricePerMillion
                + sessionCompletionTokens / 1_000_000.0 * outputPricePerMillion;
    }

    public void recordUsage(LlmUsage usage) {
        lastTurnPromptTokens = usage.getPromptTokens();
        lastTurnCompletionTokens = usage.getCompletionTokens();
        sessionPromptTokens += usage.getPromptTokens();
        sessionCompletionTokens += usage.getCompletionTokens();
        contextTokens = usage.getTotalTokens();
    }

    /**
     * Resets counters but keeps the configured prices.
     */
    public void reset() {
        steps = 0;
        sessionPromptTokens = 0;
        sessionCompletionTokens = 0;
        lastTurnPromptTokens = 0;
        lastTurnCompletionTokens = 0;
        contextTokens = 0;
        toolCallsAgreed = 0;
        toolCallsRejected = 0;
        toolCallsFailed = 0;
        toolCallsSucceeded = 0;
    }

    /**
     * Copies the counters of a persisted session. Prices stay as configured.
     */
    public void restoreCounters(AgentStats saved) {
        steps = saved.steps;
        sessionPromptTokens = saved.sessionPromptTokens;
        sessionCompletionTokens = saved.sessionCompletionTokens;
        lastTurnPromptTokens = saved.lastTurnPromptTokens;
        lastTurnCompletionTokens = saved.lastTurnCompletionTokens;
        contextTokens = saved.contextTokens;
        toolCallsAgreed = saved.toolCallsAgreed;
        toolCallsRejected = saved.toolCallsRejected;
        toolCallsFailed = saved.toolCallsFailed;
        toolCallsSucceeded = saved.toolCallsSucceeded;
    }
}

package me.golemcore.coder.domain.middleware;

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

import me.golemcore.coder.domain.model.MiddlewareResult;

/**
 * Stops the loop once the configured number of model turns has been taken.
 * The count survives compaction and restarts when the conversation is cleared.
 */
public class TurnLimitMiddleware implements ConversationMiddleware {

    private final int maxTurns;
    private int turnsTaken;

    public TurnLimitMiddleware(int maxTurns) {
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("maxTurns must be positive");
        }
        this.maxTurns = maxTurns;
    }

    @Override
    public MiddlewareResult beforeTurn(MiddlewareContext context) {
        if (turnsTaken >= maxTurns) {
            return MiddlewareResult.stop("Turn limit of " + maxTurns + " reached");
        }
        turnsTaken++;
        return MiddlewareResult.proceed();
    }

    @Override
    public void reset(ResetReason reason) {
        if (reason == ResetReason.CLEAR) {
            turnsTaken = 0;
        }
    }

    public int getTurnsTaken() {
        return turnsTaken;
    }
}

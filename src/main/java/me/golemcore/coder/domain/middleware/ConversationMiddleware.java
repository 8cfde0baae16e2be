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
 * Policy evaluated at turn boundaries of the agent loop.
 *
 * <p>
 * Middleware is registered in a {@link MiddlewarePipeline} and runs in
 * registration order. The first result that is not CONTINUE ends the
 * evaluation for that boundary.
 */
public interface ConversationMiddleware {

    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Called before the model is queried.
     */
    MiddlewareResult beforeTurn(MiddlewareContext context);

    /**
     * Called after the turn's tool results have been appended.
     */
    default MiddlewareResult afterTurn(MiddlewareContext context) {
        return MiddlewareResult.proceed();
    }

    default void reset(ResetReason reason) {
    }
}

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.MiddlewareResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Ordered chain of {@link ConversationMiddleware}. Owned by a single agent.
 */
@Slf4j
public class MiddlewarePipeline {

    private final List<ConversationMiddleware> middlewares = new ArrayList<>();

    public MiddlewarePipeline add(ConversationMiddleware middleware) {
        middlewares.add(middleware);
        return this;
    }

    public List<ConversationMiddleware> getMiddlewares() {
        return Collections.unmodifiableList(middlewares);
    }

    public void clear() {
        middlewares.clear();
    }

    public MiddlewareResult runBeforeTurn(MiddlewareContext context) {
        return run(context, ConversationMiddleware::beforeTurn, "before");
    }

    public MiddlewareResult runAfterTurn(MiddlewareContext context) {
        return run(context, ConversationMiddleware::afterTurn, "after");
    }

    public void reset(ResetReason reason) {
        log.debug("[Middleware] Reset ({})", reason);
        for (ConversationMiddleware middleware : middlewares) {
            middleware.reset(reason);
        }
    }

    private MiddlewareResult run(MiddlewareContext context,
            BiFunction<ConversationMiddleware, MiddlewareContext, MiddlewareResult> hook, String phase) {
        for (ConversationMiddleware middleware : middlewares) {
            MiddlewareResult result = hook.apply(middleware, context);
            if (result != null && !result.isContinue()) {
                log.info("[Middleware] {} {}-turn: {}", middleware.getName(), phase, result);
                return result;
            }
        }
        return MiddlewareResult.proceed();
    }
}

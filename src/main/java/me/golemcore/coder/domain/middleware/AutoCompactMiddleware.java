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

import java.util.Map;

/**
 * Requests compaction once the context reaches the threshold.
 */
public class AutoCompactMiddleware implements ConversationMiddleware {

    public static final String OLD_TOKENS = "old_tokens";
    public static final String THRESHOLD = "threshold";

    private final long threshold;

    public AutoCompactMiddleware(long threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        this.threshold = threshold;
    }

    @Override
    public MiddlewareResult beforeTurn(MiddlewareContext context) {
        long tokens = context.stats().getContextTokens();
        if (tokens >= threshold) {
            return MiddlewareResult.compact(Map.of(OLD_TOKENS, tokens, THRESHOLD, threshold));
        }
        return MiddlewareResult.proceed();
    }

    public long getThreshold() {
        return threshold;
    }
}

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
 * Reminds the model once when the context crosses {@code ratio} of the
 * compaction threshold. Re-arms after compaction or clear.
 */
public class ContextWarningMiddleware implements ConversationMiddleware {

    private final double ratio;
    private final long maxContext;
    private boolean warned;

    public ContextWarningMiddleware(double ratio, long maxContext) {
        if (ratio <= 0 || ratio > 1) {
            throw new IllegalArgumentException("ratio must be in (0, 1]");
        }
        this.ratio = ratio;
        this.maxContext = maxContext;
    }

    @Override
    public MiddlewareResult beforeTurn(MiddlewareContext context) {
        if (warned || maxContext <= 0) {
            return MiddlewareResult.proceed();
        }
        long tokens = context.stats().getContextTokens();
        if (tokens < (long) (maxContext * ratio)) {
            return MiddlewareResult.proceed();
        }
        warned = true;
        long percent = Math.round(tokens * 100.0 / maxContext);
        return MiddlewareResult.injectMessage("<system-warning>You have used " + percent
                + "% of your total context (" + tokens + "/" + maxContext + " tokens). "
                + "Be concise and avoid reading large files.</system-warning>");
    }

    @Override
    public void reset(ResetReason reason) {
        warned = false;
    }
}

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

import java.util.Locale;

/**
 * Stops the loop once the session cost exceeds the configured maximum. The cost
 * is derived from the session token counters, so the middleware keeps no state.
 */
public class PriceLimitMiddleware implements ConversationMiddleware {

    private final double maxPrice;

    public PriceLimitMiddleware(double maxPrice) {
        if (maxPrice <= 0) {
            throw new IllegalArgumentException("maxPrice must be positive");
        }
        this.maxPrice = maxPrice;
    }

    @Override
    public MiddlewareResult beforeTurn(MiddlewareContext context) {
        double cost = context.stats().getSessionCost();
        if (cost > maxPrice) {
            return MiddlewareResult.stop(String.format(Locale.ROOT,
                    "Price limit exceeded: $%.4f > $%.2f", cost, maxPrice));
        }
        return MiddlewareResult.proceed();
    }
}

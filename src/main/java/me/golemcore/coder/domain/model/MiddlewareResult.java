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

import java.util.Map;

/**
 * Result returned by a middleware at a turn boundary. Consumed once, never
 * persisted.
 */
public final class MiddlewareResult {

    public enum Action {
        CONTINUE, STOP, INJECT_MESSAGE, COMPACT
    }

    private static final MiddlewareResult CONTINUE_RESULT = new MiddlewareResult(Action.CONTINUE, null, null,
            Map.of());

    private final Action action;
    private final String reason;
    private final String message;
    private final Map<String, Object> metadata;

    private MiddlewareResult(Action action, String reason, String message, Map<String, Object> metadata) {
        this.action = action;
        this.reason = reason;
        this.message = message;
        this.metadata = metadata;
    }

    public static MiddlewareResult proceed() {
        return CONTINUE_RESULT;
    }

    public static MiddlewareResult stop(String reason) {
        return new MiddlewareResult(Action.STOP, reason, null, Map.of());
    }

    public static MiddlewareResult injectMessage(String message) {
        return new MiddlewareResult(Action.INJECT_MESSAGE, null, message, Map.of());
    }

    public static MiddlewareResult compact(Map<String, Object> metadata) {
        return new MiddlewareResult(Action.COMPACT, null, null, metadata != null ? Map.copyOf(metadata) : Map.of());
    }

    public Action getAction() {
        return action;
    }

    public String getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public boolean isContinue() {
        return action == Action.CONTINUE;
    }

    @Override
    public String toString() {
        return "MiddlewareResult{" + action + (reason != null ? ", reason=" + reason : "") + "}";
    }
}

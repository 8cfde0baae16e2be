package me.golemcore.coder.port.outbound;

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

import me.golemcore.coder.domain.loop.AgentException;

/**
 * Classified failure of the model backend. Carries the provider, endpoint and a
 * truncated diagnostic body, plus a hint the user can act on.
 */
public class ModelBackendException extends AgentException {

    private static final long serialVersionUID = 1L;

    public static final int MAX_BODY_LENGTH = 1000;

    private final ModelErrorKind kind;
    private final String provider;
    private final String endpoint;
    private final String model;
    private final String body;

    public ModelBackendException(ModelErrorKind kind, String provider, String endpoint, String model, String body,
            Throwable cause) {
        super(buildMessage(kind, provider, model, truncate(body)), cause);
        this.kind = kind;
        this.provider = provider;
        this.endpoint = endpoint;
        this.model = model;
        this.body = truncate(body);
    }

    public ModelErrorKind getKind() {
        return kind;
    }

    public String getProvider() {
        return provider;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getModel() {
        return model;
    }

    public String getBody() {
        return body;
    }

    public boolean isContextTooLong() {
        return kind == ModelErrorKind.CONTEXT_TOO_LONG;
    }

    public String getRecoveryHint() {
        return switch (kind) {
        case CONTEXT_TOO_LONG -> "The conversation no longer fits the model context. Switch to YOLO mode for terse "
                + "answers, run /compact to summarize, run /clear to start over, or use a model with a larger "
                + "context window.";
        case AUTH -> "Check the API key configured for provider '" + provider + "'.";
        case RATE_LIMIT -> "The provider is rate limiting requests. Wait a moment and try again.";
        case CONNECTION -> "Could not reach " + endpoint + ". Check the network and the configured base URL.";
        case GENERIC -> "Try again, or switch model if the error persists.";
        };
    }

    private static String buildMessage(ModelErrorKind kind, String provider, String model, String body) {
        if (kind == ModelErrorKind.CONTEXT_TOO_LONG) {
            return "Context too long for " + provider + " (model: " + model + "): " + body;
        }
        return "API error from " + provider + " (model: " + model + "): " + body;
    }

    static String truncate(String body) {
        if (body == null) {
            return "";
        }
        if (body.length() <= MAX_BODY_LENGTH) {
            return body;
        }
        return body.substring(0, MAX_BODY_LENGTH) + "...";
    }
}

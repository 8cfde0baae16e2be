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

import me.golemcore.coder.domain.model.LlmChunk;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.service.TokenEstimator;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Port for the language model backend. Implementations translate provider
 * failures into {@link ModelBackendException}.
 */
public interface ModelBackendPort {

    String getProviderId();

    String getEndpoint();

    /**
     * Sends the request and waits for the complete response.
     *
     * @throws ModelBackendException
     *             on provider or transport failure
     */
    LlmResponse complete(LlmRequest request);

    /**
     * Streams the response as fragments. Tool-call fragments carry their index;
     * at least one fragment carries usage.
     */
    Flux<LlmChunk> completeStreaming(LlmRequest request);

    default boolean supportsStreaming() {
        return true;
    }

    /**
     * Estimates the prompt size of {@code messages} in tokens.
     */
    default long countTokens(List<Message> messages) {
        return TokenEstimator.estimate(messages);
    }
}

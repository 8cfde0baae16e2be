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

package me.golemcore.coder.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * One fragment of a streamed model response. The message is partial: content
 * is a text delta and each tool call carries the index it belongs to and a
 * slice of its arguments.
 */
@Data
@Builder
public class LlmChunk {

    private Message message;
    private LlmUsage usage;
    private String finishReason;

    public boolean hasContent() {
        return message != null && message.getContent() != null && !message.getContent().isEmpty();
    }

    public boolean hasToolCalls() {
        return message != null && message.hasToolCalls();
    }
}

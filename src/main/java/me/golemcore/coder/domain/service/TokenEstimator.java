package me.golemcore.coder.domain.service;

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

import me.golemcore.coder.domain.model.Message;

import java.util.List;

/**
 * Rough token estimate used when the backend cannot count tokens itself.
 */
public final class TokenEstimator {

    private static final double CHARS_PER_TOKEN = 3.5;
    private static final int MESSAGE_OVERHEAD = 4;

    private TokenEstimator() {
    }

    public static long estimate(List<Message> messages) {
        long chars = 0;
        for (Message message : messages) {
            if (message.getContent() != null) {
                chars += message.getContent().length();
            }
            if (message.hasToolCalls()) {
                for (Message.ToolCall call : message.getToolCalls()) {
                    chars += length(call.getName()) + length(call.getArguments());
                }
            }
        }
        return (long) Math.ceil(chars / CHARS_PER_TOKEN) + (long) messages.size() * MESSAGE_OVERHEAD;
    }

    private static int length(String text) {
        return text != null ? text.length() : 0;
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered message history of one session. The first message is always the
 * system message. Messages are only appended, except by compaction and clear
 * which rebuild the list from the system message.
 */
public class Conversation {

    private final List<Message> messages = new ArrayList<>();

    public Conversation(Message systemMessage) {
        if (systemMessage == null || !systemMessage.isSystemMessage()) {
            throw new IllegalArgumentException("Conversation must start with a system message");
        }
        messages.add(systemMessage);
    }

    /**
     * Restores a conversation from persisted messages.
     */
    public static Conversation restore(List<Message> persisted) {
        if (persisted == null || persisted.isEmpty()) {
            throw new IllegalArgumentException("Persisted conversation is empty");
        }
        Conversation conversation = new Conversation(persisted.get(0));
        for (int i = 1; i < persisted.size(); i++) {
            conversation.append(persisted.get(i));
        }
        return conversation;
    }

    public void append(Message message) {
        if (message.isSystemMessage()) {
            throw new IllegalArgumentException("System message can only be the first message");
        }
        messages.add(message);
    }

    public Message getSystemMessage() {
        return messages.get(0);
    }

    public Message last() {
        return messages.get(messages.size() - 1);
    }

    public int size() {
        return messages.size();
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    /**
     * Copy of the messages, safe to hand to another thread.
     */
    public List<Message> snapshot() {
        return new ArrayList<>(messages);
    }

    /**
     * Replaces the history with the system message and a single user message
     * carrying the summary.
     */
    public void replaceWithSummary(String summary) {
        Message system = messages.get(0);
        messages.clear();
        messages.add(system);
        messages.add(Message.user(summary));
    }

    public void truncateToSystem() {
        Message system = messages.get(0);
        messages.clear();
        messages.add(system);
    }

    /**
     * Appends text to the content of the last message.
     */
    public void appendToLast(String text) {
        Message lastMessage = last();
        String content = lastMessage.getContent();
        lastMessage.setContent(content == null || content.isEmpty() ? text : content + "\n\n" + text);
    }
}

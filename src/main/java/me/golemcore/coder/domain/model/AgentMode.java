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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Safety profile the conversation operates under. Each mode carries two static
 * flags: whether tool calls are approved without asking and whether the mode is
 * read-only (write operations are blocked).
 */
public enum AgentMode {

    PLAN("📋", true, false,
            "Read-only research and planning. File modifications are blocked."),
    NORMAL("✋", false, false,
            "Every tool call outside the allow-list asks for approval."),
    AUTO("⚡", false, true,
            "Tool calls are approved automatically."),
    YOLO("🚀", false, true,
            "Tool calls are approved automatically, answers are terse."),
    ARCHITECT("🏛", true, false,
            "Read-only design mode. File modifications are blocked.");

    /**
     * Order used when cycling through modes.
     */
    public static final List<AgentMode> CYCLE_ORDER = List.of(NORMAL, AUTO, PLAN, YOLO, ARCHITECT);

    private final String emoji;
    private final boolean readOnly;
    private final boolean autoApprove;
    private final String description;

    AgentMode(String emoji, boolean readOnly, boolean autoApprove, String description) {
        this.emoji = emoji;
        this.readOnly = readOnly;
        this.autoApprove = autoApprove;
        this.description = description;
    }

    public String getEmoji() {
        return emoji;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public boolean isAutoApprove() {
        return autoApprove;
    }

    public String getDescription() {
        return description;
    }

    public AgentMode next() {
        int idx = CYCLE_ORDER.indexOf(this);
        return CYCLE_ORDER.get((idx + 1) % CYCLE_ORDER.size());
    }

    public static Optional<AgentMode> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(mode -> mode.name().equals(normalized))
                .findFirst();
    }
}

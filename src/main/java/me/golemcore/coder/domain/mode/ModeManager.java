package me.golemcore.coder.domain.mode;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.AgentMode;
import me.golemcore.coder.domain.model.ModeTransition;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mode state of one session: the active {@link AgentMode}, the permission flags
 * derived from it, and a bounded history of transitions.
 *
 * <p>
 * {@link #shouldBlock} is independent of the auto-approve flag, so a caller
 * that forced auto-approve still cannot run a write operation in a read-only
 * mode. All methods are synchronized: the state is read by concurrent tool
 * dispatches of one turn.
 */
@Slf4j
public class ModeManager {

    public static final Set<String> READ_ONLY_TOOLS = Set.of(
            "read_file", "grep", "list_files", "git_status", "git_log", "git_diff");

    private static final String PLAN_PROMPT = """
            <active_mode>
            PLAN MODE is active. You may only read and analyze.
            - Explore the codebase with read-only tools.
            - Do not create, edit or delete files and do not run mutating commands.
            - Finish with a concrete, numbered implementation plan for the user to approve.
            </active_mode>""";

    private static final String ARCHITECT_PROMPT = """
            <active_mode>
            ARCHITECT MODE is active. You may only read and analyze.
            - Focus on structure, module boundaries, data flow and trade-offs.
            - Do not create, edit or delete files and do not run mutating commands.
            - Present design options with their consequences before any implementation.
            </active_mode>""";

    private static final String YOLO_PROMPT = """
            <active_mode>
            YOLO MODE is active. Tool calls are approved automatically.
            Be concise: act first, report briefly.
            </active_mode>""";

    private final Clock clock;
    private final int historyLimit;
    private final Deque<ModeTransition> history = new ArrayDeque<>();

    private AgentMode mode;
    private boolean autoApprove;
    private boolean readOnly;

    public ModeManager(AgentMode initialMode, int historyLimit, Clock clock) {
        this.clock = clock;
        this.historyLimit = Math.max(1, historyLimit);
        applyMode(initialMode);
    }

    public synchronized AgentMode getMode() {
        return mode;
    }

    public synchronized boolean isAutoApprove() {
        return autoApprove;
    }

    public synchronized boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Switches mode and recomputes the flags.
     *
     * @return the previous mode
     */
    public synchronized AgentMode setMode(AgentMode newMode) {
        AgentMode previous = this.mode;
        applyMode(newMode);
        log.info("[Mode] {} -> {}", previous, newMode);
        return previous;
    }

    public synchronized AgentMode setModeFromName(String name) {
        AgentMode target = AgentMode.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown mode '" + name + "'. Valid modes: "
                        + Arrays.stream(AgentMode.values())
                                .map(m -> m.name().toLowerCase(java.util.Locale.ROOT))
                                .collect(Collectors.joining(", "))));
        setMode(target);
        return target;
    }

    /**
     * Moves to the next mode of {@link AgentMode#CYCLE_ORDER}.
     *
     * @return the mode now active
     */
    public synchronized AgentMode cycleMode() {
        AgentMode next = mode.next();
        setMode(next);
        return next;
    }

    /**
     * Overrides the auto-approve flag without changing the mode. The next mode
     * change recomputes it from the mode again.
     */
    public synchronized void forceAutoApprove(boolean value) {
        this.autoApprove = value;
    }

    public synchronized List<ModeTransition> getHistory() {
        return List.copyOf(history);
    }

    public synchronized boolean shouldAutoApprove(String toolName) {
        if (autoApprove) {
            return true;
        }
        return readOnly && READ_ONLY_TOOLS.contains(toolName);
    }

    public boolean isWriteOperation(String toolName, Map<String, Object> arguments) {
        return WriteOperationClassifier.isWriteOperation(toolName, arguments);
    }

    public synchronized BlockDecision shouldBlock(String toolName, Map<String, Object> arguments) {
        if (!readOnly || !isWriteOperation(toolName, arguments)) {
            return BlockDecision.allowed();
        }
        String reason = "⛔ Tool '" + toolName + "' blocked in " + mode.getEmoji() + " " + mode.name() + " mode.\n\n"
                + "This operation would modify files. Current mode is read-only: " + mode.getDescription() + "\n\n"
                + "Options: ask the user to switch to NORMAL or AUTO mode to allow modifications, "
                + "or continue with read-only tools.";
        log.info("[Mode] Blocked write operation '{}' in {} mode", toolName, mode);
        return BlockDecision.blocked(reason);
    }

    /**
     * Prompt block appended to the system prompt while the mode is active, or
     * null when the mode needs none.
     */
    public synchronized String getSystemPromptModifier() {
        return switch (mode) {
        case PLAN -> PLAN_PROMPT;
        case ARCHITECT -> ARCHITECT_PROMPT;
        case YOLO -> YOLO_PROMPT;
        default -> null;
        };
    }

    public synchronized String getModeIndicator() {
        return mode.getEmoji() + " " + mode.name();
    }

    public synchronized String describeMode() {
        return getModeIndicator() + ": " + mode.getDescription()
                + " (auto-approve: " + (autoApprove ? "on" : "off")
                + ", read-only: " + (readOnly ? "yes" : "no") + ")";
    }

    public static String getTransitionMessage(AgentMode from, AgentMode to) {
        return "Mode changed: " + from.getEmoji() + " " + from.name() + " → " + to.getEmoji() + " " + to.name()
                + "\n" + to.getDescription();
    }

    public static List<String> listModes() {
        return AgentMode.CYCLE_ORDER.stream()
                .map(m -> m.getEmoji() + " " + m.name() + " - " + m.getDescription())
                .toList();
    }

    private void applyMode(AgentMode target) {
        this.mode = target;
        this.autoApprove = target.isAutoApprove();
        this.readOnly = target.isReadOnly();
        history.addLast(new ModeTransition(target, clock.instant()));
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
    }
}

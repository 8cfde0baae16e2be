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

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a tool call would modify the workspace. File tools are
 * classified by name, command tools by matching the command text against
 * write-indicating patterns.
 */
public final class WriteOperationClassifier {

    public static final Set<String> WRITE_TOOLS = Set.of(
            "write_file", "search_replace", "create_file", "delete_file");

    public static final Set<String> COMMAND_TOOLS = Set.of("bash", "shell");

    public static final String COMMAND_ARGUMENT = "command";

    // Command position: start of line, after an operator or inside a substitution,
    // optionally behind env assignments, sudo, or a path prefix.
    private static final String COMMAND_START = "(?:^|[;&|(`\\n]|\\$\\()\\s*"
            + "(?:[A-Za-z_][A-Za-z0-9_]*=\\S*\\s+)*(?:sudo\\s+)?(?:\\S*/)?";

    private static final String MUTATING_UTILITIES =
            "rm|rmdir|mv|cp|touch|mkdir|ln|chmod|chown|truncate|dd|tee|install|unlink|shred|patch";

    // Arguments up to the next command separator.
    private static final String SAME_SEGMENT = "(?:[^;&|\\n]*\\s)?";

    private static final List<Pattern> WRITE_PATTERNS = List.of(
            Pattern.compile(">>?\\s*(?!&|/dev/null)\\S"),
            Pattern.compile(COMMAND_START + "(?:" + MUTATING_UTILITIES + ")(?=\\s|$)"),
            Pattern.compile(COMMAND_START + "find\\s" + SAME_SEGMENT
                    + "-(?:delete|exec|execdir|ok|okdir|fprint0?|fprintf|fls)(?=\\s|$)"),
            Pattern.compile(COMMAND_START + "xargs\\s" + SAME_SEGMENT + "(?:\\S*/)?"
                    + "(?:" + MUTATING_UTILITIES + "|sed|perl|git|sh|bash)(?=\\s|$)"),
            Pattern.compile(COMMAND_START + "(?:tree|sort)\\s" + SAME_SEGMENT + "-[A-Za-z]*o"),
            Pattern.compile(COMMAND_START + "(?:tree|sort|git)\\s" + SAME_SEGMENT + "--output(?:=|\\s|$)"),
            Pattern.compile(COMMAND_START + "sed\\s+(?:[^;&|]*\\s)?-[A-Za-z]*i"),
            Pattern.compile(COMMAND_START + "perl\\s+(?:[^;&|]*\\s)?-[A-Za-z]*i"),
            Pattern.compile(COMMAND_START + "git\\s+(?:-\\S+\\s+)*"
                    + "(?:commit|push|pull|add|rm|mv|reset|checkout|switch|merge|rebase|stash|apply"
                    + "|cherry-pick|clean|restore|tag|am|init|clone)(?=\\s|$)"),
            Pattern.compile(COMMAND_START + "(?:npm|pnpm|yarn|pip|pip3|uv|cargo|go|gem|bundle)\\s+"
                    + "(?:install|add|remove|uninstall|update|upgrade|i|get)(?=\\s|$)"));

    private static final Pattern COMMAND_LAUNCHER = Pattern.compile(COMMAND_START + "(?:find|xargs)(?=\\s|$)");

    private WriteOperationClassifier() {
    }

    public static boolean isWriteOperation(String toolName, Map<String, Object> arguments) {
        if (toolName == null) {
            return false;
        }
        if (WRITE_TOOLS.contains(toolName)) {
            return true;
        }
        if (COMMAND_TOOLS.contains(toolName)) {
            Object command = arguments != null ? arguments.get(COMMAND_ARGUMENT) : null;
            return command instanceof String text && isWriteCommand(text);
        }
        return false;
    }

    public static boolean isWriteCommand(String command) {
        if (command == null || command.isBlank()) {
            return false;
        }
        for (Pattern pattern : WRITE_PATTERNS) {
            if (pattern.matcher(command).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the command of a command tool starts a program that can launch
     * other programs ({@code find}, {@code xargs}).
     */
    public static boolean launchesCommands(String toolName, Map<String, Object> arguments) {
        if (toolName == null || !COMMAND_TOOLS.contains(toolName) || arguments == null) {
            return false;
        }
        return arguments.get(COMMAND_ARGUMENT) instanceof String text && COMMAND_LAUNCHER.matcher(text).find();
    }
}

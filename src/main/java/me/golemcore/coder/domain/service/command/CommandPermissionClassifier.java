package me.golemcore.coder.domain.service.command;

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
import me.golemcore.coder.domain.model.ToolPermission;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static allow/deny classification of a command string.
 *
 * <p>
 * The command is split into segments on {@code ;}, {@code &&}, {@code ||},
 * {@code |}, background {@code &} and newlines. Each segment's executable is
 * reduced to its basename, so {@code /bin/rm} is matched as {@code rm}.
 * <ul>
 * <li>any segment matching the deny-list, including commands nested inside
 * {@code $(...)} or backticks, makes the whole command {@link ToolPermission#NEVER}
 * <li>a command substitution otherwise forces {@link ToolPermission#ASK}
 * <li>{@link ToolPermission#ALWAYS} only when every segment matches the
 * allow-list
 * </ul>
 */
@Slf4j
public class CommandPermissionClassifier {

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("\\|\\||&&|;|\\||(?<![<>])&(?!>)|\\r?\\n");
    private static final Pattern DOLLAR_SUBSTITUTION = Pattern.compile("\\$\\(([^()]*)\\)");
    private static final Pattern BACKTICK_SUBSTITUTION = Pattern.compile("`([^`]*)`");
    private static final Pattern PROCESS_SUBSTITUTION = Pattern.compile("[<>]\\(");
    private static final Pattern ENV_ASSIGNMENT = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*=\\S*$");

    private final List<String> allowlist;
    private final List<String> denylist;
    private final Set<String> denylistStandalone;

    public CommandPermissionClassifier(List<String> allowlist, List<String> denylist,
            List<String> denylistStandalone) {
        this.allowlist = List.copyOf(allowlist);
        this.denylist = List.copyOf(denylist);
        this.denylistStandalone = Set.copyOf(denylistStandalone);
    }

    public ToolPermission classify(String command) {
        if (command == null || command.isBlank()) {
            return ToolPermission.ASK;
        }

        List<String> segments = segments(command);
        for (String inner : substitutedCommands(command)) {
            segments.addAll(segments(inner));
        }

        for (String segment : segments) {
            if (isDenylisted(segment)) {
                log.debug("[Tools] Command denied by segment '{}'", segment);
                return ToolPermission.NEVER;
            }
        }

        if (hasSubstitution(command)) {
            return ToolPermission.ASK;
        }

        List<String> topLevel = segments(command);
        if (!topLevel.isEmpty() && topLevel.stream().allMatch(this::isAllowlisted)) {
            return ToolPermission.ALWAYS;
        }
        return ToolPermission.ASK;
    }

    boolean isDenylisted(String segment) {
        String normalized = normalize(segment);
        if (normalized.isEmpty()) {
            return false;
        }
        for (String pattern : denylist) {
            if (matchesPrefix(normalized, pattern)) {
                return true;
            }
        }
        String[] words = normalized.split("\\s+");
        return words.length == 1 && denylistStandalone.contains(words[0]);
    }

    boolean isAllowlisted(String segment) {
        String normalized = normalize(segment);
        if (normalized.isEmpty()) {
            return false;
        }
        for (String pattern : allowlist) {
            if (matchesPrefix(normalized, pattern)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasSubstitution(String command) {
        return command.contains("`") || command.contains("$(") || PROCESS_SUBSTITUTION.matcher(command).find();
    }

    private static List<String> segments(String command) {
        List<String> result = new ArrayList<>();
        for (String part : SEGMENT_SEPARATOR.split(command)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    private static List<String> substitutedCommands(String command) {
        List<String> inner = new ArrayList<>();
        Matcher dollar = DOLLAR_SUBSTITUTION.matcher(command);
        while (dollar.find()) {
            inner.add(dollar.group(1));
        }
        Matcher backtick = BACKTICK_SUBSTITUTION.matcher(command);
        while (backtick.find()) {
            inner.add(backtick.group(1));
        }
        return inner;
    }

    /**
     * Drops leading {@code NAME=value} assignments and strips the path from the
     * executable.
     */
    static String normalize(String segment) {
        String[] words = segment.trim().split("\\s+", -1);
        int start = 0;
        while (start < words.length - 1 && ENV_ASSIGNMENT.matcher(words[start]).matches()) {
            start++;
        }
        if (start >= words.length || words[start].isEmpty()) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(SecureCommandExecutor.basename(words[start]));
        for (int i = start + 1; i < words.length; i++) {
            normalized.append(' ').append(words[i]);
        }
        return normalized.toString();
    }

    private static boolean matchesPrefix(String segment, String pattern) {
        if (pattern.isEmpty()) {
            return false;
        }
        char lastChar = pattern.charAt(pattern.length() - 1);
        if (Character.isWhitespace(lastChar) || lastChar == '=') {
            return segment.startsWith(pattern);
        }
        return segment.equals(pattern) || segment.startsWith(pattern + " ");
    }
}

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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a command line into arguments using POSIX shell quoting rules: single
 * quotes are literal, double quotes allow backslash escapes of {@code " \ $ `},
 * and a backslash outside quotes escapes the next character. Operators such as
 * {@code ;} or {@code |} are not interpreted and stay part of the word.
 */
public final class CommandLineTokenizer {

    private CommandLineTokenizer() {
    }

    public static List<String> tokenize(String command) {
        List<String> tokens = new ArrayList<>();
        if (command == null) {
            return tokens;
        }

        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        int i = 0;
        int length = command.length();
        while (i < length) {
            char c = command.charAt(i);
            if (c == '\'') {
                int end = command.indexOf('\'', i + 1);
                if (end < 0) {
                    throw new CommandSyntaxException("Invalid command syntax: No closing quotation");
                }
                current.append(command, i + 1, end);
                inToken = true;
                i = end + 1;
            } else if (c == '"') {
                i = readDoubleQuoted(command, i + 1, current);
                inToken = true;
            } else if (c == '\\') {
                if (i + 1 >= length) {
                    throw new CommandSyntaxException("Invalid command syntax: No escaped character");
                }
                char next = command.charAt(i + 1);
                if (next != '\n') {
                    current.append(next);
                    inToken = true;
                }
                i += 2;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
                i++;
            } else {
                current.append(c);
                inToken = true;
                i++;
            }
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static int readDoubleQuoted(String command, int start, StringBuilder out) {
        int i = start;
        while (i < command.length()) {
            char c = command.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\' && i + 1 < command.length()) {
                char next = command.charAt(i + 1);
                if (next == '"' || next == '\\' || next == '$' || next == '`') {
                    out.append(next);
                    i += 2;
                    continue;
                }
                if (next == '\n') {
                    i += 2;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        throw new CommandSyntaxException("Invalid command syntax: No closing quotation");
    }
}

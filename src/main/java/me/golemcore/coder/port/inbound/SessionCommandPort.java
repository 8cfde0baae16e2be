package me.golemcore.coder.port.inbound;

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

import me.golemcore.coder.domain.loop.CodingAgent;

import java.util.List;

/**
 * Port for slash commands that act on a session directly instead of going
 * through the model: mode switching, clear, compaction, status and approval
 * answers.
 */
public interface SessionCommandPort {

    /**
     * Executes a command against {@code agent}.
     *
     * @param command
     *            command name without the leading slash
     * @param args
     *            command arguments
     */
    CommandResult execute(CodingAgent agent, String command, List<String> args);

    boolean hasCommand(String command);

    List<CommandDefinition> listCommands();

    record CommandResult(boolean success, String output) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error);
        }
    }

    record CommandDefinition(String name, String description, String usage) {
    }
}

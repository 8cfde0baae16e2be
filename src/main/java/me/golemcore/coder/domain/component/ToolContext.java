package me.golemcore.coder.domain.component;

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

import me.golemcore.coder.domain.service.command.SecureCommandExecutor;

import java.nio.file.Path;

/**
 * Per-session state a tool call runs against: the session's command executor
 * (which owns the emulated working directory) and the workspace root that file
 * tools are confined to.
 */
public record ToolContext(String sessionId, Path workspaceRoot, SecureCommandExecutor commandExecutor) {

    public ToolContext {
        workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
    }
}

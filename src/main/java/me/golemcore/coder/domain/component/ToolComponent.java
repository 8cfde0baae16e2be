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

import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.domain.model.ToolPermission;
import me.golemcore.coder.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing an executable tool that can be invoked by the LLM.
 * Tools expose their JSON Schema definition to the LLM via function calling,
 * and implement the execution logic. Implementations are registered by name in
 * the {@link me.golemcore.coder.domain.service.ToolRegistry} at startup.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool. Called only after the arguments passed
     * {@link #validate(Map)} and the call was authorized.
     *
     * @param context
     *            session the call belongs to
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters);

    /**
     * Checks required arguments and their types.
     *
     * @throws ToolValidationException
     *             if the arguments cannot be used
     */
    default void validate(Map<String, Object> parameters) {
    }

    /**
     * Static allow/deny verdict for command-style tools. Tools without one return
     * null and are decided by configuration and mode.
     */
    default ToolPermission checkPermission(Map<String, Object> parameters) {
        return null;
    }

    default boolean isEnabled() {
        return true;
    }

    /**
     * Whether the tool runs through the session's command executor. Calls to
     * such tools share its working directory and run one after another.
     */
    default boolean usesCommandExecutor() {
        return false;
    }

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.component.ToolComponent;
import me.golemcore.coder.domain.mode.BlockDecision;
import me.golemcore.coder.domain.mode.ModeManager;
import me.golemcore.coder.domain.mode.WriteOperationClassifier;
import me.golemcore.coder.domain.model.AuthorizationDecision;
import me.golemcore.coder.domain.model.ToolPermission;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a tool call runs, is skipped, or needs a human verdict.
 *
 * <p>
 * Checks, in order:
 * <ol>
 * <li>read-only mode block, which nothing below can override
 * <li>static allow/deny classification of command-style tools; in read-only
 * mode the allow-list does not cover commands started through {@code find} or
 * {@code xargs}
 * <li>configured per-tool permission, or an "always" grant of this session
 * <li>mode auto-approval
 * </ol>
 * Anything left over waits for approval.
 */
@Slf4j
public class ToolAuthorizer {

    private final ModeManager modeManager;
    private final ToolRegistry toolRegistry;
    private final Map<String, ToolPermission> configuredPermissions;
    private final Set<String> alwaysApproved = ConcurrentHashMap.newKeySet();

    public ToolAuthorizer(ModeManager modeManager, ToolRegistry toolRegistry,
            Map<String, ToolPermission> configuredPermissions) {
        this.modeManager = modeManager;
        this.toolRegistry = toolRegistry;
        this.configuredPermissions = configuredPermissions != null ? Map.copyOf(configuredPermissions) : Map.of();
    }

    public AuthorizationDecision authorize(String toolName, Map<String, Object> arguments, String correlationId) {
        BlockDecision block = modeManager.shouldBlock(toolName, arguments);
        if (block.blocked()) {
            log.info("[Tools] {} '{}' blocked by mode {}", correlationId, toolName, modeManager.getMode());
            return AuthorizationDecision.skip(block.reason());
        }

        ToolPermission commandPermission = toolRegistry.getTool(toolName)
                .map(tool -> staticPermission(tool, arguments))
                .orElse(null);
        if (commandPermission == ToolPermission.NEVER) {
            log.info("[Tools] {} '{}' denied by command deny-list", correlationId, toolName);
            return AuthorizationDecision.skip("Tool '" + toolName
                    + "' was denied: the command matches the deny-list and is never run.");
        }
        if (commandPermission == ToolPermission.ALWAYS) {
            if (modeManager.isReadOnly() && WriteOperationClassifier.launchesCommands(toolName, arguments)) {
                log.debug("[Tools] {} '{}' allow-list bypassed in read-only mode", correlationId, toolName);
            } else {
                log.debug("[Tools] {} '{}' allowed by command allow-list", correlationId, toolName);
                return AuthorizationDecision.execute("allow-list");
            }
        }

        ToolPermission configured = configuredPermissions.get(toolName);
        if (configured == ToolPermission.NEVER) {
            log.info("[Tools] {} '{}' disabled by configuration", correlationId, toolName);
            return AuthorizationDecision.skip("Tool '" + toolName + "' is disabled by configuration.");
        }
        if (configured == ToolPermission.ALWAYS || alwaysApproved.contains(toolName)) {
            log.debug("[Tools] {} '{}' always allowed", correlationId, toolName);
            return AuthorizationDecision.execute("always");
        }

        if (modeManager.shouldAutoApprove(toolName)) {
            log.debug("[Tools] {} '{}' auto-approved in {} mode", correlationId, toolName, modeManager.getMode());
            return AuthorizationDecision.execute("auto-approve");
        }

        log.debug("[Tools] {} '{}' needs approval", correlationId, toolName);
        return AuthorizationDecision.awaitApproval();
    }

    /**
     * Approves every later call of {@code toolName} for this session. Mode
     * blocks and deny-list matches still apply.
     */
    public void grantAlways(String toolName) {
        alwaysApproved.add(toolName);
        log.info("[Tools] '{}' approved for the rest of the session", toolName);
    }

    public void clearGrants() {
        alwaysApproved.clear();
    }

    private static ToolPermission staticPermission(ToolComponent tool, Map<String, Object> arguments) {
        return tool.checkPermission(arguments != null ? arguments : Map.of());
    }
}

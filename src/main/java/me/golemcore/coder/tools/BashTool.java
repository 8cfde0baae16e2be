package me.golemcore.coder.tools;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.component.ToolComponent;
import me.golemcore.coder.domain.component.ToolContext;
import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.domain.model.ToolFailureKind;
import me.golemcore.coder.domain.model.ToolPermission;
import me.golemcore.coder.domain.model.ToolResult;
import me.golemcore.coder.domain.service.command.CommandExecutionException;
import me.golemcore.coder.domain.service.command.CommandPermissionClassifier;
import me.golemcore.coder.domain.service.command.CommandResult;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs a shell-like command through the session's
 * {@link me.golemcore.coder.domain.service.command.SecureCommandExecutor}.
 *
 * <p>
 * This is the command-style tool: besides mode checks, each command is
 * classified against the configured allow/deny lists before it may run.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code coder.shell.default-timeout} - Default timeout (seconds)
 * <li>{@code coder.shell.max-timeout} - Max timeout (seconds)
 * <li>{@code coder.shell.allowlist}, {@code coder.shell.denylist},
 * {@code coder.shell.denylist-standalone} - Static permission lists
 * </ul>
 */
@Component
@Slf4j
public class BashTool implements ToolComponent {

    public static final String NAME = "bash";

    private static final String PARAM_COMMAND = "command";
    private static final String PARAM_TIMEOUT = "timeout";
    private static final int LOG_COMMAND_LIMIT = 200;

    private final CommandPermissionClassifier permissionClassifier;
    private final int defaultTimeout;
    private final int maxTimeout;
    private final ExecutorService executor;

    public BashTool(CoderProperties properties, CommandPermissionClassifier permissionClassifier) {
        CoderProperties.ShellProperties config = properties.getShell();
        this.permissionClassifier = permissionClassifier;
        this.defaultTimeout = config.getDefaultTimeout();
        this.maxTimeout = config.getMaxTimeout();
        this.executor = Executors.newCachedThreadPool();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Shell] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Run a command in the project workspace and return stdout, stderr and the exit code.
                        Commands run without a terminal and without a shell unless a shell built-in is used,
                        so prefer single commands over pipelines. 'cd' changes the directory for later commands.
                        Timeout defaults to %d seconds (max %d).
                        """.formatted(defaultTimeout, maxTimeout))
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_COMMAND, Map.of(
                                        "type", "string",
                                        "description", "Command to execute"),
                                PARAM_TIMEOUT, Map.of(
                                        "type", "integer",
                                        "description", "Timeout in seconds")),
                        "required", List.of(PARAM_COMMAND)))
                .build();
    }

    @Override
    public void validate(Map<String, Object> parameters) {
        ToolArguments.requireString(parameters, PARAM_COMMAND);
        ToolArguments.optionalInt(parameters, PARAM_TIMEOUT);
    }

    @Override
    public ToolPermission checkPermission(Map<String, Object> parameters) {
        Object command = parameters.get(PARAM_COMMAND);
        if (!(command instanceof String text)) {
            return ToolPermission.ASK;
        }
        return permissionClassifier.classify(text);
    }

    @Override
    public boolean usesCommandExecutor() {
        return true;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String command = ToolArguments.requireString(parameters, PARAM_COMMAND);
            int timeout = resolveTimeout(ToolArguments.optionalInt(parameters, PARAM_TIMEOUT));
            log.info("[Shell] Command: '{}' (timeout {}s)", truncate(command), timeout);

            long start = System.currentTimeMillis();
            try {
                CommandResult result = context.commandExecutor().execute(command, Duration.ofSeconds(timeout));
                long duration = System.currentTimeMillis() - start;
                String output = formatOutput(result);
                Map<String, Object> data = Map.of(
                        "exitCode", result.exitCode(),
                        "duration", duration,
                        "workdir", context.commandExecutor().getCurrentWorkdir().toString());
                log.info("[Shell] Command finished: exitCode={}, duration={}ms", result.exitCode(), duration);
                if (result.isSuccess()) {
                    return ToolResult.success(output, data);
                }
                return ToolResult.builder()
                        .success(false)
                        .error("Command failed with exit code " + result.exitCode() + "\n" + output)
                        .failureKind(ToolFailureKind.EXECUTION_FAILED)
                        .data(data)
                        .build();
            } catch (CommandExecutionException e) {
                log.warn("[Shell] Command rejected or failed: {}", e.getMessage());
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, e.getMessage());
            }
        }, executor);
    }

    private int resolveTimeout(Integer requested) {
        if (requested == null) {
            return defaultTimeout;
        }
        return Math.max(1, Math.min(requested, maxTimeout));
    }

    private static String formatOutput(CommandResult result) {
        StringBuilder sb = new StringBuilder();
        if (!result.stdout().isEmpty()) {
            sb.append(result.stdout());
        }
        if (!result.stderr().isEmpty()) {
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
                sb.append('\n');
            }
            sb.append("[stderr]\n").append(result.stderr());
        }
        if (sb.length() == 0) {
            sb.append("(no output)");
        }
        return sb.toString();
    }

    private static String truncate(String text) {
        if (text.length() <= LOG_COMMAND_LIMIT) {
            return text;
        }
        return text.substring(0, LOG_COMMAND_LIMIT) + "...";
    }
}

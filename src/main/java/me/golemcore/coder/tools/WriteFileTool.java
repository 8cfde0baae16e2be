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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.component.ToolComponent;
import me.golemcore.coder.domain.component.ToolContext;
import me.golemcore.coder.domain.component.ToolValidationException;
import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.domain.model.ToolFailureKind;
import me.golemcore.coder.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Creates or overwrites a file in the workspace. Existing files are only
 * replaced when {@code overwrite} is true.
 */
@Component
@Slf4j
public class WriteFileTool implements ToolComponent {

    public static final String NAME = "write_file";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Write content to a file in the workspace, creating parent directories. "
                        + "Set overwrite=true to replace an existing file.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of("type", "string", "description", "File path"),
                                "content", Map.of("type", "string", "description", "Full file content"),
                                "overwrite", Map.of("type", "boolean",
                                        "description", "Replace the file if it exists (default: false)")),
                        "required", List.of("path", "content")))
                .build();
    }

    @Override
    public void validate(Map<String, Object> parameters) {
        ToolArguments.requireString(parameters, "path");
        ToolArguments.requireText(parameters, "content");
        ToolArguments.optionalBoolean(parameters, "overwrite", false);
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path path = WorkspacePaths.resolve(context.workspaceRoot(),
                        ToolArguments.requireString(parameters, "path"));
                String content = ToolArguments.requireText(parameters, "content");
                boolean overwrite = ToolArguments.optionalBoolean(parameters, "overwrite", false);
                String relative = WorkspacePaths.relative(context.workspaceRoot(), path);

                boolean existed = Files.exists(path);
                if (existed && !overwrite) {
                    return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                            "File already exists: " + relative + ". Set overwrite=true to replace it.");
                }
                if (Files.isDirectory(path)) {
                    return ToolResult.failure("Path is a directory: " + relative);
                }
                Path parent = path.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(path, content, StandardCharsets.UTF_8);
                log.info("[Tools] write_file {} ({} chars)", relative, content.length());
                return ToolResult.success((existed ? "Overwrote " : "Created ") + relative
                        + " (" + content.getBytes(StandardCharsets.UTF_8).length + " bytes)",
                        Map.of("path", relative, "created", !existed));
            } catch (ToolValidationException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
            } catch (IOException e) {
                return ToolResult.failure("Failed to write file: " + e.getMessage());
            }
        });
    }
}

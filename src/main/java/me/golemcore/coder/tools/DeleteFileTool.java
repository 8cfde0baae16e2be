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
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Deletes a file or an empty directory from the workspace.
 */
@Component
@Slf4j
public class DeleteFileTool implements ToolComponent {

    public static final String NAME = "delete_file";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Delete a file or an empty directory in the workspace.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of("type", "string", "description", "Path to delete")),
                        "required", List.of("path")))
                .build();
    }

    @Override
    public void validate(Map<String, Object> parameters) {
        ToolArguments.requireString(parameters, "path");
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path path = WorkspacePaths.resolve(context.workspaceRoot(),
                        ToolArguments.requireString(parameters, "path"));
                String relative = WorkspacePaths.relative(context.workspaceRoot(), path);
                if (path.equals(context.workspaceRoot().toAbsolutePath().normalize())) {
                    return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                            "Refusing to delete the workspace root");
                }
                if (!Files.deleteIfExists(path)) {
                    return ToolResult.failure("Path not found: " + relative);
                }
                log.info("[Tools] delete_file {}", relative);
                return ToolResult.success("Deleted " + relative, Map.of("path", relative));
            } catch (ToolValidationException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
            } catch (DirectoryNotEmptyException e) {
                return ToolResult.failure("Directory is not empty: " + e.getFile());
            } catch (IOException e) {
                return ToolResult.failure("Failed to delete: " + e.getMessage());
            }
        });
    }
}

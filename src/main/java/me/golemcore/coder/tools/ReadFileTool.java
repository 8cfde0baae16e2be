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
 * Reads a text file from the workspace, optionally a window of lines.
 */
@Component
@Slf4j
public class ReadFileTool implements ToolComponent {

    public static final String NAME = "read_file";

    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024; // 10 MB
    private static final int DEFAULT_LINE_LIMIT = 2000;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Read a UTF-8 text file. Paths are relative to the workspace root. "
                        + "Use offset and limit to page through large files.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of("type", "string", "description", "File path"),
                                "offset", Map.of("type", "integer", "description", "First line, 0-based"),
                                "limit", Map.of("type", "integer", "description", "Maximum number of lines")),
                        "required", List.of("path")))
                .build();
    }

    @Override
    public void validate(Map<String, Object> parameters) {
        ToolArguments.requireString(parameters, "path");
        ToolArguments.optionalInt(parameters, "offset");
        ToolArguments.optionalInt(parameters, "limit");
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path path = WorkspacePaths.resolve(context.workspaceRoot(), ToolArguments.requireString(parameters,
                        "path"));
                String relative = WorkspacePaths.relative(context.workspaceRoot(), path);
                if (!Files.isRegularFile(path)) {
                    return ToolResult.failure("File not found: " + relative);
                }
                if (Files.size(path) > MAX_FILE_SIZE) {
                    return ToolResult.failure("File too large (max " + (MAX_FILE_SIZE / 1024 / 1024) + " MB)");
                }

                Integer offsetArg = ToolArguments.optionalInt(parameters, "offset");
                Integer limitArg = ToolArguments.optionalInt(parameters, "limit");
                int offset = offsetArg != null ? Math.max(0, offsetArg) : 0;
                int limit = limitArg != null && limitArg > 0 ? limitArg : DEFAULT_LINE_LIMIT;

                List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
                int end = Math.min(lines.size(), offset + limit);
                String content = offset >= lines.size() ? "" : String.join("\n", lines.subList(offset, end));
                boolean truncated = end < lines.size();
                log.debug("[Tools] read_file {} lines {}-{} of {}", relative, offset, end, lines.size());
                return ToolResult.success(truncated ? content + "\n... (" + (lines.size() - end)
                        + " more lines)" : content, Map.of(
                                "path", relative,
                                "totalLines", lines.size(),
                                "truncated", truncated));
            } catch (ToolValidationException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
            } catch (IOException e) {
                return ToolResult.failure("Failed to read file: " + e.getMessage());
            }
        });
    }
}

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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists workspace entries up to a given depth, skipping VCS and build output
 * directories.
 */
@Component
@Slf4j
public class ListFilesTool implements ToolComponent {

    public static final String NAME = "list_files";

    static final Set<String> IGNORED_DIRECTORIES = Set.of(
            ".git", "node_modules", "target", "build", ".gradle", ".idea", "__pycache__", ".venv");

    private static final int MAX_ENTRIES = 500;
    private static final int DEFAULT_DEPTH = 2;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("List files and directories in the workspace. Directories end with '/'.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of("type", "string", "description", "Directory (default: workspace root)"),
                                "max_depth", Map.of("type", "integer", "description", "Depth to descend (default: 2)")),
                        "required", List.of()))
                .build();
    }

    @Override
    public void validate(Map<String, Object> parameters) {
        ToolArguments.optionalString(parameters, "path", ".");
        ToolArguments.optionalInt(parameters, "max_depth");
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path dir = WorkspacePaths.resolve(context.workspaceRoot(),
                        ToolArguments.optionalString(parameters, "path", "."));
                Integer depthArg = ToolArguments.optionalInt(parameters, "max_depth");
                int depth = depthArg != null && depthArg > 0 ? depthArg : DEFAULT_DEPTH;
                if (!Files.isDirectory(dir)) {
                    return ToolResult.failure("Not a directory: " + WorkspacePaths.relative(context.workspaceRoot(),
                            dir));
                }

                List<String> entries;
                try (Stream<Path> stream = Files.walk(dir, depth)) {
                    entries = stream
                            .filter(p -> !p.equals(dir))
                            .filter(p -> !isIgnored(dir, p))
                            .sorted()
                            .limit(MAX_ENTRIES + 1L)
                            .map(p -> WorkspacePaths.relative(context.workspaceRoot(), p)
                                    + (Files.isDirectory(p) ? "/" : ""))
                            .collect(Collectors.toList());
                }
                boolean truncated = entries.size() > MAX_ENTRIES;
                if (truncated) {
                    entries = entries.subList(0, MAX_ENTRIES);
                }
                String output = entries.isEmpty() ? "(empty)" : String.join("\n", entries);
                if (truncated) {
                    output += "\n... (truncated at " + MAX_ENTRIES + " entries)";
                }
                return ToolResult.success(output, Map.of("count", entries.size(), "truncated", truncated));
            } catch (ToolValidationException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
            } catch (IOException | java.io.UncheckedIOException e) {
                return ToolResult.failure("Failed to list files: " + e.getMessage());
            }
        });
    }

    static boolean isIgnored(Path base, Path path) {
        for (Path part : base.relativize(path)) {
            if (IGNORED_DIRECTORIES.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }
}

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
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Searches workspace files for a regular expression. Binary and oversized files
 * are skipped.
 */
@Component
@Slf4j
public class GrepTool implements ToolComponent {

    public static final String NAME = "grep";

    private static final int MAX_MATCHES = 200;
    private static final long MAX_FILE_SIZE = 2 * 1024 * 1024;
    private static final int MAX_LINE_LENGTH = 300;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search file contents with a Java regular expression. "
                        + "Returns matches as path:line: text.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "pattern", Map.of("type", "string", "description", "Regular expression"),
                                "path", Map.of("type", "string", "description", "File or directory (default: .)"),
                                "ignore_case", Map.of("type", "boolean", "description", "Case-insensitive search")),
                        "required", List.of("pattern")))
                .build();
    }

    @Override
    public void validate(Map<String, Object> parameters) {
        String pattern = ToolArguments.requireText(parameters, "pattern");
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new ToolValidationException("Invalid pattern: " + e.getDescription());
        }
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                int flags = ToolArguments.optionalBoolean(parameters, "ignore_case", false)
                        ? Pattern.CASE_INSENSITIVE
                        : 0;
                Pattern pattern = Pattern.compile(ToolArguments.requireText(parameters, "pattern"), flags);
                Path base = WorkspacePaths.resolve(context.workspaceRoot(),
                        ToolArguments.optionalString(parameters, "path", "."));

                List<String> matches = new ArrayList<>();
                try (Stream<Path> files = Files.isDirectory(base) ? Files.walk(base) : Stream.of(base)) {
                    files.filter(Files::isRegularFile)
                            .filter(p -> !ListFilesTool.isIgnored(context.workspaceRoot(), p))
                            .sorted()
                            .forEach(file -> {
                                if (matches.size() < MAX_MATCHES) {
                                    searchFile(context.workspaceRoot(), file, pattern, matches);
                                }
                            });
                }
                if (matches.isEmpty()) {
                    return ToolResult.success("No matches found", Map.of("count", 0));
                }
                String output = String.join("\n", matches);
                if (matches.size() >= MAX_MATCHES) {
                    output += "\n... (stopped at " + MAX_MATCHES + " matches)";
                }
                return ToolResult.success(output, Map.of("count", matches.size()));
            } catch (ToolValidationException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
            } catch (PatternSyntaxException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Invalid pattern: " + e.getDescription());
            } catch (IOException | UncheckedIOException e) {
                return ToolResult.failure("Search failed: " + e.getMessage());
            }
        });
    }

    private static void searchFile(Path root, Path file, Pattern pattern, List<String> matches) {
        try {
            if (Files.size(file) > MAX_FILE_SIZE) {
                return;
            }
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            String relative = WorkspacePaths.relative(root, file);
            for (int i = 0; i < lines.size() && matches.size() < MAX_MATCHES; i++) {
                String line = lines.get(i);
                if (pattern.matcher(line).find()) {
                    String shown = line.length() > MAX_LINE_LENGTH ? line.substring(0, MAX_LINE_LENGTH) + "..." : line;
                    matches.add(relative + ":" + (i + 1) + ": " + shown);
                }
            }
        } catch (CharacterCodingException e) {
            log.trace("[Tools] Skipping undecodable file {}", file);
        } catch (IOException e) {
            log.debug("[Tools] Skipping unreadable file {}: {}", file, e.getMessage());
        }
    }
}

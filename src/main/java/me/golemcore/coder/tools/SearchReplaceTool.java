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
 * Replaces an exact text block in a file. The block must occur exactly once
 * unless {@code replace_all} is set.
 */
@Component
@Slf4j
public class SearchReplaceTool implements ToolComponent {

    public static final String NAME = "search_replace";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Replace an exact block of text in a workspace file. The search text must match "
                        + "exactly once, including whitespace, unless replace_all is true.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of("type", "string", "description", "File path"),
                                "search", Map.of("type", "string", "description", "Exact text to find"),
                                "replace", Map.of("type", "string", "description", "Replacement text"),
                                "replace_all", Map.of("type", "boolean",
                                        "description", "Replace every occurrence (default: false)")),
                        "required", List.of("path", "search", "replace")))
                .build();
    }

    @Override
    public void validate(Map<String, Object> parameters) {
        ToolArguments.requireString(parameters, "path");
        if (ToolArguments.requireText(parameters, "search").isEmpty()) {
            throw new ToolValidationException("Parameter 'search' must not be empty");
        }
        ToolArguments.requireText(parameters, "replace");
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path path = WorkspacePaths.resolve(context.workspaceRoot(),
                        ToolArguments.requireString(parameters, "path"));
                String search = ToolArguments.requireText(parameters, "search");
                String replace = ToolArguments.requireText(parameters, "replace");
                boolean replaceAll = ToolArguments.optionalBoolean(parameters, "replace_all", false);
                String relative = WorkspacePaths.relative(context.workspaceRoot(), path);

                if (!Files.isRegularFile(path)) {
                    return ToolResult.failure("File not found: " + relative);
                }
                String content = Files.readString(path, StandardCharsets.UTF_8);
                int occurrences = countOccurrences(content, search);
                if (occurrences == 0) {
                    return ToolResult.failure("Search text not found in " + relative);
                }
                if (occurrences > 1 && !replaceAll) {
                    return ToolResult.failure("Search text occurs " + occurrences + " times in " + relative
                            + ". Add surrounding context or set replace_all=true.");
                }

                String updated = replaceAll ? content.replace(search, replace)
                        : content.replaceFirst(java.util.regex.Pattern.quote(search),
                                java.util.regex.Matcher.quoteReplacement(replace));
                Files.writeString(path, updated, StandardCharsets.UTF_8);
                int replaced = replaceAll ? occurrences : 1;
                log.info("[Tools] search_replace {}: {} replacement(s)", relative, replaced);
                return ToolResult.success("Replaced " + replaced + " occurrence(s) in " + relative,
                        Map.of("path", relative, "replacements", replaced));
            } catch (ToolValidationException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
            } catch (IOException e) {
                return ToolResult.failure("Failed to edit file: " + e.getMessage());
            }
        });
    }

    private static int countOccurrences(String content, String search) {
        int count = 0;
        int from = 0;
        while (true) {
            int idx = content.indexOf(search, from);
            if (idx < 0) {
                return count;
            }
            count++;
            from = idx + search.length();
        }
    }
}

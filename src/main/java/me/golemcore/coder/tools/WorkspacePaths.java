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
import me.golemcore.coder.domain.component.ToolValidationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves tool path arguments inside the workspace. Paths that leave the
 * workspace, directly or through a symlink, are rejected.
 */
@Slf4j
final class WorkspacePaths {

    private WorkspacePaths() {
    }

    static Path resolve(Path workspaceRoot, String pathStr) {
        Path root = workspaceRoot.toAbsolutePath().normalize();
        Path resolved;
        try {
            resolved = root.resolve(pathStr).normalize();
        } catch (InvalidPathException e) {
            throw new ToolValidationException("Invalid path: " + pathStr);
        }
        if (!resolved.startsWith(root)) {
            throw new ToolValidationException("Invalid path: must be within workspace");
        }

        // Follow symlinks to prevent symlink escape
        if (Files.exists(resolved)) {
            try {
                Path realPath = resolved.toRealPath();
                if (!realPath.startsWith(root.toRealPath())) {
                    log.warn("[Tools] Symlink escape blocked: {} -> {}", resolved, realPath);
                    throw new ToolValidationException("Invalid path: must be within workspace");
                }
            } catch (IOException e) {
                throw new ToolValidationException("Failed to resolve path: " + pathStr);
            }
        }
        return resolved;
    }

    static String relative(Path workspaceRoot, Path path) {
        Path root = workspaceRoot.toAbsolutePath().normalize();
        String relative = root.relativize(path).toString();
        return relative.isEmpty() ? "." : relative;
    }
}

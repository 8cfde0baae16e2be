package me.golemcore.coder.adapter.outbound.storage;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.SessionSnapshot;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.InteractionLogPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores one JSON file per session under
 * {@code coder.storage.sessions-directory}. Files are replaced atomically so a
 * crash mid-write leaves the previous snapshot intact.
 */
@Component
@Slf4j
public class JsonSessionLogAdapter implements InteractionLogPort {

    private static final String FILE_PREFIX = "session_";
    private static final String FILE_SUFFIX = ".json";
    private static final Pattern SAFE_SESSION_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonSessionLogAdapter(CoderProperties properties, ObjectMapper objectMapper) {
        this.directory = Paths.get(properties.getStorage().getSessionsDirectory()).toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    @Override
    public void saveInteraction(SessionSnapshot snapshot) {
        Path target = sessionFile(snapshot.getSessionId());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(directory);
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Session] Atomic move not supported, using regular move");
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[Session] Saved {} ({} messages)", snapshot.getSessionId(),
                    snapshot.getMessages() != null ? snapshot.getMessages().size() : 0);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new UncheckedIOException("Failed to save session " + snapshot.getSessionId(), e);
        }
    }

    @Override
    public Optional<SessionSnapshot> loadSession(String sessionId) {
        Path file = sessionFile(sessionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public Optional<SessionSnapshot> findLatestSession() {
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(FILE_PREFIX) && name.endsWith(FILE_SUFFIX);
                    })
                    .map(this::readQuietly)
                    .filter(Objects::nonNull)
                    .max(Comparator.comparing(s -> s.getSavedAt() != null ? s.getSavedAt() : Instant.EPOCH));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list sessions in " + directory, e);
        }
    }

    private SessionSnapshot read(Path file) {
        try {
            return objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8), SessionSnapshot.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read session " + file.getFileName(), e);
        }
    }

    private SessionSnapshot readQuietly(Path file) {
        try {
            return read(file);
        } catch (UncheckedIOException e) {
            log.warn("[Session] Skipping unreadable session file {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    private Path sessionFile(String sessionId) {
        if (sessionId == null || !SAFE_SESSION_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return directory.resolve(FILE_PREFIX + sessionId + FILE_SUFFIX);
    }
}

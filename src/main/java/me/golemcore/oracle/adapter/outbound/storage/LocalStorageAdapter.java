package me.golemcore.oracle.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import me.golemcore.oracle.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Filesystem-backed {@link StoragePort}.
 *
 * <p>
 * Layout under {@code oracle.storage.base-path}:
 * <ul>
 * <li>history/entries.jsonl - conversation entries
 * <li>notes/notes.json - long-term notes
 * <li>tasks/tasks.json - hierarchical tasks
 * <li>aegis/snapshots.jsonl - orientation snapshots
 * </ul>
 *
 * <p>
 * Every write is forced to disk before its future completes. Paths that
 * resolve outside the base directory are rejected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";

    private final OracleProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getBasePath()
                .replace("${user.home}", System.getProperty("user.home"));
        basePath = Paths.get(configured).toAbsolutePath().normalize();

        OracleProperties.DirectoriesProperties dirs = properties.getStorage().getDirectories();
        try {
            for (String dir : List.of(dirs.getHistory(), dirs.getNotes(), dirs.getTasks(), dirs.getAegis())) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("[Storage] Records stored under {}", basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create storage directories under " + basePath, e);
        }
    }

    @Override
    public CompletableFuture<String> readText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolve(directory, path);
            if (!Files.isRegularFile(file)) {
                return null;
            }
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendLine(String directory, String path, String line) {
        return CompletableFuture.runAsync(() -> {
            Path file = resolve(directory, path);
            String row = line.endsWith("\n") ? line : line + "\n";
            try {
                Files.createDirectories(file.getParent());
                writeSynced(file, row.getBytes(StandardCharsets.UTF_8), StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append to " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> writeAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolve(directory, path);
            Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
            try {
                Files.createDirectories(target.getParent());
                byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
                writeSynced(temp, bytes, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                        StandardOpenOption.TRUNCATE_EXISTING);
                if (Files.size(temp) != bytes.length) {
                    throw new IOException("Size mismatch after writing " + temp);
                }
                if (backup && Files.exists(target)) {
                    Files.copy(target, target.resolveSibling(target.getFileName() + BACKUP_SUFFIX),
                            StandardCopyOption.REPLACE_EXISTING);
                }
                replace(temp, target);
                log.debug("[Storage] Wrote {}/{} ({} bytes)", directory, path, bytes.length);
            } catch (IOException e) {
                discard(temp);
                throw new UncheckedIOException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private static void writeSynced(Path file, byte[] bytes, OpenOption... options) throws IOException {
        try (FileChannel channel = FileChannel.open(file, options)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic rename unsupported for {}, falling back to plain move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[Storage] Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }

    private Path resolve(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path escapes storage root: " + directory + "/" + path);
        }
        return resolved;
    }
}

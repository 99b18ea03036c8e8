package me.golemcore.oracle.adapter.outbound.workspace;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import me.golemcore.oracle.port.outbound.ProjectWorkspacePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Project workspace on the local filesystem, rooted at
 * {@code oracle.workspace.project-root}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalProjectWorkspaceAdapter implements ProjectWorkspacePort {

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("node_modules", "target", "build", "tmp", "log",
            "vendor");

    private final OracleProperties properties;

    private Path projectRoot;

    @PostConstruct
    public void init() {
        projectRoot = Paths.get(properties.getWorkspace().getProjectRoot()).toAbsolutePath().normalize();
        log.info("[Workspace] Project root: {}", projectRoot);
    }

    @Override
    public List<String> listProjectFiles() {
        int max = properties.getWorkspace().getMaxListedFiles();
        List<String> files = new ArrayList<>();
        if (!Files.isDirectory(projectRoot)) {
            return files;
        }
        try {
            Files.walkFileTree(projectRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(projectRoot)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String name = dir.getFileName().toString();
                    if (name.startsWith(".") || SKIPPED_DIRECTORIES.contains(name)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !file.getFileName().toString().startsWith(".")) {
                        files.add(projectRoot.relativize(file).toString().replace('\\', '/'));
                    }
                    return files.size() >= max ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("[Workspace] Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list project files under " + projectRoot, e);
        }
        files.sort(String::compareTo);
        return files;
    }

    @Override
    public boolean fileExists(String relativePath) {
        return resolve(relativePath).map(Files::exists).orElse(false);
    }

    @Override
    public Optional<String> readText(String relativePath) throws IOException {
        Optional<Path> path = resolve(relativePath);
        if (path.isEmpty() || !Files.isRegularFile(path.get())) {
            return Optional.empty();
        }
        return Optional.of(Files.readString(path.get(), StandardCharsets.UTF_8));
    }

    private Optional<Path> resolve(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return Optional.empty();
        }
        Path resolved = projectRoot.resolve(relativePath).normalize();
        if (!resolved.startsWith(projectRoot)) {
            log.warn("[Workspace] Path outside project root ignored: {}", relativePath);
            return Optional.empty();
        }
        return Optional.of(resolved);
    }
}

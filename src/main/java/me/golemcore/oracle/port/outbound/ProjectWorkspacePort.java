package me.golemcore.oracle.port.outbound;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the project the oracle works on.
 */
public interface ProjectWorkspacePort {

    /**
     * Project-relative paths of the project's files.
     */
    List<String> listProjectFiles();

    boolean fileExists(String relativePath);

    /**
     * Reads a project-relative text file. Empty when the file does not exist.
     */
    Optional<String> readText(String relativePath) throws IOException;
}

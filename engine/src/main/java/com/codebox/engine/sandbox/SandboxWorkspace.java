package com.codebox.engine.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Private scratch directory for exactly one execution.
 *
 * Holds the materialized source file and is the child's only writable
 * location. A fresh directory is created for every run, so concurrent runs
 * never share files, and {@link #close()} deletes it recursively whatever
 * the outcome of the run was.
 */
final class SandboxWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SandboxWorkspace.class);

    // Creation is retried once; a second failure is reported as internal_error.
    private static final int CREATE_ATTEMPTS = 2;

    private final Path directory;
    private final Path sourceFile;

    private SandboxWorkspace(Path directory, Path sourceFile) {
        this.directory  = directory;
        this.sourceFile = sourceFile;
    }

    /**
     * Create {@code <root>/exec-<random>/<fileName>} containing the source.
     *
     * @throws SandboxException (WORKSPACE) when both attempts fail
     */
    static SandboxWorkspace create(Path root, String fileName, String source) {
        IOException last = null;
        for (int attempt = 1; attempt <= CREATE_ATTEMPTS; attempt++) {
            Path dir = null;
            try {
                Files.createDirectories(root);
                dir = Files.createTempDirectory(root, "exec-");
                Path file = dir.resolve(fileName);
                Files.writeString(file, source, StandardCharsets.UTF_8);
                return new SandboxWorkspace(dir, file);
            } catch (IOException e) {
                last = e;
                log.warn("Workspace creation failed under {} (attempt {}/{}): {}",
                        root, attempt, CREATE_ATTEMPTS, e.getMessage());
                deleteQuietly(dir);
            }
        }
        throw new SandboxException(SandboxException.Kind.WORKSPACE,
                "could not create workspace under " + root, last);
    }

    Path directory()  { return directory; }
    Path sourceFile() { return sourceFile; }

    @Override
    public void close() {
        deleteQuietly(directory);
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) return;
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.error("Could not delete workspace {}, manual cleanup needed", dir, e);
        }
    }
}

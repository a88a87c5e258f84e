package com.codebox.engine.sandbox;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Fully resolved child process launch: argv, working directory and the
 * complete environment (the host environment is not inherited).
 */
record SandboxCommand(List<String> argv, Path workingDirectory, Map<String, String> environment) {

    SandboxCommand {
        argv        = List.copyOf(argv);
        environment = Map.copyOf(environment);
    }
}

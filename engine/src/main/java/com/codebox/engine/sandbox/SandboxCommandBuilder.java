package com.codebox.engine.sandbox;

import com.codebox.engine.config.CodeboxProperties;
import com.codebox.engine.model.Language;
import com.codebox.engine.policy.SecurityPolicy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns (language, policy, workspace) into the argv that launches the child.
 *
 * Layers, outermost first:
 * <pre>
 *   [isolation wrapper]  bwrap ... --   |   unshare --net --map-root-user --   |   (nothing)
 *   [limit shim]         /bin/sh -c 'ulimit -c 0; ulimit -u N; ulimit -v KB || fail; exec "$@"' codebox-sandbox
 *   [interpreter]        python3 -I -u main.py   |   jac run main.jac
 * </pre>
 * The shim is the hard memory cap (RLIMIT_AS is inherited by everything the
 * interpreter forks). The environment is built from scratch.
 */
final class SandboxCommandBuilder {

    /** Exit status the shim uses when the memory limit cannot be applied. */
    static final int    SHIM_FAILURE_EXIT = 125;
    static final String SHIM_FAILURE_MARK = "codebox-sandbox: cannot apply memory limit";

    // Where the workspace is mounted inside a bubblewrap sandbox.
    static final String SANDBOX_MOUNT = "/sandbox";

    // Inherited by every process of the run; identifies orphans after the root exits.
    static final String MARKER_VARIABLE = "CODEBOX_SANDBOX_ID";

    private static final String SHIM_NAME = "codebox-sandbox";
    private static final String SAFE_PATH = "/usr/local/bin:/usr/bin:/bin";

    private final CodeboxProperties.Sandbox settings;

    SandboxCommandBuilder(CodeboxProperties.Sandbox settings) {
        this.settings = settings;
    }

    SandboxCommand build(Language language, SecurityPolicy policy, SandboxWorkspace workspace) {
        CodeboxProperties.Interpreter interpreter = settings.interpreterFor(language);
        boolean bubblewrap = settings.getIsolation() == IsolationMode.BUBBLEWRAP;

        String home = bubblewrap ? SANDBOX_MOUNT : workspace.directory().toString();
        String script = bubblewrap
                ? SANDBOX_MOUNT + "/" + workspace.sourceFile().getFileName()
                : workspace.sourceFile().toString();

        List<String> argv = new ArrayList<>(isolationPrefix(policy, workspace));
        argv.addAll(limitShim(policy));
        argv.addAll(interpreter.getCommand());
        argv.add(script);

        Map<String, String> env = environment(home);
        env.put(MARKER_VARIABLE, workspace.directory().getFileName().toString());
        return new SandboxCommand(argv, workspace.directory(), env);
    }

    // ------------------------------------------------------------------
    // Layers
    // ------------------------------------------------------------------

    private List<String> isolationPrefix(SecurityPolicy policy, SandboxWorkspace workspace) {
        List<String> prefix = new ArrayList<>();
        switch (settings.getIsolation()) {
            case BUBBLEWRAP -> {
                prefix.add(settings.getBubblewrapPath());
                prefix.add("--die-with-parent");
                prefix.add("--new-session");
                prefix.add("--unshare-all");
                if (policy.networkAllowed()) prefix.add("--share-net");
                for (String path : settings.getReadOnlyPaths()) {
                    if (Files.exists(Path.of(path))) {
                        prefix.addAll(List.of("--ro-bind", path, path));
                    }
                }
                prefix.addAll(List.of(
                        "--proc", "/proc",
                        "--dev", "/dev",
                        "--tmpfs", "/tmp",
                        "--bind", workspace.directory().toString(), SANDBOX_MOUNT,
                        "--chdir", SANDBOX_MOUNT,
                        "--"));
            }
            case NAMESPACE -> {
                if (!policy.networkAllowed()) {
                    prefix.addAll(List.of(settings.getUnsharePath(), "--net", "--map-root-user", "--"));
                }
            }
            case NONE -> { }
        }
        return prefix;
    }

    private List<String> limitShim(SecurityPolicy policy) {
        long kib = Math.max(1, policy.maxMemoryBytes() / 1024);
        String script = "ulimit -c 0 2>/dev/null; "
                + "ulimit -u " + settings.getMaxProcesses() + " 2>/dev/null; "
                + "ulimit -v " + kib + " || { echo '" + SHIM_FAILURE_MARK + "' >&2; exit " + SHIM_FAILURE_EXIT + "; }; "
                + "exec \"$@\"";
        return List.of(settings.getShellPath(), "-c", script, SHIM_NAME);
    }

    private static Map<String, String> environment(String home) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("PATH", SAFE_PATH);
        env.put("HOME", home);
        env.put("TMPDIR", home);
        env.put("LANG", "C.UTF-8");
        env.put("PYTHONDONTWRITEBYTECODE", "1");
        env.put("PYTHONIOENCODING", "utf-8");
        return env;
    }
}

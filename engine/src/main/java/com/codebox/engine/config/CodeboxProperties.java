package com.codebox.engine.config;

import com.codebox.engine.model.Language;
import com.codebox.engine.policy.SecurityPolicy;
import com.codebox.engine.sandbox.IsolationMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All engine settings, bound from the {@code codebox.*} namespace of
 * application.yml (or the matching CODEBOX_* environment variables).
 */
@Component
@ConfigurationProperties(prefix = "codebox")
public class CodeboxProperties {

    private Sandbox sandbox = new Sandbox();
    private Pool    pool    = new Pool();
    private Policy  policy  = new Policy();

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }
    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }
    public Policy getPolicy() { return policy; }
    public void setPolicy(Policy policy) { this.policy = policy; }

    // ------------------------------------------------------------------
    // codebox.sandbox.*
    // ------------------------------------------------------------------

    public static class Sandbox {
        /** Parent directory for per-execution workspaces. */
        private String workRoot = System.getProperty("java.io.tmpdir") + "/codebox-work";
        private IsolationMode isolation = IsolationMode.BUBBLEWRAP;
        /** Time between SIGTERM and SIGKILL when a process tree is torn down. */
        private long killGraceMillis = 500;
        /** Resident-memory sampling interval of the memory watchdog. */
        private long memorySampleMillis = 50;
        /** RLIMIT_NPROC applied inside the sandbox (soft: ignored where the host refuses it). */
        private int maxProcesses = 64;
        private String shellPath = "/bin/sh";
        private String bubblewrapPath = "bwrap";
        private String unsharePath = "unshare";
        /** Host paths bound read-only into the bubblewrap sandbox (missing ones are skipped). */
        private List<String> readOnlyPaths = new ArrayList<>(List.of(
                "/usr", "/bin", "/lib", "/lib64", "/sbin", "/etc/alternatives", "/etc/ld.so.cache"));
        private Map<Language, Interpreter> interpreters = defaultInterpreters();

        public String getWorkRoot() { return workRoot; }
        public void setWorkRoot(String workRoot) { this.workRoot = workRoot; }
        public IsolationMode getIsolation() { return isolation; }
        public void setIsolation(IsolationMode isolation) { this.isolation = isolation; }
        public long getKillGraceMillis() { return killGraceMillis; }
        public void setKillGraceMillis(long killGraceMillis) { this.killGraceMillis = killGraceMillis; }
        public long getMemorySampleMillis() { return memorySampleMillis; }
        public void setMemorySampleMillis(long memorySampleMillis) { this.memorySampleMillis = memorySampleMillis; }
        public int getMaxProcesses() { return maxProcesses; }
        public void setMaxProcesses(int maxProcesses) { this.maxProcesses = maxProcesses; }
        public String getShellPath() { return shellPath; }
        public void setShellPath(String shellPath) { this.shellPath = shellPath; }
        public String getBubblewrapPath() { return bubblewrapPath; }
        public void setBubblewrapPath(String bubblewrapPath) { this.bubblewrapPath = bubblewrapPath; }
        public String getUnsharePath() { return unsharePath; }
        public void setUnsharePath(String unsharePath) { this.unsharePath = unsharePath; }
        public List<String> getReadOnlyPaths() { return readOnlyPaths; }
        public void setReadOnlyPaths(List<String> readOnlyPaths) { this.readOnlyPaths = readOnlyPaths; }
        public Map<Language, Interpreter> getInterpreters() { return interpreters; }
        public void setInterpreters(Map<Language, Interpreter> interpreters) { this.interpreters = interpreters; }

        public Interpreter interpreterFor(Language language) {
            Interpreter interpreter = interpreters.get(language);
            if (interpreter == null) {
                throw new IllegalStateException("No interpreter configured for " + language.wireName());
            }
            return interpreter;
        }

        private static Map<Language, Interpreter> defaultInterpreters() {
            Map<Language, Interpreter> map = new EnumMap<>(Language.class);
            map.put(Language.GENERAL_PURPOSE, new Interpreter(List.of("python3", "-I", "-u"), "main.py"));
            map.put(Language.DSL,             new Interpreter(List.of("jac", "run"), "main.jac"));
            return map;
        }
    }

    /**
     * Interpreter launch line: {@code command... <workspace>/<fileName>}.
     */
    public static class Interpreter {
        private List<String> command = new ArrayList<>();
        private String fileName;

        public Interpreter() {}

        public Interpreter(List<String> command, String fileName) {
            this.command  = new ArrayList<>(command);
            this.fileName = fileName;
        }

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getFileName() { return fileName; }
        public void setFileName(String fileName) { this.fileName = fileName; }
    }

    // ------------------------------------------------------------------
    // codebox.pool.*
    // ------------------------------------------------------------------

    public static class Pool {
        /** Concurrent sandboxed processes. */
        private int workers = 4;
        /** Submissions allowed to wait for a worker before capacity_exceeded. */
        private int queueCapacity = 16;

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    // ------------------------------------------------------------------
    // codebox.policy.*: startup defaults for the Policy Store
    // ------------------------------------------------------------------

    public static class Policy {
        private int maxWallClockSeconds = 30;
        private long maxMemoryBytes = 128L * 1024 * 1024;
        private int maxOutputBytes = 1024;
        private int maxSourceBytes = 100 * 1024;
        private Set<String> forbiddenImports = new LinkedHashSet<>(
                List.of("os", "sys", "subprocess", "importlib", "shutil", "socket", "ctypes"));
        private Set<String> forbiddenCalls = new LinkedHashSet<>(
                List.of("eval", "exec", "open", "__import__", "compile", "globals", "locals"));
        private boolean networkAllowed = false;
        private Set<Language> languagesEnabled = EnumSet.allOf(Language.class);

        public int getMaxWallClockSeconds() { return maxWallClockSeconds; }
        public void setMaxWallClockSeconds(int v) { this.maxWallClockSeconds = v; }
        public long getMaxMemoryBytes() { return maxMemoryBytes; }
        public void setMaxMemoryBytes(long v) { this.maxMemoryBytes = v; }
        public int getMaxOutputBytes() { return maxOutputBytes; }
        public void setMaxOutputBytes(int v) { this.maxOutputBytes = v; }
        public int getMaxSourceBytes() { return maxSourceBytes; }
        public void setMaxSourceBytes(int v) { this.maxSourceBytes = v; }
        public Set<String> getForbiddenImports() { return forbiddenImports; }
        public void setForbiddenImports(Set<String> v) { this.forbiddenImports = v; }
        public Set<String> getForbiddenCalls() { return forbiddenCalls; }
        public void setForbiddenCalls(Set<String> v) { this.forbiddenCalls = v; }
        public boolean isNetworkAllowed() { return networkAllowed; }
        public void setNetworkAllowed(boolean v) { this.networkAllowed = v; }
        public Set<Language> getLanguagesEnabled() { return languagesEnabled; }
        public void setLanguagesEnabled(Set<Language> v) { this.languagesEnabled = v; }

        public SecurityPolicy toSecurityPolicy() {
            return new SecurityPolicy(maxWallClockSeconds, maxMemoryBytes, maxOutputBytes,
                    maxSourceBytes, forbiddenImports, forbiddenCalls, networkAllowed, languagesEnabled);
        }
    }
}

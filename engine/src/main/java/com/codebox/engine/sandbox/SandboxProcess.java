package com.codebox.engine.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Ownership of the one child process spawned for an execution, and of
 * everything it forks.
 *
 * Descendants are remembered as they are observed (by the memory watchdog
 * and at teardown). Once the root has exited its orphans are no longer its
 * descendants, so they are also located through the per-run marker variable
 * every member inherits ({@link SandboxCommandBuilder#MARKER_VARIABLE}).
 * {@link #close()} kills whatever is left and
 * reaps the root; it is the guarantee that no process outlives the call.
 */
final class SandboxProcess implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SandboxProcess.class);

    private static final int  KILL_ROUNDS       = 3;
    private static final long KILL_ROUND_MILLIS = 200;
    private static final long REAP_MILLIS       = 1000;

    private final Process process;
    private final long startNanos;
    private final String marker;
    private final Set<ProcessHandle> seen = ConcurrentHashMap.newKeySet();

    private SandboxProcess(Process process, long startNanos, String marker) {
        this.process    = process;
        this.startNanos = startNanos;
        this.marker     = marker;
    }

    /**
     * @throws SandboxException (SPAWN) if the OS refuses to start the process
     */
    static SandboxProcess start(SandboxCommand command) {
        ProcessBuilder pb = new ProcessBuilder(command.argv())
                .directory(command.workingDirectory().toFile());
        pb.environment().clear();
        pb.environment().putAll(command.environment());

        long start = System.nanoTime();
        try {
            String markerValue = command.environment().get(SandboxCommandBuilder.MARKER_VARIABLE);
            String marker = markerValue == null ? null : SandboxCommandBuilder.MARKER_VARIABLE + "=" + markerValue;
            return new SandboxProcess(pb.start(), start, marker);
        } catch (IOException e) {
            throw new SandboxException(SandboxException.Kind.SPAWN,
                    "could not start " + command.argv().get(0), e);
        }
    }

    Process process()  { return process; }
    long    pid()      { return process.pid(); }
    long    startNanos() { return startNanos; }

    long elapsedMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /** Root plus every known descendant that is still running. */
    List<ProcessHandle> liveTree() {
        ProcessHandle root = process.toHandle();
        if (ProcFs.running(root)) {
            root.descendants().forEach(seen::add);
        } else if (marker != null) {
            for (long pid : ProcFs.pidsWithEnvironment(marker)) {
                ProcessHandle.of(pid).ifPresent(seen::add);
            }
        }
        List<ProcessHandle> live = new ArrayList<>();
        if (ProcFs.running(root)) live.add(root);
        for (ProcessHandle h : seen) {
            if (ProcFs.running(h)) live.add(h);
        }
        return live;
    }

    /**
     * SIGTERM to the whole tree, wait up to {@code grace}, then SIGKILL
     * whatever is still running. Returns once no member is running or the
     * kill rounds are exhausted.
     */
    void terminateTree(Duration grace) {
        List<ProcessHandle> members = liveTree();
        if (members.isEmpty()) return;

        members.forEach(ProcessHandle::destroy);
        if (awaitExit(grace.toMillis())) return;

        for (int round = 0; round < KILL_ROUNDS; round++) {
            List<ProcessHandle> alive = liveTree();
            if (alive.isEmpty()) return;
            alive.forEach(ProcessHandle::destroyForcibly);
            if (awaitExit(KILL_ROUND_MILLIS)) return;
        }
        List<ProcessHandle> survivors = liveTree();
        if (!survivors.isEmpty()) {
            log.error("Process tree of pid {} still has {} member(s) after SIGKILL: {}",
                    pid(), survivors.size(), survivors.stream().map(ProcessHandle::pid).toList());
        }
    }

    private boolean awaitExit(long millis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        while (true) {
            if (liveTree().isEmpty()) return true;
            if (System.nanoTime() >= deadline) return false;
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return liveTree().isEmpty();
            }
        }
    }

    @Override
    public void close() {
        terminateTree(Duration.ZERO);
        try {
            if (!process.waitFor(REAP_MILLIS, TimeUnit.MILLISECONDS)) {
                log.error("Sandbox root pid {} could not be reaped", pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        closeStream(process.getOutputStream());
        closeStream(process.getInputStream());
        closeStream(process.getErrorStream());
    }

    private static void closeStream(java.io.Closeable stream) {
        try {
            stream.close();
        } catch (IOException e) {
            log.debug("Ignoring error while closing sandbox pipe: {}", e.getMessage());
        }
    }
}

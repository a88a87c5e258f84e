package com.codebox.engine.sandbox;

import com.codebox.engine.config.CodeboxProperties;
import com.codebox.engine.model.ExecutionRequest;
import com.codebox.engine.model.ExecutionResult;
import com.codebox.engine.model.ExecutionStatus;
import com.codebox.engine.policy.SecurityPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Sandbox executor backed by one OS child process per request.
 *
 * Per run:
 *   1. materialize the source in a fresh {@link SandboxWorkspace}
 *   2. spawn the isolated, memory-capped interpreter ({@link SandboxCommandBuilder})
 *   3. drain stdout/stderr through {@link BoundedOutputCollector}s, sample memory
 *      with a {@link MemoryWatchdog}
 *   4. wait for whichever comes first: normal exit, the wall-clock deadline,
 *      an output or memory overflow, or cancellation. Anything but a normal
 *      exit tears the whole process tree down (SIGTERM, grace, SIGKILL)
 *   5. classify, then close the process and delete the workspace
 *
 * Step 5 runs in try-with-resources, so teardown happens on every path.
 */
@Component
public class ProcessSandboxExecutor implements SandboxExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSandboxExecutor.class);

    // How long to wait for the output pipes to reach EOF once the tree is gone.
    private static final long DRAIN_MILLIS = 1000;

    // Last line of an uncaught Python MemoryError traceback.
    private static final Pattern PYTHON_MEMORY_ERROR = Pattern.compile("^MemoryError\\b");

    // libc / C++ allocation failures; only trusted when the tree was close to the cap.
    private static final Pattern ALLOCATION_FAILURE = Pattern.compile(
            "Cannot allocate memory|std::bad_alloc");

    private static final String INTERNAL_REASON = "the sandbox could not run this submission";

    private final CodeboxProperties.Sandbox settings;
    private final SandboxCommandBuilder commands;
    private final ExecutorService ioThreads;
    private final ScheduledExecutorService samplers;
    private final AtomicLong spawnCount = new AtomicLong();
    private final Counter spawnCounter;

    public ProcessSandboxExecutor(CodeboxProperties properties, MeterRegistry meterRegistry) {
        this.settings     = properties.getSandbox();
        this.commands     = new SandboxCommandBuilder(settings);
        this.ioThreads    = Executors.newCachedThreadPool(daemonThreads("sandbox-io"));
        this.samplers     = Executors.newScheduledThreadPool(1, daemonThreads("sandbox-mem"));
        this.spawnCounter = meterRegistry.counter("codebox.sandbox.spawns");

        if (settings.getIsolation() == IsolationMode.NONE) {
            log.warn("Sandbox isolation is NONE: submissions run as plain child processes "
                    + "with host filesystem and network access. Do not use in production.");
        } else {
            log.info("Sandbox isolation mode {}, work root {}", settings.getIsolation(), settings.getWorkRoot());
        }
    }

    /** Number of child processes spawned since startup. */
    public long spawnCount() {
        return spawnCount.get();
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request, SecurityPolicy policy, Cancellation cancellation) {
        Instant createdAt = Instant.now();
        String fileName = settings.interpreterFor(request.language()).getFileName();

        try (SandboxWorkspace workspace = SandboxWorkspace.create(
                Path.of(settings.getWorkRoot()), fileName, request.sourceText())) {

            SandboxCommand command = commands.build(request.language(), policy, workspace);
            log.debug("Launching {}", command.argv());

            try (SandboxProcess process = SandboxProcess.start(command)) {
                spawnCount.incrementAndGet();
                spawnCounter.increment();
                return supervise(request, policy, cancellation, process, createdAt);
            }
        } catch (SandboxException e) {
            log.error("Sandbox failure for execution {} ({})", request.executionId(), e.getKind(), e);
            return ExecutionResult.internalError(request.executionId(), INTERNAL_REASON, 0L);
        } catch (RuntimeException e) {
            log.error("Unexpected sandbox error for execution {}", request.executionId(), e);
            return ExecutionResult.internalError(request.executionId(), INTERNAL_REASON, 0L);
        }
    }

    // ------------------------------------------------------------------
    // Supervision of a running child
    // ------------------------------------------------------------------

    private ExecutionResult supervise(ExecutionRequest request, SecurityPolicy policy,
                                      Cancellation cancellation, SandboxProcess process,
                                      Instant createdAt) {
        CompletableFuture<TerminationCause> stop = new CompletableFuture<>();

        BoundedOutputCollector stdout = new BoundedOutputCollector(
                process.process().getInputStream(), policy.maxOutputBytes(),
                () -> stop.complete(TerminationCause.OUTPUT_LIMIT));
        BoundedOutputCollector stderr = new BoundedOutputCollector(
                process.process().getErrorStream(), policy.maxOutputBytes(),
                () -> stop.complete(TerminationCause.OUTPUT_LIMIT));
        Future<?> stdoutTask = ioThreads.submit(stdout);
        Future<?> stderrTask = ioThreads.submit(stderr);
        ioThreads.submit(() -> feedStdin(process, request.stdin()));

        MemoryWatchdog watchdog = new MemoryWatchdog(process, policy.maxMemoryBytes(),
                () -> stop.complete(TerminationCause.MEMORY_LIMIT));
        ScheduledFuture<?> sampling = samplers.scheduleAtFixedRate(
                watchdog, 0, settings.getMemorySampleMillis(), TimeUnit.MILLISECONDS);

        cancellation.onCancel(() -> stop.complete(TerminationCause.CANCELLED));

        long deadlineNanos = process.startNanos() + TimeUnit.SECONDS.toNanos(policy.maxWallClockSeconds());
        try {
            waitForExitOrStop(process, stop, deadlineNanos);

            TerminationCause cause = stop.getNow(null);
            if (cause != null) {
                log.info("Execution {} stopped by {} after {} ms",
                        request.executionId(), cause, process.elapsedMillis());
            }
            // Also kills background children left behind by a normal exit.
            process.terminateTree(Duration.ofMillis(settings.getKillGraceMillis()));
            long wallClockMs = process.elapsedMillis();

            sampling.cancel(false);
            awaitDrain(stdoutTask);
            awaitDrain(stderrTask);

            Integer exitCode = exitCodeOf(process);
            String err = stderr.text();
            if (exitCode != null && exitCode == SandboxCommandBuilder.SHIM_FAILURE_EXIT
                    && err.startsWith(SandboxCommandBuilder.SHIM_FAILURE_MARK)) {
                log.error("Memory limit shim failed for execution {}: {}", request.executionId(), err.strip());
                return ExecutionResult.internalError(request.executionId(), INTERNAL_REASON, wallClockMs);
            }

            ExecutionStatus status = classify(cause, exitCode, err,
                    watchdog.peakBytes(), policy.maxMemoryBytes());
            return new ExecutionResult(
                    request.executionId(),
                    status,
                    reasonFor(status, policy),
                    stdout.text(), stdout.truncated(),
                    err, stderr.truncated(),
                    exitCode,
                    wallClockMs,
                    watchdog.peakBytes(),
                    createdAt);
        } finally {
            sampling.cancel(false);
        }
    }

    /** Blocks until the root exits, a stop signal fires, or the deadline passes. */
    private static void waitForExitOrStop(SandboxProcess process,
                                          CompletableFuture<TerminationCause> stop,
                                          long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        try {
            CompletableFuture.anyOf(process.process().onExit(), stop)
                    .get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            stop.complete(TerminationCause.TIMEOUT);
        } catch (InterruptedException e) {
            // Worker shutdown: treat like a cancellation so the tree still dies.
            Thread.currentThread().interrupt();
            stop.complete(TerminationCause.CANCELLED);
        } catch (ExecutionException e) {
            throw new SandboxException(SandboxException.Kind.IO, "waiting for sandbox process failed", e);
        }
    }

    /**
     * Maps how the run ended to a status. A termination cause always wins;
     * otherwise exit 0 is success and a failed exit is runtime_error unless
     * the host pushed the program into an allocation failure: an uncaught
     * MemoryError ending the traceback, or a libc/C++ allocation failure
     * while the sampled peak was at least half the memory cap.
     */
    static ExecutionStatus classify(TerminationCause cause, Integer exitCode, String stderr,
                                    Long peakBytes, long maxMemoryBytes) {
        if (cause != null) {
            return switch (cause) {
                case CANCELLED    -> ExecutionStatus.CANCELLED;
                case TIMEOUT      -> ExecutionStatus.TIMEOUT;
                case MEMORY_LIMIT -> ExecutionStatus.MEMORY_EXCEEDED;
                case OUTPUT_LIMIT -> ExecutionStatus.OUTPUT_TRUNCATED;
            };
        }
        if (exitCode != null && exitCode == 0) return ExecutionStatus.SUCCESS;
        if (PYTHON_MEMORY_ERROR.matcher(lastLine(stderr)).find()) return ExecutionStatus.MEMORY_EXCEEDED;
        boolean nearCap = peakBytes != null && peakBytes >= maxMemoryBytes / 2;
        if (nearCap && ALLOCATION_FAILURE.matcher(stderr).find()) return ExecutionStatus.MEMORY_EXCEEDED;
        return ExecutionStatus.RUNTIME_ERROR;
    }

    private static String lastLine(String text) {
        String trimmed = text.stripTrailing();
        return trimmed.substring(trimmed.lastIndexOf('\n') + 1);
    }

    private static String reasonFor(ExecutionStatus status, SecurityPolicy policy) {
        return switch (status) {
            case TIMEOUT          -> "exceeded wall clock limit of " + policy.maxWallClockSeconds() + " s";
            case MEMORY_EXCEEDED  -> "exceeded memory limit of " + policy.maxMemoryBytes() + " bytes";
            case OUTPUT_TRUNCATED -> "output exceeded " + policy.maxOutputBytes() + " bytes";
            case CANCELLED        -> "cancelled by caller";
            case RUNTIME_ERROR    -> "program exited with a non-zero status";
            default               -> null;
        };
    }

    private static Integer exitCodeOf(SandboxProcess process) {
        try {
            return process.process().waitFor(DRAIN_MILLIS, TimeUnit.MILLISECONDS)
                    ? process.process().exitValue()
                    : null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private static void awaitDrain(Future<?> task) {
        try {
            task.get(DRAIN_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // A pipe held open by a process outside our tree; keep what was read.
            task.cancel(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Output collector failed: {}", e.getCause().getMessage());
        }
    }

    private static void feedStdin(SandboxProcess process, String stdin) {
        try (OutputStream in = process.process().getOutputStream()) {
            if (!stdin.isEmpty()) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            // The program exited (or was killed) without reading all of its input.
            log.debug("stdin not fully delivered to pid {}: {}", process.pid(), e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @PreDestroy
    void shutdown() {
        samplers.shutdownNow();
        ioThreads.shutdownNow();
    }
}

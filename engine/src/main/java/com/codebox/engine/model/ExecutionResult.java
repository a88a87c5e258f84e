package com.codebox.engine.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Result of one submission, serialized as a flat object.
 *
 * exitCode is null when no process ran (validator rejection, invalid request,
 * capacity rejection, internal error before spawn). peakMemoryBytes is null
 * when the host could not sample the process tree.
 */
public record ExecutionResult(
        UUID            executionId,
        ExecutionStatus status,
        String          reason,
        String          stdout,
        boolean         stdoutTruncated,
        String          stderr,
        boolean         stderrTruncated,
        Integer         exitCode,
        long            wallClockMs,
        Long            peakMemoryBytes,
        Instant         createdAt) {

    public ExecutionResult {
        if (stdout == null) stdout = "";
        if (stderr == null) stderr = "";
        if (createdAt == null) createdAt = Instant.now();
    }

    public boolean success() { return status == ExecutionStatus.SUCCESS; }

    // ------------------------------------------------------------------
    // Outcomes that never reach a sandboxed process
    // ------------------------------------------------------------------

    public static ExecutionResult rejected(UUID executionId, String reason) {
        return outcome(executionId, ExecutionStatus.REJECTED_BY_VALIDATOR, reason);
    }

    public static ExecutionResult internalError(UUID executionId, String reason, long wallClockMs) {
        return new ExecutionResult(executionId, ExecutionStatus.INTERNAL_ERROR, reason,
                "", false, "", false, null, wallClockMs, null, Instant.now());
    }

    /** Cancelled while still waiting for a worker; no process was started. */
    public static ExecutionResult cancelled(UUID executionId) {
        return outcome(executionId, ExecutionStatus.CANCELLED, "cancelled by caller");
    }

    public static ExecutionResult invalidRequest(String reason) {
        return outcome(null, ExecutionStatus.INVALID_REQUEST, reason);
    }

    public static ExecutionResult capacityExceeded(UUID executionId, String reason) {
        return outcome(executionId, ExecutionStatus.CAPACITY_EXCEEDED, reason);
    }

    private static ExecutionResult outcome(UUID executionId, ExecutionStatus status, String reason) {
        return new ExecutionResult(executionId, status, reason,
                "", false, "", false, null, 0L, null, Instant.now());
    }
}

package com.codebox.engine.api.dto;

import com.codebox.engine.model.ExecutionRecord;
import com.codebox.engine.model.ExecutionStatus;
import com.codebox.engine.model.Language;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger entry as returned by GET /executions and GET /executions/{id}.
 * sourceText is null when the source was too large to be stored inline.
 */
public record ExecutionRecordResponse(
        UUID            executionId,
        String          callerId,
        Language        language,
        UUID            templateRef,
        String          sourceText,
        String          sourceSha256,
        int             sourceBytes,
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

    public static ExecutionRecordResponse from(ExecutionRecord r) {
        return new ExecutionRecordResponse(
                r.getId(), r.getCallerId(), r.getLanguage(), r.getTemplateRef(),
                r.getSourceText(), r.getSourceSha256(), r.getSourceBytes(),
                r.getStatus(), r.getReason(),
                r.getStdout(), r.isStdoutTruncated(),
                r.getStderr(), r.isStderrTruncated(),
                r.getExitCode(), r.getWallClockMs(), r.getPeakMemoryBytes(),
                r.getCreatedAt());
    }
}

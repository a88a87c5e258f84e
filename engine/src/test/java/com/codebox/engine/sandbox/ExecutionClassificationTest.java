package com.codebox.engine.sandbox;

import com.codebox.engine.model.ExecutionStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionClassificationTest {

    private static final long CAP = 128L * 1024 * 1024;

    @Test
    void terminationCause_winsOverExitCode() {
        assertThat(classify(TerminationCause.CANCELLED, 0, "")).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(classify(TerminationCause.TIMEOUT, 137, "")).isEqualTo(ExecutionStatus.TIMEOUT);
        assertThat(classify(TerminationCause.MEMORY_LIMIT, 1, "")).isEqualTo(ExecutionStatus.MEMORY_EXCEEDED);
        assertThat(classify(TerminationCause.OUTPUT_LIMIT, 0, "")).isEqualTo(ExecutionStatus.OUTPUT_TRUNCATED);
    }

    @Test
    void exitCode_decidesWhenNothingStoppedTheRun() {
        assertThat(classify(null, 0, "")).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(classify(null, 2, "Traceback ... ZeroDivisionError")).isEqualTo(ExecutionStatus.RUNTIME_ERROR);
        assertThat(classify(null, null, "")).isEqualTo(ExecutionStatus.RUNTIME_ERROR);
    }

    @Test
    void uncaughtMemoryError_isMemoryExceeded() {
        assertThat(classify(null, 1, "Traceback (most recent call last):\n  File \"main.py\", line 1\nMemoryError\n"))
                .isEqualTo(ExecutionStatus.MEMORY_EXCEEDED);
    }

    @Test
    void runtimeErrorThatMentionsMemory_isRuntimeError() {
        assertThat(classify(null, 1, "Traceback (most recent call last):\nValueError: cache out of memory"))
                .isEqualTo(ExecutionStatus.RUNTIME_ERROR);
        assertThat(classify(null, 1, "MemoryError was handled\nKeyError: 'x'"))
                .isEqualTo(ExecutionStatus.RUNTIME_ERROR);
    }

    @Test
    void allocationFailure_countsOnlyNearTheCap() {
        assertThat(ProcessSandboxExecutor.classify(null, 1, "sh: Cannot allocate memory", CAP - 1024, CAP))
                .isEqualTo(ExecutionStatus.MEMORY_EXCEEDED);
        assertThat(ProcessSandboxExecutor.classify(null, 1, "sh: Cannot allocate memory", 4_000_000L, CAP))
                .isEqualTo(ExecutionStatus.RUNTIME_ERROR);
        assertThat(ProcessSandboxExecutor.classify(null, 1, "terminate called after throwing std::bad_alloc", null, CAP))
                .isEqualTo(ExecutionStatus.RUNTIME_ERROR);
    }

    @Test
    void successWithAllocationTextOnStderr_isStillSuccess() {
        assertThat(classify(null, 0, "handled MemoryError")).isEqualTo(ExecutionStatus.SUCCESS);
    }

    private static ExecutionStatus classify(TerminationCause cause, Integer exitCode, String stderr) {
        return ProcessSandboxExecutor.classify(cause, exitCode, stderr, null, CAP);
    }
}

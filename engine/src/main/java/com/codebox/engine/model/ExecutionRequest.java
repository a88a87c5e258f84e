package com.codebox.engine.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * One submission, as built by the orchestrator from caller input.
 * Never mutated after construction.
 *
 * @param executionId  Identity of this run; the caller may choose it up front so
 *                     it can cancel a tracked run while it is still in flight.
 * @param sourceText   Code to run (non-blank).
 * @param language     Interpreter to use.
 * @param mode         QUICK or TRACKED.
 * @param callerId     Opaque caller identity; required for TRACKED.
 * @param templateRef  Template the source came from, if any.
 * @param stdin        Text fed to the program's standard input (never null).
 */
public record ExecutionRequest(
        UUID          executionId,
        String        sourceText,
        Language      language,
        ExecutionMode mode,
        String        callerId,
        UUID          templateRef,
        String        stdin) {

    public ExecutionRequest {
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(sourceText,  "sourceText");
        Objects.requireNonNull(language,    "language");
        Objects.requireNonNull(mode,        "mode");
        if (stdin == null) stdin = "";
    }

    public boolean tracked() { return mode == ExecutionMode.TRACKED; }

    public int sourceBytes() { return sourceText.getBytes(StandardCharsets.UTF_8).length; }
}

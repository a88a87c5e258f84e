package com.codebox.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one submission.
 *
 * The first eight values describe what happened to the code itself.
 * INVALID_REQUEST and CAPACITY_EXCEEDED are submission-level outcomes:
 * the request never reached validation or a worker.
 */
public enum ExecutionStatus {
    SUCCESS,
    RUNTIME_ERROR,
    TIMEOUT,
    MEMORY_EXCEEDED,
    OUTPUT_TRUNCATED,
    REJECTED_BY_VALIDATOR,
    INTERNAL_ERROR,
    CANCELLED,
    INVALID_REQUEST,
    CAPACITY_EXCEEDED;

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}

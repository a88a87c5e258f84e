package com.codebox.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * QUICK   - ephemeral run, nothing is persisted.
 * TRACKED - request and result go to the execution ledger and the
 *           caller's session stats are updated.
 */
public enum ExecutionMode {
    QUICK,
    TRACKED;

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }

    public static Optional<ExecutionMode> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

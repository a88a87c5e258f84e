package com.codebox.engine.sandbox;

/** Why the executor, rather than the program itself, ended a run. */
enum TerminationCause {
    CANCELLED,
    TIMEOUT,
    MEMORY_LIMIT,
    OUTPUT_LIMIT
}

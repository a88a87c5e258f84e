package com.codebox.engine.sandbox;

/**
 * Infrastructure failure inside the sandbox executor (never the user code's
 * fault). The executor converts it into an internal_error result; it does
 * not reach callers.
 */
public class SandboxException extends RuntimeException {

    public enum Kind { WORKSPACE, SPAWN, IO }

    private final Kind kind;

    public SandboxException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public SandboxException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}

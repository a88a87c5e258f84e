package com.codebox.engine.validation;

/**
 * Verdict of the {@link StaticValidator}.
 *
 * @param accepted true when the request may be executed
 * @param reason   why it was rejected (null when accepted)
 * @param detail   the offending name for FORBIDDEN_CONSTRUCT, otherwise a short note
 */
public record ValidationOutcome(boolean accepted, Reason reason, String detail) {

    public enum Reason { SOURCE_TOO_LARGE, LANGUAGE_DISABLED, FORBIDDEN_CONSTRUCT }

    private static final ValidationOutcome ACCEPTED = new ValidationOutcome(true, null, null);

    public static ValidationOutcome ok() { return ACCEPTED; }

    public static ValidationOutcome rejected(Reason reason, String detail) {
        return new ValidationOutcome(false, reason, detail);
    }

    /**
     * Caller-facing reason string: {@code source_too_large},
     * {@code language_disabled} or {@code forbidden_construct(<name>)}.
     */
    public String reasonText() {
        if (accepted) return null;
        return switch (reason) {
            case SOURCE_TOO_LARGE    -> "source_too_large";
            case LANGUAGE_DISABLED   -> "language_disabled";
            case FORBIDDEN_CONSTRUCT -> "forbidden_construct(" + detail + ")";
        };
    }
}

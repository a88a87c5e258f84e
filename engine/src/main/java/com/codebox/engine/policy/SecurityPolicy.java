package com.codebox.engine.policy;

import com.codebox.engine.model.Language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resource ceilings and forbidden constructs governing every execution.
 *
 * Immutable: a reload builds a whole new instance and the Policy Store swaps
 * the reference, so a reader holding a snapshot never sees a mix of old and
 * new values. Construction never throws for bad values; call
 * {@link #violations()} before activating a policy.
 */
public record SecurityPolicy(
        int           maxWallClockSeconds,
        long          maxMemoryBytes,
        int           maxOutputBytes,
        int           maxSourceBytes,
        Set<String>   forbiddenImports,
        Set<String>   forbiddenCalls,
        boolean       networkAllowed,
        Set<Language> languagesEnabled) {

    public SecurityPolicy {
        forbiddenImports = forbiddenImports == null ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(forbiddenImports));
        forbiddenCalls   = forbiddenCalls == null ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(forbiddenCalls));
        EnumSet<Language> enabled = EnumSet.noneOf(Language.class);
        if (languagesEnabled != null) {
            languagesEnabled.stream().filter(l -> l != null).forEach(enabled::add);
        }
        languagesEnabled = Collections.unmodifiableSet(enabled);
    }

    public static SecurityPolicy defaults() {
        return new SecurityPolicy(30, 128L * 1024 * 1024, 1024, 100 * 1024,
                Set.of("os", "sys", "subprocess", "importlib", "shutil", "socket", "ctypes"),
                Set.of("eval", "exec", "open", "__import__", "compile", "globals", "locals"),
                false,
                EnumSet.allOf(Language.class));
    }

    public boolean languageEnabled(Language language) {
        return languagesEnabled.contains(language);
    }

    /** Invariant check. Empty list means the policy may be activated. */
    public List<String> violations() {
        List<String> errors = new ArrayList<>();
        if (maxWallClockSeconds <= 0) errors.add("max_wall_clock_seconds must be > 0");
        if (maxMemoryBytes      <= 0) errors.add("max_memory_bytes must be > 0");
        if (maxOutputBytes      <= 0) errors.add("max_output_bytes must be > 0");
        if (maxSourceBytes      <= 0) errors.add("max_source_bytes must be > 0");
        if (languagesEnabled.isEmpty()) errors.add("languages_enabled must not be empty");
        if (forbiddenImports.stream().anyMatch(s -> s == null || s.isBlank())) {
            errors.add("forbidden_imports must not contain blank entries");
        }
        if (forbiddenCalls.stream().anyMatch(s -> s == null || s.isBlank())) {
            errors.add("forbidden_calls must not contain blank entries");
        }
        return errors;
    }
}

package com.codebox.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Source languages the engine can run.
 *
 * GENERAL_PURPOSE - Python, run by the configured python3 interpreter.
 * DSL             - Jac ("DSL-code"), run by the configured jac interpreter.
 *
 * On the wire the values are lowercase ("general_purpose", "dsl"); the
 * interpreter names "python" and "jac" are accepted as aliases.
 */
public enum Language {
    GENERAL_PURPOSE("general_purpose", "python"),
    DSL("dsl", "jac");

    private final String wireName;
    private final String alias;

    Language(String wireName, String alias) {
        this.wireName = wireName;
        this.alias    = alias;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public String alias() { return alias; }

    /** Lenient lookup used when parsing caller input. Empty for unknown values. */
    public static Optional<Language> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (Language l : values()) {
            if (l.wireName.equals(v) || l.alias.equals(v)) return Optional.of(l);
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Language fromWire(String value) {
        return parse(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown language: '" + value + "'"));
    }
}

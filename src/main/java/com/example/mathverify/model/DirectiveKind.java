package com.example.mathverify.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Keywords that may lead a CHECK block ({@code KEYWORD; key=val; ...}).
 */
public enum DirectiveKind {
    SYSTEM, DERIVATIVE, INTEGRAL, LIMIT, OPTIMIZE;

    /**
     * Classifies a CHECK by the token before its first {@code ;}, ignoring case.
     *
     * @param check raw CHECK content, may be null
     * @return the directive, or empty for legacy (bare expression) checks
     */
    public static Optional<DirectiveKind> classify(String check) {
        if (check == null || check.isBlank()) {
            return Optional.empty();
        }
        String head = check.strip().split(";", 2)[0].strip().toUpperCase(Locale.ROOT);
        for (DirectiveKind kind : values()) {
            if (kind.name().equals(head)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /** True when the CHECK text starts with {@code KEYWORD;} for this directive. */
    public boolean leads(String check) {
        return check != null && classify(check).filter(k -> k == this).isPresent();
    }
}

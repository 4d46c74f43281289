package com.example.mathverify.model;

/**
 * Closed set of domain verifiers. Declaration order is the dispatch priority:
 * in directive mode the first kind that accepts the directive wins.
 */
public enum VerifierKind {
    EQUATIONS_SYSTEM("algebra_equations"),
    CALCULUS("calculus"),
    LINEAR_ALGEBRA("linear_algebra"),
    COMPLEX_NUMBERS("complex_numbers"),
    SEQUENCES("sequences"),
    STATISTICS("stats"),
    OPTIMIZATION("optimization");

    private final String key;

    VerifierKind(String key) {
        this.key = key;
    }

    /** Short key used in report details and log lines. */
    public String key() {
        return key;
    }
}

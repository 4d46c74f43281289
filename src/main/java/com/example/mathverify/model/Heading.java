package com.example.mathverify.model;

/**
 * Section headings of a solution blob. The literal names are the wire format:
 * a heading line reads {@code EXERCICE:}, {@code SOLUTION:} and so on.
 */
public enum Heading {
    /** Exercise statement. */
    EXERCICE,
    SOLUTION,
    FINAL_ANSWER,
    CHECK
}

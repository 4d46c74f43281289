package com.example.mathverify.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Nature of the evidence a report is built on.
 */
public enum ReportKind {
    STRUCTURAL, SYMBOLIC, NUMERIC, MIXED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.example.mathverify.model;

/**
 * Atomic, named outcome of a single verification check.
 *
 * @param name    Dotted key identifying the check (e.g. {@code symbolic.derivative})
 * @param ok      Whether the check passed
 * @param message Human-readable explanation
 */
public record CheckItem(
        String name,
        boolean ok,
        String message
) {}

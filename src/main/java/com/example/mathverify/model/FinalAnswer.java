package com.example.mathverify.model;

import org.matheclipse.core.interfaces.IExpr;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed FINAL_ANSWER: a scalar expression, an ordered list of candidate values,
 * or a mapping from variable name to value.
 *
 * @param shape   which of the three forms was parsed
 * @param text    raw FINAL_ANSWER text
 * @param scalar  the expression (SCALAR only)
 * @param items   the candidates (LIST only)
 * @param entries the mapping in declaration order (MAPPING only)
 */
public record FinalAnswer(
        Shape shape,
        String text,
        IExpr scalar,
        List<IExpr> items,
        Map<String, IExpr> entries
) {

    public enum Shape {
        SCALAR, LIST, MAPPING
    }

    public static FinalAnswer scalar(String text, IExpr value) {
        return new FinalAnswer(Shape.SCALAR, text, value, List.of(), Map.of());
    }

    public static FinalAnswer list(String text, List<IExpr> values) {
        return new FinalAnswer(Shape.LIST, text, null, List.copyOf(values), Map.of());
    }

    public static FinalAnswer mapping(String text, Map<String, IExpr> values) {
        return new FinalAnswer(Shape.MAPPING, text, null, List.of(), values);
    }

    public boolean isMapping() {
        return shape == Shape.MAPPING;
    }

    /** Scalar and list answers as a list of candidate values; empty for mappings. */
    public List<IExpr> candidates() {
        return switch (shape) {
            case SCALAR -> List.of(scalar);
            case LIST -> items;
            case MAPPING -> List.of();
        };
    }

    /** First mapping entry whose key equals one of the names (case-sensitive first, then ignoring case). */
    public Optional<IExpr> entry(String... names) {
        for (String name : names) {
            IExpr value = entries.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        for (String name : names) {
            for (Map.Entry<String, IExpr> e : entries.entrySet()) {
                if (e.getKey().equalsIgnoreCase(name)) {
                    return Optional.of(e.getValue());
                }
            }
        }
        return Optional.empty();
    }
}

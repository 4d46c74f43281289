package com.example.mathverify.verifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * {@code KEYWORD; key1=val1; key2=val2} split into its head and parameters.
 * Keys are lower-cased, values trimmed; segments without {@code =} are ignored.
 *
 * @param head   upper-cased token before the first {@code ;}
 * @param params parameters in declaration order
 */
record DirectiveParameters(String head, Map<String, String> params) {

    static DirectiveParameters parse(String check) {
        if (check == null || check.isBlank()) {
            return new DirectiveParameters("", Map.of());
        }
        String[] parts = check.strip().split(";");
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 1; i < parts.length; i++) {
            int eq = parts[i].indexOf('=');
            if (eq > 0) {
                params.put(parts[i].substring(0, eq).strip().toLowerCase(Locale.ROOT),
                        parts[i].substring(eq + 1).strip());
            }
        }
        return new DirectiveParameters(parts[0].strip().toUpperCase(Locale.ROOT),
                Collections.unmodifiableMap(params));
    }

    String get(String key) {
        String value = params.get(key);
        return value == null || value.isEmpty() ? null : value;
    }

    String getOrDefault(String key, String fallback) {
        String value = get(key);
        return value != null ? value : fallback;
    }
}

package com.example.mathverify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Report produced by every verification stage.
 * <p>
 * {@code ok} is the conjunction of every item added so far: once a failing item
 * has been appended the report stays failed.
 */
public final class VerificationReport {

    private final ReportKind kind;
    private final String summary;
    private final List<CheckItem> items = new ArrayList<>();
    private final Map<String, Object> details = new LinkedHashMap<>();
    private boolean ok = true;

    public VerificationReport(ReportKind kind, String summary) {
        this.kind = kind;
        this.summary = summary;
    }

    /** Appends a check outcome; a failing outcome fails the whole report. */
    public VerificationReport add(String name, boolean passed, String message) {
        return add(new CheckItem(name, passed, message));
    }

    public VerificationReport add(CheckItem item) {
        items.add(item);
        if (!item.ok()) {
            ok = false;
        }
        return this;
    }

    public VerificationReport addAll(List<CheckItem> more) {
        more.forEach(this::add);
        return this;
    }

    public VerificationReport detail(String key, Object value) {
        details.put(key, value);
        return this;
    }

    @JsonProperty("ok")
    public boolean ok() {
        return ok;
    }

    @JsonProperty("kind")
    public ReportKind kind() {
        return kind;
    }

    @JsonProperty("summary")
    public String summary() {
        return summary;
    }

    @JsonProperty("items")
    public List<CheckItem> items() {
        return Collections.unmodifiableList(items);
    }

    @JsonProperty("details")
    public Map<String, Object> details() {
        return Collections.unmodifiableMap(details);
    }

    /** Looks up the first item with the given name. */
    public CheckItem item(String name) {
        return items.stream()
                .filter(i -> i.name().equals(name))
                .findFirst()
                .orElse(null);
    }

    @Override
    public String toString() {
        return "VerificationReport[ok=%s, kind=%s, summary=%s, items=%s]".formatted(ok, kind, summary, items);
    }
}

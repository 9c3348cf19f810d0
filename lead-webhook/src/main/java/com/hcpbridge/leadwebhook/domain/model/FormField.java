package com.hcpbridge.leadwebhook.domain.model;

import java.util.List;

/**
 * One submitted form field. Multi-select fields carry several values, single fields carry one.
 */
public record FormField(
        String name,
        List<String> values
) {
    public FormField {
        name = name == null ? "" : name.trim();
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static FormField of(String name, String value) {
        return new FormField(name, value == null ? List.of() : List.of(value));
    }

    public String value() {
        return String.join(", ", values);
    }

    public boolean isBlank() {
        return values.stream().allMatch(v -> v == null || v.isBlank());
    }
}

package com.hcpbridge.leadwebhook.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * An inbound form submission: the submitted fields in the order the widget sent them.
 */
public record FormSubmission(List<FormField> fields) {

    public FormSubmission {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public Optional<FormField> field(FormFieldKey key) {
        return fields.stream()
                .filter(f -> !f.isBlank())
                .filter(f -> FormFieldKey.classify(f.name()).filter(key::equals).isPresent())
                .findFirst();
    }

    /**
     * Trimmed value of the first non-blank field of the given kind.
     */
    public Optional<String> value(FormFieldKey key) {
        return field(key).map(FormField::value).map(String::trim).filter(v -> !v.isEmpty());
    }

    /**
     * All values of the first field of the given kind. A single comma-separated value is split into its parts.
     */
    public List<String> values(FormFieldKey key) {
        return field(key)
                .map(f -> f.values().size() == 1 ? List.of(f.values().get(0).split(",")) : f.values())
                .orElse(List.of())
                .stream()
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .toList();
    }
}

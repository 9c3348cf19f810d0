package com.hcpbridge.leadwebhook.domain.model;

import java.util.Locale;
import java.util.Set;

public enum MatchClassification {
    EXACT,
    PARTIAL,
    NONE;

    public static MatchClassification of(Set<MatchedField> matchedOn) {
        return switch (matchedOn.size()) {
            case 0 -> NONE;
            case 1 -> PARTIAL;
            default -> EXACT;
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
